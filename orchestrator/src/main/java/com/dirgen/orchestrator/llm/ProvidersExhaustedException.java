package com.dirgen.orchestrator.llm;

/**
 * Every candidate provider failed for one ask().
 */
public class ProvidersExhaustedException extends RuntimeException {

    private final TaskClass taskClass;
    private final boolean   rateLimited;

    public ProvidersExhaustedException(TaskClass taskClass, boolean rateLimited, Throwable lastError) {
        super(message(taskClass, rateLimited, lastError), lastError);
        this.taskClass   = taskClass;
        this.rateLimited = rateLimited;
    }

    public TaskClass getTaskClass()  { return taskClass; }
    public boolean   isRateLimited() { return rateLimited; }

    private static String message(TaskClass taskClass, boolean rateLimited, Throwable lastError) {
        StringBuilder sb = new StringBuilder("All LLM providers failed for task '")
                .append(taskClass.wireName()).append("'.");
        if (rateLimited) {
            sb.append(" Rate limiting was detected on at least one provider.");
        }
        sb.append(" Last error: ").append(lastError == null ? "no provider available" : lastError.getMessage());
        return sb.toString();
    }
}
