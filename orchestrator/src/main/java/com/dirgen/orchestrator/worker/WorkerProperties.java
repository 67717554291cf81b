package com.dirgen.orchestrator.worker;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;
import java.util.Map;

/**
 * Worker command lines, keyed by stage wire name ({@code requirements},
 * {@code planner}, {@code validator}, {@code executor}).
 *
 * <pre>
 * dirgen:
 *   workers:
 *     orchestrator-url: http://localhost:8000
 *     stages:
 *       planner:
 *         command: [python, agents/planner/planner_agent.py]
 *         input-flag: --pcce-path
 * </pre>
 */
@ConfigurationProperties(prefix = "dirgen.workers")
public record WorkerProperties(
        @DefaultValue("http://localhost:8000") String orchestratorUrl,
        Map<String, StageCommand> stages
) {

    public WorkerProperties {
        stages = stages == null ? Map.of() : Map.copyOf(stages);
    }

    public record StageCommand(
            List<String> command,
            @DefaultValue("--input-path") String inputFlag
    ) {
        public StageCommand {
            command = command == null ? List.of() : List.copyOf(command);
        }
    }
}
