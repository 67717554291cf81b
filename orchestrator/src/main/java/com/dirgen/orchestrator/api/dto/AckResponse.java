package com.dirgen.orchestrator.api.dto;

/**
 * Reply to worker reports.
 * status is "ok" when the report was applied, "ignored" when the run had already finished.
 */
public record AckResponse(String status, String runId) {

    public static AckResponse of(boolean applied, String runId) {
        return new AckResponse(applied ? "ok" : "ignored", runId);
    }
}
