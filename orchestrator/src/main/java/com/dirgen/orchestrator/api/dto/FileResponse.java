package com.dirgen.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Response body of the filesystem tool endpoints. Always HTTP 200; failures
 * carry {@code success=false} and an error message. Absent fields are omitted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FileResponse(
        boolean      success,
        String       message,
        String       content,
        List<String> files,
        List<String> directories,
        String       error
) {
    public static FileResponse written(String path) {
        return new FileResponse(true, "File written: " + path, null, null, null, null);
    }

    public static FileResponse read(String content) {
        return new FileResponse(true, null, content, null, null, null);
    }

    public static FileResponse listed(List<String> files, List<String> directories) {
        return new FileResponse(true, null, null, files, directories, null);
    }

    public static FileResponse failed(String error) {
        return new FileResponse(false, null, null, null, null, error);
    }
}
