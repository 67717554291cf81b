package com.dirgen.orchestrator.fs;

public class ArtifactNotFoundException extends RuntimeException {
    public ArtifactNotFoundException(String path) {
        super("Not found: " + path);
    }
}
