package com.dirgen.orchestrator.fs;

import java.util.List;

/**
 * Result of {@link FilesystemGateway#list}: immediate children of a directory,
 * as paths relative to the sandbox root, each list sorted.
 */
public record DirectoryListing(List<String> files, List<String> directories) {}
