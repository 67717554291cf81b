package com.dirgen.orchestrator.fs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * The only file I/O surface workers may use to produce artifacts.
 *
 * Every path is relative to a fixed sandbox root and is checked twice:
 *   1. syntactically: no absolute prefix, no ".." segment
 *   2. after resolution: the real path (symlinks followed) must still be
 *      inside the real root
 *
 * For targets that don't exist yet (a write into a new directory) the check
 * resolves the nearest existing ancestor and re-appends the missing tail, so a
 * symlinked parent directory pointing outside the root is still caught.
 */
public class FilesystemGateway {

    private static final Logger log = LoggerFactory.getLogger(FilesystemGateway.class);

    private final Path root;

    public FilesystemGateway(Path root) {
        try {
            Files.createDirectories(root);
            this.root = root.toRealPath();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open sandbox root " + root, e);
        }
        log.info("Filesystem sandbox root: {}", this.root);
    }

    public Path root() {
        return root;
    }

    // ------------------------------------------------------------------
    // Operations
    // ------------------------------------------------------------------

    /** Write UTF-8 text, creating parent directories as needed. */
    public void write(String path, String content) {
        Path target = resolve(path);
        try {
            Files.createDirectories(target.getParent());
            // Re-check: createDirectories may have walked through a symlink created concurrently.
            ensureInsideRoot(path, target);
            Files.writeString(target, content == null ? "" : content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write " + path, e);
        }
        log.info("File written: {} ({} chars)", path, content == null ? 0 : content.length());
    }

    /** Read a UTF-8 text file. */
    public String read(String path) {
        Path target = resolve(path);
        if (!Files.exists(target)) {
            throw new ArtifactNotFoundException(path);
        }
        if (Files.isDirectory(target)) {
            throw new IllegalArgumentException("Path is a directory: " + path);
        }
        try {
            String content = Files.readString(target, StandardCharsets.UTF_8);
            log.info("File read: {} ({} chars)", path, content.length());
            return content;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + path, e);
        }
    }

    /** List the immediate children of a directory. A blank path means the root. */
    public DirectoryListing list(String path) {
        String relative = (path == null || path.isBlank()) ? "." : path;
        Path target = resolve(relative);
        if (!Files.exists(target)) {
            throw new ArtifactNotFoundException(relative);
        }
        if (!Files.isDirectory(target)) {
            throw new IllegalArgumentException("Path is not a directory: " + relative);
        }
        List<String> files = new ArrayList<>();
        List<String> dirs  = new ArrayList<>();
        try (Stream<Path> children = Files.list(target)) {
            children.forEach(child -> {
                String rel = root.relativize(child).toString().replace('\\', '/');
                if (Files.isDirectory(child)) {
                    dirs.add(rel);
                } else {
                    files.add(rel);
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Could not list " + relative, e);
        }
        files.sort(null);
        dirs.sort(null);
        log.info("Directory listed: {} ({} files, {} directories)", relative, files.size(), dirs.size());
        return new DirectoryListing(List.copyOf(files), List.copyOf(dirs));
    }

    public boolean exists(String path) {
        return Files.exists(resolve(path));
    }

    // ------------------------------------------------------------------
    // Path checks
    // ------------------------------------------------------------------

    /**
     * Validate a relative path and return its absolute location inside the root.
     *
     * @throws SandboxViolationException if the path escapes the sandbox
     */
    public Path resolve(String path) {
        if (path == null || path.isBlank()) {
            throw new SandboxViolationException("Path is required");
        }
        String normalized = path.replace('\\', '/');
        if (normalized.startsWith("/") || Paths.get(path).isAbsolute() || hasDrivePrefix(normalized)) {
            throw new SandboxViolationException("Absolute paths are not allowed: " + path);
        }
        for (String segment : normalized.split("/")) {
            if (segment.equals("..")) {
                throw new SandboxViolationException("Parent-directory segments are not allowed: " + path);
            }
        }
        Path target = root.resolve(normalized).normalize();
        ensureInsideRoot(path, target);
        return target;
    }

    private void ensureInsideRoot(String original, Path target) {
        Path real = realPathOf(target);
        if (!real.startsWith(root)) {
            throw new SandboxViolationException("Path resolves outside the sandbox: " + original);
        }
    }

    /** Real path of {@code p}, or of its nearest existing ancestor plus the missing tail. */
    private static Path realPathOf(Path p) {
        Path existing = p;
        Path tail     = null;
        while (existing != null && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            Path name = existing.getFileName();
            tail      = tail == null ? name : name.resolve(tail);
            existing  = existing.getParent();
        }
        if (existing == null) {
            return p.toAbsolutePath().normalize();
        }
        try {
            Path real = existing.toRealPath();
            return tail == null ? real : real.resolve(tail).normalize();
        } catch (IOException e) {
            // Dangling symlink: we can't tell where it points, so refuse it.
            throw new SandboxViolationException("Cannot resolve path: " + p);
        }
    }

    private static boolean hasDrivePrefix(String path) {
        return path.length() >= 2 && Character.isLetter(path.charAt(0)) && path.charAt(1) == ':';
    }
}
