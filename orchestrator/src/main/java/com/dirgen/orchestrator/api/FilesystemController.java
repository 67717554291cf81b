package com.dirgen.orchestrator.api;

import com.dirgen.orchestrator.api.dto.FileRequest;
import com.dirgen.orchestrator.api.dto.FileResponse;
import com.dirgen.orchestrator.fs.ArtifactNotFoundException;
import com.dirgen.orchestrator.fs.DirectoryListing;
import com.dirgen.orchestrator.fs.FilesystemGateway;
import com.dirgen.orchestrator.fs.SandboxViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;

import java.io.UncheckedIOException;
import java.util.function.Supplier;

/**
 * The filesystem tools workers use for every artifact they produce.
 *
 * POST /tools/filesystem/write  {path, content}
 * POST /tools/filesystem/read   {path}
 * POST /tools/filesystem/list   {path}
 *
 * Failures are answered with HTTP 200 and {success:false, error}: workers
 * treat a tool error as an observation, not a transport failure.
 */
@RestController
@RequestMapping("/tools/filesystem")
public class FilesystemController {

    private static final Logger log = LoggerFactory.getLogger(FilesystemController.class);

    private final FilesystemGateway gateway;

    public FilesystemController(FilesystemGateway gateway) {
        this.gateway = gateway;
    }

    @PostMapping("/write")
    public FileResponse write(@RequestBody FileRequest req) {
        return guarded("write", req.path(), () -> {
            gateway.write(req.path(), req.content());
            return FileResponse.written(req.path());
        });
    }

    @PostMapping("/read")
    public FileResponse read(@RequestBody FileRequest req) {
        return guarded("read", req.path(), () -> FileResponse.read(gateway.read(req.path())));
    }

    @PostMapping("/list")
    public FileResponse list(@RequestBody(required = false) FileRequest req) {
        String path = req == null ? null : req.path();
        return guarded("list", path, () -> {
            DirectoryListing listing = gateway.list(path);
            return FileResponse.listed(listing.files(), listing.directories());
        });
    }

    private FileResponse guarded(String op, String path, Supplier<FileResponse> action) {
        try {
            return action.get();
        } catch (SandboxViolationException e) {
            log.warn("Sandbox violation on {} '{}': {}", op, path, e.getMessage());
            return FileResponse.failed(e.getMessage());
        } catch (ArtifactNotFoundException | IllegalArgumentException e) {
            return FileResponse.failed(e.getMessage());
        } catch (UncheckedIOException e) {
            log.error("Filesystem {} '{}' failed", op, path, e);
            return FileResponse.failed(e.getMessage());
        }
    }
}
