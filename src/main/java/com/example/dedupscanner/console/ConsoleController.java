package com.example.dedupscanner.console;

import com.example.dedupscanner.console.ConsoleMessages.DeleteRequest;
import com.example.dedupscanner.console.ConsoleMessages.MutationResponse;
import com.example.dedupscanner.console.ConsoleMessages.RenameRequest;
import com.example.dedupscanner.console.ConsoleMessages.ShutdownRequest;
import com.example.dedupscanner.metadata.DuplicateGroup;
import com.example.dedupscanner.metadata.ScanSession;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * HTTP surface of the management console.
 *
 * Endpoints:
 *   GET  /api/duplicates          groups of the served session
 *   GET  /api/scan-info           session record
 *   GET  /api/download?path=...   streams one tracked file
 *   POST /api/delete              {"filePath": ...}
 *   POST /api/rename              {"oldPath": ..., "newName": ...}
 *   POST /api/shutdown            {"deleteIndex": true|false}
 */
@RestController
@RequestMapping("/api")
public class ConsoleController {

    private final ManagementConsole console;
    private final ConsoleShutdown shutdown;

    public ConsoleController(ManagementConsole console, ConsoleShutdown shutdown) {
        this.console = console;
        this.shutdown = shutdown;
    }

    @GetMapping("/duplicates")
    public List<DuplicateGroup> duplicates() throws IOException {
        return console.duplicateGroups();
    }

    @GetMapping("/scan-info")
    public ScanSession scanInfo() throws IOException {
        return console.scanInfo();
    }

    @GetMapping("/download")
    public ResponseEntity<Resource> download(@RequestParam("path") String path) throws IOException {
        DownloadableFile file = console.download(path);
        String fileName = file.path().getFileName().toString();
        ContentDisposition disposition = (file.inline() ? ContentDisposition.inline() : ContentDisposition.attachment())
                .filename(fileName, StandardCharsets.UTF_8)
                .build();
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(file.mediaType()))
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .body(new FileSystemResource(file.path()));
    }

    @PostMapping("/delete")
    public MutationResponse delete(@RequestBody DeleteRequest request) throws IOException {
        console.delete(request.filePath());
        return new MutationResponse(true, "Successfully deleted " + request.filePath(), null);
    }

    @PostMapping("/rename")
    public MutationResponse rename(@RequestBody RenameRequest request) throws IOException {
        String newPath = console.rename(request.oldPath(), request.newName());
        return new MutationResponse(true, "Successfully renamed " + request.oldPath() + " to " + newPath, newPath);
    }

    @PostMapping("/shutdown")
    public MutationResponse shutdown(@RequestBody(required = false) ShutdownRequest request) {
        console.shutdown(request != null && request.deleteIndex());
        shutdown.requestShutdown();
        return new MutationResponse(true, "Server shutting down", null);
    }
}
