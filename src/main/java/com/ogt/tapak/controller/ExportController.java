package com.ogt.tapak.controller;

import com.ogt.tapak.export.ExportArchive;
import com.ogt.tapak.export.ExportSelector;
import com.ogt.tapak.export.ExportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.context.request.async.AsyncRequestTimeoutException;
import org.springframework.web.context.request.async.DeferredResult;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.util.concurrent.CompletionException;

@RestController
@RequestMapping("/download")
@RequiredArgsConstructor
@Slf4j
public class ExportController {

    static final MediaType APPLICATION_ZIP = MediaType.parseMediaType("application/zip");

    private final ExportService exportService;

    @GetMapping("/all")
    public DeferredResult<ResponseEntity<StreamingResponseBody>> downloadAll() {
        return export(ExportSelector.all());
    }

    @GetMapping("/id/{featureId}")
    public DeferredResult<ResponseEntity<StreamingResponseBody>> downloadById(@PathVariable long featureId) {
        return export(ExportSelector.id(featureId));
    }

    // GET /download/ids?ids=1,2,5
    @GetMapping("/ids")
    public DeferredResult<ResponseEntity<StreamingResponseBody>> downloadByIds(
            @RequestParam(value = "ids", required = false) String ids
    ) {
        // Se valida en el hilo de la petición: un formato inválido no llega al pool
        return export(ExportSelector.parseIds(ids));
    }

    private DeferredResult<ResponseEntity<StreamingResponseBody>> export(ExportSelector selector) {
        DeferredResult<ResponseEntity<StreamingResponseBody>> result = new DeferredResult<>();
        // Marca el resultado al vencer para que un ZIP que llegue tarde se libere en el acto
        result.onTimeout(() -> result.setErrorResult(new AsyncRequestTimeoutException()));
        exportService.exportAsync(selector).whenComplete((archive, error) -> {
            if (error != null) {
                result.setErrorResult(error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error);
                return;
            }
            ResponseEntity<StreamingResponseBody> response;
            try {
                response = toResponse(archive);
            } catch (RuntimeException e) {
                result.setErrorResult(e);
                return;
            }
            // Petición vencida o cliente desconectado: writeTo nunca va a correr
            if (!result.setResult(response)) {
                log.warn("⚠️ Export {} listo después de cerrar la petición, se libera el workspace", selector);
                archive.close();
            }
        });
        return result;
    }

    private ResponseEntity<StreamingResponseBody> toResponse(ExportArchive archive) {
        long size;
        try {
            size = archive.size();
        } catch (RuntimeException e) {
            archive.close();
            throw e;
        }
        return ResponseEntity.ok()
                .contentType(APPLICATION_ZIP)
                .contentLength(size)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(archive.getFileName()).build().toString())
                .body(archive);
    }
}
