package com.ogt.tapak.upload;

import com.ogt.tapak.archive.ArchiveExtractor;
import com.ogt.tapak.config.AsyncConfig;
import com.ogt.tapak.config.TapakProperties;
import com.ogt.tapak.conversion.GeometryConverter;
import com.ogt.tapak.dto.UploadResponseDTO;
import com.ogt.tapak.event.ImportEventPublisher;
import com.ogt.tapak.exception.BadInputException;
import com.ogt.tapak.exception.PayloadTooLargeException;
import com.ogt.tapak.job.TransferJob;
import com.ogt.tapak.job.TransferJobService;
import com.ogt.tapak.reconcile.StagingReconciler;
import com.ogt.tapak.workspace.Workspace;
import com.ogt.tapak.workspace.WorkspaceManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * Pipeline de carga: ZIP -> workspace -> staging (ogr2ogr) -> tabla destino -> staging vacío.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UploadService {

    private final TapakProperties properties;
    private final WorkspaceManager workspaceManager;
    private final ArchiveExtractor archiveExtractor;
    private final GeometryConverter geometryConverter;
    private final StagingReconciler reconciler;
    private final StagingRelationGuard stagingGuard;
    private final TransferJobService jobService;
    private final ImportEventPublisher eventPublisher;

    /**
     * Validaciones baratas que se hacen en el hilo de la petición, antes de leer el contenido.
     *
     * @return nombre original del archivo
     */
    public String validate(MultipartFile file) {
        String original = file.getOriginalFilename() != null ? file.getOriginalFilename() : "upload";
        if (!original.toLowerCase(Locale.ROOT).endsWith(".zip")) {
            throw new BadInputException("Upload a .zip file containing a shapefile (.shp .dbf .shx .prj)");
        }
        if (file.getSize() > properties.getMaxUploadBytes()) {
            throw new PayloadTooLargeException(file.getSize(), properties.getMaxUploadBytes());
        }
        return original;
    }

    @Async(AsyncConfig.UPLOAD_EXECUTOR)
    public CompletableFuture<UploadResponseDTO> uploadAsync(String fileName, byte[] content) {
        return CompletableFuture.completedFuture(upload(fileName, content));
    }

    public UploadResponseDTO upload(String fileName, byte[] content) {
        String target = properties.getTargetTable();
        String staging = properties.getStagingTable();
        TransferJob job = jobService.start(TransferJob.TYPE_UPLOAD, fileName, "target=" + target + ";staging=" + staging);

        try (Workspace workspace = workspaceManager.acquire("upload_")) {
            log.info("▶️ Carga recibida: {} ({} bytes) -> {}", fileName, content.length, workspace);
            archiveExtractor.extract(content, workspace.dir());

            int inserted = stagingGuard.exclusively(staging, () -> {
                geometryConverter.importToStaging(workspace.dir(), staging);
                return reconciler.mergeAndClear(target, staging);
            });

            jobService.complete(job, inserted);
            eventPublisher.publishImportCompleted(job, inserted);
            log.info("✅ Carga completada. Job ID: {} | filas insertadas: {}", job.getId(), inserted);
            return UploadResponseDTO.ok(inserted);
        } catch (RuntimeException e) {
            log.error("❌ Carga fallida. Job ID: {} | {}", job.getId(), e.getMessage());
            jobService.fail(job, e);
            throw e;
        }
    }
}
