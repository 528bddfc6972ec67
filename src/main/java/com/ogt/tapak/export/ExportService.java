package com.ogt.tapak.export;

import com.ogt.tapak.archive.ArchiveCompressor;
import com.ogt.tapak.config.AsyncConfig;
import com.ogt.tapak.config.TapakProperties;
import com.ogt.tapak.conversion.GeometryConverter;
import com.ogt.tapak.exception.ConversionException;
import com.ogt.tapak.exception.ExportFailedException;
import com.ogt.tapak.exception.FeatureNotFoundException;
import com.ogt.tapak.exception.TapakException;
import com.ogt.tapak.job.TransferJob;
import com.ogt.tapak.job.TransferJobService;
import com.ogt.tapak.schema.RelationName;
import com.ogt.tapak.workspace.Workspace;
import com.ogt.tapak.workspace.WorkspaceManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * Exporta filas de la tabla destino a un shapefile comprimido.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExportService {

    private final TapakProperties properties;
    private final WorkspaceManager workspaceManager;
    private final GeometryConverter geometryConverter;
    private final ArchiveCompressor archiveCompressor;
    private final SelectionSnapshotter snapshotter;
    private final TransferJobService jobService;

    @Async(AsyncConfig.EXPORT_EXECUTOR)
    public CompletableFuture<ExportArchive> exportAsync(ExportSelector selector) {
        return CompletableFuture.completedFuture(export(selector));
    }

    /**
     * El workspace devuelto dentro de {@link ExportArchive} queda a cargo de quien entrega la respuesta.
     * Ante cualquier error se libera aquí mismo.
     *
     * @throws FeatureNotFoundException si la selección por id no produce nada
     * @throws ExportFailedException si la exportación completa no genera el ZIP
     */
    public ExportArchive export(ExportSelector selector) {
        String archiveName = selector.archiveName(properties.getExportNamePrefix());
        TransferJob job = jobService.start(TransferJob.TYPE_EXPORT, archiveName, selector.describe());
        Workspace workspace = workspaceManager.acquire("export_");
        RelationName snapshot = null;

        try {
            RelationName source = RelationName.parse(properties.getTargetTable());
            Integer rows = null;

            if (!selector.isAll()) {
                SelectionSnapshotter.Snapshot selection = snapshotter.materialize(selector.ids());
                snapshot = selection.relation();
                if (selection.rows() == 0) {
                    throw new FeatureNotFoundException("Feature not found: " + selector.describe());
                }
                source = snapshot;
                rows = selection.rows();
            }

            Path fileSet = exportFileSet(selector, "SELECT * FROM " + source.quoted(), workspace.resolve("shp"));
            Path archive = archiveCompressor.compress(fileSet, workspace.resolve(archiveName))
                    .orElseThrow(() -> missingArchive(selector));

            jobService.complete(job, rows);
            log.info("✅ Export listo: {} ({})", archiveName, selector.describe());
            return new ExportArchive(archive, archiveName, workspace);
        } catch (RuntimeException e) {
            workspace.close();
            jobService.fail(job, e);
            if (!(e instanceof TapakException)) {
                log.error("❌ Error en exportación {}", selector.describe(), e);
            }
            throw e;
        } finally {
            if (snapshot != null) {
                snapshotter.drop(snapshot);
            }
        }
    }

    private Path exportFileSet(ExportSelector selector, String sql, Path destDir) {
        try {
            return geometryConverter.exportFromQuery(sql, destDir);
        } catch (ConversionException e) {
            if (selector.isAll()) {
                throw e;
            }
            // Para ids la falla se informa como "nada para exportar"
            throw new FeatureNotFoundException("Feature not found or export failed: " + selector.describe(), e);
        }
    }

    private RuntimeException missingArchive(ExportSelector selector) {
        if (selector.isAll()) {
            return new ExportFailedException("Failed to create export file");
        }
        return new FeatureNotFoundException("Export failed: " + selector.describe());
    }
}
