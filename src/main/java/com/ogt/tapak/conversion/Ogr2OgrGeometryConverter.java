package com.ogt.tapak.conversion;

import com.ogt.tapak.config.TapakProperties;
import com.ogt.tapak.exception.ConversionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * {@link GeometryConverter} que ejecuta {@code ogr2ogr} como proceso externo.
 * Los argumentos van como lista (sin shell), nunca se interpolan en una línea de comandos.
 */
@Component
@Slf4j
public class Ogr2OgrGeometryConverter implements GeometryConverter {

    private static final Pattern PASSWORD = Pattern.compile("(password\\s*=\\s*)\\S+", Pattern.CASE_INSENSITIVE);

    private final TapakProperties.Conversion config;

    public Ogr2OgrGeometryConverter(TapakProperties properties) {
        this.config = properties.getConversion();
    }

    @Override
    public void importToStaging(Path sourceDir, String stagingRelation) {
        Path shp = GeometrySourceLocator.locate(sourceDir)
                .orElseThrow(() -> new ConversionException("No .shp file found in the zip", (String) null));

        log.info("▶️ Importando {} en {}", shp.getFileName(), stagingRelation);
        run(importCommand(shp, stagingRelation));
        log.info("✅ Import a staging completado: {}", stagingRelation);
    }

    @Override
    public Path exportFromQuery(String sql, Path destDir) {
        try {
            Files.createDirectories(destDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create export directory " + destDir, e);
        }
        log.info("▶️ Exportando a shapefile en {}", destDir);
        run(exportCommand(sql, destDir.resolve(config.getExportLayerName() + ".shp")));
        return destDir;
    }

    List<String> importCommand(Path shp, String stagingRelation) {
        return List.of(
                config.getExecutable(),
                "-f", "PostgreSQL",
                "PG:" + config.getPgConnection(),
                shp.toAbsolutePath().toString(),
                "-nln", stagingRelation,
                "-overwrite",
                "-lco", "GEOMETRY_NAME=" + config.getGeometryColumn(),
                "-t_srs", config.getTargetSrs(),
                "--config", "SHAPE_ENCODING", config.getEncoding()
        );
    }

    List<String> exportCommand(String sql, Path shpOut) {
        return List.of(
                config.getExecutable(),
                "-f", "ESRI Shapefile",
                shpOut.toAbsolutePath().toString(),
                "PG:" + config.getPgConnection(),
                "-sql", sql,
                "-nln", config.getExportLayerName(),
                "-lco", "ENCODING=" + config.getEncoding(),
                "-t_srs", config.getTargetSrs()
        );
    }

    private void run(List<String> command) {
        String printable = mask(String.join(" ", command));
        log.debug("Ejecutando: {}", printable);

        Path stderrLog = null;
        Process process = null;
        try {
            stderrLog = Files.createTempFile("ogr2ogr-", ".stderr");
            process = new ProcessBuilder(command)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .redirectError(stderrLog.toFile())
                    .start();

            Duration timeout = config.getTimeout();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ConversionException("ogr2ogr timed out after " + timeout, mask(readStderr(stderrLog)));
            }

            int exit = process.exitValue();
            if (exit != 0) {
                String stderr = readStderr(stderrLog);
                log.error("❌ ogr2ogr terminó con código {}: {}", exit, mask(stderr));
                throw new ConversionException("ogr2ogr failed (exit " + exit + ")", mask(stderr));
            }
        } catch (IOException e) {
            throw new ConversionException("Could not run " + config.getExecutable(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new ConversionException("ogr2ogr interrupted", e);
        } finally {
            deleteQuietly(stderrLog);
        }
    }

    private String readStderr(Path stderrLog) {
        try {
            return new String(Files.readAllBytes(stderrLog), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "(stderr unavailable: " + e.getMessage() + ")";
        }
    }

    private void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("⚠️ No se pudo borrar {}: {}", file, e.getMessage());
        }
    }

    static String mask(String text) {
        return text == null ? null : PASSWORD.matcher(text).replaceAll("$1****");
    }
}
