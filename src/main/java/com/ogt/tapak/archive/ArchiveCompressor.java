package com.ogt.tapak.archive;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Empaqueta el conjunto .shp/.shx/.dbf/.prj/.cpg generado por la exportación.
 */
@Component
@Slf4j
public class ArchiveCompressor {

    /**
     * Comprime los archivos de {@code sourceDir} (rutas relativas, orden alfabético) en {@code archive}.
     *
     * @return el ZIP creado, o vacío si no había nada que empaquetar
     */
    public Optional<Path> compress(Path sourceDir, Path archive) {
        if (!Files.isDirectory(sourceDir)) {
            return Optional.empty();
        }
        try {
            List<Path> files;
            try (Stream<Path> walk = Files.walk(sourceDir)) {
                files = walk.filter(Files::isRegularFile).sorted().toList();
            }
            if (files.isEmpty()) {
                log.warn("⚠️ Nada que comprimir en {}", sourceDir);
                return Optional.empty();
            }

            Files.deleteIfExists(archive);
            try (OutputStream os = Files.newOutputStream(archive);
                 ZipOutputStream zos = new ZipOutputStream(os)) {
                for (Path file : files) {
                    String name = sourceDir.relativize(file).toString().replace('\\', '/');
                    zos.putNextEntry(new ZipEntry(name));
                    Files.copy(file, zos);
                    zos.closeEntry();
                }
            }
            log.info("📦 ZIP generado: {} ({} archivos)", archive.getFileName(), files.size());
            return Optional.of(archive);
        } catch (IOException e) {
            throw new UncheckedIOException("Error compressing " + sourceDir, e);
        }
    }
}
