package com.ogt.tapak.conversion;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Busca el .shp a importar dentro de un ZIP ya extraído.
 * <p>
 * Con varios candidatos se elige el primero por ruta relativa (orden alfabético), así el
 * resultado no depende del orden del listado del sistema de archivos. Los restantes se loguean.
 */
@Slf4j
public final class GeometrySourceLocator {

    private static final String EXTENSION = ".shp";

    private GeometrySourceLocator() {
    }

    public static Optional<Path> locate(Path sourceDir) {
        List<Path> candidates = candidates(sourceDir);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        if (candidates.size() > 1) {
            log.warn("⚠️ El ZIP contiene {} shapefiles, se importa {} y se ignoran {}",
                    candidates.size(), candidates.get(0).getFileName(), candidates.subList(1, candidates.size()));
        }
        return Optional.of(candidates.get(0));
    }

    static List<Path> candidates(Path sourceDir) {
        try (Stream<Path> walk = Files.walk(sourceDir)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(EXTENSION))
                    .filter(p -> !isMetadataJunk(sourceDir.relativize(p)))
                    .sorted(Comparator.comparing(p -> sourceDir.relativize(p).toString()))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not list " + sourceDir, e);
        }
    }

    // Basura que agrega el compresor de macOS (__MACOSX/._archivo.shp)
    private static boolean isMetadataJunk(Path relative) {
        for (Path part : relative) {
            String name = part.toString();
            if (name.equals("__MACOSX") || name.startsWith("._")) {
                return true;
            }
        }
        return false;
    }
}
