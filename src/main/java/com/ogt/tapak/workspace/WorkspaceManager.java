package com.ogt.tapak.workspace;

import com.ogt.tapak.config.TapakProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * Crea y elimina los workspaces de cada petición bajo un directorio raíz propio.
 */
@Component
@Slf4j
public class WorkspaceManager {

    private final Path root;

    @Autowired
    public WorkspaceManager(TapakProperties properties) {
        this(properties.getWorkspace().getRoot());
    }

    public WorkspaceManager(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path getRoot() {
        return root;
    }

    /**
     * Crea un directorio vacío con nombre único ({@code prefix} + aleatorio).
     */
    public Workspace acquire(String prefix) {
        try {
            Files.createDirectories(root);
            Path dir = Files.createTempDirectory(root, prefix);
            log.debug("Workspace creado: {}", dir);
            return new Workspace(dir, this);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create workspace under " + root, e);
        }
    }

    /**
     * Idempotente: tolera un directorio ya borrado total o parcialmente y nunca lanza.
     */
    public void release(Workspace workspace) {
        if (workspace != null) {
            workspace.close();
        }
    }

    void delete(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.deleteIfExists(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                    if (exc instanceof NoSuchFileException) {
                        return FileVisitResult.CONTINUE;
                    }
                    throw exc;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path d, IOException exc) throws IOException {
                    Files.deleteIfExists(d);
                    return FileVisitResult.CONTINUE;
                }
            });
            log.debug("Workspace eliminado: {}", dir);
        } catch (NoSuchFileException e) {
            log.debug("Workspace {} ya no existía", dir);
        } catch (IOException e) {
            // El janitor lo volverá a intentar
            log.warn("⚠️ No se pudo eliminar el workspace {}: {}", dir, e.getMessage());
        }
    }
}
