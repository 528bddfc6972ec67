package com.ogt.tapak.workspace;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Directorio temporal de una única petición. {@link #close()} lo elimina una sola vez,
 * por lo que puede usarse en try-with-resources y también cerrarse desde otro hilo.
 */
public final class Workspace implements AutoCloseable {

    private final Path dir;
    private final WorkspaceManager manager;
    private final AtomicBoolean released = new AtomicBoolean(false);

    Workspace(Path dir, WorkspaceManager manager) {
        this.dir = dir;
        this.manager = manager;
    }

    public Path dir() {
        return dir;
    }

    public Path resolve(String name) {
        return dir.resolve(name);
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            manager.delete(dir);
        }
    }

    @Override
    public String toString() {
        return dir.toString();
    }
}
