package com.ogt.tapak.export;

import com.ogt.tapak.workspace.Workspace;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * ZIP listo para entregar. El workspace que lo contiene se libera una sola vez al
 * terminar {@link #writeTo}, haya completado, fallado o cortado el cliente la descarga.
 */
public class ExportArchive implements StreamingResponseBody, Closeable {

    private final Path file;
    private final String fileName;
    private final Workspace workspace;

    public ExportArchive(Path file, String fileName, Workspace workspace) {
        this.file = file;
        this.fileName = fileName;
        this.workspace = workspace;
    }

    public Path getFile() {
        return file;
    }

    public String getFileName() {
        return fileName;
    }

    public long size() {
        try {
            return Files.size(file);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void writeTo(OutputStream out) throws IOException {
        try {
            Files.copy(file, out);
            out.flush();
        } finally {
            close();
        }
    }

    @Override
    public void close() {
        workspace.close();
    }
}
