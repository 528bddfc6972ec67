package com.ogt.tapak.archive;

import com.ogt.tapak.config.TapakProperties;
import com.ogt.tapak.exception.BadInputException;
import com.ogt.tapak.exception.PayloadTooLargeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;

/**
 * Descomprime el ZIP subido dentro del workspace.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ArchiveExtractor {

    static final Charset LEGACY_ENTRY_CHARSET = Charset.forName("IBM437");

    private final TapakProperties properties;

    /**
     * @return cantidad de archivos escritos
     * @throws PayloadTooLargeException si supera {@code tapak.max-upload-bytes} (antes de tocar disco)
     * @throws BadInputException si no es un ZIP válido o alguna entrada sale de {@code destDir}
     */
    public int extract(byte[] raw, Path destDir) {
        long max = properties.getMaxUploadBytes();
        if (raw.length > max) {
            throw new PayloadTooLargeException(raw.length, max);
        }
        if (!isZip(raw)) {
            throw new BadInputException("Failed to extract ZIP: not a zip archive");
        }

        Path base = destDir.toAbsolutePath().normalize();
        int files;
        try {
            files = extractWith(raw, base, StandardCharsets.UTF_8);
        } catch (InvalidPathException e) {
            throw new BadInputException("Failed to extract ZIP: invalid entry name (" + e.getReason() + ")", e);
        } catch (IllegalArgumentException e) {
            // Nombres sin flag UTF-8 (Explorador de Windows): se decodifican como cp437
            log.info("Nombres de entrada no UTF-8, se reintenta con {}", LEGACY_ENTRY_CHARSET);
            try {
                files = extractWith(raw, base, LEGACY_ENTRY_CHARSET);
            } catch (IllegalArgumentException retry) {
                throw new BadInputException("Failed to extract ZIP: invalid entry name", retry);
            }
        }
        log.info("📦 ZIP extraído en {} ({} archivos)", base, files);
        return files;
    }

    private int extractWith(byte[] raw, Path base, Charset entryCharset) {
        int files = 0;
        int entries = 0;

        try (ZipInputStream zis = new ZipInputStream(new ByteArrayInputStream(raw), entryCharset)) {
            ZipEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                entries++;
                Path out = base.resolve(entry.getName()).normalize();
                // Zip-slip: ninguna entrada puede escapar del workspace
                if (!out.startsWith(base) || out.equals(base)) {
                    throw new BadInputException("Failed to extract ZIP: unsafe entry path " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(out);
                    continue;
                }
                Files.createDirectories(out.getParent());
                try (OutputStream os = Files.newOutputStream(out)) {
                    zis.transferTo(os);
                }
                files++;
            }
        } catch (ZipException | EOFException e) {
            throw new BadInputException("Failed to extract ZIP: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing extracted entries to " + base, e);
        }

        if (entries == 0) {
            throw new BadInputException("Failed to extract ZIP: archive is empty");
        }
        return files;
    }

    private boolean isZip(byte[] raw) {
        // PK\003\004
        return raw.length >= 4 && raw[0] == 'P' && raw[1] == 'K' && raw[2] == 3 && raw[3] == 4;
    }
}
