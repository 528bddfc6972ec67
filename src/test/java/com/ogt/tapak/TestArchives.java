package com.ogt.tapak;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

public final class TestArchives {

    private TestArchives() {
    }

    public static byte[] zip(Map<String, byte[]> entries) {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        try (ZipOutputStream zos = new ZipOutputStream(bos)) {
            for (Map.Entry<String, byte[]> e : entries.entrySet()) {
                zos.putNextEntry(new ZipEntry(e.getKey()));
                zos.write(e.getValue());
                zos.closeEntry();
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bos.toByteArray();
    }

    /** Conjunto mínimo de un shapefile (contenido ficticio). */
    public static byte[] shapefileZip(String baseName) {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        for (String ext : new String[]{".shp", ".shx", ".dbf", ".prj"}) {
            entries.put(baseName + ext, ("fake " + ext).getBytes(StandardCharsets.UTF_8));
        }
        return zip(entries);
    }
}
