package com.ogt.tapak.conversion;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class GeometrySourceLocatorTest {

    @TempDir
    Path dir;

    @Test
    void findsShapefileRegardlessOfExtensionCase() throws IOException {
        Files.writeString(dir.resolve("TAPAK.SHP"), "x");
        Files.writeString(dir.resolve("TAPAK.DBF"), "x");

        assertThat(GeometrySourceLocator.locate(dir)).contains(dir.resolve("TAPAK.SHP"));
    }

    @Test
    void findsShapefileInsideSubdirectory() throws IOException {
        Files.createDirectories(dir.resolve("data"));
        Files.writeString(dir.resolve("data/tapak.shp"), "x");

        assertThat(GeometrySourceLocator.locate(dir)).contains(dir.resolve("data/tapak.shp"));
    }

    @Test
    void picksFirstByRelativePathWhenSeveralArePresent() throws IOException {
        Files.writeString(dir.resolve("zona_b.shp"), "x");
        Files.writeString(dir.resolve("zona_a.shp"), "x");
        Files.writeString(dir.resolve("zona_c.shp"), "x");

        assertThat(GeometrySourceLocator.candidates(dir)).hasSize(3);
        assertThat(GeometrySourceLocator.locate(dir)).contains(dir.resolve("zona_a.shp"));
    }

    @Test
    void ignoresMacOsMetadataEntries() throws IOException {
        Files.createDirectories(dir.resolve("__MACOSX"));
        Files.writeString(dir.resolve("__MACOSX/._tapak.shp"), "x");
        Files.writeString(dir.resolve("._tapak.shp"), "x");
        Files.writeString(dir.resolve("tapak.shp"), "x");

        assertThat(GeometrySourceLocator.candidates(dir)).containsExactly(dir.resolve("tapak.shp"));
    }

    @Test
    void emptyWhenNoShapefile() throws IOException {
        Files.writeString(dir.resolve("readme.txt"), "x");

        assertThat(GeometrySourceLocator.locate(dir)).isEmpty();
    }
}
