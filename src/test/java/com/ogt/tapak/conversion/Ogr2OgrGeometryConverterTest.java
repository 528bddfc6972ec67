package com.ogt.tapak.conversion;

import com.ogt.tapak.config.TapakProperties;
import com.ogt.tapak.exception.ConversionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class Ogr2OgrGeometryConverterTest {

    @TempDir
    Path dir;

    private Ogr2OgrGeometryConverter converter;

    @BeforeEach
    void setUp() {
        TapakProperties properties = new TapakProperties();
        properties.getConversion().setPgConnection("host=db dbname=gis user=gis password=s3cr3t");
        converter = new Ogr2OgrGeometryConverter(properties);
    }

    @Test
    void importCommandOverwritesStagingWithForcedProjectionAndGeometryName() {
        Path shp = dir.resolve("tapak.shp");

        List<String> cmd = converter.importCommand(shp, "public.staging_tapak_upload");

        assertThat(cmd.get(0)).isEqualTo("ogr2ogr");
        assertThat(cmd).containsSubsequence("-f", "PostgreSQL", "PG:host=db dbname=gis user=gis password=s3cr3t",
                shp.toAbsolutePath().toString());
        assertThat(cmd).containsSubsequence("-nln", "public.staging_tapak_upload");
        assertThat(cmd).contains("-overwrite");
        assertThat(cmd).containsSubsequence("-lco", "GEOMETRY_NAME=geom");
        assertThat(cmd).containsSubsequence("-t_srs", "EPSG:4326");
        assertThat(cmd).containsSubsequence("--config", "SHAPE_ENCODING", "UTF-8");
    }

    @Test
    void exportCommandPassesSqlAsSingleArgument() {
        String sql = "SELECT * FROM \"public\".\"tapak_proyek\"";
        Path out = dir.resolve("export_tapak.shp");

        List<String> cmd = converter.exportCommand(sql, out);

        assertThat(cmd).containsSubsequence("-f", "ESRI Shapefile", out.toAbsolutePath().toString());
        assertThat(cmd).containsSubsequence("-sql", sql);
        assertThat(cmd).containsSubsequence("-nln", "export_tapak");
        assertThat(cmd).containsSubsequence("-lco", "ENCODING=UTF-8");
        assertThat(cmd).containsSubsequence("-t_srs", "EPSG:4326");
    }

    @Test
    void importFailsWhenNoShapefileIsPresent() {
        assertThatThrownBy(() -> converter.importToStaging(dir, "public.staging_tapak_upload"))
                .isInstanceOf(ConversionException.class)
                .hasMessageContaining("No .shp file");
    }

    @Test
    void masksPasswordInConnectionString() {
        assertThat(Ogr2OgrGeometryConverter.mask("PG:host=db password=s3cr3t user=gis"))
                .isEqualTo("PG:host=db password=**** user=gis");
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void nonZeroExitCarriesMaskedStderr() throws IOException {
        Ogr2OgrGeometryConverter failing = converterRunning("""
                #!/bin/sh
                echo "ERROR 1: PQconnectdb failed: host=db password=s3cr3t" >&2
                exit 3
                """, Duration.ofSeconds(30));

        assertThatThrownBy(() -> failing.exportFromQuery("SELECT 1", dir.resolve("shp")))
                .isInstanceOfSatisfying(ConversionException.class, e -> {
                    assertThat(e.getMessage()).contains("exit 3");
                    assertThat(e.getStderr()).contains("ERROR 1: PQconnectdb failed").contains("password=****");
                    assertThat(e.getStderr()).doesNotContain("s3cr3t");
                    assertThat(e.getMessage()).doesNotContain("s3cr3t");
                });
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void hangingToolIsDestroyedAfterTimeout() throws IOException {
        Ogr2OgrGeometryConverter hanging = converterRunning("""
                #!/bin/sh
                echo "still working" >&2
                exec sleep 30
                """, Duration.ofMillis(300));

        long started = System.nanoTime();
        assertThatThrownBy(() -> hanging.exportFromQuery("SELECT 1", dir.resolve("shp")))
                .isInstanceOf(ConversionException.class)
                .hasMessageContaining("timed out");
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(10));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void successfulRunReturnsOutputDirectory() throws IOException {
        Ogr2OgrGeometryConverter ok = converterRunning("""
                #!/bin/sh
                exit 0
                """, Duration.ofSeconds(30));

        Path out = ok.exportFromQuery("SELECT 1", dir.resolve("shp"));

        assertThat(out).isEqualTo(dir.resolve("shp")).isDirectory();
    }

    @Test
    void missingExecutableIsConversionFailure() {
        TapakProperties properties = new TapakProperties();
        properties.getConversion().setPgConnection("host=db");
        properties.getConversion().setExecutable(dir.resolve("no-such-ogr2ogr").toString());
        Ogr2OgrGeometryConverter missing = new Ogr2OgrGeometryConverter(properties);

        assertThatThrownBy(() -> missing.exportFromQuery("SELECT 1", dir.resolve("shp")))
                .isInstanceOf(ConversionException.class)
                .hasMessageContaining("Could not run");
    }

    private Ogr2OgrGeometryConverter converterRunning(String script, Duration timeout) throws IOException {
        Path tool = dir.resolve("fake-ogr2ogr.sh");
        Files.writeString(tool, script);
        Files.setPosixFilePermissions(tool, PosixFilePermissions.fromString("rwxr-xr-x"));
        assumeTrue(Files.isExecutable(tool), "temp directory does not allow executing scripts");

        TapakProperties properties = new TapakProperties();
        properties.getConversion().setPgConnection("host=db dbname=gis user=gis password=s3cr3t");
        properties.getConversion().setExecutable(tool.toString());
        properties.getConversion().setTimeout(timeout);
        return new Ogr2OgrGeometryConverter(properties);
    }
}
