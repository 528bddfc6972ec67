package com.ogt.tapak.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuración del servicio, resuelta una sola vez al arrancar ({@code tapak.*}).
 */
@ConfigurationProperties(prefix = "tapak")
@Validated
@Getter
@Setter
public class TapakProperties {

    /** Tabla permanente, siempre calificada con esquema (ej: public.tapak_proyek). */
    @NotBlank
    private String targetTable = "public.tapak_proyek";

    @NotBlank
    private String stagingTable = "public.staging_tapak_upload";

    /** Columna autogenerada que nunca participa del INSERT. */
    @NotBlank
    private String identifierColumn = "id";

    @Positive
    private long maxUploadBytes = 50L * 1024L * 1024L;

    /** Secreto compartido opcional (header X-API-Key). Vacío = sin autenticación. */
    private String apiKey;

    @NotBlank
    private String exportNamePrefix = "tapak_proyek";

    private Duration stagingLockTimeout = Duration.ofMinutes(5);

    @Valid
    private Workspace workspace = new Workspace();

    @Valid
    private Conversion conversion = new Conversion();

    @Valid
    private Events events = new Events();

    public boolean isApiKeyRequired() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Getter
    @Setter
    public static class Workspace {
        private Path root = Path.of(System.getProperty("java.io.tmpdir"), "ogt-tapak-workspaces");
        private Duration maxAge = Duration.ofHours(6);
        private long sweepIntervalMs = 900_000L;
    }

    @Getter
    @Setter
    public static class Conversion {
        @NotBlank
        private String executable = "ogr2ogr";

        /** Cadena libpq que se pasa como PG:&lt;conexión&gt;. */
        @NotBlank
        private String pgConnection;

        @NotBlank
        private String targetSrs = "EPSG:4326";

        @NotBlank
        private String geometryColumn = "geom";

        @NotBlank
        private String encoding = "UTF-8";

        @NotBlank
        private String exportLayerName = "export_tapak";

        private Duration timeout = Duration.ofMinutes(10);

        /** Hilos para cargas (ogr2ogr hacia staging). */
        @Positive
        private int poolSize = 4;

        @Positive
        private int exportPoolSize = 4;

        @Positive
        private int queueCapacity = 100;
    }

    @Getter
    @Setter
    public static class Events {
        private boolean enabled = true;
        private String exchange = "ogt.gis.events";
        private String routingKey = "tapak.import.completed";
    }
}
