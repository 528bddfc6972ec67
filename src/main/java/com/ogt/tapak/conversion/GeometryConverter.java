package com.ogt.tapak.conversion;

import java.nio.file.Path;

/**
 * Frontera con la herramienta externa de conversión de geometrías.
 * Las operaciones son bloqueantes: se invocan siempre desde el pool de conversión.
 */
public interface GeometryConverter {

    /**
     * Importa el único shapefile de {@code sourceDir} a la relación de staging,
     * sobrescribiéndola (reproyección y nombre de columna de geometría forzados).
     *
     * @throws com.ogt.tapak.exception.ConversionException si no hay .shp o la herramienta falla
     */
    void importToStaging(Path sourceDir, String stagingRelation);

    /**
     * Exporta el resultado de {@code sql} como shapefile dentro de {@code destDir}.
     *
     * @return el directorio que contiene el conjunto de archivos generado
     * @throws com.ogt.tapak.exception.ConversionException si la herramienta falla
     */
    Path exportFromQuery(String sql, Path destDir);
}
