package com.ogt.tapak.export;

import com.ogt.tapak.config.TapakProperties;
import com.ogt.tapak.schema.RelationName;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Copia las filas pedidas a una relación propia de la petición usando parámetros JDBC.
 * ogr2ogr sólo recibe {@code SELECT * FROM <snapshot>}: ningún valor del cliente llega al texto SQL.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SelectionSnapshotter {

    private final JdbcTemplate jdbcTemplate;
    private final TapakProperties properties;

    public record Snapshot(RelationName relation, int rows) {
    }

    public Snapshot materialize(List<Long> ids) {
        RelationName target = RelationName.parse(properties.getTargetTable());
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        RelationName snapshot = target.sibling(target.table() + "_export_" + suffix);

        jdbcTemplate.execute("CREATE TABLE " + snapshot.quoted()
                + " AS SELECT * FROM " + target.quoted() + " WITH NO DATA");

        String placeholders = ids.stream().map(id -> "?").collect(Collectors.joining(", "));
        String sql = "INSERT INTO " + snapshot.quoted()
                + " SELECT * FROM " + target.quoted()
                + " WHERE " + RelationName.quote(properties.getIdentifierColumn()) + " IN (" + placeholders + ")";
        try {
            int rows = jdbcTemplate.update(sql, ids.toArray());
            log.debug("Snapshot {} con {} filas", snapshot, rows);
            return new Snapshot(snapshot, Math.max(rows, 0));
        } catch (RuntimeException e) {
            drop(snapshot);
            throw e;
        }
    }

    /** Limpieza: un fallo aquí se loguea para no tapar el error original de la petición. */
    public void drop(RelationName snapshot) {
        try {
            jdbcTemplate.execute("DROP TABLE IF EXISTS " + snapshot.quoted());
        } catch (DataAccessException e) {
            log.warn("⚠️ No se pudo eliminar el snapshot {}: {}", snapshot, e.getMessage());
        }
    }
}
