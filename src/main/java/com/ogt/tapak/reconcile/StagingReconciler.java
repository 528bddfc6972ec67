package com.ogt.tapak.reconcile;

import com.ogt.tapak.config.TapakProperties;
import com.ogt.tapak.exception.InvalidRelationException;
import com.ogt.tapak.exception.NothingToInsertException;
import com.ogt.tapak.schema.RelationName;
import com.ogt.tapak.schema.SchemaIntrospector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Vuelca la relación de staging en la relación destino mapeando columnas por nombre.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StagingReconciler {

    private final SchemaIntrospector introspector;
    private final JdbcTemplate jdbcTemplate;
    private final TapakProperties properties;

    /**
     * Reconcilia y vacía staging en la misma transacción: si el TRUNCATE falla tampoco
     * quedan insertadas las filas, y un reintento no las duplica.
     */
    @Transactional
    public int mergeAndClear(String targetRelation, String stagingRelation) {
        int inserted = reconcile(targetRelation, stagingRelation);
        truncate(stagingRelation);
        return inserted;
    }

    /**
     * @return filas insertadas según el motor (0 si no lo informa)
     */
    public int reconcile(String targetRelation, String stagingRelation) {
        RelationName target = RelationName.parse(targetRelation);
        RelationName staging = RelationName.parse(stagingRelation);

        List<String> targetColumns = introspector.columnsOf(target);
        if (targetColumns.isEmpty()) {
            throw new InvalidRelationException("Target relation not found or has no columns: " + target);
        }
        List<String> stagingColumns = introspector.columnsOf(staging);
        if (stagingColumns.isEmpty()) {
            throw new InvalidRelationException("Staging relation not found or has no columns: " + staging);
        }

        ColumnMapping mapping = ColumnMapping.between(targetColumns, stagingColumns, properties.getIdentifierColumn());
        if (mapping.isEmpty()) {
            throw new NothingToInsertException(target.toString());
        }
        if (!mapping.nullFilledColumns().isEmpty()) {
            log.info("Columnas de {} sin equivalente en staging (se insertan NULL): {}", target, mapping.nullFilledColumns());
        }

        String sql = mapping.toInsertSql(target, staging);
        log.debug("Reconcile SQL: {}", sql);
        int affected = jdbcTemplate.update(sql);

        // El conteo es informativo: si el driver no lo reporta se informa 0 sin fallar
        if (affected < 0) {
            log.warn("⚠️ El motor no informó filas afectadas para {}, se reporta 0", target);
            return 0;
        }
        log.info("✅ {} filas de {} agregadas a {}", affected, staging, target);
        return affected;
    }

    /** Vacía staging conservando su estructura. */
    public void truncate(String stagingRelation) {
        jdbcTemplate.execute("TRUNCATE TABLE " + RelationName.parse(stagingRelation).quoted());
    }
}
