package com.ogt.tapak.reconcile;

import com.ogt.tapak.schema.RelationName;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Mapeo columna destino -> expresión sobre staging, calculado por petición.
 * <p>
 * Toda columna del destino salvo el identificador aparece exactamente una vez. El match es
 * por nombre sin distinguir mayúsculas; si staging tiene dos columnas que sólo difieren en
 * mayúsculas gana la última en orden de declaración. Sin match se inserta NULL.
 */
public final class ColumnMapping {

    /**
     * @param targetColumn columna del destino
     * @param stagingColumn columna de staging con su capitalización original, o null si no existe
     */
    public record Entry(String targetColumn, String stagingColumn) {

        public boolean isNullFill() {
            return stagingColumn == null;
        }

        String selectExpression() {
            String alias = RelationName.quote(targetColumn);
            return isNullFill() ? "NULL AS " + alias : RelationName.quote(stagingColumn) + " AS " + alias;
        }
    }

    private final List<Entry> entries;

    private ColumnMapping(List<Entry> entries) {
        this.entries = List.copyOf(entries);
    }

    public static ColumnMapping between(List<String> targetColumns, List<String> stagingColumns, String identifierColumn) {
        Map<String, String> stagingByLower = new HashMap<>();
        for (String col : stagingColumns) {
            stagingByLower.put(col.toLowerCase(Locale.ROOT), col);
        }

        List<Entry> entries = new ArrayList<>();
        for (String col : targetColumns) {
            // Por nombre exacto, no por tipo ni posición
            if (col.equals(identifierColumn)) {
                continue;
            }
            entries.add(new Entry(col, stagingByLower.get(col.toLowerCase(Locale.ROOT))));
        }
        return new ColumnMapping(entries);
    }

    public List<Entry> entries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<String> nullFilledColumns() {
        return entries.stream().filter(Entry::isNullFill).map(Entry::targetColumn).toList();
    }

    String insertColumnsSql() {
        return entries.stream().map(e -> RelationName.quote(e.targetColumn())).collect(Collectors.joining(", "));
    }

    String selectExpressionsSql() {
        return entries.stream().map(Entry::selectExpression).collect(Collectors.joining(", "));
    }

    /**
     * {@code INSERT INTO target (cols) SELECT exprs FROM staging}: una sola sentencia, atómica.
     */
    public String toInsertSql(RelationName target, RelationName staging) {
        return "INSERT INTO " + target.quoted() + " (" + insertColumnsSql() + ") "
                + "SELECT " + selectExpressionsSql() + " FROM " + staging.quoted();
    }
}
