package com.ogt.tapak.schema;

import com.ogt.tapak.exception.InvalidRelationException;

/**
 * Nombre de relación calificado con esquema ({@code esquema.tabla}).
 */
public record RelationName(String schema, String table) {

    public static RelationName parse(String fullName) {
        if (fullName == null) {
            throw new InvalidRelationException("Relation name is required");
        }
        int dot = fullName.indexOf('.');
        if (dot <= 0 || dot == fullName.length() - 1) {
            throw new InvalidRelationException("Relation name must be schema-qualified: " + fullName);
        }
        return new RelationName(fullName.substring(0, dot).trim(), fullName.substring(dot + 1).trim());
    }

    /** Relación hermana en el mismo esquema. */
    public RelationName sibling(String otherTable) {
        return new RelationName(schema, otherTable);
    }

    public String quoted() {
        return quote(schema) + "." + quote(table);
    }

    public static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String toString() {
        return schema + "." + table;
    }
}
