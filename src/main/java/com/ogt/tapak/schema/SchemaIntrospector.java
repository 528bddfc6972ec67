package com.ogt.tapak.schema;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Lee del catálogo las columnas de una relación, en orden de declaración.
 */
@Component
@RequiredArgsConstructor
public class SchemaIntrospector {

    private static final String COLUMNS_SQL = """
            SELECT column_name
            FROM information_schema.columns
            WHERE table_schema = ? AND table_name = ?
            ORDER BY ordinal_position
            """;

    private final JdbcTemplate jdbcTemplate;

    /**
     * @return columnas ordenadas; lista vacía si la relación no existe
     * @throws com.ogt.tapak.exception.InvalidRelationException si el nombre no lleva esquema
     */
    public List<String> columnsOf(String relationFullName) {
        return columnsOf(RelationName.parse(relationFullName));
    }

    public List<String> columnsOf(RelationName relation) {
        return jdbcTemplate.queryForList(COLUMNS_SQL, String.class, relation.schema(), relation.table());
    }
}
