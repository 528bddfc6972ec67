package com.ogt.tapak.export;

import com.ogt.tapak.exception.BadInputException;

import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Qué filas de la tabla destino se exportan: todas, un id o un conjunto de ids.
 * Los ids se guardan deduplicados y ordenados, y sólo viajan a SQL como parámetros.
 */
public final class ExportSelector {

    /** Tope de parámetros por sentencia, muy por debajo del límite de PostgreSQL. */
    static final int MAX_IDS = 10_000;

    public enum Kind { ALL, ID, IDS }

    private final Kind kind;
    private final List<Long> ids;

    private ExportSelector(Kind kind, List<Long> ids) {
        this.kind = kind;
        this.ids = List.copyOf(ids);
    }

    public static ExportSelector all() {
        return new ExportSelector(Kind.ALL, List.of());
    }

    public static ExportSelector id(long featureId) {
        return new ExportSelector(Kind.ID, List.of(featureId));
    }

    /**
     * Parsea {@code "1,2,5"}. Los elementos vacíos se ignoran.
     *
     * @throws BadInputException "Invalid ids format" si algún elemento no es entero,
     *                           "Empty id list" si no queda ninguno
     */
    public static ExportSelector parseIds(String raw) {
        TreeSet<Long> parsed = new TreeSet<>();
        if (raw != null) {
            for (String part : raw.split(",")) {
                String value = part.trim();
                if (value.isEmpty()) {
                    continue;
                }
                try {
                    parsed.add(Long.parseLong(value));
                } catch (NumberFormatException e) {
                    throw new BadInputException("Invalid ids format: " + value);
                }
            }
        }
        if (parsed.isEmpty()) {
            throw new BadInputException("Empty id list");
        }
        if (parsed.size() > MAX_IDS) {
            throw new BadInputException("Too many ids: " + parsed.size() + " (max " + MAX_IDS + ")");
        }
        return new ExportSelector(Kind.IDS, List.copyOf(parsed));
    }

    public Kind kind() {
        return kind;
    }

    public boolean isAll() {
        return kind == Kind.ALL;
    }

    public List<Long> ids() {
        return ids;
    }

    /** Nombre del ZIP visible para el cliente. */
    public String archiveName(String prefix) {
        return switch (kind) {
            case ALL -> prefix + "_all.zip";
            case ID -> prefix + "_id_" + ids.get(0) + ".zip";
            case IDS -> prefix + "_ids_" + joinedIds() + ".zip";
        };
    }

    public String describe() {
        return switch (kind) {
            case ALL -> "all";
            case ID -> "id=" + ids.get(0);
            case IDS -> "ids=" + joinedIds();
        };
    }

    private String joinedIds() {
        return ids.stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExportSelector other)) return false;
        return kind == other.kind && ids.equals(other.ids);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, ids);
    }

    @Override
    public String toString() {
        return describe();
    }
}
