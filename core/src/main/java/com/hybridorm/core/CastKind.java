package com.hybridorm.core;

import java.util.Locale;

/**
 * The per-attribute coercions an entity can declare.
 */
public enum CastKind {
    DATETIME,
    JSON,
    BOOL,
    INT,
    DOUBLE,
    NONE;

    /**
     * Resolves the lower-case names used in entity definitions ({@code "datetime"}, {@code "json"}, ...).
     * Unknown names resolve to {@link #NONE}.
     */
    public static CastKind fromName(String name) {
        if (name == null) {
            return NONE;
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "datetime":
            case "date":
                return DATETIME;
            case "json":
            case "array":
                return JSON;
            case "bool":
            case "boolean":
                return BOOL;
            case "int":
            case "integer":
                return INT;
            case "double":
            case "float":
                return DOUBLE;
            default:
                return NONE;
        }
    }
}
