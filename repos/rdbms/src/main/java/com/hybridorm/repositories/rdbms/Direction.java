package com.hybridorm.repositories.rdbms;

import java.util.Locale;

public enum Direction {
    ASC,
    DESC;

    public static Direction parse(String direction) {
        if (direction == null) {
            return ASC;
        }
        switch (direction.trim().toLowerCase(Locale.ROOT)) {
            case "asc":
                return ASC;
            case "desc":
                return DESC;
            default:
                throw new IllegalArgumentException("Unsupported order direction: " + direction);
        }
    }
}
