package com.hybridorm.repositories.rdbms;

public record OrderClause(String column, Direction direction) {
    public String toSql() {
        return column + " " + direction.name();
    }
}
