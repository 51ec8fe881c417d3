package com.hybridorm.repositories.rdbms;

public record WhereClause(String column, Operator operator, Object value) {
    public String toSql() {
        return operator.takesValue()
                ? column + " " + operator.symbol() + " ?"
                : column + " " + operator.symbol();
    }
}
