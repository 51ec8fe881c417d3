package com.hybridorm.repositories.rdbms;

import com.hybridorm.core.Json;
import com.hybridorm.core.Moment;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.*;

/**
 * Conversions between Java values and JDBC parameters and rows.
 */
public interface Converters {

    /**
     * Converts a value into something every embedded driver can bind: booleans become
     * 1/0, temporal values the canonical datetime string, maps and lists JSON text.
     */
    static Object prepare(Object value) {
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1 : 0;
        }
        if (Moment.isTemporal(value)) {
            return Moment.from(value).format();
        }
        if (value instanceof Map || value instanceof List) {
            return Json.encode(value);
        }
        return value;
    }

    static List<Object> prepareAll(Collection<?> values) {
        List<Object> prepared = new ArrayList<>(values.size());
        for (Object value : values) {
            prepared.add(prepare(value));
        }
        return prepared;
    }

    static void bind(PreparedStatement stmt, List<?> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            stmt.setObject(i + 1, prepare(params.get(i)));
        }
    }

    /**
     * Reads every remaining row as a column-label keyed map, keeping the driver's types.
     */
    static List<Map<String, Object>> resultSetToRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(meta.getColumnLabel(i), rs.getObject(i));
            }
            rows.add(row);
        }
        return rows;
    }
}
