package com.hybridorm.repositories.rdbms;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One parameterized statement and its positional bindings, in placeholder order.
 */
public record CompiledQuery(String sql, List<Object> bindings) {
    public CompiledQuery {
        bindings = Collections.unmodifiableList(new ArrayList<>(bindings));
    }
}
