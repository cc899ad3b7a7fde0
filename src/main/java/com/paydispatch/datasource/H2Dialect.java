package com.paydispatch.datasource;

import java.util.ArrayList;
import java.util.List;

/**
 * H2 running in PostgreSQL compatibility mode, which accepts {@code ON CONFLICT DO NOTHING}
 * but not a conflict target.
 */
public final class H2Dialect implements SqlDialect {

    @Override
    public String name() {
        return "h2";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:h2:");
    }

    @Override
    public String insertIgnoreSql(String table, String keyColumn, List<String> columns) {
        return "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES ("
                + SqlDialect.placeholders(columns.size()) + ") ON CONFLICT DO NOTHING";
    }

    @Override
    public List<String> purgeSql(List<String> tables) {
        List<String> statements = new ArrayList<>(tables.size());
        for (String table : tables) {
            statements.add("DELETE FROM " + table);
        }
        return statements;
    }
}
