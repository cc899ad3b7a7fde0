package com.paydispatch.datasource;

import java.util.List;

public final class PostgresDialect implements SqlDialect {

    @Override
    public String name() {
        return "postgresql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:postgresql:");
    }

    @Override
    public String insertIgnoreSql(String table, String keyColumn, List<String> columns) {
        return "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES ("
                + SqlDialect.placeholders(columns.size()) + ") ON CONFLICT (" + keyColumn + ") DO NOTHING";
    }

    @Override
    public List<String> purgeSql(List<String> tables) {
        return List.of("TRUNCATE TABLE " + String.join(", ", tables));
    }
}
