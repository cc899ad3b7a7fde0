package com.paydispatch.datasource;

import java.util.Collections;
import java.util.List;

public interface SqlDialect {

    String name();

    List<String> jdbcUrlPrefixes();

    String insertIgnoreSql(String table, String keyColumn, List<String> columns);

    List<String> purgeSql(List<String> tables);

    static SqlDialect forJdbcUrl(String jdbcUrl) {
        for (SqlDialect dialect : List.of(new PostgresDialect(), new H2Dialect())) {
            for (String prefix : dialect.jdbcUrlPrefixes()) {
                if (jdbcUrl.startsWith(prefix)) {
                    return dialect;
                }
            }
        }
        throw new IllegalArgumentException("No SQL dialect for JDBC URL: " + jdbcUrl);
    }

    static String placeholders(int count) {
        return String.join(",", Collections.nCopies(count, "?"));
    }
}
