package com.riskgate.repository.jdbc;

import java.nio.file.Path;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

/**
 * Builds a {@link JdbcTemplate} over a SQLite file. The underlying {@link DriverManagerDataSource}
 * opens a new connection for every operation and closes it afterwards; nothing is pooled, so
 * several processes can share the file without holding it open between calls.
 */
public final class SqliteJdbcTemplates {

    static final String DRIVER_CLASS = "org.sqlite.JDBC";

    private SqliteJdbcTemplates() {}

    public static JdbcTemplate forPath(Path databasePath) {
        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName(DRIVER_CLASS);
        dataSource.setUrl("jdbc:sqlite:" + databasePath.toAbsolutePath());
        return new JdbcTemplate(dataSource);
    }
}
