package com.riskgate.repository.jdbc;

/**
 * DDL for the tables of the metrics store that the gate touches. All statements are idempotent.
 *
 * <p>{@code runs} and {@code metrics} are owned by the reporting side and only read here; their
 * DDL is kept so tests and fresh installs can create a compatible store.
 */
public final class MetricsSchema {

    private MetricsSchema() {}

    public static final String CREATE_RUNS = """
            CREATE TABLE IF NOT EXISTS runs (
                id TEXT PRIMARY KEY,
                experiment_id TEXT NOT NULL,
                kind TEXT,
                started_utc TEXT,
                finished_utc TEXT,
                status TEXT,
                docker_image TEXT,
                freqtrade_version TEXT,
                config_json TEXT,
                data_window TEXT,
                artifacts_path TEXT
            )
            """;

    public static final String CREATE_METRICS = """
            CREATE TABLE IF NOT EXISTS metrics (
                run_id TEXT,
                key TEXT,
                value REAL,
                PRIMARY KEY (run_id, key)
            )
            """;

    public static final String CREATE_INCIDENTS = """
            CREATE TABLE IF NOT EXISTS incidents (
                id TEXT PRIMARY KEY,
                run_id TEXT,
                severity TEXT,
                description TEXT,
                log_excerpt_path TEXT,
                created_utc TEXT
            )
            """;
}
