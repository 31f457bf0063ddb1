package io.github.yok.csvreconciler.config;

/**
 * Enumerates the database products the reconciler can write to.
 *
 * <p>
 * Each constant selects a {@link io.github.yok.csvreconciler.db.DbDialect} implementation through
 * {@link io.github.yok.csvreconciler.db.DbDialectFactory}.
 * </p>
 *
 * <ul>
 * <li>POSTGRESQL: for PostgreSQL (production target)</li>
 * <li>H2: for the H2 database (local runs and tests)</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum DialectMode {
    // INSERT ... ON CONFLICT upsert, jsonb payloads
    POSTGRESQL,
    // MERGE INTO ... KEY upsert, text payloads
    H2
}
