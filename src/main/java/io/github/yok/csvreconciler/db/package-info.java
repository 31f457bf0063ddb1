/**
 * Database access package.
 *
 * <p>
 * Holds the per-product SQL dialects (upsert grammar, JSON parameters, identifier quoting, primary
 * key discovery) and the factory of short-lived JDBC connections.
 * </p>
 */
package io.github.yok.csvreconciler.db;
