/**
 * Configuration model package.
 *
 * <p>
 * Defines classes bound from {@code application.yml} and the environment: database connection
 * settings, the data directory, and the entity schema declarations.
 * </p>
 *
 * <p>
 * This package only holds configuration data; the reconciliation itself lives in {@code core}.
 * </p>
 */
package io.github.yok.csvreconciler.config;
