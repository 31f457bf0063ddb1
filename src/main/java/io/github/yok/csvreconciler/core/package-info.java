/**
 * Reconciliation pipeline: loading CSV extracts, schema validation, the raw/canonical dual write,
 * the error ledger and the orchestrating {@link io.github.yok.csvreconciler.core.ReconcileRunner}.
 */
package io.github.yok.csvreconciler.core;
