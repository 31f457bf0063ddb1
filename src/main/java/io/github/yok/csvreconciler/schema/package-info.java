/**
 * Schema descriptors of the reconciled entities.
 *
 * <p>
 * Column and table descriptors are immutable and built from configuration before a run starts.
 * The core treats them as read-only input.
 * </p>
 */
package io.github.yok.csvreconciler.schema;
