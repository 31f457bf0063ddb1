/**
 * Shared helper utilities: CSV reading, log path rendering, and fatal error reporting.
 */
package io.github.yok.csvreconciler.util;
