package com.rdslens.model;

/**
 * Log file listed by the control plane.
 *
 * @param name log file name, e.g. {@code error/postgresql.log.2024-01-01-10}
 * @param lastWrittenMillis epoch millis of the last write
 * @param size size in bytes, may be null
 */
public record LogFileDescriptor(String name, long lastWrittenMillis, Long size) {
}
