package com.rdslens.model;

import java.util.Locale;

/**
 * Engine family of a managed instance, derived from the raw engine string reported by the control plane.
 *
 * Aurora variants ({@code aurora-mysql}, {@code aurora-postgresql}) fold into their base family.
 */
public enum EngineFamily {
    MYSQL,
    POSTGRES,
    OTHER;

    /**
     * Classify a raw engine string.
     *
     * @param engine engine string, e.g. {@code mysql}, {@code aurora-postgresql}
     * @return engine family, {@link #OTHER} when null or unrecognized
     */
    public static EngineFamily fromEngine(String engine) {
        if (engine == null) {
            return OTHER;
        }
        String v = engine.trim().toLowerCase(Locale.ROOT);
        if (v.contains("mysql")) {
            return MYSQL;
        }
        if (v.contains("postgres")) {
            return POSTGRES;
        }
        return OTHER;
    }
}
