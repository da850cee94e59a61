package com.rdslens.model;

import java.util.Locale;

/**
 * Dimension groups supported by the top-load tool, mapped to Performance Insights group names.
 */
public enum LoadDimension {
    STATEMENT("db.sql", "db.sql.statement"),
    USER("db.user", "db.user.name"),
    WAIT_EVENT("db.wait_event", "db.wait_event.name");

    private final String group;
    private final String nameKey;

    LoadDimension(String group, String nameKey) {
        this.group = group;
        this.nameKey = nameKey;
    }

    public String getGroup() {
        return group;
    }

    /**
     * Dimension key holding the human readable value for this group.
     */
    public String getNameKey() {
        return nameKey;
    }

    /**
     * Parse a user supplied dimension name. Accepts {@code statement}, {@code sql}, {@code user},
     * {@code wait_event}, {@code wait-event}, {@code wait}, or the raw Performance Insights group.
     *
     * @param raw dimension name, null or blank means {@link #STATEMENT}
     * @return dimension
     * @throws IllegalArgumentException when the name is unknown
     */
    public static LoadDimension parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return STATEMENT;
        }
        String v = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        switch (v) {
            case "statement":
            case "sql":
            case "db.sql":
                return STATEMENT;
            case "user":
            case "db.user":
                return USER;
            case "wait_event":
            case "wait":
            case "db.wait_event":
                return WAIT_EVENT;
            default:
                throw new IllegalArgumentException("Unsupported load dimension: " + raw);
        }
    }
}
