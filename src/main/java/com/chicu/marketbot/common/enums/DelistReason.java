package com.chicu.marketbot.common.enums;

/**
 * Причина снятия лота. BitSkins не всегда присылает её явно.
 */
public enum DelistReason {
    SOLD("sold"),
    DELISTED("delisted"),
    UNKNOWN("Unknown");

    private final String value;

    DelistReason(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static DelistReason parse(String raw) {
        if (raw == null || raw.isBlank()) return UNKNOWN;
        return switch (raw.trim().toLowerCase()) {
            case "sold", "sale", "bought" -> SOLD;
            case "delisted", "removed", "withdrawn" -> DELISTED;
            default -> UNKNOWN;
        };
    }
}
