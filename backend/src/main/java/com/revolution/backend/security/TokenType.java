package com.revolution.backend.security;

public enum TokenType {
    ACCESS("access"),
    REFRESH("refresh");

    private final String wireName;

    TokenType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * {@code null} for a missing or unknown value.
     */
    public static TokenType fromWireName(String value) {
        for (TokenType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        return null;
    }
}
