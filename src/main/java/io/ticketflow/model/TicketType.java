package io.ticketflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TicketType {
    FEATURE("feature"),
    TEST("test"),
    REFACTOR("refactor"),
    DOCS("docs"),
    BUGFIX("bugfix"),
    PERFORMANCE("performance"),
    SECURITY("security");

    private final String value;

    TicketType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static TicketType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return FEATURE;
        }
        for (TicketType type : values()) {
            if (type.name().equalsIgnoreCase(raw.trim()) || type.value.equalsIgnoreCase(raw.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown ticket type: " + raw);
    }

    @Override
    public String toString() {
        return value;
    }
}
