package com.foliogate.shared.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of owned resources that can be shared through a public link.
 * Each constant carries its wire value and the short segment used by the
 * type-scoped public paths (/api/public/r/{token}, /api/public/c/{token}).
 */
public enum ResourceType {

    RESUME("resume", "r"),
    COVER_LETTER("cover_letter", "c");

    private final String value;
    private final String publicSegment;

    ResourceType(String value, String publicSegment) {
        this.value = value;
        this.publicSegment = publicSegment;
    }

    public String getValue() {
        return value;
    }

    public String getPublicSegment() {
        return publicSegment;
    }

    /**
     * Parses a wire value ("resume", "cover_letter") or enum name, case-insensitively.
     * @throws IllegalArgumentException for unknown values
     */
    public static ResourceType fromValue(String raw) {
        if (raw != null) {
            for (ResourceType type : values()) {
                if (type.value.equalsIgnoreCase(raw) || type.name().equalsIgnoreCase(raw)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown resource type: " + raw);
    }

    public static Optional<ResourceType> fromPublicSegment(String segment) {
        return Arrays.stream(values())
                .filter(type -> type.publicSegment.equals(segment))
                .findFirst();
    }
}
