package com.example.bom_flattener.entity.enumclass;

import java.util.Locale;

public enum ItemKind {

    PART("part"),
    ASSEMBLY("assembly");

    private final String label;

    ItemKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     *  표 형식 레코드의 Type 값 -> ItemKind (빈 값은 part)
     */
    public static ItemKind from(String value) {
        if (value == null || value.isBlank()) {
            return PART;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ItemKind kind : values()) {
            if (kind.label.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown item kind: " + value);
    }
}
