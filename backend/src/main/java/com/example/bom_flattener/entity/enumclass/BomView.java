package com.example.bom_flattener.entity.enumclass;

import java.util.Locale;

/**
 *  BOM 트리에서 조회할 수 있는 뷰 목록
 */
public enum BomView {

    PARTS,
    ASSEMBLIES,
    FLAT,
    QTY,
    AGGREGATE,
    SUMMARY,
    TREE;

    public static BomView from(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("BOM view name is required");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown BOM view: " + name, e);
        }
    }
}
