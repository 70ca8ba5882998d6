package com.example.bom_flattener.bom;

import com.example.bom_flattener.entity.Item;
import com.example.bom_flattener.entity.enumclass.ItemKind;
import com.example.bom_flattener.exception.DuplicatePartException;
import com.example.bom_flattener.exception.InvalidRecordException;
import com.example.bom_flattener.exception.UnknownPartException;

import java.util.*;

/**
 *  품번 기준 부품 마스터 (선언 순서 유지, 생성 후 변경 없음)
 */
public final class PartsCatalog {

    private static final String CATALOG = "catalog";

    private final Map<String, Item> items;

    private PartsCatalog(Map<String, Item> items) {
        this.items = Collections.unmodifiableMap(items);
    }

    public static PartsCatalog of(Collection<Item> source) {
        Map<String, Item> items = new LinkedHashMap<>();
        int row = 0;
        for (Item item : source) {
            validate(item, row);
            if (items.putIfAbsent(item.getPartNumber(), item) != null) {
                throw new DuplicatePartException(item.getPartNumber(), row);
            }
            row++;
        }
        return new PartsCatalog(items);
    }

    private static void validate(Item item, int row) {
        if (item.getPartNumber() == null || item.getPartNumber().isBlank()) {
            throw new InvalidRecordException(CATALOG, row, "missing PN");
        }
        if (item.getPackageQuantity() < 1) {
            throw new InvalidRecordException(CATALOG, row, "Pkg QTY must be at least 1: " + item.getPackageQuantity());
        }
        if (item.getPackagePrice() == null || item.getPackagePrice().signum() < 0) {
            throw new InvalidRecordException(CATALOG, row, "Pkg Price must not be negative: " + item.getPackagePrice());
        }
        if (item.getKind() == null) {
            throw new InvalidRecordException(CATALOG, row, "missing Type for " + item.getPartNumber());
        }
    }

    public Item lookup(String partNumber) {
        Item item = items.get(partNumber);
        if (item == null) {
            throw new UnknownPartException(partNumber, (String) null);
        }
        return item;
    }

    public Optional<Item> find(String partNumber) {
        return Optional.ofNullable(items.get(partNumber));
    }

    public ItemKind kindOf(String partNumber) {
        return lookup(partNumber).getKind();
    }

    public boolean contains(String partNumber) {
        return items.containsKey(partNumber);
    }

    public List<Item> getItems() {
        return List.copyOf(items.values());
    }

    public int size() {
        return items.size();
    }

    @Override
    public String toString() {
        return "Parts list with " + items.size() + " parts";
    }
}
