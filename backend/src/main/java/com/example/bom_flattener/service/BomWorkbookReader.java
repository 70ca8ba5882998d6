package com.example.bom_flattener.service;

import com.example.bom_flattener.bom.BomWorkbook;
import com.example.bom_flattener.bom.PartsCatalog;
import com.example.bom_flattener.config.BomProperties;
import com.example.bom_flattener.entity.Item;
import com.example.bom_flattener.entity.ItemLink;
import com.example.bom_flattener.entity.enumclass.ItemKind;
import com.example.bom_flattener.exception.InvalidRecordException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.*;

/**
 *  시트별 레코드 -> BomWorkbook 변환
 *  - 부품 마스터: app.bom.parts-sheet-name 시트 (없으면 첫 시트)
 *  - 나머지 시트: 시트 이름 = 어셈블리 품번
 *  - 컬럼명은 대소문자/공백/밑줄 무시 (Pkg QTY = pkg_qty)
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class BomWorkbookReader {

    static final String PN = "pn";
    static final String QTY = "qty";
    static final String NAME = "name";
    static final String DESCRIPTION = "description";
    static final String SUPPLIER = "supplier";
    static final String SUPPLIER_PN = "supplierpn";
    static final String PKG_QTY = "pkgqty";
    static final String PKG_PRICE = "pkgprice";
    static final String COST = "cost";
    static final String TYPE = "type";
    static final String ITEM_TYPE = "itemtype";

    private final BomProperties bomProperties;

    public BomWorkbook read(Map<String, List<Map<String, Object>>> sheets) {

        if (sheets == null || sheets.size() < 2) {
            throw new InvalidRecordException("A workbook must contain a parts list and at least one assembly sheet.");
        }

        String partsSheet = findPartsSheet(sheets.keySet());
        PartsCatalog catalog = readCatalog(partsSheet, sheets.get(partsSheet));

        Map<String, List<ItemLink>> assemblies = new LinkedHashMap<>();
        sheets.forEach((sheet, rows) -> {
            if (!sheet.equals(partsSheet)) {
                assemblies.put(sheet, readAssembly(sheet, rows));
            }
        });

        log.debug("Workbook read. partsSheet={}, parts={}, assemblies={}", partsSheet, catalog.size(), assemblies.keySet());
        return new BomWorkbook(catalog, assemblies);
    }

    private String findPartsSheet(Set<String> sheetNames) {
        return sheetNames.stream()
                .filter(name -> name.equalsIgnoreCase(bomProperties.getPartsSheetName()))
                .findFirst()
                .orElseGet(() -> sheetNames.iterator().next());
    }

    PartsCatalog readCatalog(String sheet, List<Map<String, Object>> rows) {

        List<Item> items = new ArrayList<>();
        int rowIndex = 0;
        for (Map<String, Object> raw : nullSafe(rows)) {
            Map<String, Object> row = normalizeKeys(raw);
            String partNumber = requireText(sheet, rowIndex, row, PN);

            Integer packageQuantity = integer(sheet, rowIndex, row, PKG_QTY);
            if (packageQuantity != null && packageQuantity < 1) {
                throw new InvalidRecordException(sheet, rowIndex, "Pkg QTY must be at least 1: " + packageQuantity);
            }

            BigDecimal packagePrice = decimal(sheet, rowIndex, row, PKG_PRICE);
            if (packagePrice == null) {
                packagePrice = decimal(sheet, rowIndex, row, COST);
            }
            if (packagePrice != null && packagePrice.signum() < 0) {
                throw new InvalidRecordException(sheet, rowIndex, "Pkg Price must not be negative: " + packagePrice);
            }

            items.add(Item.builder()
                    .partNumber(partNumber)
                    .name(text(row, NAME))
                    .description(text(row, DESCRIPTION))
                    .supplier(text(row, SUPPLIER))
                    .supplierPartNumber(text(row, SUPPLIER_PN))
                    .packageQuantity(packageQuantity == null ? 1 : packageQuantity)
                    .packagePrice(packagePrice == null ? BigDecimal.ZERO : packagePrice)
                    .kind(kind(sheet, rowIndex, row))
                    .build());
            rowIndex++;
        }
        return PartsCatalog.of(items);
    }

    List<ItemLink> readAssembly(String sheet, List<Map<String, Object>> rows) {

        List<ItemLink> links = new ArrayList<>();
        int rowIndex = 0;
        for (Map<String, Object> raw : nullSafe(rows)) {
            Map<String, Object> row = normalizeKeys(raw);
            String partNumber = requireText(sheet, rowIndex, row, PN);
            BigDecimal quantity = decimal(sheet, rowIndex, row, QTY);
            if (quantity == null || quantity.signum() <= 0) {
                throw new InvalidRecordException(sheet, rowIndex, "QTY must be a positive number for " + partNumber);
            }
            links.add(ItemLink.of(partNumber, quantity));
            rowIndex++;
        }
        return links;
    }

    private ItemKind kind(String sheet, int rowIndex, Map<String, Object> row) {
        String value = text(row, TYPE);
        if (value == null) {
            value = text(row, ITEM_TYPE);
        }
        try {
            return ItemKind.from(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidRecordException(sheet, rowIndex, e.getMessage(), e);
        }
    }

    private static List<Map<String, Object>> nullSafe(List<Map<String, Object>> rows) {
        return rows == null ? List.of() : rows;
    }

    private static Map<String, Object> normalizeKeys(Map<String, Object> row) {
        Map<String, Object> normalized = new HashMap<>();
        if (row != null) {
            row.forEach((key, value) -> normalized.putIfAbsent(normalizeKey(key), value));
        }
        return normalized;
    }

    static String normalizeKey(String key) {
        return key == null ? "" : key.replace(" ", "").replace("_", "").toLowerCase(Locale.ROOT);
    }

    private static String requireText(String sheet, int rowIndex, Map<String, Object> row, String column) {
        String value = text(row, column);
        if (value == null) {
            throw new InvalidRecordException(sheet, rowIndex, "missing " + column.toUpperCase(Locale.ROOT));
        }
        return value;
    }

    /**
     *  숫자 품번(1001.0)은 1001로 변환
     */
    private static String text(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null) {
            return null;
        }
        String text = value instanceof Number
                ? new BigDecimal(value.toString()).stripTrailingZeros().toPlainString()
                : value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    private static BigDecimal decimal(String sheet, int rowIndex, Map<String, Object> row, String column) {
        String value = text(row, column);
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            throw new InvalidRecordException(sheet, rowIndex, "not a number in " + column + ": " + value, e);
        }
    }

    private static Integer integer(String sheet, int rowIndex, Map<String, Object> row, String column) {
        BigDecimal value = decimal(sheet, rowIndex, row, column);
        if (value == null) {
            return null;
        }
        try {
            return value.stripTrailingZeros().intValueExact();
        } catch (ArithmeticException e) {
            throw new InvalidRecordException(sheet, rowIndex, "not a whole number in " + column + ": " + value, e);
        }
    }
}
