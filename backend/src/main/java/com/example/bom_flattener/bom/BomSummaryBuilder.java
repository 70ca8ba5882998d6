package com.example.bom_flattener.bom;

import com.example.bom_flattener.entity.Item;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 *  합산 수량 + 부품 마스터 = 구매 목록 (마스터 선언 순서, 어셈블리 제외)
 */
final class BomSummaryBuilder {

    private BomSummaryBuilder() {
    }

    static BomSummary build(Map<String, BigDecimal> aggregate, PartsCatalog catalog) {
        List<SummaryRow> rows = new ArrayList<>();
        for (Item item : catalog.getItems()) {
            BigDecimal total = aggregate.get(item.getPartNumber());
            if (total == null || item.isAssembly()) {
                continue;
            }
            BigDecimal purchase = Quantities.purchaseQuantity(total, item.getPackageQuantity());
            rows.add(SummaryRow.builder()
                    .partNumber(item.getPartNumber())
                    .name(item.getName())
                    .description(item.getDescription())
                    .supplier(item.getSupplier())
                    .supplierPartNumber(item.getSupplierPartNumber())
                    .packageQuantity(item.getPackageQuantity())
                    .packagePrice(item.getPackagePrice())
                    .totalQuantity(total)
                    .purchaseQuantity(purchase)
                    .extendedCost(Quantities.extendedCost(purchase, item.getPackagePrice()))
                    .build());
        }
        return new BomSummary(rows);
    }
}
