package com.example.bom_flattener.bom;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

@Getter
@ToString
@Builder
public class SummaryRow {

    private final String partNumber;
    private final String name;
    private final String description;
    private final String supplier;
    private final String supplierPartNumber;
    private final int packageQuantity;
    private final BigDecimal packagePrice;

    private final BigDecimal totalQuantity;
    private final BigDecimal purchaseQuantity;
    private final BigDecimal extendedCost;
}
