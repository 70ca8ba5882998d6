package com.example.bom_flattener.entity;

import com.example.bom_flattener.entity.enumclass.ItemKind;
import lombok.*;

import java.math.BigDecimal;

/**
 *  부품 마스터(카탈로그) 항목
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class Item {

    private final String partNumber;

    private final String name;
    private final String description;
    private final String supplier;
    private final String supplierPartNumber;

    @Builder.Default
    private final int packageQuantity = 1;

    @Builder.Default
    private final BigDecimal packagePrice = BigDecimal.ZERO;

    @Builder.Default
    private final ItemKind kind = ItemKind.PART;

    public boolean isAssembly() {
        return kind == ItemKind.ASSEMBLY;
    }
}
