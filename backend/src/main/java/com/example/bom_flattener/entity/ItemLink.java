package com.example.bom_flattener.entity;

import lombok.*;

import java.math.BigDecimal;

/**
 *  상위 어셈블리가 직접 요구하는 (품번, 수량) 한 줄
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class ItemLink {

    private final String partNumber;
    private final BigDecimal quantity;

    public static ItemLink of(String partNumber, BigDecimal quantity) {
        return new ItemLink(partNumber, quantity);
    }

    public static ItemLink of(String partNumber, long quantity) {
        return new ItemLink(partNumber, BigDecimal.valueOf(quantity));
    }
}
