package com.example.bom_flattener.bom;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 *  수량/금액 계산 유틸리티
 */
public final class Quantities {

    private Quantities() {
    }

    /**
     *  8.000 -> 8, 1.50 -> 1.5
     */
    public static BigDecimal normalize(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }

    /**
     *  구매 수량 = ceil(총 소요량 / 포장 수량), 포장 수량이 1 이하면 총 소요량 그대로
     */
    public static BigDecimal purchaseQuantity(BigDecimal totalQuantity, int packageQuantity) {
        if (packageQuantity <= 1) {
            return normalize(totalQuantity);
        }
        return totalQuantity.divide(BigDecimal.valueOf(packageQuantity), 0, RoundingMode.CEILING);
    }

    public static BigDecimal extendedCost(BigDecimal purchaseQuantity, BigDecimal packagePrice) {
        return normalize(purchaseQuantity.multiply(packagePrice));
    }
}
