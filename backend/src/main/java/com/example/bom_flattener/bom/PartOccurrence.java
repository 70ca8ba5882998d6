package com.example.bom_flattener.bom;

import com.example.bom_flattener.entity.Item;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.List;

/**
 *  flat() 결과의 한 줄: 트리 안에서 부품이 실제로 사용된 한 위치
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class PartOccurrence {

    private final Item item;

    // 직속 상위 어셈블리에 선언된 수량
    private final BigDecimal quantity;

    // 조회 노드부터 이 위치까지 링크 수량의 곱
    private final BigDecimal effectiveQuantity;

    // 조회 노드부터 직속 상위 어셈블리까지의 품번 경로
    private final List<String> path;

    public String getPartNumber() {
        return item.getPartNumber();
    }
}
