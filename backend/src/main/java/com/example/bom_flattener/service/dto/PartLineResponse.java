package com.example.bom_flattener.service.dto;

import com.example.bom_flattener.bom.BomChild;
import com.example.bom_flattener.bom.Quantities;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PartLineResponse {

    private String partNumber;
    private String name;
    private BigDecimal quantity;

    // BomChild -> Dto
    public static PartLineResponse from(BomChild child) {
        return PartLineResponse.builder()
                .partNumber(child.getPartNumber())
                .name(child.getItem() == null ? null : child.getItem().getName())
                .quantity(Quantities.normalize(child.getQuantity()))
                .build();
    }
}
