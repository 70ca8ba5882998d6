package com.example.bom_flattener.service.dto;

import com.example.bom_flattener.entity.Item;
import com.example.bom_flattener.entity.enumclass.ItemKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogItemResponse {

    private String partNumber;
    private String name;
    private String description;
    private String supplier;
    private String supplierPartNumber;
    private int packageQuantity;
    private BigDecimal packagePrice;
    private ItemKind kind;

    // Item -> Dto
    public static CatalogItemResponse from(Item item) {
        return CatalogItemResponse.builder()
                .partNumber(item.getPartNumber())
                .name(item.getName())
                .description(item.getDescription())
                .supplier(item.getSupplier())
                .supplierPartNumber(item.getSupplierPartNumber())
                .packageQuantity(item.getPackageQuantity())
                .packagePrice(item.getPackagePrice())
                .kind(item.getKind())
                .build();
    }
}
