package com.example.bom_flattener.service.dto;

import com.example.bom_flattener.bom.BomNode;
import com.example.bom_flattener.entity.Item;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssemblyResponse {

    private String partNumber;
    private String name;
    private List<String> path;
    private int childCount;

    // BomNode -> Dto
    public static AssemblyResponse from(BomNode node) {
        return AssemblyResponse.builder()
                .partNumber(node.getPartNumber())
                .name(node.getItem().map(Item::getName).orElse(null))
                .path(node.getPath())
                .childCount(node.getChildren().size())
                .build();
    }
}
