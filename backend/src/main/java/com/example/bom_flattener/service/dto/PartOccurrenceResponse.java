package com.example.bom_flattener.service.dto;

import com.example.bom_flattener.bom.PartOccurrence;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PartOccurrenceResponse {

    private String partNumber;
    private String name;
    private BigDecimal quantity;
    private BigDecimal effectiveQuantity;
    private List<String> path;

    // PartOccurrence -> Dto
    public static PartOccurrenceResponse from(PartOccurrence occurrence) {
        return PartOccurrenceResponse.builder()
                .partNumber(occurrence.getPartNumber())
                .name(occurrence.getItem().getName())
                .quantity(occurrence.getQuantity())
                .effectiveQuantity(occurrence.getEffectiveQuantity())
                .path(occurrence.getPath())
                .build();
    }
}
