package com.example.bom_flattener.service.dto;

import com.example.bom_flattener.bom.BomSummary;
import com.example.bom_flattener.entity.enumclass.BomView;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 *  요청한 뷰에 해당하는 필드만 채워서 반환
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BomViewResponse {

    private BomView view;
    private String root;

    private List<PartLineResponse> parts;
    private List<AssemblyResponse> assemblies;
    private List<PartOccurrenceResponse> flat;
    private String partNumber;
    private BigDecimal quantity;
    private Map<String, BigDecimal> aggregate;
    private BomSummary summary;
    private String tree;
}
