package com.example.bom_flattener.controller.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 *  시트 이름 -> 행 목록 (행 = 컬럼명 -> 값), 시트 순서 유지
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BomViewForm {

    @NotEmpty
    private Map<String, List<Map<String, Object>>> sheets;

    // 미지정 시 다른 어셈블리에서 참조되지 않는 어셈블리를 루트로 사용
    private String root;

    // QTY 뷰에서 조회할 품번
    private String partNumber;
}
