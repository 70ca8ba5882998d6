package com.example.bom_flattener.controller;

import com.example.bom_flattener.bom.BomNode;
import com.example.bom_flattener.config.BomProperties;
import com.example.bom_flattener.controller.dto.BomViewForm;
import com.example.bom_flattener.entity.enumclass.BomView;
import com.example.bom_flattener.service.BomService;
import com.example.bom_flattener.service.dto.BomViewResponse;
import com.example.bom_flattener.service.dto.CatalogItemResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RequiredArgsConstructor
@RequestMapping("/api/v1/bom")
@RestController
public class BomController {

    private final BomService bomService;
    private final BomProperties bomProperties;

    /**
     *  1. 기본 뷰 조회
     */
    @PostMapping
    public ApiResponse<BomViewResponse> getDefaultView(@Valid @RequestBody BomViewForm bomViewForm) {

        return ApiResponse.of(render(bomProperties.getDefaultView(), bomViewForm));
    }

    /**
     *  2. 뷰 조회 (parts, assemblies, flat, qty, aggregate, summary, tree)
     */
    @PostMapping("/view/{view}")
    public ApiResponse<BomViewResponse> getView(@PathVariable(name = "view") String view,
                                                @Valid @RequestBody BomViewForm bomViewForm) {

        return ApiResponse.of(render(BomView.from(view), bomViewForm));
    }

    /**
     *  3. 부품 마스터 조회
     */
    @PostMapping("/catalog")
    public ApiResponse<List<CatalogItemResponse>> getCatalog(@Valid @RequestBody BomViewForm bomViewForm) {

        List<CatalogItemResponse> catalog = bomService.getCatalog(bomViewForm.getSheets());

        return ApiResponse.of(catalog);
    }

    private BomViewResponse render(BomView view, BomViewForm bomViewForm) {

        BomNode bom = bomService.loadBom(bomViewForm.getSheets(), bomViewForm.getRoot());

        return bomService.view(bom, view, bomViewForm.getPartNumber());
    }
}
