package com.example.bom_flattener.service;

import com.example.bom_flattener.bom.BomNode;
import com.example.bom_flattener.bom.BomTreeBuilder;
import com.example.bom_flattener.bom.BomWorkbook;
import com.example.bom_flattener.entity.enumclass.BomView;
import com.example.bom_flattener.service.dto.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

@Slf4j
@RequiredArgsConstructor
@Service
public class BomService {

    private final BomWorkbookReader bomWorkbookReader;

    /**
     *  1. BOM 트리 생성 (root 미지정 시 자동 탐색)
     */
    public BomNode loadBom(Map<String, List<Map<String, Object>>> sheets, String root) {

        BomWorkbook workbook = bomWorkbookReader.read(sheets);
        BomTreeBuilder treeBuilder = workbook.treeBuilder();

        BomNode bom = (root == null || root.isBlank())
                ? treeBuilder.build()
                : treeBuilder.build(root.trim());

        log.info("BOM loaded. root={}, parts={}, assemblies={}",
                bom.getPartNumber(), workbook.getCatalog().size(), workbook.getAssemblies().size());
        return bom;
    }

    /**
     *  2. 부품 마스터 목록 조회
     */
    public List<CatalogItemResponse> getCatalog(Map<String, List<Map<String, Object>>> sheets) {

        return bomWorkbookReader.read(sheets).getCatalog().getItems().stream()
                .map(CatalogItemResponse::from)
                .collect(Collectors.toList());
    }

    /**
     *  3. 뷰 조회
     */
    public BomViewResponse view(BomNode bom, BomView view, String partNumber) {

        BomViewResponse.BomViewResponseBuilder response = BomViewResponse.builder()
                .view(view)
                .root(bom.getPartNumber());

        switch (view) {
            case PARTS -> response.parts(bom.getParts().stream()
                    .map(PartLineResponse::from)
                    .collect(Collectors.toList()));
            case ASSEMBLIES -> response.assemblies(bom.getAssemblies().stream()
                    .map(AssemblyResponse::from)
                    .collect(Collectors.toList()));
            case FLAT -> response.flat(StreamSupport.stream(bom.flat().spliterator(), false)
                    .map(PartOccurrenceResponse::from)
                    .collect(Collectors.toList()));
            case QTY -> {
                if (partNumber == null || partNumber.isBlank()) {
                    throw new IllegalArgumentException("partNumber is required for the QTY view");
                }
                response.partNumber(partNumber.trim())
                        .quantity(bom.qty(partNumber.trim()));
            }
            case AGGREGATE -> response.aggregate(bom.aggregate());
            case SUMMARY -> response.summary(bom.summary());
            case TREE -> response.tree(bom.tree());
        }

        return response.build();
    }
}
