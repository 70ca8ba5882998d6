package com.example.bom_flattener.bom;

import com.example.bom_flattener.entity.ItemLink;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 *  파싱된 부품 마스터 + 어셈블리별 구성 레코드
 */
@Getter
public class BomWorkbook {

    private final PartsCatalog catalog;
    private final Map<String, List<ItemLink>> assemblies;

    public BomWorkbook(PartsCatalog catalog, Map<String, List<ItemLink>> assemblies) {
        this.catalog = catalog;
        this.assemblies = assemblies;
    }

    public BomTreeBuilder treeBuilder() {
        return new BomTreeBuilder(catalog, assemblies);
    }
}
