package com.example.bom_flattener.bom;

import com.example.bom_flattener.entity.Item;
import com.example.bom_flattener.entity.ItemLink;
import com.example.bom_flattener.exception.CyclicBomException;
import com.example.bom_flattener.exception.InvalidRecordException;
import com.example.bom_flattener.exception.RootNotFoundException;
import com.example.bom_flattener.exception.UnknownPartException;
import com.example.bom_flattener.exception.UnresolvedReferenceException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.*;

/**
 *  어셈블리 레코드 -> BomNode 트리
 *  1. 레코드를 어셈블리 품번별로 모두 수집
 *  2. 루트부터 품번으로 참조 해석 (레코드가 있으면 하위 어셈블리, 없으면 마스터 부품)
 *  3. 해석 중인 상위 경로로 순환 참조 검출
 */
@Slf4j
public class BomTreeBuilder {

    private final PartsCatalog catalog;
    private final Map<String, List<ItemLink>> assemblies;

    public BomTreeBuilder(PartsCatalog catalog, Map<String, List<ItemLink>> assemblies) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        Map<String, List<ItemLink>> copy = new LinkedHashMap<>();
        assemblies.forEach((partNumber, links) -> {
            validate(partNumber, links);
            copy.put(partNumber, List.copyOf(links));
        });
        this.assemblies = Collections.unmodifiableMap(copy);
    }

    private static void validate(String assemblyPartNumber, List<ItemLink> links) {
        for (int row = 0; row < links.size(); row++) {
            ItemLink link = links.get(row);
            if (link.getPartNumber() == null || link.getPartNumber().isBlank()) {
                throw new InvalidRecordException(assemblyPartNumber, row, "missing PN");
            }
            BigDecimal quantity = link.getQuantity();
            if (quantity == null || quantity.signum() <= 0) {
                throw new InvalidRecordException(assemblyPartNumber, row,
                        "QTY must be positive for " + link.getPartNumber() + ": " + quantity);
            }
        }
    }

    public BomNode build() {
        return build(findRoot());
    }

    public BomNode build(String rootPartNumber) {
        if (!assemblies.containsKey(rootPartNumber)) {
            throw new UnresolvedReferenceException(rootPartNumber, "<root>");
        }
        BomNode root = resolve(rootPartNumber, null, new ArrayList<>());
        if (log.isDebugEnabled()) {
            log.debug("BOM tree built. root={}, assemblies={}, catalogParts={}",
                    rootPartNumber, root.allAssemblies().size() + 1, catalog.size());
        }
        return root;
    }

    /**
     *  다른 어셈블리가 참조하지 않는 유일한 어셈블리 (0개 또는 여러 개면 RootNotFoundException)
     */
    public String findRoot() {
        Set<String> referenced = new HashSet<>();
        assemblies.values().forEach(links -> links.forEach(link -> referenced.add(link.getPartNumber())));

        List<String> candidates = new ArrayList<>();
        for (String partNumber : assemblies.keySet()) {
            if (!referenced.contains(partNumber)) {
                candidates.add(partNumber);
            }
        }
        if (candidates.size() != 1) {
            throw new RootNotFoundException(candidates);
        }
        return candidates.get(0);
    }

    private BomNode resolve(String partNumber, BomNode parent, List<String> ancestors) {
        int seen = ancestors.indexOf(partNumber);
        if (seen >= 0) {
            List<String> cycle = new ArrayList<>(ancestors.subList(seen, ancestors.size()));
            cycle.add(partNumber);
            throw new CyclicBomException(cycle);
        }
        ancestors.add(partNumber);

        BomNode node = new BomNode(partNumber, assemblies.get(partNumber), catalog, parent);
        for (ItemLink link : node.getLinks()) {
            String childPartNumber = link.getPartNumber();

            if (assemblies.containsKey(childPartNumber)) {
                if (catalog.find(childPartNumber).map(item -> !item.isAssembly()).orElse(false)) {
                    log.warn("Catalog lists {} as a part but assembly records exist for it; treating it as an assembly",
                            childPartNumber);
                }
                node.addChild(BomChild.assembly(link, resolve(childPartNumber, node, ancestors)));
                continue;
            }

            Item item = catalog.find(childPartNumber)
                    .orElseThrow(() -> new UnknownPartException(childPartNumber, partNumber));
            if (item.isAssembly()) {
                // 카탈로그에는 어셈블리로 등록됐지만 구성 레코드가 없음
                throw new UnresolvedReferenceException(childPartNumber, partNumber);
            }
            node.addChild(BomChild.part(link, item));
        }

        ancestors.remove(ancestors.size() - 1);
        return node;
    }
}
