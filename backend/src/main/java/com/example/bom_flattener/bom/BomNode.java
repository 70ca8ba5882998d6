package com.example.bom_flattener.bom;

import com.example.bom_flattener.entity.Item;
import com.example.bom_flattener.entity.ItemLink;
import com.example.bom_flattener.exception.NotDirectChildException;

import java.math.BigDecimal;
import java.util.*;

/**
 *  어셈블리 하나의 BOM (BomTreeBuilder가 생성, 이후 변경 없음)
 *  parent는 경로 표시용으로만 사용
 */
public class BomNode {

    private final String partNumber;
    private final List<ItemLink> links;
    private final List<BomChild> children = new ArrayList<>();
    private final PartsCatalog catalog;
    private final BomNode parent;

    private Map<String, BigDecimal> aggregate;

    BomNode(String partNumber, List<ItemLink> links, PartsCatalog catalog, BomNode parent) {
        this.partNumber = Objects.requireNonNull(partNumber, "partNumber");
        this.links = List.copyOf(links);
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.parent = parent;
    }

    void addChild(BomChild child) {
        children.add(child);
    }

    public String getPartNumber() {
        return partNumber;
    }

    public List<ItemLink> getLinks() {
        return links;
    }

    public List<BomChild> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public PartsCatalog getCatalog() {
        return catalog;
    }

    public Optional<BomNode> getParent() {
        return Optional.ofNullable(parent);
    }

    public boolean isRoot() {
        return parent == null;
    }

    /**
     *  마스터 등록 정보 (최상위 제품은 없을 수 있음)
     */
    public Optional<Item> getItem() {
        return catalog.find(partNumber);
    }

    /**
     *  루트부터 이 노드까지 품번 경로 (예: [SKA-100, TR-01, WH-01])
     */
    public List<String> getPath() {
        Deque<String> path = new ArrayDeque<>();
        for (BomNode node = this; node != null; node = node.parent) {
            path.addFirst(node.partNumber);
        }
        return List.copyOf(path);
    }

    public List<BomChild> getParts() {
        return BomAggregator.parts(this);
    }

    public List<BomNode> getAssemblies() {
        return BomAggregator.assemblies(this);
    }

    /**
     *  하위 어셈블리 전체 (선언 순서 깊이 우선)
     */
    public List<BomNode> allAssemblies() {
        List<BomNode> result = new ArrayList<>();
        for (BomNode assembly : getAssemblies()) {
            result.add(assembly);
            result.addAll(assembly.allAssemblies());
        }
        return result;
    }

    /**
     *  직속 자식 수량 (중복 선언은 합산, 직속 자식이 아니면 NotDirectChildException)
     */
    public BigDecimal qty(String partNumber) {
        BigDecimal total = null;
        for (ItemLink link : links) {
            if (link.getPartNumber().equals(partNumber)) {
                total = total == null ? link.getQuantity() : total.add(link.getQuantity());
            }
        }
        if (total == null) {
            throw new NotDirectChildException(partNumber, this.partNumber);
        }
        return Quantities.normalize(total);
    }

    public Iterable<PartOccurrence> flat() {
        return BomAggregator.flat(this);
    }

    /**
     *  하위 트리 전체의 품번별 총 소요량 (최초 1회 계산 후 캐시)
     */
    public Map<String, BigDecimal> aggregate() {
        if (aggregate == null) {
            aggregate = Collections.unmodifiableMap(BomAggregator.aggregate(this));
        }
        return aggregate;
    }

    public BomSummary summary() {
        return BomSummaryBuilder.build(aggregate(), catalog);
    }

    public String tree() {
        return BomTreeRenderer.render(this);
    }

    @Override
    public String toString() {
        return partNumber;
    }
}
