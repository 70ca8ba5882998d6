package com.example.bom_flattener.bom;

import com.example.bom_flattener.entity.Item;
import com.example.bom_flattener.entity.ItemLink;

import java.math.BigDecimal;
import java.util.Objects;

/**
 *  BomNode의 자식 한 줄 (부품 또는 하위 어셈블리 + 선언한 링크)
 */
public final class BomChild {

    private final ItemLink link;
    private final Item item;
    private final BomNode node;

    private BomChild(ItemLink link, Item item, BomNode node) {
        this.link = Objects.requireNonNull(link, "link");
        this.item = item;
        this.node = node;
    }

    static BomChild part(ItemLink link, Item item) {
        return new BomChild(link, Objects.requireNonNull(item, "item"), null);
    }

    static BomChild assembly(ItemLink link, BomNode node) {
        return new BomChild(link, null, Objects.requireNonNull(node, "node"));
    }

    public ItemLink getLink() {
        return link;
    }

    public String getPartNumber() {
        return link.getPartNumber();
    }

    public BigDecimal getQuantity() {
        return link.getQuantity();
    }

    public boolean isAssembly() {
        return node != null;
    }

    // 어셈블리면 null
    public Item getItem() {
        return item;
    }

    // 부품이면 null
    public BomNode getNode() {
        return node;
    }

    @Override
    public String toString() {
        return (isAssembly() ? "Assembly " : "Part ") + getPartNumber() + " x" + Quantities.normalize(getQuantity()).toPlainString();
    }
}
