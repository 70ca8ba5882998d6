package com.example.bom_flattener.bom;

import com.example.bom_flattener.entity.Item;

import java.util.List;

/**
 *  텍스트 트리 출력
 * <pre>
 * SKA-100
 * ├── SK1001-01 x1  Deck
 * ├── TR-01 x2
 * │   ├── SK1002-01 x1  Truck
 * ...
 * </pre>
 */
final class BomTreeRenderer {

    private static final String BRANCH = "├── ";
    private static final String LAST_BRANCH = "└── ";
    private static final String PIPE = "│   ";
    private static final String SPACE = "    ";

    private BomTreeRenderer() {
    }

    static String render(BomNode root) {
        StringBuilder out = new StringBuilder(root.getPartNumber());
        renderChildren(root, "", out);
        return out.toString();
    }

    private static void renderChildren(BomNode node, String prefix, StringBuilder out) {
        List<BomChild> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            BomChild child = children.get(i);
            boolean last = i == children.size() - 1;
            out.append('\n')
                    .append(prefix)
                    .append(last ? LAST_BRANCH : BRANCH)
                    .append(label(child, node.getCatalog()));
            if (child.isAssembly()) {
                renderChildren(child.getNode(), prefix + (last ? SPACE : PIPE), out);
            }
        }
    }

    private static String label(BomChild child, PartsCatalog catalog) {
        String label = child.getPartNumber() + " x" + Quantities.normalize(child.getQuantity()).toPlainString();
        String name = catalog.find(child.getPartNumber())
                .map(Item::getName)
                .orElse(null);
        return name == null || name.isBlank() ? label : label + "  " + name;
    }
}
