package com.example.bom_flattener.bom;

import java.math.BigDecimal;
import java.util.*;

/**
 *  하위 트리 전개(flat) / 수량 합산(aggregate)
 */
final class BomAggregator {

    private BomAggregator() {
    }

    static List<BomChild> parts(BomNode node) {
        List<BomChild> parts = new ArrayList<>();
        for (BomChild child : node.getChildren()) {
            if (!child.isAssembly()) {
                parts.add(child);
            }
        }
        return parts;
    }

    static List<BomNode> assemblies(BomNode node) {
        List<BomNode> assemblies = new ArrayList<>();
        for (BomChild child : node.getChildren()) {
            if (child.isAssembly()) {
                assemblies.add(child.getNode());
            }
        }
        return assemblies;
    }

    /**
     *  하위 어셈블리 합계 x 링크 수량 + 직속 부품 수량
     */
    static Map<String, BigDecimal> aggregate(BomNode node) {
        Map<String, BigDecimal> totals = new LinkedHashMap<>();
        for (BomChild child : node.getChildren()) {
            if (child.isAssembly()) {
                BigDecimal multiplier = child.getQuantity();
                child.getNode().aggregate()
                        .forEach((partNumber, quantity) -> totals.merge(partNumber, quantity.multiply(multiplier), BigDecimal::add));
            } else {
                totals.merge(child.getPartNumber(), child.getQuantity(), BigDecimal::add);
            }
        }
        totals.replaceAll((partNumber, quantity) -> Quantities.normalize(quantity));
        return totals;
    }

    static Iterable<PartOccurrence> flat(BomNode node) {
        return () -> new FlatIterator(node);
    }

    private static final class Frame {

        private final BomNode node;
        private final BigDecimal multiplier;
        private final List<String> path;
        private int index;

        private Frame(BomNode node, BigDecimal multiplier, List<String> path) {
            this.node = node;
            this.multiplier = multiplier;
            this.path = path;
        }
    }

    /**
     *  선언 순서 깊이 우선 탐색, 실제 사용 위치마다 한 건
     */
    private static final class FlatIterator implements Iterator<PartOccurrence> {

        private final Deque<Frame> stack = new ArrayDeque<>();
        private PartOccurrence next;

        private FlatIterator(BomNode root) {
            stack.push(new Frame(root, BigDecimal.ONE, List.of(root.getPartNumber())));
        }

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public PartOccurrence next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            PartOccurrence result = next;
            next = null;
            return result;
        }

        private PartOccurrence advance() {
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                List<BomChild> children = frame.node.getChildren();
                if (frame.index >= children.size()) {
                    stack.pop();
                    continue;
                }
                BomChild child = children.get(frame.index++);
                BigDecimal effective = frame.multiplier.multiply(child.getQuantity());
                if (child.isAssembly()) {
                    List<String> path = new ArrayList<>(frame.path);
                    path.add(child.getPartNumber());
                    stack.push(new Frame(child.getNode(), effective, List.copyOf(path)));
                } else {
                    return new PartOccurrence(child.getItem(), Quantities.normalize(child.getQuantity()),
                            Quantities.normalize(effective), frame.path);
                }
            }
            return null;
        }
    }
}
