package com.example.bom_flattener.bom;

import com.example.bom_flattener.entity.ItemLink;
import com.example.bom_flattener.exception.CyclicBomException;
import com.example.bom_flattener.exception.InvalidRecordException;
import com.example.bom_flattener.exception.RootNotFoundException;
import com.example.bom_flattener.exception.UnknownPartException;
import com.example.bom_flattener.exception.UnresolvedReferenceException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.example.bom_flattener.bom.BomFixtures.assembly;
import static com.example.bom_flattener.bom.BomFixtures.part;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class BomTreeBuilderTest {

    @Test
    void build_resolvesPartsAndNestedAssembliesInDeclaredOrder() {
        BomNode root = BomFixtures.skateboard();

        assertThat(root.getPartNumber()).isEqualTo("SKA-100");
        assertThat(root.isRoot()).isTrue();
        assertThat(root.getChildren())
                .extracting(BomChild::getPartNumber)
                .containsExactly("SK1001-01", "TR-01", "SK1005-01", "SK1006-01", "SK1007-01");
        assertThat(root.getChildren())
                .extracting(BomChild::isAssembly)
                .containsExactly(false, true, false, false, false);
    }

    @Test
    void build_setsParentReferencesForPath() {
        BomNode wheels = BomFixtures.skateboard().getAssemblies().get(0).getAssemblies().get(0);

        assertThat(wheels.getPartNumber()).isEqualTo("WH-01");
        assertThat(wheels.getParent()).map(BomNode::getPartNumber).contains("TR-01");
        assertThat(wheels.getPath()).containsExactly("SKA-100", "TR-01", "WH-01");
        assertThat(wheels.getItem()).map(item -> item.getName()).contains("Wheel assembly");
    }

    @Test
    void build_rootNotInCatalogIsAllowed() {
        BomNode root = BomFixtures.skateboard();

        assertThat(root.getItem()).isEmpty();
    }

    @Test
    void findRoot_returnsTheOnlyUnreferencedAssembly() {
        BomTreeBuilder builder = new BomTreeBuilder(BomFixtures.skateboardCatalog(), BomFixtures.skateboardAssemblies());

        assertThat(builder.findRoot()).isEqualTo("SKA-100");
        assertThat(builder.build().getPartNumber()).isEqualTo("SKA-100");
    }

    @Test
    void findRoot_severalCandidates_throws() {
        Map<String, List<ItemLink>> assemblies = new LinkedHashMap<>();
        assemblies.put("A", List.of(ItemLink.of("P1", 1)));
        assemblies.put("B", List.of(ItemLink.of("P1", 1)));
        BomTreeBuilder builder = new BomTreeBuilder(PartsCatalog.of(List.of(part("P1", "Bearing"))), assemblies);

        assertThatThrownBy(builder::findRoot)
                .isInstanceOf(RootNotFoundException.class)
                .hasMessageContaining("[A, B]");
    }

    @Test
    void build_cycleBetweenAssemblies_throwsWithPath() {
        Map<String, List<ItemLink>> assemblies = new LinkedHashMap<>();
        assemblies.put("A", List.of(ItemLink.of("P1", 1), ItemLink.of("B", 1)));
        assemblies.put("B", List.of(ItemLink.of("A", 2)));
        BomTreeBuilder builder = new BomTreeBuilder(
                PartsCatalog.of(List.of(part("P1", "Bearing"), assembly("A", "a"), assembly("B", "b"))), assemblies);

        CyclicBomException ex = catchThrowableOfType(() -> builder.build("A"), CyclicBomException.class);

        assertThat(ex).hasMessageContaining("A -> B -> A");
        assertThat(ex.getCycle()).containsExactly("A", "B", "A");

        // 모든 어셈블리가 서로 참조되므로 루트도 없음
        assertThatThrownBy(builder::build).isInstanceOf(RootNotFoundException.class);
    }

    @Test
    void build_selfReference_throws() {
        Map<String, List<ItemLink>> assemblies = Map.of("A", List.of(ItemLink.of("A", 1)));
        BomTreeBuilder builder = new BomTreeBuilder(PartsCatalog.of(List.of()), assemblies);

        assertThatThrownBy(() -> builder.build("A"))
                .isInstanceOf(CyclicBomException.class)
                .hasMessageContaining("A -> A");
    }

    @Test
    void build_sharedSubAssemblyIsNotACycle() {
        Map<String, List<ItemLink>> assemblies = new LinkedHashMap<>();
        assemblies.put("TOP", List.of(ItemLink.of("L", 1), ItemLink.of("R", 1)));
        assemblies.put("L", List.of(ItemLink.of("SUB", 2)));
        assemblies.put("R", List.of(ItemLink.of("SUB", 3)));
        assemblies.put("SUB", List.of(ItemLink.of("P1", 1)));

        BomNode root = new BomTreeBuilder(PartsCatalog.of(List.of(part("P1", "Bearing"))), assemblies).build("TOP");

        assertThat(root.aggregate().get("P1")).isEqualByComparingTo("5");
    }

    @Test
    void build_leafMissingFromCatalog_throwsUnknownPart() {
        Map<String, List<ItemLink>> assemblies = Map.of("A", List.of(ItemLink.of("P1", 1), ItemLink.of("GHOST", 3)));
        BomTreeBuilder builder = new BomTreeBuilder(PartsCatalog.of(List.of(part("P1", "Bearing"))), assemblies);

        assertThatThrownBy(() -> builder.build("A"))
                .isInstanceOf(UnknownPartException.class)
                .hasMessageContaining("GHOST")
                .hasMessageContaining("referencedBy=A");
    }

    @Test
    void build_catalogAssemblyWithoutRecords_throwsUnresolvedReference() {
        Map<String, List<ItemLink>> assemblies = Map.of("A", List.of(ItemLink.of("SUB", 1)));
        BomTreeBuilder builder = new BomTreeBuilder(PartsCatalog.of(List.of(assembly("SUB", "Sub"))), assemblies);

        assertThatThrownBy(() -> builder.build("A"))
                .isInstanceOf(UnresolvedReferenceException.class)
                .isNotInstanceOf(UnknownPartException.class)
                .hasMessageContaining("partNumber=SUB");
    }

    @Test
    void build_unknownRoot_throwsUnresolvedReference() {
        BomTreeBuilder builder = new BomTreeBuilder(BomFixtures.skateboardCatalog(), BomFixtures.skateboardAssemblies());

        assertThatThrownBy(() -> builder.build("SKA-999"))
                .isInstanceOf(UnresolvedReferenceException.class)
                .hasMessageContaining("SKA-999");
    }

    @Test
    void build_assemblyRecordsWinOverCatalogPartKind() {
        Map<String, List<ItemLink>> assemblies = new LinkedHashMap<>();
        assemblies.put("TOP", List.of(ItemLink.of("SUB", 2)));
        assemblies.put("SUB", List.of(ItemLink.of("P1", 3)));
        PartsCatalog catalog = PartsCatalog.of(List.of(part("P1", "Bearing"), part("SUB", "Listed as a part")));

        BomNode root = new BomTreeBuilder(catalog, assemblies).build("TOP");

        assertThat(root.getAssemblies()).extracting(BomNode::getPartNumber).containsExactly("SUB");
        assertThat(root.aggregate()).containsOnlyKeys("P1");
    }

    @Test
    void new_negativeLinkQuantity_throws() {
        Map<String, List<ItemLink>> assemblies = Map.of("A", List.of(ItemLink.of("P1", 1), ItemLink.of("P1", -3)));

        assertThatThrownBy(() -> new BomTreeBuilder(PartsCatalog.of(List.of(part("P1", "Bearing"))), assemblies))
                .isInstanceOf(InvalidRecordException.class)
                .hasMessageContaining("sheet=A")
                .hasMessageContaining("row=1")
                .hasMessageContaining("QTY must be positive");
    }

    @Test
    void new_zeroLinkQuantity_throws() {
        Map<String, List<ItemLink>> assemblies = Map.of("A", List.of(ItemLink.of("P1", BigDecimal.ZERO)));

        assertThatThrownBy(() -> new BomTreeBuilder(PartsCatalog.of(List.of(part("P1", "Bearing"))), assemblies))
                .isInstanceOf(InvalidRecordException.class)
                .hasMessageContaining("QTY must be positive");
    }

    @Test
    void new_missingLinkQuantity_throws() {
        Map<String, List<ItemLink>> assemblies = Map.of("A", List.of(ItemLink.of("P1", (BigDecimal) null)));

        assertThatThrownBy(() -> new BomTreeBuilder(PartsCatalog.of(List.of(part("P1", "Bearing"))), assemblies))
                .isInstanceOf(InvalidRecordException.class)
                .hasMessageContaining("P1");
    }

    @Test
    void new_blankLinkPartNumber_throws() {
        Map<String, List<ItemLink>> assemblies = Map.of("A", List.of(ItemLink.of("", 2)));

        assertThatThrownBy(() -> new BomTreeBuilder(PartsCatalog.of(List.of(part("P1", "Bearing"))), assemblies))
                .isInstanceOf(InvalidRecordException.class)
                .hasMessageContaining("missing PN");
    }
}
