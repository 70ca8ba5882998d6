package com.example.bom_flattener.service;

import com.example.bom_flattener.bom.BomNode;
import com.example.bom_flattener.bom.BomTreeBuilder;
import com.example.bom_flattener.bom.PartsCatalog;
import com.example.bom_flattener.config.BomProperties;
import com.example.bom_flattener.entity.Item;
import com.example.bom_flattener.entity.ItemLink;
import com.example.bom_flattener.entity.enumclass.BomView;
import com.example.bom_flattener.exception.NotDirectChildException;
import com.example.bom_flattener.exception.UnresolvedReferenceException;
import com.example.bom_flattener.service.dto.AssemblyResponse;
import com.example.bom_flattener.service.dto.BomViewResponse;
import com.example.bom_flattener.service.dto.CatalogItemResponse;
import com.example.bom_flattener.service.dto.PartLineResponse;
import com.example.bom_flattener.service.dto.PartOccurrenceResponse;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BomServiceTest {

    private final BomService bomService = new BomService(new BomWorkbookReader(new BomProperties()));

    @Test
    void loadBom_discoversRootWhenNotGiven() {
        BomNode bom = bomService.loadBom(WorkbookFixtures.skateboard(), null);

        assertThat(bom.getPartNumber()).isEqualTo("SKA-100");
    }

    @Test
    void loadBom_usesExplicitRoot() {
        BomNode bom = bomService.loadBom(WorkbookFixtures.skateboard(), " TR-01 ");

        assertThat(bom.getPartNumber()).isEqualTo("TR-01");
        assertThat(bom.aggregate().get("SK1003-01")).isEqualByComparingTo("8");
    }

    @Test
    void loadBom_unknownRoot_throws() {
        assertThatThrownBy(() -> bomService.loadBom(WorkbookFixtures.skateboard(), "NOPE"))
                .isInstanceOf(UnresolvedReferenceException.class);
    }

    @Test
    void view_fillsOnlyTheRequestedView() {
        BomNode bom = bomService.loadBom(WorkbookFixtures.skateboard(), null);

        BomViewResponse response = bomService.view(bom, BomView.PARTS, null);

        assertThat(response.getView()).isEqualTo(BomView.PARTS);
        assertThat(response.getRoot()).isEqualTo("SKA-100");
        assertThat(response.getParts())
                .extracting(PartLineResponse::getPartNumber)
                .containsExactly("SK1001-01", "SK1005-01", "SK1006-01", "SK1007-01");
        assertThat(response.getAggregate()).isNull();
        assertThat(response.getTree()).isNull();
    }

    @Test
    void view_partsQuantityIsNormalized() {
        PartsCatalog catalog = PartsCatalog.of(List.of(Item.builder().partNumber("P1").name("Bolt").build()));
        BomNode bom = new BomTreeBuilder(catalog, Map.of("A", List.of(ItemLink.of("P1", new BigDecimal("8.0")))))
                .build("A");

        List<PartLineResponse> parts = bomService.view(bom, BomView.PARTS, null).getParts();

        assertThat(parts).hasSize(1);
        assertThat(parts.get(0).getQuantity().toPlainString()).isEqualTo("8");
    }

    @Test
    void view_dispatchesEveryView() {
        BomNode bom = bomService.loadBom(WorkbookFixtures.skateboard(), null);

        assertThat(bomService.view(bom, BomView.ASSEMBLIES, null).getAssemblies())
                .extracting(AssemblyResponse::getPartNumber)
                .containsExactly("TR-01");
        assertThat(bomService.view(bom, BomView.FLAT, null).getFlat())
                .extracting(PartOccurrenceResponse::getPartNumber)
                .hasSize(7)
                .startsWith("SK1001-01", "SK1002-01");
        assertThat(bomService.view(bom, BomView.QTY, "TR-01").getQuantity()).isEqualByComparingTo("2");
        assertThat(bomService.view(bom, BomView.AGGREGATE, null).getAggregate()).hasSize(7);
        assertThat(bomService.view(bom, BomView.SUMMARY, null).getSummary().getTotalCost()).isEqualByComparingTo("178");
        assertThat(bomService.view(bom, BomView.TREE, null).getTree()).startsWith("SKA-100\n├── SK1001-01 x1  Deck");
    }

    @Test
    void view_qtyRequiresDirectChild() {
        BomNode bom = bomService.loadBom(WorkbookFixtures.skateboard(), null);

        assertThatThrownBy(() -> bomService.view(bom, BomView.QTY, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> bomService.view(bom, BomView.QTY, "SK1003-01"))
                .isInstanceOf(NotDirectChildException.class);
    }

    @Test
    void getCatalog_listsEveryItemInOrder() {
        List<CatalogItemResponse> catalog = bomService.getCatalog(WorkbookFixtures.skateboard());

        assertThat(catalog).hasSize(9);
        assertThat(catalog.get(0).getPartNumber()).isEqualTo("SK1001-01");
        assertThat(catalog.get(8).getPartNumber()).isEqualTo("WH-01");
    }
}
