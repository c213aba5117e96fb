package com.vtb.parity.chain;

import com.vtb.parity.TestFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class LinkGraphTest {

    private final LinkGraph graph = LinkGraph.build(TestFixtures.itemsSpecification());

    @Test
    void testEdgesFromLinks() {
        List<String> edges = graph.getEdges().stream()
            .map(edge -> edge.getSourceOperationId() + "->" + edge.getTargetOperationId())
            .collect(Collectors.toList());

        assertEquals(List.of("listItems->getItem", "createItem->getItem", "getItem->deleteItem"), edges);
    }

    @Test
    void testSuppliedParametersUseBareNames() {
        LinkGraph.Edge delete = graph.outgoing("getItem").get(0);

        assertEquals(Set.of("item_id"), delete.getSuppliedParameters(),
            "Префикс path. должен отбрасываться");
        assertEquals(Set.of("item_id"), graph.linkSuppliedParameters("deleteItem"));
        assertTrue(graph.linkSuppliedParameters("createItem").isEmpty());
    }

    @Test
    void testStartOperations() {
        assertEquals(List.of("listItems", "createItem"), graph.startOperations(),
            "Операции, чьи обязательные параметры приходят только из link, не стартовые");
    }

    @Test
    void testDescribe() {
        List<String> lines = graph.describe();

        assertEquals(3, lines.size());
        assertTrue(lines.get(1).contains("createItem") && lines.get(1).contains("GetCreated"),
            "Описание должно содержать источник и имя link");
    }
}
