package com.stayharvest.crawl.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class JsonTreeScannerTest {
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void walksContainersInDocumentOrder() throws Exception {
        JsonNode root = objectMapper.readTree("{\"a\": {\"b\": [1, {\"c\": 2}]}, \"d\": {}}");
        List<Integer> depths = new ArrayList<>();

        int visited = new JsonTreeScanner().walk(root, (node, depth) -> {
            depths.add(depth);
            return JsonTreeScanner.Visit.DESCEND;
        });

        assertEquals(5, visited);
        assertEquals(List.of(0, 1, 2, 3, 1), depths);
    }

    @Test
    void deepDocumentsAreBoundedWithoutOverflow() {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        ObjectNode current = root;
        for (int i = 0; i < 10_000; i++) {
            current = current.putObject("child");
        }
        current.put("id", 1).put("title", "too deep");

        JsonTreeScanner scanner = new JsonTreeScanner(64, 200_000);
        int visited = scanner.walk(root, (node, depth) -> JsonTreeScanner.Visit.DESCEND);

        assertEquals(65, visited);
        assertThat(scanner.collectListingCandidates(root)).isEmpty();
    }

    @Test
    void nodeLimitStopsTheWalk() throws Exception {
        JsonNode root = objectMapper.readTree("[{}, {}, {}, {}, {}]");
        int visited = new JsonTreeScanner(64, 3).walk(root, (node, depth) -> JsonTreeScanner.Visit.DESCEND);
        assertEquals(3, visited);
    }

    @Test
    void collectsArraysWhoseLeadingElementsLookLikeListings() throws Exception {
        JsonNode root = objectMapper.readTree("""
            {"feed": [
              {"sectionTitle": "header"},
              {"listing": {"id": 1}},
              {"listing": {"id": 2}},
              {"listing": {"id": 3}}
            ]}
            """);

        List<JsonNode> candidates = new JsonTreeScanner().collectListingCandidates(root);

        assertEquals(4, candidates.size());
    }

    @Test
    void findsFirstContainerAndText() throws Exception {
        JsonNode root = objectMapper.readTree("""
            {"x": {"pageInfo": {"n": 1}}, "y": {"federatedSearchId": "  "}, "z": {"federatedSearchId": "fed-9"}}
            """);
        JsonTreeScanner scanner = new JsonTreeScanner();

        Optional<JsonNode> pageInfo = scanner.findFirstContainerUnder(root, List.of("pagination", "pageInfo"));
        assertThat(pageInfo).isPresent();
        assertEquals(1, pageInfo.get().path("n").asInt());
        assertThat(scanner.findFirstText(root, "federatedSearchId")).contains("fed-9");
        assertThat(scanner.findFirstText(root, "missing")).isEmpty();
    }
}
