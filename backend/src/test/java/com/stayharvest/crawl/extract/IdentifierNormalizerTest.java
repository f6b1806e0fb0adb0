package com.stayharvest.crawl.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class IdentifierNormalizerTest {
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void resolvesPrefixedTokensAndPlainNumbers() {
        assertThat(IdentifierNormalizer.normalize("listing:12345")).contains("12345");
        assertThat(IdentifierNormalizer.normalize(123)).contains("123");
        assertThat(IdentifierNormalizer.normalize(123L)).contains("123");
        assertThat(IdentifierNormalizer.normalize(new BigInteger("987654321987654321987"))).contains("987654321987654321987");
        assertThat(IdentifierNormalizer.normalize("  00042  ")).contains("00042");
        assertThat(IdentifierNormalizer.normalize("DemandStayListing:77 trailing 88")).contains("77");
    }

    @Test
    void rejectsShortBase64AndGarbage() {
        assertThat(IdentifierNormalizer.normalize("aGVsbG8=")).isEmpty();
        assertThat(IdentifierNormalizer.normalize("")).isEmpty();
        assertThat(IdentifierNormalizer.normalize("   ")).isEmpty();
        assertThat(IdentifierNormalizer.normalize("not-an-id")).isEmpty();
        assertThat(IdentifierNormalizer.normalize(-5)).isEmpty();
        assertThat(IdentifierNormalizer.normalize(1.5d)).isEmpty();
        assertThat(IdentifierNormalizer.normalize(null)).isEmpty();
    }

    @Test
    void decodesBase64GlobalIds() {
        assertThat(IdentifierNormalizer.normalize("U3RheUxpc3Rpbmc6OTg3NjU0MzI=")).contains("98765432");
        assertThat(IdentifierNormalizer.normalize("U3RheUxpc3Rpbmc6OTg3NjU0MzI")).contains("98765432");
        assertThat(IdentifierNormalizer.normalize("RGVtYW5kU3RheUxpc3Rpbmc6NTU1NjY2Nzc3LGV4dHJh")).contains("555666777");
    }

    @Test
    void readsExponentNotationAndRoomPaths() {
        assertThat(IdentifierNormalizer.normalize("1.2345e+5")).contains("123450");
        assertThat(IdentifierNormalizer.normalize("https://www.airbnb.com/rooms/556677?adults=1")).contains("556677");
        assertThat(IdentifierNormalizer.normalize("https://www.airbnb.com/rooms/556677")).contains("556677");
        assertThat(IdentifierNormalizer.normalize("/rooms/plus/31337/")).contains("31337");
        assertThat(IdentifierNormalizer.normalize("/s/rooms-nearby/4455/")).contains("4455");
    }

    @Test
    void fallsBackToContainerKeysInOrder() {
        Map<String, Object> container = new HashMap<>();
        container.put("id", "garbage");
        container.put("roomId", 9001);
        assertThat(IdentifierNormalizer.normalize(null, container)).contains("9001");

        container.put("listingId", "listing:11");
        assertThat(IdentifierNormalizer.normalize(null, container)).contains("11");
        assertThat(IdentifierNormalizer.normalize(null, Map.of())).isEmpty();
    }

    @Test
    void normalizesJsonNodes() throws Exception {
        JsonNode node = objectMapper.readTree("{\"a\": 123, \"b\": 1.0E3, \"c\": 12.5, \"d\": \"listing:9\", \"e\": true}");
        assertThat(IdentifierNormalizer.normalizeNode(node.get("a"), null)).contains("123");
        assertThat(IdentifierNormalizer.normalizeNode(node.get("b"), null)).contains("1000");
        assertThat(IdentifierNormalizer.normalizeNode(node.get("c"), null)).isEmpty();
        assertThat(IdentifierNormalizer.normalizeNode(node.get("d"), null)).contains("9");
        assertThat(IdentifierNormalizer.normalizeNode(node.get("e"), null)).isEmpty();

        JsonNode container = objectMapper.readTree("{\"id\": null, \"roomId\": \"rooms/55\"}");
        assertThat(IdentifierNormalizer.normalizeNode(null, container)).contains("55");
    }

    @Test
    void normalizationIsIdempotent() {
        List<Object> inputs = List.of(
            "listing:12345",
            123,
            "U3RheUxpc3Rpbmc6OTg3NjU0MzI=",
            "https://www.airbnb.com/rooms/556677",
            "1.2345e+5"
        );
        for (Object input : inputs) {
            Optional<String> once = IdentifierNormalizer.normalize(input);
            assertThat(once).isPresent();
            assertThat(IdentifierNormalizer.normalize(once.get())).isEqualTo(once);
        }
    }
}
