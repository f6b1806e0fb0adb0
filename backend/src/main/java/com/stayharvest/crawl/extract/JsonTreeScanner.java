package com.stayharvest.crawl.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Bounded pre-order walk over a Jackson tree. Uses an explicit worklist, so deep documents cannot
 * overflow the stack, and stops silently once the depth or node limits are hit.
 */
public class JsonTreeScanner {
    public static final int DEFAULT_MAX_DEPTH = 64;
    public static final int DEFAULT_MAX_NODES = 200_000;
    private static final int ARRAY_PROBE_SIZE = 3;

    private final int maxDepth;
    private final int maxNodes;

    public JsonTreeScanner() {
        this(DEFAULT_MAX_DEPTH, DEFAULT_MAX_NODES);
    }

    public JsonTreeScanner(int maxDepth, int maxNodes) {
        this.maxDepth = Math.max(1, maxDepth);
        this.maxNodes = Math.max(1, maxNodes);
    }

    public enum Visit {
        DESCEND,
        SKIP_CHILDREN,
        STOP
    }

    @FunctionalInterface
    public interface Visitor {
        Visit visit(JsonNode node, int depth);
    }

    /**
     * Visits container nodes (objects and arrays) in document order. Scalars are never handed to the visitor.
     *
     * @return number of nodes visited
     */
    public int walk(JsonNode root, Visitor visitor) {
        if (root == null || !root.isContainerNode()) {
            return 0;
        }
        Set<JsonNode> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Frame> work = new ArrayDeque<>();
        work.push(new Frame(root, 0));
        int count = 0;
        while (!work.isEmpty()) {
            Frame frame = work.pop();
            if (!visited.add(frame.node())) {
                continue;
            }
            if (++count > maxNodes) {
                return count - 1;
            }
            Visit decision = visitor.visit(frame.node(), frame.depth());
            if (decision == Visit.STOP) {
                return count;
            }
            if (decision == Visit.SKIP_CHILDREN || frame.depth() >= maxDepth) {
                continue;
            }
            pushChildren(work, frame);
        }
        return count;
    }

    /**
     * Listing-shaped nodes found anywhere below {@code root}. A matched node is not walked into, so the
     * same listing cannot be collected twice.
     */
    public List<JsonNode> collectListingCandidates(JsonNode root) {
        List<JsonNode> candidates = new ArrayList<>();
        walk(root, (node, depth) -> {
            if (node.isObject()) {
                JsonNode listing = node.get("listing");
                if (listing != null && listing.isObject()) {
                    if (isTruthy(listing, "id") || isTruthy(listing, "listingId")) {
                        candidates.add(node);
                        return Visit.SKIP_CHILDREN;
                    }
                    return Visit.DESCEND;
                }
                if (looksLikeListing(node, true)) {
                    ObjectNode wrapper = JsonNodeFactory.instance.objectNode();
                    wrapper.set("listing", node);
                    candidates.add(wrapper);
                    return Visit.SKIP_CHILDREN;
                }
                return Visit.DESCEND;
            }
            int probe = Math.min(ARRAY_PROBE_SIZE, node.size());
            for (int i = 0; i < probe; i++) {
                JsonNode item = node.get(i);
                if (item != null && item.isObject() && isListingArrayElement(item)) {
                    node.forEach(candidates::add);
                    return Visit.SKIP_CHILDREN;
                }
            }
            return Visit.DESCEND;
        });
        return candidates;
    }

    /**
     * First object or array held under any of {@code keys} by some object below {@code root}.
     */
    public Optional<JsonNode> findFirstContainerUnder(JsonNode root, List<String> keys) {
        JsonNode[] found = new JsonNode[1];
        walk(root, (node, depth) -> {
            if (!node.isObject()) {
                return Visit.DESCEND;
            }
            for (String key : keys) {
                JsonNode value = node.get(key);
                if (value != null && value.isContainerNode()) {
                    found[0] = value;
                    return Visit.STOP;
                }
            }
            return Visit.DESCEND;
        });
        return Optional.ofNullable(found[0]);
    }

    /**
     * First non-blank textual value stored under {@code key} by some object below {@code root}.
     */
    public Optional<String> findFirstText(JsonNode root, String key) {
        String[] found = new String[1];
        walk(root, (node, depth) -> {
            if (node.isObject()) {
                JsonNode value = node.get(key);
                if (value != null && value.isValueNode() && !value.isNull() && !value.asText().isBlank()) {
                    found[0] = value.asText();
                    return Visit.STOP;
                }
            }
            return Visit.DESCEND;
        });
        return Optional.ofNullable(found[0]);
    }

    static boolean looksLikeListing(JsonNode node, boolean acceptDisplayPrice) {
        if (!node.has("id") && !node.has("listingId")) {
            return false;
        }
        return node.has("title") || node.has("name") || (acceptDisplayPrice && node.has("structuredDisplayPrice"));
    }

    private static boolean isListingArrayElement(JsonNode item) {
        JsonNode listing = item.get("listing");
        return (listing != null && listing.isObject()) || looksLikeListing(item, false);
    }

    private static boolean isTruthy(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return false;
        }
        if (value.isTextual()) {
            return !value.textValue().isEmpty();
        }
        if (value.isNumber()) {
            return value.asDouble() != 0.0;
        }
        return !value.isMissingNode();
    }

    private void pushChildren(Deque<Frame> work, Frame frame) {
        List<JsonNode> children = new ArrayList<>();
        Iterator<JsonNode> elements = frame.node().elements();
        while (elements.hasNext()) {
            JsonNode child = elements.next();
            if (child.isContainerNode()) {
                children.add(child);
            }
        }
        for (int i = children.size() - 1; i >= 0; i--) {
            work.push(new Frame(children.get(i), frame.depth() + 1));
        }
    }

    private record Frame(JsonNode node, int depth) {
    }
}
