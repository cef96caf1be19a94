package io.github.cyfko.formstate.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Links the nodes of a synchronized response tree to the items they answer.
 * <p>
 * Link ids are only unique among siblings, so the item of a node is found structurally: the
 * children of the root answer the top-level items, and the nodes below a node answer the children
 * of that node's item. Nodes with no matching item are left out.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ResponseIndex {

    private final ResponseTree tree;
    private final Map<Long, Item> itemsByNodeId = new HashMap<>();
    private final Map<Long, ResponseNode> nodesById = new HashMap<>();
    private final Map<Item, List<ResponseNode>> nodesByItem = new IdentityHashMap<>();
    private final List<ResponseNode> nodes = new ArrayList<>();

    private ResponseIndex(ResponseTree tree) {
        this.tree = tree;
    }

    public static ResponseIndex build(FormDefinition definition, ResponseTree tree) {
        ResponseIndex index = new ResponseIndex(tree);
        index.nodesById.put(tree.getRoot().getNodeId(), tree.getRoot());
        index.walk(tree.getRoot().getChildren(), definition.getItems());
        return index;
    }

    private void walk(List<ResponseNode> level, List<Item> items) {
        for (ResponseNode node : level) {
            Optional<Item> item = items.stream().filter(i -> i.getLinkId().equals(node.getLinkId())).findFirst();
            if (item.isEmpty()) continue;
            itemsByNodeId.put(node.getNodeId(), item.get());
            nodesById.put(node.getNodeId(), node);
            nodesByItem.computeIfAbsent(item.get(), k -> new ArrayList<>()).add(node);
            nodes.add(node);
            walk(node.getChildren(), item.get().getChildren());
            for (Answer answer : node.getAnswers()) {
                walk(answer.getChildren(), item.get().getChildren());
            }
        }
    }

    public ResponseTree tree() {
        return tree;
    }

    /**
     * @return the item a node answers, empty for the root and for unknown nodes
     */
    public Optional<Item> itemOf(ResponseNode node) {
        return Optional.ofNullable(itemsByNodeId.get(node.getNodeId()));
    }

    public Optional<ResponseNode> node(long nodeId) {
        return Optional.ofNullable(nodesById.get(nodeId));
    }

    /**
     * @return the nodes answering this item, in document order
     */
    public List<ResponseNode> nodesOf(Item item) {
        return Collections.unmodifiableList(nodesByItem.getOrDefault(item, List.of()));
    }

    /**
     * @return every indexed node except the root, in document order
     */
    public List<ResponseNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public boolean contains(long nodeId) {
        return nodesById.containsKey(nodeId);
    }
}
