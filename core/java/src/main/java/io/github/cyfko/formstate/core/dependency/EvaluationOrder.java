package io.github.cyfko.formstate.core.dependency;

import io.github.cyfko.formstate.core.model.Item;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Result of dependency resolution: every expression node of a definition in a valid evaluation
 * order, the nodes caught in cycles, and the edges needed to find what a change affects.
 * <p>
 * Immutable and shared by every session of an engine.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class EvaluationOrder {

    private final List<ExpressionNode> nodes;
    private final int[] positions;
    private final Set<Integer> cyclic;
    private final Map<Integer, List<ExpressionNode>> successors;
    private final Map<String, List<ExpressionNode>> answerReaders;
    private final Map<Integer, Set<Reference>> references;

    EvaluationOrder(List<ExpressionNode> orderedNodes,
                    Set<Integer> cyclic,
                    Map<Integer, List<ExpressionNode>> successors,
                    Map<String, List<ExpressionNode>> answerReaders,
                    Map<Integer, Set<Reference>> references) {
        this.nodes = List.copyOf(orderedNodes);
        this.positions = new int[orderedNodes.size()];
        for (int i = 0; i < orderedNodes.size(); i++) {
            positions[orderedNodes.get(i).id()] = i;
        }
        this.cyclic = Set.copyOf(cyclic);
        this.successors = Map.copyOf(successors);
        this.answerReaders = Map.copyOf(answerReaders);
        this.references = Map.copyOf(references);
    }

    /**
     * @return every node, each one after everything it depends on (cycles aside)
     */
    public List<ExpressionNode> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    /**
     * @return position of the node in {@link #nodes()}
     */
    public int position(ExpressionNode node) {
        return positions[node.id()];
    }

    public boolean isCyclic(ExpressionNode node) {
        return cyclic.contains(node.id());
    }

    public List<ExpressionNode> cyclicNodes() {
        return nodes.stream().filter(this::isCyclic).toList();
    }

    /**
     * @return nodes whose result depends directly on this node's result
     */
    public List<ExpressionNode> successorsOf(ExpressionNode node) {
        return successors.getOrDefault(node.id(), List.of());
    }

    /**
     * @return nodes reading the answers of items with this link id
     */
    public List<ExpressionNode> readersOf(String linkId) {
        return answerReaders.getOrDefault(linkId, List.of());
    }

    public Set<Reference> referencesOf(ExpressionNode node) {
        return references.getOrDefault(node.id(), Set.of());
    }

    /**
     * @return nodes declared by the item, in evaluation order
     */
    public List<ExpressionNode> nodesOf(Item item) {
        return nodes.stream().filter(n -> n.item() == item).toList();
    }

    /**
     * Transitive closure of the readers of the given link ids.
     *
     * @param changedLinkIds link ids whose answers changed
     * @return affected nodes, in evaluation order
     */
    public Set<ExpressionNode> affectedBy(Collection<String> changedLinkIds) {
        List<ExpressionNode> seeds = new ArrayList<>();
        for (String linkId : changedLinkIds) {
            seeds.addAll(readersOf(linkId));
        }
        return closure(seeds);
    }

    /**
     * @return the node and everything transitively depending on it, in evaluation order
     */
    public Set<ExpressionNode> downstreamOf(ExpressionNode node) {
        return closure(List.of(node));
    }

    private Set<ExpressionNode> closure(Collection<ExpressionNode> seeds) {
        Set<ExpressionNode> result = new TreeSet<>(Comparator.comparingInt(this::position));
        Deque<ExpressionNode> pending = new ArrayDeque<>(seeds);
        while (!pending.isEmpty()) {
            ExpressionNode current = pending.pop();
            if (result.add(current)) {
                pending.addAll(successorsOf(current));
            }
        }
        return Collections.unmodifiableSet(result);
    }

    @Override
    public String toString() {
        return "EvaluationOrder[nodes=" + nodes.size() + ", cyclic=" + cyclic.size() + "]";
    }
}
