package io.github.cyfko.formstate.core.dependency;

import io.github.cyfko.formstate.core.model.EnableWhen;
import io.github.cyfko.formstate.core.model.Expression;
import io.github.cyfko.formstate.core.model.FormDefinition;
import io.github.cyfko.formstate.core.model.Item;
import io.github.cyfko.formstate.core.spi.ReferenceExtractor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Builds the dependency graph of a definition and orders it for evaluation.
 *
 * <h2>Graph</h2>
 * <p>
 * Every expression of the definition is a node (see {@link ExpressionKind}). An edge
 * {@code P -> R} means R reads what P produces:
 * </p>
 * <ul>
 *   <li>R reads the answers of item {@code L}: the producers of L's answers are L's initial,
 *       calculated, option set and option toggle nodes, plus the enable condition nodes of L and
 *       of its ancestors, since disabled answers are invisible</li>
 *   <li>R reads variable {@code %v}: the producer is the declaration found first in R's own item,
 *       then its ancestors, then the form. Unresolved names come from the launch context and add
 *       no edge</li>
 * </ul>
 *
 * <h2>Ordering</h2>
 * <p>
 * Strongly connected components are found with Tarjan's algorithm; every node of a component
 * with more than one member, or with an edge to itself, is cyclic. The condensation is then
 * ordered with Kahn's algorithm. When several components are ready, the one holding the node
 * that comes first by {@link ExpressionNode#EVALUATION_PRIORITY} goes first, so the order is
 * fully deterministic for a given definition.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class DependencyResolver {

    private static final Logger logger = Logger.getLogger(DependencyResolver.class.getName());

    private final ReferenceExtractor extractor;

    public DependencyResolver(ReferenceExtractor extractor) {
        this.extractor = Objects.requireNonNull(extractor, "extractor cannot be null");
    }

    /**
     * Resolves the evaluation order of a definition.
     *
     * @param definition the definition
     * @return the order, with cyclic nodes flagged
     */
    public EvaluationOrder resolve(FormDefinition definition) {
        Objects.requireNonNull(definition, "definition cannot be null");
        long start = System.nanoTime();

        List<ExpressionNode> nodes = createNodes(definition);
        Map<Integer, Set<Reference>> references = new HashMap<>();
        for (ExpressionNode node : nodes) {
            references.put(node.id(), referencesOf(node));
        }

        Map<Item, List<ExpressionNode>> producers = answerProducers(definition, nodes);
        List<Set<Integer>> edges = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            edges.add(new LinkedHashSet<>());
        }
        Map<String, List<ExpressionNode>> answerReaders = new LinkedHashMap<>();

        for (ExpressionNode reader : nodes) {
            for (Reference reference : references.get(reader.id())) {
                if (reference.type() == Reference.Type.ANSWER) {
                    answerReaders.computeIfAbsent(reference.name(), k -> new ArrayList<>()).add(reader);
                    for (Item target : definition.itemsFor(reference.name())) {
                        for (ExpressionNode producer : producers.getOrDefault(target, List.of())) {
                            edges.get(producer.id()).add(reader.id());
                        }
                    }
                } else {
                    resolveVariable(definition, nodes, reader, reference.name())
                            .ifPresent(declaration -> edges.get(declaration.id()).add(reader.id()));
                }
            }
        }

        Set<Integer> cyclic = new HashSet<>();
        List<List<Integer>> components = new Tarjan(edges).components();
        for (List<Integer> component : components) {
            if (component.size() > 1 || edges.get(component.get(0)).contains(component.get(0))) {
                cyclic.addAll(component);
            }
        }

        List<ExpressionNode> ordered = order(nodes, edges, components);

        Map<Integer, List<ExpressionNode>> successors = new HashMap<>();
        for (ExpressionNode node : nodes) {
            List<ExpressionNode> next = new ArrayList<>();
            for (Integer id : edges.get(node.id())) {
                next.add(nodes.get(id));
            }
            successors.put(node.id(), List.copyOf(next));
        }
        answerReaders.replaceAll((k, v) -> List.copyOf(v));

        EvaluationOrder order = new EvaluationOrder(ordered, cyclic, successors, answerReaders, references);
        logger.fine(() -> String.format("Resolved %d expression(s) of form '%s' in %dus, %d cyclic",
                nodes.size(), definition.getId(), (System.nanoTime() - start) / 1000, cyclic.size()));
        if (!cyclic.isEmpty()) {
            logger.warning(() -> "Cyclic expressions in form '" + definition.getId() + "': "
                    + order.cyclicNodes().stream().map(ExpressionNode::label).toList());
        }
        return order;
    }

    private static List<ExpressionNode> createNodes(FormDefinition definition) {
        List<ExpressionNode> nodes = new ArrayList<>();
        List<Expression> formVariables = definition.getVariables();
        for (int i = 0; i < formVariables.size(); i++) {
            nodes.add(new ExpressionNode(nodes.size(), null, ExpressionKind.VARIABLE, formVariables.get(i), i, -1));
        }
        List<Item> items = definition.flattened();
        for (int doc = 0; doc < items.size(); doc++) {
            Item item = items.get(doc);
            List<Expression> variables = item.getVariables();
            for (int i = 0; i < variables.size(); i++) {
                nodes.add(new ExpressionNode(nodes.size(), item, ExpressionKind.VARIABLE, variables.get(i), i, doc));
            }
            if (item.getInitialExpression().isPresent()) {
                nodes.add(new ExpressionNode(nodes.size(), item, ExpressionKind.INITIAL,
                        item.getInitialExpression().get(), 0, doc));
            }
            if (item.hasEnableCondition()) {
                nodes.add(new ExpressionNode(nodes.size(), item, ExpressionKind.ENABLE_WHEN,
                        item.getEnableWhenExpression().orElse(null), 0, doc));
            }
            if (item.getCalculatedExpression().isPresent()) {
                nodes.add(new ExpressionNode(nodes.size(), item, ExpressionKind.CALCULATED,
                        item.getCalculatedExpression().get(), 0, doc));
            }
            Optional<Expression> options = item.getAnswerExpression().or(item::getCandidateExpression);
            if (options.isPresent()) {
                nodes.add(new ExpressionNode(nodes.size(), item, ExpressionKind.ANSWER_OPTIONS, options.get(), 0, doc));
            }
            for (int i = 0; i < item.getAnswerOptionsToggles().size(); i++) {
                nodes.add(new ExpressionNode(nodes.size(), item, ExpressionKind.ANSWER_OPTIONS_TOGGLE,
                        item.getAnswerOptionsToggles().get(i).expression(), i, doc));
            }
        }
        return nodes;
    }

    private Set<Reference> referencesOf(ExpressionNode node) {
        Set<Reference> references = new LinkedHashSet<>();
        if (node.expression() != null) {
            references.addAll(extractor.extract(node.expression()));
        } else if (node.kind() == ExpressionKind.ENABLE_WHEN) {
            for (EnableWhen condition : node.item().getEnableWhen()) {
                references.add(Reference.answer(condition.question()));
            }
        }
        return Set.copyOf(references);
    }

    private static Map<Item, List<ExpressionNode>> answerProducers(FormDefinition definition, List<ExpressionNode> nodes) {
        Map<Item, List<ExpressionNode>> own = new IdentityHashMap<>();
        Map<Item, ExpressionNode> enablement = new IdentityHashMap<>();
        for (ExpressionNode node : nodes) {
            if (node.isFormLevel()) continue;
            if (node.kind().producesAnswers()) {
                own.computeIfAbsent(node.item(), k -> new ArrayList<>()).add(node);
            } else if (node.kind() == ExpressionKind.ENABLE_WHEN) {
                enablement.put(node.item(), node);
            }
        }
        Map<Item, List<ExpressionNode>> producers = new IdentityHashMap<>();
        for (Item item : definition.flattened()) {
            List<ExpressionNode> list = new ArrayList<>(own.getOrDefault(item, List.of()));
            if (enablement.containsKey(item)) {
                list.add(enablement.get(item));
            }
            for (Item ancestor : definition.ancestorsOf(item)) {
                if (enablement.containsKey(ancestor)) {
                    list.add(enablement.get(ancestor));
                }
            }
            producers.put(item, list);
        }
        return producers;
    }

    private static Optional<ExpressionNode> resolveVariable(FormDefinition definition, List<ExpressionNode> nodes,
                                                            ExpressionNode reader, String name) {
        List<Item> scopes = new ArrayList<>();
        if (!reader.isFormLevel()) {
            scopes.add(reader.item());
            scopes.addAll(definition.ancestorsOf(reader.item()));
        }
        for (Item scope : scopes) {
            Optional<ExpressionNode> declaration = nodes.stream()
                    .filter(n -> n.item() == scope && n.kind() == ExpressionKind.VARIABLE && name.equals(n.variableName()))
                    .findFirst();
            if (declaration.isPresent()) return declaration;
        }
        return nodes.stream()
                .filter(n -> n.isFormLevel() && name.equals(n.variableName()))
                .findFirst();
    }

    private static List<ExpressionNode> order(List<ExpressionNode> nodes, List<Set<Integer>> edges,
                                              List<List<Integer>> components) {
        int[] componentOf = new int[nodes.size()];
        List<List<ExpressionNode>> members = new ArrayList<>();
        for (int c = 0; c < components.size(); c++) {
            List<ExpressionNode> list = new ArrayList<>();
            for (Integer id : components.get(c)) {
                componentOf[id] = c;
                list.add(nodes.get(id));
            }
            list.sort(ExpressionNode.EVALUATION_PRIORITY);
            members.add(list);
        }

        int[] inDegree = new int[components.size()];
        List<Set<Integer>> componentEdges = new ArrayList<>();
        for (int c = 0; c < components.size(); c++) {
            componentEdges.add(new HashSet<>());
        }
        for (int from = 0; from < nodes.size(); from++) {
            for (Integer to : edges.get(from)) {
                int a = componentOf[from];
                int b = componentOf[to];
                if (a != b && componentEdges.get(a).add(b)) {
                    inDegree[b]++;
                }
            }
        }

        PriorityQueue<Integer> ready = new PriorityQueue<>(
                Comparator.comparing((Integer c) -> members.get(c).get(0), ExpressionNode.EVALUATION_PRIORITY));
        for (int c = 0; c < components.size(); c++) {
            if (inDegree[c] == 0) ready.add(c);
        }
        List<ExpressionNode> ordered = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            int c = ready.poll();
            ordered.addAll(members.get(c));
            for (Integer next : componentEdges.get(c)) {
                if (--inDegree[next] == 0) ready.add(next);
            }
        }
        return ordered;
    }

    /**
     * Tarjan's strongly connected components, iterative so deep forms cannot overflow the stack.
     */
    private static final class Tarjan {
        private final List<Set<Integer>> edges;
        private final int[] index;
        private final int[] lowLink;
        private final boolean[] onStack;
        private final Deque<Integer> stack = new ArrayDeque<>();
        private final List<List<Integer>> components = new ArrayList<>();
        private int counter;

        Tarjan(List<Set<Integer>> edges) {
            this.edges = edges;
            this.index = new int[edges.size()];
            this.lowLink = new int[edges.size()];
            this.onStack = new boolean[edges.size()];
            Arrays.fill(index, -1);
        }

        List<List<Integer>> components() {
            for (int v = 0; v < edges.size(); v++) {
                if (index[v] == -1) visit(v);
            }
            return components;
        }

        private void visit(int root) {
            Deque<int[]> work = new ArrayDeque<>();
            Map<Integer, List<Integer>> pendingSuccessors = new HashMap<>();
            open(root, pendingSuccessors);
            work.push(new int[]{root});
            while (!work.isEmpty()) {
                int v = work.peek()[0];
                List<Integer> remaining = pendingSuccessors.get(v);
                if (!remaining.isEmpty()) {
                    int w = remaining.remove(0);
                    if (index[w] == -1) {
                        open(w, pendingSuccessors);
                        work.push(new int[]{w});
                    } else if (onStack[w]) {
                        lowLink[v] = Math.min(lowLink[v], index[w]);
                    }
                    continue;
                }
                work.pop();
                if (!work.isEmpty()) {
                    int parent = work.peek()[0];
                    lowLink[parent] = Math.min(lowLink[parent], lowLink[v]);
                }
                if (lowLink[v] == index[v]) {
                    List<Integer> component = new ArrayList<>();
                    int w;
                    do {
                        w = stack.pop();
                        onStack[w] = false;
                        component.add(w);
                    } while (w != v);
                    components.add(component);
                }
            }
        }

        private void open(int v, Map<Integer, List<Integer>> pendingSuccessors) {
            index[v] = counter;
            lowLink[v] = counter;
            counter++;
            stack.push(v);
            onStack[v] = true;
            pendingSuccessors.put(v, new ArrayList<>(edges.get(v)));
        }
    }
}
