package io.github.cyfko.formstate.core.evaluation;

import io.github.cyfko.formstate.core.model.Answer;
import io.github.cyfko.formstate.core.model.FormDefinition;
import io.github.cyfko.formstate.core.model.Item;
import io.github.cyfko.formstate.core.model.LinkIdPath;
import io.github.cyfko.formstate.core.model.ResponseNode;
import io.github.cyfko.formstate.core.model.ResponseTree;
import io.github.cyfko.formstate.core.spi.EvaluationContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluation scope anchored at one response node.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
final class ScopedEvaluationContext implements EvaluationContext {

    private final EvaluatedForm form;
    private final ResponseNode node;
    private final Item item;

    ScopedEvaluationContext(EvaluatedForm form, ResponseNode node, Item item) {
        this.form = form;
        this.node = node;
        this.item = item;
    }

    @Override
    public FormDefinition definition() {
        return form.definition();
    }

    @Override
    public Optional<Item> item() {
        return Optional.ofNullable(item);
    }

    @Override
    public Optional<LinkIdPath> path() {
        return node.isRoot() ? Optional.empty() : Optional.of(ResponseTree.pathOf(node));
    }

    @Override
    public Map<String, List<Object>> variables() {
        Map<String, List<Object>> merged = new LinkedHashMap<>(
                form.state().variablesAt(form.tree().getRoot().getNodeId()));
        if (!node.isRoot()) {
            List<ResponseNode> scopes = new ArrayList<>(node.ancestors());
            Collections.reverse(scopes);
            scopes.add(node);
            for (ResponseNode scope : scopes) {
                merged.putAll(form.state().variablesAt(scope.getNodeId()));
            }
        }
        return Collections.unmodifiableMap(merged);
    }

    @Override
    public Optional<List<Object>> variable(String name) {
        return Optional.ofNullable(variables().get(name));
    }

    /**
     * Searches the subtree of the current node, then the subtree of each ancestor in turn. The
     * first subtree containing a node for the link id answers, with the answers of its enabled
     * nodes.
     */
    @Override
    public List<Object> answers(String linkId) {
        ResponseNode scope = node;
        while (scope != null) {
            List<ResponseNode> matches = new ArrayList<>();
            collect(scope, linkId, matches);
            if (!matches.isEmpty()) {
                List<Object> values = new ArrayList<>();
                for (ResponseNode match : matches) {
                    if (form.isEnabled(match)) values.addAll(match.answerValues());
                }
                return values;
            }
            scope = scope.getParent();
        }
        return List.of();
    }

    private static void collect(ResponseNode scope, String linkId, List<ResponseNode> sink) {
        if (linkId.equals(scope.getLinkId())) sink.add(scope);
        for (ResponseNode child : scope.childNodes()) {
            collect(child, linkId, sink);
        }
    }

    @Override
    public List<Object> currentAnswers() {
        if (node.isRoot()) return List.of();
        return node.getAnswers().stream().map(Answer::getValue).toList();
    }

    @Override
    public Map<String, Object> launchContext() {
        return form.launchContext();
    }
}
