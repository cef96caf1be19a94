package io.github.cyfko.formstate.core.evaluation;

import io.github.cyfko.formstate.core.model.AnswerOption;
import io.github.cyfko.formstate.core.model.AnswerOptionsToggle;
import io.github.cyfko.formstate.core.model.FormDefinition;
import io.github.cyfko.formstate.core.model.Item;
import io.github.cyfko.formstate.core.model.ResponseIndex;
import io.github.cyfko.formstate.core.model.ResponseNode;
import io.github.cyfko.formstate.core.model.ResponseTree;
import io.github.cyfko.formstate.core.spi.EvaluationContext;
import io.github.cyfko.formstate.core.utils.AnswerValues;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A response tree read through the results of an evaluation: which nodes are enabled, which
 * options each choice offers, and the scope expressions see at each node.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class EvaluatedForm {

    private final FormDefinition definition;
    private final ResponseIndex index;
    private final StateView state;
    private final Map<String, Object> launchContext;

    EvaluatedForm(FormDefinition definition, ResponseIndex index, StateView state, Map<String, Object> launchContext) {
        this.definition = definition;
        this.index = index;
        this.state = state;
        this.launchContext = Map.copyOf(launchContext);
    }

    public FormDefinition definition() {
        return definition;
    }

    public ResponseIndex index() {
        return index;
    }

    public ResponseTree tree() {
        return index.tree();
    }

    public Optional<Item> itemOf(ResponseNode node) {
        return index.itemOf(node);
    }

    Map<String, Object> launchContext() {
        return launchContext;
    }

    StateView state() {
        return state;
    }

    /**
     * A node is enabled when its own condition holds (for a repeated group instance, the
     * condition of its slot) and its parent is enabled. Conditions not evaluated yet hold.
     */
    public boolean isEnabled(ResponseNode node) {
        if (node.isRoot()) return true;
        ResponseNode parent = node.getParent();
        boolean own = node.isRepeatedInstance() && parent != null
                ? state.slotEnabled(new SlotKey(parent.getNodeId(), node.getLinkId())).orElse(true)
                : state.ownEnabled(node.getNodeId()).orElse(true);
        if (!own) return false;
        return parent == null || isEnabled(parent);
    }

    /**
     * @param parent node the repeated group's instances live under, the root at the top level
     * @param item   the repeated group
     * @return whether instances of the group may exist and be shown there
     */
    public boolean isSlotEnabled(ResponseNode parent, Item item) {
        return state.slotEnabled(new SlotKey(parent.getNodeId(), item.getLinkId())).orElse(true)
                && isEnabled(parent);
    }

    /**
     * Options currently offered by a choice node: the evaluated answer options (or the static ones
     * when there is no answer expression or it failed), minus those switched off by toggles.
     * <p>
     * An option listed by toggles stays available when at least one of those toggles holds or has
     * not been evaluated yet. Options no toggle lists are always available.
     * </p>
     */
    public List<Object> optionsFor(ResponseNode node) {
        Optional<Item> item = itemOf(node);
        if (item.isEmpty()) return List.of();
        List<Object> base = state.baseOptions(node.getNodeId())
                .orElseGet(() -> item.get().getAnswerOptions().stream().map(AnswerOption::value).toList());
        List<AnswerOptionsToggle> toggles = item.get().getAnswerOptionsToggles();
        if (toggles.isEmpty()) return base;

        Map<Integer, Boolean> results = state.toggles(node.getNodeId());
        List<Object> available = new ArrayList<>();
        for (Object option : base) {
            boolean listed = false;
            boolean on = false;
            for (int i = 0; i < toggles.size(); i++) {
                if (toggles.get(i).options().stream().noneMatch(o -> AnswerValues.sameValue(o, option))) continue;
                listed = true;
                if (results.getOrDefault(i, Boolean.TRUE)) {
                    on = true;
                    break;
                }
            }
            if (!listed || on) available.add(option);
        }
        return available;
    }

    /**
     * @return true when the node's options come from somewhere, so answers can be checked against them
     */
    public boolean hasOptionSource(ResponseNode node) {
        Optional<Item> item = itemOf(node);
        if (item.isEmpty()) return false;
        return state.baseOptions(node.getNodeId()).isPresent() || !item.get().getAnswerOptions().isEmpty();
    }

    /**
     * @param node node to evaluate at, the root for form-level expressions
     * @return the scope of an expression of the node's item
     */
    public EvaluationContext contextFor(ResponseNode node) {
        return new ScopedEvaluationContext(this, node, node.isRoot() ? null : itemOf(node).orElse(null));
    }

    EvaluationContext contextFor(ResponseNode node, Item item) {
        return new ScopedEvaluationContext(this, node, item);
    }
}
