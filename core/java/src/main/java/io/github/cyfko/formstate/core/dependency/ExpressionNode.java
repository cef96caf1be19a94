package io.github.cyfko.formstate.core.dependency;

import io.github.cyfko.formstate.core.model.Expression;
import io.github.cyfko.formstate.core.model.Item;

import java.util.Comparator;
import java.util.Optional;

/**
 * One expression of the definition, as a node of the dependency graph.
 *
 * @param id               position of the node in the graph, unique per definition
 * @param item             declaring item, null for form-level variables
 * @param kind             expression kind
 * @param expression       the expression; null for an enable condition made only of declarative conditions
 * @param declarationIndex index among the item's declarations of the same kind (variables, toggles)
 * @param documentIndex    pre-order index of the item, -1 at form level
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ExpressionNode(int id, Item item, ExpressionKind kind, Expression expression,
                             int declarationIndex, int documentIndex) {

    /**
     * Deterministic tie-break order: document position, then kind priority, then declaration.
     */
    public static final Comparator<ExpressionNode> EVALUATION_PRIORITY = Comparator
            .comparingInt(ExpressionNode::documentIndex)
            .thenComparing(ExpressionNode::kind)
            .thenComparingInt(ExpressionNode::declarationIndex);

    public Optional<Item> declaringItem() {
        return Optional.ofNullable(item);
    }

    public boolean isFormLevel() {
        return item == null;
    }

    /**
     * @return the variable name of a variable node, null otherwise
     */
    public String variableName() {
        return kind == ExpressionKind.VARIABLE ? expression.name() : null;
    }

    /**
     * @return label for logs and error reports, e.g. {@code weight:CALCULATED}
     */
    public String label() {
        String owner = item == null ? "<form>" : item.getLinkId();
        String suffix = kind == ExpressionKind.VARIABLE ? "(%" + expression.name() + ")"
                : kind == ExpressionKind.ANSWER_OPTIONS_TOGGLE ? "#" + declarationIndex : "";
        return owner + ":" + kind + suffix;
    }

    @Override
    public String toString() {
        return "ExpressionNode[" + id + " " + label() + "]";
    }
}
