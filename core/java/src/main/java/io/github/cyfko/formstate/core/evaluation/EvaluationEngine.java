package io.github.cyfko.formstate.core.evaluation;

import io.github.cyfko.formstate.core.dependency.EvaluationOrder;
import io.github.cyfko.formstate.core.dependency.ExpressionKind;
import io.github.cyfko.formstate.core.dependency.ExpressionNode;
import io.github.cyfko.formstate.core.model.Answer;
import io.github.cyfko.formstate.core.model.AnswerOption;
import io.github.cyfko.formstate.core.model.EnableBehavior;
import io.github.cyfko.formstate.core.model.EnableWhen;
import io.github.cyfko.formstate.core.model.Expression;
import io.github.cyfko.formstate.core.model.FormDefinition;
import io.github.cyfko.formstate.core.model.Item;
import io.github.cyfko.formstate.core.model.ItemType;
import io.github.cyfko.formstate.core.model.ResponseIndex;
import io.github.cyfko.formstate.core.model.ResponseNode;
import io.github.cyfko.formstate.core.model.ResponseTree;
import io.github.cyfko.formstate.core.spi.EvaluationContext;
import io.github.cyfko.formstate.core.spi.EvaluationResult;
import io.github.cyfko.formstate.core.spi.ExpressionEvaluator;
import io.github.cyfko.formstate.core.sync.ResponseTreeSynchronizer;
import io.github.cyfko.formstate.core.utils.AnswerValues;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the expressions of a definition against a response tree.
 *
 * <h2>Pass</h2>
 * <p>
 * A pass walks the {@link EvaluationOrder} once. Every expression node is evaluated for each
 * response node it applies to (all nodes of its item, the root for form-level variables, the
 * parent of the slot for enable conditions of repeated groups), but only when the expression is
 * affected by the changed link ids or has never been evaluated for that response node. A result
 * that differs from the previous one marks everything downstream as affected.
 * </p>
 *
 * <h2>Failures</h2>
 * <p>
 * Failures and cycles never abort a pass. They are recorded as {@link ExpressionError}s and the
 * expression kind's default applies:
 * </p>
 * <ul>
 *   <li>variable: absent</li>
 *   <li>enable condition: enabled</li>
 *   <li>calculated value, initial expression: answers left unchanged</li>
 *   <li>answer options: static options</li>
 *   <li>options toggle: false</li>
 * </ul>
 *
 * <p>The engine mutates the tree it is given; callers pass a copy.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class EvaluationEngine {

    private static final Logger logger = Logger.getLogger(EvaluationEngine.class.getName());

    /** Extra sweeps for nodes created by calculated values below nested items. */
    private static final int MAX_SWEEPS = 4;

    private final FormDefinition definition;
    private final EvaluationOrder order;
    private final ExpressionEvaluator evaluator;
    private final ResponseTreeSynchronizer synchronizer;

    public EvaluationEngine(FormDefinition definition, EvaluationOrder order, ExpressionEvaluator evaluator) {
        this.definition = Objects.requireNonNull(definition, "definition cannot be null");
        this.order = Objects.requireNonNull(order, "order cannot be null");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator cannot be null");
        this.synchronizer = new ResponseTreeSynchronizer();
    }

    /**
     * Result of a pass.
     *
     * @param tree        the evaluated tree, with calculated answers written
     * @param state       the new evaluation state
     * @param form        the tree read through the new state
     * @param evaluations number of expression evaluations performed
     */
    public record PassResult(ResponseTree tree, EvaluationState state, EvaluatedForm form, int evaluations) {
    }

    /**
     * Evaluates what the given changes affect.
     *
     * @param tree           tree to evaluate, mutated in place
     * @param changedLinkIds link ids whose answers or instances changed since the previous pass
     * @param previous       state of the previous pass
     * @param full           re-evaluate everything, whatever changed
     * @param launchContext  values supplied when the session was opened
     * @return the pass result
     */
    public PassResult evaluate(ResponseTree tree, Collection<String> changedLinkIds, EvaluationState previous,
                               boolean full, Map<String, Object> launchContext) {
        return evaluate(tree, changedLinkIds, List.of(), previous, full, launchContext);
    }

    /**
     * Evaluates what the given changes affect, and re-runs the calculated expressions of the
     * given items with everything downstream of them.
     *
     * @param recalculated items whose calculated value must be recomputed, e.g. after their answers
     *                     stopped being marked as edited by the user
     */
    public PassResult evaluate(ResponseTree tree, Collection<String> changedLinkIds, Collection<Item> recalculated,
                               EvaluationState previous, boolean full, Map<String, Object> launchContext) {
        long start = System.nanoTime();
        Pass pass = new Pass(tree, previous.toBuilder(), launchContext);
        pass.affected.addAll(full ? order.nodes() : order.affectedBy(changedLinkIds));
        for (Item item : recalculated) {
            for (ExpressionNode node : order.nodesOf(item)) {
                if (node.kind() == ExpressionKind.CALCULATED) {
                    pass.affected.addAll(order.downstreamOf(node));
                }
            }
        }

        int sweeps = 0;
        do {
            pass.structureChanged = false;
            pass.sweep();
            sweeps++;
        } while (pass.structureChanged && pass.hasFreshTargets() && sweeps < MAX_SWEEPS);

        pass.state.prune(pass.index);
        EvaluationState state = pass.state.build();
        EvaluatedForm form = new EvaluatedForm(definition, pass.index, state, launchContext);

        int evaluations = pass.evaluations;
        int finalSweeps = sweeps;
        logger.fine(() -> String.format("Evaluation pass on '%s': %d evaluation(s), %d sweep(s), %d error(s) in %d µs",
                definition.getId(), evaluations, finalSweeps, state.errors().size(), (System.nanoTime() - start) / 1000));
        return new PassResult(tree, state, form, evaluations);
    }

    /**
     * Mutable working set of one pass.
     */
    private final class Pass {
        private final ResponseTree tree;
        private final EvaluationState.Builder state;
        private final Map<String, Object> launchContext;
        private final Set<ExpressionNode> affected = new HashSet<>();
        private ResponseIndex index;
        private EvaluatedForm form;
        private boolean structureChanged;
        private int evaluations;

        Pass(ResponseTree tree, EvaluationState.Builder state, Map<String, Object> launchContext) {
            this.tree = tree;
            this.state = state;
            this.launchContext = launchContext;
            reindex();
            state.prune(index);
        }

        void reindex() {
            index = ResponseIndex.build(definition, tree);
            form = new EvaluatedForm(definition, index, state, launchContext);
        }

        void sweep() {
            for (ExpressionNode node : order.nodes()) {
                boolean isAffected = affected.contains(node);
                boolean changed = false;
                for (ResponseNode target : targetsOf(node)) {
                    TargetKey key = new TargetKey(target.getNodeId(), node.id());
                    boolean fresh = !state.wasEvaluated(key);
                    if (!isAffected && !fresh) continue;
                    if (evaluateTarget(node, target, key, fresh)) {
                        changed = true;
                    }
                    state.markEvaluated(key);
                }
                if (changed) {
                    affected.addAll(order.downstreamOf(node));
                }
                if (structureChanged) {
                    reindex();
                }
            }
            affected.clear();
        }

        boolean hasFreshTargets() {
            for (ExpressionNode node : order.nodes()) {
                for (ResponseNode target : targetsOf(node)) {
                    if (!state.wasEvaluated(new TargetKey(target.getNodeId(), node.id()))) return true;
                }
            }
            return false;
        }

        private List<ResponseNode> targetsOf(ExpressionNode node) {
            if (node.isFormLevel()) {
                return List.of(tree.getRoot());
            }
            if (isSlotCondition(node)) {
                Optional<Item> parentItem = definition.parentOf(node.item());
                return parentItem.isEmpty() ? List.of(tree.getRoot()) : index.nodesOf(parentItem.get());
            }
            return index.nodesOf(node.item());
        }

        private boolean evaluateTarget(ExpressionNode node, ResponseNode target, TargetKey key, boolean fresh) {
            if (order.isCyclic(node)) {
                record(node, target, key, "Expression is part of a dependency cycle", true);
                return applyDefault(node, target);
            }
            return switch (node.kind()) {
                case VARIABLE -> evaluateVariable(node, target, key);
                case INITIAL -> fresh && evaluateInitial(node, target, key);
                case ENABLE_WHEN -> evaluateEnableWhen(node, target, key);
                case CALCULATED -> evaluateCalculated(node, target, key);
                case ANSWER_OPTIONS -> evaluateAnswerOptions(node, target, key);
                case ANSWER_OPTIONS_TOGGLE -> evaluateToggle(node, target, key);
                case CONSTRAINT -> false;
            };
        }

        private boolean applyDefault(ExpressionNode node, ResponseNode target) {
            return switch (node.kind()) {
                case VARIABLE -> state.putVariable(target.getNodeId(), node.variableName(), null);
                case ENABLE_WHEN -> putEnabled(node, target, true);
                case ANSWER_OPTIONS -> state.putBaseOptions(target.getNodeId(), null) | pruneAnswers(target);
                case ANSWER_OPTIONS_TOGGLE -> state.putToggle(target.getNodeId(), node.declarationIndex(), false)
                        | pruneAnswers(target);
                case INITIAL, CALCULATED, CONSTRAINT -> false;
            };
        }

        // ==================== Expression kinds ====================

        private boolean evaluateVariable(ExpressionNode node, ResponseNode target, TargetKey key) {
            EvaluationResult result = call(node.expression(), contextOf(node, target));
            if (!result.isSuccess()) {
                record(node, target, key, result.error(), false);
                return state.putVariable(target.getNodeId(), node.variableName(), null);
            }
            state.clearError(key);
            return state.putVariable(target.getNodeId(), node.variableName(), result.values());
        }

        /**
         * Initial expressions seed a node once, when it has no answers: static initial values and
         * restored answers take precedence.
         */
        private boolean evaluateInitial(ExpressionNode node, ResponseNode target, TargetKey key) {
            if (target.hasAnswers()) return false;
            EvaluationResult result = call(node.expression(), contextOf(node, target));
            if (!result.isSuccess()) {
                record(node, target, key, result.error(), false);
                return false;
            }
            state.clearError(key);
            List<Object> values = coerce(node, target, key, result.values());
            if (values == null || values.isEmpty()) return false;
            writeAnswers(node.item(), target, values);
            return true;
        }

        private boolean evaluateEnableWhen(ExpressionNode node, ResponseNode target, TargetKey key) {
            Item item = node.item();
            EvaluationContext context = contextOf(node, target);
            boolean enabled;
            if (node.expression() != null) {
                EvaluationResult result = call(node.expression(), context);
                if (result.isSuccess()) {
                    state.clearError(key);
                    enabled = result.isTrue();
                } else {
                    record(node, target, key, result.error(), false);
                    enabled = true;
                }
            } else {
                enabled = evaluateConditions(item, context);
            }
            return putEnabled(node, target, enabled);
        }

        private boolean putEnabled(ExpressionNode node, ResponseNode target, boolean enabled) {
            if (isSlotCondition(node)) {
                return state.putSlotEnabled(new SlotKey(target.getNodeId(), node.item().getLinkId()), enabled);
            }
            return state.putEnabled(target.getNodeId(), enabled);
        }

        /**
         * Calculated values never overwrite answers the user edited. The value is written only when
         * it differs from the current answers.
         */
        private boolean evaluateCalculated(ExpressionNode node, ResponseNode target, TargetKey key) {
            if (target.getAnswers().stream().anyMatch(Answer::isUserEdited)) return false;
            EvaluationResult result = call(node.expression(), contextOf(node, target));
            if (!result.isSuccess()) {
                record(node, target, key, result.error(), false);
                return false;
            }
            List<Object> values = coerce(node, target, key, result.values());
            if (values == null) return false;
            state.clearError(key);
            state.putCalculated(target.getNodeId(), values);
            if (sameValues(target.answerValues(), values)) return false;
            writeAnswers(node.item(), target, values);
            return true;
        }

        private boolean evaluateAnswerOptions(ExpressionNode node, ResponseNode target, TargetKey key) {
            EvaluationResult result = call(node.expression(), contextOf(node, target));
            boolean changed;
            if (result.isSuccess()) {
                state.clearError(key);
                List<Object> options = new ArrayList<>();
                for (Object value : result.values()) {
                    options.add(value instanceof AnswerOption option ? option.value() : value);
                }
                changed = state.putBaseOptions(target.getNodeId(), options);
            } else {
                record(node, target, key, result.error(), false);
                changed = state.putBaseOptions(target.getNodeId(), null);
            }
            return pruneAnswers(target) | changed;
        }

        private boolean evaluateToggle(ExpressionNode node, ResponseNode target, TargetKey key) {
            EvaluationResult result = call(node.expression(), contextOf(node, target));
            boolean on;
            if (result.isSuccess()) {
                state.clearError(key);
                on = result.isTrue();
            } else {
                record(node, target, key, result.error(), false);
                on = false;
            }
            return state.putToggle(target.getNodeId(), node.declarationIndex(), on) | pruneAnswers(target);
        }

        // ==================== Helpers ====================

        private EvaluationContext contextOf(ExpressionNode node, ResponseNode target) {
            return form.contextFor(target, node.item());
        }

        private EvaluationResult call(Expression expression, EvaluationContext context) {
            evaluations++;
            try {
                EvaluationResult result = evaluator.evaluate(expression, context);
                return result == null ? EvaluationResult.failure("Evaluator returned no result") : result;
            } catch (RuntimeException e) {
                logger.log(Level.FINE, "Evaluator failed on '" + expression.expression() + "'", e);
                return EvaluationResult.failure(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            }
        }

        /**
         * @return the values converted to the item's answer type, a single one for non-repeating
         * items, or null (with an error recorded) when a value does not fit the type
         */
        private List<Object> coerce(ExpressionNode node, ResponseNode target, TargetKey key, List<Object> values) {
            Item item = node.item();
            List<Object> coerced = new ArrayList<>();
            for (Object value : values) {
                if (value == null) continue;
                Optional<Object> converted = AnswerValues.coerce(item.getType(), value);
                if (converted.isEmpty()) {
                    record(node, target, key, "Value '" + value + "' is not a valid " + item.getType() + " answer", false);
                    return null;
                }
                coerced.add(converted.get());
            }
            if (!item.isRepeats() && coerced.size() > 1) {
                return List.of(coerced.get(0));
            }
            return coerced;
        }

        private void writeAnswers(Item item, ResponseNode target, List<Object> values) {
            List<Answer> answers = new ArrayList<>();
            for (Object value : values) {
                answers.add(Answer.of(value));
            }
            target.replaceAnswers(answers);
            if (item.hasNestedItemsUnderAnswers()) {
                synchronizer.sync(tree, item, target);
                structureChanged = true;
            }
        }

        /**
         * Drops answers of a choice node that its options no longer offer. Open choices keep
         * free-text answers.
         */
        private boolean pruneAnswers(ResponseNode target) {
            Optional<Item> item = index.itemOf(target);
            if (item.isEmpty() || !item.get().getType().isChoice() || !target.hasAnswers()) return false;
            if (!form.hasOptionSource(target)) return false;
            List<Object> options = form.optionsFor(target);
            boolean open = item.get().getType() == ItemType.OPEN_CHOICE;
            List<Answer> kept = new ArrayList<>();
            for (Answer answer : target.getAnswers()) {
                Object value = answer.getValue();
                if ((open && value instanceof String) || options.stream().anyMatch(o -> AnswerValues.sameValue(o, value))) {
                    kept.add(answer);
                }
            }
            if (kept.size() == target.getAnswers().size()) return false;
            int dropped = target.getAnswers().size() - kept.size();
            target.replaceAnswers(kept);
            logger.fine(() -> String.format("Dropped %d answer(s) of '%s' no longer offered", dropped, target.getLinkId()));
            if (item.get().hasNestedItemsUnderAnswers()) {
                structureChanged = true;
            }
            return true;
        }

        private void record(ExpressionNode node, ResponseNode target, TargetKey key, String message, boolean cyclic) {
            String location;
            if (target.isRoot()) {
                location = node.isFormLevel() ? "<form>" : node.item().getLinkId();
            } else if (isSlotCondition(node)) {
                location = ResponseTree.pathOf(target).child(node.item().getLinkId()).toString();
            } else {
                location = ResponseTree.pathOf(target).toString();
            }
            ExpressionError error = new ExpressionError(location,
                    node.isFormLevel() ? null : node.item().getLinkId(),
                    node.kind(),
                    node.expression() == null ? null : node.expression().expression(),
                    message,
                    cyclic);
            if (!error.equals(state.recordedError(key))) {
                logger.fine(() -> String.format("Expression %s failed at %s: %s", node.label(), location, message));
            }
            state.recordError(key, error);
        }
    }

    // ==================== Declarative conditions ====================

    private static boolean isSlotCondition(ExpressionNode node) {
        return node.kind() == ExpressionKind.ENABLE_WHEN && node.item().isRepeatedGroup();
    }

    /**
     * Evaluates the declarative conditions of an item, combined with its enable behavior.
     */
    static boolean evaluateConditions(Item item, EvaluationContext context) {
        if (item.getEnableWhen().isEmpty()) return true;
        boolean all = item.getEnableBehavior() == EnableBehavior.ALL;
        for (EnableWhen condition : item.getEnableWhen()) {
            boolean holds = holds(condition, context.answers(condition.question()));
            if (all && !holds) return false;
            if (!all && holds) return true;
        }
        return all;
    }

    /**
     * One condition against the answers of its question. Without answers only
     * {@code exists = false} holds.
     */
    static boolean holds(EnableWhen condition, List<Object> answers) {
        List<Object> present = answers.stream().filter(a -> !AnswerValues.isEmpty(a)).toList();
        Object expected = condition.answer();
        return switch (condition.operator()) {
            case EXISTS -> (Boolean) expected != present.isEmpty();
            case EQUAL -> present.stream().anyMatch(a -> AnswerValues.sameValue(a, expected));
            case NOT_EQUAL -> !present.isEmpty() && present.stream().noneMatch(a -> AnswerValues.sameValue(a, expected));
            case GREATER_THAN -> present.stream().anyMatch(a -> AnswerValues.compare(a, expected).map(c -> c > 0).orElse(false));
            case LESS_THAN -> present.stream().anyMatch(a -> AnswerValues.compare(a, expected).map(c -> c < 0).orElse(false));
            case GREATER_OR_EQUAL -> present.stream().anyMatch(a -> AnswerValues.compare(a, expected).map(c -> c >= 0).orElse(false));
            case LESS_OR_EQUAL -> present.stream().anyMatch(a -> AnswerValues.compare(a, expected).map(c -> c <= 0).orElse(false));
        };
    }

    private static boolean sameValues(List<Object> current, List<Object> values) {
        if (current.size() != values.size()) return false;
        for (int i = 0; i < current.size(); i++) {
            if (!AnswerValues.sameValue(current.get(i), values.get(i))) return false;
        }
        return true;
    }
}
