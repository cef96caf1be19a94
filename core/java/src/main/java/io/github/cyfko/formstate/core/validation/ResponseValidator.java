package io.github.cyfko.formstate.core.validation;

import io.github.cyfko.formstate.core.evaluation.EvaluatedForm;
import io.github.cyfko.formstate.core.model.Attachment;
import io.github.cyfko.formstate.core.model.Constraint;
import io.github.cyfko.formstate.core.model.Item;
import io.github.cyfko.formstate.core.model.ItemType;
import io.github.cyfko.formstate.core.model.LinkIdPath;
import io.github.cyfko.formstate.core.model.ResponseNode;
import io.github.cyfko.formstate.core.model.ResponseTree;
import io.github.cyfko.formstate.core.spi.AnswerConstraintValidator;
import io.github.cyfko.formstate.core.spi.EvaluationResult;
import io.github.cyfko.formstate.core.spi.ExpressionEvaluator;
import io.github.cyfko.formstate.core.spi.ItemMatcherRegistry;
import io.github.cyfko.formstate.core.utils.AnswerValues;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Validates the answers of an evaluated response.
 *
 * <p><b>Scope:</b></p>
 * <ul>
 *     <li>Only enabled nodes are validated; disabled subtrees produce no entry</li>
 *     <li>Untouched nodes are {@link ValidationResult.Status#NOT_VALIDATED} unless full
 *         validation is requested</li>
 *     <li>Each repeated group gets an extra entry under its unindexed path for its instance
 *         count ({@code required}, {@code minOccurs}, {@code maxOccurs})</li>
 * </ul>
 *
 * <p><b>Checks on a node:</b></p>
 * <ul>
 *     <li>required questions have an answer, required groups an answered descendant</li>
 *     <li>non-repeating questions have at most one answer, repeating ones respect their occurrences</li>
 *     <li>each value fits the item type, its length, its bounds, and for attachments size and
 *         MIME type</li>
 *     <li>choice answers are among the options currently offered</li>
 *     <li>constraint expressions hold; a failing expression counts as violated</li>
 *     <li>the custom validator registered for the item, if any, accepts the answers</li>
 * </ul>
 *
 * <p>Validation reads the tree and never changes it, so validating twice yields the same result.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ResponseValidator {

    private static final Logger logger = Logger.getLogger(ResponseValidator.class.getName());

    private final ExpressionEvaluator evaluator;
    private final ItemMatcherRegistry<AnswerConstraintValidator> validators;

    public ResponseValidator(ExpressionEvaluator evaluator, ItemMatcherRegistry<AnswerConstraintValidator> validators) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator cannot be null");
        this.validators = Objects.requireNonNull(validators, "validators cannot be null");
    }

    /**
     * Validates the whole response.
     *
     * @param form evaluated response
     * @param all  validate untouched nodes too
     * @return results by node path, in document order
     */
    public Map<LinkIdPath, ValidationResult> validate(EvaluatedForm form, boolean all) {
        Map<LinkIdPath, ValidationResult> results = new LinkedHashMap<>();
        ResponseNode root = form.tree().getRoot();
        walk(form, root, LinkIdPath.Segment.NO_INDEX, root.getChildren(), form.definition().getItems(), all, results);
        return results;
    }

    private void walk(EvaluatedForm form, ResponseNode parent, int answerIndex, List<ResponseNode> container,
                      List<Item> items, boolean all, Map<LinkIdPath, ValidationResult> results) {
        for (Item item : items) {
            List<ResponseNode> nodes = container.stream().filter(n -> item.getLinkId().equals(n.getLinkId())).toList();
            if (item.isRepeatedGroup()) {
                if (!form.isSlotEnabled(parent, item)) continue;
                LinkIdPath slotPath = slotPath(parent, answerIndex, item);
                boolean touched = nodes.stream().anyMatch(ResponseValidator::touchedSubtree);
                results.put(slotPath, all || touched ? validateSlot(item, nodes.size()) : ValidationResult.notValidated());
            }
            for (ResponseNode node : nodes) {
                if (!form.isEnabled(node)) continue;
                results.put(ResponseTree.pathOf(node),
                        all || node.isTouched() ? validateNode(form, node, item) : ValidationResult.notValidated());
                walk(form, node, LinkIdPath.Segment.NO_INDEX, node.getChildren(), item.getChildren(), all, results);
                for (int i = 0; i < node.getAnswers().size(); i++) {
                    walk(form, node, i, node.getAnswers().get(i).getChildren(), item.getChildren(), all, results);
                }
            }
        }
    }

    private static LinkIdPath slotPath(ResponseNode parent, int answerIndex, Item item) {
        if (parent.isRoot()) return LinkIdPath.of(item.getLinkId());
        LinkIdPath parentPath = ResponseTree.pathOf(parent);
        if (answerIndex != LinkIdPath.Segment.NO_INDEX) {
            parentPath = parentPath.withLastIndex(answerIndex);
        }
        return parentPath.child(item.getLinkId());
    }

    private static boolean touchedSubtree(ResponseNode node) {
        if (node.isTouched()) return true;
        for (ResponseNode child : node.childNodes()) {
            if (touchedSubtree(child)) return true;
        }
        return false;
    }

    /**
     * Checks the instance count of a repeated group.
     */
    public ValidationResult validateSlot(Item group, int instances) {
        List<ValidationMessage> messages = new ArrayList<>();
        if (group.isRequired() && instances == 0) {
            messages.add(ValidationMessage.error("At least one '" + group.getLinkId() + "' is required."));
        }
        group.getMinOccurs().filter(min -> instances < min).ifPresent(min ->
                messages.add(ValidationMessage.error("At least " + min + " '" + group.getLinkId() + "' required, found " + instances + ".")));
        group.getMaxOccurs().filter(max -> instances > max).ifPresent(max ->
                messages.add(ValidationMessage.error("At most " + max + " '" + group.getLinkId() + "' allowed, found " + instances + ".")));
        return ValidationResult.of(messages);
    }

    /**
     * Checks one node against its item, whether or not it was touched.
     */
    public ValidationResult validateNode(EvaluatedForm form, ResponseNode node, Item item) {
        List<ValidationMessage> messages = new ArrayList<>();
        List<Object> answers = node.answerValues().stream().filter(v -> !AnswerValues.isEmpty(v)).toList();

        if (item.getType().isQuestion()) {
            checkOccurrences(item, answers, messages);
            for (Object value : answers) {
                checkValue(form, node, item, value, messages);
            }
        } else if (item.isGroup() && item.isRequired() && !item.isRepeatedGroup() && !hasEnabledAnswer(form, node)) {
            messages.add(ValidationMessage.error("Group '" + item.getLinkId() + "' requires at least one answer."));
        }

        for (Constraint constraint : item.getConstraints()) {
            checkConstraint(form, node, constraint, messages);
        }
        Optional<AnswerConstraintValidator> custom = validators.find(item);
        custom.ifPresent(validator -> messages.addAll(validator.validate(item, answers)));
        return ValidationResult.of(messages);
    }

    private static void checkOccurrences(Item item, List<Object> answers, List<ValidationMessage> messages) {
        if (item.isRequired() && answers.isEmpty()) {
            messages.add(ValidationMessage.error("Missing answer for required field."));
        }
        if (!item.isRepeats()) {
            if (answers.size() > 1) {
                messages.add(ValidationMessage.error("Only one answer allowed, found " + answers.size() + "."));
            }
            return;
        }
        item.getMinOccurs().filter(min -> !answers.isEmpty() && answers.size() < min).ifPresent(min ->
                messages.add(ValidationMessage.error("At least " + min + " answers required.")));
        item.getMaxOccurs().filter(max -> answers.size() > max).ifPresent(max ->
                messages.add(ValidationMessage.error("At most " + max + " answers allowed.")));
    }

    private static void checkValue(EvaluatedForm form, ResponseNode node, Item item, Object value,
                                   List<ValidationMessage> messages) {
        ItemType type = item.getType();
        if (!AnswerValues.conforms(type, value)) {
            messages.add(ValidationMessage.error("Value '" + value + "' is not a valid " + type + " answer."));
            return;
        }
        if (value instanceof String text && item.getMaxLength().isPresent()
                && (type == ItemType.STRING || type == ItemType.TEXT || type == ItemType.URL || type == ItemType.OPEN_CHOICE)) {
            int max = item.getMaxLength().get();
            if (text.length() > max) {
                messages.add(ValidationMessage.error("The maximum number of characters that are permitted in the answer is: " + max));
            }
        }
        item.getMinValue().ifPresent(min -> {
            if (AnswerValues.compare(value, min).map(c -> c < 0).orElse(false)) {
                messages.add(ValidationMessage.error("Minimum value allowed is:" + min));
            }
        });
        item.getMaxValue().ifPresent(max -> {
            if (AnswerValues.compare(value, max).map(c -> c > 0).orElse(false)) {
                messages.add(ValidationMessage.error("Maximum value allowed is:" + max));
            }
        });
        if (value instanceof Attachment attachment) {
            checkAttachment(item, attachment, messages);
        }
        if (type == ItemType.CHOICE && form.hasOptionSource(node)
                && form.optionsFor(node).stream().noneMatch(o -> AnswerValues.sameValue(o, value))) {
            messages.add(ValidationMessage.error("Value '" + value + "' is not one of the available options."));
        }
    }

    private static void checkAttachment(Item item, Attachment attachment, List<ValidationMessage> messages) {
        if (attachment.size() > item.getMaxSizeBytes()) {
            messages.add(ValidationMessage.error("Attachment is larger than the allowed " + item.getMaxSizeBytes() + " bytes."));
        }
        List<String> mimeTypes = item.getMimeTypes();
        if (!mimeTypes.isEmpty() && mimeTypes.stream().noneMatch(m -> attachment.contentType().startsWith(m))) {
            messages.add(ValidationMessage.error("Attachment type '" + attachment.contentType() + "' is not allowed, expected one of " + mimeTypes + "."));
        }
    }

    private void checkConstraint(EvaluatedForm form, ResponseNode node, Constraint constraint,
                                 List<ValidationMessage> messages) {
        EvaluationResult result;
        try {
            result = evaluator.evaluate(constraint.expression(), form.contextFor(node));
        } catch (RuntimeException e) {
            logger.log(Level.FINE, "Constraint '" + constraint.key() + "' could not be evaluated", e);
            result = EvaluationResult.failure(e.getMessage());
        }
        if (result == null) {
            result = EvaluationResult.failure("Evaluator returned no result");
        }
        if (result.isSuccess() && result.isTrue()) return;
        if (!result.isSuccess()) {
            String error = result.error();
            logger.fine(() -> String.format("Constraint '%s' on '%s' counted as violated: %s", constraint.key(), node.getLinkId(), error));
        }
        messages.add(new ValidationMessage(constraint.severity(), constraint.human()));
    }

    private static boolean hasEnabledAnswer(EvaluatedForm form, ResponseNode node) {
        for (ResponseNode child : node.childNodes()) {
            if (!form.isEnabled(child)) continue;
            if (child.answerValues().stream().anyMatch(v -> !AnswerValues.isEmpty(v))) return true;
            if (hasEnabledAnswer(form, child)) return true;
        }
        return false;
    }
}
