package io.github.cyfko.formstate.core.model;

import io.github.cyfko.formstate.core.exception.FormDefinitionException;
import io.github.cyfko.formstate.core.utils.AnswerValues;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Load-time structural checks of a {@link FormDefinition}.
 * <p>
 * Every problem found is collected, and a single {@link FormDefinitionException} listing all of
 * them is thrown, so a broken definition surfaces as one failure before any session exists.
 * </p>
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Link ids are not blank</li>
 *   <li>Initial values are not combined with answer options, unless an initial expression is declared</li>
 *   <li>Groups and display items declare no initial value</li>
 *   <li>Non-repeating items declare at most one initial value (initial or initially selected option)</li>
 *   <li>Initial values conform to the item type; a quantity without value is accepted as a unit hint</li>
 *   <li>Variables are named, and names are unique per declaring scope</li>
 *   <li>Calculated, answer, candidate and initial expressions and answer options toggles only appear on questions</li>
 *   <li>{@code minOccurs} does not exceed {@code maxOccurs}</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class DefinitionValidator {

    private static final Logger logger = Logger.getLogger(DefinitionValidator.class.getName());

    private DefinitionValidator() {
        // Utility class
    }

    /**
     * Checks a definition.
     *
     * @param definition the definition to check
     * @throws FormDefinitionException listing every problem found
     */
    public static void validate(FormDefinition definition) {
        List<String> problems = new ArrayList<>();
        checkVariables("form '" + definition.getId() + "'", definition.getVariables(), problems);
        for (Item item : definition.flattened()) {
            checkItem(item, problems);
        }
        if (!problems.isEmpty()) {
            logger.warning(() -> String.format("Form '%s' rejected with %d problem(s)", definition.getId(), problems.size()));
            throw new FormDefinitionException("Invalid form definition '" + definition.getId() + "': "
                    + String.join("; ", problems));
        }
    }

    private static void checkItem(Item item, List<String> problems) {
        String linkId = item.getLinkId();
        if (linkId.isBlank()) {
            problems.add("an item of type " + item.getType() + " has a blank linkId");
        }

        List<Object> initial = item.getInitial();
        long initiallySelected = item.getAnswerOptions().stream().filter(AnswerOption::initialSelected).count();

        if (!initial.isEmpty() && !item.getAnswerOptions().isEmpty() && item.getInitialExpression().isEmpty()) {
            problems.add("item '" + linkId + "' has both initial value(s) and answer options");
        }
        if (!item.getType().isQuestion()) {
            if (!initial.isEmpty() || initiallySelected > 0) {
                problems.add("item '" + linkId + "' is a " + item.getType() + " item and cannot have initial values");
            }
            if (item.getCalculatedExpression().isPresent() || item.getAnswerExpression().isPresent()
                    || item.getCandidateExpression().isPresent() || item.getInitialExpression().isPresent()
                    || !item.getAnswerOptionsToggles().isEmpty()) {
                problems.add("item '" + linkId + "' is a " + item.getType() + " item and cannot compute answers");
            }
        }
        if (!item.isRepeats() && (initial.size() > 1 || initiallySelected > 1)) {
            problems.add("item '" + linkId + "' can only have multiple initial values when it repeats");
        }
        if (item.getType().isQuestion()) {
            for (Object value : initial) {
                boolean unitHint = value instanceof Quantity quantity && !quantity.hasValue();
                if (!unitHint && !AnswerValues.conforms(item.getType(), value)) {
                    problems.add("initial value " + value + " of item '" + linkId + "' is not a valid " + item.getType() + " answer");
                }
            }
        }
        if (item.getMinOccurs().isPresent() && item.getMaxOccurs().isPresent()
                && item.getMinOccurs().get() > item.getMaxOccurs().get()) {
            problems.add("item '" + linkId + "' has minOccurs greater than maxOccurs");
        }
        checkVariables("item '" + linkId + "'", item.getVariables(), problems);
    }

    private static void checkVariables(String scope, List<Expression> variables, List<String> problems) {
        List<String> names = new ArrayList<>();
        for (Expression variable : variables) {
            if (!variable.isNamed()) {
                problems.add(scope + " declares a variable without a name");
            } else if (names.contains(variable.name())) {
                problems.add(scope + " declares variable '" + variable.name() + "' twice");
            } else {
                names.add(variable.name());
            }
        }
    }
}
