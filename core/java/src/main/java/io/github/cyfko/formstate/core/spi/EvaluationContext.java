package io.github.cyfko.formstate.core.spi;

import io.github.cyfko.formstate.core.model.FormDefinition;
import io.github.cyfko.formstate.core.model.Item;
import io.github.cyfko.formstate.core.model.LinkIdPath;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scope an expression is evaluated in.
 * <p>
 * Variables are scoped lexically: form-level variables first, then those of every ancestor of
 * the current item, then the item's own, an inner declaration shadowing an outer one with the
 * same name. Variables declared on siblings are not visible. Answers are read through
 * {@link #answers(String)}, which only sees enabled items.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface EvaluationContext {

    FormDefinition definition();

    /**
     * @return the item the expression belongs to, empty for form-level variables
     */
    Optional<Item> item();

    /**
     * @return path of the response node the expression is evaluated for, empty at form level
     */
    Optional<LinkIdPath> path();

    /**
     * @return every variable visible from here, by name
     */
    Map<String, List<Object>> variables();

    /**
     * @return the value of a visible variable, empty when it is absent or unknown
     */
    Optional<List<Object>> variable(String name);

    /**
     * Answers of the item with the given link id, looked up from the current node outwards: the
     * nearest enclosing subtree containing that item wins. Answers of disabled items are not
     * returned.
     */
    List<Object> answers(String linkId);

    /**
     * @return the answers of the current node
     */
    List<Object> currentAnswers();

    /**
     * @return launch context values supplied when the session was opened
     */
    Map<String, Object> launchContext();
}
