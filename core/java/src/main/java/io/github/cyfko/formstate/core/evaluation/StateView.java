package io.github.cyfko.formstate.core.evaluation;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read access shared by a frozen {@link EvaluationState} and the builder a pass writes into.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
interface StateView {

    /**
     * @return the result of the node's own enable condition, empty when it has none or never ran
     */
    Optional<Boolean> ownEnabled(long nodeId);

    Optional<Boolean> slotEnabled(SlotKey slot);

    /**
     * @return variables declared by the node's item, evaluated for that node
     */
    Map<String, List<Object>> variablesAt(long nodeId);

    Optional<List<Object>> baseOptions(long nodeId);

    /**
     * @return toggle results by toggle index; a missing index has not been evaluated yet
     */
    Map<Integer, Boolean> toggles(long nodeId);
}
