package io.github.cyfko.formstate.core.spi;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one expression evaluation: a (possibly empty) collection of values or a failure.
 *
 * @param values values produced, empty on failure
 * @param error  failure message, null on success
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record EvaluationResult(List<Object> values, String error) {

    public EvaluationResult {
        values = values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static EvaluationResult success(List<?> values) {
        return new EvaluationResult(new ArrayList<>(values), null);
    }

    public static EvaluationResult success(Object... values) {
        return new EvaluationResult(Arrays.asList(values), null);
    }

    public static EvaluationResult empty() {
        return new EvaluationResult(List.of(), null);
    }

    public static EvaluationResult failure(String error) {
        return new EvaluationResult(List.of(), error == null ? "Evaluation failed" : error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Boolean reading of the result: true only when the first value is {@link Boolean#TRUE}.
     * An empty result reads as false.
     */
    public boolean isTrue() {
        return !values.isEmpty() && Boolean.TRUE.equals(values.get(0));
    }
}
