package io.github.cyfko.formstate.core.spi;

import io.github.cyfko.formstate.core.model.Expression;

/**
 * Evaluates the expressions declared by a form.
 * <p>
 * The engine treats the expression language as opaque: it hands every expression, together
 * with the scope it is evaluated in, to this interface and only interprets the returned values.
 * Implementations report failures either with {@link EvaluationResult#failure(String)} or by
 * throwing; thrown exceptions are caught by the engine and recorded as expression errors.
 * </p>
 *
 * <p><strong>Implementation Example:</strong></p>
 * <pre>{@code
 * ExpressionEvaluator evaluator = (expression, context) -> {
 *     try {
 *         List<Object> values = fhirPathEngine.evaluate(expression.expression(), context.variables());
 *         return EvaluationResult.success(values);
 *     } catch (FhirPathException e) {
 *         return EvaluationResult.failure(e.getMessage());
 *     }
 * };
 * }</pre>
 *
 * <p>Evaluators must not mutate anything reachable from the context. They may be called from
 * the configured evaluation executor, never concurrently for the same session.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface ExpressionEvaluator {

    /**
     * Evaluates one expression.
     *
     * @param expression the expression to evaluate
     * @param context    scope of the evaluation
     * @return the resulting values, or a failure
     */
    EvaluationResult evaluate(Expression expression, EvaluationContext context);

    /**
     * Evaluator for forms without expressions: every evaluation fails, which the engine records
     * as an expression error.
     */
    static ExpressionEvaluator unsupported() {
        return (expression, context) -> EvaluationResult.failure(
                "No expression evaluator configured for '" + expression.expression() + "'");
    }
}
