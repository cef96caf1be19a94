package io.github.cyfko.formstate.core;

import io.github.cyfko.formstate.core.config.FormEngineConfig;
import io.github.cyfko.formstate.core.dependency.DependencyResolver;
import io.github.cyfko.formstate.core.dependency.EvaluationOrder;
import io.github.cyfko.formstate.core.dependency.ReferenceScanner;
import io.github.cyfko.formstate.core.evaluation.EvaluationEngine;
import io.github.cyfko.formstate.core.exception.FormDefinitionException;
import io.github.cyfko.formstate.core.model.DefinitionValidator;
import io.github.cyfko.formstate.core.model.FormDefinition;
import io.github.cyfko.formstate.core.model.ResponseDocument;
import io.github.cyfko.formstate.core.spi.ReferenceExtractor;
import io.github.cyfko.formstate.core.sync.ResponseTreeSynchronizer;
import io.github.cyfko.formstate.core.validation.ResponseValidator;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Entry point: a validated form definition, its resolved evaluation order and the configuration
 * its sessions run with.
 * <p>
 * Loading a definition validates it and resolves the dependencies between its expressions once.
 * The resulting engine is immutable and thread-safe; it opens any number of independent
 * {@link FormSession}s.
 * </p>
 *
 * <p><strong>Complete Usage Example:</strong></p>
 * <pre>{@code
 * // 1. Describe the form
 * FormDefinition definition = FormDefinition.of("vitals",
 *     Item.builder("height", ItemType.DECIMAL).build(),
 *     Item.builder("weight", ItemType.DECIMAL).calculatedExpression("%height * 2").build());
 *
 * // 2. Load it with an expression evaluator
 * FormEngine engine = FormEngine.load(definition, FormEngineConfig.builder()
 *     .expressionEvaluator(fhirPathEvaluator)
 *     .build());
 *
 * // 3. Edit a response
 * FormSession session = engine.open();
 * EvaluationSnapshot snapshot = session.setAnswer(LinkIdPath.parse("height"), 10).join();
 * snapshot.answers("weight"); // [20]
 *
 * // 4. Submit
 * SubmissionOutcome outcome = session.submit().join();
 * }</pre>
 *
 * <p><strong>Error Handling:</strong></p>
 * <ul>
 *   <li>{@link FormDefinitionException} - the definition is inconsistent, reported in full at load</li>
 *   <li>{@link NullPointerException} - missing definition or configuration</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FormEngine {

    private static final Logger logger = Logger.getLogger(FormEngine.class.getName());

    private final FormDefinition definition;
    private final FormEngineConfig config;
    private final EvaluationOrder order;
    private final EvaluationEngine evaluationEngine;
    private final ResponseValidator validator;
    private final ResponseTreeSynchronizer synchronizer;

    private FormEngine(FormDefinition definition, FormEngineConfig config, EvaluationOrder order) {
        this.definition = definition;
        this.config = config;
        this.order = order;
        this.evaluationEngine = new EvaluationEngine(definition, order, config.getExpressionEvaluator());
        this.validator = new ResponseValidator(config.getExpressionEvaluator(), config.getAnswerValidators());
        this.synchronizer = new ResponseTreeSynchronizer();
    }

    /**
     * Loads a definition with the default configuration.
     *
     * @throws FormDefinitionException if the definition is inconsistent
     */
    public static FormEngine load(FormDefinition definition) {
        return load(definition, FormEngineConfig.defaults());
    }

    /**
     * Loads a definition.
     *
     * @param definition the form
     * @param config     evaluator, policies and executors for every session
     * @return the engine
     * @throws FormDefinitionException if the definition is inconsistent
     */
    public static FormEngine load(FormDefinition definition, FormEngineConfig config) {
        Objects.requireNonNull(definition, "definition cannot be null");
        Objects.requireNonNull(config, "config cannot be null");
        long start = System.nanoTime();

        DefinitionValidator.validate(definition);
        ReferenceExtractor extractor = config.getReferenceExtractor()
                .orElseGet(() -> new ReferenceScanner(config.getCachePolicy()));
        EvaluationOrder order = new DependencyResolver(extractor).resolve(definition);

        logger.info(() -> String.format("Loaded form '%s': %d item(s), %d expression(s) in %d ms",
                definition.getId(), definition.flattened().size(), order.size(), (System.nanoTime() - start) / 1_000_000));
        return new FormEngine(definition, config, order);
    }

    /**
     * Opens a session on a fresh response.
     */
    public FormSession open() {
        return open(null, Map.of());
    }

    /**
     * Opens a session resuming a stored response.
     *
     * @param response response to resume; data matching no item is discarded and reported in the
     *                 snapshot's sync issues
     */
    public FormSession open(ResponseDocument response) {
        return open(response, Map.of());
    }

    /**
     * Opens a session.
     *
     * @param response      response to resume, null for a fresh one
     * @param launchContext values exposed to expressions, on top of the configured ones
     */
    public FormSession open(ResponseDocument response, Map<String, Object> launchContext) {
        Objects.requireNonNull(launchContext, "launchContext cannot be null");
        if (response != null && response.formId() != null && !response.formId().equals(definition.getId())) {
            throw new IllegalArgumentException("Response belongs to form '" + response.formId()
                    + "', not '" + definition.getId() + "'");
        }
        Map<String, Object> context = new LinkedHashMap<>(config.getLaunchContext());
        context.putAll(launchContext);
        return FormSession.open(this, response, context);
    }

    public FormDefinition getDefinition() {
        return definition;
    }

    public FormEngineConfig getConfig() {
        return config;
    }

    public EvaluationOrder getEvaluationOrder() {
        return order;
    }

    EvaluationEngine evaluationEngine() {
        return evaluationEngine;
    }

    ResponseValidator validator() {
        return validator;
    }

    ResponseTreeSynchronizer synchronizer() {
        return synchronizer;
    }

    @Override
    public String toString() {
        return "FormEngine[form=" + definition.getId() + ", " + order + "]";
    }
}
