package io.github.cyfko.formstate.spring.support;

import io.github.cyfko.formstate.core.FormEngine;
import io.github.cyfko.formstate.core.FormSession;
import io.github.cyfko.formstate.core.config.FormEngineConfig;
import io.github.cyfko.formstate.core.model.FormDefinition;
import io.github.cyfko.formstate.core.model.ResponseDocument;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Central registry of the form engines and open sessions of an application.
 * <p>
 * Every {@link FormDefinition} bean is loaded into a {@link FormEngine} at startup with the shared
 * {@link FormEngineConfig}; more definitions can be registered later. Sessions opened through the
 * registry are tracked by id until they are submitted or cancelled.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Lookups and registrations may run concurrently. Each session serializes its own mutations.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FormSessionRegistry {

    private static final Logger logger = Logger.getLogger(FormSessionRegistry.class.getName());

    private final FormEngineConfig config;
    private final Map<String, FormEngine> enginesByForm = new ConcurrentHashMap<>();
    private final Map<String, FormSession> sessionsById = new ConcurrentHashMap<>();

    /**
     * @param config      configuration every engine is loaded with
     * @param definitions forms to load right away
     * @throws io.github.cyfko.formstate.core.exception.FormDefinitionException if a definition is inconsistent
     */
    public FormSessionRegistry(FormEngineConfig config, List<FormDefinition> definitions) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        for (FormDefinition definition : definitions) {
            register(definition);
        }
    }

    /**
     * Loads a definition, replacing any engine previously registered under the same form id.
     * Sessions already open keep the engine they were opened with.
     *
     * @return the loaded engine
     */
    public FormEngine register(FormDefinition definition) {
        FormEngine engine = FormEngine.load(definition, config);
        if (enginesByForm.put(definition.getId(), engine) != null) {
            logger.info(() -> String.format("Replaced engine of form '%s'", definition.getId()));
        }
        return engine;
    }

    /**
     * @throws IllegalArgumentException if no form is registered under this id
     */
    public FormEngine getEngine(String formId) {
        FormEngine engine = enginesByForm.get(formId);
        if (engine == null) {
            throw new IllegalArgumentException("No form registered under id '" + formId + "'. "
                    + "Declare a FormDefinition bean or call register().");
        }
        return engine;
    }

    public boolean hasForm(String formId) {
        return enginesByForm.containsKey(formId);
    }

    /**
     * Opens and tracks a session on a fresh response.
     */
    public FormSession open(String formId) {
        return open(formId, null);
    }

    /**
     * Opens and tracks a session.
     *
     * @param formId   registered form
     * @param response response to resume, null for a fresh one
     */
    public FormSession open(String formId, ResponseDocument response) {
        FormSession session = getEngine(formId).open(response);
        sessionsById.put(session.getId(), session);
        session.addListener(event -> {
            sessionsById.remove(event.sessionId());
            logger.fine(() -> String.format("Session %s of form '%s' ended: %s", event.sessionId(), formId, event.type()));
        });
        return session;
    }

    public Optional<FormSession> getSession(String sessionId) {
        return Optional.ofNullable(sessionsById.get(sessionId));
    }

    /**
     * @return sessions neither submitted nor cancelled
     */
    public Collection<FormSession> openSessions() {
        return List.copyOf(sessionsById.values());
    }
}
