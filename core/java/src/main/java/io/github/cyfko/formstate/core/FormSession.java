package io.github.cyfko.formstate.core;

import io.github.cyfko.formstate.core.config.FormEngineConfig;
import io.github.cyfko.formstate.core.config.NavigationPolicy;
import io.github.cyfko.formstate.core.evaluation.EvaluatedForm;
import io.github.cyfko.formstate.core.evaluation.EvaluationEngine;
import io.github.cyfko.formstate.core.evaluation.EvaluationState;
import io.github.cyfko.formstate.core.exception.ExpressionEvaluationException;
import io.github.cyfko.formstate.core.exception.SynchronizationException;
import io.github.cyfko.formstate.core.model.Answer;
import io.github.cyfko.formstate.core.model.FormDefinition;
import io.github.cyfko.formstate.core.model.Item;
import io.github.cyfko.formstate.core.model.LinkIdPath;
import io.github.cyfko.formstate.core.model.ResponseDocument;
import io.github.cyfko.formstate.core.model.ResponseNode;
import io.github.cyfko.formstate.core.model.ResponseTree;
import io.github.cyfko.formstate.core.navigation.DisplayModeStateMachine;
import io.github.cyfko.formstate.core.navigation.FormMode;
import io.github.cyfko.formstate.core.navigation.PageNavigator;
import io.github.cyfko.formstate.core.navigation.PageStatus;
import io.github.cyfko.formstate.core.navigation.PaginationState;
import io.github.cyfko.formstate.core.session.EvaluationSnapshot;
import io.github.cyfko.formstate.core.session.FormEvent;
import io.github.cyfko.formstate.core.session.FormEventListener;
import io.github.cyfko.formstate.core.session.ItemState;
import io.github.cyfko.formstate.core.session.SerialExecutor;
import io.github.cyfko.formstate.core.session.SubmissionOutcome;
import io.github.cyfko.formstate.core.sync.ResponseTreeSynchronizer;
import io.github.cyfko.formstate.core.sync.SyncIssue;
import io.github.cyfko.formstate.core.utils.AnswerValues;
import io.github.cyfko.formstate.core.validation.ValidationResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One editing session of a form response.
 *
 * <h2>Threading</h2>
 * <p>
 * Every mutation runs on the session's {@link SerialExecutor}, one at a time, against the
 * session's response tree. Each mutation then requests an evaluation pass, which runs on the
 * configured evaluation executor over a copy of the tree. The pass result is applied back on the
 * queue: the tree, the evaluation state and the published {@link EvaluationSnapshot} are swapped
 * together. A pass that a newer mutation has superseded is discarded; the changes it covered are
 * carried by the newer pass.
 * </p>
 * <p>
 * Mutation methods return a future completing with the first snapshot that accounts for the
 * mutation. Caller mistakes detectable from the definition alone (answering a group, unknown
 * item) throw immediately; those depending on the current response (missing instance) complete
 * the future exceptionally. {@link #snapshot()} never blocks.
 * </p>
 *
 * <h2>Lifecycle</h2>
 * <p>
 * The session starts in {@link FormMode#INIT} and enters its first mode once the first pass is
 * applied. An accepted {@link #submit()} or a {@link #cancel()} closes it; later mutations throw
 * {@link IllegalStateException}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FormSession {

    private static final Logger logger = Logger.getLogger(FormSession.class.getName());

    private final String id = UUID.randomUUID().toString();
    private final FormEngine engine;
    private final FormDefinition definition;
    private final FormEngineConfig config;
    private final Map<String, Object> launchContext;
    private final SerialExecutor queue;
    private final AtomicReference<EvaluationSnapshot> snapshot;
    private final List<FormEventListener> listeners = new CopyOnWriteArrayList<>();
    private final List<SyncIssue> syncIssues;
    private CompletableFuture<EvaluationSnapshot> ready;
    private volatile boolean closed;

    // Confined to the mutation queue
    private ResponseTree tree;
    private EvaluationState state = EvaluationState.empty();
    private EvaluatedForm form;
    private final DisplayModeStateMachine modes;
    private int currentPage = -1;
    private boolean validateAll;
    private long generation;
    private long appliedGeneration;
    private final Set<String> pendingChanges = new LinkedHashSet<>();
    private final Set<Item> pendingRecalculation = Collections.newSetFromMap(new IdentityHashMap<>());
    private boolean pendingFull;
    private final List<CompletableFuture<EvaluationSnapshot>> waiters = new ArrayList<>();

    private FormSession(FormEngine engine, ResponseDocument response, Map<String, Object> launchContext) {
        this.engine = engine;
        this.definition = engine.getDefinition();
        this.config = engine.getConfig();
        this.launchContext = Map.copyOf(launchContext);
        this.queue = new SerialExecutor(config.getMutationExecutor());
        this.modes = DisplayModeStateMachine.from(config);

        List<SyncIssue> issues = new ArrayList<>();
        this.tree = engine.synchronizer().create(definition, response, issues);
        this.syncIssues = List.copyOf(issues);
        this.snapshot = new AtomicReference<>(EvaluationSnapshot.builder(definition.getId())
                .syncIssues(syncIssues)
                .response(tree.toDocument(definition.getId(), node -> true))
                .build());
    }

    static FormSession open(FormEngine engine, ResponseDocument response, Map<String, Object> launchContext) {
        FormSession session = new FormSession(engine, response, launchContext);
        session.ready = session.queue.submit(() -> {
            session.pendingFull = true;
            return session.requestPass();
        }).thenCompose(Function.identity());
        logger.fine(() -> String.format("Opened session %s on form '%s'%s", session.id, session.definition.getId(),
                response == null ? "" : " (resumed)"));
        return session;
    }

    public String getId() {
        return id;
    }

    public FormEngine getEngine() {
        return engine;
    }

    /**
     * @return completes with the snapshot of the first pass, when the session left {@link FormMode#INIT}
     */
    public CompletableFuture<EvaluationSnapshot> ready() {
        return ready;
    }

    /**
     * @return the latest published snapshot
     */
    public EvaluationSnapshot snapshot() {
        return snapshot.get();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * @return the latest published response, disabled items included
     */
    public ResponseDocument responseDocument() {
        return snapshot().getResponse();
    }

    /**
     * @return the latest published response without disabled items
     */
    public ResponseDocument submissionDocument() {
        return snapshot().getSubmission();
    }

    public void addListener(FormEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    public boolean removeListener(FormEventListener listener) {
        return listeners.remove(listener);
    }

    // ==================== Answer mutations ====================

    /**
     * Replaces the answers of a question. Answers are marked as edited by the user, so calculated
     * values no longer overwrite them, and the node is marked touched.
     *
     * @param path   path of the question node
     * @param values new answer values, none to clear
     * @throws SynchronizationException if the path names no item or names a group or display item
     * @throws IllegalArgumentException if several values are given for a non-repeating item
     * @throws NullPointerException     if a value is null
     */
    public CompletableFuture<EvaluationSnapshot> setAnswer(LinkIdPath path, Object... values) {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        for (Object value : values) {
            Objects.requireNonNull(value, "answer value cannot be null, pass no value to clear");
        }
        Item item = answerableItem(path);
        List<Object> newValues = List.of(values);
        if (!item.isRepeats() && newValues.size() > 1) {
            throw new IllegalArgumentException("Item '" + item.getLinkId() + "' does not repeat, got "
                    + newValues.size() + " answers");
        }
        return mutate("setAnswer " + path, () -> {
            ensureEditable();
            ResponseNode node = nodeAt(path);
            List<Answer> answers = new ArrayList<>();
            for (Object value : newValues) {
                Optional<Answer> kept = node.getAnswers().stream()
                        .filter(a -> !answers.contains(a) && AnswerValues.sameValue(a.getValue(), value))
                        .findFirst();
                kept.ifPresent(a -> a.setUserEdited(true));
                answers.add(kept.orElseGet(() -> Answer.edited(value)));
            }
            node.replaceAnswers(answers);
            node.setTouched(true);
            return changedBy(item, node);
        });
    }

    public CompletableFuture<EvaluationSnapshot> setAnswer(String path, Object... values) {
        return setAnswer(LinkIdPath.parse(path), values);
    }

    /**
     * Removes every answer of a question.
     */
    public CompletableFuture<EvaluationSnapshot> clearAnswer(LinkIdPath path) {
        return setAnswer(path);
    }

    /**
     * Clears the edited flag of a question's answers, letting its calculated value apply again.
     */
    public CompletableFuture<EvaluationSnapshot> clearUserEdited(LinkIdPath path) {
        Objects.requireNonNull(path, "path cannot be null");
        Item item = answerableItem(path);
        return mutate("clearUserEdited " + path, () -> {
            ResponseNode node = nodeAt(path);
            node.getAnswers().forEach(answer -> answer.setUserEdited(false));
            pendingRecalculation.add(item);
            return Set.of();
        });
    }

    /**
     * Drops every answer of the response, with the nodes nested under them, and re-evaluates the
     * whole form. Calculated values apply again since no answer is left marked as edited.
     */
    public CompletableFuture<EvaluationSnapshot> clearAllAnswers() {
        return mutate("clearAllAnswers", () -> {
            ensureEditable();
            for (ResponseNode node : tree.nodes()) {
                node.clearAnswers();
                node.setTouched(false);
            }
            List<SyncIssue> issues = engine.synchronizer().synchronize(definition, tree);
            if (!issues.isEmpty()) {
                logger.warning(() -> String.format("Session %s: clearing answers left %d sync issue(s)", id, issues.size()));
            }
            pendingFull = true;
            return Set.of();
        });
    }

    // ==================== Repeated groups ====================

    /**
     * Adds an instance at the end of a repeated group.
     *
     * @param path path of the group; the parent segment's index selects where it is nested
     * @throws SynchronizationException if the item is not a repeated group
     */
    public CompletableFuture<EvaluationSnapshot> addRepeatedInstance(LinkIdPath path) {
        Objects.requireNonNull(path, "path cannot be null");
        Item item = repeatedGroup(path);
        return mutate("addRepeatedInstance " + path, () -> {
            ensureEditable();
            ResponseNode instance = engine.synchronizer().addInstance(definition, tree, path);
            instance.setTouched(true);
            return subtreeLinkIds(item);
        });
    }

    public CompletableFuture<EvaluationSnapshot> addRepeatedInstance(String path) {
        return addRepeatedInstance(LinkIdPath.parse(path));
    }

    /**
     * Removes an instance of a repeated group with everything below it.
     *
     * @param path  path of the group
     * @param index instance index
     * @throws SynchronizationException if the item is not a repeated group; a missing instance
     *                                  fails the returned future with the same exception
     */
    public CompletableFuture<EvaluationSnapshot> removeRepeatedInstance(LinkIdPath path, int index) {
        Objects.requireNonNull(path, "path cannot be null");
        Item item = repeatedGroup(path);
        return mutate("removeRepeatedInstance " + path + " #" + index, () -> {
            ensureEditable();
            engine.synchronizer().removeInstance(definition, tree, path, index);
            return subtreeLinkIds(item);
        });
    }

    public CompletableFuture<EvaluationSnapshot> removeRepeatedInstance(String path, int index) {
        return removeRepeatedInstance(LinkIdPath.parse(path), index);
    }

    // ==================== Mode & pages ====================

    /**
     * Switches between {@link FormMode#EDIT} and {@link FormMode#REVIEW}.
     *
     * @throws IllegalStateException through the future when the transition is refused
     */
    public CompletableFuture<EvaluationSnapshot> setMode(FormMode mode) {
        Objects.requireNonNull(mode, "mode cannot be null");
        return whenSettled(() -> {
            FormMode previous = modes.getMode();
            modes.transitionTo(mode);
            if (previous != mode) {
                logger.fine(() -> String.format("Session %s: %s -> %s", id, previous, mode));
            }
            return publish();
        });
    }

    /**
     * Moves to a page. Going back is always allowed. Under {@link NavigationPolicy#LINEAR}, going
     * forward requires every enabled page before the target to be free of invalid answers; when
     * one is not, its nodes are marked touched so their problems show, and the cursor stays.
     *
     * @param index page index among the top-level items
     * @throws IllegalStateException    through the future when the form is not paginated
     * @throws IllegalArgumentException through the future when the page does not exist or is disabled
     */
    public CompletableFuture<EvaluationSnapshot> goToPage(int index) {
        return whenSettled(() -> {
            List<PageStatus> pages = pageStatuses(engine.validator().validate(form, validateAll));
            if (pages.isEmpty()) {
                throw new IllegalStateException("Form '" + definition.getId() + "' is not paginated");
            }
            if (index < 0 || index >= pages.size()) {
                throw new IllegalArgumentException("No page " + index + ", the form has " + pages.size());
            }
            if (!pages.get(index).enabled()) {
                throw new IllegalArgumentException("Page " + index + " ('" + pages.get(index).linkId() + "') is disabled");
            }
            if (index > currentPage && config.getNavigationPolicy() == NavigationPolicy.LINEAR) {
                Set<String> blocking = blockingPages(pages, index);
                if (!blocking.isEmpty()) {
                    touchPages(blocking);
                    logger.fine(() -> String.format("Session %s: page %d blocked by invalid page(s) %s", id, index, blocking));
                    return publish();
                }
            }
            currentPage = index;
            return publish();
        });
    }

    public CompletableFuture<EvaluationSnapshot> nextPage() {
        return whenSettled(() -> PageNavigator.next(currentPages(), currentPage))
                .thenCompose(next -> next == -1 ? CompletableFuture.completedFuture(snapshot()) : goToPage(next));
    }

    public CompletableFuture<EvaluationSnapshot> previousPage() {
        return whenSettled(() -> PageNavigator.previous(currentPages(), currentPage))
                .thenCompose(previous -> previous == -1 ? CompletableFuture.completedFuture(snapshot()) : goToPage(previous));
    }

    // ==================== Validation & submission ====================

    /**
     * Validates every enabled node, touched or not, from now on.
     *
     * @return the results of the current state
     */
    public CompletableFuture<Map<LinkIdPath, ValidationResult>> validateAll() {
        return whenSettled(() -> {
            validateAll = true;
            return publish().getValidation();
        });
    }

    /**
     * Submits the response. With any invalid result nothing changes and the outcome lists the
     * invalid results; otherwise the session closes and listeners receive
     * {@link FormEvent.Type#SUBMITTED} with the response minus disabled items.
     */
    public CompletableFuture<SubmissionOutcome> submit() {
        return whenSettled(() -> {
            validateAll = true;
            EvaluationSnapshot current = publish();
            if (current.hasInvalid()) {
                logger.fine(() -> String.format("Session %s: submission refused, %d invalid result(s)",
                        id, current.invalidResults().size()));
                return SubmissionOutcome.refused(current.invalidResults());
            }
            ResponseDocument response = current.getSubmission();
            close();
            fire(new FormEvent(FormEvent.Type.SUBMITTED, id, response));
            logger.info(() -> String.format("Session %s submitted form '%s'", id, definition.getId()));
            return SubmissionOutcome.accepted(response);
        });
    }

    /**
     * Abandons the session. Listeners receive {@link FormEvent.Type#CANCELLED} with the response
     * as it was.
     *
     * @return the response at cancellation
     */
    public CompletableFuture<ResponseDocument> cancel() {
        return whenSettled(() -> {
            ResponseDocument response = tree.toDocument(definition.getId(), node -> true);
            close();
            fire(new FormEvent(FormEvent.Type.CANCELLED, id, response));
            logger.info(() -> String.format("Session %s cancelled on form '%s'", id, definition.getId()));
            return response;
        });
    }

    // ==================== Queue plumbing ====================

    private CompletableFuture<EvaluationSnapshot> mutate(String operation, Supplier<Collection<String>> change) {
        ensureOpen();
        return queue.submit(() -> {
            ensureOpen();
            if (modes.getMode() == FormMode.INIT && appliedGeneration != generation) {
                // first pass still running
                return awaitPass().thenCompose(ignored -> mutate(operation, change));
            }
            Collection<String> changed = change.get();
            pendingChanges.addAll(changed);
            logger.fine(() -> String.format("Session %s: %s, changed %s", id, operation, changed));
            return requestPass();
        }).thenCompose(Function.identity());
    }

    /**
     * Runs an action on the queue once every requested pass has been applied.
     */
    private <T> CompletableFuture<T> whenSettled(Callable<T> action) {
        ensureOpen();
        return queue.submit(() -> {
            ensureOpen();
            if (appliedGeneration != generation) {
                return awaitPass().thenCompose(ignored -> whenSettled(action));
            }
            if (form == null) {
                throw new IllegalStateException("Session " + id + " has no evaluated state, its first pass failed");
            }
            return CompletableFuture.completedFuture(action.call());
        }).thenCompose(Function.identity());
    }

    private CompletableFuture<EvaluationSnapshot> awaitPass() {
        CompletableFuture<EvaluationSnapshot> waiter = new CompletableFuture<>();
        waiters.add(waiter);
        return waiter;
    }

    private CompletableFuture<EvaluationSnapshot> requestPass() {
        long pass = ++generation;
        CompletableFuture<EvaluationSnapshot> done = awaitPass();
        ResponseTree copy = tree.deepCopy();
        Set<String> changes = Set.copyOf(pendingChanges);
        List<Item> recalculated = List.copyOf(pendingRecalculation);
        boolean full = pendingFull;
        EvaluationState previous = state;
        EvaluationEngine evaluationEngine = engine.evaluationEngine();
        CompletableFuture
                .supplyAsync(() -> evaluationEngine.evaluate(copy, changes, recalculated, previous, full, launchContext),
                        config.getEvaluationExecutor())
                .whenComplete((result, error) -> queue.submit(() -> {
                    apply(pass, result, error);
                    return null;
                }));
        return done;
    }

    private void apply(long pass, EvaluationEngine.PassResult result, Throwable error) {
        if (pass != generation) {
            logger.fine(() -> String.format("Session %s: discarded pass %d, superseded by %d", id, pass, generation));
            return;
        }
        appliedGeneration = pass;
        if (error != null) {
            Throwable cause = error.getCause() != null ? error.getCause() : error;
            logger.log(Level.SEVERE, "Evaluation pass " + pass + " of session " + id + " failed", cause);
            ExpressionEvaluationException failure = new ExpressionEvaluationException(
                    "Evaluation pass failed on form '" + definition.getId() + "'", cause);
            List<CompletableFuture<EvaluationSnapshot>> failed = List.copyOf(waiters);
            waiters.clear();
            failed.forEach(waiter -> waiter.completeExceptionally(failure));
            return;
        }
        tree = result.tree();
        state = result.state();
        form = result.form();
        pendingChanges.clear();
        pendingRecalculation.clear();
        pendingFull = false;
        if (modes.getMode() == FormMode.INIT) {
            FormMode started = modes.start();
            logger.fine(() -> String.format("Session %s started in %s", id, started));
        }
        publish();
    }

    /**
     * Validates the current state, builds and publishes its snapshot, and releases the waiters.
     */
    private EvaluationSnapshot publish() {
        Map<LinkIdPath, ValidationResult> validation = engine.validator().validate(form, validateAll);
        List<PageStatus> pages = pageStatuses(validation);
        currentPage = PageNavigator.settle(pages, currentPage);

        EvaluationSnapshot.Builder builder = EvaluationSnapshot.builder(definition.getId())
                .generation(appliedGeneration)
                .mode(modes.getMode())
                .closed(closed)
                .pagination(PaginationState.of(pages, currentPage))
                .variables(state.variablesAt(tree.getRoot().getNodeId()))
                .errors(state.errors())
                .validation(validation)
                .syncIssues(syncIssues)
                .response(tree.toDocument(definition.getId(), node -> true))
                .submission(tree.toDocument(definition.getId(), form::isEnabled));
        for (ResponseNode node : form.index().nodes()) {
            Item item = form.itemOf(node).orElseThrow();
            builder.item(new ItemState(ResponseTree.pathOf(node), node.getLinkId(), form.isEnabled(node),
                    node.isTouched(), node.answerValues(),
                    item.getType().isChoice() ? form.optionsFor(node) : List.of()));
        }
        for (Item item : definition.flattened()) {
            if (!item.isRepeatedGroup()) continue;
            Optional<Item> parentItem = definition.parentOf(item);
            List<ResponseNode> parents = parentItem.isEmpty()
                    ? List.of(tree.getRoot())
                    : form.index().nodesOf(parentItem.get());
            for (ResponseNode parent : parents) {
                LinkIdPath path = parent.isRoot()
                        ? LinkIdPath.of(item.getLinkId())
                        : ResponseTree.pathOf(parent).child(item.getLinkId());
                builder.slot(path, form.isSlotEnabled(parent, item));
            }
        }

        EvaluationSnapshot next = builder.build();
        snapshot.set(next);
        List<CompletableFuture<EvaluationSnapshot>> released = List.copyOf(waiters);
        waiters.clear();
        released.forEach(waiter -> waiter.complete(next));
        return next;
    }

    // ==================== Helpers ====================

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Session " + id + " is closed");
        }
    }

    private void ensureEditable() {
        if (!modes.isEditable()) {
            throw new IllegalStateException("Answers can only change in " + FormMode.EDIT + " mode, session is in "
                    + modes.getMode());
        }
    }

    private void close() {
        closed = true;
        publish();
    }

    private void fire(FormEvent event) {
        for (FormEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Listener failed on " + event.type() + " of session " + id, e);
            }
        }
    }

    private Item answerableItem(LinkIdPath path) {
        Item item = ResponseTreeSynchronizer.resolveItem(definition, path);
        if (!item.getType().isQuestion()) {
            throw new SynchronizationException("Item '" + item.getLinkId() + "' is a " + item.getType()
                    + " item and takes no answer");
        }
        return item;
    }

    private Item repeatedGroup(LinkIdPath path) {
        Item item = ResponseTreeSynchronizer.resolveItem(definition, path);
        if (!item.isRepeatedGroup()) {
            throw new SynchronizationException("Item '" + item.getLinkId() + "' is not a repeated group");
        }
        return item;
    }

    private ResponseNode nodeAt(LinkIdPath path) {
        return tree.find(path).orElseThrow(() -> new SynchronizationException("No response node at '" + path + "'"));
    }

    /**
     * Link ids whose answers an answer change affects: the item, and its nested items when their
     * nodes were created or dropped along with answers.
     */
    private Set<String> changedBy(Item item, ResponseNode node) {
        Set<String> changed = new LinkedHashSet<>();
        changed.add(item.getLinkId());
        if (item.hasNestedItemsUnderAnswers()) {
            engine.synchronizer().sync(tree, item, node);
            changed.addAll(subtreeLinkIds(item));
        }
        return changed;
    }

    private static Set<String> subtreeLinkIds(Item item) {
        Set<String> linkIds = new LinkedHashSet<>();
        linkIds.add(item.getLinkId());
        for (Item child : item.getChildren()) {
            linkIds.addAll(subtreeLinkIds(child));
        }
        return linkIds;
    }

    private List<PageStatus> currentPages() {
        return pageStatuses(snapshot().getValidation());
    }

    private List<PageStatus> pageStatuses(Map<LinkIdPath, ValidationResult> validation) {
        List<Item> pageItems = definition.pages();
        List<PageStatus> pages = new ArrayList<>();
        for (int i = 0; i < pageItems.size(); i++) {
            String linkId = pageItems.get(i).getLinkId();
            boolean enabled = tree.getRoot().getChildren().stream()
                    .filter(node -> linkId.equals(node.getLinkId()))
                    .anyMatch(form::isEnabled);
            boolean valid = validation.entrySet().stream()
                    .filter(e -> e.getKey().segments().get(0).linkId().equals(linkId))
                    .noneMatch(e -> e.getValue().isInvalid());
            pages.add(new PageStatus(i, linkId, enabled, valid));
        }
        return pages;
    }

    private Set<String> blockingPages(List<PageStatus> pages, int target) {
        Map<LinkIdPath, ValidationResult> full = engine.validator().validate(form, true);
        Set<String> blocking = new LinkedHashSet<>();
        for (PageStatus page : pageStatuses(full)) {
            if (page.index() < target && page.enabled() && !page.valid()) {
                blocking.add(page.linkId());
            }
        }
        return blocking;
    }

    private void touchPages(Set<String> linkIds) {
        for (ResponseNode node : tree.getRoot().getChildren()) {
            if (linkIds.contains(node.getLinkId())) {
                touchSubtree(node);
            }
        }
    }

    private static void touchSubtree(ResponseNode node) {
        node.setTouched(true);
        for (ResponseNode child : node.childNodes()) {
            touchSubtree(child);
        }
    }

    @Override
    public String toString() {
        return "FormSession[" + id + ", form=" + definition.getId() + ", closed=" + closed + "]";
    }
}
