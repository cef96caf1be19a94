package io.github.cyfko.formstate.core;

import io.github.cyfko.formstate.core.config.FormEngineConfig;
import io.github.cyfko.formstate.core.config.NavigationPolicy;
import io.github.cyfko.formstate.core.evaluation.ExpressionError;
import io.github.cyfko.formstate.core.exception.SynchronizationException;
import io.github.cyfko.formstate.core.model.FormDefinition;
import io.github.cyfko.formstate.core.model.Item;
import io.github.cyfko.formstate.core.model.ItemControl;
import io.github.cyfko.formstate.core.model.ItemType;
import io.github.cyfko.formstate.core.model.LinkIdPath;
import io.github.cyfko.formstate.core.model.ResponseDocument;
import io.github.cyfko.formstate.core.model.ResponseItem;
import io.github.cyfko.formstate.core.navigation.FormMode;
import io.github.cyfko.formstate.core.session.EvaluationSnapshot;
import io.github.cyfko.formstate.core.session.FormEvent;
import io.github.cyfko.formstate.core.session.FormEventListener;
import io.github.cyfko.formstate.core.session.SubmissionOutcome;
import io.github.cyfko.formstate.core.spi.EvaluationResult;
import io.github.cyfko.formstate.core.validation.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static io.github.cyfko.formstate.core.ScriptedEvaluator.firstNumber;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@DisplayName("FormSession Tests")
class FormSessionTest {

    private static final String WEIGHT = "%resource.item.where(linkId = 'height').answer.value * 2";
    private static final String HAS_ADDRESS = "%resource.item.where(linkId = 'hasAddress').answer.value = true";

    private ScriptedEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new ScriptedEvaluator()
                .on(WEIGHT, ctx -> {
                    Number height = firstNumber(ctx, "height");
                    return height == null ? EvaluationResult.empty() : EvaluationResult.success(height.intValue() * 2);
                })
                .on(HAS_ADDRESS, ctx -> EvaluationResult.success(ctx.answers("hasAddress").contains(true)));
    }

    private FormEngineConfig.Builder config() {
        return FormEngineConfig.builder().expressionEvaluator(evaluator);
    }

    private FormSession open(FormEngineConfig config, Item... items) {
        FormSession session = FormEngine.load(FormDefinition.of("test", items), config).open();
        session.ready().join();
        return session;
    }

    private FormSession open(Item... items) {
        return open(config().build(), items);
    }

    private static Item vitals() {
        return Item.builder("vitals", ItemType.GROUP).children(
                Item.builder("height", ItemType.INTEGER).build(),
                Item.builder("weight", ItemType.INTEGER).calculatedExpression(WEIGHT).build()).build();
    }

    private static Throwable causeOf(CompletableFuture<?> future) {
        CompletionException exception = assertThrows(CompletionException.class, future::join);
        return exception.getCause();
    }

    private static List<String> linkIds(ResponseDocument document) {
        return document.items().stream().map(ResponseItem::linkId).toList();
    }

    // ==================== Lifecycle ====================

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("A session should enter edit mode once its first pass is applied")
        void shouldStartInEdit() {
            FormSession session = open(vitals());

            EvaluationSnapshot snapshot = session.snapshot();
            assertEquals(FormMode.EDIT, snapshot.getMode());
            assertEquals(1, snapshot.getGeneration());
            assertEquals("test", snapshot.getFormId());
            assertFalse(session.isClosed());
        }

        @Test
        @DisplayName("A read-only session should start in review and refuse edits")
        void readOnlySessionShouldRefuseEdits() {
            FormSession session = open(config().readOnly(true).build(), vitals());

            assertEquals(FormMode.REVIEW, session.snapshot().getMode());
            assertInstanceOf(IllegalStateException.class, causeOf(session.setAnswer("vitals/height", 3)));
            assertInstanceOf(IllegalStateException.class, causeOf(session.setMode(FormMode.EDIT)));
        }

        @Test
        @DisplayName("Answers should be refused while reviewing")
        void reviewShouldRefuseEdits() {
            FormSession session = open(config().reviewEnabled(true).build(), vitals());

            session.setMode(FormMode.REVIEW).join();

            Throwable cause = causeOf(session.setAnswer("vitals/height", 3));
            assertInstanceOf(IllegalStateException.class, cause);
            assertTrue(cause.getMessage().contains("REVIEW"));

            session.setMode(FormMode.EDIT).join();
            assertEquals(List.of(6), session.setAnswer("vitals/height", 3).join().answers("vitals/weight"));
        }

        @Test
        @DisplayName("Cancelling should close the session and notify every listener")
        void cancelShouldNotifyListeners() {
            FormSession session = open(vitals());
            List<FormEvent> events = new ArrayList<>();
            session.addListener(event -> {
                throw new IllegalStateException("listener failure");
            });
            session.addListener(events::add);
            session.setAnswer("vitals/height", 5).join();

            ResponseDocument response = session.cancel().join();

            assertTrue(session.isClosed());
            assertTrue(session.snapshot().isClosed());
            assertEquals(1, events.size(), "a failing listener does not stop the others");
            assertEquals(FormEvent.Type.CANCELLED, events.get(0).type());
            assertEquals(session.getId(), events.get(0).sessionId());
            assertEquals(response, events.get(0).response());
            assertThrows(IllegalStateException.class, () -> session.setAnswer("vitals/height", 6));
        }
    }

    // ==================== Answers ====================

    @Nested
    @DisplayName("Answers")
    class Answers {

        @Test
        @DisplayName("A calculated value should follow its inputs until the user overrides it")
        void calculatedValueShouldYieldToUser() {
            FormSession session = open(vitals());

            assertEquals(List.of(20), session.setAnswer("vitals/height", 10).join().answers("vitals/weight"));

            session.setAnswer("vitals/weight", 99).join();
            EvaluationSnapshot overridden = session.setAnswer("vitals/height", 11).join();
            assertEquals(List.of(99), overridden.answers("vitals/weight"));

            EvaluationSnapshot recalculated = session.clearUserEdited(LinkIdPath.parse("vitals/weight")).join();
            assertEquals(List.of(22), recalculated.answers("vitals/weight"));
        }

        @Test
        @DisplayName("Mistakes detectable from the definition should throw right away")
        void definitionMistakesShouldThrow() {
            FormSession session = open(vitals(), Item.builder("name", ItemType.STRING).build());

            assertThrows(SynchronizationException.class, () -> session.setAnswer("vitals", "x"));
            assertThrows(SynchronizationException.class, () -> session.setAnswer("unknown", "x"));
            assertThrows(IllegalArgumentException.class, () -> session.setAnswer("name", "a", "b"));
            assertThrows(SynchronizationException.class, () -> session.addRepeatedInstance("name"));
        }

        @Test
        @DisplayName("Cyclic expressions should surface as errors without blocking the session")
        void cyclicExpressionsShouldSurface() {
            String readsB = "%resource.item.where(linkId = 'b').answer.value + 1";
            String readsA = "%resource.item.where(linkId = 'a').answer.value + 1";
            FormSession session = open(Item.builder("a", ItemType.INTEGER).calculatedExpression(readsB).build(),
                    Item.builder("b", ItemType.INTEGER).calculatedExpression(readsA).build(),
                    Item.builder("c", ItemType.STRING).build());

            EvaluationSnapshot snapshot = session.setAnswer("c", "still works").join();

            List<ExpressionError> errors = snapshot.errorsFor("a");
            assertEquals(1, errors.size());
            assertTrue(errors.get(0).cyclic());
            List<ExpressionError> otherErrors = snapshot.errorsFor("b");
            assertEquals(1, otherErrors.size());
            assertTrue(otherErrors.get(0).cyclic());
            assertEquals(List.of("still works"), snapshot.answers("c"));
        }

        @Test
        @DisplayName("An enable expression should hide a group and keep it out of the submission")
        void enableExpressionShouldHideGroup() {
            FormSession session = open(Item.builder("hasAddress", ItemType.BOOLEAN).build(),
                    Item.builder("address", ItemType.GROUP).enableWhenExpression(HAS_ADDRESS)
                            .children(Item.builder("street", ItemType.STRING).build())
                            .build());

            assertFalse(session.snapshot().isEnabled("address/street"));
            assertEquals(List.of("hasAddress", "address"), linkIds(session.responseDocument()));
            assertEquals(List.of("hasAddress"), linkIds(session.submissionDocument()));

            EvaluationSnapshot enabled = session.setAnswer("hasAddress", true).join();

            assertTrue(enabled.isEnabled("address/street"));
            assertEquals(List.of("hasAddress", "address"), linkIds(enabled.getSubmission()));
        }

        @Test
        @DisplayName("Hiding a group should drop its invalid results from validation")
        void hidingGroupShouldDropItsInvalidResults() {
            FormSession session = open(Item.builder("hasAddress", ItemType.BOOLEAN).build(),
                    Item.builder("address", ItemType.GROUP).enableWhenExpression(HAS_ADDRESS)
                            .children(Item.builder("street", ItemType.STRING).required(true).build())
                            .build());
            session.setAnswer("hasAddress", true).join();

            // Given
            Map<LinkIdPath, ValidationResult> shown = session.validateAll().join();
            assertTrue(shown.get(LinkIdPath.parse("address/street")).isInvalid());

            // When
            session.setAnswer("hasAddress", false).join();
            Map<LinkIdPath, ValidationResult> hidden = session.validateAll().join();

            // Then
            assertFalse(hidden.containsKey(LinkIdPath.parse("address/street")));
            assertTrue(hidden.values().stream().noneMatch(ValidationResult::isInvalid));
            assertTrue(hidden.get(LinkIdPath.of("hasAddress")).isValid());
        }

        @Test
        @DisplayName("Clearing all answers should let calculated values apply again")
        void clearAllAnswersShouldResetOverrides() {
            FormSession session = open(vitals());
            session.setAnswer("vitals/height", 10).join();
            session.setAnswer("vitals/weight", 99).join();

            EvaluationSnapshot cleared = session.clearAllAnswers().join();

            assertEquals(List.of(), cleared.answers("vitals/height"));
            assertEquals(List.of(), cleared.answers("vitals/weight"));
            assertEquals(List.of(22), session.setAnswer("vitals/height", 11).join().answers("vitals/weight"));
        }

        @Test
        @DisplayName("A null answer value should be rejected")
        void nullAnswerShouldBeRejected() {
            FormSession session = open(Item.builder("name", ItemType.STRING).build());

            NullPointerException exception = assertThrows(NullPointerException.class,
                    () -> session.setAnswer("name", (Object) null));
            assertTrue(exception.getMessage().contains("cannot be null"));
        }
    }

    // ==================== Repeated groups ====================

    @Nested
    @DisplayName("Repeated groups")
    class RepeatedGroups {

        private Item members() {
            return Item.builder("member", ItemType.GROUP).repeats(true).required(true)
                    .children(Item.builder("name", ItemType.STRING).build())
                    .build();
        }

        @Test
        @DisplayName("A required repeated group should be valid once it has an instance")
        void requiredGroupNeedsInstance() {
            FormSession session = open(members());

            assertTrue(session.validateAll().join().get(LinkIdPath.of("member")).isInvalid());

            EvaluationSnapshot snapshot = session.addRepeatedInstance("member").join();
            assertTrue(snapshot.validation("member").isValid());
            assertTrue(snapshot.item("member[0]").isPresent());

            snapshot = session.setAnswer("member[0]/name", "Ann").join();
            assertEquals(List.of("Ann"), snapshot.answers("member[0]/name"));
        }

        @Test
        @DisplayName("Removing a missing instance should fail the future")
        void removingMissingInstanceShouldFail() {
            FormSession session = open(members());

            assertInstanceOf(SynchronizationException.class, causeOf(session.removeRepeatedInstance("member", 3)));
            assertEquals(FormMode.EDIT, session.snapshot().getMode());
        }
    }

    // ==================== Submission ====================

    @Nested
    @DisplayName("Submission")
    class Submission {

        @Test
        @DisplayName("Submitting should be refused until required answers are given")
        void submissionShouldWaitForRequiredAnswers() {
            FormSession session = open(config().reviewEnabled(true).build(),
                    Item.builder("name", ItemType.STRING).required(true).build());
            FormEventListener listener = mock(FormEventListener.class);
            session.addListener(listener);

            SubmissionOutcome refused = session.submit().join();
            assertFalse(refused.accepted());
            assertTrue(refused.invalid().containsKey(LinkIdPath.of("name")));
            verifyNoInteractions(listener);

            session.setAnswer("name", "Ann").join();
            session.setMode(FormMode.REVIEW).join();
            SubmissionOutcome accepted = session.submit().join();

            assertTrue(accepted.accepted());
            assertEquals(List.of("name"), linkIds(accepted.response()));
            assertTrue(session.isClosed());
            verify(listener).onEvent(argThat(event -> event.type() == FormEvent.Type.SUBMITTED
                    && event.response().equals(accepted.response())));
            assertThrows(IllegalStateException.class, session::submit);
        }
    }

    // ==================== Pages ====================

    @Nested
    @DisplayName("Pages")
    class Pages {

        private Item[] pages() {
            return new Item[]{
                    Item.builder("identity", ItemType.GROUP).itemControl(ItemControl.PAGE)
                            .children(Item.builder("name", ItemType.STRING).required(true).build()).build(),
                    Item.builder("contact", ItemType.GROUP).itemControl(ItemControl.PAGE)
                            .children(Item.builder("email", ItemType.STRING).build()).build()
            };
        }

        @Test
        @DisplayName("Linear navigation should stop on a page with invalid answers")
        void linearNavigationShouldStop() {
            FormSession session = open(pages());
            assertEquals(0, session.snapshot().getPagination().currentPage());
            assertEquals(50, session.snapshot().getPagination().progressPercent());

            EvaluationSnapshot blocked = session.nextPage().join();
            assertEquals(0, blocked.getPagination().currentPage());
            assertTrue(blocked.validation("identity/name").isInvalid(), "blocking answers are revealed");

            session.setAnswer("identity/name", "Ann").join();
            EvaluationSnapshot moved = session.nextPage().join();
            assertEquals(1, moved.getPagination().currentPage());
            assertEquals(100, moved.getPagination().progressPercent());
            assertFalse(moved.getPagination().hasNext());

            assertEquals(0, session.previousPage().join().getPagination().currentPage());
        }

        @Test
        @DisplayName("Free navigation should jump to any enabled page")
        void freeNavigationShouldJump() {
            FormSession session = open(config().navigationPolicy(NavigationPolicy.NON_LINEAR).build(), pages());

            assertEquals(1, session.goToPage(1).join().getPagination().currentPage());
            assertInstanceOf(IllegalArgumentException.class, causeOf(session.goToPage(5)));
        }

        @Test
        @DisplayName("A form without pages should refuse page navigation")
        void unpaginatedFormShouldRefuse() {
            FormSession session = open(vitals());

            assertFalse(session.snapshot().getPagination().isPaginated());
            assertInstanceOf(IllegalStateException.class, causeOf(session.goToPage(0)));
        }
    }

    // ==================== Initial values ====================

    @Nested
    @DisplayName("Initial values")
    class InitialValues {

        @Test
        @DisplayName("Restored answers should win over static initial values, which win over expressions")
        void initialPrecedence() {
            evaluator.on("'expr'", ctx -> EvaluationResult.success("expr"));
            FormEngine engine = FormEngine.load(FormDefinition.of("test",
                    Item.builder("q", ItemType.STRING).initial("static").initialExpression("'expr'").build(),
                    Item.builder("r", ItemType.STRING).initialExpression("'expr'").build()), config().build());

            EvaluationSnapshot fresh = engine.open().ready().join();
            assertEquals(List.of("static"), fresh.answers("q"));
            assertEquals(List.of("expr"), fresh.answers("r"));

            EvaluationSnapshot resumed = engine.open(new ResponseDocument("test",
                    List.of(ResponseItem.answered("q", "restored")))).ready().join();
            assertEquals(List.of("restored"), resumed.answers("q"));
        }

        @Test
        @DisplayName("Launch values given at opening should override configured ones")
        void launchContextShouldMerge() {
            evaluator.on("%launch.country", ctx -> EvaluationResult.success(ctx.launchContext().get("country")));
            FormEngine engine = FormEngine.load(FormDefinition.of("test",
                            Item.builder("country", ItemType.STRING).initialExpression("%launch.country").build()),
                    config().launchContext("country", "BE").build());

            assertEquals(List.of("BE"), engine.open().ready().join().answers("country"));
            assertEquals(List.of("FR"), engine.open(null, Map.of("country", "FR")).ready().join().answers("country"));
        }
    }

    // ==================== Concurrency ====================

    @Nested
    @DisplayName("Pass scheduling")
    class PassScheduling {

        @Test
        @DisplayName("A superseded pass should be discarded and its callers served by the newer one")
        void supersededPassShouldBeDiscarded() {
            // Given an evaluation executor run by hand
            List<Runnable> pending = new ArrayList<>();
            FormEngine engine = FormEngine.load(FormDefinition.of("test", vitals()),
                    config().evaluationExecutor(pending::add).build());
            FormSession session = engine.open();
            assertEquals(FormMode.INIT, session.snapshot().getMode());

            // When a mutation arrives before the first pass is applied
            CompletableFuture<EvaluationSnapshot> first = session.setAnswer("vitals/height", 1);
            pending.remove(0).run();

            // Then it waits for that pass and requests its own
            assertTrue(session.ready().isDone());
            assertFalse(first.isDone());
            assertEquals(1, pending.size());

            // When a newer mutation supersedes it
            CompletableFuture<EvaluationSnapshot> second = session.setAnswer("vitals/height", 2);
            pending.remove(0).run();
            assertFalse(first.isDone(), "the superseded pass is discarded");
            pending.remove(0).run();

            // Then
            assertTrue(first.isDone());
            assertSame(first.join(), second.join());
            assertEquals(List.of(4), second.join().answers("vitals/weight"));
            assertEquals(3, second.join().getGeneration());
        }
    }
}
