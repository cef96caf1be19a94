package io.github.cyfko.formstate.core.evaluation;

import io.github.cyfko.formstate.core.ScriptedEvaluator;
import io.github.cyfko.formstate.core.dependency.DependencyResolver;
import io.github.cyfko.formstate.core.dependency.ExpressionKind;
import io.github.cyfko.formstate.core.dependency.ReferenceScanner;
import io.github.cyfko.formstate.core.model.Answer;
import io.github.cyfko.formstate.core.model.EnableWhen;
import io.github.cyfko.formstate.core.model.EnableWhenOperator;
import io.github.cyfko.formstate.core.model.Expression;
import io.github.cyfko.formstate.core.model.FormDefinition;
import io.github.cyfko.formstate.core.model.Item;
import io.github.cyfko.formstate.core.model.ItemType;
import io.github.cyfko.formstate.core.model.LinkIdPath;
import io.github.cyfko.formstate.core.model.ResponseNode;
import io.github.cyfko.formstate.core.model.ResponseTree;
import io.github.cyfko.formstate.core.spi.EvaluationResult;
import io.github.cyfko.formstate.core.sync.ResponseTreeSynchronizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.github.cyfko.formstate.core.ScriptedEvaluator.firstNumber;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EvaluationEngine Tests")
class EvaluationEngineTest {

    private static final String HEIGHT = "%resource.item.where(linkId = 'height').answer.value";
    private static final String WEIGHT = HEIGHT + " * 2";

    private ScriptedEvaluator evaluator;
    private ResponseTreeSynchronizer synchronizer;
    private FormDefinition definition;
    private ResponseTree tree;
    private EvaluationEngine engine;

    @BeforeEach
    void setUp() {
        evaluator = new ScriptedEvaluator()
                .on(WEIGHT, ctx -> {
                    Number height = firstNumber(ctx, "height");
                    return height == null ? EvaluationResult.empty() : EvaluationResult.success(height.intValue() * 2);
                });
        synchronizer = new ResponseTreeSynchronizer();
    }

    private void load(Item... items) {
        load(new FormDefinition("test", List.of(items), List.of()));
    }

    private void load(FormDefinition form) {
        definition = form;
        tree = synchronizer.create(definition, null, new ArrayList<>());
        engine = new EvaluationEngine(definition, new DependencyResolver(new ReferenceScanner()).resolve(definition), evaluator);
    }

    private ResponseNode node(String path) {
        return tree.find(LinkIdPath.parse(path)).orElseThrow();
    }

    private void answer(String path, Object... values) {
        List<Answer> answers = new ArrayList<>();
        for (Object value : values) {
            answers.add(Answer.edited(value));
        }
        node(path).replaceAnswers(answers);
    }

    private EvaluationEngine.PassResult fullPass() {
        return engine.evaluate(tree, Set.of(), EvaluationState.empty(), true, Map.of());
    }

    // ==================== Calculated values ====================

    @Nested
    @DisplayName("Calculated values")
    class CalculatedValues {

        @Test
        @DisplayName("Should write the calculated value and recompute only what a change affects")
        void shouldRecomputeIncrementally() {
            // Given
            load(Item.builder("height", ItemType.INTEGER).build(),
                    Item.builder("weight", ItemType.INTEGER).calculatedExpression(WEIGHT).build(),
                    Item.builder("note", ItemType.STRING).build());
            answer("height", 10);

            // When
            EvaluationEngine.PassResult first = fullPass();

            // Then
            assertEquals(List.of(20), node("weight").answerValues());
            assertFalse(node("weight").getAnswers().get(0).isUserEdited());
            assertEquals(1, first.evaluations());

            // When the height changes
            answer("height", 12);
            EvaluationEngine.PassResult second = engine.evaluate(tree, Set.of("height"), first.state(), false, Map.of());

            // Then
            assertEquals(List.of(24), node("weight").answerValues());
            assertEquals(1, second.evaluations());
            assertEquals(List.of(24), second.state().calculated(node("weight").getNodeId()).orElseThrow());

            // When something unrelated changes
            EvaluationEngine.PassResult third = engine.evaluate(tree, Set.of("note"), second.state(), false, Map.of());

            // Then
            assertEquals(0, third.evaluations());
        }

        @Test
        @DisplayName("Should never overwrite answers edited by the user")
        void shouldNotOverwriteUserEdits() {
            load(Item.builder("height", ItemType.INTEGER).build(),
                    Item.builder("weight", ItemType.INTEGER).calculatedExpression(WEIGHT).build());
            answer("height", 10);
            answer("weight", 99);

            fullPass();

            assertEquals(List.of(99), node("weight").answerValues());
            assertEquals(0, evaluator.callsTo(WEIGHT));
        }

        @Test
        @DisplayName("Should record values that do not fit the item type and leave answers alone")
        void shouldRecordIncoercibleValues() {
            evaluator.on("'abc'", ctx -> EvaluationResult.success("abc"));
            load(Item.builder("count", ItemType.INTEGER).initial(1).calculatedExpression("'abc'").build());

            EvaluationEngine.PassResult result = fullPass();

            assertEquals(List.of(1), node("count").answerValues());
            ExpressionError error = result.state().errors().iterator().next();
            assertEquals("count", error.location());
            assertEquals(ExpressionKind.CALCULATED, error.kind());
            assertTrue(error.message().contains("not a valid INTEGER answer"));
        }

        @Test
        @DisplayName("Should keep only the first value for a non-repeating item")
        void shouldKeepFirstValueForNonRepeating() {
            evaluator.on("(1 | 2)", ctx -> EvaluationResult.success(1, 2));
            load(Item.builder("single", ItemType.INTEGER).calculatedExpression("(1 | 2)").build(),
                    Item.builder("many", ItemType.INTEGER).repeats(true).calculatedExpression("(1 | 2)").build());

            fullPass();

            assertEquals(List.of(1), node("single").answerValues());
            assertEquals(List.of(1, 2), node("many").answerValues());
        }
    }

    // ==================== Failures and cycles ====================

    @Nested
    @DisplayName("Failures and cycles")
    class FailuresAndCycles {

        @Test
        @DisplayName("Cyclic expressions should be reported and skipped")
        void cyclicExpressionsShouldBeSkipped() {
            String readsB = "%resource.item.where(linkId = 'b').answer.value + 1";
            String readsA = "%resource.item.where(linkId = 'a').answer.value + 1";
            load(Item.builder("a", ItemType.INTEGER).calculatedExpression(readsB).build(),
                    Item.builder("b", ItemType.INTEGER).calculatedExpression(readsA).build());

            EvaluationEngine.PassResult result = fullPass();

            assertEquals(2, result.state().errors().size());
            assertTrue(result.state().errors().stream().allMatch(ExpressionError::cyclic));
            assertEquals(Set.of("a", "b"), result.state().errors().stream().map(ExpressionError::linkId).collect(java.util.stream.Collectors.toSet()));
            assertEquals(0, evaluator.callsTo(readsA) + evaluator.callsTo(readsB));
            assertFalse(node("a").hasAnswers());
        }

        @Test
        @DisplayName("A throwing evaluator should be recorded, not propagated")
        void throwingEvaluatorShouldBeRecorded() {
            evaluator.on("boom()", ctx -> {
                throw new IllegalStateException("boom");
            });
            load(Item.builder("x", ItemType.STRING).calculatedExpression("boom()").build());

            EvaluationEngine.PassResult result = assertDoesNotThrow(EvaluationEngineTest.this::fullPass);

            assertEquals("boom", result.state().errors().iterator().next().message());
        }

        @Test
        @DisplayName("An error should clear once the expression succeeds again")
        void errorShouldClearOnSuccess() {
            String flaky = "%resource.item.where(linkId = 'height').answer.value.flaky()";
            evaluator.on(flaky, ctx -> firstNumber(ctx, "height") == null
                    ? EvaluationResult.failure("no height")
                    : EvaluationResult.success(firstNumber(ctx, "height")));
            load(Item.builder("height", ItemType.INTEGER).build(),
                    Item.builder("copy", ItemType.INTEGER).calculatedExpression(flaky).build());

            EvaluationEngine.PassResult first = fullPass();
            assertEquals(1, first.state().errors().size());

            answer("height", 3);
            EvaluationEngine.PassResult second = engine.evaluate(tree, Set.of("height"), first.state(), false, Map.of());

            assertTrue(second.state().errors().isEmpty());
            assertEquals(List.of(3), node("copy").answerValues());
        }
    }

    // ==================== Enablement ====================

    @Nested
    @DisplayName("Enablement")
    class Enablement {

        private static final String HAS_ADDRESS = "%resource.item.where(linkId = 'hasAddress').answer.value = true";

        @Test
        @DisplayName("An enable expression should switch a group and its subtree")
        void enableExpressionShouldSwitchSubtree() {
            evaluator.on(HAS_ADDRESS, ctx -> EvaluationResult.success(ctx.answers("hasAddress").contains(true)));
            load(Item.builder("hasAddress", ItemType.BOOLEAN).build(),
                    Item.builder("address", ItemType.GROUP).enableWhenExpression(HAS_ADDRESS)
                            .children(Item.builder("street", ItemType.STRING).build())
                            .build());

            EvaluationEngine.PassResult first = fullPass();
            assertFalse(first.form().isEnabled(node("address")));
            assertFalse(first.form().isEnabled(node("address/street")));

            answer("hasAddress", true);
            EvaluationEngine.PassResult second = engine.evaluate(tree, Set.of("hasAddress"), first.state(), false, Map.of());

            assertTrue(second.form().isEnabled(node("address/street")));
        }

        @Test
        @DisplayName("A failing enable expression should leave the item enabled")
        void failingEnableExpressionShouldEnable() {
            load(Item.builder("q", ItemType.STRING).enableWhenExpression("unknown()").build());

            EvaluationEngine.PassResult result = fullPass();

            assertTrue(result.form().isEnabled(node("q")));
            assertEquals(ExpressionKind.ENABLE_WHEN, result.state().errors().iterator().next().kind());
        }

        @Test
        @DisplayName("Declarative conditions should follow the enable behavior")
        void declarativeConditions() {
            load(Item.builder("flag", ItemType.BOOLEAN).build(),
                    Item.builder("whenTrue", ItemType.STRING).enableWhen(EnableWhen.equalTo("flag", true)).build(),
                    Item.builder("whenMissing", ItemType.STRING).enableWhen(EnableWhen.exists("flag", false)).build());

            EvaluationEngine.PassResult first = fullPass();
            assertFalse(first.form().isEnabled(node("whenTrue")));
            assertTrue(first.form().isEnabled(node("whenMissing")));

            answer("flag", true);
            EvaluationEngine.PassResult second = engine.evaluate(tree, Set.of("flag"), first.state(), false, Map.of());
            assertTrue(second.form().isEnabled(node("whenTrue")));
            assertFalse(second.form().isEnabled(node("whenMissing")));
        }

        @Test
        @DisplayName("Answers of disabled items should be invisible to expressions")
        void disabledAnswersShouldBeInvisible() {
            String copy = "%resource.item.where(linkId = 'secret').answer.value";
            evaluator.on(copy, ctx -> EvaluationResult.success(ctx.answers("secret")));
            load(Item.builder("show", ItemType.BOOLEAN).build(),
                    Item.builder("secret", ItemType.STRING).enableWhen(EnableWhen.equalTo("show", true)).build(),
                    Item.builder("copy", ItemType.STRING).calculatedExpression(copy).build());
            answer("secret", "hidden");

            fullPass();

            assertFalse(node("copy").hasAnswers());
        }

        @Test
        @DisplayName("A condition on a repeated group should govern the slot and every instance")
        void repeatedGroupConditionShouldGovernSlot() {
            Item children = Item.builder("children", ItemType.GROUP).repeats(true)
                    .enableWhen(EnableWhen.equalTo("hasKids", true))
                    .children(Item.builder("name", ItemType.STRING).build())
                    .build();
            load(Item.builder("hasKids", ItemType.BOOLEAN).build(), children);
            synchronizer.addInstance(definition, tree, LinkIdPath.of("children"));

            EvaluationEngine.PassResult first = fullPass();
            assertFalse(first.form().isSlotEnabled(tree.getRoot(), children));
            assertFalse(first.form().isEnabled(node("children[0]/name")));

            answer("hasKids", true);
            EvaluationEngine.PassResult second = engine.evaluate(tree, Set.of("hasKids"), first.state(), false, Map.of());
            assertTrue(second.form().isSlotEnabled(tree.getRoot(), children));
            assertTrue(second.form().isEnabled(node("children[0]")));
        }

        @Test
        @DisplayName("Operators should compare answers with the expected value")
        void operatorsShouldCompare() {
            assertTrue(EvaluationEngine.holds(new EnableWhen("age", EnableWhenOperator.GREATER_THAN, 17), List.of(18)));
            assertFalse(EvaluationEngine.holds(new EnableWhen("age", EnableWhenOperator.GREATER_THAN, 17), List.of(17)));
            assertTrue(EvaluationEngine.holds(new EnableWhen("age", EnableWhenOperator.LESS_OR_EQUAL, 17), List.of(17)));
            assertFalse(EvaluationEngine.holds(new EnableWhen("age", EnableWhenOperator.NOT_EQUAL, 17), List.of()));
            assertTrue(EvaluationEngine.holds(new EnableWhen("age", EnableWhenOperator.NOT_EQUAL, 17), List.of(18)));
            assertFalse(EvaluationEngine.holds(EnableWhen.exists("name", true), List.of("  ")));
        }
    }

    // ==================== Variables ====================

    @Nested
    @DisplayName("Variables")
    class Variables {

        @Test
        @DisplayName("Form variables should be visible to items")
        void formVariablesShouldBeVisible() {
            evaluator.on("2", ctx -> EvaluationResult.success(2))
                    .on("%factor * 3", ctx -> EvaluationResult.success(
                            ((Number) ctx.variable("factor").orElseThrow().get(0)).intValue() * 3));
            load(new FormDefinition("test",
                    List.of(Item.builder("scaled", ItemType.INTEGER).calculatedExpression("%factor * 3").build()),
                    List.of(Expression.variable("factor", "2"))));

            EvaluationEngine.PassResult result = fullPass();

            assertEquals(List.of(6), node("scaled").answerValues());
            assertEquals(Map.of("factor", List.of(2)), result.state().variablesAt(tree.getRoot().getNodeId()));
        }

        @Test
        @DisplayName("A failing variable should be absent and reported at form level")
        void failingVariableShouldBeAbsent() {
            evaluator.on("%factor * 3", ctx -> ctx.variable("factor").isPresent()
                    ? EvaluationResult.success(1)
                    : EvaluationResult.empty());
            load(new FormDefinition("test",
                    List.of(Item.builder("scaled", ItemType.INTEGER).calculatedExpression("%factor * 3").build()),
                    List.of(Expression.variable("factor", "broken("))));

            EvaluationEngine.PassResult result = fullPass();

            assertFalse(node("scaled").hasAnswers());
            ExpressionError error = result.state().errors().iterator().next();
            assertEquals("<form>", error.location());
            assertNull(error.linkId());
        }

        @Test
        @DisplayName("Item variables should shadow form variables")
        void itemVariablesShouldShadow() {
            evaluator.on("'form'", ctx -> EvaluationResult.success("form"))
                    .on("'group'", ctx -> EvaluationResult.success("group"))
                    .on("%v", ctx -> EvaluationResult.success(ctx.variable("v").orElseThrow()));
            Item group = Item.builder("group", ItemType.GROUP).variable("v", "'group'")
                    .children(Item.builder("inner", ItemType.STRING).calculatedExpression("%v").build())
                    .build();
            load(new FormDefinition("test", List.of(group,
                    Item.builder("outer", ItemType.STRING).calculatedExpression("%v").build()),
                    List.of(Expression.variable("v", "'form'"))));

            fullPass();

            assertEquals(List.of("group"), node("group/inner").answerValues());
            assertEquals(List.of("form"), node("outer").answerValues());
        }
    }

    // ==================== Options ====================

    @Nested
    @DisplayName("Answer options")
    class AnswerOptions {

        private static final String PALETTE = "%resource.item.where(linkId = 'palette').answer.value.colors()";
        private static final String ALLOW_RED = "%resource.item.where(linkId = 'allowRed').answer.value";

        @Test
        @DisplayName("Evaluated options should replace static ones and prune stale answers")
        void evaluatedOptionsShouldPrune() {
            evaluator.on(PALETTE, ctx -> ctx.answers("palette").contains("cool")
                    ? EvaluationResult.success("blue", "green")
                    : EvaluationResult.success("red", "blue"));
            load(Item.builder("palette", ItemType.STRING).build(),
                    Item.builder("color", ItemType.CHOICE).answerExpression(PALETTE).build());
            answer("color", "red");

            EvaluationEngine.PassResult first = fullPass();
            assertEquals(List.of("red"), node("color").answerValues());
            assertEquals(List.of("red", "blue"), first.form().optionsFor(node("color")));

            answer("palette", "cool");
            EvaluationEngine.PassResult second = engine.evaluate(tree, Set.of("palette"), first.state(), false, Map.of());

            assertEquals(List.of("blue", "green"), second.form().optionsFor(node("color")));
            assertFalse(node("color").hasAnswers());
        }

        @Test
        @DisplayName("A failing options expression should fall back to static options")
        void failingOptionsShouldFallBack() {
            load(Item.builder("color", ItemType.CHOICE).options("red", "blue").answerExpression("unknown()").build());

            EvaluationEngine.PassResult result = fullPass();

            assertEquals(List.of("red", "blue"), result.form().optionsFor(node("color")));
            assertEquals(1, result.state().errors().size());
        }

        @Test
        @DisplayName("Toggles should switch the options they list")
        void togglesShouldSwitchOptions() {
            evaluator.on(ALLOW_RED, ctx -> EvaluationResult.success(ctx.answers("allowRed").contains(true)));
            load(Item.builder("allowRed", ItemType.BOOLEAN).build(),
                    Item.builder("color", ItemType.CHOICE).options("red", "blue", "green")
                            .answerOptionsToggle(ALLOW_RED, "red")
                            .answerOptionsToggle("unknown()", "green")
                            .build());
            answer("color", "red");

            EvaluationEngine.PassResult first = fullPass();
            assertEquals(List.of("blue"), first.form().optionsFor(node("color")), "failed toggles count as false");
            assertFalse(node("color").hasAnswers());

            answer("allowRed", true);
            EvaluationEngine.PassResult second = engine.evaluate(tree, Set.of("allowRed"), first.state(), false, Map.of());
            assertEquals(List.of("red", "blue"), second.form().optionsFor(node("color")));
        }
    }

    // ==================== Initial expressions ====================

    @Nested
    @DisplayName("Initial expressions")
    class InitialExpressions {

        @Test
        @DisplayName("Should seed an empty node once, from the launch context")
        void shouldSeedOnce() {
            evaluator.on("%launch.country", ctx -> EvaluationResult.success(ctx.launchContext().get("country")));
            load(Item.builder("country", ItemType.STRING).initialExpression("%launch.country").build());

            EvaluationEngine.PassResult first = engine.evaluate(tree, Set.of(), EvaluationState.empty(), true, Map.of("country", "FR"));
            assertEquals(List.of("FR"), node("country").answerValues());

            node("country").clearAnswers();
            engine.evaluate(tree, Set.of(), first.state(), true, Map.of("country", "FR"));

            assertFalse(node("country").hasAnswers(), "an initial expression runs only for new nodes");
        }

        @Test
        @DisplayName("Static initial values should win over the initial expression")
        void staticInitialShouldWin() {
            evaluator.on("'expr'", ctx -> EvaluationResult.success("expr"));
            load(Item.builder("q", ItemType.STRING).initial("static").initialExpression("'expr'").build());

            fullPass();

            assertEquals(List.of("static"), node("q").answerValues());
            assertEquals(0, evaluator.callsTo("'expr'"));
        }
    }
}
