package io.github.cyfko.formstate.core.validation;

import io.github.cyfko.formstate.core.ScriptedEvaluator;
import io.github.cyfko.formstate.core.dependency.DependencyResolver;
import io.github.cyfko.formstate.core.dependency.ReferenceScanner;
import io.github.cyfko.formstate.core.evaluation.EvaluatedForm;
import io.github.cyfko.formstate.core.evaluation.EvaluationEngine;
import io.github.cyfko.formstate.core.evaluation.EvaluationState;
import io.github.cyfko.formstate.core.model.Answer;
import io.github.cyfko.formstate.core.model.Attachment;
import io.github.cyfko.formstate.core.model.Constraint;
import io.github.cyfko.formstate.core.model.EnableWhen;
import io.github.cyfko.formstate.core.model.FormDefinition;
import io.github.cyfko.formstate.core.model.Item;
import io.github.cyfko.formstate.core.model.ItemType;
import io.github.cyfko.formstate.core.model.LinkIdPath;
import io.github.cyfko.formstate.core.model.ResponseNode;
import io.github.cyfko.formstate.core.model.ResponseTree;
import io.github.cyfko.formstate.core.spi.AnswerConstraintValidator;
import io.github.cyfko.formstate.core.spi.EvaluationResult;
import io.github.cyfko.formstate.core.spi.ItemMatcherRegistry;
import io.github.cyfko.formstate.core.sync.ResponseTreeSynchronizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("ResponseValidator Tests")
class ResponseValidatorTest {

    private ScriptedEvaluator evaluator;
    private ItemMatcherRegistry<AnswerConstraintValidator> validators;
    private ResponseValidator validator;
    private ResponseTreeSynchronizer synchronizer;
    private FormDefinition definition;
    private ResponseTree tree;

    @BeforeEach
    void setUp() {
        evaluator = new ScriptedEvaluator();
        validators = new ItemMatcherRegistry<>();
        validator = new ResponseValidator(evaluator, validators);
        synchronizer = new ResponseTreeSynchronizer();
    }

    private void load(Item... items) {
        definition = new FormDefinition("test", List.of(items), List.of());
        tree = synchronizer.create(definition, null, new ArrayList<>());
    }

    private EvaluatedForm evaluate() {
        EvaluationEngine engine = new EvaluationEngine(definition,
                new DependencyResolver(new ReferenceScanner()).resolve(definition), evaluator);
        return engine.evaluate(tree, Set.of(), EvaluationState.empty(), true, Map.of()).form();
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
        node(path).setTouched(true);
    }

    private ValidationResult validateAll(String path) {
        return validator.validate(evaluate(), true).get(LinkIdPath.parse(path));
    }

    private static List<String> texts(List<ValidationMessage> messages) {
        return messages.stream().map(ValidationMessage::text).toList();
    }

    // ==================== Scope ====================

    @Nested
    @DisplayName("Scope")
    class Scope {

        @Test
        @DisplayName("Untouched nodes should not be validated unless everything is requested")
        void untouchedNodesShouldNotBeValidated() {
            load(Item.builder("name", ItemType.STRING).required(true).build());
            EvaluatedForm form = evaluate();

            assertEquals(ValidationResult.Status.NOT_VALIDATED,
                    validator.validate(form, false).get(LinkIdPath.of("name")).getStatus());
            assertTrue(validator.validate(form, true).get(LinkIdPath.of("name")).isInvalid());
        }

        @Test
        @DisplayName("Disabled subtrees should produce no entry")
        void disabledSubtreesShouldBeSkipped() {
            load(Item.builder("flag", ItemType.BOOLEAN).build(),
                    Item.builder("details", ItemType.GROUP).enableWhen(EnableWhen.equalTo("flag", true))
                            .children(Item.builder("text", ItemType.STRING).required(true).build())
                            .build());

            Map<LinkIdPath, ValidationResult> results = validator.validate(evaluate(), true);

            assertTrue(results.containsKey(LinkIdPath.of("flag")));
            assertFalse(results.containsKey(LinkIdPath.of("details")));
            assertFalse(results.containsKey(LinkIdPath.parse("details/text")));
        }

        @Test
        @DisplayName("Validating twice should give the same results and leave the tree alone")
        void validationShouldBeRepeatable() {
            load(Item.builder("age", ItemType.INTEGER).minValue(18).build());
            answer("age", 12);
            EvaluatedForm form = evaluate();

            Map<LinkIdPath, ValidationResult> first = validator.validate(form, true);
            Map<LinkIdPath, ValidationResult> second = validator.validate(form, true);

            assertEquals(first, second);
            assertEquals(List.of(12), node("age").answerValues());
        }
    }

    // ==================== Questions ====================

    @Nested
    @DisplayName("Questions")
    class Questions {

        @Test
        @DisplayName("A required question without answer should be invalid")
        void requiredQuestionWithoutAnswer() {
            load(Item.builder("name", ItemType.STRING).required(true).build());
            answer("name", "   ");

            ValidationResult result = validateAll("name");

            assertEquals(List.of("Missing answer for required field."), texts(result.getErrors()));
        }

        @Test
        @DisplayName("A non-repeating question should accept one answer only")
        void nonRepeatingShouldAcceptOneAnswer() {
            load(Item.builder("name", ItemType.STRING).build());
            answer("name", "a", "b");

            assertEquals(List.of("Only one answer allowed, found 2."), texts(validateAll("name").getErrors()));
        }

        @Test
        @DisplayName("Text longer than the maximum length should be invalid")
        void maxLength() {
            load(Item.builder("code", ItemType.STRING).maxLength(3).build());
            answer("code", "ABCD");

            assertEquals(List.of("The maximum number of characters that are permitted in the answer is: 3"),
                    texts(validateAll("code").getErrors()));
        }

        @Test
        @DisplayName("Values outside the bounds should be invalid")
        void bounds() {
            load(Item.builder("low", ItemType.DECIMAL).minValue(new BigDecimal("1.5")).build(),
                    Item.builder("high", ItemType.INTEGER).maxValue(10).build(),
                    Item.builder("fine", ItemType.INTEGER).minValue(0).maxValue(10).build());
            answer("low", new BigDecimal("1.2"));
            answer("high", 11);
            answer("fine", 10);

            Map<LinkIdPath, ValidationResult> results = validator.validate(evaluate(), true);

            assertEquals(List.of("Minimum value allowed is:1.5"), texts(results.get(LinkIdPath.of("low")).getErrors()));
            assertEquals(List.of("Maximum value allowed is:10"), texts(results.get(LinkIdPath.of("high")).getErrors()));
            assertTrue(results.get(LinkIdPath.of("fine")).isValid());
        }

        @Test
        @DisplayName("A choice answer should be among the offered options")
        void choiceShouldBeOffered() {
            load(Item.builder("color", ItemType.CHOICE).options("red", "blue").build());
            answer("color", "green");

            assertEquals(List.of("Value 'green' is not one of the available options."),
                    texts(validateAll("color").getErrors()));
        }

        @Test
        @DisplayName("Attachments should respect size and MIME types")
        void attachments() {
            load(Item.builder("scan", ItemType.ATTACHMENT).maxSizeBytes(1024).mimeTypes("image/").build());
            answer("scan", new Attachment("application/pdf", 4096, "file:///scan.pdf", "scan"));

            ValidationResult result = validateAll("scan");

            assertEquals(2, result.getErrors().size());
            assertTrue(result.getErrors().get(0).text().startsWith("Attachment is larger"));
        }
    }

    // ==================== Groups ====================

    @Nested
    @DisplayName("Groups")
    class Groups {

        @Test
        @DisplayName("A required group should need an answered descendant")
        void requiredGroupNeedsAnswer() {
            load(Item.builder("contact", ItemType.GROUP).required(true)
                    .children(Item.builder("phone", ItemType.STRING).build())
                    .build());

            assertEquals(List.of("Group 'contact' requires at least one answer."),
                    texts(validateAll("contact").getErrors()));

            answer("contact/phone", "555");
            assertTrue(validateAll("contact").isValid());
        }

        @Test
        @DisplayName("A required repeated group should need an instance")
        void requiredRepeatedGroupNeedsInstance() {
            load(Item.builder("member", ItemType.GROUP).repeats(true).required(true).maxOccurs(1)
                    .children(Item.builder("name", ItemType.STRING).build())
                    .build());

            assertEquals(List.of("At least one 'member' is required."), texts(validateAll("member").getErrors()));

            synchronizer.addInstance(definition, tree, LinkIdPath.of("member"));
            assertTrue(validateAll("member").isValid());

            synchronizer.addInstance(definition, tree, LinkIdPath.of("member"));
            assertEquals(List.of("At most 1 'member' allowed, found 2."), texts(validateAll("member").getErrors()));
        }
    }

    // ==================== Constraints and custom validators ====================

    @Nested
    @DisplayName("Constraints")
    class Constraints {

        private static final String EVEN = "%resource.item.where(linkId = 'n').answer.value mod 2 = 0";

        @Test
        @DisplayName("Violated constraints should report their message with their severity")
        void violatedConstraints() {
            evaluator.on(EVEN, ctx -> EvaluationResult.success(
                    ctx.currentAnswers().stream().allMatch(v -> ((Number) v).intValue() % 2 == 0)));
            load(Item.builder("n", ItemType.INTEGER)
                    .constraints(Constraint.error("even", EVEN, "Must be even"),
                            Constraint.warning("known", "unknown()", "Could not check"))
                    .build());
            answer("n", 3);

            ValidationResult result = validateAll("n");

            assertEquals(List.of("Must be even"), texts(result.getErrors()));
            assertEquals(List.of("Could not check"), texts(result.getWarnings()), "a failing expression counts as violated");
        }

        @Test
        @DisplayName("Only warnings should leave the result valid")
        void warningsOnlyShouldBeValid() {
            load(Item.builder("n", ItemType.INTEGER)
                    .constraints(Constraint.warning("known", "unknown()", "Could not check"))
                    .build());
            answer("n", 4);

            ValidationResult result = validateAll("n");

            assertTrue(result.isValid());
            assertEquals(1, result.getWarnings().size());
        }

        @Test
        @DisplayName("The custom validator matching the item should run")
        void customValidatorShouldRun() {
            // Given
            AnswerConstraintValidator phone = mock(AnswerConstraintValidator.class);
            when(phone.validate(any(), any())).thenReturn(List.of(ValidationMessage.error("Digits only.")));
            validators.register("phone", item -> item.getLinkId().equals("phone"), phone);
            load(Item.builder("phone", ItemType.STRING).build(), Item.builder("name", ItemType.STRING).build());
            answer("phone", "55-12");
            answer("name", "55-12");

            // When
            Map<LinkIdPath, ValidationResult> results = validator.validate(evaluate(), true);

            // Then
            assertEquals(List.of("Digits only."), texts(results.get(LinkIdPath.of("phone")).getErrors()));
            assertTrue(results.get(LinkIdPath.of("name")).isValid());
            verify(phone, times(1)).validate(argThat(item -> item.getLinkId().equals("phone")), eq(List.<Object>of("55-12")));
        }
    }
}
