package io.github.cyfko.formstate.core.dependency;

import io.github.cyfko.formstate.core.model.EnableWhen;
import io.github.cyfko.formstate.core.model.Expression;
import io.github.cyfko.formstate.core.model.FormDefinition;
import io.github.cyfko.formstate.core.model.Item;
import io.github.cyfko.formstate.core.model.ItemType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DependencyResolver Tests")
class DependencyResolverTest {

    private DependencyResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new DependencyResolver(new ReferenceScanner());
    }

    private static String answerOf(String linkId) {
        return "%resource.item.where(linkId = '" + linkId + "').answer.value";
    }

    private static ExpressionNode nodeOf(EvaluationOrder order, String linkId, ExpressionKind kind) {
        return order.nodes().stream()
                .filter(n -> n.item() != null && n.item().getLinkId().equals(linkId) && n.kind() == kind)
                .findFirst()
                .orElseThrow();
    }

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        @DisplayName("Readers should come after what they read, whatever the document order")
        void readersShouldComeAfterProducers() {
            // Given: bmi is declared before the weight it reads
            FormDefinition definition = FormDefinition.of("vitals",
                    Item.builder("bmi", ItemType.DECIMAL).calculatedExpression(answerOf("weight") + " / 2").build(),
                    Item.builder("height", ItemType.DECIMAL).build(),
                    Item.builder("weight", ItemType.DECIMAL).calculatedExpression(answerOf("height") + " * 2").build());

            // When
            EvaluationOrder order = resolver.resolve(definition);

            // Then
            ExpressionNode weight = nodeOf(order, "weight", ExpressionKind.CALCULATED);
            ExpressionNode bmi = nodeOf(order, "bmi", ExpressionKind.CALCULATED);
            assertTrue(order.position(weight) < order.position(bmi));
            assertEquals(List.of(bmi), order.successorsOf(weight));
            assertTrue(order.cyclicNodes().isEmpty());
        }

        @Test
        @DisplayName("Independent nodes should keep document order and kind priority")
        void independentNodesShouldKeepDocumentOrder() {
            FormDefinition definition = FormDefinition.of("f",
                    Item.builder("a", ItemType.STRING)
                            .calculatedExpression("'x'")
                            .enableWhenExpression("true")
                            .variable("v", "1")
                            .build(),
                    Item.builder("b", ItemType.STRING).calculatedExpression("'y'").build());

            EvaluationOrder order = resolver.resolve(definition);

            assertEquals(List.of("a:VARIABLE(%v)", "a:ENABLE_WHEN", "a:CALCULATED", "b:CALCULATED"),
                    order.nodes().stream().map(ExpressionNode::label).toList());
        }

        @Test
        @DisplayName("Variables should resolve to the nearest declaration")
        void variablesShouldResolveToNearestDeclaration() {
            Item inner = Item.builder("inner", ItemType.STRING).calculatedExpression("%v").build();
            Item group = Item.builder("group", ItemType.GROUP).variable("v", "'group'").children(inner).build();
            FormDefinition definition = new FormDefinition("f", List.of(group), List.of(Expression.variable("v", "'form'")));

            EvaluationOrder order = resolver.resolve(definition);

            ExpressionNode formVariable = order.nodes().stream().filter(ExpressionNode::isFormLevel).findFirst().orElseThrow();
            ExpressionNode groupVariable = nodeOf(order, "group", ExpressionKind.VARIABLE);
            ExpressionNode calculated = nodeOf(order, "inner", ExpressionKind.CALCULATED);
            assertTrue(order.successorsOf(formVariable).isEmpty());
            assertEquals(List.of(calculated), order.successorsOf(groupVariable));
        }
    }

    @Nested
    @DisplayName("Affected sets")
    class AffectedSets {

        @Test
        @DisplayName("Readers of an item should depend on its enable condition and its ancestors'")
        void readersShouldDependOnEnablement() {
            Item flag = Item.builder("flag", ItemType.BOOLEAN).build();
            Item street = Item.builder("street", ItemType.STRING).build();
            Item address = Item.builder("address", ItemType.GROUP)
                    .enableWhen(EnableWhen.equalTo("flag", true))
                    .children(street)
                    .build();
            Item label = Item.builder("label", ItemType.STRING).calculatedExpression(answerOf("street")).build();
            FormDefinition definition = FormDefinition.of("f", flag, address, label);

            EvaluationOrder order = resolver.resolve(definition);

            ExpressionNode enable = nodeOf(order, "address", ExpressionKind.ENABLE_WHEN);
            ExpressionNode calculated = nodeOf(order, "label", ExpressionKind.CALCULATED);
            assertEquals(Set.of(enable, calculated), order.affectedBy(List.of("flag")));
            assertEquals(Set.of(calculated), order.affectedBy(List.of("street")));
            assertTrue(order.affectedBy(List.of("label")).isEmpty());
        }

        @Test
        @DisplayName("Downstream closure should be transitive")
        void downstreamShouldBeTransitive() {
            FormDefinition definition = FormDefinition.of("f",
                    Item.builder("a", ItemType.INTEGER).build(),
                    Item.builder("b", ItemType.INTEGER).calculatedExpression(answerOf("a")).build(),
                    Item.builder("c", ItemType.INTEGER).calculatedExpression(answerOf("b")).build(),
                    Item.builder("d", ItemType.INTEGER).calculatedExpression(answerOf("c")).build());

            EvaluationOrder order = resolver.resolve(definition);

            ExpressionNode b = nodeOf(order, "b", ExpressionKind.CALCULATED);
            assertEquals(List.of("b", "c", "d"),
                    order.downstreamOf(b).stream().map(n -> n.item().getLinkId()).toList());
        }
    }

    @Nested
    @DisplayName("Cycles")
    class Cycles {

        @Test
        @DisplayName("Mutually dependent expressions should be flagged cyclic")
        void mutualDependencyShouldBeCyclic() {
            FormDefinition definition = FormDefinition.of("f",
                    Item.builder("a", ItemType.INTEGER).calculatedExpression(answerOf("b")).build(),
                    Item.builder("b", ItemType.INTEGER).calculatedExpression(answerOf("a")).build(),
                    Item.builder("c", ItemType.INTEGER).calculatedExpression(answerOf("a")).build());

            EvaluationOrder order = resolver.resolve(definition);

            assertEquals(List.of("a", "b"), order.cyclicNodes().stream().map(n -> n.item().getLinkId()).toList());
            assertFalse(order.isCyclic(nodeOf(order, "c", ExpressionKind.CALCULATED)));
            assertEquals(3, order.size(), "cyclic nodes stay in the order");
        }

        @Test
        @DisplayName("An expression reading its own item should be cyclic")
        void selfReferenceShouldBeCyclic() {
            FormDefinition definition = FormDefinition.of("f",
                    Item.builder("a", ItemType.INTEGER).calculatedExpression(answerOf("a") + " + 1").build());

            EvaluationOrder order = resolver.resolve(definition);

            assertTrue(order.isCyclic(order.nodes().get(0)));
        }
    }
}
