package io.github.cyfko.formstate.core.spi;

import io.github.cyfko.formstate.core.model.Item;
import io.github.cyfko.formstate.core.validation.ValidationMessage;

import java.util.List;

/**
 * Custom answer check contributed by the host application, resolved per item through an
 * {@link ItemMatcherRegistry}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface AnswerConstraintValidator {

    /**
     * @param item    the item being validated
     * @param answers its current answer values
     * @return problems found, empty when the answers are acceptable
     */
    List<ValidationMessage> validate(Item item, List<Object> answers);
}
