package io.github.cyfko.formstate.core.spi;

import io.github.cyfko.formstate.core.model.Item;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * Ordered registry of item handlers, each guarded by a predicate over the item it applies to.
 * <p>
 * Lookup walks the registrations in registration order and returns the handler of the first
 * matcher accepting the item. When several matchers accept the same item the earliest
 * registration therefore wins, deterministically.
 * </p>
 *
 * <p><strong>Concurrency:</strong> registrations are kept in a {@link CopyOnWriteArrayList};
 * lookups never block and see a consistent registration order.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * ItemMatcherRegistry<AnswerConstraintValidator> validators = new ItemMatcherRegistry<>();
 *
 * // Phone numbers get a dedicated check
 * validators.register("phone", item -> item.getItemControl().orElse(null) == ItemControl.PHONE_NUMBER,
 *         (item, answers) -> checkPhone(answers));
 *
 * Optional<AnswerConstraintValidator> validator = validators.find(item);
 *
 * // Remove a registration when no longer needed
 * validators.unregister("phone");
 * }</pre>
 *
 * @param <H> type of the handlers
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ItemMatcherRegistry<H> {

    private record Registration<H>(String name, Predicate<Item> matcher, H handler) {
    }

    private final List<Registration<H>> registrations = new CopyOnWriteArrayList<>();

    /**
     * Registers a handler after every existing registration.
     *
     * @param name    unique registration name
     * @param matcher items the handler applies to
     * @param handler the handler
     * @throws IllegalArgumentException if the name is already registered
     */
    public synchronized void register(String name, Predicate<Item> matcher, H handler) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(matcher, "matcher cannot be null");
        Objects.requireNonNull(handler, "handler cannot be null");
        if (isRegistered(name)) {
            throw new IllegalArgumentException("Matcher [" + name + "] is already registered.");
        }
        registrations.add(new Registration<>(name, matcher, handler));
    }

    /**
     * Removes a registration.
     *
     * @param name registration name
     * @return true if something was removed
     */
    public synchronized boolean unregister(String name) {
        return registrations.removeIf(r -> r.name().equals(name));
    }

    /**
     * Removes every registration.
     */
    public synchronized void unregisterAll() {
        registrations.clear();
    }

    public boolean isRegistered(String name) {
        return registrations.stream().anyMatch(r -> r.name().equals(name));
    }

    /**
     * Returns the handler of the first registration whose matcher accepts the item.
     *
     * @param item item to find a handler for
     * @return the handler, empty when no matcher accepts the item
     */
    public Optional<H> find(Item item) {
        if (item == null) return Optional.empty();
        for (Registration<H> registration : registrations) {
            if (registration.matcher().test(item)) {
                return Optional.of(registration.handler());
            }
        }
        return Optional.empty();
    }

    /**
     * @return registration names in registration order, a snapshot
     */
    public List<String> registeredNames() {
        List<String> names = new ArrayList<>();
        for (Registration<H> registration : registrations) {
            names.add(registration.name());
        }
        return Collections.unmodifiableList(names);
    }

    public int size() {
        return registrations.size();
    }
}
