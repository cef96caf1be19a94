package io.github.cyfko.formstate.core.spi;

import io.github.cyfko.formstate.core.model.Item;
import io.github.cyfko.formstate.core.model.ItemControl;
import io.github.cyfko.formstate.core.model.ItemType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ItemMatcherRegistry Tests")
class ItemMatcherRegistryTest {

    private ItemMatcherRegistry<String> registry;
    private Item phone;
    private Item text;

    @BeforeEach
    void setUp() {
        registry = new ItemMatcherRegistry<>();
        phone = Item.builder("phone", ItemType.STRING).itemControl(ItemControl.PHONE_NUMBER).build();
        text = Item.builder("text", ItemType.STRING).build();
    }

    @Test
    @DisplayName("Should find the handler of the matching registration")
    void shouldFindMatchingHandler() {
        registry.register("phone", item -> item.getItemControl().orElse(null) == ItemControl.PHONE_NUMBER, "phone-check");

        assertEquals(Optional.of("phone-check"), registry.find(phone));
        assertTrue(registry.find(text).isEmpty());
        assertTrue(registry.find(null).isEmpty());
    }

    @Test
    @DisplayName("First registration should win when several match")
    void firstRegistrationShouldWin() {
        registry.register("strings", item -> item.getType() == ItemType.STRING, "strings");
        registry.register("phone", item -> item.getItemControl().isPresent(), "phone");

        assertEquals(Optional.of("strings"), registry.find(phone));

        registry.unregister("strings");
        assertEquals(Optional.of("phone"), registry.find(phone));
    }

    @Test
    @DisplayName("Should reject duplicate names")
    void shouldRejectDuplicateNames() {
        registry.register("a", item -> true, "x");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> registry.register("a", item -> true, "y"));
        assertEquals("Matcher [a] is already registered.", e.getMessage());
    }

    @Test
    @DisplayName("Should list and clear registrations")
    void shouldListAndClear() {
        registry.register("a", item -> true, "x");
        registry.register("b", item -> true, "y");

        assertEquals(List.of("a", "b"), registry.registeredNames());
        assertTrue(registry.isRegistered("b"));
        assertFalse(registry.unregister("missing"));

        registry.unregisterAll();
        assertEquals(0, registry.size());
    }
}
