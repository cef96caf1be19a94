package io.github.cyfko.formstate.core.navigation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Pagination Tests")
class PageNavigatorTest {

    // page 1 is disabled
    private final List<PageStatus> pages = List.of(
            new PageStatus(0, "p0", true, true),
            new PageStatus(1, "p1", false, true),
            new PageStatus(2, "p2", true, true),
            new PageStatus(3, "p3", true, false));

    @Nested
    @DisplayName("PageNavigator")
    class Navigator {

        @Test
        @DisplayName("Should skip disabled pages")
        void shouldSkipDisabledPages() {
            assertEquals(0, PageNavigator.first(pages));
            assertEquals(2, PageNavigator.next(pages, 0));
            assertEquals(0, PageNavigator.previous(pages, 2));
            assertEquals(-1, PageNavigator.next(pages, 3));
            assertEquals(-1, PageNavigator.previous(pages, 0));
        }

        @Test
        @DisplayName("Should move off a page that got disabled")
        void shouldSettleOnEnabledPage() {
            assertEquals(2, PageNavigator.settle(pages, 1));
            assertEquals(2, PageNavigator.settle(pages, 2));

            List<PageStatus> lastDisabled = List.of(
                    new PageStatus(0, "p0", true, true),
                    new PageStatus(1, "p1", false, true));
            assertEquals(0, PageNavigator.settle(lastDisabled, 1));
            assertEquals(-1, PageNavigator.settle(List.of(), 0));
        }
    }

    @Nested
    @DisplayName("PaginationState")
    class State {

        @Test
        @DisplayName("Progress should count enabled pages only")
        void progressShouldCountEnabledPages() {
            PaginationState first = PaginationState.of(pages, 0);
            PaginationState second = PaginationState.of(pages, 2);
            PaginationState last = PaginationState.of(pages, 3);

            assertEquals(33, first.progressPercent());
            assertEquals(66, second.progressPercent());
            assertEquals(100, last.progressPercent());
            assertFalse(first.hasPrevious());
            assertTrue(first.hasNext());
            assertTrue(last.hasPrevious());
            assertFalse(last.hasNext());
        }

        @Test
        @DisplayName("A form without pages should not be paginated")
        void noPages() {
            PaginationState state = PaginationState.of(List.of(), 0);

            assertSame(PaginationState.none(), state);
            assertFalse(state.isPaginated());
            assertTrue(PaginationState.of(pages, 0).isPaginated());
        }

        @Test
        @DisplayName("Should reject a progress outside 0..100")
        void shouldRejectInvalidProgress() {
            assertThrows(IllegalArgumentException.class, () -> new PaginationState(0, List.of(), 101, false, false));
        }
    }
}
