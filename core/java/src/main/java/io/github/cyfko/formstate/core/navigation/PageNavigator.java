package io.github.cyfko.formstate.core.navigation;

import java.util.List;

/**
 * Page cursor arithmetic. Disabled pages are skipped.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class PageNavigator {

    private PageNavigator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * @return index of the first enabled page, -1 if none
     */
    public static int first(List<PageStatus> pages) {
        return next(pages, -1);
    }

    /**
     * @return index of the next enabled page after {@code current}, -1 if none
     */
    public static int next(List<PageStatus> pages, int current) {
        for (PageStatus page : pages) {
            if (page.index() > current && page.enabled()) return page.index();
        }
        return -1;
    }

    /**
     * @return index of the closest enabled page before {@code current}, -1 if none
     */
    public static int previous(List<PageStatus> pages, int current) {
        for (int i = pages.size() - 1; i >= 0; i--) {
            PageStatus page = pages.get(i);
            if (page.index() < current && page.enabled()) return page.index();
        }
        return -1;
    }

    /**
     * Keeps the cursor on an enabled page: when the current page got disabled, moves to the next
     * enabled page, or the previous one at the end of the form.
     */
    public static int settle(List<PageStatus> pages, int current) {
        if (pages.isEmpty()) return -1;
        if (current >= 0 && current < pages.size() && pages.get(current).enabled()) return current;
        int next = next(pages, current);
        return next != -1 ? next : previous(pages, current);
    }
}
