package io.github.cyfko.formstate.core.navigation;

import java.util.List;
import java.util.Objects;

/**
 * Where the user is in a paginated form.
 *
 * @param currentPage     index of the current page, -1 when the form is not paginated
 * @param pages           every page, disabled ones included
 * @param progressPercent position of the current page among enabled pages, from 1 to 100
 * @param hasPrevious     an enabled page exists before the current one
 * @param hasNext         an enabled page exists after the current one
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record PaginationState(int currentPage, List<PageStatus> pages, int progressPercent,
                              boolean hasPrevious, boolean hasNext) {

    private static final PaginationState NONE = new PaginationState(-1, List.of(), 0, false, false);

    public PaginationState {
        Objects.requireNonNull(pages, "pages cannot be null");
        pages = List.copyOf(pages);
        if (progressPercent < 0 || progressPercent > 100) {
            throw new IllegalArgumentException("progressPercent must be between 0 and 100, got: " + progressPercent);
        }
    }

    public static PaginationState none() {
        return NONE;
    }

    /**
     * Computes the state for a page cursor.
     *
     * @param pages       all pages
     * @param currentPage index of the current page
     */
    public static PaginationState of(List<PageStatus> pages, int currentPage) {
        if (pages.isEmpty()) return NONE;
        List<PageStatus> enabled = pages.stream().filter(PageStatus::enabled).toList();
        int position = 0;
        for (int i = 0; i < enabled.size(); i++) {
            if (enabled.get(i).index() == currentPage) position = i;
        }
        int progress = enabled.isEmpty() ? 0 : (position + 1) * 100 / enabled.size();
        boolean hasPrevious = PageNavigator.previous(pages, currentPage) != -1;
        boolean hasNext = PageNavigator.next(pages, currentPage) != -1;
        return new PaginationState(currentPage, pages, progress, hasPrevious, hasNext);
    }

    public boolean isPaginated() {
        return currentPage >= 0;
    }
}
