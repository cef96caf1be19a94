package io.github.cyfko.formstate.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Address of a node in the response tree, written {@code family[1]/name}.
 * <p>
 * Each segment names a link id and an optional index. On a repeated group the index selects the
 * instance; on a question it selects the answer whose nested items the next segment lives in. A
 * segment without index ({@link Segment#NO_INDEX}) addresses the item level: the slot of a
 * repeated group, or the only node of anything else.
 * </p>
 *
 * @param segments path segments from the top level down, never empty
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record LinkIdPath(List<Segment> segments) {

    private static final Pattern SEGMENT = Pattern.compile("^([^\\[\\]/]+)(?:\\[(\\d+)])?$");

    public LinkIdPath {
        Objects.requireNonNull(segments, "segments cannot be null");
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("A path needs at least one segment");
        }
        segments = List.copyOf(segments);
    }

    /**
     * One step of a path.
     *
     * @param linkId link id of the item
     * @param index  instance or answer index, {@link #NO_INDEX} when absent
     */
    public record Segment(String linkId, int index) {
        public static final int NO_INDEX = -1;

        public Segment {
            Objects.requireNonNull(linkId, "linkId cannot be null");
            if (index < NO_INDEX) {
                throw new IllegalArgumentException("index must not be negative, got: " + index);
            }
        }

        public boolean hasIndex() {
            return index != NO_INDEX;
        }

        @Override
        public String toString() {
            return hasIndex() ? linkId + "[" + index + "]" : linkId;
        }
    }

    /**
     * Parses a path such as {@code family[1]/name}.
     *
     * @throws IllegalArgumentException if the text is not a well-formed path
     */
    public static LinkIdPath parse(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Path cannot be blank");
        }
        List<Segment> segments = new ArrayList<>();
        for (String part : path.trim().split("/")) {
            Matcher matcher = SEGMENT.matcher(part.trim());
            if (!matcher.matches()) {
                throw new IllegalArgumentException("Malformed path segment '" + part + "' in '" + path + "'");
            }
            int index = matcher.group(2) == null ? Segment.NO_INDEX : Integer.parseInt(matcher.group(2));
            segments.add(new Segment(matcher.group(1), index));
        }
        return new LinkIdPath(segments);
    }

    /**
     * Path made of unindexed segments.
     */
    public static LinkIdPath of(String... linkIds) {
        List<Segment> segments = new ArrayList<>();
        for (String linkId : linkIds) {
            segments.add(new Segment(linkId, Segment.NO_INDEX));
        }
        return new LinkIdPath(segments);
    }

    public LinkIdPath child(String linkId) {
        return child(linkId, Segment.NO_INDEX);
    }

    public LinkIdPath child(String linkId, int index) {
        List<Segment> extended = new ArrayList<>(segments);
        extended.add(new Segment(linkId, index));
        return new LinkIdPath(extended);
    }

    /**
     * @return the same path with the last segment indexed
     */
    public LinkIdPath withLastIndex(int index) {
        List<Segment> copy = new ArrayList<>(segments);
        copy.set(copy.size() - 1, new Segment(last().linkId(), index));
        return new LinkIdPath(copy);
    }

    /**
     * @return the same path with the last segment's index removed
     */
    public LinkIdPath withoutLastIndex() {
        return last().hasIndex() ? withLastIndex(Segment.NO_INDEX) : this;
    }

    public Segment last() {
        return segments.get(segments.size() - 1);
    }

    public String lastLinkId() {
        return last().linkId();
    }

    public int depth() {
        return segments.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Segment segment : segments) {
            if (sb.length() > 0) sb.append('/');
            sb.append(segment);
        }
        return sb.toString();
    }
}
