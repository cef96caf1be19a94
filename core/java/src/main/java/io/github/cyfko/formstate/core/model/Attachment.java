package io.github.cyfko.formstate.core.model;

import java.util.Objects;

/**
 * Uploaded file answer. Only the metadata the engine validates is kept here.
 *
 * @param contentType mime type of the data
 * @param size        size in bytes
 * @param url         where the data lives, may be null
 * @param title       file name or label, may be null
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Attachment(String contentType, long size, String url, String title) {

    public Attachment {
        Objects.requireNonNull(contentType, "contentType cannot be null");
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative, got: " + size);
        }
    }
}
