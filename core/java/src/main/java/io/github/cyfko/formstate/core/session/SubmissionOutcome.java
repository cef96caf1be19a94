package io.github.cyfko.formstate.core.session;

import io.github.cyfko.formstate.core.model.LinkIdPath;
import io.github.cyfko.formstate.core.model.ResponseDocument;
import io.github.cyfko.formstate.core.validation.ValidationResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a submission attempt.
 *
 * @param accepted true when nothing was invalid and the session closed
 * @param invalid  the invalid results that blocked submission, empty when accepted
 * @param response the submitted response, null when refused
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record SubmissionOutcome(boolean accepted, Map<LinkIdPath, ValidationResult> invalid, ResponseDocument response) {

    public SubmissionOutcome {
        invalid = Collections.unmodifiableMap(new LinkedHashMap<>(invalid));
        if (accepted && response == null) {
            throw new IllegalArgumentException("An accepted submission needs a response");
        }
    }

    public static SubmissionOutcome accepted(ResponseDocument response) {
        return new SubmissionOutcome(true, Map.of(), response);
    }

    public static SubmissionOutcome refused(Map<LinkIdPath, ValidationResult> invalid) {
        return new SubmissionOutcome(false, invalid, null);
    }
}
