package com.example.invoice.domain.model;

import java.util.Objects;

/**
 * Result of a single validator call: either success or a failure tagged with a {@link ValidationError}.
 * Instances are created per call and never persisted.
 *
 * @param error   failure kind, {@code null} on success
 * @param message human readable explanation, {@code null} on success
 */
public record ValidationOutcome(ValidationError error, String message) {

    private static final ValidationOutcome SUCCESS = new ValidationOutcome(null, null);

    /**
     * @return the shared success outcome
     */
    public static ValidationOutcome success() {
        return SUCCESS;
    }

    /**
     * Creates a failure carrying the default message of the error kind.
     *
     * @param error failure kind
     * @return failed outcome
     */
    public static ValidationOutcome failure(ValidationError error) {
        return failure(error, error.message());
    }

    /**
     * Creates a failure with a caller supplied message.
     *
     * @param error   failure kind
     * @param message message shown to the client
     * @return failed outcome
     */
    public static ValidationOutcome failure(ValidationError error, String message) {
        return new ValidationOutcome(Objects.requireNonNull(error, "error"), message);
    }

    public boolean isValid() {
        return error == null;
    }
}
