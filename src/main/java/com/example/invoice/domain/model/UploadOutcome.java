package com.example.invoice.domain.model;

/**
 * Terminal state of one upload pipeline run.
 * Each failure kind carries the short message surfaced to the caller.
 */
public enum UploadOutcome {
    ACCEPTED("Invoice upload service called"),
    NO_FILE_UPLOADED("No file uploaded"),
    UNAUTHORIZED("Unauthorized"),
    SERVER_TIMEOUT("Server timeout"),
    UNSUPPORTED_FORMAT("Unsupported file format"),
    ENCRYPTED_DOCUMENT("Encrypted PDF files are not supported"),
    CORRUPT_DOCUMENT("The PDF file is corrupted"),
    FILE_TOO_LARGE("File exceeds maximum allowed size"),
    INTERNAL_ERROR("Internal server error");

    private final String defaultMessage;

    UploadOutcome(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean isFailure() {
        return this != ACCEPTED;
    }
}
