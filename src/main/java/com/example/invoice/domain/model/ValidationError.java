package com.example.invoice.domain.model;

/**
 * Failure signals produced by the individual PDF validators.
 */
public enum ValidationError {
    INVALID_MIME_TYPE("Invalid MIME type"),
    INVALID_EXTENSION("Invalid file extension"),
    INVALID_PDF_CONTENT("Invalid PDF file"),
    FILE_TOO_LARGE("File exceeds maximum allowed size");

    private final String message;

    ValidationError(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
