package com.example.invoice.application.validation;

import com.example.invoice.domain.model.ValidationError;
import com.example.invoice.domain.model.ValidationOutcome;

/**
 * Enforces the maximum invoice size. The limit is inclusive.
 * Registered as a bean by {@code InvoiceUploadConfig} so the limit comes from configuration.
 */
public class FileSizeValidator {

    public static final long DEFAULT_MAX_BYTES = 20L * 1024 * 1024;

    private static final long MEGABYTE = 1024L * 1024;

    private final long maxBytes;

    /**
     * @param maxBytes largest accepted file length in bytes
     */
    public FileSizeValidator(long maxBytes) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive: " + maxBytes);
        }
        this.maxBytes = maxBytes;
    }

    public ValidationOutcome validateSize(byte[] content) {
        long length = content != null ? content.length : 0L;
        if (length > maxBytes) {
            return ValidationOutcome.failure(ValidationError.FILE_TOO_LARGE,
                    "File exceeds maximum allowed size of " + describeLimit());
        }
        return ValidationOutcome.success();
    }

    public long maxBytes() {
        return maxBytes;
    }

    private String describeLimit() {
        if (maxBytes % MEGABYTE == 0) {
            return (maxBytes / MEGABYTE) + "MB";
        }
        return maxBytes + " bytes";
    }
}
