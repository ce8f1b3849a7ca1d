package com.example.invoice.domain.model;

/**
 * Domain DTO describing how an upload request ended.
 * Returned from {@code InvoiceUploadService} so controllers only translate it to HTTP.
 */
public record InvoiceUploadResult(
        UploadOutcome outcome,
        String message,
        ValidationError validationError,
        InvoiceUploadReceipt receipt,
        String fileName,
        long fileSizeBytes
) {

    /**
     * Builds a failure result using the outcome's default message.
     *
     * @param outcome failure kind
     * @return populated result
     */
    public static InvoiceUploadResult failure(UploadOutcome outcome) {
        return new InvoiceUploadResult(outcome, outcome.defaultMessage(), null, null, null, 0L);
    }

    /**
     * Builds a failure result that keeps the validator's specific error.
     *
     * @param outcome    failure kind
     * @param validation failed validator outcome
     * @param file       document that was rejected
     * @return populated result
     */
    public static InvoiceUploadResult rejected(UploadOutcome outcome, ValidationOutcome validation, UploadedInvoice file) {
        return new InvoiceUploadResult(outcome, validation.message(), validation.error(), null,
                file.originalFilename(), file.sizeBytes());
    }

    /**
     * Builds a failure result for a known file using the outcome's default message.
     *
     * @param outcome failure kind
     * @param file    document that was rejected
     * @return populated result
     */
    public static InvoiceUploadResult rejected(UploadOutcome outcome, UploadedInvoice file) {
        return new InvoiceUploadResult(outcome, outcome.defaultMessage(), null, null,
                file.originalFilename(), file.sizeBytes());
    }

    /**
     * Builds the success result from the collaborator receipt.
     *
     * @param receipt collaborator answer
     * @param file    document that was handed over
     * @return populated result
     */
    public static InvoiceUploadResult accepted(InvoiceUploadReceipt receipt, UploadedInvoice file) {
        String message = receipt.message() != null ? receipt.message() : UploadOutcome.ACCEPTED.defaultMessage();
        return new InvoiceUploadResult(UploadOutcome.ACCEPTED, message, null, receipt,
                file.originalFilename(), file.sizeBytes());
    }
}
