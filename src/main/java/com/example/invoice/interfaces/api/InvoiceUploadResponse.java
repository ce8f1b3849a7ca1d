package com.example.invoice.interfaces.api;

/**
 * API-layer DTO returned once an invoice has been handed to the upload collaborator.
 */
public record InvoiceUploadResponse(
        String message,
        String fileName,
        long fileSizeBytes,
        boolean stored
) {
}
