package com.example.invoice.domain.model;

/**
 * Answer of the upload collaborator once a validated invoice has been handed over.
 *
 * @param stored  {@code true} when the collaborator actually persisted the file
 * @param message collaborator message relayed to the client
 */
public record InvoiceUploadReceipt(boolean stored, String message) {
}
