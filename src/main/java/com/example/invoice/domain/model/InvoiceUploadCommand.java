package com.example.invoice.domain.model;

/**
 * Input of the upload use case as assembled by the interfaces layer.
 *
 * @param file            uploaded document or {@code null} when the request carried none
 * @param credentials     client credentials supplied with the request
 * @param simulateTimeout debug flag requesting the simulated timeout outcome
 */
public record InvoiceUploadCommand(
        UploadedInvoice file,
        ClientCredentials credentials,
        boolean simulateTimeout
) {
}
