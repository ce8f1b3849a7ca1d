package com.example.invoice.application.port;

import com.example.invoice.domain.model.InvoiceUploadReceipt;
import com.example.invoice.domain.model.UploadedInvoice;

import java.util.concurrent.CompletableFuture;

/**
 * Receives invoices that passed every validation stage.
 */
public interface InvoiceUploadGateway {

    /**
     * @param invoice validated document
     * @return future completing with the collaborator receipt; completes exceptionally on failure
     */
    CompletableFuture<InvoiceUploadReceipt> persistUpload(UploadedInvoice invoice);
}
