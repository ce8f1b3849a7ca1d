package com.example.invoice.infrastructure.storage;

import com.example.invoice.application.port.InvoiceUploadGateway;
import com.example.invoice.domain.model.InvoiceUploadReceipt;
import com.example.invoice.domain.model.UploadedInvoice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Placeholder for the invoice storage backend. Acknowledges the hand-off without persisting anything,
 * which the API reports as "not implemented".
 */
@Service
public class NotImplementedInvoiceUploadGateway implements InvoiceUploadGateway {

    private static final Logger log = LoggerFactory.getLogger(NotImplementedInvoiceUploadGateway.class);

    static final String MESSAGE = "Invoice upload service called";

    @Override
    public CompletableFuture<InvoiceUploadReceipt> persistUpload(UploadedInvoice invoice) {
        log.info("Storage backend not available, dropping {} ({} bytes)",
                invoice.originalFilename(), invoice.sizeBytes());
        return CompletableFuture.completedFuture(new InvoiceUploadReceipt(false, MESSAGE));
    }
}
