package com.example.invoice.application.service;

import com.example.invoice.application.port.ClientAuthenticator;
import com.example.invoice.application.port.InvoiceUploadGateway;
import com.example.invoice.application.validation.FileSizeValidator;
import com.example.invoice.application.validation.PdfEncryptionDetector;
import com.example.invoice.application.validation.PdfFormatValidator;
import com.example.invoice.application.validation.PdfIntegrityChecker;
import com.example.invoice.config.InvoiceUploadProperties;
import com.example.invoice.domain.model.ClientCredentials;
import com.example.invoice.domain.model.InvoiceUploadCommand;
import com.example.invoice.domain.model.InvoiceUploadReceipt;
import com.example.invoice.domain.model.InvoiceUploadResult;
import com.example.invoice.domain.model.UploadOutcome;
import com.example.invoice.domain.model.UploadedInvoice;
import com.example.invoice.domain.model.ValidationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Application-layer service that runs one invoice upload through the validation pipeline.
 * Stages run in a fixed order and the first failing stage ends the request:
 * authentication, simulated timeout, format, encryption, integrity, size, then the upload hand-off.
 */
@Service
public class InvoiceUploadService {

    private static final Logger log = LoggerFactory.getLogger(InvoiceUploadService.class);

    private final ClientAuthenticator authenticator;
    private final InvoiceUploadGateway uploadGateway;
    private final PdfFormatValidator formatValidator;
    private final PdfEncryptionDetector encryptionDetector;
    private final PdfIntegrityChecker integrityChecker;
    private final FileSizeValidator sizeValidator;
    private final boolean timeoutSimulationEnabled;

    /**
     * Creates the service with its collaborators and validators.
     *
     * @param authenticator      external client authenticator
     * @param uploadGateway      external upload/persistence collaborator
     * @param formatValidator    MIME, extension and header check
     * @param encryptionDetector encryption marker scan
     * @param integrityChecker   structural completeness check
     * @param sizeValidator      configured size bound
     * @param properties         upload pipeline configuration
     */
    public InvoiceUploadService(ClientAuthenticator authenticator,
                                InvoiceUploadGateway uploadGateway,
                                PdfFormatValidator formatValidator,
                                PdfEncryptionDetector encryptionDetector,
                                PdfIntegrityChecker integrityChecker,
                                FileSizeValidator sizeValidator,
                                InvoiceUploadProperties properties) {
        this.authenticator = authenticator;
        this.uploadGateway = uploadGateway;
        this.formatValidator = formatValidator;
        this.encryptionDetector = encryptionDetector;
        this.integrityChecker = integrityChecker;
        this.sizeValidator = sizeValidator;
        this.timeoutSimulationEnabled = properties.isTimeoutSimulationEnabled();
    }

    /**
     * Runs the pipeline for one request. Never throws: unexpected faults become
     * {@link UploadOutcome#INTERNAL_ERROR} and are only logged.
     *
     * @param command uploaded file, credentials and debug flags
     * @return terminal outcome of the request
     */
    public InvoiceUploadResult upload(InvoiceUploadCommand command) {
        try {
            return runPipeline(command);
        } catch (RuntimeException ex) {
            log.error("Invoice upload failed unexpectedly", ex);
            return InvoiceUploadResult.failure(UploadOutcome.INTERNAL_ERROR);
        }
    }

    private InvoiceUploadResult runPipeline(InvoiceUploadCommand command) {
        UploadedInvoice file = command.file();
        if (file == null) {
            log.info("Upload rejected: no file attached");
            return InvoiceUploadResult.failure(UploadOutcome.NO_FILE_UPLOADED);
        }

        if (!isAuthorized(command.credentials())) {
            return InvoiceUploadResult.failure(UploadOutcome.UNAUTHORIZED);
        }

        if (command.simulateTimeout() && timeoutSimulationEnabled) {
            log.warn("Simulated timeout requested for {}", file.originalFilename());
            return InvoiceUploadResult.failure(UploadOutcome.SERVER_TIMEOUT);
        }

        ValidationOutcome format = formatValidator.validateFormat(
                file.content(), file.declaredMimeType(), file.originalFilename());
        if (!format.isValid()) {
            log.info("Upload {} rejected: {}", file.originalFilename(), format.error());
            return InvoiceUploadResult.rejected(UploadOutcome.UNSUPPORTED_FORMAT, format, file);
        }

        if (encryptionDetector.isEncrypted(file.content())) {
            log.info("Upload {} rejected: encrypted document", file.originalFilename());
            return InvoiceUploadResult.rejected(UploadOutcome.ENCRYPTED_DOCUMENT, file);
        }

        if (!integrityChecker.checkIntegrity(file.content())) {
            log.info("Upload {} rejected: corrupt document", file.originalFilename());
            return InvoiceUploadResult.rejected(UploadOutcome.CORRUPT_DOCUMENT, file);
        }

        ValidationOutcome size = sizeValidator.validateSize(file.content());
        if (!size.isValid()) {
            log.info("Upload {} rejected: {} bytes exceeds {}", file.originalFilename(),
                    file.sizeBytes(), sizeValidator.maxBytes());
            return InvoiceUploadResult.rejected(UploadOutcome.FILE_TOO_LARGE, size, file);
        }

        InvoiceUploadReceipt receipt = await(uploadGateway.persistUpload(file), "upload");
        if (receipt == null) {
            throw new IllegalStateException("Upload gateway returned no receipt");
        }
        log.debug("Upload {} handed over, stored={}", file.originalFilename(), receipt.stored());
        return InvoiceUploadResult.accepted(receipt, file);
    }

    private boolean isAuthorized(ClientCredentials credentials) {
        String clientId = credentials != null ? credentials.clientId() : null;
        String clientSecret = credentials != null ? credentials.clientSecret() : null;
        Boolean authorized = await(authenticator.authenticate(clientId, clientSecret), "authentication");
        if (authorized == null) {
            throw new IllegalStateException("Authenticator returned no answer");
        }
        if (!authorized) {
            log.info("Upload rejected: client {} is not authorized", clientId);
            return false;
        }
        return true;
    }

    /**
     * Waits for a collaborator future and unwraps its failure so the caller logs the real cause.
     */
    private <T> T await(CompletableFuture<T> future, String stage) {
        if (future == null) {
            throw new IllegalStateException("Collaborator returned no result for " + stage);
        }
        try {
            return future.join();
        } catch (CompletionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            throw new IllegalStateException("Collaborator failed during " + stage, cause);
        }
    }
}
