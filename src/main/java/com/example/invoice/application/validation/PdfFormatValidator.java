package com.example.invoice.application.validation;

import com.example.invoice.domain.model.ValidationError;
import com.example.invoice.domain.model.ValidationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Checks that an upload is declared, named and encoded as a PDF.
 * The checks run MIME type first, then extension, then magic bytes; the first failure is reported.
 */
@Component
public class PdfFormatValidator {

    private static final Logger log = LoggerFactory.getLogger(PdfFormatValidator.class);

    public static final String PDF_MIME_TYPE = "application/pdf";
    static final String PDF_EXTENSION = ".pdf";
    static final byte[] PDF_SIGNATURE = "%PDF-".getBytes(StandardCharsets.US_ASCII);

    /**
     * Validates the declared metadata and the header bytes of an upload.
     *
     * @param content          raw file bytes
     * @param declaredMimeType content type sent by the client
     * @param filename         original file name sent by the client
     * @return success or the first failing check
     */
    public ValidationOutcome validateFormat(byte[] content, String declaredMimeType, String filename) {
        if (!PDF_MIME_TYPE.equals(declaredMimeType)) {
            log.debug("Rejected {}: declared MIME type {}", filename, declaredMimeType);
            return ValidationOutcome.failure(ValidationError.INVALID_MIME_TYPE);
        }
        if (!hasPdfExtension(filename)) {
            log.debug("Rejected {}: extension is not {}", filename, PDF_EXTENSION);
            return ValidationOutcome.failure(ValidationError.INVALID_EXTENSION);
        }
        if (!startsWithSignature(content)) {
            log.debug("Rejected {}: missing %PDF- header", filename);
            return ValidationOutcome.failure(ValidationError.INVALID_PDF_CONTENT);
        }
        return ValidationOutcome.success();
    }

    private boolean hasPdfExtension(String filename) {
        return filename != null && filename.toLowerCase(Locale.ROOT).endsWith(PDF_EXTENSION);
    }

    static boolean startsWithSignature(byte[] content) {
        if (content == null || content.length < PDF_SIGNATURE.length) {
            return false;
        }
        for (int i = 0; i < PDF_SIGNATURE.length; i++) {
            if (content[i] != PDF_SIGNATURE[i]) {
                return false;
            }
        }
        return true;
    }
}
