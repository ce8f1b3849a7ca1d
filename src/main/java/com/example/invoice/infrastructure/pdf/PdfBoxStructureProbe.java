package com.example.invoice.infrastructure.pdf;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Infrastructure helper that asks PDFBox whether a byte stream opens as a PDF document.
 * Hides the PDFBox parser and its exceptions from the validation layer.
 */
@Component
public class PdfBoxStructureProbe {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxStructureProbe.class);

    /**
     * Loads the bytes with the lenient PDFBox parser and touches the document catalog.
     *
     * @param content raw PDF bytes
     * @return {@code true} when the document loads and exposes a catalog
     */
    public boolean canOpen(byte[] content) {
        try (PDDocument document = Loader.loadPDF(content)) {
            return document.getDocumentCatalog() != null;
        } catch (InvalidPasswordException ex) {
            log.warn("PDFBox reports an encrypted document that passed the encryption scan");
            return false;
        } catch (IOException | RuntimeException ex) {
            log.debug("PDFBox could not open the document: {}", ex.getMessage());
            return false;
        }
    }
}
