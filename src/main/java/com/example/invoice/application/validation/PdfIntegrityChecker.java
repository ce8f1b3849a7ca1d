package com.example.invoice.application.validation;

import com.example.invoice.infrastructure.pdf.PdfBoxStructureProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Confirms that a byte stream is a structurally complete PDF.
 * Looks for the header, an object definition, a cross-reference section, a trailer root,
 * {@code startxref} and the {@code %%EOF} marker, then asks PDFBox to open the document.
 * Never throws; every problem is reported as {@code false}.
 */
@Component
public class PdfIntegrityChecker {

    private static final Logger log = LoggerFactory.getLogger(PdfIntegrityChecker.class);

    private static final int EOF_SEARCH_WINDOW = 1024;

    private static final Pattern OBJECT_DEFINITION = Pattern.compile("(?m)^\\s*\\d+\\s+\\d+\\s+obj\\b");
    private static final Pattern XREF_TABLE = Pattern.compile("(?<![A-Za-z])xref\\s");
    private static final Pattern XREF_STREAM = Pattern.compile("/Type\\s*/XRef\\b");
    private static final Pattern TRAILER_ROOT =
            Pattern.compile("trailer\\s*<<.*?/Root\\s+\\d+\\s+\\d+\\s+R", Pattern.DOTALL);
    private static final Pattern ROOT_ENTRY = Pattern.compile("/Root\\s+\\d+\\s+\\d+\\s+R");
    private static final Pattern START_XREF = Pattern.compile("startxref\\s+\\d+");
    private static final String EOF_MARKER = "%%EOF";

    private final PdfBoxStructureProbe structureProbe;

    public PdfIntegrityChecker(PdfBoxStructureProbe structureProbe) {
        this.structureProbe = structureProbe;
    }

    /**
     * @param content raw file bytes
     * @return {@code true} when every structural anchor is present and PDFBox can open the bytes
     */
    public boolean checkIntegrity(byte[] content) {
        if (!PdfFormatValidator.startsWithSignature(content)) {
            return false;
        }
        String raw = new String(content, StandardCharsets.ISO_8859_1);
        String missing = findMissingAnchor(raw);
        if (missing != null) {
            log.debug("PDF integrity check failed: missing {}", missing);
            return false;
        }
        return structureProbe.canOpen(content);
    }

    private String findMissingAnchor(String raw) {
        if (!OBJECT_DEFINITION.matcher(raw).find()) {
            return "object definition";
        }
        boolean xrefTable = XREF_TABLE.matcher(raw).find();
        boolean xrefStream = XREF_STREAM.matcher(raw).find();
        if (!xrefTable && !xrefStream) {
            return "cross-reference section";
        }
        boolean rootDeclared = TRAILER_ROOT.matcher(raw).find()
                || (xrefStream && ROOT_ENTRY.matcher(raw).find());
        if (!rootDeclared) {
            return "trailer /Root entry";
        }
        if (!START_XREF.matcher(raw).find()) {
            return "startxref";
        }
        int tailStart = Math.max(0, raw.length() - EOF_SEARCH_WINDOW);
        if (raw.indexOf(EOF_MARKER, tailStart) < 0) {
            return "%%EOF marker";
        }
        return null;
    }
}
