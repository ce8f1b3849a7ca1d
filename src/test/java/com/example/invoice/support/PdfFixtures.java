package com.example.invoice.support;

import org.apache.pdfbox.pdfwriter.compress.CompressParameters;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.encryption.AccessPermission;
import org.apache.pdfbox.pdmodel.encryption.StandardProtectionPolicy;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds small PDF documents for tests. Offsets in the xref table are computed so PDFBox
 * can open the output without falling back to its repair mode.
 */
public final class PdfFixtures {

    public static final String CATALOG = "<</Type/Catalog/Pages 2 0 R>>";
    public static final String PAGES = "<</Type/Pages/Kids[3 0 R]/Count 1>>";
    public static final String PAGE = "<</Type/Page/MediaBox[0 0 595 842]/Parent 2 0 R/Resources<<>>>>";
    public static final String STANDARD_ENCRYPTION =
            "<</Filter/Standard/V 1/R 2/O<1234567890ABCDEF1234567890ABCDEF>/U<ABCDEF1234567890ABCDEF1234567890>/P -3904>>";

    /**
     * Hand written sample as found in the upload test corpus: catalog, pages and page objects,
     * xref and a trailer without an Encrypt entry.
     */
    public static final byte[] UNENCRYPTED_SAMPLE = (
            "%PDF-1.3\n"
                    + "1 0 obj\n<</Type/Catalog/Pages 2 0 R>>\nendobj\n"
                    + "2 0 obj\n<</Type/Pages/Kids[3 0 R]/Count 1>>\nendobj\n"
                    + "3 0 obj\n<</Type/Page/MediaBox[0 0 595 842]/Parent 2 0 R/Resources<<>>>>\nendobj\n"
                    + "xref\n0 4\n0000000000 65535 f\n0000000010 00000 n\n0000000053 00000 n\n0000000102 00000 n\n"
                    + "trailer\n<</Size 4/Root 1 0 R>>\n"
                    + "startxref\n178\n%%EOF"
    ).getBytes(StandardCharsets.US_ASCII);

    /**
     * Same sample with object 4 holding a Standard security handler referenced as /Encrypt from the trailer.
     */
    public static final byte[] ENCRYPTED_SAMPLE = (
            "%PDF-1.3\n"
                    + "1 0 obj\n<</Type/Catalog/Pages 2 0 R>>\nendobj\n"
                    + "2 0 obj\n<</Type/Pages/Kids[3 0 R]/Count 1>>\nendobj\n"
                    + "3 0 obj\n<</Type/Page/MediaBox[0 0 595 842]/Parent 2 0 R/Resources<<>>>>\nendobj\n"
                    + "4 0 obj\n<</Filter/Standard/V 1/R 2/O<1234567890ABCDEF1234567890ABCDEF>/U<ABCDEF1234567890ABCDEF1234567890>/P -3904>>\nendobj\n"
                    + "xref\n0 5\n0000000000 65535 f\n0000000010 00000 n\n0000000053 00000 n\n0000000102 00000 n\n0000000183 00000 n\n"
                    + "trailer\n<</Size 5/Root 1 0 R/Encrypt 4 0 R>>\n"
                    + "startxref\n291\n%%EOF"
    ).getBytes(StandardCharsets.US_ASCII);

    private PdfFixtures() {
    }

    /**
     * @return builder preloaded with catalog, pages and page objects
     */
    public static Builder minimalDocument() {
        return new Builder().object(CATALOG).object(PAGES).object(PAGE);
    }

    /**
     * @return well-formed single page PDF without encryption
     */
    public static byte[] validInvoice() {
        return minimalDocument().build();
    }

    /**
     * @return well-formed PDF whose trailer references a Standard security handler
     */
    public static byte[] encryptedInvoice() {
        return minimalDocument().object(STANDARD_ENCRYPTION).trailerEntry("/Encrypt 4 0 R").build();
    }

    /**
     * Renders a one page document with PDFBox itself.
     *
     * @param text text drawn on the page
     * @return PDF bytes
     * @throws IOException when PDFBox cannot create or save the document
     */
    public static byte[] renderWithPdfBox(String text) throws IOException {
        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {

            PDPage page = new PDPage(PDRectangle.A4);
            document.addPage(page);

            try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                contentStream.beginText();
                contentStream.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                contentStream.newLineAtOffset(72, 700);
                contentStream.showText(text);
                contentStream.endText();
            }

            document.save(outputStream);
            return outputStream.toByteArray();
        }
    }

    /**
     * Saves a user-password protected document with PDFBox and rewrites the {@code /Encrypt} and
     * {@code /Standard} names with {@code #xx} escapes, so a plain text scan no longer sees them while
     * a PDF parser still decodes them. The startxref offset is recomputed after the rewrite.
     *
     * @return protected PDF bytes that only a password-aware parser recognizes as encrypted
     * @throws IOException when PDFBox cannot create, protect or save the document
     */
    public static byte[] passwordProtectedWithEscapedNames() throws IOException {
        byte[] saved;
        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {

            document.addPage(new PDPage(PDRectangle.A4));
            StandardProtectionPolicy policy =
                    new StandardProtectionPolicy("owner-secret", "user-secret", new AccessPermission());
            policy.setEncryptionKeyLength(128);
            document.protect(policy);

            document.save(outputStream, CompressParameters.NO_COMPRESSION);
            saved = outputStream.toByteArray();
        }

        String text = new String(saved, StandardCharsets.ISO_8859_1)
                .replace("/Encrypt", "/Encr#79pt")
                .replace("/Standard", "/St#61ndard");

        int xrefOffset = text.lastIndexOf("\nxref") + 1;
        int startXref = text.lastIndexOf("startxref");
        int eof = text.indexOf("%%EOF", startXref);
        text = text.substring(0, startXref) + "startxref\n" + xrefOffset + "\n" + text.substring(eof);
        return text.getBytes(StandardCharsets.ISO_8859_1);
    }

    /**
     * Assembles objects, the xref table, trailer and end-of-file marker with correct byte offsets.
     */
    public static final class Builder {

        private final List<String> objects = new ArrayList<>();
        private final StringBuilder trailerEntries = new StringBuilder();
        private int commentPadding;
        private boolean xref = true;
        private boolean rootEntry = true;
        private boolean eofMarker = true;

        public Builder object(String dictionary) {
            objects.add(dictionary);
            return this;
        }

        public Builder trailerEntry(String entry) {
            trailerEntries.append(entry);
            return this;
        }

        /**
         * Adds a comment line of the given length after the header to grow the file.
         */
        public Builder padding(int characters) {
            this.commentPadding = characters;
            return this;
        }

        public Builder withoutXref() {
            this.xref = false;
            return this;
        }

        public Builder withoutRoot() {
            this.rootEntry = false;
            return this;
        }

        public Builder withoutEofMarker() {
            this.eofMarker = false;
            return this;
        }

        public byte[] build() {
            StringBuilder pdf = new StringBuilder();
            pdf.append("%PDF-1.4\n");
            if (commentPadding > 0) {
                pdf.append('%').append("x".repeat(commentPadding)).append('\n');
            }

            List<Integer> offsets = new ArrayList<>();
            for (int i = 0; i < objects.size(); i++) {
                offsets.add(pdf.length());
                pdf.append(i + 1).append(" 0 obj\n").append(objects.get(i)).append("\nendobj\n");
            }

            int xrefOffset = pdf.length();
            if (xref) {
                pdf.append("xref\n0 ").append(objects.size() + 1).append('\n');
                pdf.append("0000000000 65535 f\r\n");
                for (int offset : offsets) {
                    pdf.append(String.format("%010d 00000 n\r\n", offset));
                }
            }
            pdf.append("trailer\n<</Size ").append(objects.size() + 1);
            if (rootEntry) {
                pdf.append("/Root 1 0 R");
            }
            pdf.append(trailerEntries).append(">>\n");
            pdf.append("startxref\n").append(xrefOffset).append('\n');
            if (eofMarker) {
                pdf.append("%%EOF\n");
            }
            return pdf.toString().getBytes(StandardCharsets.US_ASCII);
        }
    }
}
