package com.example.invoice.application.validation;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Heuristic scan of raw PDF bytes for encryption markers.
 * No object graph is resolved; the bytes are searched for an {@code /Encrypt} entry that
 * references an object or holds an inline dictionary, and for a {@code /Filter/Standard}
 * security handler dictionary.
 */
@Component
public class PdfEncryptionDetector {

    private static final Pattern ENCRYPT_ENTRY =
            Pattern.compile("/Encrypt\\s*(?:\\d+\\s+\\d+\\s+R|<<)");
    private static final Pattern STANDARD_SECURITY_HANDLER =
            Pattern.compile("/Filter\\s*/Standard(?![A-Za-z0-9])");

    /**
     * @param content raw file bytes
     * @return {@code true} when any encryption marker is present
     */
    public boolean isEncrypted(byte[] content) {
        if (content == null || content.length == 0) {
            return false;
        }
        // ISO-8859-1 maps every byte to one char, so offsets stay aligned with the raw stream.
        String raw = new String(content, StandardCharsets.ISO_8859_1);
        return ENCRYPT_ENTRY.matcher(raw).find() || STANDARD_SECURITY_HANDLER.matcher(raw).find();
    }
}
