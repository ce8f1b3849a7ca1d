package com.example.invoice.domain.model;

/**
 * Domain DTO holding an uploaded invoice document for the duration of one request.
 * The content is copied on construction; validators only read it.
 */
public record UploadedInvoice(
        byte[] content,
        String declaredMimeType,
        String originalFilename
) {
    public UploadedInvoice {
        content = content != null ? content.clone() : new byte[0];
    }

    /**
     * @return number of bytes received from the client
     */
    public long sizeBytes() {
        return content.length;
    }
}
