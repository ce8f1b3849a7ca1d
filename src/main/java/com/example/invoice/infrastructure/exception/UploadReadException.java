package com.example.invoice.infrastructure.exception;

/**
 * Signals that the multipart payload could not be read into memory.
 */
public class UploadReadException extends InfrastructureException {

	/**
	 * @param message description kept in the server log
	 * @param cause   IO failure raised by the servlet container
	 */
    public UploadReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
