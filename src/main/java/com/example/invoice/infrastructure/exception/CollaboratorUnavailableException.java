package com.example.invoice.infrastructure.exception;

/**
 * Raised by collaborator adapters (authentication, storage) when the remote side cannot answer.
 */
public class CollaboratorUnavailableException extends InfrastructureException {

    public CollaboratorUnavailableException(String message) {
        super(message);
    }

    public CollaboratorUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
