/**
 * Contracts of the external collaborators the upload use case depends on.
 * <p>Adapters under {@code infrastructure} implement these interfaces; implementations must be
 * thread-safe and may complete their futures exceptionally to signal a fault.</p>
 */
package com.example.invoice.application.port;
