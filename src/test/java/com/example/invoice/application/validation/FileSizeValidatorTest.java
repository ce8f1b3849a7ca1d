package com.example.invoice.application.validation;

import com.example.invoice.domain.model.ValidationError;
import com.example.invoice.domain.model.ValidationOutcome;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the inclusive size bound.
 */
class FileSizeValidatorTest {

    private static final int TWENTY_MB = 20 * 1024 * 1024;

    private final FileSizeValidator validator = new FileSizeValidator(FileSizeValidator.DEFAULT_MAX_BYTES);

    @Test
    void acceptsFileUnderLimit() {
        assertThat(validator.validateSize(new byte[10 * 1024 * 1024]).isValid()).isTrue();
    }

    @Test
    void acceptsFileOfExactlyTheLimit() {
        assertThat(validator.validateSize(new byte[TWENTY_MB]).isValid()).isTrue();
    }

    @Test
    void rejectsFileOneByteOverTheLimit() {
        ValidationOutcome outcome = validator.validateSize(new byte[TWENTY_MB + 1]);

        assertThat(outcome.error()).isEqualTo(ValidationError.FILE_TOO_LARGE);
        assertThat(outcome.message()).isEqualTo("File exceeds maximum allowed size of 20MB");
    }

    @Test
    void usesConfiguredLimit() {
        FileSizeValidator small = new FileSizeValidator(100);

        assertThat(small.validateSize(new byte[100]).isValid()).isTrue();
        assertThat(small.validateSize(new byte[101]).message()).isEqualTo("File exceeds maximum allowed size of 100 bytes");
    }

    @Test
    void rejectsNonPositiveLimit() {
        assertThatThrownBy(() -> new FileSizeValidator(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
