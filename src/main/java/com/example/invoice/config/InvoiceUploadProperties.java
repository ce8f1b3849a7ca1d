package com.example.invoice.config;

import com.example.invoice.application.validation.FileSizeValidator;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

/**
 * Externalized upload pipeline configuration bound from {@code application.properties}.
 */
@ConfigurationProperties(prefix = "invoice.upload")
public class InvoiceUploadProperties {

    private DataSize maxFileSize = DataSize.ofBytes(FileSizeValidator.DEFAULT_MAX_BYTES);
    private boolean timeoutSimulationEnabled = true;

    public DataSize getMaxFileSize() {
        return maxFileSize;
    }

    public void setMaxFileSize(DataSize maxFileSize) {
        this.maxFileSize = maxFileSize;
    }

    public boolean isTimeoutSimulationEnabled() {
        return timeoutSimulationEnabled;
    }

    public void setTimeoutSimulationEnabled(boolean timeoutSimulationEnabled) {
        this.timeoutSimulationEnabled = timeoutSimulationEnabled;
    }
}
