package com.example.invoice.config;

import com.example.invoice.application.validation.FileSizeValidator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Enables binding of the upload and client configuration and exposes the configured size validator.
 */
@Configuration
@EnableConfigurationProperties({InvoiceUploadProperties.class, ClientAuthProperties.class})
public class InvoiceUploadConfig {

    @Bean
    public FileSizeValidator fileSizeValidator(InvoiceUploadProperties properties) {
        return new FileSizeValidator(properties.getMaxFileSize().toBytes());
    }
}
