package com.example.invoice.interfaces.api;

import com.example.invoice.application.service.InvoiceUploadService;
import com.example.invoice.domain.model.ClientCredentials;
import com.example.invoice.domain.model.InvoiceUploadCommand;
import com.example.invoice.domain.model.InvoiceUploadResult;
import com.example.invoice.domain.model.UploadOutcome;
import com.example.invoice.domain.model.UploadedInvoice;
import com.example.invoice.infrastructure.exception.InfrastructureException;
import com.example.invoice.infrastructure.exception.UploadReadException;
import com.example.invoice.interfaces.api.error.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Map;

/**
 * Interfaces-layer controller that accepts invoice uploads, both as a JSON API and from the HTML form.
 */
@Controller
public class InvoiceUploadController {

    private final InvoiceUploadService invoiceUploadService;

    /**
     * Creates the controller with the upload use case.
     *
     * @param invoiceUploadService service running the validation pipeline
     */
    public InvoiceUploadController(InvoiceUploadService invoiceUploadService) {
        this.invoiceUploadService = invoiceUploadService;
    }

    /**
     * REST endpoint running the upload pipeline and translating its outcome to an HTTP status.
     *
     * @param file            uploaded invoice (optional so a missing file reaches the pipeline)
     * @param clientId        client identifier
     * @param clientSecret    client secret
     * @param simulateTimeout debug flag forcing the simulated timeout outcome
     * @param request         incoming HTTP request, used for the error envelope
     * @return upload receipt or an {@link ErrorResponse}
     */
    @PostMapping(value = "/invoices/upload", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<Object> uploadInvoice(@RequestParam(value = "file", required = false) MultipartFile file,
                                                @RequestParam(value = "client_id", required = false) String clientId,
                                                @RequestParam(value = "client_secret", required = false) String clientSecret,
                                                @RequestParam(value = "simulateTimeout", defaultValue = "false") boolean simulateTimeout,
                                                HttpServletRequest request) {
        InvoiceUploadResult result = invoiceUploadService.upload(
                toCommand(file, clientId, clientSecret, simulateTimeout));
        HttpStatus status = statusFor(result);

        if (result.outcome() == UploadOutcome.ACCEPTED) {
            InvoiceUploadResponse body = new InvoiceUploadResponse(
                    result.message(), result.fileName(), result.fileSizeBytes(), result.receipt().stored());
            return ResponseEntity.status(status).body(body);
        }

        Map<String, Object> details = result.validationError() != null
                ? Map.of("reason", result.validationError().name())
                : null;
        ErrorResponse error = ErrorResponse.of(status.value(), result.outcome().name(), result.message(),
                request.getRequestURI(), details);
        return ResponseEntity.status(status).body(error);
    }

    /**
     * Renders the upload page.
     *
     * @param model model used to expose attributes to the Thymeleaf view
     * @return upload view name
     */
    @GetMapping("/")
    public String showUploadForm(Model model) {
        model.addAttribute("result", null);
        model.addAttribute("error", null);
        return "upload";
    }

    /**
     * Handles form submissions and renders the pipeline outcome on the upload page.
     *
     * @param file         uploaded invoice
     * @param clientId     client identifier
     * @param clientSecret client secret
     * @param model        model used for view rendering
     * @return upload view name populated with success or error data
     */
    @PostMapping("/invoices/upload-form")
    public String handleUploadForm(@RequestParam(value = "file", required = false) MultipartFile file,
                                   @RequestParam(value = "client_id", required = false) String clientId,
                                   @RequestParam(value = "client_secret", required = false) String clientSecret,
                                   Model model) {
        try {
            InvoiceUploadResult result = invoiceUploadService.upload(toCommand(file, clientId, clientSecret, false));
            model.addAttribute("result", result);
            model.addAttribute("error", result.outcome().isFailure() ? result.message() : null);
        } catch (InfrastructureException ex) {
            model.addAttribute("result", null);
            model.addAttribute("error", "We couldn't read that file. Please try again.");
        }
        return "upload";
    }

    /**
     * Maps every pipeline outcome to its HTTP status.
     *
     * @param result pipeline result
     * @return status sent to the client
     */
    static HttpStatus statusFor(InvoiceUploadResult result) {
        return switch (result.outcome()) {
            case ACCEPTED -> result.receipt() != null && result.receipt().stored()
                    ? HttpStatus.CREATED
                    : HttpStatus.NOT_IMPLEMENTED;
            case NO_FILE_UPLOADED, ENCRYPTED_DOCUMENT, CORRUPT_DOCUMENT -> HttpStatus.BAD_REQUEST;
            case UNAUTHORIZED -> HttpStatus.UNAUTHORIZED;
            case UNSUPPORTED_FORMAT -> HttpStatus.UNSUPPORTED_MEDIA_TYPE;
            case FILE_TOO_LARGE -> HttpStatus.PAYLOAD_TOO_LARGE;
            case SERVER_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case INTERNAL_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private InvoiceUploadCommand toCommand(MultipartFile file, String clientId, String clientSecret, boolean simulateTimeout) {
        return new InvoiceUploadCommand(toUploadedInvoice(file), new ClientCredentials(clientId, clientSecret), simulateTimeout);
    }

    /**
     * Copies the multipart payload into the domain DTO.
     *
     * @param file multipart part, possibly {@code null}
     * @return uploaded invoice or {@code null} when no file content was sent
     */
    private UploadedInvoice toUploadedInvoice(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            return null;
        }
        try {
            return new UploadedInvoice(file.getBytes(), file.getContentType(), file.getOriginalFilename());
        } catch (IOException e) {
            throw new UploadReadException("Unable to read the uploaded invoice.", e);
        }
    }
}
