package com.omniguard.api.pipeline;

import com.omniguard.api.audit.AuditLogService;
import com.omniguard.api.crypto.MessageCipherService;
import com.omniguard.core.domain.ContentReason;
import com.omniguard.core.domain.Identity;
import com.omniguard.core.store.PersistenceUnavailableException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Set;

/**
 * REST controller for sending and reading chat messages.
 */
@RestController
@RequestMapping("/api/v1/messages")
public class MessageController {

    private static final Logger log = LoggerFactory.getLogger(MessageController.class);

    private final MessagePipelineService pipelineService;

    public MessageController(MessagePipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @PostMapping
    public ResponseEntity<SendMessageResponse> send(
            @AuthenticationPrincipal Identity identity,
            @Valid @RequestBody SendMessageRequest request) {
        SendResult result = pipelineService.sendMessage(identity, request.text());
        return ResponseEntity.status(statusFor(result.status())).body(SendMessageResponse.from(result));
    }

    @GetMapping("/{messageId}")
    public ResponseEntity<ReadMessageResponse> read(
            @AuthenticationPrincipal Identity identity,
            @PathVariable String messageId) {
        String text = pipelineService.readMessage(identity, messageId);
        return ResponseEntity.ok(new ReadMessageResponse(messageId, text));
    }

    private static HttpStatus statusFor(MessageStatus status) {
        return switch (status) {
            case DELIVERED -> HttpStatus.CREATED;
            case RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
            case CONTENT_BLOCKED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case ENCRYPTION_FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
            case UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    // Exception handlers

    @ExceptionHandler(MessagePipelineService.MessageNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(MessagePipelineService.MessageNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse("MSG_001", e.getMessage()));
    }

    @ExceptionHandler(MessageCipherService.IntegrityException.class)
    public ResponseEntity<ErrorResponse> handleIntegrity(MessageCipherService.IntegrityException e) {
        log.error("Integrity failure while reading message", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("CRYPTO_001", SendResult.GENERIC_FAILURE));
    }

    @ExceptionHandler({AuditLogService.AuditUnavailableException.class, PersistenceUnavailableException.class})
    public ResponseEntity<ErrorResponse> handleUnavailable(RuntimeException e) {
        log.error("Message endpoint dependency unavailable", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("MSG_002", SendResult.GENERIC_FAILURE));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalid(MethodArgumentNotValidException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("MSG_003", "Message text is required"));
    }

    // DTOs

    public record SendMessageRequest(@NotNull @Size(max = 20_000) String text) {}

    public record SendMessageResponse(
            MessageStatus status,
            String messageId,
            Integer remaining,
            Instant resetAt,
            Set<ContentReason> reasons,
            String message
    ) {
        static SendMessageResponse from(SendResult result) {
            return new SendMessageResponse(result.status(), result.messageId(), result.remaining(),
                    result.resetAt(), result.reasons(), result.userMessage());
        }
    }

    public record ReadMessageResponse(String messageId, String text) {}

    public record ErrorResponse(String code, String message) {}
}
