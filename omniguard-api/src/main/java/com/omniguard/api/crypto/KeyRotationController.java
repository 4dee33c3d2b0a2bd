package com.omniguard.api.crypto;

import com.omniguard.api.audit.AuditLogService;
import com.omniguard.core.domain.AuditEventType;
import com.omniguard.core.domain.Identity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Operator endpoint for rotating the message key.
 */
@RestController
@RequestMapping("/api/v1/keys")
public class KeyRotationController {

    private static final Logger log = LoggerFactory.getLogger(KeyRotationController.class);

    private final KeyRing keyRing;
    private final AuditLogService auditLogService;

    public KeyRotationController(KeyRing keyRing, AuditLogService auditLogService) {
        this.keyRing = keyRing;
        this.auditLogService = auditLogService;
    }

    @PostMapping("/rotate")
    public ResponseEntity<Map<String, String>> rotate(@AuthenticationPrincipal Identity operator) {
        String previous = keyRing.activeKeyId();
        String next = keyRing.rotate();
        auditLogService.append(operator.id(), AuditEventType.KEY_ROTATED,
                Map.of("previousKeyId", previous, "activeKeyId", next));
        return ResponseEntity.ok(Map.of("activeKeyId", next));
    }

    @GetMapping("/active")
    public ResponseEntity<Map<String, String>> active() {
        return ResponseEntity.ok(Map.of("activeKeyId", keyRing.activeKeyId()));
    }

    @ExceptionHandler(AuditLogService.AuditUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleAuditUnavailable(AuditLogService.AuditUnavailableException e) {
        log.error("Key rotated but rotation could not be audited", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("KEY_001", "Something went wrong, please try again."));
    }

    public record ErrorResponse(String code, String message) {}
}
