package com.omniguard.api.audit;

import com.omniguard.core.domain.Identity;
import com.omniguard.core.store.PersistenceUnavailableException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Operator endpoints for audit chain verification, export and freeze recovery.
 */
@RestController
@RequestMapping("/api/v1/audit")
public class AuditController {

    private final AuditLogService auditLogService;

    public AuditController(AuditLogService auditLogService) {
        this.auditLogService = auditLogService;
    }

    /**
     * Verifies the whole chain, or {@code [from, to]} when both are given.
     * Returns 409 when the chain is broken.
     */
    @GetMapping("/verify")
    public ResponseEntity<ChainVerification> verify(
            @RequestParam(required = false) Long from,
            @RequestParam(required = false) Long to) {
        ChainVerification result = (from == null || to == null)
                ? auditLogService.verifyIntegrity()
                : auditLogService.verifyIntegrity(from, to);
        HttpStatus status = result.valid() ? HttpStatus.OK : HttpStatus.CONFLICT;
        return ResponseEntity.status(status).body(result);
    }

    @GetMapping(value = "/export", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> export() {
        return ResponseEntity.ok(auditLogService.exportAsJson());
    }

    @PostMapping("/unfreeze")
    public ResponseEntity<Map<String, Object>> unfreeze(@AuthenticationPrincipal Identity operator) {
        long sequence = auditLogService.unfreeze(operator.id());
        return ResponseEntity.ok(Map.of("unfrozen", true, "sequenceNumber", sequence));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleNotFrozen(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(new ErrorResponse("AUDIT_001", e.getMessage()));
    }

    @ExceptionHandler({AuditLogService.AuditUnavailableException.class, PersistenceUnavailableException.class})
    public ResponseEntity<ErrorResponse> handleUnavailable(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("AUDIT_002", "Audit log unavailable"));
    }

    public record ErrorResponse(String code, String message) {}
}
