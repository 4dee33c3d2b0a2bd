package com.omniguard.api.health;

import com.omniguard.api.audit.AuditLogService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Map;

/**
 * Health check for load balancers. Reports DEGRADED while audit events are buffered
 * and DOWN while the audit log is frozen.
 */
@RestController
@RequestMapping("/api/v1")
public class HealthController {

    private final AuditLogService auditLogService;
    private final Clock clock;

    public HealthController(AuditLogService auditLogService, Clock clock) {
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean frozen = auditLogService.isFrozen();
        int pending = auditLogService.pendingCount();
        String status = frozen ? "DOWN" : pending > 0 ? "DEGRADED" : "UP";
        return ResponseEntity.status(frozen ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK).body(Map.of(
            "status", status,
            "auditFrozen", frozen,
            "auditPending", pending,
            "timestamp", clock.instant().toString()
        ));
    }
}
