package com.omniguard.api.quota;

import com.omniguard.core.domain.Identity;
import com.omniguard.core.store.PersistenceUnavailableException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for the caller's daily message allowance.
 */
@RestController
@RequestMapping("/api/v1/quota")
public class QuotaController {

    private final RateLimiterService rateLimiterService;

    public QuotaController(RateLimiterService rateLimiterService) {
        this.rateLimiterService = rateLimiterService;
    }

    /**
     * Today's usage for the authenticated identity. Does not consume anything.
     */
    @GetMapping
    public ResponseEntity<QuotaUsage> getUsage(@AuthenticationPrincipal Identity identity) {
        return ResponseEntity.ok(rateLimiterService.usage(identity));
    }

    @ExceptionHandler(PersistenceUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUnavailable(PersistenceUnavailableException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("QUOTA_001", "Something went wrong, please try again."));
    }

    public record ErrorResponse(String code, String message) {}
}
