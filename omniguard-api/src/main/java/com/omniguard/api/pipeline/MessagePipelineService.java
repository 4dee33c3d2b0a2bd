package com.omniguard.api.pipeline;

import com.omniguard.api.audit.AuditLogService;
import com.omniguard.api.audit.AuditLogService.AuditUnavailableException;
import com.omniguard.api.config.OmniGuardProperties;
import com.omniguard.api.content.ContentGateService;
import com.omniguard.api.crisis.CrisisEscalationService;
import com.omniguard.api.crypto.MessageCipherService;
import com.omniguard.api.quota.QuotaDecision;
import com.omniguard.api.quota.RateLimiterService;
import com.omniguard.core.domain.AuditEventType;
import com.omniguard.core.domain.ContentReason;
import com.omniguard.core.domain.EncryptedEnvelope;
import com.omniguard.core.domain.Identity;
import com.omniguard.core.domain.ModerationVerdict;
import com.omniguard.core.domain.StoredMessage;
import com.omniguard.core.store.BoundedRetry;
import com.omniguard.core.store.MessageStore;
import com.omniguard.core.store.PersistenceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Runs every outgoing message through content gate, quota, encryption, persistence and
 * audit, in that order.
 * <p>
 * Rejected content never consumes quota. Crisis escalation happens for any message with
 * crisis language, delivered or not. Each call yields exactly one terminal status and one
 * outcome event in the audit log; if that event cannot be written the message is not
 * delivered.
 */
@Service
public class MessagePipelineService {

    private static final Logger log = LoggerFactory.getLogger(MessagePipelineService.class);

    private final ContentGateService contentGate;
    private final RateLimiterService rateLimiter;
    private final MessageCipherService cipher;
    private final AuditLogService auditLog;
    private final CrisisEscalationService crisisEscalation;
    private final MessageStore messageStore;
    private final BoundedRetry storeRetry;
    private final Clock clock;

    public MessagePipelineService(ContentGateService contentGate,
                                  RateLimiterService rateLimiter,
                                  MessageCipherService cipher,
                                  AuditLogService auditLog,
                                  CrisisEscalationService crisisEscalation,
                                  MessageStore messageStore,
                                  OmniGuardProperties properties,
                                  Clock clock) {
        this.contentGate = contentGate;
        this.rateLimiter = rateLimiter;
        this.cipher = cipher;
        this.auditLog = auditLog;
        this.crisisEscalation = crisisEscalation;
        this.messageStore = messageStore;
        OmniGuardProperties.Retry retry = properties.getQuota().getRetry();
        this.storeRetry = new BoundedRetry(retry.getMaxAttempts(), retry.getBaseBackoff());
        this.clock = clock;
    }

    public SendResult sendMessage(Identity identity, String text) {
        Objects.requireNonNull(identity, "Identity cannot be null");
        MessageStage stage = MessageStage.RECEIVED;
        try {
            ModerationVerdict verdict = contentGate.validate(text);

            if (verdict.crisisDetected()) {
                crisisEscalation.escalate(identity, verdict.severity());
                auditLog.append(identity.id(), AuditEventType.CRISIS_FLAGGED, Map.of(
                        "severity", verdict.severity().name(),
                        "crisisLevel", String.valueOf(verdict.severity().crisisLevel())));
            }

            if (!verdict.allowed()) {
                auditLog.append(identity.id(), AuditEventType.CONTENT_BLOCKED, Map.of(
                        "reasons", joinReasons(verdict),
                        "categories", String.join(",", verdict.categories())));
                log.warn("Message from identity {} blocked: {}", identity.id(), verdict.reasons());
                return SendResult.contentBlocked(verdict.reasons());
            }
            stage = MessageStage.CONTENT_CHECKED;

            QuotaDecision quota = rateLimiter.checkAndConsume(identity);
            if (quota.outcome() == QuotaDecision.Outcome.STORE_UNAVAILABLE) {
                auditLog.append(identity.id(), AuditEventType.QUOTA_DENIED, Map.of("cause", "store_unavailable"));
                return SendResult.unavailable(stage);
            }
            if (!quota.allowed()) {
                auditLog.append(identity.id(), AuditEventType.QUOTA_DENIED, Map.of(
                        "resetAt", quota.resetAt().toString()));
                return SendResult.rateLimited(quota.resetAt());
            }
            stage = MessageStage.RATE_CHECKED;

            EncryptedEnvelope envelope;
            try {
                envelope = cipher.encrypt(verdict.sanitizedText());
            } catch (MessageCipherService.EncryptionException e) {
                log.error("Encryption failed for message from identity {}", identity.id(), e);
                auditLog.append(identity.id(), AuditEventType.ENCRYPTION_FAILED, Map.of("cause", e.getMessage()));
                return SendResult.encryptionFailed();
            }
            stage = MessageStage.ENCRYPTED;

            String messageId = UUID.randomUUID().toString();
            StoredMessage stored = new StoredMessage(messageId, identity.id(), envelope, clock.instant());
            try {
                storeRetry.run("message save", () -> messageStore.save(stored));
            } catch (PersistenceUnavailableException e) {
                log.error("Message store unavailable for identity {}", identity.id(), e);
                return SendResult.unavailable(stage);
            }
            stage = MessageStage.PERSISTED;

            try {
                auditLog.append(identity.id(), AuditEventType.RECORDED, Map.of(
                        "messageId", messageId,
                        "keyId", envelope.keyId()));
            } catch (AuditUnavailableException e) {
                discard(messageId);
                throw e;
            }

            log.info("Delivered message {} for identity {} ({} remaining today)",
                    messageId, identity.id(), quota.remaining());
            return SendResult.delivered(messageId, quota.remaining(), quota.resetAt(), verdict.reasons());
        } catch (AuditUnavailableException e) {
            log.error("Audit log unavailable at stage {}, message from identity {} not delivered",
                    stage, identity.id(), e);
            return SendResult.unavailable(stage);
        }
    }

    /**
     * Decrypts a stored message for its owner.
     *
     * @throws MessageNotFoundException if no message exists or it belongs to someone else
     * @throws MessageCipherService.IntegrityException if the stored envelope fails authentication
     */
    public String readMessage(Identity identity, String messageId) {
        Objects.requireNonNull(identity, "Identity cannot be null");
        StoredMessage stored = storeRetry.call("message read", () -> messageStore.find(messageId))
                .filter(message -> message.ownedBy(identity))
                .orElseThrow(() -> new MessageNotFoundException(messageId));
        try {
            return cipher.decrypt(stored.envelope());
        } catch (MessageCipherService.IntegrityException e) {
            log.error("Stored message {} failed integrity check", messageId);
            try {
                auditLog.append(identity.id(), AuditEventType.DECRYPT_FAILED, Map.of(
                        "messageId", messageId,
                        "keyId", e.keyId()));
            } catch (AuditUnavailableException auditFailure) {
                e.addSuppressed(auditFailure);
            }
            throw e;
        }
    }

    private void discard(String messageId) {
        try {
            storeRetry.run("message discard", () -> messageStore.delete(messageId));
        } catch (PersistenceUnavailableException e) {
            log.error("Could not discard unaudited message {}", messageId, e);
        }
    }

    private static String joinReasons(ModerationVerdict verdict) {
        return verdict.reasons().stream()
                .map(ContentReason::name)
                .sorted()
                .collect(Collectors.joining(","));
    }

    public static class MessageNotFoundException extends RuntimeException {
        public MessageNotFoundException(String messageId) {
            super("Message not found: " + messageId);
        }
    }
}
