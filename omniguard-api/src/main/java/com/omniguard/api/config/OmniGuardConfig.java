package com.omniguard.api.config;

import com.omniguard.api.crisis.CrisisResourcesClient;
import com.omniguard.api.crisis.LoggingCrisisResourcesClient;
import com.omniguard.core.key.InMemoryCredentialStore;
import com.omniguard.core.key.SecureCredentialStore;
import com.omniguard.core.store.AuditEventStore;
import com.omniguard.core.store.InMemoryAuditEventStore;
import com.omniguard.core.store.InMemoryMessageStore;
import com.omniguard.core.store.InMemoryQuotaBucketStore;
import com.omniguard.core.store.MessageStore;
import com.omniguard.core.store.QuotaBucketStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the persistence ports and shared infrastructure for the message pipeline.
 * Store beans default to in-memory adapters and back off when a deployment provides its own.
 */
@Configuration
@EnableConfigurationProperties(OmniGuardProperties.class)
public class OmniGuardConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public QuotaBucketStore quotaBucketStore() {
        return new InMemoryQuotaBucketStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditEventStore auditEventStore() {
        return new InMemoryAuditEventStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageStore messageStore() {
        return new InMemoryMessageStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public SecureCredentialStore secureCredentialStore() {
        return new InMemoryCredentialStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public CrisisResourcesClient crisisResourcesClient() {
        return new LoggingCrisisResourcesClient();
    }

    @Bean
    public RestTemplate moderationRestTemplate(RestTemplateBuilder builder, OmniGuardProperties properties) {
        return builder
                .connectTimeout(properties.getModeration().getTimeout())
                .readTimeout(properties.getModeration().getTimeout())
                .build();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService moderationExecutor() {
        return Executors.newCachedThreadPool(namedDaemonThreads("moderation-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService crisisExecutor() {
        return Executors.newFixedThreadPool(2, namedDaemonThreads("crisis-escalation-"));
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
