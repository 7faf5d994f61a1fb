package com.eyelevel.jobrelay.config;

import com.eyelevel.jobrelay.exception.BlobStoreException;
import com.eyelevel.jobrelay.store.BlobStoreRetryListener;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

/**
 * Retry policy for object store calls. Store instances are created per bucket at runtime, so the
 * policy is applied through a template rather than {@code @Retryable}.
 */
@Configuration
public class BlobStoreConfig {

    @Bean("blobStoreRetryTemplate")
    public RetryTemplate blobStoreRetryTemplate(final JobRelayConfig config, final BlobStoreRetryListener listener) {
        final JobRelayConfig.StoreRetry retry = config.getStoreRetry();
        return RetryTemplate.builder()
                            .maxAttempts(Math.max(1, retry.getAttempts()))
                            .fixedBackoff(Math.max(1, retry.getDelayMs()))
                            .retryOn(BlobStoreException.class)
                            .withListener(listener)
                            .build();
    }
}
