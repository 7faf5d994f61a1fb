package com.eyelevel.jobrelay.store.memory;

import com.eyelevel.jobrelay.store.BlobStore;
import com.eyelevel.jobrelay.store.BlobStoreFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out one {@link InMemoryBlobStore} per bucket for the lifetime of the application, so that
 * every caller opening the same bucket sees the same objects.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.relay", name = "store", havingValue = "memory")
public class InMemoryBlobStoreFactory implements BlobStoreFactory {

    private final Map<String, InMemoryBlobStore> buckets = new ConcurrentHashMap<>();

    @Override
    public BlobStore open(final String bucket) {
        return buckets.computeIfAbsent(bucket, name -> {
            log.info("Creating in-memory bucket '{}'.", name);
            return new InMemoryBlobStore(name);
        });
    }
}
