package com.eyelevel.jobrelay.store.memory;

import com.eyelevel.jobrelay.store.BlobStore;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * A {@link BlobStore} held in memory, for local runs and tests. Stored arrays are copied on the way
 * in and out so callers cannot mutate an object after writing it.
 */
@Slf4j
public class InMemoryBlobStore implements BlobStore {

    private final String bucketName;
    private final NavigableMap<String, byte[]> objects = new ConcurrentSkipListMap<>();

    public InMemoryBlobStore(final String bucketName) {
        this.bucketName = bucketName;
    }

    @Override
    public String bucket() {
        return bucketName;
    }

    @Override
    public void put(final String key, final byte[] content) {
        log.trace("put {}/{} ({} bytes)", bucketName, key, content.length);
        objects.put(key, content.clone());
    }

    @Override
    public Optional<byte[]> get(final String key) {
        return Optional.ofNullable(objects.get(key)).map(byte[]::clone);
    }

    @Override
    public boolean exists(final String key) {
        return objects.containsKey(key);
    }

    @Override
    public List<String> list(final String prefix) {
        return objects.tailMap(prefix, true).keySet().stream()
                      .takeWhile(key -> key.startsWith(prefix))
                      .toList();
    }

    @Override
    public void delete(final String key) {
        objects.remove(key);
    }
}
