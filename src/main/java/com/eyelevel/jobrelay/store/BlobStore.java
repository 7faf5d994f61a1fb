package com.eyelevel.jobrelay.store;

import java.util.List;
import java.util.Optional;

/**
 * A flat key/value view over one bucket of an object store. Absence is an ordinary outcome
 * ({@link Optional#empty()} or {@code false}); any failure to reach the store is reported as a
 * {@link com.eyelevel.jobrelay.exception.BlobStoreException}.
 */
public interface BlobStore {

    /**
     * The bucket this store reads and writes.
     */
    String bucket();

    /**
     * Writes {@code content} at {@code key}, replacing any existing object.
     */
    void put(String key, byte[] content);

    /**
     * Reads the object at {@code key}.
     *
     * @return The object's bytes, or empty if no object exists at the key.
     */
    Optional<byte[]> get(String key);

    boolean exists(String key);

    /**
     * Lists every key starting with {@code prefix}, in lexicographic order.
     */
    List<String> list(String prefix);

    /**
     * Deletes the object at {@code key}. Deleting a missing key succeeds.
     */
    void delete(String key);

    /**
     * Deletes every object under {@code prefix}.
     *
     * @return The number of objects removed.
     */
    default int deletePrefix(String prefix) {
        List<String> keys = list(prefix);
        keys.forEach(this::delete);
        return keys.size();
    }
}
