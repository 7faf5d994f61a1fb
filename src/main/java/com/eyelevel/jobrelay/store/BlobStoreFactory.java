package com.eyelevel.jobrelay.store;

/**
 * Opens a {@link BlobStore} for a bucket. Each tool lives in its own bucket, so stores are
 * obtained per tool rather than injected.
 */
public interface BlobStoreFactory {

    BlobStore open(String bucket);
}
