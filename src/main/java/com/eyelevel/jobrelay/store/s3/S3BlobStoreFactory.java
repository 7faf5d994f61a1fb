package com.eyelevel.jobrelay.store.s3;

import com.eyelevel.jobrelay.store.BlobStore;
import com.eyelevel.jobrelay.store.BlobStoreFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.s3.S3Client;

@Component
@ConditionalOnProperty(prefix = "app.relay", name = "store", havingValue = "s3", matchIfMissing = true)
public class S3BlobStoreFactory implements BlobStoreFactory {

    private final S3Client s3Client;
    private final RetryTemplate retryTemplate;

    public S3BlobStoreFactory(final S3Client s3Client,
                              @Qualifier("blobStoreRetryTemplate") final RetryTemplate retryTemplate) {
        this.s3Client = s3Client;
        this.retryTemplate = retryTemplate;
    }

    @Override
    public BlobStore open(final String bucket) {
        return new S3BlobStore(s3Client, retryTemplate, bucket);
    }
}
