package com.eyelevel.jobrelay.store.s3;

import com.eyelevel.jobrelay.exception.BlobStoreException;
import com.eyelevel.jobrelay.store.BlobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * A {@link BlobStore} over one S3 bucket.
 * <p>
 * Each call runs inside the shared {@link RetryTemplate}: transient SDK failures are retried a
 * bounded number of times and then surface as {@link BlobStoreException}. A missing key is answered
 * directly and never retried.
 */
@Slf4j
public class S3BlobStore implements BlobStore {

    private static final int NOT_FOUND = 404;

    private final S3Client s3Client;
    private final RetryTemplate retryTemplate;
    private final String bucketName;

    public S3BlobStore(final S3Client s3Client, final RetryTemplate retryTemplate, final String bucketName) {
        this.s3Client = s3Client;
        this.retryTemplate = retryTemplate;
        this.bucketName = bucketName;
        log.info("S3BlobStore initialized for bucket '{}'.", bucketName);
    }

    @Override
    public String bucket() {
        return bucketName;
    }

    @Override
    public void put(final String key, final byte[] content) {
        log.debug("Uploading {} bytes to s3://{}/{}", content.length, bucketName, key);
        final PutObjectRequest putObjectRequest = PutObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .build();
        execute("put " + key, () -> s3Client.putObject(putObjectRequest, RequestBody.fromBytes(content)));
    }

    @Override
    public Optional<byte[]> get(final String key) {
        log.debug("Downloading object from s3://{}/{}", bucketName, key);
        final GetObjectRequest getObjectRequest = GetObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .build();
        return execute("get " + key, () -> {
            try {
                ResponseBytes<GetObjectResponse> bytes = s3Client.getObjectAsBytes(getObjectRequest);
                return Optional.of(bytes.asByteArray());
            } catch (NoSuchKeyException e) {
                return Optional.empty();
            }
        });
    }

    @Override
    public boolean exists(final String key) {
        final HeadObjectRequest headObjectRequest = HeadObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .build();
        return execute("head " + key, () -> {
            try {
                s3Client.headObject(headObjectRequest);
                return true;
            } catch (NoSuchKeyException e) {
                return false;
            } catch (S3Exception e) {
                if (e.statusCode() == NOT_FOUND) {
                    return false;
                }
                throw e;
            }
        });
    }

    @Override
    public List<String> list(final String prefix) {
        log.debug("Listing s3://{}/{}*", bucketName, prefix);
        final ListObjectsV2Request request = ListObjectsV2Request.builder()
                .bucket(bucketName)
                .prefix(prefix)
                .build();
        return execute("list " + prefix, () -> s3Client.listObjectsV2Paginator(request).contents().stream()
                                                        .map(S3Object::key)
                                                        .sorted()
                                                        .toList());
    }

    @Override
    public void delete(final String key) {
        log.debug("Deleting s3://{}/{}", bucketName, key);
        final DeleteObjectRequest request = DeleteObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .build();
        execute("delete " + key, () -> s3Client.deleteObject(request));
    }

    private <T> T execute(final String operation, final Supplier<T> call) {
        return retryTemplate.execute(context -> {
            try {
                return call.get();
            } catch (SdkException e) {
                throw new BlobStoreException(
                        String.format("Object store call '%s' on bucket '%s' failed", operation, bucketName), e);
            }
        });
    }
}
