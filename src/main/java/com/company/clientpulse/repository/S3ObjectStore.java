package com.company.clientpulse.repository;

import com.company.clientpulse.config.StoreProperties;
import com.company.clientpulse.exception.StoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * JSON documents in the configured bucket. Every key is relative to the store prefix.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class S3ObjectStore {

    private final S3Client s3Client;
    private final StoreProperties properties;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    public String key(String relativeKey) {
        return properties.getPrefix() + "/" + relativeKey;
    }

    public <T> Optional<T> read(String key, Class<T> type, String repository) {
        return timed("get", repository, () -> {
            try {
                ResponseBytes<GetObjectResponse> bytes = s3Client.getObjectAsBytes(GetObjectRequest.builder()
                        .bucket(properties.getBucket())
                        .key(key)
                        .build());
                return Optional.of(objectMapper.readValue(bytes.asByteArray(), type));
            } catch (NoSuchKeyException e) {
                return Optional.empty();
            } catch (java.io.IOException e) {
                throw new StoreException("Failed to decode " + key, e);
            }
        });
    }

    public void write(String key, Object value, String repository) {
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to encode " + key, e);
        }

        meterRegistry.summary("pulse.store.object.size", "repository", repository).record(body.length);

        timed("put", repository, () -> s3Client.putObject(PutObjectRequest.builder()
                        .bucket(properties.getBucket())
                        .key(key)
                        .contentType("application/json")
                        .build(),
                RequestBody.fromBytes(body)));
    }

    public void delete(String key, String repository) {
        timed("delete", repository, () -> s3Client.deleteObject(DeleteObjectRequest.builder()
                .bucket(properties.getBucket())
                .key(key)
                .build()));
    }

    /**
     * All keys under the prefix, following continuation tokens.
     */
    public List<String> listKeys(String prefix, String repository) {
        return timed("list", repository, () -> {
            List<String> keys = new ArrayList<>();
            String continuationToken = null;
            do {
                ListObjectsV2Response page = s3Client.listObjectsV2(ListObjectsV2Request.builder()
                        .bucket(properties.getBucket())
                        .prefix(prefix)
                        .continuationToken(continuationToken)
                        .build());
                for (S3Object object : page.contents()) {
                    keys.add(object.key());
                }
                continuationToken = Boolean.TRUE.equals(page.isTruncated()) ? page.nextContinuationToken() : null;
            } while (continuationToken != null);
            return keys;
        });
    }

    private <T> T timed(String operation, String repository, Supplier<T> action) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";
        try {
            return action.get();
        } catch (SdkException e) {
            outcome = "error";
            throw new StoreException(String.format("S3 %s failed for %s: %s", operation, repository, e.getMessage()), e);
        } catch (RuntimeException e) {
            outcome = "error";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("pulse.store.operations",
                    "operation", operation,
                    "repository", repository,
                    "outcome", outcome));
        }
    }
}
