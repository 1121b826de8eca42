/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.testing;

import io.quarkus.test.Mock;
import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.catalog.exceptions.StorageException;
import villagecompute.catalog.services.StorageGateway;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory replacement for {@link StorageGateway} in {@code @QuarkusTest} runs, so no S3 endpoint is needed.
 */
@Mock
@ApplicationScoped
public class InMemoryStorageGateway extends StorageGateway {

    private final Map<String, byte[]> objects = new ConcurrentHashMap<>();

    @Override
    public void put(BucketType bucket, String objectKey, byte[] bytes, String contentType) {
        objects.put(key(bucket, objectKey), bytes.clone());
    }

    @Override
    public byte[] download(BucketType bucket, String objectKey) {
        byte[] bytes = objects.get(key(bucket, objectKey));
        if (bytes == null) {
            throw new StorageException("Storage download failed: no object " + objectKey, null);
        }
        return bytes.clone();
    }

    @Override
    public boolean exists(BucketType bucket, String objectKey) {
        return objects.containsKey(key(bucket, objectKey));
    }

    @Override
    public void delete(BucketType bucket, String objectKey) {
        objects.remove(key(bucket, objectKey));
    }

    /**
     * Object keys currently stored in a bucket.
     */
    public Set<String> keys(BucketType bucket) {
        String prefix = bucket.name() + ":";
        return objects.keySet().stream().filter(k -> k.startsWith(prefix)).map(k -> k.substring(prefix.length()))
                .collect(Collectors.toSet());
    }

    public void clear() {
        objects.clear();
    }

    private static String key(BucketType bucket, String objectKey) {
        return bucket.name() + ":" + objectKey;
    }
}
