package com.cbcluster.common.model;

import lombok.Builder;

/**
 * Creation settings of a standard bucket. Every nullable field is left out of
 * the create request when unset, so the cluster default applies.
 */
@Builder(toBuilder = true)
public record BucketSettings(
        BucketType bucketType,
        Integer memoryQuotaMegabytes,
        Integer replicas,
        Boolean flushEnabled,
        StorageBackend storageBackend,
        CompressionMode compressionMode,
        ConflictResolutionType conflictResolutionType,
        DurabilityLevel minimumDurabilityLevel,
        EvictionPolicy evictionPolicy,
        Integer maximumTimeToLiveSeconds
) {

    public static final int DEFAULT_MEMORY_QUOTA_MEGABYTES = 100;

    public BucketSettings {
        bucketType = bucketType == null ? BucketType.COUCHBASE : bucketType;
        if (memoryQuotaMegabytes != null && memoryQuotaMegabytes <= 0) {
            throw new IllegalArgumentException("Bucket memory quota must be positive");
        }
        if (replicas != null && (replicas < 0 || replicas > 3)) {
            throw new IllegalArgumentException("Bucket replicas must be between 0 and 3");
        }
        if (maximumTimeToLiveSeconds != null && maximumTimeToLiveSeconds < 0) {
            throw new IllegalArgumentException("Bucket max TTL cannot be negative");
        }
    }

    public static BucketSettings defaults() {
        return BucketSettings.builder().build();
    }

    public int effectiveMemoryQuotaMegabytes() {
        return memoryQuotaMegabytes == null ? DEFAULT_MEMORY_QUOTA_MEGABYTES : memoryQuotaMegabytes;
    }
}
