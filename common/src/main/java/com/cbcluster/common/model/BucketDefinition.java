package com.cbcluster.common.model;

import java.util.List;

/**
 * Declaration of a bucket provisioned once the cluster is running.
 *
 * @param resourceName name of the bucket resource in the topology
 * @param bucketName   name of the bucket in the cluster
 */
public record BucketDefinition(
        String resourceName,
        String bucketName,
        BucketKind kind,
        BucketSettings settings,
        List<ScopeDefinition> scopes
) {

    public BucketDefinition {
        if (resourceName == null || resourceName.isBlank()) {
            throw new IllegalArgumentException("Bucket resource name must be provided");
        }
        bucketName = bucketName == null || bucketName.isBlank() ? resourceName : bucketName;
        kind = kind == null ? BucketKind.STANDARD : kind;
        settings = settings == null ? BucketSettings.defaults() : settings;
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }

    public static BucketDefinition standard(String name, BucketSettings settings) {
        return new BucketDefinition(name, name, BucketKind.STANDARD, settings, List.of());
    }

    public static BucketDefinition sample(String name) {
        return new BucketDefinition(name, name, BucketKind.SAMPLE, null, List.of());
    }

    public boolean isSample() {
        return kind == BucketKind.SAMPLE;
    }

    public boolean isFlushEnabled() {
        return Boolean.TRUE.equals(settings.flushEnabled());
    }
}
