package com.cbcluster.common.model;

import lombok.Builder;

/**
 * Per-node memory quotas of the cluster services, in megabytes.
 */
@Builder(toBuilder = true)
public record MemoryQuotas(
        int dataServiceMegabytes,
        int queryServiceMegabytes,
        int indexServiceMegabytes,
        int ftsServiceMegabytes,
        int analyticsServiceMegabytes,
        int eventingServiceMegabytes
) {

    public static final int DEFAULT_QUOTA_MEGABYTES = 1024;

    public MemoryQuotas {
        requirePositive(dataServiceMegabytes, "data");
        requirePositive(queryServiceMegabytes, "query");
        requirePositive(indexServiceMegabytes, "index");
        requirePositive(ftsServiceMegabytes, "fts");
        requirePositive(analyticsServiceMegabytes, "analytics");
        requirePositive(eventingServiceMegabytes, "eventing");
    }

    public static MemoryQuotas defaults() {
        return new MemoryQuotas(DEFAULT_QUOTA_MEGABYTES, DEFAULT_QUOTA_MEGABYTES, DEFAULT_QUOTA_MEGABYTES,
                DEFAULT_QUOTA_MEGABYTES, DEFAULT_QUOTA_MEGABYTES, DEFAULT_QUOTA_MEGABYTES);
    }

    private static void requirePositive(int value, String service) {
        if (value <= 0) {
            throw new IllegalArgumentException("Memory quota for " + service + " service must be positive");
        }
    }
}
