package com.cbcluster.common.model;

/**
 * Type of a bucket.
 */
public enum BucketType implements WireValue {
    COUCHBASE("membase"),
    MEMCACHED("memcached"),
    EPHEMERAL("ephemeral");

    private final String wireValue;

    BucketType(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
