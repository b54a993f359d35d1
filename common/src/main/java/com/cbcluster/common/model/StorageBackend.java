package com.cbcluster.common.model;

/**
 * Storage engine backing a couchbase bucket.
 */
public enum StorageBackend implements WireValue {
    COUCHSTORE("couchstore"),
    MAGMA("magma");

    private final String wireValue;

    StorageBackend(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
