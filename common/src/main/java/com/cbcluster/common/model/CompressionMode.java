package com.cbcluster.common.model;

/**
 * Document compression mode of a bucket.
 */
public enum CompressionMode implements WireValue {
    OFF("off"),
    PASSIVE("passive"),
    ACTIVE("active");

    private final String wireValue;

    CompressionMode(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
