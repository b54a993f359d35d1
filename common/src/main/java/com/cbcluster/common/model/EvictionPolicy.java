package com.cbcluster.common.model;

/**
 * Ejection policy of a bucket.
 */
public enum EvictionPolicy implements WireValue {
    FULL("fullEviction"),
    VALUE_ONLY("valueOnly"),
    NOT_RECENTLY_USED("nruEviction"),
    NO_EVICTION("noEviction");

    private final String wireValue;

    EvictionPolicy(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
