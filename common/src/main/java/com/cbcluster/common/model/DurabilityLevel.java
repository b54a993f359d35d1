package com.cbcluster.common.model;

/**
 * Minimum durability level enforced for writes to a bucket.
 */
public enum DurabilityLevel implements WireValue {
    NONE("none"),
    MAJORITY("majority"),
    MAJORITY_AND_PERSIST_TO_ACTIVE("majorityAndPersistActive"),
    PERSIST_TO_MAJORITY("persistToMajority");

    private final String wireValue;

    DurabilityLevel(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
