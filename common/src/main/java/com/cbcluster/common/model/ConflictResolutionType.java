package com.cbcluster.common.model;

/**
 * Conflict resolution used by cross data center replication.
 */
public enum ConflictResolutionType implements WireValue {
    TIMESTAMP("lww"),
    SEQUENCE_NUMBER("seqno"),
    CUSTOM("custom");

    private final String wireValue;

    ConflictResolutionType(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
