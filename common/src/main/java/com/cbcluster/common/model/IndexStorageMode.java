package com.cbcluster.common.model;

/**
 * Storage mode of the index service, applied cluster wide at initialization.
 */
public enum IndexStorageMode implements WireValue {
    PLASMA("plasma"),
    MEMORY_OPTIMIZED("memory_optimized"),
    FOREST_DB("forestdb");

    private final String wireValue;

    IndexStorageMode(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
