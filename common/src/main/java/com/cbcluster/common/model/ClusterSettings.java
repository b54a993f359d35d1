package com.cbcluster.common.model;

import lombok.Builder;

/**
 * Settings applied once, when the primary node is initialized into a cluster.
 *
 * @param managementPort management port the node is initialized with, {@code null} to keep its current one
 */
@Builder(toBuilder = true)
public record ClusterSettings(
        CouchbaseEdition edition,
        Integer managementPort,
        MemoryQuotas memoryQuotas,
        IndexStorageMode indexStorageMode
) {

    public ClusterSettings {
        edition = edition == null ? CouchbaseEdition.ENTERPRISE : edition;
        memoryQuotas = memoryQuotas == null ? MemoryQuotas.defaults() : memoryQuotas;
        indexStorageMode = indexStorageMode == null ? IndexStorageMode.PLASMA : indexStorageMode;
    }

    public static ClusterSettings defaults() {
        return new ClusterSettings(null, null, null, null);
    }

    public boolean isEnterprise() {
        return edition == CouchbaseEdition.ENTERPRISE;
    }
}
