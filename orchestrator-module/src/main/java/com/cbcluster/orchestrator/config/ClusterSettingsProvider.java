package com.cbcluster.orchestrator.config;

import com.cbcluster.common.model.ClusterSettings;

/**
 * Supplies the settings the cluster is initialized with. Invoked once, when the primary node is initialized.
 */
@FunctionalInterface
public interface ClusterSettingsProvider {

    ClusterSettings clusterSettings();
}
