package com.cbcluster.orchestrator.certificate;

import com.cbcluster.common.model.CertificateAuthority;

import java.util.Optional;

/**
 * Source of the custom root CA of the cluster.
 */
public interface CertificateProvider {

    /**
     * The CA, or empty when the cluster uses the certificates the nodes generate themselves.
     */
    Optional<CertificateAuthority> certificateAuthority();
}
