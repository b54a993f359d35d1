package com.cbcluster.common.model;

import java.security.cert.X509Certificate;
import java.util.List;

/**
 * Custom root CA the nodes present certificates from.
 *
 * @param certificate      the CA certificate
 * @param chain            certificates supporting the CA up to and including the root
 * @param trustCertificate whether management clients must explicitly trust the chain
 */
public record CertificateAuthority(X509Certificate certificate, List<X509Certificate> chain, boolean trustCertificate) {

    public CertificateAuthority {
        if (certificate == null) {
            throw new IllegalArgumentException("CA certificate must be provided");
        }
        chain = chain == null || chain.isEmpty() ? List.of(certificate) : List.copyOf(chain);
    }
}
