package com.cbcluster.orchestrator.certificate;

import com.cbcluster.common.exception.TopologyValidationException;
import com.cbcluster.common.model.CertificateAuthority;
import com.cbcluster.orchestrator.config.TopologyProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads the CA certificate and its chain from PEM resources.
 */
@Slf4j
public class PemCertificateProvider implements CertificateProvider {

    private final TopologyProperties.CertificateAuthority properties;
    private final ResourceLoader resourceLoader;

    public PemCertificateProvider(TopologyProperties.CertificateAuthority properties, ResourceLoader resourceLoader) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
    }

    @Override
    public Optional<CertificateAuthority> certificateAuthority() {
        if (properties == null) {
            return Optional.empty();
        }
        X509Certificate certificate = read(properties.getCertificatePath());
        List<X509Certificate> chain = new ArrayList<>();
        for (String path : properties.getChainPaths()) {
            chain.add(read(path));
        }
        log.info("Loaded cluster CA {}", certificate.getSubjectX500Principal().getName());
        return Optional.of(new CertificateAuthority(certificate, chain, properties.isTrustCertificate()));
    }

    private X509Certificate read(String location) {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            return (X509Certificate) CertificateFactory.getInstance("X.509").generateCertificate(in);
        } catch (IOException | CertificateException e) {
            throw new TopologyValidationException("Cannot read certificate from '" + location + "'", e);
        }
    }
}
