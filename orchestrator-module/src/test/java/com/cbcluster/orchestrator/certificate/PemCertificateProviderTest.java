package com.cbcluster.orchestrator.certificate;

import com.cbcluster.common.exception.TopologyValidationException;
import com.cbcluster.orchestrator.config.TopologyProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.nio.file.Files;
import java.nio.file.Path;
import java.security.cert.CertificateException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PemCertificateProviderTest {

    @TempDir
    Path tempDir;

    @Test
    void noCertificateAuthorityConfigured() {
        PemCertificateProvider provider = new PemCertificateProvider(null, new DefaultResourceLoader());

        assertThat(provider.certificateAuthority()).isEmpty();
    }

    @Test
    void missingCertificateFileIsRejected() {
        TopologyProperties.CertificateAuthority properties = new TopologyProperties.CertificateAuthority();
        properties.setCertificatePath("file:" + tempDir.resolve("missing.pem"));
        PemCertificateProvider provider = new PemCertificateProvider(properties, new DefaultResourceLoader());

        assertThatThrownBy(provider::certificateAuthority)
                .isInstanceOf(TopologyValidationException.class)
                .hasMessageContaining("missing.pem");
    }

    @Test
    void malformedCertificateIsRejected() throws Exception {
        Path pem = Files.writeString(tempDir.resolve("ca.pem"),
                "-----BEGIN CERTIFICATE-----\nbm90IGEgY2VydGlmaWNhdGU=\n-----END CERTIFICATE-----\n");
        TopologyProperties.CertificateAuthority properties = new TopologyProperties.CertificateAuthority();
        properties.setCertificatePath(pem.toUri().toString());
        PemCertificateProvider provider = new PemCertificateProvider(properties, new DefaultResourceLoader());

        assertThatThrownBy(provider::certificateAuthority)
                .isInstanceOf(TopologyValidationException.class)
                .hasCauseInstanceOf(CertificateException.class);
    }
}
