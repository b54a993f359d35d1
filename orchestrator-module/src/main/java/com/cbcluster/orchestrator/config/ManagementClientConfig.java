package com.cbcluster.orchestrator.config;

import com.cbcluster.common.model.CertificateAuthority;
import com.cbcluster.common.model.ClusterTopology;
import com.cbcluster.orchestrator.client.ManagementApiClient;
import com.cbcluster.orchestrator.client.ManagementApiClientFactory;
import io.netty.channel.ChannelOption;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import javax.net.ssl.SSLException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
@EnableConfigurationProperties(ManagementClientConfig.ManagementClientProperties.class)
public class ManagementClientConfig {

    @Bean
    public WebClient.Builder managementWebClientBuilder(ManagementClientProperties properties, ClusterTopology topology) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, properties.getConnectionTimeout())
                .responseTimeout(Duration.ofMillis(properties.getReadTimeout()))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(properties.getReadTimeout(), TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(properties.getReadTimeout(), TimeUnit.MILLISECONDS)));

        CertificateAuthority authority = topology.certificateAuthority().orElse(null);
        if (authority != null && authority.trustCertificate()) {
            SslContext sslContext = trustingSslContext(authority);
            httpClient = httpClient.secure(spec -> spec.sslContext(sslContext));
            log.info("Management client trusts {} certificate(s) of the cluster CA", authority.chain().size());
        }

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(10 * 1024 * 1024));
    }

    @Bean
    public ManagementApiClient managementApiClient(ManagementApiClientFactory factory, ClusterTopology topology) {
        return factory.create(topology);
    }

    private static SslContext trustingSslContext(CertificateAuthority authority) {
        try {
            return SslContextBuilder.forClient()
                    .trustManager(authority.chain().toArray(new X509Certificate[0]))
                    .build();
        } catch (SSLException e) {
            throw new IllegalStateException("Cannot build TLS context trusting the cluster CA", e);
        }
    }

    @Data
    @Validated
    @ConfigurationProperties("orchestrator.management-client")
    public static class ManagementClientProperties {
        private int connectionTimeout = 5000;
        private int readTimeout = 10000;

        @Valid
        @NotNull
        private Retry retry = new Retry();

        @Data
        public static class Retry {
            /**
             * Attempts per request, the first one included.
             */
            @Min(1)
            private int maxAttempts = 60;

            @NotNull
            private Duration backoff = Duration.ofSeconds(1);
        }
    }
}
