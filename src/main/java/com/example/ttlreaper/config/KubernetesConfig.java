package com.example.ttlreaper.config;

import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.util.ClientBuilder;
import io.kubernetes.client.util.Config;
import java.io.IOException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

@Configuration
public class KubernetesConfig {

    @Bean
    @Primary
    public ApiClient kubernetesApiClient(
            @Value("${reaper.kubernetes.endpoint:}") String endpoint,
            @Value("${reaper.kubernetes.verify-ssl:true}") boolean verifySsl,
            @Value("${reaper.kubernetes.request-timeout-millis:30000}") int requestTimeoutMillis) throws IOException {
        // timeouts surface as transient failures; the next pass retries
        return baseClient(endpoint, verifySsl).setReadTimeout(requestTimeoutMillis);
    }

    @Bean
    public ApiClient kubernetesWatchClient(
            @Value("${reaper.kubernetes.endpoint:}") String endpoint,
            @Value("${reaper.kubernetes.verify-ssl:true}") boolean verifySsl) throws IOException {
        // watch streams stay open until the server-side timeout
        return baseClient(endpoint, verifySsl).setReadTimeout(0);
    }

    @Bean
    public CoreV1Api coreV1Api(@Qualifier("kubernetesApiClient") ApiClient apiClient) {
        return new CoreV1Api(apiClient);
    }

    private static ApiClient baseClient(String endpoint, boolean verifySsl) throws IOException {
        if (endpoint == null || endpoint.isBlank()) {
            // in-cluster service account, then $KUBECONFIG / ~/.kube/config
            return ClientBuilder.standard().build();
        }
        return Config.fromUrl(endpoint, verifySsl);
    }
}
