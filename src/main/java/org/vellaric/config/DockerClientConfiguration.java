package org.vellaric.config;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * DockerClient 配置，用于容器查询与启停
 */
@Configuration
public class DockerClientConfiguration {

    @Value("${platform.docker.host:}")
    private String dockerHost;

    @Value("${platform.docker.response-timeout:60s}")
    private Duration responseTimeout;

    @Bean
    public DockerClient dockerClient() {
        DefaultDockerClientConfig.Builder configBuilder = DefaultDockerClientConfig.createDefaultConfigBuilder();
        if (StringUtils.hasText(dockerHost)) {
            configBuilder.withDockerHost(dockerHost);
        }
        DefaultDockerClientConfig config = configBuilder.build();

        ApacheDockerHttpClient httpClient = new ApacheDockerHttpClient.Builder()
            .dockerHost(config.getDockerHost())
            .sslConfig(config.getSSLConfig())
            .connectionTimeout(Duration.ofSeconds(10))
            .responseTimeout(responseTimeout)
            .maxConnections(50)
            .build();

        return DockerClientImpl.getInstance(config, httpClient);
    }
}
