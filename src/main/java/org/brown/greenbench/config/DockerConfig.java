package org.brown.greenbench.config;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Docker Client 설정 (docker exec 워크로드용)
 *
 * 기본 Docker 소켓 (/var/run/docker.sock) 에 연결
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "measurement.docker.enabled", havingValue = "true")
public class DockerConfig {

    @Bean
    public DockerClient dockerClient(MeasurementProperties properties) {
        DefaultDockerClientConfig config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .build();
        log.info("Docker client: {}", config.getDockerHost());

        // exec 응답은 워크로드 타임아웃만큼 걸릴 수 있다
        Duration responseTimeout = Duration.ofSeconds(properties.getWorkload().getDefaultTimeoutSeconds() + 60);

        ApacheDockerHttpClient httpClient = new ApacheDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .maxConnections(10)
                .connectionTimeout(Duration.ofSeconds(30))
                .responseTimeout(responseTimeout)
                .build();

        return DockerClientImpl.getInstance(config, httpClient);
    }
}
