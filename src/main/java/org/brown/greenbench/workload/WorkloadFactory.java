package org.brown.greenbench.workload;

import com.github.dockerjava.api.DockerClient;
import lombok.RequiredArgsConstructor;
import org.brown.greenbench.config.MeasurementProperties;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * 요청 정보로 워크로드를 만든다. 컨테이너 id 가 있으면 docker exec, 없으면 로컬 프로세스.
 */
@Component
@RequiredArgsConstructor
public class WorkloadFactory {

    private final ObjectProvider<DockerClient> dockerClient;
    private final MeasurementProperties properties;

    public Workload create(String command, String workingDir, String containerId, Long usefulWork) {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command is required");
        }
        if (containerId != null && !containerId.isBlank()) {
            DockerClient client = dockerClient.getIfAvailable();
            if (client == null) {
                throw new IllegalArgumentException(
                        "containerId given but docker is disabled (measurement.docker.enabled=false)");
            }
            String dir = workingDir != null && !workingDir.isBlank() ? workingDir : properties.getDocker().getWorkDir();
            return new DockerExecWorkload(client, containerId, dir, command, usefulWork);
        }
        Path dir = workingDir != null && !workingDir.isBlank() ? Path.of(workingDir) : null;
        return new ProcessWorkload(command, dir, usefulWork);
    }
}
