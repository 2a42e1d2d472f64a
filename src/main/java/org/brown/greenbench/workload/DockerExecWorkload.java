package org.brown.greenbench.workload;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.ExecCreateCmdResponse;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.core.command.ExecStartResultCallback;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * 실행 중인 컨테이너 안에서 docker exec 로 명령을 실행하는 워크로드
 *
 * 컨테이너 준비(생성/의존성 설치)는 호출자 책임이다.
 */
@Slf4j
public class DockerExecWorkload implements Workload {

    static final String EXEC_MARKER_ENV = "GREENBENCH_EXEC_ID";
    private static final long KILL_TIMEOUT_SECONDS = 10;

    private final DockerClient dockerClient;
    private final String containerId;
    private final String workDir;
    private final List<String> cmd;
    private final Long usefulWork;

    public DockerExecWorkload(DockerClient dockerClient, String containerId, String workDir,
                              String shellCommand, Long usefulWork) {
        this.dockerClient = dockerClient;
        this.containerId = containerId;
        this.workDir = workDir;
        this.cmd = List.of("/bin/bash", "-c", shellCommand);
        this.usefulWork = usefulWork;
    }

    @Override
    public WorkloadResult run(Duration timeout) throws InterruptedException {
        long start = System.nanoTime();
        String marker = UUID.randomUUID().toString();

        ExecCreateCmdResponse execCreateResponse = dockerClient.execCreateCmd(containerId)
                .withCmd(cmd.toArray(new String[0]))
                .withWorkingDir(workDir)
                .withEnv(List.of(EXEC_MARKER_ENV + "=" + marker))
                .withAttachStdout(true)
                .withAttachStderr(true)
                .exec();
        String execId = execCreateResponse.getId();
        log.debug("Created exec: {} in container: {}", execId, containerId);

        OutputTail stdout = new OutputTail();
        OutputTail stderr = new OutputTail();
        ExecStartResultCallback callback = new ExecStartResultCallback() {
            @Override
            public void onNext(Frame frame) {
                switch (frame.getStreamType()) {
                    case STDOUT, RAW -> stdout.append(frame.getPayload());
                    case STDERR -> stderr.append(frame.getPayload());
                    default -> {
                    }
                }
            }
        };

        boolean completed;
        try {
            completed = dockerClient.execStartCmd(execId)
                    .exec(callback)
                    .awaitCompletion(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            abort(execId, marker, callback);
            throw e;
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        if (!completed) {
            log.warn("[FAIL][WORKLOAD] exec {} in container {} timed out after {} ms",
                    execId, containerId, timeout.toMillis());
            abort(execId, marker, callback);
            return WorkloadResult.failed(elapsed, "timed out after " + timeout.toMillis() + " ms");
        }

        Long exitCodeLong = dockerClient.inspectExecCmd(execId).exec().getExitCodeLong();
        int exitCode = exitCodeLong != null ? exitCodeLong.intValue() : -1;
        log.debug("Exec {} finished with exit code: {}", execId, exitCode);

        if (exitCode != 0) {
            return WorkloadResult.failed(elapsed, "exit code " + exitCode + "\n"
                    + (stderr.isEmpty() ? stdout.text() : stderr.text()));
        }
        return WorkloadResult.builder()
                .success(true)
                .elapsed(elapsed)
                .diagnostic(stdout.text())
                .usefulWork(usefulWork)
                .build();
    }

    /**
     * 타임아웃/인터럽트된 exec 를 정리한다: 출력 스트림을 닫고, 마커 환경변수를 가진
     * 컨테이너 안의 프로세스(셸과 그 자식들)를 모두 종료한다.
     */
    private void abort(String execId, String marker, ExecStartResultCallback callback) {
        try {
            callback.close();
        } catch (IOException e) {
            log.debug("Failed to close exec {} stream: {}", execId, e.getMessage());
        }
        try {
            String killId = dockerClient.execCreateCmd(containerId)
                    .withCmd("/bin/sh", "-c", killCommand(marker))
                    .withAttachStdout(true)
                    .withAttachStderr(true)
                    .exec()
                    .getId();
            boolean done = dockerClient.execStartCmd(killId)
                    .exec(new ExecStartResultCallback())
                    .awaitCompletion(KILL_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!done) {
                log.warn("[FAIL][WORKLOAD] cleanup of exec {} did not finish within {}s", execId, KILL_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[FAIL][WORKLOAD] interrupted while cleaning up exec {}", execId);
        } catch (RuntimeException e) {
            log.error("[FAIL][WORKLOAD] failed to kill exec {} in container {}", execId, containerId, e);
        }
    }

    static String killCommand(String marker) {
        return "for p in /proc/[0-9]*; do "
                + "if tr '\\0' '\\n' < \"$p/environ\" 2>/dev/null | grep -qx '" + EXEC_MARKER_ENV + "=" + marker + "'; "
                + "then kill -9 \"${p#/proc/}\" 2>/dev/null; fi; done; true";
    }

    /**
     * 프레임 바이트를 그대로 모았다가 UTF-8 로 디코딩한다.
     * 프레임 경계에서 잘린 멀티바이트 문자도 온전히 복원된다. 마지막 일부만 보관한다.
     */
    private static final class OutputTail {

        // UTF-8 한 글자는 최대 4바이트
        private static final int MAX_BYTES = ProcessWorkload.DIAGNOSTIC_TAIL_CHARS * 4;

        private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();

        synchronized void append(byte[] payload) {
            bytes.write(payload, 0, payload.length);
            if (bytes.size() > 2 * MAX_BYTES) {
                byte[] all = bytes.toByteArray();
                bytes.reset();
                bytes.write(all, all.length - MAX_BYTES, MAX_BYTES);
            }
        }

        synchronized boolean isEmpty() {
            return bytes.size() == 0;
        }

        synchronized String text() {
            String s = bytes.toString(StandardCharsets.UTF_8).trim();
            int max = ProcessWorkload.DIAGNOSTIC_TAIL_CHARS;
            return s.length() <= max ? s : s.substring(s.length() - max);
        }
    }
}
