package org.brown.greenbench.workload;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 로컬 셸 명령 워크로드 ({@code bash -c <command>})
 *
 * stdout/stderr 는 합쳐서 꼬리 부분만 진단 메시지로 남긴다.
 */
@Slf4j
public class ProcessWorkload implements Workload {

    static final int DIAGNOSTIC_TAIL_CHARS = 2000;

    private final List<String> command;
    private final Path workingDir;
    private final Long usefulWork;

    public ProcessWorkload(String shellCommand, Path workingDir, Long usefulWork) {
        this(List.of("bash", "-c", shellCommand), workingDir, usefulWork);
    }

    public ProcessWorkload(List<String> command, Path workingDir, Long usefulWork) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command is empty");
        }
        this.command = List.copyOf(command);
        this.workingDir = workingDir;
        this.usefulWork = usefulWork;
    }

    @Override
    public WorkloadResult run(Duration timeout) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(command).redirectErrorStream(true);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }

        long start = System.nanoTime();
        Process process = pb.start();
        OutputTail tail = new OutputTail(process.getInputStream());
        Thread drainer = new Thread(tail, "workload-output");
        drainer.setDaemon(true);
        drainer.start();

        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            destroyTree(process);
            throw e;
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        if (!finished) {
            destroyTree(process);
            log.warn("[FAIL][WORKLOAD] command timed out after {} ms: {}", timeout.toMillis(), command);
            return WorkloadResult.failed(elapsed, "timed out after " + timeout.toMillis() + " ms");
        }

        drainer.join(1000);
        int exitCode = process.exitValue();
        log.debug("Command exited with {} in {} ms", exitCode, elapsed.toMillis());

        return WorkloadResult.builder()
                .success(exitCode == 0)
                .elapsed(elapsed)
                .diagnostic(exitCode == 0 ? tail.text() : "exit code " + exitCode + "\n" + tail.text())
                .usefulWork(exitCode == 0 ? usefulWork : null)
                .build();
    }

    /**
     * 셸이 띄운 자식 프로세스까지 모두 종료한다. 남은 프로세스가 다음 시도의 측정에 섞이지 않게 한다.
     */
    static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    public List<String> command() {
        return command;
    }

    /**
     * 프로세스 출력을 끝까지 읽되 마지막 N 글자만 보관한다.
     */
    private static final class OutputTail implements Runnable {

        private final InputStream in;
        private final StringBuilder tail = new StringBuilder();

        private OutputTail(InputStream in) {
            this.in = in;
        }

        @Override
        public void run() {
            byte[] buf = new byte[4096];
            try (in) {
                int n;
                while ((n = in.read(buf)) != -1) {
                    append(new String(buf, 0, n, StandardCharsets.UTF_8));
                }
            } catch (IOException e) {
                log.debug("Workload output stream closed: {}", e.getMessage());
            }
        }

        private synchronized void append(String chunk) {
            tail.append(chunk);
            if (tail.length() > DIAGNOSTIC_TAIL_CHARS) {
                tail.delete(0, tail.length() - DIAGNOSTIC_TAIL_CHARS);
            }
        }

        private synchronized String text() {
            return tail.toString().trim();
        }
    }
}
