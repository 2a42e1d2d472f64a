package org.brown.greenbench.workload;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.ExecCreateCmd;
import com.github.dockerjava.api.command.ExecCreateCmdResponse;
import com.github.dockerjava.api.command.ExecStartCmd;
import com.github.dockerjava.api.command.InspectExecCmd;
import com.github.dockerjava.api.command.InspectExecResponse;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.StreamType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("DockerExecWorkload Tests")
class DockerExecWorkloadTest {

    private final DockerClient docker = mock(DockerClient.class);
    private final ExecCreateCmd createCmd = mock(ExecCreateCmd.class);
    private final ExecStartCmd runStart = mock(ExecStartCmd.class);
    private final ExecStartCmd killStart = mock(ExecStartCmd.class);
    private final List<List<String>> createdCommands = new ArrayList<>();
    private final List<List<String>> envs = new ArrayList<>();

    @BeforeEach
    void setUp() {
        ExecCreateCmdResponse runResponse = mock(ExecCreateCmdResponse.class);
        ExecCreateCmdResponse killResponse = mock(ExecCreateCmdResponse.class);
        when(runResponse.getId()).thenReturn("exec-run");
        when(killResponse.getId()).thenReturn("exec-kill");

        when(docker.execCreateCmd("c1")).thenReturn(createCmd);
        when(createCmd.withCmd(any(String[].class))).thenAnswer(inv -> {
            createdCommands.add(Arrays.asList((String[]) inv.getRawArguments()[0]));
            return createCmd;
        });
        when(createCmd.withWorkingDir(anyString())).thenReturn(createCmd);
        when(createCmd.withEnv(anyList())).thenAnswer(inv -> {
            envs.add(inv.getArgument(0));
            return createCmd;
        });
        when(createCmd.withAttachStdout(anyBoolean())).thenReturn(createCmd);
        when(createCmd.withAttachStderr(anyBoolean())).thenReturn(createCmd);
        when(createCmd.exec()).thenReturn(runResponse, killResponse);

        when(docker.execStartCmd("exec-run")).thenReturn(runStart);
        when(docker.execStartCmd("exec-kill")).thenReturn(killStart);
        when(killStart.exec(any())).thenAnswer(inv -> {
            ResultCallback<Frame> callback = inv.getArgument(0);
            callback.onComplete();
            return callback;
        });
    }

    private void exitCode(long code) {
        InspectExecCmd inspectCmd = mock(InspectExecCmd.class);
        InspectExecResponse inspect = mock(InspectExecResponse.class);
        when(docker.inspectExecCmd("exec-run")).thenReturn(inspectCmd);
        when(inspectCmd.exec()).thenReturn(inspect);
        when(inspect.getExitCodeLong()).thenReturn(code);
    }

    @Test
    @DisplayName("Should kill every process tagged with the exec marker when the timeout elapses")
    void testTimeoutKillsExecProcesses() throws Exception {
        when(runStart.exec(any())).thenAnswer(inv -> inv.getArgument(0));
        DockerExecWorkload workload = new DockerExecWorkload(docker, "c1", "/workspace", "pytest -x", null);

        WorkloadResult result = workload.run(Duration.ofMillis(100));

        assertFalse(result.isSuccess());
        assertEquals("timed out after 100 ms", result.getDiagnostic());
        assertEquals(2, createdCommands.size());
        assertEquals(List.of("/bin/bash", "-c", "pytest -x"), createdCommands.get(0));

        String marker = envs.get(0).get(0);
        assertTrue(marker.startsWith(DockerExecWorkload.EXEC_MARKER_ENV + "="));
        List<String> kill = createdCommands.get(1);
        assertEquals("/bin/sh", kill.get(0));
        assertTrue(kill.get(2).contains("grep -qx '" + marker + "'"));
        assertTrue(kill.get(2).contains("kill -9"));
    }

    @Test
    @DisplayName("Should decode output frames as UTF-8 even when a character is split across frames")
    void testUtf8AcrossFrames() throws Exception {
        byte[] text = "héllo  wörld\n  3 passed".getBytes(StandardCharsets.UTF_8);
        int split = 2;
        when(runStart.exec(any())).thenAnswer(inv -> {
            ResultCallback<Frame> callback = inv.getArgument(0);
            callback.onNext(new Frame(StreamType.STDOUT, Arrays.copyOfRange(text, 0, split)));
            callback.onNext(new Frame(StreamType.STDOUT, Arrays.copyOfRange(text, split, text.length)));
            callback.onComplete();
            return callback;
        });
        exitCode(0);
        DockerExecWorkload workload = new DockerExecWorkload(docker, "c1", "/workspace", "pytest", 3L);

        WorkloadResult result = workload.run(Duration.ofSeconds(5));

        assertTrue(result.isSuccess());
        assertEquals("héllo  wörld\n  3 passed", result.getDiagnostic());
        assertEquals(3L, result.usefulWorkCount().getAsLong());
        assertEquals(1, createdCommands.size());
    }

    @Test
    @DisplayName("Should report the exit code and stderr of a failed exec")
    void testNonZeroExit() throws Exception {
        when(runStart.exec(any())).thenAnswer(inv -> {
            ResultCallback<Frame> callback = inv.getArgument(0);
            callback.onNext(new Frame(StreamType.STDERR, "AssertionError\n".getBytes(StandardCharsets.UTF_8)));
            callback.onComplete();
            return callback;
        });
        exitCode(1);
        DockerExecWorkload workload = new DockerExecWorkload(docker, "c1", "/workspace", "pytest", 3L);

        WorkloadResult result = workload.run(Duration.ofSeconds(5));

        assertFalse(result.isSuccess());
        assertEquals("exit code 1\nAssertionError", result.getDiagnostic());
    }
}
