package io.github.drompincen.javacron.runtime.script;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.javacron.runtime.remote.CommandResult;
import io.github.drompincen.javacron.runtime.remote.FakeRemoteSession;
import io.github.drompincen.javacron.runtime.store.EventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ScriptExecutorTest {

    private static final String BASE = "/tmp";

    @Mock private EventStore eventStore;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ScriptExecutor executor;
    private FakeRemoteSession host;

    @BeforeEach
    void setUp() {
        executor = new ScriptExecutor(eventStore, objectMapper);
        host = new FakeRemoteSession();
    }

    /** Simulates the script: {@code body} sees the work directory and the session's files. */
    private void whenScriptRuns(CommandResult result, BiConsumer<String, FakeRemoteSession> body) {
        host.onExec((session, command) -> {
            if (command.startsWith("/bin/bash ") && command.endsWith("/" + WorkDir.RUNNER)) {
                String dir = command.substring("/bin/bash ".length(), command.length() - WorkDir.RUNNER.length() - 1);
                body.accept(dir, session);
                return result;
            }
            return new CommandResult("", "", 0, false);
        });
    }

    private static void put(FakeRemoteSession session, String path, String content) {
        session.writeFile(path, content.getBytes(StandardCharsets.UTF_8));
    }

    private ScriptRunRequest request(Map<String, String> variables) {
        return new ScriptRunRequest("user-1", ShimLanguage.BASH, "echo hello",
                Map.of("region", "eu"), Map.of("id", "evt-1", "name", "Nightly"),
                variables, Map.of("API_TOKEN", "t0k'en", "BAD-NAME", "x"), Duration.ofSeconds(30));
    }

    // ------------------------------------------------------------------
    // Staging
    // ------------------------------------------------------------------

    @Test
    void stagesProtocolFilesBeforeRunning() {
        AtomicReference<Map<String, String>> seen = new AtomicReference<>();
        whenScriptRuns(new CommandResult("hello\n", "", 0, false), (dir, session) -> {
            Map<String, String> snapshot = new LinkedHashMap<>();
            for (String name : new String[]{WorkDir.INPUT, WorkDir.EVENT, WorkDir.VARIABLES, "script.sh", WorkDir.RUNNER}) {
                snapshot.put(name, session.fileText(dir + "/" + name));
            }
            seen.set(snapshot);
        });

        ScriptRunResult result = executor.run(host, BASE, request(Map.of("counter", "1")));

        assertThat(result.success()).isTrue();
        assertThat(result.stdout()).isEqualTo("hello\n");
        Map<String, String> files = seen.get();
        assertThat(files.get(WorkDir.INPUT)).contains("\"region\" : \"eu\"");
        assertThat(files.get(WorkDir.EVENT)).contains("\"name\" : \"Nightly\"");
        assertThat(files.get(WorkDir.VARIABLES)).contains("\"counter\" : \"1\"").contains(WorkDir.UPDATED_KEY);
        assertThat(files.get("script.sh")).contains("setCondition()").endsWith("echo hello");
        assertThat(files.get(WorkDir.RUNNER))
                .contains("export API_TOKEN='t0k'\"'\"'en'")
                .doesNotContain("BAD-NAME")
                .contains("exec bash /tmp/javacron_");
        assertThat(host.commands.get(0)).startsWith("mkdir -p -m 700 /tmp/javacron_");
    }

    @Test
    void runnerExportsWorkDirBeforeUserEnvironment() {
        String runner = executor.runner("/tmp/javacron_x", ShimLanguage.PYTHON, Map.of("MODE", "fast lane"));

        assertThat(runner).startsWith("#!/bin/bash\nexport JAVACRON_WORK_DIR=/tmp/javacron_x\n")
                .contains("export MODE='fast lane'\n")
                .contains("cd /tmp/javacron_x || exit 1\n")
                .endsWith("exec python3 /tmp/javacron_x/script.py\n");
    }

    // ------------------------------------------------------------------
    // Read-back
    // ------------------------------------------------------------------

    @Test
    void readsOutputAndTrueCondition() {
        whenScriptRuns(new CommandResult("", "", 0, false), (dir, session) -> {
            put(session, dir + "/" + WorkDir.OUTPUT, "{\"rows\": 42}");
            put(session, dir + "/" + WorkDir.CONDITION, "{\"condition\": true}");
        });

        ScriptRunResult result = executor.run(host, BASE, request(Map.of()));

        assertThat(result.output().get("rows").asInt()).isEqualTo(42);
        assertThat(result.condition()).isTrue();
    }

    @Test
    void missingConditionIsNullNotFalse() {
        whenScriptRuns(new CommandResult("", "", 0, false), (dir, session) -> { });

        ScriptRunResult result = executor.run(host, BASE, request(Map.of()));

        assertThat(result.condition()).isNull();
        assertThat(result.output()).isNull();
        assertThat(result.success()).isTrue();
    }

    @Test
    void unparseableOutputIsNoDataNotAnError() {
        whenScriptRuns(new CommandResult("", "", 0, false), (dir, session) ->
                put(session, dir + "/" + WorkDir.OUTPUT, "{not json"));

        ScriptRunResult result = executor.run(host, BASE, request(Map.of()));

        assertThat(result.success()).isTrue();
        assertThat(result.output()).isNull();
    }

    @Test
    void falseConditionIsReported() {
        whenScriptRuns(new CommandResult("", "", 0, false), (dir, session) ->
                put(session, dir + "/" + WorkDir.CONDITION, "{\"condition\": false}"));

        assertThat(executor.run(host, BASE, request(Map.of())).condition()).isFalse();
    }

    // ------------------------------------------------------------------
    // Variables
    // ------------------------------------------------------------------

    @Test
    void persistsChangedAddedAndDeletedVariables() {
        whenScriptRuns(new CommandResult("", "", 0, false), (dir, session) ->
                put(session, dir + "/" + WorkDir.VARIABLES,
                        "{\"counter\": \"2\", \"keep\": \"same\", \"fresh\": \"new\", \"__updated__\": \"later\"}"));

        ScriptRunResult result = executor.run(host, BASE,
                request(Map.of("counter", "1", "keep", "same", "gone", "bye")));

        verify(eventStore).setUserVariable("user-1", "counter", "2");
        verify(eventStore).setUserVariable("user-1", "fresh", "new");
        verify(eventStore).deleteUserVariable("user-1", "gone");
        verify(eventStore, never()).setUserVariable(anyString(), eq("keep"), anyString());
        verify(eventStore, never()).setUserVariable(anyString(), eq(WorkDir.UPDATED_KEY), anyString());
        assertThat(result.variableChanges().deletions()).containsExactly("gone");
    }

    @Test
    void untouchedVariablesCauseNoWrites() {
        whenScriptRuns(new CommandResult("", "", 0, false), (dir, session) -> { });

        executor.run(host, BASE, request(Map.of("counter", "1")));

        verify(eventStore, never()).setUserVariable(anyString(), anyString(), anyString());
        verify(eventStore, never()).deleteUserVariable(anyString(), anyString());
    }

    @Test
    void corruptVariablesFileDeletesNothing() {
        whenScriptRuns(new CommandResult("", "", 0, false), (dir, session) ->
                put(session, dir + "/" + WorkDir.VARIABLES, "{\"counter\": "));

        executor.run(host, BASE, request(Map.of("counter", "1")));

        verify(eventStore, never()).deleteUserVariable(anyString(), anyString());
    }

    @Test
    void variableStoreFailureDoesNotFailTheRun() {
        doThrow(new IllegalStateException("db down")).when(eventStore).setUserVariable(anyString(), anyString(), anyString());
        whenScriptRuns(new CommandResult("done", "", 0, false), (dir, session) ->
                put(session, dir + "/" + WorkDir.VARIABLES, "{\"a\": \"1\", \"b\": \"2\"}"));

        ScriptRunResult result = executor.run(host, BASE, request(Map.of()));

        assertThat(result.success()).isTrue();
        verify(eventStore, times(2)).setUserVariable(anyString(), anyString(), anyString());
    }

    // ------------------------------------------------------------------
    // Cleanup
    // ------------------------------------------------------------------

    @Test
    void workDirIsRemovedAfterSuccess() {
        whenScriptRuns(new CommandResult("", "", 0, false), (dir, session) ->
                put(session, dir + "/" + WorkDir.OUTPUT, "{}"));

        executor.run(host, BASE, request(Map.of()));

        assertThat(host.files).isEmpty();
        assertThat(host.commands).anyMatch(c -> c.startsWith("rm -rf /tmp/javacron_"));
        assertThat(host.commands).anyMatch(c -> c.startsWith("find /tmp -maxdepth 1 -type d -name 'javacron_*' -mmin +5"));
    }

    @Test
    void workDirIsRemovedAfterTimeout() {
        whenScriptRuns(CommandResult.timeout("partial", "Command timed out"), (dir, session) -> { });

        ScriptRunResult result = executor.run(host, BASE, request(Map.of()));

        assertThat(result.timedOut()).isTrue();
        assertThat(result.success()).isFalse();
        assertThat(result.exitCode()).isEqualTo(-1);
        assertThat(host.files).isEmpty();
    }

    @Test
    void failedMkdirSkipsTheRun() {
        host.onExec((session, command) -> command.startsWith("mkdir")
                ? new CommandResult("", "Permission denied", 1, false)
                : new CommandResult("", "", 0, false));

        ScriptRunResult result = executor.run(host, BASE, request(Map.of()));

        assertThat(result.success()).isFalse();
        assertThat(result.stderr()).contains("Permission denied");
        assertThat(host.commands).noneMatch(c -> c.startsWith("/bin/bash"));
        assertThat(host.commands).anyMatch(c -> c.startsWith("rm -rf"));
    }
}
