package io.github.drompincen.javacron.runtime.script;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.javacron.runtime.remote.LocalHost;
import io.github.drompincen.javacron.runtime.store.InMemoryEventStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@EnabledOnOs({OS.LINUX, OS.MAC})
@EnabledIf("interpreterPresent")
class LocalPythonRunTest {

    @TempDir Path workRoot;

    private final InMemoryEventStore store = new InMemoryEventStore();
    private final ScriptExecutor executor = new ScriptExecutor(store, new ObjectMapper());

    static boolean interpreterPresent() {
        return Interpreters.available("python3");
    }

    @Test
    void helpersRoundTripThroughTheWorkDir() {
        Map<String, String> variables = new LinkedHashMap<>();
        variables.put("old", "x");
        variables.put("keep", "café");
        store.variables.put("user-1", new LinkedHashMap<>(variables));

        String script = String.join("\n",
                "setCondition(True)",
                "output({\"ok\": True, \"a\": input()[\"a\"], \"event\": event()[\"id\"]})",
                "setVariable(\"report\", \"line1\\nline2\")",
                "deleteVariable(\"old\")",
                "print(\"keep=\" + getVariable(\"keep\") + \" cond=\" + str(getCondition()).lower() + \" env=\" + __import__(\"os\").environ[\"GREETING\"])",
                "");

        ScriptRunResult result = executor.run(new LocalHost(), workRoot.toString(),
                new ScriptRunRequest("user-1", ShimLanguage.PYTHON, script, Map.of("a", 7),
                        Map.of("id", "evt-1"), variables, Map.of("GREETING", "hello"), Duration.ofSeconds(20)));

        assertThat(result.exitCode()).as(result.stderr()).isZero();
        assertThat(result.stdout()).contains("keep=café cond=true env=hello");
        assertThat(result.condition()).isTrue();
        assertThat(result.output().get("ok").asBoolean()).isTrue();
        assertThat(result.output().get("a").asInt()).isEqualTo(7);
        assertThat(result.output().get("event").asText()).isEqualTo("evt-1");
        assertThat(store.variables.get("user-1"))
                .containsEntry("report", "line1\nline2")
                .containsEntry("keep", "café")
                .doesNotContainKey("old");
    }

    @Test
    void conditionIsFalseWhenSetFalse() {
        String script = "setCondition(False)\n";

        ScriptRunResult result = executor.run(new LocalHost(), workRoot.toString(),
                new ScriptRunRequest("user-1", ShimLanguage.PYTHON, script, Map.of(), Map.of(), Map.of(),
                        Map.of(), Duration.ofSeconds(20)));

        assertThat(result.exitCode()).as(result.stderr()).isZero();
        assertThat(result.condition()).isFalse();
        assertThat(result.variableChanges().isEmpty()).isTrue();
    }
}
