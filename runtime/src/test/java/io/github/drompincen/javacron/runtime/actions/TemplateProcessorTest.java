package io.github.drompincen.javacron.runtime.actions;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateProcessorTest {

    private TemplateProcessor processor;
    private TemplateContext context;

    @BeforeEach
    void setUp() {
        processor = new TemplateProcessor(new ObjectMapper(), ZoneOffset.UTC);
        context = new TemplateContext(
                Map.of("name", "backup", "status", "success", "duration", 90_000L,
                        "executionTime", "2026-03-01T10:00:00Z"),
                Map.of("region", "eu-west"),
                Map.of("ticket", "OPS-7"),
                Map.of("healthy", true));
    }

    @Test
    void rendersNamespacedFields() {
        String out = processor.processTemplate(
                "{{javacron.event.name}} in {{javacron.getVariables.region}} for {{javacron.input.ticket}}", context);

        assertThat(out).isEqualTo("backup in eu-west for OPS-7");
    }

    @Test
    void ifEqualsPicksBranch() {
        String template = "{{#ifEquals javacron.event.status \"success\"}}OK{{else}}FAIL{{/ifEquals}}";

        assertThat(processor.processTemplate(template, context)).isEqualTo("OK");
    }

    @Test
    void formatsDurationAndTime() {
        assertThat(processor.processTemplate("{{formatDuration javacron.event.duration}}", context)).isEqualTo("1.5m");
        assertThat(processor.processTemplate("{{formatTime javacron.event.executionTime}}", context))
                .startsWith("2026-03-01 10:00:00");
        assertThat(processor.processTemplate("{{formatTime javacron.event.missing}}", context)).isEqualTo("Unknown");
    }

    @Test
    void getHelperFallsBackOnMissingPath() {
        assertThat(processor.processTemplate("{{get javacron \"getVariables.region\" \"none\"}}", context)).isEqualTo("eu-west");
        assertThat(processor.processTemplate("{{get javacron \"getVariables.nope\" \"none\"}}", context)).isEqualTo("none");
    }

    @Test
    void brokenTemplateReturnsNoticeWithRawText() {
        String out = processor.processTemplate("Hello {{#if}", context);

        assertThat(out).startsWith("[Template Error:").endsWith("Hello {{#if}");
        assertThat(processor.isValid("Hello {{#if}")).isFalse();
        assertThat(processor.isValid("Hello {{javacron.event.name}}")).isTrue();
    }

    @Test
    void durationBuckets() {
        assertThat(TemplateProcessor.formatDuration(250)).isEqualTo("250ms");
        assertThat(TemplateProcessor.formatDuration(2500)).isEqualTo("2.5s");
        assertThat(TemplateProcessor.formatDuration(7_200_000)).isEqualTo("2.0h");
    }

    @Test
    void nullTemplateRendersEmpty() {
        assertThat(processor.processTemplate(null, context)).isEmpty();
    }
}
