package io.github.drompincen.javacron.runtime.actions;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.jknack.handlebars.Handlebars;
import com.github.jknack.handlebars.Helper;
import com.github.jknack.handlebars.Template;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Handlebars rendering for conditional-action messages and subjects.
 */
@Component
public class TemplateProcessor {

    private static final Logger log = LoggerFactory.getLogger(TemplateProcessor.class);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z", Locale.ROOT);

    private final Handlebars handlebars = new Handlebars();
    private final ObjectMapper objectMapper;
    private final ZoneId zone;

    public TemplateProcessor(ObjectMapper objectMapper) {
        this(objectMapper, ZoneId.systemDefault());
    }

    TemplateProcessor(ObjectMapper objectMapper, ZoneId zone) {
        this.objectMapper = objectMapper;
        this.zone = zone;
        registerHelpers();
    }

    private void registerHelpers() {
        handlebars.registerHelper("get", (Helper<Object>) (obj, options) -> {
            String path = options.param(0, "");
            Object fallback = options.param(1, "");
            Object current = obj;
            for (String key : path.split("\\.")) {
                if (!(current instanceof Map<?, ?> map)) return fallback;
                current = map.get(key);
            }
            return current == null ? fallback : current;
        });

        handlebars.registerHelper("ifEquals", (Helper<Object>) (left, options) -> {
            Object right = options.param(0, null);
            boolean equal = left != null && right != null
                    ? String.valueOf(left).equals(String.valueOf(right))
                    : Objects.equals(left, right);
            return equal ? options.fn() : options.inverse();
        });

        handlebars.registerHelper("formatDuration", (Helper<Object>) (ms, options) ->
                ms instanceof Number n ? formatDuration(n.longValue()) : "Less than 1 second");

        handlebars.registerHelper("formatTime", (Helper<Object>) (timestamp, options) -> formatTime(timestamp));

        handlebars.registerHelper("json", (Helper<Object>) (obj, options) ->
                new Handlebars.SafeString(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(obj)));

        handlebars.registerHelper("lookup", (Helper<Object>) (obj, options) -> {
            Object field = options.param(0, null);
            return obj instanceof Map<?, ?> map && field != null ? map.get(String.valueOf(field)) : null;
        });
    }

    /**
     * Renders {@code template}. A broken template yields an error notice followed by the raw
     * template instead of an exception.
     */
    public String processTemplate(String template, TemplateContext context) {
        if (template == null) return "";
        try {
            Template compiled = handlebars.compileInline(template);
            return compiled.apply(context.toModel());
        } catch (IOException | RuntimeException e) {
            log.warn("Template processing error: {}", e.getMessage());
            return "[Template Error: " + e.getMessage() + "]\n\n" + template;
        }
    }

    public boolean isValid(String template) {
        try {
            handlebars.compileInline(template);
            return true;
        } catch (IOException | RuntimeException e) {
            return false;
        }
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        if (ms < 60_000) return String.format(Locale.ROOT, "%.1fs", ms / 1000.0);
        if (ms < 3_600_000) return String.format(Locale.ROOT, "%.1fm", ms / 60_000.0);
        return String.format(Locale.ROOT, "%.1fh", ms / 3_600_000.0);
    }

    private String formatTime(Object timestamp) {
        if (timestamp == null || String.valueOf(timestamp).isBlank()) return "Unknown";
        try {
            Instant instant = timestamp instanceof Instant i ? i : Instant.parse(String.valueOf(timestamp));
            return TIME_FORMAT.format(instant.atZone(zone));
        } catch (DateTimeParseException e) {
            return String.valueOf(timestamp);
        }
    }
}
