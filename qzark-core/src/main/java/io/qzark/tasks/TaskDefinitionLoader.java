package io.qzark.tasks;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.qzark.core.Task;
import io.qzark.core.TaskDefinitionException;
import io.qzark.utils.IntervalParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads task definitions from a YAML document:
 *
 * <pre>
 * tasks:
 *   - name: disk-check
 *     interval_seconds: 300
 *     shell_command: "df -h / | tail -1"
 * </pre>
 *
 * <p>Records that are incomplete or invalid are skipped with a warning; the remaining records are
 * returned in document order. An unreadable document yields an empty list.
 */
public class TaskDefinitionLoader {
    private static final Logger log = LoggerFactory.getLogger(TaskDefinitionLoader.class);

    private final ObjectMapper yamlMapper;

    public TaskDefinitionLoader() {
        this(new ObjectMapper(new YAMLFactory()));
    }

    public TaskDefinitionLoader(ObjectMapper yamlMapper) {
        this.yamlMapper = yamlMapper;
    }

    public List<Task> load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            List<Task> tasks = load(in);
            log.info("Loaded {} tasks from '{}'.", tasks.size(), file);
            return tasks;
        } catch (NoSuchFileException e) {
            log.error("Tasks file not found: {}", file);
            return List.of();
        } catch (IOException e) {
            log.error("Error reading tasks file '{}': {}", file, e.getMessage());
            return List.of();
        }
    }

    public List<Task> load(InputStream in) {
        JsonNode root;
        try {
            root = yamlMapper.readTree(in);
        } catch (IOException e) {
            log.error("Error parsing YAML: {}", e.getMessage());
            return List.of();
        }
        return fromTree(root);
    }

    List<Task> fromTree(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return List.of();
        }

        JsonNode items = root.path("tasks");
        if (!items.isArray()) {
            if (!items.isMissingNode() && !items.isNull()) {
                log.warn("'tasks' must be a list, got {}", items.getNodeType());
            }
            return List.of();
        }

        List<Task> tasks = new ArrayList<>(items.size());
        Set<String> names = new HashSet<>();
        for (JsonNode item : items) {
            try {
                Task task = toTask(item);
                if (!names.add(task.name())) {
                    throw new TaskDefinitionException("duplicate task name '" + task.name() + "'");
                }
                tasks.add(task);
            } catch (TaskDefinitionException e) {
                log.warn("Invalid task definition: {} ({})", item, e.getMessage());
            }
        }
        return tasks;
    }

    static Task toTask(JsonNode item) throws TaskDefinitionException {
        if (item == null || !item.isObject()) {
            throw new TaskDefinitionException("task record must be a mapping");
        }

        String name = text(item, "name");
        String command = text(item, "shell_command");
        if (name == null || command == null) {
            throw new TaskDefinitionException("'name' and 'shell_command' are required");
        }

        return new Task(name, interval(item), command);
    }

    private static Duration interval(JsonNode item) throws TaskDefinitionException {
        JsonNode seconds = item.get("interval_seconds");
        JsonNode human = item.get("interval");
        try {
            if (seconds != null && !seconds.isNull()) {
                if (seconds.isIntegralNumber() && seconds.canConvertToLong()) {
                    return IntervalParser.parseSeconds(seconds.asLong());
                }
                if (seconds.isTextual() && seconds.asText().trim().matches("^-?\\d{1,18}$")) {
                    return IntervalParser.parseSeconds(Long.parseLong(seconds.asText().trim()));
                }
                throw new TaskDefinitionException("'interval_seconds' must be an integer: " + seconds);
            }
            if (human != null && !human.isNull()) {
                return IntervalParser.parseDuration(human.asText());
            }
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new TaskDefinitionException(e.getMessage(), e);
        }
        return Task.DEFAULT_INTERVAL;
    }

    private static String text(JsonNode item, String field) {
        JsonNode node = item.get(field);
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }
}
