package com.planforge.llm.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.common.concurrent.CancellationToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Accumulates a streamed curriculum and validates it once the stream is exhausted.
 *
 * <p>Memory is bounded: the buffer never grows past {@code maxResponseChars}; the chunk that would push it over
 * fails the parse immediately, before the rest of the stream is read. While accumulating, a cheap pattern check
 * spots the opening of the {@code modules} array and fires the first-module hook once.</p>
 *
 * <p>Cancellation is checked between chunks, before and after the document parse, and per module.
 * {@link com.planforge.common.concurrent.GenerationCancelledException} passes through untouched.</p>
 */
@Component
@Slf4j
public class GenerationStreamParser {

    public static final int DEFAULT_MAX_RESPONSE_CHARS = 200_000;
    public static final int DEFAULT_MAX_MODULES = 12;
    public static final int DEFAULT_MAX_TASKS_PER_MODULE = 20;

    private static final String MODULES_KEY = "\"modules\"";
    private static final Pattern MODULES_OPENING = Pattern.compile("\"modules\"\\s*:\\s*[\\{\\[]");
    // What may follow the key while the opening bracket has not arrived yet
    private static final Pattern PENDING_OPENING = Pattern.compile("\\s*(:\\s*)?");
    private static final Pattern NUMERIC_TEXT = Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");
    private static final Pattern CODE_FENCE = Pattern.compile("^```[a-zA-Z]*\\s*|\\s*```$");

    private final ObjectMapper objectMapper;
    private final int maxResponseChars;
    private final int maxModules;
    private final int maxTasksPerModule;

    @Autowired
    public GenerationStreamParser(
            ObjectMapper objectMapper,
            @Value("${llm.parser.max-response-chars:200000}") int maxResponseChars,
            @Value("${llm.parser.max-modules:12}") int maxModules,
            @Value("${llm.parser.max-tasks-per-module:20}") int maxTasksPerModule) {
        this.objectMapper = objectMapper;
        this.maxResponseChars = maxResponseChars;
        this.maxModules = maxModules;
        this.maxTasksPerModule = maxTasksPerModule;
    }

    public GenerationStreamParser(ObjectMapper objectMapper) {
        this(objectMapper, DEFAULT_MAX_RESPONSE_CHARS, DEFAULT_MAX_MODULES, DEFAULT_MAX_TASKS_PER_MODULE);
    }

    public ParsedGeneration parse(Iterator<String> chunks) {
        return parse(chunks, null, CancellationToken.create());
    }

    public ParsedGeneration parse(Iterator<String> chunks, Runnable onFirstModuleDetected, CancellationToken cancellationToken) {
        StringBuilder buffer = new StringBuilder();
        boolean moduleDetected = false;
        int detectionFrom = 0;
        int chunkCount = 0;

        cancellationToken.throwIfCancelled();
        while (chunks.hasNext()) {
            cancellationToken.throwIfCancelled();
            String chunk = chunks.next();
            if (chunk == null || chunk.isEmpty()) {
                continue;
            }
            chunkCount++;
            if (buffer.length() + chunk.length() > maxResponseChars) {
                log.warn("[PARSER] Response exceeds size limit | maxChars={} | bufferedChars={} | chunks={}",
                    maxResponseChars, buffer.length(), chunkCount);
                throw ParserException.validation(
                    "AI provider response exceeds maximum size (" + maxResponseChars + " chars).");
            }
            buffer.append(chunk);

            if (!moduleDetected) {
                if (MODULES_OPENING.matcher(buffer).region(detectionFrom, buffer.length()).find()) {
                    moduleDetected = true;
                    log.debug("[PARSER] Modules array detected | bufferedChars={} | chunks={}", buffer.length(), chunkCount);
                    if (onFirstModuleDetected != null) {
                        onFirstModuleDetected.run();
                    }
                } else {
                    detectionFrom = nextDetectionStart(buffer, detectionFrom);
                }
            }
        }

        cancellationToken.throwIfCancelled();
        log.debug("[PARSER] Stream exhausted | chars={} | chunks={}", buffer.length(), chunkCount);

        JsonNode root = readDocument(buffer);
        cancellationToken.throwIfCancelled();

        List<ParsedModule> modules = readModules(root, cancellationToken);
        cancellationToken.throwIfCancelled();

        ParsedGeneration generation = ParsedGeneration.builder()
            .modules(List.copyOf(modules))
            .rawLength(buffer.length())
            .build();
        log.info("[PARSER] Parsed curriculum | modules={} | tasks={} | chars={}",
            modules.size(), generation.getTaskCount(), buffer.length());
        return generation;
    }

    /**
     * Earliest offset where the modules opening can still be found once more text arrives: a key whose colon
     * or bracket is still outstanding, however much whitespace follows it, or else a key split at the end.
     */
    static int nextDetectionStart(StringBuilder buffer, int from) {
        int pendingKey = -1;
        for (int key = buffer.indexOf(MODULES_KEY, from); key >= 0; key = buffer.indexOf(MODULES_KEY, key + 1)) {
            if (PENDING_OPENING.matcher(buffer).region(key + MODULES_KEY.length(), buffer.length()).matches()) {
                pendingKey = key;
            }
        }
        if (pendingKey >= 0) {
            return pendingKey;
        }
        return Math.max(from, buffer.length() - (MODULES_KEY.length() - 1));
    }

    private JsonNode readDocument(StringBuilder buffer) {
        String document = CODE_FENCE.matcher(buffer.toString().trim()).replaceAll("");
        if (document.isBlank()) {
            throw new ParserException(ParserException.Kind.INVALID_JSON, "AI provider returned an empty response.");
        }
        try {
            return objectMapper.readTree(document);
        } catch (JsonProcessingException e) {
            log.warn("[PARSER] Invalid JSON | chars={} | error={}", document.length(), e.getOriginalMessage());
            throw new ParserException(ParserException.Kind.INVALID_JSON, "AI provider returned invalid JSON.", e);
        }
    }

    private List<ParsedModule> readModules(JsonNode root, CancellationToken cancellationToken) {
        if (root == null || !root.isObject()) {
            throw ParserException.validation("AI provider response must be an object.");
        }
        JsonNode modulesNode = root.get("modules");
        if (modulesNode == null || !modulesNode.isArray()) {
            throw ParserException.validation("AI provider response missing modules array.");
        }
        if (modulesNode.isEmpty()) {
            throw ParserException.validation("AI provider returned zero modules.");
        }
        if (modulesNode.size() > maxModules) {
            throw ParserException.validation("AI provider response exceeds maximum modules (" + maxModules + ").");
        }

        List<ParsedModule> modules = new ArrayList<>(modulesNode.size());
        int moduleNumber = 0;
        for (JsonNode moduleNode : modulesNode) {
            cancellationToken.throwIfCancelled();
            moduleNumber++;
            modules.add(readModule(moduleNode, moduleNumber));
        }
        return modules;
    }

    private ParsedModule readModule(JsonNode node, int moduleNumber) {
        String label = "Module " + moduleNumber;
        if (!node.isObject()) {
            throw ParserException.validation(label + " is not an object.");
        }

        String title = requiredText(node, label + " title must be a non-empty string.", "title");
        Double minutes = finiteNumber(node);
        if (minutes == null) {
            throw ParserException.validation(label + " estimated minutes must be a finite number.");
        }
        String description = optionalText(node, label);

        JsonNode tasksNode = node.get("tasks");
        if (tasksNode == null || !tasksNode.isArray() || tasksNode.isEmpty()) {
            throw ParserException.validation(label + " must include at least one task.");
        }
        if (tasksNode.size() > maxTasksPerModule) {
            throw ParserException.validation(label + " exceeds maximum tasks (" + maxTasksPerModule + ").");
        }

        ParsedModule.ParsedModuleBuilder module = ParsedModule.builder()
            .title(title)
            .description(description)
            .estimatedMinutes(minutes);

        int taskNumber = 0;
        for (JsonNode taskNode : tasksNode) {
            taskNumber++;
            module.task(readTask(taskNode, moduleNumber, taskNumber));
        }
        return module.build();
    }

    private ParsedTask readTask(JsonNode node, int moduleNumber, int taskNumber) {
        String label = "Task " + taskNumber + " in module " + moduleNumber;
        if (!node.isObject()) {
            throw ParserException.validation(label + " is not an object.");
        }
        String title = requiredText(node, label + " title must be a non-empty string.", "title", "task");
        Double minutes = finiteNumber(node);
        if (minutes == null) {
            throw ParserException.validation(label + " estimated minutes must be a finite number.");
        }
        return ParsedTask.builder()
            .title(title)
            .description(optionalText(node, label))
            .estimatedMinutes(minutes)
            .build();
    }

    private String requiredText(JsonNode node, String message, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        throw ParserException.validation(message);
    }

    /** description or summary; blank becomes null. */
    private String optionalText(JsonNode node, String label) {
        JsonNode value = node.hasNonNull("description") ? node.get("description") : node.get("summary");
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw ParserException.validation(label + " description must be a string when provided.");
        }
        String trimmed = value.asText().trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private Double finiteNumber(JsonNode node) {
        JsonNode value = node.hasNonNull("estimatedMinutes") ? node.get("estimatedMinutes") : node.get("estimated_minutes");
        if (value == null || value.isNull()) {
            return null;
        }
        double number;
        if (value.isNumber()) {
            number = value.asDouble();
        } else if (value.isTextual()) {
            String text = value.asText().trim();
            // Blank text counts as zero, the usual string-to-number coercion
            if (text.isEmpty()) {
                return 0.0;
            }
            Matcher numeric = NUMERIC_TEXT.matcher(text);
            if (!numeric.matches()) {
                return null;
            }
            number = Double.parseDouble(numeric.group());
        } else {
            return null;
        }
        return Double.isFinite(number) ? number : null;
    }
}
