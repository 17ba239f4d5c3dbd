package com.planforge.core.input;

import com.planforge.common.constants.LearningStyle;
import com.planforge.common.constants.SkillLevel;
import com.planforge.common.util.HashUtils;
import com.planforge.common.util.TruncatedText;
import com.planforge.llm.model.GenerationInput;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@Component
@Slf4j
public class InputSanitizer {

    public static final int DEFAULT_TOPIC_MAX_LENGTH = 200;
    public static final int DEFAULT_NOTES_MAX_LENGTH = 2_000;
    public static final int DEFAULT_SOURCE_CONTEXT_MAX_LENGTH = 20_000;
    private static final int MAX_WEEKLY_HOURS = 80;

    private final int topicMaxLength;
    private final int notesMaxLength;
    private final int sourceContextMaxLength;

    @Autowired
    public InputSanitizer(
            @Value("${planforge.input.topic-max-length:200}") int topicMaxLength,
            @Value("${planforge.input.notes-max-length:2000}") int notesMaxLength,
            @Value("${planforge.input.source-context-max-length:20000}") int sourceContextMaxLength) {
        this.topicMaxLength = topicMaxLength;
        this.notesMaxLength = notesMaxLength;
        this.sourceContextMaxLength = sourceContextMaxLength;
    }

    public InputSanitizer() {
        this(DEFAULT_TOPIC_MAX_LENGTH, DEFAULT_NOTES_MAX_LENGTH, DEFAULT_SOURCE_CONTEXT_MAX_LENGTH);
    }

    public SanitizedInput sanitize(GenerationRequest request) {
        if (request.getTopic() == null || request.getTopic().isBlank()) {
            throw new IllegalArgumentException("Topic must not be blank");
        }
        if (request.getStartDate() != null && request.getDeadlineDate() != null
                && request.getDeadlineDate().isBefore(request.getStartDate())) {
            throw new IllegalArgumentException("Deadline must not be before the start date");
        }

        TruncatedText topic = TruncatedText.of(request.getTopic(), topicMaxLength);
        TruncatedText notes = TruncatedText.ofOptional(request.getNotes(), notesMaxLength);
        TruncatedText sourceContext = TruncatedText.ofOptional(request.getSourceContext(), sourceContextMaxLength);
        String sourceDigest = sourceContext.value() != null ? HashUtils.sha256Hex(request.getSourceContext().trim()) : null;

        int weeklyHours = request.getWeeklyHours() != null ? request.getWeeklyHours() : 1;
        weeklyHours = Math.max(1, Math.min(MAX_WEEKLY_HOURS, weeklyHours));

        if (topic.truncated() || notes.truncated() || sourceContext.truncated()) {
            log.info("[INPUT] Truncated oversized input | planId={} | topicLength={} | notesLength={} | sourceContextLength={}",
                request.getPlanId(), topic.originalLength(), notes.originalLength(), sourceContext.originalLength());
        }

        GenerationInput input = GenerationInput.builder()
            .topic(topic.value())
            .notes(notes.value())
            .skillLevel(request.getSkillLevel() != null ? request.getSkillLevel() : SkillLevel.BEGINNER)
            .weeklyHours(weeklyHours)
            .learningStyle(request.getLearningStyle() != null ? request.getLearningStyle() : LearningStyle.MIXED)
            .startDate(request.getStartDate())
            .deadlineDate(request.getDeadlineDate())
            .sourceContext(sourceContext.value())
            .build();

        return SanitizedInput.builder()
            .generationInput(input)
            .topic(topic)
            .notes(notes)
            .sourceContext(sourceContext)
            .sourceContextDigest(sourceDigest)
            .build();
    }

    /**
     * Deterministic hash of everything that shapes the prompt. Same plan, user and sanitized fields give the
     * same hash on every run.
     */
    public String promptHash(UUID planId, UUID userId, SanitizedInput sanitized) {
        GenerationInput input = sanitized.getGenerationInput();
        Map<String, Object> payload = new HashMap<>();
        payload.put("planId", planId.toString());
        payload.put("userId", userId.toString());
        payload.put("topic", input.getTopic());
        payload.put("notes", input.getNotes());
        payload.put("skillLevel", input.getSkillLevel().getValue());
        payload.put("weeklyHours", input.getWeeklyHours());
        payload.put("learningStyle", input.getLearningStyle().getValue());
        payload.put("startDate", input.getStartDate() != null ? input.getStartDate().toString() : null);
        payload.put("deadlineDate", input.getDeadlineDate() != null ? input.getDeadlineDate().toString() : null);
        payload.put("sourceContextDigest", sanitized.getSourceContextDigest());
        return HashUtils.stableHash(payload);
    }
}
