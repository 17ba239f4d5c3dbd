package com.planforge.api.dto.request;

import com.planforge.common.constants.LearningStyle;
import com.planforge.common.constants.SkillLevel;
import com.planforge.core.input.GenerationRequest;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Body of a generation request. Lengths are not validated here: oversized text is truncated downstream and
 * the truncation recorded on the attempt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeneratePlanRequest {

    @NotBlank(message = "Topic is required")
    private String topic;

    private String notes;

    @NotNull(message = "Skill level is required")
    private SkillLevel skillLevel;

    @NotNull(message = "Weekly hours is required")
    @Min(value = 1, message = "Weekly hours must be at least 1")
    @Max(value = 80, message = "Weekly hours must be at most 80")
    private Integer weeklyHours;

    @NotNull(message = "Learning style is required")
    private LearningStyle learningStyle;

    private LocalDate startDate;

    private LocalDate deadlineDate;

    private String sourceContext;

    public GenerationRequest toGenerationRequest(UUID planId, UUID userId) {
        return GenerationRequest.builder()
            .planId(planId)
            .userId(userId)
            .topic(topic)
            .notes(notes)
            .skillLevel(skillLevel)
            .weeklyHours(weeklyHours)
            .learningStyle(learningStyle)
            .startDate(startDate)
            .deadlineDate(deadlineDate)
            .sourceContext(sourceContext)
            .build();
    }
}
