package com.planforge.core.input;

import com.planforge.common.constants.LearningStyle;
import com.planforge.common.constants.SkillLevel;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Raw generation request as received from the caller, before sanitization.
 */
@Value
@Builder(toBuilder = true)
public class GenerationRequest {
    UUID planId;
    UUID userId;
    String topic;
    String notes;
    SkillLevel skillLevel;
    Integer weeklyHours;
    LearningStyle learningStyle;
    LocalDate startDate;
    LocalDate deadlineDate;
    String sourceContext;
}
