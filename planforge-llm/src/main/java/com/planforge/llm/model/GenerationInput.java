package com.planforge.llm.model;

import com.planforge.common.constants.LearningStyle;
import com.planforge.common.constants.SkillLevel;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Sanitized, length-bounded generation parameters. Built once per attempt from the raw request.
 */
@Value
@Builder(toBuilder = true)
public class GenerationInput {
    String topic;
    String notes;
    SkillLevel skillLevel;
    int weeklyHours;
    LearningStyle learningStyle;
    LocalDate startDate;
    LocalDate deadlineDate;
    String sourceContext;
}
