package com.planforge.llm.prompt;

import com.planforge.llm.model.GenerationInput;

public final class PlanGenerationPrompts {

    public static final String SYSTEM_PROMPT = """
        You are an expert curriculum designer who builds structured, realistic self-study plans.

        OUTPUT RULES:
        1. Respond with a single JSON object and nothing else. No markdown fences, no commentary.
        2. The object has exactly one top-level key, "modules", holding an ordered array.
        3. Each module has:
           - "title": short, specific, non-empty
           - "description": one or two sentences
           - "estimated_minutes": integer total effort for the module
           - "tasks": ordered array of 1 to 20 tasks
        4. Each task has:
           - "title": an actionable step, non-empty
           - "description": what to do and what "done" looks like
           - "estimated_minutes": integer between 5 and 480
        5. Produce between 3 and 12 modules, ordered from fundamentals to advanced material.
        6. Size the total effort so it fits the learner's weekly hours and deadline when one is given.
        7. Favour the requested learning style when choosing activities.
        """;

    private PlanGenerationPrompts() {}

    public static String buildUserPrompt(GenerationInput input) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Create a learning plan.\n\n");
        prompt.append("Topic: ").append(input.getTopic()).append("\n");
        prompt.append("Skill level: ").append(input.getSkillLevel().getValue()).append("\n");
        prompt.append("Weekly hours available: ").append(input.getWeeklyHours()).append("\n");
        prompt.append("Learning style: ").append(input.getLearningStyle().getValue())
            .append(" (prefer ").append(input.getLearningStyle().getPromptHint()).append(")\n");

        if (input.getStartDate() != null) {
            prompt.append("Start date: ").append(input.getStartDate()).append("\n");
        }
        if (input.getDeadlineDate() != null) {
            prompt.append("Deadline: ").append(input.getDeadlineDate()).append("\n");
        }
        if (input.getNotes() != null && !input.getNotes().isBlank()) {
            prompt.append("\nLearner notes:\n").append(input.getNotes()).append("\n");
        }
        if (input.getSourceContext() != null && !input.getSourceContext().isBlank()) {
            prompt.append("\nSource material supplied by the learner (base the curriculum on it):\n")
                .append("---\n")
                .append(input.getSourceContext())
                .append("\n---\n");
        }

        prompt.append("\nReturn only the JSON object.");
        return prompt.toString();
    }
}
