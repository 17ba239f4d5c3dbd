package com.planforge.core.normalize;

import com.planforge.llm.parser.ParsedModule;
import com.planforge.llm.parser.ParsedTask;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Rounds effort estimates to whole minutes and clamps them to sane bounds before persistence.
 * Titles are cut to the column width.
 */
@Component
public class EffortNormalizer {

    public static final int MODULE_MIN_MINUTES = 15;
    public static final int MODULE_MAX_MINUTES = 2_400;
    public static final int TASK_MIN_MINUTES = 5;
    public static final int TASK_MAX_MINUTES = 480;
    public static final int MAX_TITLE_LENGTH = 500;

    public NormalizedCurriculum normalize(List<ParsedModule> modules) {
        boolean modulesClamped = false;
        boolean tasksClamped = false;
        List<NormalizedModule> normalized = new ArrayList<>(modules.size());

        for (ParsedModule module : modules) {
            List<NormalizedTask> tasks = new ArrayList<>(module.getTasks().size());
            for (ParsedTask task : module.getTasks()) {
                long rounded = Math.round(task.getEstimatedMinutes());
                int minutes = clamp(rounded, TASK_MIN_MINUTES, TASK_MAX_MINUTES);
                tasksClamped |= minutes != rounded;
                tasks.add(NormalizedTask.builder()
                    .title(truncateTitle(task.getTitle()))
                    .description(task.getDescription())
                    .estimatedMinutes(minutes)
                    .build());
            }

            long rounded = Math.round(module.getEstimatedMinutes());
            int minutes = clamp(rounded, MODULE_MIN_MINUTES, MODULE_MAX_MINUTES);
            modulesClamped |= minutes != rounded;
            normalized.add(NormalizedModule.builder()
                .title(truncateTitle(module.getTitle()))
                .description(module.getDescription())
                .estimatedMinutes(minutes)
                .tasks(List.copyOf(tasks))
                .build());
        }

        return NormalizedCurriculum.builder()
            .modules(List.copyOf(normalized))
            .modulesClamped(modulesClamped)
            .tasksClamped(tasksClamped)
            .build();
    }

    private static int clamp(long value, int min, int max) {
        return (int) Math.max(min, Math.min(max, value));
    }

    private static String truncateTitle(String title) {
        return title.length() <= MAX_TITLE_LENGTH ? title : title.substring(0, MAX_TITLE_LENGTH);
    }
}
