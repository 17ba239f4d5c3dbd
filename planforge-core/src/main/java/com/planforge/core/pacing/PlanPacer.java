package com.planforge.core.pacing;

import com.planforge.common.constants.SkillLevel;
import com.planforge.llm.model.GenerationInput;
import com.planforge.llm.parser.ParsedModule;
import com.planforge.llm.parser.ParsedTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Fits a curriculum into the learner's available time before a deadline.
 *
 * Capacity is a task count: weekly hours over the whole window divided by an average task length that depends
 * on skill level. Trimming keeps the first task of every module before spending the rest of the capacity in
 * module/task order, so no module is emptied while later ones keep extras.
 */
@Component
@Slf4j
public class PlanPacer {

    static final int BASE_TASK_MINUTES = 45;
    static final int SKILL_ADJUSTMENT_MINUTES = 10;
    static final int MIN_TASK_MINUTES = 20;
    static final int MAX_TASK_MINUTES = 90;

    public int averageTaskMinutes(SkillLevel skillLevel) {
        int minutes = BASE_TASK_MINUTES;
        if (skillLevel == SkillLevel.BEGINNER) {
            minutes += SKILL_ADJUSTMENT_MINUTES;
        } else if (skillLevel == SkillLevel.ADVANCED) {
            minutes -= SKILL_ADJUSTMENT_MINUTES;
        }
        return Math.max(MIN_TASK_MINUTES, Math.min(MAX_TASK_MINUTES, minutes));
    }

    /**
     * Number of tasks that fit between start and deadline; -1 when there is no deadline.
     */
    public int computeCapacity(GenerationInput input, LocalDate today) {
        if (input.getDeadlineDate() == null) {
            return -1;
        }
        LocalDate start = input.getStartDate() != null ? input.getStartDate() : today;
        long days = Math.max(0, ChronoUnit.DAYS.between(start, input.getDeadlineDate()));
        long weeks = Math.max(1, (days + 6) / 7);
        long availableMinutes = (long) input.getWeeklyHours() * weeks * 60;
        return (int) Math.min(Integer.MAX_VALUE, availableMinutes / averageTaskMinutes(input.getSkillLevel()));
    }

    public List<ParsedModule> trimToCapacity(List<ParsedModule> modules, GenerationInput input, LocalDate today) {
        int capacity = computeCapacity(input, today);
        if (capacity < 0) {
            return modules;
        }
        int totalTasks = modules.stream().mapToInt(module -> module.getTasks().size()).sum();
        if (totalTasks <= capacity) {
            return modules;
        }
        // Every module keeps at least its first task, even when capacity is smaller than the module count
        int budget = Math.max(capacity, modules.size());

        int[] keep = new int[modules.size()];
        int used = 0;
        for (int i = 0; i < modules.size(); i++) {
            keep[i] = 1;
            used++;
        }
        for (int i = 0; i < modules.size() && used < budget; i++) {
            int extra = Math.min(modules.get(i).getTasks().size() - keep[i], budget - used);
            keep[i] += extra;
            used += extra;
        }

        List<ParsedModule> trimmed = new ArrayList<>();
        for (int i = 0; i < modules.size(); i++) {
            ParsedModule module = modules.get(i);
            List<ParsedTask> tasks = module.getTasks().subList(0, keep[i]);
            trimmed.add(module.toBuilder().clearTasks().tasks(tasks).build());
        }

        log.info("[PACING] Trimmed curriculum to capacity | capacity={} | tasksBefore={} | tasksAfter={} | modulesBefore={} | modulesAfter={}",
            capacity, totalTasks, used, modules.size(), trimmed.size());
        return trimmed;
    }
}
