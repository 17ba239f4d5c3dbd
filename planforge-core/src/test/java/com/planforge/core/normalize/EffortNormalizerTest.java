package com.planforge.core.normalize;

import com.planforge.llm.parser.ParsedModule;
import com.planforge.llm.parser.ParsedTask;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EffortNormalizerTest {

    private final EffortNormalizer normalizer = new EffortNormalizer();

    @Test
    void valuesInsideBoundsAreOnlyRounded() {
        NormalizedCurriculum curriculum = normalizer.normalize(List.of(module(90.4, 29.6)));

        NormalizedModule module = curriculum.getModules().get(0);
        assertThat(module.getEstimatedMinutes()).isEqualTo(90);
        assertThat(module.getTasks().get(0).getEstimatedMinutes()).isEqualTo(30);
        assertThat(curriculum.isClamped()).isFalse();
    }

    @Test
    void outOfRangeValuesAreClampedAndFlagged() {
        NormalizedCurriculum curriculum = normalizer.normalize(List.of(module(1, 1_000), module(9_999, 1)));

        assertThat(curriculum.getModules())
            .extracting(NormalizedModule::getEstimatedMinutes)
            .containsExactly(EffortNormalizer.MODULE_MIN_MINUTES, EffortNormalizer.MODULE_MAX_MINUTES);
        assertThat(curriculum.getModules())
            .flatExtracting(NormalizedModule::getTasks)
            .extracting(NormalizedTask::getEstimatedMinutes)
            .containsExactly(EffortNormalizer.TASK_MAX_MINUTES, EffortNormalizer.TASK_MIN_MINUTES);
        assertThat(curriculum.isModulesClamped()).isTrue();
        assertThat(curriculum.isTasksClamped()).isTrue();
    }

    @Test
    void longTitlesAreCutToColumnWidth() {
        ParsedModule module = ParsedModule.builder()
            .title("m".repeat(700))
            .estimatedMinutes(60)
            .task(ParsedTask.builder().title("t".repeat(501)).estimatedMinutes(10).build())
            .build();

        NormalizedModule normalized = normalizer.normalize(List.of(module)).getModules().get(0);

        assertThat(normalized.getTitle()).hasSize(EffortNormalizer.MAX_TITLE_LENGTH);
        assertThat(normalized.getTasks().get(0).getTitle()).hasSize(EffortNormalizer.MAX_TITLE_LENGTH);
    }

    @Test
    void countsCoverAllModulesAndTasks() {
        NormalizedCurriculum curriculum = normalizer.normalize(List.of(module(60, 10), module(60, 10)));

        assertThat(curriculum.getModuleCount()).isEqualTo(2);
        assertThat(curriculum.getTaskCount()).isEqualTo(2);
    }

    private static ParsedModule module(double moduleMinutes, double taskMinutes) {
        return ParsedModule.builder()
            .title("Module")
            .estimatedMinutes(moduleMinutes)
            .task(ParsedTask.builder().title("Task").estimatedMinutes(taskMinutes).build())
            .build();
    }
}
