package com.planforge.core.normalize;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class NormalizedCurriculum {
    List<NormalizedModule> modules;
    boolean modulesClamped;
    boolean tasksClamped;

    public int getModuleCount() {
        return modules.size();
    }

    public int getTaskCount() {
        return modules.stream().mapToInt(module -> module.getTasks().size()).sum();
    }

    public boolean isClamped() {
        return modulesClamped || tasksClamped;
    }
}
