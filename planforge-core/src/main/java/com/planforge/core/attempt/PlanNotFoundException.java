package com.planforge.core.attempt;

import lombok.Getter;

import java.util.UUID;

/**
 * The plan does not exist or belongs to someone else. The two cases are deliberately indistinguishable to
 * the caller.
 */
@Getter
public class PlanNotFoundException extends RuntimeException {

    private final UUID planId;

    public PlanNotFoundException(UUID planId) {
        super("Plan not found: " + planId);
        this.planId = planId;
    }
}
