package com.planforge.common.concurrent;

public enum CancellationReason {
    /** The caller went away (client disconnect or explicit abort). */
    CLIENT,
    /** The attempt deadline elapsed. */
    TIMEOUT
}
