package com.postflow.guardrail.impl;

import com.postflow.guardrail.LiveState;
import com.postflow.rule.GuardrailType;

import java.time.Duration;
import java.util.Optional;

/**
 * Blocks while a volume has less free space than required.
 * Without a path the default media volume is checked.
 */
public class MinFreeSpaceGuardrail extends AbstractGuardrail {

    private final double minFreeGb;
    private final String path;

    public MinFreeSpaceGuardrail(double minFreeGb, String path, Duration retryDelay, Duration unavailableDelay) {
        super(GuardrailType.MIN_FREE_SPACE_GB, retryDelay, unavailableDelay);
        this.minFreeGb = minFreeGb;
        this.path = path;
    }

    @Override
    protected Optional<Boolean> isBlocked(LiveState state) {
        return state.freeSpaceGb(path).map(free -> free < minFreeGb);
    }

    @Override
    protected String reason() {
        return "low_disk_space";
    }
}
