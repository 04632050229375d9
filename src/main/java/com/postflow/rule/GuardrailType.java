package com.postflow.rule;

import java.util.ArrayList;
import java.util.List;

import static com.postflow.rule.ParamSpec.optional;
import static com.postflow.rule.ParamSpec.required;

/**
 * Registered guardrail types. Every guardrail also accepts an optional
 * {@value #RETRY_DELAY_PARAM} overriding the engine's default recheck delay.
 */
public enum GuardrailType implements RegisteredType {
    PAUSE_IF_RECORDING("pause_if_recording", List.of()),
    PAUSE_IF_STREAMING("pause_if_streaming", List.of()),
    PAUSE_IF_CPU_PCT_ABOVE("pause_if_cpu_pct_above", List.of(required("threshold", ParamKind.NUMBER))),
    PAUSE_IF_GPU_PCT_ABOVE("pause_if_gpu_pct_above", List.of(required("threshold", ParamKind.NUMBER))),
    MIN_FREE_SPACE_GB("min_free_space_gb", List.of(
            required("min_gb", ParamKind.NUMBER),
            optional("path", ParamKind.STRING))),
    MAX_CONCURRENT_JOBS("max_concurrent_jobs", List.of(required("max", ParamKind.NUMBER))),
    MAX_QUEUE_DEPTH("max_queue_depth", List.of(required("max", ParamKind.NUMBER)));

    public static final String RETRY_DELAY_PARAM = "retry_delay_sec";

    private final String wireName;
    private final List<ParamSpec> params;

    GuardrailType(String wireName, List<ParamSpec> params) {
        this.wireName = wireName;
        List<ParamSpec> all = new ArrayList<>(params);
        all.add(optional(RETRY_DELAY_PARAM, ParamKind.NUMBER));
        this.params = List.copyOf(all);
    }

    @Override
    public String wireName() {
        return wireName;
    }

    @Override
    public List<ParamSpec> params() {
        return params;
    }
}
