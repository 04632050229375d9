package com.postflow.rule;

import java.util.List;

import static com.postflow.rule.ParamSpec.optional;
import static com.postflow.rule.ParamSpec.optionalEnum;
import static com.postflow.rule.ParamSpec.required;
import static com.postflow.rule.ParamSpec.requiredEnum;

/**
 * Registered action types. Opaque to the engine beyond parameter validation;
 * they are handed to the executor as-is.
 */
public enum ActionType implements RegisteredType {
    FFMPEG_REMUX("ffmpeg_remux", List.of(
            optionalEnum("container", "mp4", "mov", "mkv"),
            optional("faststart", ParamKind.BOOLEAN))),
    MOVE("move", List.of(required("target", ParamKind.STRING))),
    COPY("copy", List.of(required("target", ParamKind.STRING))),
    INDEX_ASSET("index_asset", List.of()),
    THUMBS("thumbs", List.of(
            optional("count", ParamKind.NUMBER),
            optional("interval_sec", ParamKind.NUMBER))),
    PROXY("proxy", List.of(
            optionalEnum("codec", "dnxhr_lb", "prores_proxy", "h264"),
            optional("min_duration_sec", ParamKind.NUMBER))),
    TRANSCODE_PRESET("transcode_preset", List.of(required("preset", ParamKind.STRING))),
    TAG("tag", List.of(required("tags", ParamKind.STRING_ARRAY))),
    OVERLAY_UPDATE("overlay_update", List.of(
            required("overlay_id", ParamKind.STRING),
            optional("visible", ParamKind.BOOLEAN))),
    ARCHIVE("archive", List.of(
            required("target", ParamKind.STRING),
            optional("delete_source", ParamKind.BOOLEAN))),
    NOTIFY("notify", List.of(
            requiredEnum("channel", "discord", "email", "webhook", "twitter"),
            optional("message", ParamKind.STRING)));

    private final String wireName;
    private final List<ParamSpec> params;

    ActionType(String wireName, List<ParamSpec> params) {
        this.wireName = wireName;
        this.params = params;
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
