package com.linlay.chatrunner.frame;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum FrameType {

    TEXT_DELTA("text-delta", Category.CONTENT),
    CODE_DELTA("code-delta", Category.CONTENT),
    SHEET_DELTA("sheet-delta", Category.CONTENT),
    IMAGE_DELTA("image-delta", Category.CONTENT),

    TOOL_START("tool-start", Category.TOOL),
    TOOL_CALL("tool-call", Category.TOOL),
    TOOL_RESULT("tool-result", Category.TOOL),
    TOOL_COMPLETE("tool-complete", Category.TOOL),
    TOOL_ERROR("tool-error", Category.TOOL),
    SUGGESTION("suggestion", Category.TOOL),

    CLEAR("clear", Category.LIFECYCLE),
    FINISH("finish", Category.LIFECYCLE),
    TITLE("title", Category.LIFECYCLE),
    ID("id", Category.LIFECYCLE),
    KIND("kind", Category.LIFECYCLE),
    MODEL_ROUTING("model-routing", Category.LIFECYCLE),

    ERROR("error", Category.TERMINAL);

    private static final Map<String, FrameType> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(FrameType::wireName, Function.identity()));

    private final String wireName;
    private final Category category;

    FrameType(String wireName, Category category) {
        this.wireName = wireName;
        this.category = category;
    }

    public String wireName() {
        return wireName;
    }

    public Category category() {
        return category;
    }

    /**
     * Whether the payload of this frame type is a JSON object rather than a plain string.
     * Structured payloads travel in the {@code data} field of the wire form.
     */
    public boolean structured() {
        return category == Category.TOOL || category == Category.TERMINAL || this == MODEL_ROUTING;
    }

    public boolean contentDelta() {
        return category == Category.CONTENT;
    }

    public static Optional<FrameType> fromWireName(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_WIRE_NAME.get(raw.trim().toLowerCase(Locale.ROOT)));
    }

    public enum Category {
        CONTENT,
        TOOL,
        LIFECYCLE,
        TERMINAL
    }
}
