package com.aiv.organizer.core.task;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of operations, with the tag used in task files and the name used in summaries.
 */
public enum OperationKind {
    NG_SORTING("ng_sorting", "NG Folder Sorting"),
    DATE_COPY("date_copy", "Date-Based Copy"),
    IMAGE_COPY("image_copy", "Image Format Copy"),
    SIMULATION_FOLDERING("simulation_foldering", "Simulation Foldering"),
    NG_COUNT("ng_count", "NG Count"),
    BASIC_SORTING("basic_sorting", "Basic Sorting"),
    CROP("crop", "Crop"),
    ATTACH_FOV("attach_fov", "Attach FOV"),
    MIM_TO_BMP("mim_to_bmp", "MIM to BMP"),
    BTJ("btj", "BMP to JPG"),
    RESIZE("resize", "Resize"),
    FLIP("flip", "Flip"),
    ROTATE("rotate", "Rotate");

    private final String tag;
    private final String displayName;

    OperationKind(String tag, String displayName) {
        this.tag = tag;
        this.displayName = displayName;
    }

    public String tag() {
        return tag;
    }

    public String displayName() {
        return displayName;
    }

    public static Optional<OperationKind> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(k -> k.tag.equals(normalized)).findFirst();
    }
}
