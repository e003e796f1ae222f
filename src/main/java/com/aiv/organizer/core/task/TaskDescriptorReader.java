package com.aiv.organizer.core.task;

import com.aiv.organizer.core.image.CropBox;
import com.aiv.organizer.core.image.ImageTransform;
import com.aiv.organizer.core.match.FormatSelection;
import com.aiv.organizer.core.match.FovRangeParser;
import com.aiv.organizer.core.task.TaskDescriptor.DateCopyTask;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Set;

/**
 * Reads a task file: a JSON object whose {@code operation} field selects the descriptor and whose
 * other fields carry its parameters, e.g.
 * <pre>{"operation": "crop", "source": "D:/in", "target": "D:/out",
 *  "formats": [".bmp"], "crop_area": "0,0,512,512"}</pre>
 */
public final class TaskDescriptorReader {
    static final String OPERATION = "operation";

    private TaskDescriptorReader() {
    }

    public static TaskDescriptor read(Path file) throws TaskDescriptorException {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TaskDescriptorException("Cannot read task file " + file + ": " + e.getMessage(), null, e);
        }
        return parse(content);
    }

    public static TaskDescriptor parse(String json) throws TaskDescriptorException {
        JSONObject root;
        try {
            root = new JSONObject(json);
        } catch (JSONException e) {
            throw new TaskDescriptorException("Task file is not a JSON object: " + e.getMessage(), null, e);
        }
        return fromJson(root);
    }

    public static TaskDescriptor fromJson(JSONObject root) throws TaskDescriptorException {
        String tag = root.optString(OPERATION, "");
        OperationKind kind = OperationKind.fromTag(tag)
            .orElseThrow(() -> new TaskDescriptorException("Unknown operation '" + tag + "'", OPERATION));
        try {
            return switch (kind) {
                case NG_SORTING -> new TaskDescriptor.NgSortingTask(
                    paths(root, "inputs"),
                    requiredPath(root, "source2"),
                    requiredPath(root, "target"),
                    formats(root));
                case DATE_COPY -> dateCopy(root);
                case IMAGE_COPY -> new TaskDescriptor.ImageCopyTask(
                    paths(root, "sources"),
                    paths(root, "targets"),
                    formats(root));
                case SIMULATION_FOLDERING -> new TaskDescriptor.SimulationFolderingTask();
                case NG_COUNT -> new TaskDescriptor.NgCountTask(requiredPath(root, "ng_folder"));
                case BASIC_SORTING -> new TaskDescriptor.BasicSortingTask(
                    requiredPath(root, "source"),
                    requiredPath(root, "target"),
                    optionalPath(root, "inner_id_list"),
                    root.optBoolean("double_path", false),
                    root.optBoolean("use_inner_id", false) ? optionalText(root, "inner_id") : null,
                    optionalText(root, "fov_number"),
                    formats(root));
                case CROP -> new TaskDescriptor.CropTask(
                    requiredPath(root, "source"),
                    requiredPath(root, "target"),
                    formats(root),
                    cropBox(root),
                    optionalText(root, "fov_number"),
                    optionalPath(root, "debug_folder"));
                case ATTACH_FOV -> new TaskDescriptor.AttachFovTask(
                    requiredPath(root, "search1"),
                    requiredPath(root, "search2"),
                    requiredPath(root, "target"),
                    optionalText(root, "fov_number"));
                case MIM_TO_BMP -> new TaskDescriptor.MimToBmpTask(
                    optionalPath(root, "source"),
                    optionalPath(root, "target"));
                case BTJ -> new TaskDescriptor.BmpToJpgTask(
                    requiredPath(root, "source"),
                    optionalPath(root, "target"));
                case RESIZE, FLIP, ROTATE -> new TaskDescriptor.ImageTransformTask(
                    requiredPath(root, "source"),
                    requiredPath(root, "target"),
                    formats(root),
                    transform(kind, root));
            };
        } catch (JSONException | IllegalArgumentException e) {
            throw new TaskDescriptorException("Malformed task file: " + e.getMessage(), null, e);
        }
    }

    private static DateCopyTask dateCopy(JSONObject root) throws TaskDescriptorException {
        String modeText = root.optString("mode", "folder").trim().toLowerCase(Locale.ROOT);
        DateCopyTask.Mode mode = switch (modeText) {
            case "folder" -> DateCopyTask.Mode.FOLDER;
            case "image" -> DateCopyTask.Mode.IMAGE;
            default -> throw new TaskDescriptorException("Mode must be 'folder' or 'image': " + modeText, "mode");
        };

        boolean strong = root.optBoolean("strong_random", false);
        boolean conditional = root.optBoolean("conditional_random", false);
        if (strong && conditional) {
            throw new TaskDescriptorException("Choose either strong_random or conditional_random", "conditional_random");
        }
        DateCopyTask.SelectionPolicy policy = strong ? DateCopyTask.SelectionPolicy.STRONG_RANDOM
            : conditional ? DateCopyTask.SelectionPolicy.CONDITIONAL_RANDOM
            : DateCopyTask.SelectionPolicy.FIRST;

        LocalDateTime since;
        try {
            since = LocalDateTime.of(
                requiredInt(root, "year"), requiredInt(root, "month"), requiredInt(root, "day"),
                root.optInt("hour", 0), root.optInt("minute", 0), root.optInt("second", 0));
        } catch (DateTimeException e) {
            throw new TaskDescriptorException("Invalid date: " + e.getMessage(), "year", e);
        }

        Random random = root.has("random_seed") ? new Random(root.getLong("random_seed")) : new Random();
        return new DateCopyTask(
            mode,
            requiredPath(root, "source"),
            requiredPath(root, "target"),
            requiredInt(root, "count"),
            formats(root),
            since,
            policy,
            root.optInt("random_count", 0),
            fovNumbers(root),
            random);
    }

    /** {@code fov_numbers} as a list of numbers or as a range expression such as {@code "1,3,5/7"}. */
    private static Set<String> fovNumbers(JSONObject root) {
        Object value = root.opt("fov_numbers");
        if (value instanceof JSONArray array) {
            Set<String> numbers = new LinkedHashSet<>();
            for (int i = 0; i < array.length(); i++) {
                String number = String.valueOf(array.get(i)).trim();
                if (!number.isEmpty()) {
                    numbers.add(number);
                }
            }
            return numbers;
        }
        if (value instanceof String text) {
            return FovRangeParser.parse(text).fovNumbers();
        }
        return Set.of();
    }

    private static ImageTransform transform(OperationKind kind, JSONObject root) throws TaskDescriptorException {
        try {
            return switch (kind) {
                case RESIZE -> ImageTransform.Resize.parse(requiredText(root, "resize_dimensions"));
                case FLIP -> new ImageTransform.Flip(flipDirection(requiredText(root, "flip_direction")));
                default -> new ImageTransform.Rotate(rotateAngle(root));
            };
        } catch (IllegalArgumentException e) {
            throw new TaskDescriptorException(e.getMessage(), kind.tag(), e);
        }
    }

    private static ImageTransform.Flip.Direction flipDirection(String text) throws TaskDescriptorException {
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "horizontal" -> ImageTransform.Flip.Direction.HORIZONTAL;
            case "vertical" -> ImageTransform.Flip.Direction.VERTICAL;
            default -> throw new TaskDescriptorException("Flip direction must be horizontal or vertical: " + text,
                "flip_direction");
        };
    }

    private static double rotateAngle(JSONObject root) throws TaskDescriptorException {
        String text = requiredText(root, "rotate_angle");
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            throw new TaskDescriptorException("Rotate angle is not a number: " + text, "rotate_angle", e);
        }
    }

    private static CropBox cropBox(JSONObject root) throws TaskDescriptorException {
        try {
            return CropBox.parse(requiredText(root, "crop_area"));
        } catch (IllegalArgumentException e) {
            throw new TaskDescriptorException(e.getMessage(), "crop_area", e);
        }
    }

    private static FormatSelection formats(JSONObject root) {
        JSONArray array = root.optJSONArray("formats");
        if (array == null) {
            return FormatSelection.none();
        }
        List<String> tokens = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            tokens.add(array.optString(i, ""));
        }
        return FormatSelection.of(tokens);
    }

    private static List<Path> paths(JSONObject root, String key) throws TaskDescriptorException {
        Object value = root.opt(key);
        List<Path> paths = new ArrayList<>();
        if (value instanceof String text && !text.isBlank()) {
            paths.add(toPath(text.trim(), key));
        } else if (value instanceof JSONArray array) {
            for (int i = 0; i < array.length(); i++) {
                String text = array.optString(i, "").trim();
                if (!text.isEmpty()) {
                    paths.add(toPath(text, key));
                }
            }
        } else if (value != null) {
            throw new TaskDescriptorException("Field '" + key + "' must be a list of paths", key);
        }
        return paths;
    }

    private static Path requiredPath(JSONObject root, String key) throws TaskDescriptorException {
        return toPath(requiredText(root, key), key);
    }

    private static Path optionalPath(JSONObject root, String key) throws TaskDescriptorException {
        String text = optionalText(root, key);
        return text == null ? null : toPath(text, key);
    }

    private static Path toPath(String text, String key) throws TaskDescriptorException {
        try {
            return Path.of(text);
        } catch (RuntimeException e) {
            throw new TaskDescriptorException("Invalid path in '" + key + "': " + text, key, e);
        }
    }

    private static String requiredText(JSONObject root, String key) throws TaskDescriptorException {
        String text = optionalText(root, key);
        if (text == null) {
            throw new TaskDescriptorException("Missing required field '" + key + "'", key);
        }
        return text;
    }

    private static String optionalText(JSONObject root, String key) {
        Object value = root.opt(key);
        if (value == null || value == JSONObject.NULL) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }

    private static int requiredInt(JSONObject root, String key) throws TaskDescriptorException {
        if (!root.has(key)) {
            throw new TaskDescriptorException("Missing required field '" + key + "'", key);
        }
        try {
            return root.getInt(key);
        } catch (JSONException e) {
            throw new TaskDescriptorException("Field '" + key + "' must be an integer", key, e);
        }
    }
}
