package com.aiv.organizer.core.task;

import com.aiv.organizer.core.image.CropBox;
import com.aiv.organizer.core.image.ImageTransform;
import com.aiv.organizer.core.match.FormatSelection;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * Immutable parameters of one operation. Each record carries exactly the fields its operation
 * reads; collections are copied on construction.
 */
public sealed interface TaskDescriptor permits
    TaskDescriptor.NgSortingTask,
    TaskDescriptor.DateCopyTask,
    TaskDescriptor.ImageCopyTask,
    TaskDescriptor.SimulationFolderingTask,
    TaskDescriptor.NgCountTask,
    TaskDescriptor.BasicSortingTask,
    TaskDescriptor.CropTask,
    TaskDescriptor.AttachFovTask,
    TaskDescriptor.MimToBmpTask,
    TaskDescriptor.BmpToJpgTask,
    TaskDescriptor.ImageTransformTask {

    OperationKind kind();

    /**
     * Copies eligible files of {@code source2/<id>} into {@code target/<id>} for every identifier
     * that is both a basename of {@code sources1} and a subfolder of {@code source2}.
     */
    record NgSortingTask(List<Path> sources1, Path source2, Path target, FormatSelection formats)
        implements TaskDescriptor {
        public NgSortingTask {
            sources1 = List.copyOf(sources1);
            Objects.requireNonNull(source2, "source2");
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(formats, "formats");
        }

        @Override
        public OperationKind kind() {
            return OperationKind.NG_SORTING;
        }
    }

    /**
     * Copies recently modified sample folders, or selected FOV images out of them.
     *
     * @param fovNumbers FOV numbers to pick in {@link Mode#IMAGE}; ignored in folder mode
     * @param randomCount folders skipped between picks under {@link SelectionPolicy#CONDITIONAL_RANDOM}
     */
    record DateCopyTask(Mode mode,
                        Path source,
                        Path target,
                        int count,
                        FormatSelection formats,
                        LocalDateTime since,
                        SelectionPolicy policy,
                        int randomCount,
                        Set<String> fovNumbers,
                        Random random) implements TaskDescriptor {
        public enum Mode {
            FOLDER,
            IMAGE
        }

        public enum SelectionPolicy {
            FIRST,
            STRONG_RANDOM,
            CONDITIONAL_RANDOM;

            /**
             * Index step between conditional picks. Folder mode skips {@code randomCount} folders
             * between picks, image mode steps by {@code randomCount} itself and never by less than 1.
             */
            public static int strideFor(Mode mode, int randomCount) {
                int n = Math.max(0, randomCount);
                return mode == Mode.FOLDER ? n + 1 : Math.max(1, n);
            }
        }

        public DateCopyTask {
            Objects.requireNonNull(mode, "mode");
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(formats, "formats");
            Objects.requireNonNull(since, "since");
            Objects.requireNonNull(policy, "policy");
            fovNumbers = fovNumbers == null ? Set.of() : Set.copyOf(fovNumbers);
            random = random == null ? new Random() : random;
            if (count < 0) {
                throw new IllegalArgumentException("count must not be negative: " + count);
            }
        }

        @Override
        public OperationKind kind() {
            return OperationKind.DATE_COPY;
        }
    }

    /** Copies eligible files of {@code sources.get(i)} into {@code targets.get(i)}. */
    record ImageCopyTask(List<Path> sources, List<Path> targets, FormatSelection formats)
        implements TaskDescriptor {
        public ImageCopyTask {
            sources = List.copyOf(sources);
            targets = List.copyOf(targets);
            Objects.requireNonNull(formats, "formats");
        }

        @Override
        public OperationKind kind() {
            return OperationKind.IMAGE_COPY;
        }
    }

    record SimulationFolderingTask() implements TaskDescriptor {
        @Override
        public OperationKind kind() {
            return OperationKind.SIMULATION_FOLDERING;
        }
    }

    record NgCountTask(Path ngFolder) implements TaskDescriptor {
        public NgCountTask {
            Objects.requireNonNull(ngFolder, "ngFolder");
        }

        @Override
        public OperationKind kind() {
            return OperationKind.NG_COUNT;
        }
    }

    /**
     * Gathers the files of inner-ID folders into {@code target} with the folder name as prefix.
     *
     * @param innerIdListPath folder whose subfolders name the inner IDs, or null
     * @param doublePath when set, {@code innerIdListPath} holds code folders that contain the inner-ID folders
     * @param innerId single inner ID used when no list path is given, or null
     * @param fovExpression FOV range expression restricting the copied files, or null for all files
     */
    record BasicSortingTask(Path source,
                            Path target,
                            Path innerIdListPath,
                            boolean doublePath,
                            String innerId,
                            String fovExpression,
                            FormatSelection formats) implements TaskDescriptor {
        public BasicSortingTask {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(formats, "formats");
        }

        @Override
        public OperationKind kind() {
            return OperationKind.BASIC_SORTING;
        }
    }

    /**
     * @param debugOverlay folder for annotation overlay images, or null for none
     */
    record CropTask(Path source,
                    Path target,
                    FormatSelection formats,
                    CropBox box,
                    String fovExpression,
                    Path debugOverlay) implements TaskDescriptor {
        public CropTask {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(formats, "formats");
            Objects.requireNonNull(box, "box");
        }

        @Override
        public OperationKind kind() {
            return OperationKind.CROP;
        }
    }

    record AttachFovTask(Path search1, Path search2, Path target, String fovExpression) implements TaskDescriptor {
        public AttachFovTask {
            Objects.requireNonNull(search1, "search1");
            Objects.requireNonNull(search2, "search2");
            Objects.requireNonNull(target, "target");
        }

        @Override
        public OperationKind kind() {
            return OperationKind.ATTACH_FOV;
        }
    }

    record MimToBmpTask(Path source, Path target) implements TaskDescriptor {
        @Override
        public OperationKind kind() {
            return OperationKind.MIM_TO_BMP;
        }
    }

    /**
     * @param target output root, or null for a {@code _JPG} sibling of {@code source}
     */
    record BmpToJpgTask(Path source, Path target) implements TaskDescriptor {
        public static final String DEFAULT_TARGET_SUFFIX = "_JPG";

        public BmpToJpgTask {
            Objects.requireNonNull(source, "source");
        }

        public Path resolvedTarget() {
            if (target != null) {
                return target;
            }
            Path absolute = source.toAbsolutePath().normalize();
            Path name = absolute.getFileName();
            return name == null ? absolute.resolve("JPG") : absolute.resolveSibling(name + DEFAULT_TARGET_SUFFIX);
        }

        @Override
        public OperationKind kind() {
            return OperationKind.BTJ;
        }
    }

    /** Resize, flip or rotate every eligible file directly under {@code source}. */
    record ImageTransformTask(Path source, Path target, FormatSelection formats, ImageTransform transform)
        implements TaskDescriptor {
        public ImageTransformTask {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(formats, "formats");
            Objects.requireNonNull(transform, "transform");
            if (transform instanceof ImageTransform.ToJpeg) {
                throw new IllegalArgumentException("BMP to JPG conversion runs as its own operation");
            }
        }

        @Override
        public OperationKind kind() {
            if (transform instanceof ImageTransform.Resize) {
                return OperationKind.RESIZE;
            }
            if (transform instanceof ImageTransform.Flip) {
                return OperationKind.FLIP;
            }
            return OperationKind.ROTATE;
        }
    }
}
