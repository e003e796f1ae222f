package com.aiv.organizer.core.task;

/**
 * Number of instance folders found for one defect type of one camera.
 */
public record NgCountRow(String cameraName, String defectName, int instanceCount) {
}
