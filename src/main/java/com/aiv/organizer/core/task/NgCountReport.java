package com.aiv.organizer.core.task;

import java.util.List;

/**
 * Result table of an NG count together with the number of inspected sample folders next to the
 * NG root.
 */
public record NgCountReport(List<NgCountRow> rows, int inspectedFolderCount) {
    public NgCountReport {
        rows = List.copyOf(rows);
    }

    public int totalDefects() {
        return rows.stream().mapToInt(NgCountRow::instanceCount).sum();
    }

    public long cameraCount() {
        return rows.stream().map(NgCountRow::cameraName).distinct().count();
    }
}
