package com.aiv.organizer.core.procedure;

import com.aiv.organizer.core.fs.FolderScanner;
import com.aiv.organizer.core.fs.IgnoredFolders;
import com.aiv.organizer.core.task.NgCountReport;
import com.aiv.organizer.core.task.NgCountRow;
import com.aiv.organizer.core.task.ProgressState;
import com.aiv.organizer.core.task.TaskContext;
import com.aiv.organizer.core.task.TaskDescriptor.NgCountTask;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Counts defect instances below an NG root: camera folders named {@code Cam_<n>} hold one folder
 * per defect type, which holds one folder per instance. The folders next to the NG root,
 * classification folders excluded, give the inspected sample count.
 */
public final class NgCount implements Procedure<NgCountTask> {
    static final String CAMERA_PREFIX = "Cam_";

    @Override
    public ProcedureOutcome run(NgCountTask task, TaskContext context) {
        FolderScanner scanner = context.scanner();
        Path ngFolder = task.ngFolder();
        int inspected = inspectedFolderCount(scanner, ngFolder);

        List<String> cameras = new ArrayList<>();
        for (String name : scanner.listImmediateSubfolders(ngFolder, Set.of())) {
            if (name.startsWith(CAMERA_PREFIX)) {
                cameras.add(name);
            }
        }
        if (cameras.isEmpty()) {
            context.events().ngCount(new NgCountReport(List.of(), inspected));
            return Summaries.nothingToDo(context, "No folder starting with '" + CAMERA_PREFIX + "' in " + ngFolder + ".");
        }

        context.markRunning();
        ProgressState progress = ProgressState.of(cameras.size());
        List<NgCountRow> rows = new ArrayList<>();
        int defects = 0;
        for (String camera : cameras) {
            if (context.isCancelled()) {
                return Summaries.stopped(context, "Cameras: " + progress.processed() + ", defects: " + defects);
            }
            Path cameraFolder = ngFolder.resolve(camera);
            for (String defect : scanner.listImmediateSubfolders(cameraFolder, Set.of())) {
                int instances = scanner.listImmediateSubfolders(cameraFolder.resolve(defect), Set.of()).size();
                rows.add(new NgCountRow(camera, defect, instances));
                defects += instances;
            }
            context.progress(progress.complete());
        }

        NgCountReport report = new NgCountReport(rows, inspected);
        context.events().ngCount(report);
        return Summaries.completed(context, "Cameras: " + cameras.size()
            + ", defects: " + defects
            + ", inspected folders: " + inspected);
    }

    static int inspectedFolderCount(FolderScanner scanner, Path ngFolder) {
        Path parent = ngFolder.toAbsolutePath().normalize().getParent();
        if (parent == null) {
            return 0;
        }
        return scanner.listImmediateSubfolders(parent, IgnoredFolders.CLASSIFICATION).size();
    }
}
