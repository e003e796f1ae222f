package com.aiv.organizer.core.transfer;

import com.aiv.organizer.config.ConfigService;
import com.aiv.organizer.core.match.FormatSelection;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cancellable file and folder copies. A destination is either complete or absent: a copy that
 * fails or is cancelled part-way deletes what it had written.
 */
public final class FileTransfers {
    private final CancellationToken token;
    private final int chunkBytes;
    private final Logger logger;

    public FileTransfers(CancellationToken token, Logger logger) {
        this(token, ConfigService.getInstance().getCopyChunkBytes(), logger);
    }

    public FileTransfers(CancellationToken token, int chunkBytes, Logger logger) {
        if (chunkBytes <= 0) {
            throw new IllegalArgumentException("chunkBytes must be positive: " + chunkBytes);
        }
        this.token = Objects.requireNonNull(token, "token");
        this.chunkBytes = chunkBytes;
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    /**
     * Copies {@code src} to {@code dst} chunk by chunk, overwriting {@code dst}. The stop flag is
     * checked before every chunk.
     */
    public TransferResult copyFileChunked(Path src, Path dst) {
        String item = src.toString();
        if (token.isCancelled()) {
            return TransferResult.cancelled(item);
        }
        boolean started = false;
        boolean completed = false;
        try {
            byte[] buffer = new byte[chunkBytes];
            try (InputStream in = Files.newInputStream(src);
                 OutputStream out = Files.newOutputStream(dst,
                     StandardOpenOption.CREATE,
                     StandardOpenOption.TRUNCATE_EXISTING,
                     StandardOpenOption.WRITE)) {
                started = true;
                int read;
                while ((read = in.read(buffer)) != -1) {
                    if (token.isCancelled()) {
                        break;
                    }
                    out.write(buffer, 0, read);
                }
            }
            if (token.isCancelled()) {
                return TransferResult.cancelled(item);
            }
            Files.setLastModifiedTime(dst, Files.getLastModifiedTime(src));
            completed = true;
            return TransferResult.success(item, "Copied " + src + " to " + dst);
        } catch (IOException | SecurityException e) {
            logger.log(Level.WARNING, "Copy failed: " + src + " -> " + dst, e);
            return TransferResult.error(item, "copy " + src + " -> " + dst + " failed: " + e.getMessage());
        } finally {
            if (started && !completed) {
                deletePartial(dst);
            }
        }
    }

    /**
     * Copies the files of {@code src} accepted by {@code formats} into {@code dst}, creating it
     * when absent. Not recursive. A cancellation part-way yields a cancelled result, never a
     * partial success.
     */
    public TransferResult copyFolderFiltered(Path src, Path dst, FormatSelection formats) {
        String item = src.toString();
        if (token.isCancelled()) {
            return TransferResult.cancelled(item);
        }
        try {
            Files.createDirectories(dst);
            List<Path> candidates = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(src)) {
                for (Path entry : stream) {
                    if (Files.isRegularFile(entry) && formats.accepts(entry.getFileName().toString())) {
                        candidates.add(entry);
                    }
                }
            }
            int copied = 0;
            int failed = 0;
            for (Path entry : candidates) {
                if (token.isCancelled()) {
                    return TransferResult.cancelled(item);
                }
                TransferResult result = copyFileChunked(entry, dst.resolve(entry.getFileName().toString()));
                if (result.isCancelled()) {
                    return TransferResult.cancelled(item);
                }
                if (result.isSuccess()) {
                    copied++;
                } else {
                    failed++;
                }
            }
            String message = "Copied " + copied + " file(s) from " + src + " to " + dst + " (filtered)";
            if (failed > 0) {
                message += ", " + failed + " failed";
            }
            return TransferResult.success(item, message, copied);
        } catch (IOException | SecurityException e) {
            logger.log(Level.WARNING, "Filtered folder copy failed: " + src + " -> " + dst, e);
            return TransferResult.error(item, "folder copy " + src + " -> " + dst + " failed: " + e.getMessage());
        }
    }

    private void deletePartial(Path dst) {
        try {
            Files.deleteIfExists(dst);
        } catch (IOException e) {
            logger.warning("Could not remove partial file " + dst + ": " + e.getMessage());
        }
    }
}
