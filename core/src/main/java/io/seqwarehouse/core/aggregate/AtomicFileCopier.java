package io.seqwarehouse.core.aggregate;

import io.seqwarehouse.core.model.FileCopy;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies single files so that the destination never holds a partial file: the content is written
 * to the sibling {@code .<name>.part} and renamed into place. A destination with the same size and
 * modification time as the source is left alone.
 */
final class AtomicFileCopier {

    private static final Logger LOG = LoggerFactory.getLogger(AtomicFileCopier.class);

    FileCopy copy(Path source, Path destination) {
        Path temp = null;
        try {
            FileTime sourceTime = Files.getLastModifiedTime(source);
            if (isSame(source, sourceTime, destination)) {
                LOG.debug("Already present: {}", destination);
                return FileCopy.alreadyPresent(source, destination);
            }
            Path folder = destination.getParent();
            Files.createDirectories(folder);
            temp = partFileFor(destination);
            Files.copy(source, temp, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            Files.setLastModifiedTime(temp, sourceTime);
            moveIntoPlace(temp, destination);
            LOG.debug("Copied {} -> {}", source, destination);
            return FileCopy.copied(source, destination);
        } catch (IOException e) {
            String error = e.getClass().getSimpleName() + ": " + e.getMessage();
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    error += " (temporary file " + temp + " left behind: " + cleanup.getMessage() + ")";
                }
            }
            LOG.warn("Failed to copy {} -> {}: {}", source, destination, error);
            return FileCopy.failed(source, destination, error);
        }
    }

    /** The fixed temporary sibling {@code .<name>.part}; a copy left over by an interrupted run is overwritten. */
    static Path partFileFor(Path destination) {
        return destination.resolveSibling("." + destination.getFileName() + ".part");
    }

    private static boolean isSame(Path source, FileTime sourceTime, Path destination) throws IOException {
        if (!Files.isRegularFile(destination)) {
            return false;
        }
        return Files.size(source) == Files.size(destination)
                && sourceTime.toMillis() == Files.getLastModifiedTime(destination).toMillis();
    }

    private static void moveIntoPlace(Path temp, Path destination) throws IOException {
        try {
            Files.move(temp, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move unsupported in {}, falling back to replace", destination.getParent());
            Files.move(temp, destination, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
