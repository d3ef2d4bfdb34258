package com.fragmentdl.services;

import com.fragmentdl.exceptions.DiskIOException;
import com.fragmentdl.exceptions.MergeIntegrityException;
import com.fragmentdl.models.Fragment;
import com.fragmentdl.models.FragmentState;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Comparator;
import java.util.List;

/**
 * Concatenates completed fragment stores, in index order, into the destination file.
 */
@Slf4j
public class FragmentMerger {

    /**
     * Merges the plan into {@code destination} and removes the fragment stores.
     * <p>
     * The concatenation goes to a staging file next to the destination and is moved into place only
     * after its size matched {@code expectedBytes}. On a mismatch the staging file is deleted and the
     * fragment stores are kept for inspection.
     *
     * @return bytes written to the destination
     */
    public long merge(List<Fragment> plan, Path destination, long expectedBytes)
            throws MergeIntegrityException, DiskIOException {
        for (Fragment fragment : plan) {
            if (fragment.getState() != FragmentState.COMPLETED) {
                throw new IllegalStateException("Cannot merge before every fragment completed: " + fragment);
            }
        }
        List<Fragment> ordered = plan.stream().sorted(Comparator.comparingInt(Fragment::getIndex)).toList();
        Path staging = destination.resolveSibling(destination.getFileName() + ".merging");

        long written = 0;
        try (FileChannel out = FileChannel.open(staging, StandardOpenOption.CREATE,
                StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            for (Fragment fragment : ordered) {
                written += append(fragment.getStorePath(), out);
            }
            out.force(true);
        } catch (IOException e) {
            deleteQuietly(staging);
            throw new DiskIOException("Failed to merge fragments into " + destination + ": " + e.getMessage(), e);
        }

        if (written != expectedBytes) {
            log.error("Merge of {} wrote {} bytes, expected {}. Keeping fragment stores", destination, written, expectedBytes);
            deleteQuietly(staging);
            throw new MergeIntegrityException(expectedBytes, written);
        }

        try {
            moveIntoPlace(staging, destination);
        } catch (IOException e) {
            deleteQuietly(staging);
            throw new DiskIOException("Cannot move merged file to " + destination + ": " + e.getMessage(), e);
        }
        log.info("Merged {} fragments into {} ({} bytes)", ordered.size(), destination, written);
        discard(plan);
        return written;
    }

    /**
     * Deletes the stores of a plan. Failures are logged and do not stop the remaining deletions.
     */
    public void discard(List<Fragment> plan) {
        for (Fragment fragment : plan) {
            deleteQuietly(fragment.getStorePath());
        }
    }

    private static long append(Path store, FileChannel out) throws IOException {
        try (FileChannel in = FileChannel.open(store, StandardOpenOption.READ)) {
            long size = in.size();
            long position = 0;
            while (position < size) {
                long transferred = in.transferTo(position, size - position, out);
                if (transferred <= 0) {
                    break;
                }
                position += transferred;
            }
            return position;
        }
    }

    private static void moveIntoPlace(Path staging, Path destination) throws IOException {
        try {
            Files.move(staging, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move unsupported for {}, falling back to plain move", destination);
            Files.move(staging, destination, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to cleanup temp file: {}", path, e);
        }
    }
}
