package com.fragmentdl.services;

import com.fragmentdl.models.DownloadJob;
import com.fragmentdl.models.Fragment;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Partitions the resource into contiguous, non-overlapping byte ranges.
 */
@Slf4j
public class FragmentPlanner {

    private final long minFragmentSize;

    public FragmentPlanner(long minFragmentSize) {
        if (minFragmentSize < 1) {
            throw new IllegalArgumentException("minFragmentSize must be >= 1");
        }
        this.minFragmentSize = minFragmentSize;
    }

    /**
     * Splits the job into {@code fragmentCount} ranges, or returns the single-stream plan when the
     * server cannot serve ranges, the size is unknown, or the resource is smaller than the minimum
     * fragment size.
     */
    public List<Fragment> plan(DownloadJob job) {
        if (!job.supportsRanges() || !job.isSizeKnown() || job.totalSize() < minFragmentSize
                || job.fragmentCount() == 1) {
            log.info("Planning single stream (ranges={}, size={}, requested fragments={})",
                    job.supportsRanges(), job.totalSize(), job.fragmentCount());
            return singleStream(job);
        }
        List<Fragment> plan = split(job.totalSize(), job.fragmentCount(), job.tempDirectory(), job.fileName());
        log.info("Planned {} fragments of ~{} bytes", plan.size(), job.totalSize() / plan.size());
        return plan;
    }

    /**
     * One fragment spanning the whole resource; its end stays open when the size is unknown.
     */
    public List<Fragment> singleStream(DownloadJob job) {
        long end = job.isSizeKnown() ? job.totalSize() : Fragment.UNKNOWN_END;
        return List.of(new Fragment(0, 0, end, job.tempDirectory().resolve(job.fileName() + ".stream")));
    }

    static List<Fragment> split(long totalSize, int count, Path tempDirectory, String fileName) {
        if (totalSize < 1) throw new IllegalArgumentException("totalSize must be positive");
        if (count < 1) throw new IllegalArgumentException("count must be >= 1");
        long size = totalSize / count;
        List<Fragment> fragments = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            long start = i * size;
            long end = i == count - 1 ? totalSize : start + size;
            fragments.add(new Fragment(i, start, end, tempDirectory.resolve(fileName + ".part" + i)));
        }
        return fragments;
    }
}
