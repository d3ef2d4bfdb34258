package com.fragmentdl.presenters;

import com.fragmentdl.models.ProgressSnapshot;
import com.fragmentdl.models.ProgressSnapshot.FragmentProgress;
import com.fragmentdl.utils.ByteSizes;

import java.io.PrintStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Redraws the overall line and one line per fragment in place.
 */
public class InlinePresenter implements Presenter {

    private final PrintStream out;
    private final boolean ansi;
    private int lastLineCount;

    public InlinePresenter(PrintStream out, boolean ansi) {
        this.out = out;
        this.ansi = ansi;
    }

    @Override
    public Duration refreshInterval() {
        return Duration.ofSeconds(1);
    }

    @Override
    public void render(ProgressSnapshot snapshot) {
        List<String> lines = lines(snapshot);
        if (ansi && lastLineCount > 0) {
            out.print("\033[" + lastLineCount + "A");
        }
        for (String line : lines) {
            if (ansi) {
                out.print("\033[K");
                out.println(line);
            } else {
                out.println(String.format("%-80s", line));
            }
        }
        if (!ansi) {
            out.println("-".repeat(50));
        }
        out.flush();
        lastLineCount = lines.size();
    }

    List<String> lines(ProgressSnapshot snapshot) {
        List<String> lines = new ArrayList<>();
        lines.add(String.format(Locale.ROOT, "Overall: %s %5.1f%% | %s/%s",
                ProgressBars.bar(snapshot.percent(), 30, ansi), snapshot.percent(),
                ByteSizes.format(snapshot.bytesDownloaded()),
                snapshot.bytesTotal() >= 0 ? ByteSizes.format(snapshot.bytesTotal()) : "?"));
        for (FragmentProgress fragment : snapshot.fragments()) {
            lines.add(String.format(Locale.ROOT, "Frag %2d: %s %5.1f%% | %10s",
                    fragment.index() + 1, ProgressBars.bar(fragment.percent(), 20, ansi), fragment.percent(),
                    ByteSizes.format(fragment.bytesPerSecond()) + "/s"));
        }
        return lines;
    }
}
