package com.fragmentdl.presenters;

import com.fragmentdl.models.ProgressSnapshot;
import com.fragmentdl.utils.ByteSizes;

import java.io.PrintStream;
import java.time.Duration;
import java.util.Locale;

/**
 * Prints a single line whenever overall progress moved by at least {@value #STEP_PERCENT} points.
 */
public class SimplePresenter implements Presenter {

    static final double STEP_PERCENT = 5.0;

    private final PrintStream out;
    private double lastPrinted;

    public SimplePresenter(PrintStream out) {
        this.out = out;
    }

    @Override
    public Duration refreshInterval() {
        return Duration.ofSeconds(2);
    }

    @Override
    public void render(ProgressSnapshot snapshot) {
        if (Math.abs(snapshot.percent() - lastPrinted) >= STEP_PERCENT) {
            print(snapshot);
        }
    }

    @Override
    public void finish(ProgressSnapshot snapshot) {
        if (snapshot.percent() != lastPrinted) {
            print(snapshot);
        }
    }

    private void print(ProgressSnapshot snapshot) {
        out.println(String.format(Locale.ROOT, "Progress: %5.1f%% | Speed: %s/s | Fragments: %d/%d completed",
                snapshot.percent(), ByteSizes.format(snapshot.bytesPerSecond()),
                snapshot.completedFragments(), snapshot.fragments().size()));
        out.flush();
        lastPrinted = snapshot.percent();
    }
}
