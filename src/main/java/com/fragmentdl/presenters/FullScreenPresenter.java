package com.fragmentdl.presenters;

import com.fragmentdl.models.FragmentState;
import com.fragmentdl.models.ProgressSnapshot;
import com.fragmentdl.models.ProgressSnapshot.FragmentProgress;
import com.fragmentdl.utils.ByteSizes;

import java.io.PrintStream;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Clears the terminal and draws a full progress dashboard on every refresh.
 */
public class FullScreenPresenter implements Presenter {

    private static final DateTimeFormatter CLOCK = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final String RULE = "=".repeat(60);

    private final PrintStream out;
    private final ZoneId zone;

    public FullScreenPresenter(PrintStream out, ZoneId zone) {
        this.out = out;
        this.zone = zone;
    }

    @Override
    public Duration refreshInterval() {
        return Duration.ofMillis(500);
    }

    @Override
    public void render(ProgressSnapshot snapshot) {
        StringBuilder screen = new StringBuilder("\033[2J\033[H");
        screen.append(RULE).append('\n')
                .append("DOWNLOAD PROGRESS - ").append(CLOCK.format(snapshot.takenAt().atZone(zone))).append('\n')
                .append(RULE).append('\n')
                .append(String.format(Locale.ROOT, "Overall: %s %.1f%%%n",
                        ProgressBars.bar(snapshot.percent(), 30, true), snapshot.percent()))
                .append("Downloaded: ").append(ByteSizes.format(snapshot.bytesDownloaded()))
                .append(" / ").append(snapshot.bytesTotal() >= 0 ? ByteSizes.format(snapshot.bytesTotal()) : "?")
                .append('\n')
                .append("Total Speed: ").append(ByteSizes.format(snapshot.bytesPerSecond())).append("/s\n\n")
                .append("Fragment Progress:\n")
                .append("-".repeat(60)).append('\n');
        for (FragmentProgress fragment : snapshot.fragments()) {
            screen.append(String.format(Locale.ROOT, "%s Fragment %2d: %s %5.1f%% | %10s%n",
                    marker(fragment.state()), fragment.index() + 1, ProgressBars.bar(fragment.percent(), 30, true),
                    fragment.percent(), ByteSizes.format(fragment.bytesPerSecond()) + "/s"));
        }
        screen.append(RULE).append('\n');
        out.print(screen);
        out.flush();
    }

    private static String marker(FragmentState state) {
        return switch (state) {
            case COMPLETED -> "✓";
            case FAILED -> "✗";
            case RETRY_WAITING -> "↻";
            default -> "↓";
        };
    }
}
