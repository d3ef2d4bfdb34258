package com.fragmentdl.presenters;

import com.fragmentdl.config.ProgressStyle;

import java.io.PrintStream;
import java.time.ZoneId;

public final class Presenters {

    private Presenters() {
    }

    /**
     * Picks the presenter for a style. Full-screen needs ANSI support and degrades to inline without it.
     */
    public static Presenter forStyle(ProgressStyle style, PrintStream out, boolean ansi) {
        return switch (style) {
            case SIMPLE -> new SimplePresenter(out);
            case FULL_SCREEN -> ansi ? new FullScreenPresenter(out, ZoneId.systemDefault()) : new InlinePresenter(out, false);
            case INLINE -> new InlinePresenter(out, ansi);
        };
    }

    public static boolean terminalSupportsAnsi() {
        String term = System.getenv("TERM");
        return term != null && !"dumb".equals(term);
    }
}
