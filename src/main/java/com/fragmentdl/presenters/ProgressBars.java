package com.fragmentdl.presenters;

final class ProgressBars {

    private ProgressBars() {
    }

    static String bar(double percent, int width, boolean unicode) {
        int filled = (int) Math.max(0, Math.min(width, width * percent / 100));
        char full = unicode ? '█' : '#';
        char empty = unicode ? '░' : '-';
        return "[" + String.valueOf(full).repeat(filled) + String.valueOf(empty).repeat(width - filled) + "]";
    }
}
