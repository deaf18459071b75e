package org.pokerroom.service.poker.analysis;

public record DrawAnalysis(
        boolean flushDraw,
        boolean openEnded,
        boolean gutshot,
        int flushOuts,
        int straightOuts,
        int totalOuts
) {
    public static final DrawAnalysis NONE = new DrawAnalysis(false, false, false, 0, 0, 0);

    public boolean straightDraw() {
        return openEnded || gutshot;
    }
}
