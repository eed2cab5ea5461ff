package me.binarii.mirror.core;

public final class Bandwidth {

    private Bandwidth() {
    }

    /**
     * Transfer rate of a completed download. A transfer that received no byte at all
     * yields {@link Double#NaN}, which keeps "connected but empty" apart from
     * "never measured".
     */
    public static double rate(long bytesReceived, long elapsedMillis) {
        if (bytesReceived == 0) {
            return Double.NaN;
        }
        return bytesReceived / (1000.0 * elapsedMillis);
    }

}
