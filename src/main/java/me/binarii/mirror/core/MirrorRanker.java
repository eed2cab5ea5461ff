package me.binarii.mirror.core;

import me.binarii.mirror.model.Mirror;
import me.binarii.mirror.model.MirrorList;
import me.binarii.mirror.model.SortKey;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Stable sort of a mirror list. Mirrors comparing equal keep their relative order.
 */
public class MirrorRanker {

    private static final Comparator<Mirror> BY_AGE =
            Comparator.comparing(Mirror::getLastSync, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()));

    // missing and NaN both map to NaN, which Double.compare puts after every number
    private static final Comparator<Mirror> BY_RATE =
            (m, n) -> Double.compare(descendingRateKey(m), descendingRateKey(n));

    private static final Comparator<Mirror> BY_COUNTRY =
            Comparator.comparing(m -> m.getCountry() != null ? m.getCountry() : "");

    private static final Comparator<Mirror> BY_SCORE =
            Comparator.comparingLong(m -> roundedOrLast(m.getScore()));

    private static final Comparator<Mirror> BY_DELAY =
            Comparator.comparingLong(m -> roundedOrLast(m.getDelay()));

    public MirrorList sort(MirrorList mirrorList, SortKey key) {
        List<Mirror> mirrors = new ArrayList<>(mirrorList.getMirrors());
        mirrors.sort(comparator(key));
        return mirrorList.withMirrors(mirrors);
    }

    public static Comparator<Mirror> comparator(SortKey key) {
        switch (key) {
            case AGE:
                return BY_AGE;
            case RATE:
                return BY_RATE;
            case COUNTRY:
                return BY_COUNTRY;
            case SCORE:
                return BY_SCORE;
            case DELAY:
                return BY_DELAY;
            default:
                throw new IllegalArgumentException("unsupported sort key: " + key);
        }
    }

    private static double descendingRateKey(Mirror mirror) {
        Double rate = mirror.getDownloadRate();
        return rate == null || rate.isNaN() ? Double.NaN : -rate;
    }

    // halves round away from zero; the cast saturates, so a missing value (+inf) lands on Long.MAX_VALUE
    static long roundedOrLast(Double value) {
        double v = value != null ? value : Double.POSITIVE_INFINITY;
        return (long) (Math.signum(v) * Math.floor(Math.abs(v) + 0.5));
    }

}
