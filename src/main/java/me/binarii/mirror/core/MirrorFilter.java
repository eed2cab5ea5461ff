package me.binarii.mirror.core;

import me.binarii.mirror.model.Mirror;
import me.binarii.mirror.model.MirrorList;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Predicate;

import static java.util.stream.Collectors.toList;

public class MirrorFilter {

    private final Clock clock;

    public MirrorFilter() {
        this(Clock.systemUTC());
    }

    public MirrorFilter(Clock clock) {
        this.clock = clock;
    }

    public MirrorList filter(MirrorList mirrorList, FilterCriteria criteria) {
        Predicate<Mirror> predicate = m -> true;
        if (criteria.getMaxAgeHours() != null) {
            Instant now = clock.instant();
            double maxAge = criteria.getMaxAgeHours();
            predicate = predicate.and(m -> {
                Duration age = m.age(now);
                return age != null && ageInHours(age) < maxAge;
            });
        }
        if (criteria.isIsos()) {
            predicate = predicate.and(m -> Boolean.TRUE.equals(m.getIsos()));
        }
        if (criteria.isIpv4()) {
            predicate = predicate.and(m -> Boolean.TRUE.equals(m.getIpv4()));
        }
        if (criteria.isIpv6()) {
            predicate = predicate.and(m -> Boolean.TRUE.equals(m.getIpv6()));
        }
        if (!criteria.getProtocols().isEmpty()) {
            predicate = predicate.and(m -> criteria.getProtocols().contains(m.getProtocol()));
        }

        List<Mirror> kept = mirrorList.getMirrors().stream()
                .filter(predicate)
                .collect(toList());
        return mirrorList.withMirrors(kept);
    }

    /**
     * Whole hours plus the leftover minutes as a fraction. Both parts carry the sign
     * of the duration, so a sync ten minutes in the future is -1/6 of an hour old.
     */
    static double ageInHours(Duration age) {
        return age.toHours() + age.toMinutesPart() / 60.0;
    }

}
