package me.binarii.mirror.core;

import me.binarii.mirror.model.Mirror;
import me.binarii.mirror.model.MirrorList;
import me.binarii.mirror.model.Protocol;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static me.binarii.mirror.MirrorFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class MirrorFilterTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private final MirrorFilter filter = new MirrorFilter(Clock.fixed(NOW, ZoneOffset.UTC));

    /** the three fixture mirrors plus twenty synced 0 to 19 hours before ten minutes from now */
    private static MirrorList agedMirrors() {
        MirrorList list = threeMirrors();
        List<Mirror> mirrors = new ArrayList<>(list.getMirrors());
        Instant future = NOW.plus(Duration.ofMinutes(10));
        for (int h = 0; h < 20; h++) {
            mirrors.add(Mirror.builder("https://aged-" + h + ".example.org/")
                    .lastSync(future.minus(Duration.ofHours(h)))
                    .build());
        }
        return list.withMirrors(mirrors);
    }

    /** every combination of absent/true/false capability flags */
    private static MirrorList flaggedMirrors() {
        Boolean[] values = {null, true, false};
        Protocol[] protocols = Protocol.values();
        List<Mirror> mirrors = new ArrayList<>();
        int i = 0;
        for (Boolean isos : values) {
            for (Boolean ipv4 : values) {
                for (Boolean ipv6 : values) {
                    mirrors.add(Mirror.builder("https://flag-" + i + ".example.org/")
                            .protocol(protocols[i % protocols.length])
                            .isos(isos)
                            .ipv4(ipv4)
                            .ipv6(ipv6)
                            .build());
                    i++;
                }
            }
        }
        return new MirrorList(mirrors);
    }

    @Test
    @DisplayName("Should keep everything in order without criteria")
    void testNoCriteria() {
        MirrorList list = agedMirrors();
        MirrorList filtered = filter.filter(list, FilterCriteria.none());
        assertEquals(urls(list), urls(filtered));
    }

    @Nested
    @DisplayName("Age cutoff")
    class AgeTests {

        @Test
        @DisplayName("Should keep only the mirror synced in the future under a 0.7h cutoff")
        void testNearZeroCutoff() {
            MirrorList filtered = filter.filter(agedMirrors(),
                    FilterCriteria.builder().maxAgeHours(0.7).build());

            assertEquals(List.of("https://aged-0.example.org/"), urls(filtered));
        }

        @Test
        @DisplayName("Should shrink monotonically as the cutoff decreases")
        void testDecreasingCutoff() {
            MirrorList list = agedMirrors();
            int size = list.size();
            for (int age = 29; age >= 0; age--) {
                list = filter.filter(list, FilterCriteria.builder().maxAgeHours(age * 0.7).build());
                assertTrue(list.size() <= size);
                size = list.size();
            }
            assertEquals(1, list.size());
        }

        @Test
        @DisplayName("Should drop mirrors without a last sync")
        void testDropsUnknownAge() {
            MirrorList filtered = filter.filter(agedMirrors(),
                    FilterCriteria.builder().maxAgeHours(1e9).build());

            assertFalse(urls(filtered).contains(RUTGERS));
            assertEquals(22, filtered.size());
        }

        @Test
        @DisplayName("Should drop a mirror whose age equals the cutoff")
        void testCutoffIsExclusive() {
            MirrorList list = new MirrorList(List.of(
                    Mirror.builder("exact").lastSync(NOW.minus(Duration.ofMinutes(30))).build(),
                    Mirror.builder("under").lastSync(NOW.minus(Duration.ofMinutes(29))).build()));

            MirrorList filtered = filter.filter(list, FilterCriteria.builder().maxAgeHours(0.5).build());

            assertEquals(List.of("under"), urls(filtered));
        }

        @Test
        @DisplayName("Should add leftover minutes as a signed fraction of an hour")
        void testAgeInHours() {
            assertEquals(2.5, MirrorFilter.ageInHours(Duration.ofMinutes(150)), 1e-9);
            assertEquals(-1.0 / 6, MirrorFilter.ageInHours(Duration.ofMinutes(-10)), 1e-9);
            assertEquals(-1 - 1.0 / 6, MirrorFilter.ageInHours(Duration.ofMinutes(-70)), 1e-9);
            assertEquals(0.0, MirrorFilter.ageInHours(Duration.ofSeconds(59)), 1e-9);
        }

    }

    @Nested
    @DisplayName("Capabilities and protocols")
    class FlagTests {

        @Test
        @DisplayName("Should treat an absent flag as false")
        void testSingleFlags() {
            MirrorList list = flaggedMirrors();

            MirrorList isos = filter.filter(list, FilterCriteria.builder().isos(true).build());
            MirrorList ipv4 = filter.filter(list, FilterCriteria.builder().ipv4(true).build());
            MirrorList ipv6 = filter.filter(list, FilterCriteria.builder().ipv6(true).build());

            assertEquals(9, isos.size());
            assertTrue(isos.getMirrors().stream().allMatch(m -> Boolean.TRUE.equals(m.getIsos())));
            assertEquals(9, ipv4.size());
            assertTrue(ipv4.getMirrors().stream().allMatch(m -> Boolean.TRUE.equals(m.getIpv4())));
            assertEquals(9, ipv6.size());
            assertTrue(ipv6.getMirrors().stream().allMatch(m -> Boolean.TRUE.equals(m.getIpv6())));
        }

        @Test
        @DisplayName("Should combine criteria with a logical and")
        void testAllFlags() {
            MirrorList filtered = filter.filter(flaggedMirrors(),
                    FilterCriteria.builder().isos(true).ipv4(true).ipv6(true).build());

            assertEquals(1, filtered.size());
            Mirror mirror = filtered.getMirrors().get(0);
            assertTrue(mirror.getIsos() && mirror.getIpv4() && mirror.getIpv6());
        }

        @Test
        @DisplayName("Should keep only allowed protocols")
        void testProtocols() {
            MirrorList list = flaggedMirrors();
            for (List<Protocol> allowed : List.of(
                    List.of(Protocol.RSYNC, Protocol.HTTPS),
                    List.of(Protocol.HTTP),
                    List.of(Protocol.FTP))) {
                MirrorList filtered = filter.filter(list, FilterCriteria.builder().protocols(allowed).build());

                assertFalse(filtered.isEmpty());
                assertTrue(filtered.size() < list.size());
                assertTrue(filtered.getMirrors().stream().allMatch(m -> allowed.contains(m.getProtocol())));
            }
        }

        @Test
        @DisplayName("Should ignore an empty protocol allow-list")
        void testEmptyProtocols() {
            MirrorList list = flaggedMirrors();
            MirrorList filtered = filter.filter(list, FilterCriteria.builder().protocols(List.of()).build());
            assertEquals(list.size(), filtered.size());
        }

    }

    @Test
    @DisplayName("Should reject a NaN age cutoff")
    void testNaNCutoff() {
        assertThrows(IllegalArgumentException.class,
                () -> FilterCriteria.builder().maxAgeHours(Double.NaN));
    }

}
