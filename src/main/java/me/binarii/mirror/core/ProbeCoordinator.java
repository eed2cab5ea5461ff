package me.binarii.mirror.core;

import me.binarii.mirror.model.Mirror;
import me.binarii.mirror.model.MirrorList;
import me.binarii.mirror.model.ProbeOutcome;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Probes every mirror of a list at once and stops listening as soon as enough of
 * them have succeeded.
 * <p>
 * Results are consumed in completion order on the calling thread only, so the
 * output list has a single writer. Probes still running after the target is met
 * are cancelled and left behind without waiting for them to wind down.
 */
public class ProbeCoordinator {

    private static Log logger = LogFactory.getLog(ProbeCoordinator.class);

    private static final AtomicInteger ROUND = new AtomicInteger(1);

    private final Prober prober;

    public ProbeCoordinator(Prober prober) {
        this.prober = prober;
    }

    /**
     * @param mirrorList mirrors to measure
     * @param deadline   per-probe time limit, {@code null} for none
     * @param limit      number of successful probes to wait for, clamped to the list size
     * @return the measured mirrors in completion order, followed by all the others in
     * their original order
     */
    public ProbeReport updateDownloadRates(MirrorList mirrorList, Duration deadline, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0: " + limit);
        }
        List<Mirror> original = new ArrayList<>(mirrorList.getMirrors());
        int left = Math.min(original.size(), limit);
        if (left == 0) {
            List<ProbeOutcome> outcomes = new ArrayList<>(original.size());
            original.forEach(m -> outcomes.add(ProbeOutcome.skipped(m.getUrl())));
            return new ProbeReport(mirrorList.withMirrors(original), outcomes);
        }

        Map<String, ProbeOutcome> reported = new HashMap<>();
        List<Mirror> updated = new ArrayList<>(left);

        ExecutorService executor = Executors.newFixedThreadPool(original.size(), newThreadFactory());
        CompletionService<Mirror> completions = new ExecutorCompletionService<>(executor);
        Map<Future<Mirror>, Mirror> inFlight = new HashMap<>();
        for (Mirror mirror : original) {
            inFlight.put(completions.submit(() -> prober.probe(mirror, deadline)), mirror);
        }

        try {
            while (left > 0 && !inFlight.isEmpty()) {
                Future<Mirror> done = completions.take();
                Mirror mirror = inFlight.remove(done);
                try {
                    Mirror probed = done.get();
                    updated.add(probed);
                    reported.put(probed.getUrl(), ProbeOutcome.succeeded(probed.getUrl(), probed.getDownloadRate()));
                    left--;
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    logger.debug("failed to update download rate of " + mirror.getUrl(), cause);
                    reported.put(mirror.getUrl(), cause instanceof ProbeTimeoutException
                            ? ProbeOutcome.timedOut(mirror.getUrl(), cause.getMessage())
                            : ProbeOutcome.failed(mirror.getUrl(), String.valueOf(cause.getMessage())));
                }
            }
            if (left == 0) {
                logger.debug("enough mirrors updated, abandoning " + inFlight.size() + " probes");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("interrupted while waiting for probes, keeping " + updated.size() + " results", e);
        } finally {
            inFlight.keySet().forEach(future -> future.cancel(true));
            executor.shutdownNow();
        }

        return reconcile(mirrorList, original, updated, reported);
    }

    private ProbeReport reconcile(MirrorList mirrorList,
                                  List<Mirror> original,
                                  List<Mirror> updated,
                                  Map<String, ProbeOutcome> reported) {
        Set<String> okUrls = new HashSet<>();
        updated.forEach(m -> okUrls.add(m.getUrl()));

        List<Mirror> mirrors = new ArrayList<>(updated);
        for (Mirror mirror : original) {
            if (!okUrls.contains(mirror.getUrl())) {
                mirrors.add(mirror);
            }
        }

        List<ProbeOutcome> outcomes = new ArrayList<>(mirrors.size());
        for (Mirror mirror : mirrors) {
            ProbeOutcome outcome = reported.get(mirror.getUrl());
            outcomes.add(outcome != null ? outcome : ProbeOutcome.abandoned(mirror.getUrl()));
        }
        logger.debug(updated.size() + " of " + original.size() + " mirrors probed successfully");
        return new ProbeReport(mirrorList.withMirrors(mirrors), outcomes);
    }

    private static ThreadFactory newThreadFactory() {
        int round = ROUND.getAndIncrement();
        AtomicInteger seq = new AtomicInteger(1);
        return r -> {
            Thread thread = new Thread(r, "mirror-probe-" + round + "-" + seq.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }

}
