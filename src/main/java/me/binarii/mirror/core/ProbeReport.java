package me.binarii.mirror.core;

import me.binarii.mirror.model.MirrorList;
import me.binarii.mirror.model.ProbeOutcome;

import java.util.Collections;
import java.util.List;

public class ProbeReport {

    private final MirrorList mirrorList;

    private final List<ProbeOutcome> outcomes;

    public ProbeReport(MirrorList mirrorList, List<ProbeOutcome> outcomes) {
        this.mirrorList = mirrorList;
        this.outcomes = Collections.unmodifiableList(outcomes);
    }

    public MirrorList getMirrorList() {
        return mirrorList;
    }

    public List<ProbeOutcome> getOutcomes() {
        return outcomes;
    }

    public long countSucceeded() {
        return outcomes.stream().filter(ProbeOutcome::isSucceeded).count();
    }

}
