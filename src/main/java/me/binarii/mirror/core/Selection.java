package me.binarii.mirror.core;

import me.binarii.mirror.model.MirrorList;
import me.binarii.mirror.model.ProbeOutcome;

import java.util.Collections;
import java.util.List;

public class Selection {

    private final MirrorList mirrorList;

    private final List<ProbeOutcome> probeOutcomes;

    public Selection(MirrorList mirrorList, List<ProbeOutcome> probeOutcomes) {
        this.mirrorList = mirrorList;
        this.probeOutcomes = Collections.unmodifiableList(probeOutcomes);
    }

    public MirrorList getMirrorList() {
        return mirrorList;
    }

    public List<ProbeOutcome> getProbeOutcomes() {
        return probeOutcomes;
    }

}
