package me.binarii.mirror.core;

import me.binarii.mirror.config.MirrorsConfig;
import me.binarii.mirror.model.MirrorList;
import me.binarii.mirror.model.ProbeOutcome;
import me.binarii.mirror.model.SortKey;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.util.Collections;
import java.util.List;

public class MirrorSelector {

    private static Log logger = LogFactory.getLog(MirrorSelector.class);

    private final MirrorFilter filter;

    private final ProbeCoordinator coordinator;

    private final MirrorRanker ranker;

    public MirrorSelector(Prober prober) {
        this(new MirrorFilter(), new ProbeCoordinator(prober), new MirrorRanker());
    }

    public MirrorSelector(MirrorFilter filter, ProbeCoordinator coordinator, MirrorRanker ranker) {
        this.filter = filter;
        this.coordinator = coordinator;
        this.ranker = ranker;
    }

    public Selection select(MirrorList mirrorList, MirrorsConfig config) {
        MirrorList filtered = filter.filter(mirrorList, config.getCriteria());
        logger.debug(filtered.size() + " of " + mirrorList.size() + " mirrors left after filtering");

        List<ProbeOutcome> outcomes = Collections.emptyList();
        if (config.getSortKey() == SortKey.RATE) {
            ProbeReport report = coordinator.updateDownloadRates(
                    filtered, config.getProbeTimeout(), config.getProbeLimit());
            filtered = report.getMirrorList();
            outcomes = report.getOutcomes();
            logger.info(report.countSucceeded() + " of " + filtered.size() + " mirrors probed");
        }

        MirrorList selected = ranker.sort(filtered, config.getSortKey()).truncate(config.getNumber());
        logger.info("selected " + selected.size() + " mirrors by " + config.getSortKey());
        return new Selection(selected, outcomes);
    }

}
