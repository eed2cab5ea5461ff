package me.binarii.mirror;

import me.binarii.mirror.config.MirrorsConfig;
import me.binarii.mirror.core.HttpDownloadProber;
import me.binarii.mirror.core.MirrorSelector;
import me.binarii.mirror.core.Selection;
import me.binarii.mirror.io.CountryReport;
import me.binarii.mirror.io.MirrorListWriter;
import me.binarii.mirror.io.MirrorStatusClient;
import me.binarii.mirror.io.MirrorStatusException;
import me.binarii.mirror.model.MirrorList;
import me.binarii.mirror.util.JSON;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.io.IOException;

public class Boot {

	private static Log logger = LogFactory.getLog(Boot.class);

	public static void main(String[] args) throws Exception {
		MirrorsConfig config = MirrorsConfig.load();
		logger.debug(config);

		MirrorList mirrorList;
		try (MirrorStatusClient client = new MirrorStatusClient()) {
			mirrorList = client.fetch(config.getUrl());
		} catch (MirrorStatusException e) {
			logger.error(e.getMessage(), e);
			System.exit(1);
			return;
		}

		if (config.isListCountries()) {
			System.out.println(new CountryReport().render(mirrorList));
			return;
		}

		Selection selection;
		try (HttpDownloadProber prober = new HttpDownloadProber()) {
			selection = new MirrorSelector(prober).select(mirrorList, config);
		}
		if (logger.isDebugEnabled() && !selection.getProbeOutcomes().isEmpty()) {
			logger.debug("probe outcomes: " + JSON.toJSONString(selection.getProbeOutcomes()));
		}

		write(selection.getMirrorList(), config);
	}

	private static void write(MirrorList selected, MirrorsConfig config) throws IOException {
		MirrorListWriter writer = new MirrorListWriter();
		if (config.getOutput() != null) {
			writer.write(selected, config.getNumber(), config.getOutput());
			logger.info("mirror list written to " + config.getOutput());
		} else {
			System.out.println(writer.render(selected, config.getNumber()));
		}
	}

}
