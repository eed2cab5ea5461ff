package me.binarii.mirror.config;

import me.binarii.mirror.core.FilterCriteria;
import me.binarii.mirror.model.Protocol;
import me.binarii.mirror.model.SortKey;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

public class MirrorsConfig {

	public static final String RESOURCE = "mirrors.properties";

	public static final String DEFAULT_URL = "https://archlinux.org/mirrors/status/json";

	public static final SortKey DEFAULT_SORT = SortKey.SCORE;

	public static final int DEFAULT_NUMBER = 20;

	public static final long DEFAULT_TIMEOUT_SECONDS = 5;

	private static final String PREFIX = "mirrors.";

	private final String url;

	private final SortKey sortKey;

	private final int number;

	private final FilterCriteria criteria;

	private final Duration probeTimeout;

	private final int probeLimit;

	private final Path output;

	private final boolean listCountries;

	private MirrorsConfig(Builder builder) {
		this.url = builder.url;
		this.sortKey = builder.sortKey;
		this.number = builder.number;
		this.criteria = builder.criteria.build();
		this.probeTimeout = builder.probeTimeoutSeconds > 0 ? Duration.ofSeconds(builder.probeTimeoutSeconds) : null;
		this.probeLimit = builder.probeLimit != null ? builder.probeLimit : builder.number;
		this.output = builder.output;
		this.listCountries = builder.listCountries;
	}

	public static MirrorsConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public static MirrorsConfig load() {
		Properties properties = new Properties();
		try (InputStream in = MirrorsConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
			if (in != null) {
				properties.load(in);
			}
		} catch (IOException e) {
			throw new UncheckedIOException("cannot read " + RESOURCE, e);
		}
		for (String name : System.getProperties().stringPropertyNames()) {
			if (name.startsWith(PREFIX)) {
				properties.setProperty(name, System.getProperty(name));
			}
		}
		return fromProperties(properties);
	}

	public static MirrorsConfig fromProperties(Properties properties) {
		Builder builder = builder();
		String value;
		if ((value = get(properties, "url")) != null) builder.url(value);
		if ((value = get(properties, "sort")) != null) builder.sortKey(SortKey.fromName(value));
		if ((value = get(properties, "number")) != null) builder.number(parseInt("number", value));
		if ((value = get(properties, "age")) != null) builder.maxAgeHours(parseDouble("age", value));
		if ((value = get(properties, "isos")) != null) builder.isos(Boolean.parseBoolean(value));
		if ((value = get(properties, "ipv4")) != null) builder.ipv4(Boolean.parseBoolean(value));
		if ((value = get(properties, "ipv6")) != null) builder.ipv6(Boolean.parseBoolean(value));
		if ((value = get(properties, "protocols")) != null) {
			List<Protocol> protocols = new ArrayList<>();
			for (String name : value.split(",")) {
				if (!name.isBlank()) {
					protocols.add(Protocol.fromName(name));
				}
			}
			builder.protocols(protocols);
		}
		if ((value = get(properties, "timeout")) != null) builder.probeTimeoutSeconds(parseInt("timeout", value));
		if ((value = get(properties, "probes")) != null) builder.probeLimit(parseInt("probes", value));
		if ((value = get(properties, "output")) != null) builder.output(Paths.get(value));
		if ((value = get(properties, "countries")) != null) builder.listCountries(Boolean.parseBoolean(value));
		return builder.build();
	}

	private static String get(Properties properties, String key) {
		String value = properties.getProperty(PREFIX + key);
		return value == null || value.isBlank() ? null : value.trim();
	}

	private static int parseInt(String key, String value) {
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(PREFIX + key + " is not an integer: " + value, e);
		}
	}

	private static double parseDouble(String key, String value) {
		try {
			return Double.parseDouble(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(PREFIX + key + " is not a number: " + value, e);
		}
	}

	public String getUrl() {
		return url;
	}

	public SortKey getSortKey() {
		return sortKey;
	}

	public int getNumber() {
		return number;
	}

	public FilterCriteria getCriteria() {
		return criteria;
	}

	public Duration getProbeTimeout() {
		return probeTimeout;
	}

	public int getProbeLimit() {
		return probeLimit;
	}

	public Path getOutput() {
		return output;
	}

	public boolean isListCountries() {
		return listCountries;
	}

	@Override
	public String toString() {
		return "MirrorsConfig(url=" + url + ", sort=" + sortKey + ", number=" + number + ", " + criteria
				+ ", timeout=" + probeTimeout + ", probes=" + probeLimit + ", output=" + output
				+ ", countries=" + listCountries + ")";
	}

	public static class Builder {

		private String url = DEFAULT_URL;

		private SortKey sortKey = DEFAULT_SORT;

		private int number = DEFAULT_NUMBER;

		private final FilterCriteria.Builder criteria = FilterCriteria.builder();

		private long probeTimeoutSeconds = DEFAULT_TIMEOUT_SECONDS;

		private Integer probeLimit;

		private Path output;

		private boolean listCountries;

		public Builder url(String url) {
			this.url = url;
			return this;
		}

		public Builder sortKey(SortKey sortKey) {
			this.sortKey = sortKey;
			return this;
		}

		public Builder number(int number) {
			if (number < 0) {
				throw new IllegalArgumentException("number must be >= 0: " + number);
			}
			this.number = number;
			return this;
		}

		public Builder maxAgeHours(Double maxAgeHours) {
			criteria.maxAgeHours(maxAgeHours);
			return this;
		}

		public Builder isos(boolean isos) {
			criteria.isos(isos);
			return this;
		}

		public Builder ipv4(boolean ipv4) {
			criteria.ipv4(ipv4);
			return this;
		}

		public Builder ipv6(boolean ipv6) {
			criteria.ipv6(ipv6);
			return this;
		}

		public Builder protocols(List<Protocol> protocols) {
			criteria.protocols(protocols != null ? protocols : Collections.emptyList());
			return this;
		}

		public Builder probeTimeoutSeconds(long seconds) {
			if (seconds < 0) {
				throw new IllegalArgumentException("timeout must be >= 0: " + seconds);
			}
			this.probeTimeoutSeconds = seconds;
			return this;
		}

		public Builder probeLimit(int probeLimit) {
			if (probeLimit < 0) {
				throw new IllegalArgumentException("probes must be >= 0: " + probeLimit);
			}
			this.probeLimit = probeLimit;
			return this;
		}

		public Builder output(Path output) {
			this.output = output;
			return this;
		}

		public Builder listCountries(boolean listCountries) {
			this.listCountries = listCountries;
			return this;
		}

		public MirrorsConfig build() {
			if (url == null || url.isBlank()) {
				throw new IllegalArgumentException("status url is required");
			}
			if (sortKey == null) {
				throw new IllegalArgumentException("sort key is required");
			}
			return new MirrorsConfig(this);
		}

	}

}
