package me.binarii.mirror.model;

import java.time.Duration;
import java.time.Instant;

/**
 * One mirror of the status document. Everything but the measured download rate is
 * fixed at decode time; the rate is only ever set through {@link #withDownloadRate}.
 */
public class Mirror {

	private final String url;

	private final Protocol protocol;

	private final Double score;

	private final Double delay;

	private final String country;

	private final String countryCode;

	private final Instant lastSync;

	private final Boolean isos;

	private final Boolean ipv4;

	private final Boolean ipv6;

	private final String details;

	/** kB/s; NaN when a probe completed without receiving a byte */
	private final Double downloadRate;

	private Mirror(Builder builder, Double downloadRate) {
		this.url = builder.url;
		this.protocol = builder.protocol;
		this.score = builder.score;
		this.delay = builder.delay;
		this.country = builder.country;
		this.countryCode = builder.countryCode;
		this.lastSync = builder.lastSync;
		this.isos = builder.isos;
		this.ipv4 = builder.ipv4;
		this.ipv6 = builder.ipv6;
		this.details = builder.details;
		this.downloadRate = downloadRate;
	}

	public static Builder builder(String url) {
		return new Builder(url);
	}

	public Builder toBuilder() {
		return new Builder(url)
				.protocol(protocol)
				.score(score)
				.delay(delay)
				.country(country)
				.countryCode(countryCode)
				.lastSync(lastSync)
				.isos(isos)
				.ipv4(ipv4)
				.ipv6(ipv6)
				.details(details);
	}

	/**
	 * @return a copy of this mirror carrying the given measured rate
	 */
	public Mirror withDownloadRate(double downloadRate) {
		return new Mirror(toBuilder(), downloadRate);
	}

	/**
	 * @return time elapsed since the last synchronisation, negative when it lies in
	 * the future, or {@code null} when the mirror never reported one
	 */
	public Duration age(Instant now) {
		return lastSync != null ? Duration.between(lastSync, now) : null;
	}

	public String getUrl() {
		return url;
	}

	public Protocol getProtocol() {
		return protocol;
	}

	public Double getScore() {
		return score;
	}

	public Double getDelay() {
		return delay;
	}

	public String getCountry() {
		return country;
	}

	public String getCountryCode() {
		return countryCode;
	}

	public Instant getLastSync() {
		return lastSync;
	}

	public Boolean getIsos() {
		return isos;
	}

	public Boolean getIpv4() {
		return ipv4;
	}

	public Boolean getIpv6() {
		return ipv6;
	}

	public String getDetails() {
		return details;
	}

	public Double getDownloadRate() {
		return downloadRate;
	}

	public boolean hasDownloadRate() {
		return downloadRate != null;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj instanceof Mirror) {
			Mirror that = (Mirror) obj;
			return this.url != null && this.url.equals(that.url);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return url != null ? url.hashCode() : 0;
	}

	@Override
	public String toString() {
		return "(" + url + ", " + protocol + ", " + country + ", " + downloadRate + ")";
	}

	public static class Builder {

		private final String url;

		private Protocol protocol = Protocol.DEFAULT;

		private Double score;

		private Double delay;

		private String country;

		private String countryCode;

		private Instant lastSync;

		private Boolean isos;

		private Boolean ipv4;

		private Boolean ipv6;

		private String details = "";

		private Builder(String url) {
			if (url == null) {
				throw new IllegalArgumentException("mirror url is required");
			}
			this.url = url;
		}

		public Builder protocol(Protocol protocol) {
			this.protocol = protocol != null ? protocol : Protocol.DEFAULT;
			return this;
		}

		public Builder score(Double score) {
			this.score = score;
			return this;
		}

		public Builder delay(Double delay) {
			this.delay = delay;
			return this;
		}

		public Builder country(String country) {
			this.country = country;
			return this;
		}

		public Builder countryCode(String countryCode) {
			this.countryCode = countryCode;
			return this;
		}

		public Builder lastSync(Instant lastSync) {
			this.lastSync = lastSync;
			return this;
		}

		public Builder isos(Boolean isos) {
			this.isos = isos;
			return this;
		}

		public Builder ipv4(Boolean ipv4) {
			this.ipv4 = ipv4;
			return this;
		}

		public Builder ipv6(Boolean ipv6) {
			this.ipv6 = ipv6;
			return this;
		}

		public Builder details(String details) {
			this.details = details != null ? details : "";
			return this;
		}

		public Mirror build() {
			return new Mirror(this, null);
		}

	}

}
