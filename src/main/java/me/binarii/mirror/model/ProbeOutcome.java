package me.binarii.mirror.model;

public class ProbeOutcome {

	public enum Status {
		SUCCEEDED,
		TIMED_OUT,
		FAILED,
		ABANDONED,
		SKIPPED
	}

	private final String url;

	private final Status status;

	private final Double downloadRate;

	private final String message;

	private ProbeOutcome(String url, Status status, Double downloadRate, String message) {
		this.url = url;
		this.status = status;
		this.downloadRate = downloadRate;
		this.message = message;
	}

	public static ProbeOutcome succeeded(String url, Double downloadRate) {
		return new ProbeOutcome(url, Status.SUCCEEDED, downloadRate, null);
	}

	public static ProbeOutcome timedOut(String url, String message) {
		return new ProbeOutcome(url, Status.TIMED_OUT, null, message);
	}

	public static ProbeOutcome failed(String url, String message) {
		return new ProbeOutcome(url, Status.FAILED, null, message);
	}

	public static ProbeOutcome abandoned(String url) {
		return new ProbeOutcome(url, Status.ABANDONED, null, null);
	}

	public static ProbeOutcome skipped(String url) {
		return new ProbeOutcome(url, Status.SKIPPED, null, null);
	}

	public String getUrl() {
		return url;
	}

	public Status getStatus() {
		return status;
	}

	public Double getDownloadRate() {
		return downloadRate;
	}

	public String getMessage() {
		return message;
	}

	public boolean isSucceeded() {
		return status == Status.SUCCEEDED;
	}

	@Override
	public String toString() {
		return "(" + url + ", " + status + (downloadRate != null ? ", " + downloadRate : "")
				+ (message != null ? ", " + message : "") + ")";
	}

}
