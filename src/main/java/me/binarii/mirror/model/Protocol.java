package me.binarii.mirror.model;

import java.util.Locale;

public enum Protocol {

	FTP, HTTPS, HTTP, RSYNC;

	public static final Protocol DEFAULT = HTTPS;

	public static Protocol fromName(String name) {
		if (name == null) {
			throw new IllegalArgumentException("protocol name is null");
		}
		for (Protocol protocol : values()) {
			if (protocol.toString().equals(name.trim().toLowerCase(Locale.ROOT))) {
				return protocol;
			}
		}
		throw new IllegalArgumentException("unknown protocol: " + name);
	}

	@Override
	public String toString() {
		return name().toLowerCase(Locale.ROOT);
	}

}
