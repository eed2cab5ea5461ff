package me.binarii.mirror.model;

import java.util.Locale;

public enum SortKey {

	AGE,
	RATE,
	COUNTRY,
	SCORE,
	DELAY;

	public static SortKey fromName(String name) {
		if (name == null) {
			throw new IllegalArgumentException("sort key is null");
		}
		try {
			return valueOf(name.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("unknown sort key: " + name, e);
		}
	}

	@Override
	public String toString() {
		return name().toLowerCase(Locale.ROOT);
	}

}
