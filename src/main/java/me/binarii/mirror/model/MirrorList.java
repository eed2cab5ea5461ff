package me.binarii.mirror.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class MirrorList {

	private final List<Mirror> mirrors;

	private final String source;

	public MirrorList(List<Mirror> mirrors) {
		this(mirrors, null);
	}

	public MirrorList(List<Mirror> mirrors, String source) {
		this.mirrors = Collections.unmodifiableList(new ArrayList<>(mirrors));
		this.source = source;
	}

	public List<Mirror> getMirrors() {
		return mirrors;
	}

	public String getSource() {
		return source;
	}

	public int size() {
		return mirrors.size();
	}

	public boolean isEmpty() {
		return mirrors.isEmpty();
	}

	public MirrorList withMirrors(List<Mirror> mirrors) {
		return new MirrorList(mirrors, source);
	}

	public MirrorList truncate(int number) {
		if (number < 0) {
			throw new IllegalArgumentException("number must be >= 0: " + number);
		}
		return withMirrors(mirrors.subList(0, Math.min(number, mirrors.size())));
	}

	@Override
	public String toString() {
		return "MirrorList(" + mirrors.size() + " mirrors, from " + source + ")";
	}

}
