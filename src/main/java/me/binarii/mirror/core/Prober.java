package me.binarii.mirror.core;

import me.binarii.mirror.model.Mirror;

import java.time.Duration;

@FunctionalInterface
public interface Prober {

    Mirror probe(Mirror mirror, Duration deadline) throws ProbeException;

}
