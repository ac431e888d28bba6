package com.gentoro.codex.resonance;

/** A named band and the frequency its components gravitate to. */
public record BandAttractor(String band, double frequency, String cluster) {}
