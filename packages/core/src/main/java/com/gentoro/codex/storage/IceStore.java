package com.gentoro.codex.storage;

/** Durable tier. Holds ICE nodes only. */
public interface IceStore extends NodeStore {}
