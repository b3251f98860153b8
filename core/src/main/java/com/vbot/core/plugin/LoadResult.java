package com.vbot.core.plugin;

import java.util.Objects;

/**
 * Outcome of loading a single extension: either loaded, or failed with the fault it raised.
 */
public final class LoadResult {
    private final String name;
    private final Throwable fault;

    private LoadResult(String name, Throwable fault) {
        this.name = name;
        this.fault = fault;
    }

    public static LoadResult loaded(String name) {
        return new LoadResult(name, null);
    }

    public static LoadResult failed(String name, Throwable fault) {
        return new LoadResult(name, Objects.requireNonNull(fault, "fault"));
    }

    public String getName() {
        return name;
    }

    public boolean isLoaded() {
        return fault == null;
    }

    public Throwable getFault() {
        return fault;
    }

    @Override
    public String toString() {
        return isLoaded() ? "Loaded(" + name + ")" : "Failed(" + name + ", " + fault + ")";
    }
}
