package com.delta.signaltracker.ingest.plugin;

public class DuplicatePluginException extends RuntimeException {
    public DuplicatePluginException(String name) {
        super("Plugin '" + name + "' is already registered");
    }
}
