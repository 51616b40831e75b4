package com.delta.signaltracker.ingest.plugin;

import java.util.List;

public class UnknownPluginException extends RuntimeException {
    private final List<String> unknownNames;

    public UnknownPluginException(List<String> unknownNames, List<String> registeredNames) {
        super("Unknown plugin(s) " + unknownNames + ". Available plugins: " + registeredNames);
        this.unknownNames = List.copyOf(unknownNames);
    }

    public List<String> unknownNames() {
        return unknownNames;
    }
}
