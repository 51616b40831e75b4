package com.delta.signaltracker.ingest.plugin;

@FunctionalInterface
public interface PluginFactory {
    SourcePlugin create(String name);
}
