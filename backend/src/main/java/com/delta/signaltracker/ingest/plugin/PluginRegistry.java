package com.delta.signaltracker.ingest.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide directory of source plugins by name.
 */
public class PluginRegistry {
    private static final Logger log = LoggerFactory.getLogger(PluginRegistry.class);

    private final Map<String, PluginFactory> factories = new ConcurrentHashMap<>();

    public void register(String name, PluginFactory factory) {
        String key = normalizeName(name);
        if (factory == null) {
            throw new IllegalArgumentException("factory is required for plugin '" + key + "'");
        }
        if (factories.putIfAbsent(key, factory) != null) {
            throw new DuplicatePluginException(key);
        }
        log.info("Registered plugin '{}'", key);
    }

    public boolean isRegistered(String name) {
        return name != null && factories.containsKey(name.trim());
    }

    /**
     * Instantiates the requested plugins in input order. Nothing is instantiated when any
     * name is unknown.
     */
    public List<SourcePlugin> resolve(Collection<String> names) {
        Set<String> requested = new LinkedHashSet<>();
        if (names != null) {
            for (String name : names) {
                requested.add(normalizeName(name));
            }
        }
        List<String> unknown = new ArrayList<>();
        for (String name : requested) {
            if (!factories.containsKey(name)) {
                unknown.add(name);
            }
        }
        if (!unknown.isEmpty()) {
            throw new UnknownPluginException(unknown, registeredNames());
        }
        List<SourcePlugin> plugins = new ArrayList<>(requested.size());
        for (String name : requested) {
            SourcePlugin plugin = factories.get(name).create(name);
            if (plugin == null || !name.equals(plugin.name())) {
                throw new IllegalStateException("Factory for '" + name + "' produced a plugin with a different name");
            }
            plugins.add(plugin);
        }
        return plugins;
    }

    public List<String> registeredNames() {
        List<String> names = new ArrayList<>(factories.keySet());
        names.sort(String::compareTo);
        return names;
    }

    private static String normalizeName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("plugin name must not be blank");
        }
        return name.trim();
    }
}
