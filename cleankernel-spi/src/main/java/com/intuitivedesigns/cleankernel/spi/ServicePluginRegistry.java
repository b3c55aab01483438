/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Registry for one plugin SPI.
 *
 * <p>The ServiceLoader classpath scan runs <b>once</b> at construction; lookups are map reads.
 * Duplicate ids fail fast so two jars cannot silently shadow each other.</p>
 *
 * @param <T> The SPI interface type (e.g., SourcePlugin.class)
 */
public final class ServicePluginRegistry<T extends PipelinePlugin<?>> {

    private final Map<String, T> byId;

    public ServicePluginRegistry(Class<T> spiType) {
        this(spiType, Thread.currentThread().getContextClassLoader());
    }

    public ServicePluginRegistry(Class<T> spiType, ClassLoader cl) {
        Map<String, T> tmp = new LinkedHashMap<>();
        ServiceLoader<T> loader = ServiceLoader.load(spiType, cl);
        for (T plugin : loader) {
            String id = PluginIds.normalize(plugin.id());
            if (id.isEmpty()) {
                throw new IllegalStateException("Plugin id() must not be blank for " + plugin.getClass().getName());
            }
            if (tmp.containsKey(id)) {
                throw new IllegalStateException("Duplicate plugin ID '" + id + "' for SPI " + spiType.getSimpleName()
                        + ". Conflict between: " + tmp.get(id).getClass().getName() + " and " + plugin.getClass().getName());
            }
            tmp.put(id, plugin);
        }
        this.byId = Collections.unmodifiableMap(tmp);
    }

    public T require(String id, String configKeyName) {
        String key = PluginIds.normalize(id);
        T plugin = byId.get(key);
        if (plugin == null) {
            throw new IllegalArgumentException("No plugin found for '" + configKeyName + "=" + id + "'. "
                    + "Available options: " + byId.keySet());
        }
        return plugin;
    }

    public Set<String> availableIds() {
        return byId.keySet();
    }

    public Optional<T> get(String id) {
        return Optional.ofNullable(byId.get(PluginIds.normalize(id)));
    }
}
