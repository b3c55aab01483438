/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.spi;

/**
 * Typed registries for every plugin kind the pipeline can load.
 */
public final class PluginCatalog {

    private final ServicePluginRegistry<SourcePlugin> sources;
    private final ServicePluginRegistry<SinkPlugin> sinks;
    private final ServicePluginRegistry<DlqSinkPlugin> dlqSinks;

    public PluginCatalog(ClassLoader cl) {
        this.sources = new ServicePluginRegistry<>(SourcePlugin.class, cl);
        this.sinks = new ServicePluginRegistry<>(SinkPlugin.class, cl);
        this.dlqSinks = new ServicePluginRegistry<>(DlqSinkPlugin.class, cl);
    }

    public ServicePluginRegistry<SourcePlugin> sources() {
        return sources;
    }

    public ServicePluginRegistry<SinkPlugin> sinks() {
        return sinks;
    }

    public ServicePluginRegistry<DlqSinkPlugin> dlqSinks() {
        return dlqSinks;
    }
}
