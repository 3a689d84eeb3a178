package com.exthost.api.plugin;

import org.jspecify.annotations.Nullable;

/**
 * 插件入口声明：后端入口、前端入口或两者
 */
public record PluginEntryPoint(@Nullable String backend, @Nullable String frontend) {

    public static PluginEntryPoint backend(String path) {
        return new PluginEntryPoint(path, null);
    }

    public static PluginEntryPoint frontend(String path) {
        return new PluginEntryPoint(null, path);
    }

    public boolean declaresBackend() {
        return backend != null && !backend.isBlank();
    }

    public boolean declaresFrontend() {
        return frontend != null && !frontend.isBlank();
    }
}
