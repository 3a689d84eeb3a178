package com.exthost.api.plugin;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 插件描述符：主进程随 init 调用下发的插件元数据，创建后不可变
 *
 * @param model     插件模型
 * @param lifecycle 生命周期钩子
 * @param source    原始清单内容
 */
public record PluginDescriptor(PluginModel model,
                               PluginLifecycle lifecycle,
                               @Nullable Map<String, Object> source) {

    public PluginDescriptor {
        Objects.requireNonNull(model, "model");
        lifecycle = lifecycle != null ? lifecycle : PluginLifecycle.none();
        // 清单中允许 null 值，不能用 Map.copyOf
        source = source != null ? Collections.unmodifiableMap(new LinkedHashMap<>(source)) : Map.of();
    }

    public PluginDescriptor(PluginModel model, PluginLifecycle lifecycle) {
        this(model, lifecycle, null);
    }
}
