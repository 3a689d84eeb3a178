package com.exthost.api.plugin;

import org.jspecify.annotations.Nullable;

/**
 * 插件模型：主进程从插件清单解析出的静态元数据
 *
 * @param id          插件唯一标识；缺省时由 publisher 与 name 推导
 * @param name        插件名
 * @param publisher   发布者
 * @param version     版本号
 * @param displayName 展示名
 * @param description 描述
 * @param packagePath 插件包所在目录
 * @param entryPoint  入口声明
 */
public record PluginModel(@Nullable String id,
                          @Nullable String name,
                          @Nullable String publisher,
                          @Nullable String version,
                          @Nullable String displayName,
                          @Nullable String description,
                          @Nullable String packagePath,
                          @Nullable PluginEntryPoint entryPoint) {

    public PluginModel {
        if ((id == null || id.isBlank()) && name != null) {
            id = (publisher != null && !publisher.isBlank()) ? publisher + "." + name : name;
        }
    }

    /**
     * 测试与嵌入场景下的便捷构造
     */
    public static PluginModel of(String name, String version, PluginEntryPoint entryPoint) {
        return new PluginModel(null, name, null, version, null, null, null, entryPoint);
    }

    public boolean declaresBackend() {
        return entryPoint != null && entryPoint.declaresBackend();
    }

    public boolean declaresFrontend() {
        return entryPoint != null && entryPoint.declaresFrontend();
    }
}
