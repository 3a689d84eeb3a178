package com.exthost.api.plugin;

import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * 宿主进程对插件描述符的解析视图
 *
 * @param pluginPath 入口模块路径
 * @param initPath   初始化模块路径，未声明时为空串
 * @param model      插件模型
 * @param lifecycle  生命周期钩子
 * @param rawModel   原始清单内容
 */
public record Plugin(String pluginPath,
                     String initPath,
                     PluginModel model,
                     PluginLifecycle lifecycle,
                     @Nullable Map<String, Object> rawModel) {

    public Plugin {
        initPath = initPath != null ? initPath : "";
    }

    /**
     * 插件标识，模型未给出时退化为入口路径
     */
    public String pluginId() {
        return model != null && model.id() != null ? model.id() : pluginPath;
    }

    public boolean hasInitializer() {
        return !initPath.isEmpty();
    }
}
