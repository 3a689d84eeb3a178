package com.exthost.api.plugin;

import java.util.List;

/**
 * init 调用的结果：本进程执行的后端插件 + 原样转交主进程的前端插件
 */
public record InitResult(List<Plugin> backendPlugins, List<Plugin> frontendPlugins) {

    public InitResult {
        backendPlugins = backendPlugins != null ? List.copyOf(backendPlugins) : List.of();
        frontendPlugins = frontendPlugins != null ? List.copyOf(frontendPlugins) : List.of();
    }
}
