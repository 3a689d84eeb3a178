package com.exthost.core.context;

import com.exthost.api.context.PluginContext;
import com.exthost.api.plugin.Plugin;
import com.exthost.api.rpc.RpcProtocol;
import lombok.RequiredArgsConstructor;

import java.util.Map;
import java.util.Optional;

/**
 * 交给插件入口的上下文
 */
@RequiredArgsConstructor
public class HostedPluginContext implements PluginContext {

    private final Plugin plugin;
    private final RpcProtocol rpc;

    @Override
    public String getPluginId() {
        return plugin.pluginId();
    }

    @Override
    public Plugin getPlugin() {
        return plugin;
    }

    @Override
    public RpcProtocol getRpc() {
        return rpc;
    }

    @Override
    public Optional<String> getProperty(String key) {
        // 先查插件清单，再查系统属性
        Map<String, Object> raw = plugin.rawModel();
        if (raw != null) {
            Object value = raw.get(key);
            if (value != null) {
                return Optional.of(String.valueOf(value));
            }
        }
        return Optional.ofNullable(System.getProperty(key));
    }
}
