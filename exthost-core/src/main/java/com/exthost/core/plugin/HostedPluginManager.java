package com.exthost.core.plugin;

import com.exthost.api.plugin.BackendInitializer;
import com.exthost.api.plugin.HostedPlugin;
import com.exthost.api.plugin.InitResult;
import com.exthost.api.plugin.Plugin;
import com.exthost.api.plugin.PluginDescriptor;
import com.exthost.api.plugin.PluginLifecycle;
import com.exthost.api.plugin.PluginLoadResult;
import com.exthost.api.plugin.PluginManagerExt;
import com.exthost.api.plugin.PluginModel;
import com.exthost.api.rpc.RpcProtocol;
import com.exthost.core.context.HostedPluginContext;
import com.exthost.core.event.Emitter;
import com.exthost.core.exception.PluginLoadException;
import com.exthost.core.loader.ModuleHandle;
import com.exthost.core.loader.ModuleLoader;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 宿主进程侧插件管理器
 * <p>
 * 职责：
 * 1. init：按入口声明把插件分为后端/前端两桶，后端插件在入桶前执行初始化钩子
 * 2. loadPlugin：执行 doLoad 钩子后加载入口模块，失败按插件隔离
 * 3. 维护每个插件的状态与加载报告，发布生命周期事件
 * 4. stop：停止已启动的插件并释放模块
 */
@Slf4j
public class HostedPluginManager implements PluginManagerExt {

    private final String contextId;
    private final RpcProtocol rpc;
    private final ModuleLoader moduleLoader;

    @Getter
    private final Emitter<PluginEvent> events;

    // 插件标识 -> 状态
    private final Map<String, PluginState> states = new ConcurrentHashMap<>();

    // 按发生顺序的加载报告
    private final List<PluginLoadResult> loadReport = new CopyOnWriteArrayList<>();

    // 已启动的插件 (用于 stop)
    private final List<StartedPlugin> startedPlugins = new CopyOnWriteArrayList<>();

    public HostedPluginManager(String contextId, RpcProtocol rpc, ModuleLoader moduleLoader) {
        this.contextId = contextId;
        this.rpc = rpc;
        this.moduleLoader = moduleLoader;
        this.events = new Emitter<>(contextId + "/plugins");
    }

    // ==================== init ====================

    @Override
    public CompletableFuture<InitResult> init(List<PluginDescriptor> descriptors) {
        List<Plugin> backendPlugins = new ArrayList<>();
        List<Plugin> frontendPlugins = new ArrayList<>();
        List<PluginDescriptor> input = descriptors != null ? descriptors : Collections.emptyList();

        for (PluginDescriptor descriptor : input) {
            PluginModel model = descriptor.model();
            PluginLifecycle lifecycle = descriptor.lifecycle();

            if (model.declaresBackend()) {
                String backendInitPath = lifecycle.backendInitPath();
                Plugin plugin = new Plugin(model.entryPoint().backend(),
                        backendInitPath != null ? backendInitPath : "",
                        model, lifecycle, descriptor.source());
                transition(plugin.pluginId(), PluginState.PARTITIONED_BACKEND);
                events.fire(new PluginEvent.Partitioned(plugin.pluginId(), true));

                if (plugin.hasInitializer() && !initialize(plugin, descriptor)) {
                    continue;
                }
                backendPlugins.add(plugin);
            } else if (model.declaresFrontend()) {
                // 前端插件原样转交，不执行任何钩子
                Plugin plugin = new Plugin(model.entryPoint().frontend(),
                        lifecycle.frontendInitPath(),
                        model, lifecycle, descriptor.source());
                transition(plugin.pluginId(), PluginState.PARTITIONED_FRONTEND);
                events.fire(new PluginEvent.Partitioned(plugin.pluginId(), false));
                frontendPlugins.add(plugin);
            } else {
                log.debug("[{}] Plugin {} declares no entry point, skipped", contextId, model.id());
            }
        }

        log.info("[{}] init partitioned {} plugin(s): {} backend, {} frontend",
                contextId, input.size(), backendPlugins.size(), frontendPlugins.size());
        return CompletableFuture.completedFuture(new InitResult(backendPlugins, frontendPlugins));
    }

    /**
     * 执行后端初始化钩子
     *
     * @return 是否成功；失败的插件不进入后端分桶
     */
    private boolean initialize(Plugin plugin, PluginDescriptor descriptor) {
        String initPath = plugin.initPath();
        log.info("[{}] initializing({})", contextId, initPath);
        try {
            ModuleHandle module = moduleLoader.load(initPath);
            for (BackendInitializer initializer : module.exports(BackendInitializer.class)) {
                initializer.doInitialization(rpc, this, descriptor);
            }
            transition(plugin.pluginId(), PluginState.INITIALIZED);
            events.fire(new PluginEvent.Initialized(plugin.pluginId(), initPath));
            return true;
        } catch (Exception | LinkageError e) {
            // 第三方模块常见的 NoClassDefFoundError / ExceptionInInitializerError 同样按插件隔离
            fail(plugin, new PluginLoadException(plugin.pluginId(), "initializer " + initPath + " failed", e));
            return false;
        }
    }

    // ==================== loadPlugin ====================

    @Override
    public CompletableFuture<Void> loadPlugin(String contextPath, Plugin plugin) {
        log.info("[{}] loadPlugin({})", contextId, plugin.pluginPath());
        try {
            if (contextPath != null && !contextPath.isEmpty()) {
                ModuleHandle initModule = moduleLoader.load(contextPath);
                for (BackendInitializer initializer : initModule.exports(BackendInitializer.class)) {
                    initializer.doLoad(rpc, plugin);
                }
            }

            ModuleHandle main = moduleLoader.load(plugin.pluginPath());
            HostedPluginContext context = new HostedPluginContext(plugin, rpc);
            for (HostedPlugin hostedPlugin : main.exports(HostedPlugin.class)) {
                hostedPlugin.onStart(context);
                startedPlugins.add(new StartedPlugin(plugin.pluginId(), hostedPlugin, context));
            }

            transition(plugin.pluginId(), PluginState.LOADED);
            loadReport.add(PluginLoadResult.loaded(plugin));
            events.fire(new PluginEvent.Loaded(plugin.pluginId(), plugin));
        } catch (Exception | LinkageError e) {
            // 单个插件失败不影响后续插件，调用本身也不失败
            fail(plugin, new PluginLoadException(plugin.pluginId(), "failed to load " + plugin.pluginPath(), e));
        }
        return CompletableFuture.completedFuture(null);
    }

    private void fail(Plugin plugin, PluginLoadException error) {
        log.error("[{}] {}", contextId, error.getMessage(), error);
        transition(plugin.pluginId(), PluginState.LOAD_FAILED);
        loadReport.add(PluginLoadResult.failed(plugin.pluginId(), plugin.pluginPath(), error.getCause()));
        events.fire(new PluginEvent.LoadFailed(plugin.pluginId(), plugin.pluginPath(), error.getCause()));
    }

    // ==================== 报告与停止 ====================

    @Override
    public CompletableFuture<List<PluginLoadResult>> getLoadReport() {
        return CompletableFuture.completedFuture(List.copyOf(loadReport));
    }

    @Override
    public CompletableFuture<Void> stop() {
        stopAll();
        return CompletableFuture.completedFuture(null);
    }

    /**
     * 停止所有已启动的插件 (逆序)，释放模块
     */
    public void stopAll() {
        List<StartedPlugin> started = new ArrayList<>(startedPlugins);
        startedPlugins.clear();
        Collections.reverse(started);
        for (StartedPlugin entry : started) {
            try {
                entry.plugin().onStop(entry.context());
            } catch (Exception | LinkageError e) {
                log.error("[{}] Error stopping plugin {}: {}", contextId, entry.pluginId(), e.getMessage(), e);
            }
            transition(entry.pluginId(), PluginState.STOPPED);
            events.fire(new PluginEvent.Stopped(entry.pluginId()));
        }
        moduleLoader.closeAll();
        log.info("[{}] Stopped {} plugin instance(s)", contextId, started.size());
    }

    private void transition(String pluginId, PluginState state) {
        PluginState previous = states.put(pluginId, state);
        log.debug("[{}] {}: {} -> {}", contextId, pluginId, previous, state);
    }

    // ==================== 查询 ====================

    public Optional<PluginState> getState(String pluginId) {
        return Optional.ofNullable(states.get(pluginId));
    }

    public List<PluginLoadResult> getLoadResults() {
        return List.copyOf(loadReport);
    }

    public int getStartedCount() {
        return startedPlugins.size();
    }

    private record StartedPlugin(String pluginId, HostedPlugin plugin, HostedPluginContext context) {
    }
}
