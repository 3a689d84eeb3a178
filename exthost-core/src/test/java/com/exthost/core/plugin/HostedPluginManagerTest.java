package com.exthost.core.plugin;

import com.exthost.api.context.PluginContext;
import com.exthost.api.plugin.BackendInitializer;
import com.exthost.api.plugin.HostedPlugin;
import com.exthost.api.plugin.InitResult;
import com.exthost.api.plugin.Plugin;
import com.exthost.api.plugin.PluginDescriptor;
import com.exthost.api.plugin.PluginEntryPoint;
import com.exthost.api.plugin.PluginLifecycle;
import com.exthost.api.plugin.PluginLoadResult;
import com.exthost.api.plugin.PluginManagerExt;
import com.exthost.api.plugin.PluginModel;
import com.exthost.api.rpc.RpcProtocol;
import com.exthost.core.fixture.FakeModuleLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("HostedPluginManager 单元测试")
public class HostedPluginManagerTest {

    @Mock
    private RpcProtocol rpc;

    private FakeModuleLoader moduleLoader;
    private HostedPluginManager manager;
    private final List<String> trace = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        moduleLoader = new FakeModuleLoader();
        manager = new HostedPluginManager("TEST_HOST", rpc, moduleLoader);
        manager.getEvents().subscribe(event -> trace.add(event.getClass().getSimpleName() + ":" + event.pluginId()));
    }

    // ==================== 辅助 ====================

    private static PluginDescriptor backend(String name, String path) {
        return new PluginDescriptor(PluginModel.of(name, "1.0.0", PluginEntryPoint.backend(path)), PluginLifecycle.none());
    }

    private static PluginDescriptor backend(String name, String path, String initPath) {
        return new PluginDescriptor(PluginModel.of(name, "1.0.0", PluginEntryPoint.backend(path)),
                PluginLifecycle.backendInit(initPath), Map.of("publisher", "acme"));
    }

    private static PluginDescriptor frontend(String name, String path) {
        return new PluginDescriptor(PluginModel.of(name, "1.0.0", PluginEntryPoint.frontend(path)),
                new PluginLifecycle(null, name + "-front-init.js"));
    }

    private static List<String> paths(List<Plugin> plugins) {
        return plugins.stream().map(Plugin::pluginPath).toList();
    }

    /**
     * 记录钩子调用的初始化模块
     */
    private class RecordingInitializer implements BackendInitializer {
        private final String name;
        PluginManagerExt receivedManager;
        PluginDescriptor receivedDescriptor;
        RpcProtocol receivedRpc;

        RecordingInitializer(String name) {
            this.name = name;
        }

        @Override
        public void doInitialization(RpcProtocol rpc, PluginManagerExt pluginManager, PluginDescriptor descriptor) {
            receivedRpc = rpc;
            receivedManager = pluginManager;
            receivedDescriptor = descriptor;
            trace.add("doInitialization:" + name);
        }

        @Override
        public void doLoad(RpcProtocol rpc, Plugin plugin) {
            trace.add("doLoad:" + plugin.pluginId() + " loaded=" + moduleLoader.getLoadedPaths());
        }
    }

    private class RecordingPlugin implements HostedPlugin {
        PluginContext context;

        @Override
        public void onStart(PluginContext context) {
            this.context = context;
            trace.add("onStart:" + context.getPluginId());
        }

        @Override
        public void onStop(PluginContext context) {
            trace.add("onStop:" + context.getPluginId());
        }
    }

    // ==================== init ====================

    @Nested
    @DisplayName("init 分桶")
    class InitTests {

        @Test
        @DisplayName("后端/前端/带初始化的后端三种插件正确分桶")
        void shouldPartitionMixedDescriptors() {
            RecordingInitializer initializer = new RecordingInitializer("c-init");
            moduleLoader.register("c-init.js", initializer);
            PluginDescriptor c = backend("c", "c.js", "c-init.js");

            InitResult result = manager.init(List.of(backend("a", "a.js"), frontend("b", "b.js"), c)).join();

            assertEquals(List.of("a.js", "c.js"), paths(result.backendPlugins()));
            assertEquals(List.of("b.js"), paths(result.frontendPlugins()));
            assertEquals("", result.backendPlugins().get(0).initPath());
            assertEquals("c-init.js", result.backendPlugins().get(1).initPath());
            assertEquals("b-front-init.js", result.frontendPlugins().get(0).initPath());

            // 初始化钩子在 c 入桶前执行，参数为引擎、管理器与原始描述符
            assertEquals(List.of(
                    "Partitioned:a",
                    "Partitioned:b",
                    "Partitioned:c",
                    "doInitialization:c-init",
                    "Initialized:c"), trace);
            assertSame(rpc, initializer.receivedRpc);
            assertSame(manager, initializer.receivedManager);
            assertSame(c, initializer.receivedDescriptor);
            assertEquals(PluginState.INITIALIZED, manager.getState("c").orElseThrow());
            assertEquals(PluginState.PARTITIONED_BACKEND, manager.getState("a").orElseThrow());
            assertEquals(PluginState.PARTITIONED_FRONTEND, manager.getState("b").orElseThrow());
        }

        @Test
        @DisplayName("前端插件不加载任何模块")
        void frontendOnlyShouldNotTouchLoader() {
            InitResult result = manager.init(List.of(frontend("b", "b.js"))).join();

            assertEquals(1, result.frontendPlugins().size());
            assertTrue(result.backendPlugins().isEmpty());
            assertTrue(moduleLoader.getLoadedPaths().isEmpty());
            verifyNoInteractions(rpc);
        }

        @Test
        @DisplayName("两种入口都没有的插件被排除")
        void descriptorWithoutEntryPointShouldBeExcluded() {
            PluginDescriptor empty = new PluginDescriptor(PluginModel.of("ghost", "1.0.0", null), null);

            InitResult result = assertDoesNotThrow(() -> manager.init(List.of(empty, backend("a", "a.js"))).join());

            assertEquals(List.of("a.js"), paths(result.backendPlugins()));
            assertTrue(result.frontendPlugins().isEmpty());
            assertTrue(manager.getState("ghost").isEmpty());
        }

        @Test
        @DisplayName("同时声明两种入口时按后端处理")
        void backendShouldWinOverFrontend() {
            PluginDescriptor both = new PluginDescriptor(
                    PluginModel.of("both", "1.0.0", new PluginEntryPoint("both.js", "both-ui.js")), null);

            InitResult result = manager.init(List.of(both)).join();

            assertEquals(List.of("both.js"), paths(result.backendPlugins()));
            assertTrue(result.frontendPlugins().isEmpty());
        }

        @Test
        @DisplayName("初始化钩子失败只影响该插件")
        void failingInitializerShouldBeIsolated() {
            moduleLoader.register("bad-init.js", new BackendInitializer() {
                @Override
                public void doInitialization(RpcProtocol rpc, PluginManagerExt pluginManager, PluginDescriptor descriptor) {
                    throw new IllegalStateException("init exploded");
                }
            });

            InitResult result = manager.init(List.of(backend("bad", "bad.js", "bad-init.js"), backend("a", "a.js"))).join();

            assertEquals(List.of("a.js"), paths(result.backendPlugins()));
            assertEquals(PluginState.LOAD_FAILED, manager.getState("bad").orElseThrow());
            List<PluginLoadResult> report = manager.getLoadReport().join();
            assertEquals(1, report.size());
            assertEquals("bad", report.get(0).pluginId());
            assertEquals("init exploded", report.get(0).error());
            assertTrue(trace.contains("LoadFailed:bad"));
        }

        @Test
        @DisplayName("初始化钩子抛出 NoClassDefFoundError 也只影响该插件")
        void linkageErrorInInitializerShouldBeIsolated() {
            moduleLoader.register("bad-init.js", new BackendInitializer() {
                @Override
                public void doInitialization(RpcProtocol rpc, PluginManagerExt pluginManager, PluginDescriptor descriptor) {
                    throw new NoClassDefFoundError("com/missing/Dep");
                }
            });

            InitResult result = assertDoesNotThrow(() ->
                    manager.init(List.of(backend("bad", "bad.js", "bad-init.js"), backend("ok", "ok.js"))).join());

            assertEquals(List.of("ok.js"), paths(result.backendPlugins()));
            assertEquals(PluginState.LOAD_FAILED, manager.getState("bad").orElseThrow());
            assertEquals("com/missing/Dep", manager.getLoadResults().get(0).error());
        }

        @Test
        @DisplayName("缺失的初始化模块按失败处理")
        void missingInitializerModuleShouldFailPlugin() {
            InitResult result = manager.init(List.of(backend("c", "c.js", "nowhere.js"))).join();

            assertTrue(result.backendPlugins().isEmpty());
            assertEquals(PluginLoadResult.Status.LOAD_FAILED, manager.getLoadResults().get(0).status());
        }

        @Test
        @DisplayName("null 描述符列表得到空结果")
        void nullDescriptorsShouldYieldEmptyResult() {
            InitResult result = manager.init(null).join();

            assertTrue(result.backendPlugins().isEmpty());
            assertTrue(result.frontendPlugins().isEmpty());
        }
    }

    // ==================== loadPlugin ====================

    @Nested
    @DisplayName("loadPlugin 加载")
    class LoadTests {

        @Test
        @DisplayName("doLoad 先于入口模块执行，入口插件收到上下文")
        void doLoadShouldRunBeforeMainModule() {
            RecordingInitializer initializer = new RecordingInitializer("c-init");
            RecordingPlugin plugin = new RecordingPlugin();
            moduleLoader.register("c-init.js", initializer).register("c.js", plugin);
            Plugin c = manager.init(List.of(backend("c", "c.js", "c-init.js"))).join().backendPlugins().get(0);
            trace.clear();

            CompletableFuture<Void> future = manager.loadPlugin(c.initPath(), c);

            assertNull(future.join());
            assertEquals(List.of(
                    "doLoad:c loaded=[c-init.js, c-init.js]",
                    "onStart:c",
                    "Loaded:c"), trace);
            assertEquals("c", plugin.context.getPluginId());
            assertSame(rpc, plugin.context.getRpc());
            assertEquals("acme", plugin.context.getProperty("publisher").orElseThrow());
            assertEquals(PluginState.LOADED, manager.getState("c").orElseThrow());
            assertEquals(1, manager.getStartedCount());
        }

        @Test
        @DisplayName("没有初始化路径时直接加载入口模块")
        void emptyContextPathShouldSkipHooks() {
            moduleLoader.register("a.js", new RecordingPlugin());
            Plugin a = manager.init(List.of(backend("a", "a.js"))).join().backendPlugins().get(0);

            manager.loadPlugin("", a).join();

            assertEquals(List.of("a.js"), moduleLoader.getLoadedPaths());
            assertTrue(manager.getLoadReport().join().get(0).succeeded());
        }

        @Test
        @DisplayName("一个插件加载失败不影响后续插件")
        void failureShouldNotAffectSiblings() {
            moduleLoader.failOn("broken.js", new IllegalStateException("cannot require"));
            moduleLoader.register("ok.js", new RecordingPlugin());
            List<Plugin> plugins = manager.init(List.of(backend("broken", "broken.js"), backend("ok", "ok.js")))
                    .join().backendPlugins();

            CompletableFuture<Void> first = manager.loadPlugin("", plugins.get(0));
            CompletableFuture<Void> second = manager.loadPlugin("", plugins.get(1));

            // 失败不会让调用失败
            assertFalse(first.isCompletedExceptionally());
            assertFalse(second.isCompletedExceptionally());
            assertEquals(PluginState.LOAD_FAILED, manager.getState("broken").orElseThrow());
            assertEquals(PluginState.LOADED, manager.getState("ok").orElseThrow());

            List<PluginLoadResult> report = manager.getLoadReport().join();
            assertEquals(List.of("broken", "ok"), report.stream().map(PluginLoadResult::pluginId).toList());
            assertEquals("cannot require", report.get(0).error());
            assertTrue(report.get(1).succeeded());
        }

        @Test
        @DisplayName("onStart 抛出异常按加载失败处理")
        void onStartFailureShouldMarkLoadFailed() {
            moduleLoader.register("crash.js", new HostedPlugin() {
                @Override
                public void onStart(PluginContext context) {
                    throw new IllegalArgumentException("bad config");
                }
            });
            Plugin crash = manager.init(List.of(backend("crash", "crash.js"))).join().backendPlugins().get(0);

            manager.loadPlugin("", crash).join();

            assertEquals(PluginState.LOAD_FAILED, manager.getState("crash").orElseThrow());
            assertTrue(trace.contains("LoadFailed:crash"));
        }

        @Test
        @DisplayName("onStart 抛出 ExceptionInInitializerError 按加载失败处理")
        void linkageErrorInOnStartShouldMarkLoadFailed() {
            moduleLoader.register("static.js", new HostedPlugin() {
                @Override
                public void onStart(PluginContext context) {
                    throw new ExceptionInInitializerError("static init failed");
                }
            });
            moduleLoader.register("ok.js", new RecordingPlugin());
            List<Plugin> plugins = manager.init(List.of(backend("static", "static.js"), backend("ok", "ok.js")))
                    .join().backendPlugins();

            CompletableFuture<Void> first = assertDoesNotThrow(() -> manager.loadPlugin("", plugins.get(0)));
            manager.loadPlugin("", plugins.get(1)).join();

            assertFalse(first.isCompletedExceptionally());
            assertEquals(PluginState.LOAD_FAILED, manager.getState("static").orElseThrow());
            assertEquals(PluginState.LOADED, manager.getState("ok").orElseThrow());
            assertEquals("static init failed", manager.getLoadResults().get(0).error());
        }

        @Test
        @DisplayName("doLoad 抛出 NoClassDefFoundError 按加载失败处理")
        void linkageErrorInDoLoadShouldMarkLoadFailed() {
            moduleLoader.register("d-init.js", new BackendInitializer() {
                @Override
                public void doInitialization(RpcProtocol rpc, PluginManagerExt pluginManager, PluginDescriptor descriptor) {
                }

                @Override
                public void doLoad(RpcProtocol rpc, Plugin plugin) {
                    throw new NoClassDefFoundError("com/missing/Hook");
                }
            }).register("d.js", new RecordingPlugin());
            Plugin d = manager.init(List.of(backend("d", "d.js", "d-init.js"))).join().backendPlugins().get(0);

            manager.loadPlugin(d.initPath(), d).join();

            assertEquals(PluginState.LOAD_FAILED, manager.getState("d").orElseThrow());
            assertEquals(0, manager.getStartedCount());
        }

        @Test
        @DisplayName("没有导出 HostedPlugin 的模块仍视为加载成功")
        void moduleWithoutExportsShouldStillLoad() {
            moduleLoader.register("plain.js");
            Plugin plain = manager.init(List.of(backend("plain", "plain.js"))).join().backendPlugins().get(0);

            manager.loadPlugin("", plain).join();

            assertEquals(PluginState.LOADED, manager.getState("plain").orElseThrow());
            assertEquals(0, manager.getStartedCount());
        }
    }

    // ==================== stop ====================

    @Nested
    @DisplayName("stop 停止")
    class StopTests {

        @Test
        @DisplayName("stop 逆序调用 onStop 并释放模块")
        void stopShouldStopPluginsInReverseOrder() {
            moduleLoader.register("a.js", new RecordingPlugin()).register("b.js", new RecordingPlugin());
            List<Plugin> plugins = manager.init(List.of(backend("a", "a.js"), backend("b", "b.js")))
                    .join().backendPlugins();
            plugins.forEach(p -> manager.loadPlugin("", p).join());
            trace.clear();

            manager.stop().join();

            assertEquals(List.of("onStop:b", "Stopped:b", "onStop:a", "Stopped:a"), trace);
            assertEquals(PluginState.STOPPED, manager.getState("a").orElseThrow());
            assertEquals(1, moduleLoader.getCloseAllCount());
            assertTrue(moduleLoader.isClosed("a.js"));
            assertEquals(0, manager.getStartedCount());
        }

        @Test
        @DisplayName("onStop 异常不影响其他插件停止")
        void onStopFailureShouldBeIsolated() {
            moduleLoader.register("bad.js", new HostedPlugin() {
                @Override
                public void onStop(PluginContext context) {
                    throw new IllegalStateException("stuck");
                }
            }).register("ok.js", new RecordingPlugin());
            List<Plugin> plugins = manager.init(List.of(backend("ok", "ok.js"), backend("bad", "bad.js")))
                    .join().backendPlugins();
            plugins.forEach(p -> manager.loadPlugin("", p).join());

            assertDoesNotThrow(() -> manager.stop().join());

            assertEquals(PluginState.STOPPED, manager.getState("ok").orElseThrow());
            assertEquals(PluginState.STOPPED, manager.getState("bad").orElseThrow());
        }
    }
}
