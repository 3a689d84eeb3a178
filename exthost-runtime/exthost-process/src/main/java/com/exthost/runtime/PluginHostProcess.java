package com.exthost.runtime;

import com.exthost.api.rpc.MainRpcContext;
import com.exthost.core.config.HostConfig;
import com.exthost.core.config.HostConfigLoader;
import com.exthost.core.loader.ClassLoaderModuleLoader;
import com.exthost.core.loader.ModuleLoader;
import com.exthost.core.plugin.HostedPluginManager;
import com.exthost.core.rpc.FrameCodec;
import com.exthost.core.rpc.MessageEmitter;
import com.exthost.core.rpc.RpcProtocolImpl;
import com.exthost.core.transport.StreamTransportChannel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 插件宿主进程入口
 * <p>
 * 组装顺序：传输通道 -> 消息源 -> RPC 协议引擎 -> 插件管理器，
 * 并把插件管理器注册到 HOSTED_PLUGIN_MANAGER_EXT，之后等待主进程发来 init。
 */
@Slf4j
public class PluginHostProcess {

    @Getter
    private final String contextId;
    private final HostConfig config;
    private final StreamTransportChannel channel;
    @Getter
    private final RpcProtocolImpl rpc;
    @Getter
    private final HostedPluginManager pluginManager;

    private final CountDownLatch closedLatch = new CountDownLatch(1);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private PluginHostProcess(HostConfig config, InputStream in, OutputStream out, ModuleLoader moduleLoader) {
        this.config = config;
        this.contextId = config.resolveContextId();

        FrameCodec codec = new FrameCodec();
        MessageEmitter emitter = new MessageEmitter(contextId, codec, config.isTraceFrames());
        this.channel = new StreamTransportChannel(contextId, in, out);
        channel.onFrame(emitter::fire);

        this.rpc = new RpcProtocolImpl(contextId, emitter, channel, codec, config.isTraceFrames());
        this.pluginManager = new HostedPluginManager(contextId, rpc, moduleLoader);
        rpc.set(MainRpcContext.HOSTED_PLUGIN_MANAGER_EXT, pluginManager);

        channel.onClose(this::onChannelClosed);
    }

    /**
     * 在给定的流上启动宿主 (使用默认模块加载器)
     */
    public static PluginHostProcess start(HostConfig config, InputStream in, OutputStream out) {
        ModuleLoader moduleLoader = new ClassLoaderModuleLoader(
                Path.of(config.getPluginHome()),
                PluginHostProcess.class.getClassLoader(),
                config.getAdditionalParentPackages());
        return start(config, in, out, moduleLoader);
    }

    public static PluginHostProcess start(HostConfig config, InputStream in, OutputStream out, ModuleLoader moduleLoader) {
        PluginHostProcess host = new PluginHostProcess(config, in, out, moduleLoader);
        log.info("[{}] starting instance", host.contextId);
        host.channel.start();
        return host;
    }

    private void onChannelClosed() {
        log.info("[{}] Channel to main process closed", contextId);
        if (config.isStopPluginsOnClose()) {
            shutdown();
        }
        closedLatch.countDown();
    }

    /**
     * 停止插件并关闭通道，可重复调用
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        log.info("[{}] Plugin host shutting down...", contextId);
        try {
            pluginManager.stopAll();
        } finally {
            channel.close();
        }
    }

    public void awaitClose() throws InterruptedException {
        closedLatch.await();
    }

    public boolean awaitClose(long timeout, TimeUnit unit) throws InterruptedException {
        return closedLatch.await(timeout, unit);
    }

    public boolean isRunning() {
        return channel.isOpen();
    }

    public static void main(String[] args) throws InterruptedException {
        // 标准输出是帧通道，插件的 System.out 输出改道到标准错误
        PrintStream frameOut = System.out;
        System.setOut(System.err);

        HostConfig config = HostConfigLoader.loadDefault();
        HostConfig.init(config);

        PluginHostProcess host = start(config, System.in, frameOut);
        Runtime.getRuntime().addShutdownHook(new Thread(host::shutdown, "exthost-shutdown"));

        host.awaitClose();
        log.info("[{}] Plugin host exiting", host.contextId);
        if (config.isExitOnChannelClose()) {
            System.exit(0);
        }
    }
}
