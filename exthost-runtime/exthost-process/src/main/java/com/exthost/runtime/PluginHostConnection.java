package com.exthost.runtime;

import com.exthost.core.client.HostedPluginClient;
import com.exthost.core.rpc.RpcProtocolImpl;
import com.exthost.core.transport.TransportChannel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;

/**
 * 主进程持有的宿主连接：子进程 + 通道 + RPC 引擎
 */
@Slf4j
public class PluginHostConnection implements AutoCloseable {

    private static final long EXIT_TIMEOUT_SECONDS = 5;

    @Getter
    private final String contextId;
    @Getter
    private final Process process;
    private final TransportChannel channel;
    @Getter
    private final RpcProtocolImpl rpc;
    @Getter
    private final HostedPluginClient client;

    PluginHostConnection(String contextId, Process process, TransportChannel channel, RpcProtocolImpl rpc) {
        this.contextId = contextId;
        this.process = process;
        this.channel = channel;
        this.rpc = rpc;
        this.client = new HostedPluginClient(contextId, rpc);
    }

    public boolean isAlive() {
        return process.isAlive() && channel.isOpen();
    }

    /**
     * 关闭通道；宿主读到 EOF 后自行退出，超时则强制结束
     */
    @Override
    public void close() {
        channel.close();
        try {
            if (!process.waitFor(EXIT_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("[{}] Plugin host did not exit in {}s, destroying", contextId, EXIT_TIMEOUT_SECONDS);
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
        log.info("[{}] Plugin host connection closed", contextId);
    }
}
