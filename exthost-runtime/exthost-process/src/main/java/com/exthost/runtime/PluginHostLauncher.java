package com.exthost.runtime;

import com.exthost.core.config.HostConfigLoader;
import com.exthost.core.rpc.FrameCodec;
import com.exthost.core.rpc.MessageEmitter;
import com.exthost.core.rpc.RpcProtocolImpl;
import com.exthost.core.transport.StreamTransportChannel;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 主进程侧启动器：拉起一个独立 JVM 作为插件宿主，并在其标准输入/输出上建立 RPC 连接
 */
@Slf4j
@Getter
@Builder
public class PluginHostLauncher {

    /**
     * java 可执行文件
     */
    @Builder.Default
    private final String javaExecutable = Path.of(System.getProperty("java.home"), "bin", "java").toString();

    /**
     * 宿主进程的 classpath
     */
    @Builder.Default
    private final String classpath = System.getProperty("java.class.path");

    /**
     * 宿主配置文件 (可选)，以 -Dexthost.config 传入
     */
    private final String configFile;

    @Builder.Default
    private final boolean traceFrames = false;

    @Singular
    private final List<String> jvmArgs;

    @Singular
    private final Map<String, String> systemProperties;

    /**
     * 组装启动命令
     */
    public List<String> buildCommand() {
        List<String> command = new ArrayList<>();
        command.add(javaExecutable);
        command.addAll(jvmArgs);
        systemProperties.forEach((key, value) -> command.add("-D" + key + "=" + value));
        if (configFile != null && !configFile.isBlank()) {
            command.add("-D" + HostConfigLoader.CONFIG_PROPERTY + "=" + new File(configFile).getAbsolutePath());
        }
        command.add("-cp");
        command.add(classpath);
        command.add(PluginHostProcess.class.getName());
        return command;
    }

    /**
     * 启动宿主进程并建立连接
     */
    public PluginHostConnection launch() throws IOException {
        List<String> command = buildCommand();
        log.debug("Launching plugin host: {}", command);
        Process process = new ProcessBuilder(command)
                // 宿主日志写标准错误，直接透传
                .redirectError(ProcessBuilder.Redirect.INHERIT)
                .start();

        String contextId = "MAIN->PLUGIN_HOST(" + process.pid() + ")";
        FrameCodec codec = new FrameCodec();
        MessageEmitter emitter = new MessageEmitter(contextId, codec, traceFrames);
        StreamTransportChannel channel = new StreamTransportChannel(
                contextId, process.getInputStream(), process.getOutputStream());
        channel.onFrame(emitter::fire);
        RpcProtocolImpl rpc = new RpcProtocolImpl(contextId, emitter, channel, codec, traceFrames);
        channel.start();

        log.info("[{}] Plugin host launched", contextId);
        return new PluginHostConnection(contextId, process, channel, rpc);
    }
}
