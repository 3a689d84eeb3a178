package com.exthost.core.config;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

/**
 * 插件宿主全局配置对象 (Immutable)
 * <p>
 * 职责：作为宿主进程的唯一配置入口，屏蔽配置来源 (YAML / 系统属性 / 代码) 的差异。
 */
@Data
@Builder
@ToString
public class HostConfig {

    private static volatile HostConfig INSTANCE;

    /**
     * 获取全局配置实例
     */
    public static HostConfig current() {
        if (INSTANCE == null) {
            // 未初始化时（比如单元测试）返回默认值
            return HostConfig.builder().build();
        }
        return INSTANCE;
    }

    /**
     * 初始化全局实例 (由启动器调用一次)
     */
    public static void init(HostConfig config) {
        INSTANCE = config;
    }

    /**
     * 清理全局配置
     * 场景：单元测试 teardown
     */
    public static void clear() {
        INSTANCE = null;
    }

    /**
     * 日志标签；为空时使用 PLUGIN_HOST(pid)
     */
    private String contextId;

    /**
     * 相对模块路径的解析根目录
     */
    @Builder.Default
    private String pluginHome = ".";

    /**
     * 主进程断开后是否退出宿主进程
     */
    @Builder.Default
    private boolean exitOnChannelClose = true;

    /**
     * 主进程断开后是否先停止已启动的插件
     */
    @Builder.Default
    private boolean stopPluginsOnClose = true;

    /**
     * 是否在 DEBUG 级别打印每一帧
     */
    @Builder.Default
    private boolean traceFrames = false;

    /**
     * 插件类加载器额外强制委派给父加载器的包前缀
     */
    @Builder.Default
    private List<String> additionalParentPackages = Collections.emptyList();

    /**
     * 解析后的日志标签
     */
    public String resolveContextId() {
        if (contextId != null && !contextId.isBlank()) {
            return contextId;
        }
        return "PLUGIN_HOST(" + ProcessHandle.current().pid() + ")";
    }
}
