package com.exthost.core.plugin;

/**
 * 宿主内单个插件的状态
 * <p>
 * 后端：PARTITIONED_BACKEND -> INITIALIZED -> LOADED | LOAD_FAILED -> STOPPED
 * 前端：PARTITIONED_FRONTEND (本进程不执行)
 */
public enum PluginState {

    PARTITIONED_BACKEND,
    PARTITIONED_FRONTEND,
    INITIALIZED,
    LOADED,
    LOAD_FAILED,
    STOPPED
}
