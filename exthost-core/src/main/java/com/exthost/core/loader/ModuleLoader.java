package com.exthost.core.loader;

import com.exthost.core.exception.ModuleLoadException;

/**
 * 模块加载能力
 * 按路径把插件入口或初始化模块加载为句柄；测试可替换为内存实现
 */
public interface ModuleLoader {

    /**
     * 加载模块
     *
     * @param path 模块路径 (jar 或 class 目录)，相对路径按 pluginHome 解析
     * @return 模块句柄，同一路径多次加载返回同一句柄
     * @throws ModuleLoadException 路径不存在或模块无法加载
     */
    ModuleHandle load(String path);

    /**
     * 关闭全部已加载模块
     */
    default void closeAll() {
    }
}
