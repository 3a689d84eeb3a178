package com.exthost.core.loader;

import java.util.List;

/**
 * 已加载模块
 */
public interface ModuleHandle extends AutoCloseable {

    /**
     * 解析后的模块路径
     */
    String getPath();

    /**
     * 模块导出的某类型实现，按声明顺序；同一类型多次获取返回相同实例
     */
    <T> List<T> exports(Class<T> type);

    ClassLoader getClassLoader();

    /**
     * 释放模块资源
     */
    @Override
    void close();
}
