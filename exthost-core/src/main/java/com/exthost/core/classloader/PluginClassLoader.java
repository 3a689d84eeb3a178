package com.exthost.core.classloader;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;

/**
 * 插件模块类加载器
 * 特性：
 * 1. Child-First (优先加载模块内部类)
 * 2. 强制委派白名单 (契约包与日志门面必须走父加载器，否则宿主与插件看到的是两份不同的类)
 * 3. 资源加载 Child-First (META-INF/services 先看模块自己的)
 */
@Slf4j
public class PluginClassLoader extends URLClassLoader {

    static {
        ClassLoader.registerAsParallelCapable();
    }

    // 必须强制走父加载器的包（契约包 + JDK）
    private static final List<String> FORCE_PARENT_PACKAGES = List.of(
            "java.", "javax.", "jdk.", "sun.", "com.sun.", "org.w3c.", "org.xml.",
            "com.exthost.api.",       // 契约必须共享
            "org.slf4j.",             // 日志门面共享
            "ch.qos.logback.",
            "org.jspecify.",
            "com.fasterxml.jackson."  // 参数与结果由宿主侧的 Jackson 转换
    );

    @Getter
    private final String moduleId;

    // 可配置的额外委派包列表
    private final List<String> additionalParentPackages;

    private volatile boolean closed = false;

    public PluginClassLoader(String moduleId, URL[] urls, ClassLoader parent) {
        this(moduleId, urls, parent, Collections.emptyList());
    }

    public PluginClassLoader(String moduleId, URL[] urls, ClassLoader parent, List<String> additionalParentPackages) {
        super(urls, parent);
        this.moduleId = moduleId;
        this.additionalParentPackages = additionalParentPackages != null
                ? List.copyOf(additionalParentPackages)
                : Collections.emptyList();
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        if (closed) {
            throw new IllegalStateException("PluginClassLoader [" + moduleId + "] is closed, cannot load " + name);
        }
        synchronized (getClassLoadingLock(name)) {
            // 1. 检查缓存
            Class<?> c = findLoadedClass(name);
            if (c != null) return c;

            // 2. 白名单强制委派给父加载器
            if (shouldDelegateToParent(name)) {
                c = getParent().loadClass(name);
            }

            // 3. Child-First: 优先自己加载
            if (c == null) {
                try {
                    c = findClass(name);
                } catch (ClassNotFoundException e) {
                    log.trace("[{}] {} not found locally, delegating to parent", moduleId, name);
                }
            }

            // 4. 兜底: 自己没有，再找父加载器
            if (c == null) {
                c = super.loadClass(name, false);
            }

            if (resolve) resolveClass(c);
            return c;
        }
    }

    @Override
    public URL getResource(String name) {
        if (closed) {
            return null;
        }
        URL url = findResource(name);
        if (url != null) return url;
        return super.getResource(name);
    }

    @Override
    public Enumeration<URL> getResources(String name) throws IOException {
        if (closed) {
            return Collections.emptyEnumeration();
        }
        // 组合资源：自己的在前，父加载器的在后
        List<URL> urls = new ArrayList<>(Collections.list(findResources(name)));
        if (getParent() != null) {
            urls.addAll(Collections.list(getParent().getResources(name)));
        }
        return Collections.enumeration(urls);
    }

    private boolean shouldDelegateToParent(String name) {
        for (String pkg : FORCE_PARENT_PACKAGES) {
            if (name.startsWith(pkg)) return true;
        }
        for (String pkg : additionalParentPackages) {
            if (name.startsWith(pkg)) return true;
        }
        return false;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        super.close();
        log.debug("[{}] PluginClassLoader closed", moduleId);
    }
}
