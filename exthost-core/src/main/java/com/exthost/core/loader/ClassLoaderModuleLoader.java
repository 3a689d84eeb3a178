package com.exthost.core.loader;

import com.exthost.core.classloader.PluginClassLoader;
import com.exthost.core.exception.ModuleLoadException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 默认模块加载器
 * <p>
 * 每个模块一个 child-first 的 {@link PluginClassLoader}；
 * 模块的导出 = META-INF/services 中由该模块自己的类加载器定义的实现类。
 * 句柄按规范化路径缓存。
 */
@Slf4j
public class ClassLoaderModuleLoader implements ModuleLoader {

    private final Path pluginHome;
    private final ClassLoader parent;
    private final List<String> additionalParentPackages;

    // 规范化路径 -> 句柄
    private final Map<Path, ClassLoaderModule> modules = new ConcurrentHashMap<>();

    public ClassLoaderModuleLoader(Path pluginHome) {
        this(pluginHome, ClassLoaderModuleLoader.class.getClassLoader(), Collections.emptyList());
    }

    public ClassLoaderModuleLoader(Path pluginHome, ClassLoader parent, List<String> additionalParentPackages) {
        this.pluginHome = pluginHome.toAbsolutePath().normalize();
        this.parent = parent;
        this.additionalParentPackages = additionalParentPackages;
    }

    @Override
    public ModuleHandle load(String path) {
        if (path == null || path.isBlank()) {
            throw new ModuleLoadException(String.valueOf(path), "empty module path");
        }
        Path resolved = pluginHome.resolve(path).toAbsolutePath().normalize();
        if (!Files.exists(resolved)) {
            throw new ModuleLoadException(path, "no such file " + resolved);
        }
        return modules.computeIfAbsent(resolved, this::open);
    }

    private ClassLoaderModule open(Path resolved) {
        URL url;
        try {
            url = resolved.toUri().toURL();
        } catch (MalformedURLException e) {
            throw new ModuleLoadException(resolved.toString(), "invalid location", e);
        }
        PluginClassLoader classLoader = new PluginClassLoader(
                resolved.getFileName().toString(), new URL[]{url}, parent, additionalParentPackages);
        log.debug("Opened module {}", resolved);
        return new ClassLoaderModule(resolved, classLoader);
    }

    @Override
    public void closeAll() {
        modules.values().forEach(ClassLoaderModule::close);
        modules.clear();
    }

    public int getModuleCount() {
        return modules.size();
    }

    /**
     * 基于类加载器的模块句柄
     */
    private static final class ClassLoaderModule implements ModuleHandle {

        private final Path path;
        private final PluginClassLoader classLoader;
        // 导出类型 -> 实例
        private final Map<Class<?>, List<?>> exportCache = new ConcurrentHashMap<>();

        ClassLoaderModule(Path path, PluginClassLoader classLoader) {
            this.path = path;
            this.classLoader = classLoader;
        }

        @Override
        public String getPath() {
            return path.toString();
        }

        @Override
        @SuppressWarnings("unchecked")
        public <T> List<T> exports(Class<T> type) {
            return (List<T>) exportCache.computeIfAbsent(type, t -> discover(type));
        }

        private <T> List<T> discover(Class<T> type) {
            List<T> found = new ArrayList<>();
            try {
                ServiceLoader.load(type, classLoader).stream()
                        // 只认模块自己定义的实现，父加载器可见的实现不算导出
                        .filter(provider -> provider.type().getClassLoader() == classLoader)
                        .forEach(provider -> found.add(provider.get()));
            } catch (ServiceConfigurationError e) {
                throw new ModuleLoadException(path.toString(),
                        "cannot instantiate " + type.getSimpleName() + ": " + e.getMessage(), e);
            }
            return Collections.unmodifiableList(found);
        }

        @Override
        public ClassLoader getClassLoader() {
            return classLoader;
        }

        @Override
        public void close() {
            exportCache.clear();
            try {
                classLoader.close();
            } catch (IOException e) {
                log.warn("Failed to close module {}: {}", path, e.getMessage());
            }
        }
    }
}
