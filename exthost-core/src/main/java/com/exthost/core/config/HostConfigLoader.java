package com.exthost.core.config;

import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 宿主配置加载
 * 查找顺序：系统属性 exthost.config 指向的文件 -> classpath 下的 exthost.yml -> 默认值
 */
@Slf4j
public class HostConfigLoader {

    public static final String CONFIG_PROPERTY = "exthost.config";
    public static final String DEFAULT_RESOURCE = "exthost.yml";

    private HostConfigLoader() {
    }

    public static HostConfig loadDefault() {
        String location = System.getProperty(CONFIG_PROPERTY);
        if (location != null && !location.isBlank()) {
            Path path = Path.of(location);
            try (InputStream in = Files.newInputStream(path)) {
                log.info("Loading host config from {}", path.toAbsolutePath());
                return load(in);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read host config " + path, e);
            }
        }

        InputStream resource = HostConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
        if (resource != null) {
            try (InputStream in = resource) {
                return load(in);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read classpath " + DEFAULT_RESOURCE, e);
            }
        }
        return HostConfig.builder().build();
    }

    public static HostConfig load(InputStream inputStream) {
        // 只解析标准类型，不允许 YAML 实例化任意类
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(inputStream);

        HostConfig.HostConfigBuilder builder = HostConfig.builder();
        if (root == null) {
            return builder.build();
        }
        if (!(root instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Host config root must be a mapping, got " + root.getClass().getSimpleName());
        }

        // 兼容顶层包一层 exthost:
        Object nested = map.get("exthost");
        if (nested instanceof Map<?, ?> inner) {
            map = inner;
        }

        Object value;
        if ((value = map.get("contextId")) != null) builder.contextId(value.toString());
        if ((value = map.get("pluginHome")) != null) builder.pluginHome(value.toString());
        if ((value = map.get("exitOnChannelClose")) != null) builder.exitOnChannelClose(toBoolean(value));
        if ((value = map.get("stopPluginsOnClose")) != null) builder.stopPluginsOnClose(toBoolean(value));
        if ((value = map.get("traceFrames")) != null) builder.traceFrames(toBoolean(value));
        if ((value = map.get("additionalParentPackages")) != null) {
            builder.additionalParentPackages(toStringList(value));
        }
        return builder.build();
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(value.toString());
    }

    private static List<String> toStringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item != null) result.add(item.toString());
            }
        } else {
            result.add(value.toString());
        }
        return List.copyOf(result);
    }
}
