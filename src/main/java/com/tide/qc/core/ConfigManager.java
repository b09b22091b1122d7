package com.tide.qc.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * 配置管理器 - 负责读取检测参数
 * 查找顺序: 工作目录/spike-detector.properties -> classpath 默认配置
 */
public class ConfigManager {

    private static final Logger logger = LoggerFactory.getLogger(ConfigManager.class);

    public static final String CONFIG_FILE = "spike-detector.properties";
    private static ConfigManager instance;
    private final Properties properties;

    private ConfigManager(Properties properties) {
        this.properties = properties;
    }

    public static synchronized ConfigManager getInstance() {
        if (instance == null) {
            instance = new ConfigManager(loadDefault());
        }
        return instance;
    }

    /**
     * 从指定文件加载配置
     */
    public static ConfigManager fromFile(Path path) {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new IllegalArgumentException("无法加载配置文件: " + path, e);
        }
        logger.info("已加载配置文件: {}", path.toAbsolutePath());
        return new ConfigManager(properties);
    }

    public static ConfigManager fromProperties(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        return new ConfigManager(copy);
    }

    /**
     * 加载默认配置
     * 工作目录没有配置文件时使用 classpath 中的默认值
     */
    private static Properties loadDefault() {
        Path configPath = Paths.get(CONFIG_FILE);
        if (Files.exists(configPath)) {
            return fromFile(configPath).properties;
        }

        Properties properties = new Properties();
        try (InputStream in = ConfigManager.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (in == null) {
                logger.warn("未找到配置文件 {}，使用内置默认参数", CONFIG_FILE);
                return properties;
            }
            properties.load(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException("无法读取默认配置: " + CONFIG_FILE, e);
        }
        return properties;
    }

    /**
     * 获取配置属性，缺失时返回默认值
     */
    public String getProperty(String key, String defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return value.trim();
    }

    /**
     * 检查属性是否存在
     */
    public boolean hasProperty(String key) {
        String value = properties.getProperty(key);
        return value != null && !value.trim().isEmpty();
    }

    /**
     * 获取整数配置
     */
    public int getIntProperty(String key, int defaultValue) {
        String value = getProperty(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("配置项不是整数: " + key + "=" + value, e);
        }
    }

    /**
     * 获取浮点配置
     */
    public double getDoubleProperty(String key, double defaultValue) {
        String value = getProperty(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("配置项不是数字: " + key + "=" + value, e);
        }
    }

    /**
     * 获取布尔配置
     */
    public boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = getProperty(key, null);
        return value == null ? defaultValue : Boolean.parseBoolean(value);
    }
}
