package com.trade.scalper.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;

/**
 * 配置管理器
 * 加载顺序（后者覆盖前者）：
 * 1. classpath: scalper-defaults.properties
 * 2. 工作目录: scalper.properties（可选）
 * 3. 环境变量: BYBIT_API_KEY / BYBIT_API_SECRET / BYBIT_ENV / BYBIT_ACCOUNT_TYPE / SYMBOL
 */
public class ConfigManager {

    private static final Logger logger = LoggerFactory.getLogger(ConfigManager.class);

    private static final String DEFAULTS_RESOURCE = "scalper-defaults.properties";
    private static final String CONFIG_FILE = "scalper.properties";

    /**
     * 环境变量 → 配置项
     */
    private static final Map<String, String> ENV_KEYS = Map.of(
            "BYBIT_API_KEY", "bybit.api.key",
            "BYBIT_API_SECRET", "bybit.api.secret",
            "BYBIT_ENV", "bybit.env",
            "BYBIT_ACCOUNT_TYPE", "bybit.account.type",
            "SYMBOL", "trade.symbol"
    );

    private static ConfigManager instance;
    private final Properties properties;

    private ConfigManager(Properties properties) {
        this.properties = properties;
    }

    public static synchronized ConfigManager getInstance() {
        if (instance == null) {
            instance = load(Paths.get(CONFIG_FILE), System.getenv());
        }
        return instance;
    }

    /**
     * 直接基于给定属性构造，不读取文件与环境变量
     */
    public static ConfigManager fromProperties(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        return new ConfigManager(copy);
    }

    static ConfigManager load(Path overrideFile, Map<String, String> env) {
        Properties props = new Properties();
        loadDefaults(props);
        if (overrideFile != null && Files.exists(overrideFile)) {
            try (Reader reader = Files.newBufferedReader(overrideFile, StandardCharsets.UTF_8)) {
                props.load(reader);
                logger.info("已加载配置文件: {}", overrideFile.toAbsolutePath());
            } catch (IOException e) {
                throw new IllegalStateException("无法加载配置文件: " + overrideFile, e);
            }
        }
        for (Map.Entry<String, String> entry : ENV_KEYS.entrySet()) {
            String value = env.get(entry.getKey());
            if (value != null && !value.isBlank()) {
                props.setProperty(entry.getValue(), value.trim());
            }
        }
        return new ConfigManager(props);
    }

    private static void loadDefaults(Properties props) {
        try (InputStream in = ConfigManager.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                logger.warn("未找到默认配置 {}", DEFAULTS_RESOURCE);
                return;
            }
            props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException("无法加载默认配置: " + DEFAULTS_RESOURCE, e);
        }
    }

    /**
     * 获取配置属性，缺失时抛出异常
     */
    public String getProperty(String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new IllegalStateException("配置项缺失: " + key);
        }
        return value.trim();
    }

    public String getProperty(String key, String defaultValue) {
        return hasProperty(key) ? getProperty(key) : defaultValue;
    }

    /**
     * 检查属性是否存在（空值与 YOUR_ 占位符视为不存在）
     */
    public boolean hasProperty(String key) {
        String value = properties.getProperty(key);
        return value != null && !value.trim().isEmpty() && !value.trim().startsWith("YOUR_");
    }

    public int getIntProperty(String key, int defaultValue) {
        if (!hasProperty(key)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(getProperty(key));
        } catch (NumberFormatException e) {
            throw new IllegalStateException("配置项不是整数: " + key + "=" + properties.getProperty(key), e);
        }
    }

    public long getLongProperty(String key, long defaultValue) {
        if (!hasProperty(key)) {
            return defaultValue;
        }
        try {
            return Long.parseLong(getProperty(key));
        } catch (NumberFormatException e) {
            throw new IllegalStateException("配置项不是整数: " + key + "=" + properties.getProperty(key), e);
        }
    }

    public BigDecimal getDecimalProperty(String key, BigDecimal defaultValue) {
        if (!hasProperty(key)) {
            return defaultValue;
        }
        try {
            return new BigDecimal(getProperty(key));
        } catch (NumberFormatException e) {
            throw new IllegalStateException("配置项不是数值: " + key + "=" + properties.getProperty(key), e);
        }
    }
}
