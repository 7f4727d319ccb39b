package org.muma.rudis.config;

import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

/**
 * 服务配置
 * 优先级: 命令行参数 > 环境变量 > 配置文件 (rudis.properties) > 默认值
 * <p>
 * 由启动入口创建后逐层注入，不做全局单例。
 */
@Getter
@Setter
public class RudisConfig {

    private static final Logger log = LoggerFactory.getLogger(RudisConfig.class);

    public static final String DEFAULT_CONFIG_FILE = "rudis.properties";

    // --- Server ---
    private String bind = "127.0.0.1";
    private int port = 6379;
    private int workerThreads = 0; // 0 = Netty default

    // --- Expire ---
    private long expireIntervalMillis = 100;

    // --- Persistence ---
    private String dir = ".";

    private boolean appendOnly = false;
    private String appendFilename = "appendonly.aof";
    private long appendFlushSeconds = 1;

    private boolean rdbEnabled = false;
    private String rdbFilename = "dump.rdb";
    private long rdbSaveIntervalSeconds = 5;

    private String configFilePath = DEFAULT_CONFIG_FILE;

    /**
     * 按优先级完成加载：先确定配置文件路径，再依次叠加文件、环境变量、命令行参数
     */
    public static RudisConfig load(String[] args, Map<String, String> env) {
        RudisConfig config = new RudisConfig();
        config.configFilePath = findConfigPath(args);
        config.loadConfig(config.configFilePath);
        config.applyEnvOverrides(env);
        config.parseArgs(args);
        log.info("Config initialized: {}", config);
        return config;
    }

    public Path getAofPath() {
        return Path.of(dir, appendFilename);
    }

    public Path getRdbPath() {
        return Path.of(dir, rdbFilename);
    }

    // --- Loading Logic ---

    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (i + 1 >= args.length) {
                log.warn("Ignoring argument without value: {}", arg);
                break;
            }
            switch (arg) {
                case "--config" -> this.configFilePath = args[++i];
                case "--port" -> this.port = parseInt("--port", args[++i]);
                case "--bind" -> this.bind = args[++i];
                case "--dir" -> this.dir = args[++i];
                case "--appendonly" -> this.appendOnly = parseBool(args[++i]);
                case "--rdb" -> this.rdbEnabled = parseBool(args[++i]);
                default -> log.warn("Unknown argument: {}", arg);
            }
        }
    }

    public void loadConfig(String path) {
        Properties props = loadProperties(path);

        // 1. Server
        this.bind = props.getProperty("server.bind", this.bind);
        this.port = getInt(props, "server.port", this.port);
        this.workerThreads = getInt(props, "server.worker_threads", this.workerThreads);

        // 2. Expire
        this.expireIntervalMillis = getLong(props, "expire.interval_ms", this.expireIntervalMillis);

        // 3. Persistence
        this.dir = props.getProperty("dir", this.dir);
        this.appendOnly = parseBool(props.getProperty("appendonly", appendOnly ? "yes" : "no"));
        this.appendFilename = props.getProperty("appendfilename", this.appendFilename);
        this.appendFlushSeconds = getLong(props, "appendflush", this.appendFlushSeconds);
        this.rdbEnabled = parseBool(props.getProperty("rdb.enabled", rdbEnabled ? "yes" : "no"));
        this.rdbFilename = props.getProperty("dbfilename", this.rdbFilename);
        this.rdbSaveIntervalSeconds = getLong(props, "rdb.save_interval", this.rdbSaveIntervalSeconds);

        validate();
    }

    void applyEnvOverrides(Map<String, String> env) {
        String envPort = env.get("RUDIS_PORT");
        if (envPort != null) {
            this.port = parseInt("RUDIS_PORT", envPort);
            log.info("Port overridden by ENV: {}", this.port);
        }
        String envDir = env.get("RUDIS_DIR");
        if (envDir != null) {
            this.dir = envDir;
            log.info("Data dir overridden by ENV: {}", this.dir);
        }
    }

    private void validate() {
        if (appendFlushSeconds <= 0) {
            throw new IllegalArgumentException("appendflush must be positive: " + appendFlushSeconds);
        }
        if (rdbSaveIntervalSeconds <= 0) {
            throw new IllegalArgumentException("rdb.save_interval must be positive: " + rdbSaveIntervalSeconds);
        }
        if (expireIntervalMillis <= 0) {
            throw new IllegalArgumentException("expire.interval_ms must be positive: " + expireIntervalMillis);
        }
    }

    private static String findConfigPath(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                return args[i + 1];
            }
        }
        return DEFAULT_CONFIG_FILE;
    }

    private Properties loadProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            if (is != null) {
                props.load(is);
                log.info("Loaded config from classpath: {}", path);
                return props;
            }
        } catch (IOException e) {
            log.error("Error loading classpath config {}", path, e);
        }

        // 不在 classpath 上则按文件系统路径加载
        try (InputStream fis = new FileInputStream(path)) {
            props.load(fis);
            log.info("Loaded config from file: {}", path);
        } catch (IOException e) {
            log.warn("Config file not found: {}, using defaults.", path);
        }
        return props;
    }

    private static boolean parseBool(String value) {
        return "yes".equalsIgnoreCase(value) || "true".equalsIgnoreCase(value);
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + name + ": " + value, e);
        }
    }

    private int getInt(Properties props, String key, int defaultValue) {
        String val = props.getProperty(key);
        return val != null ? parseInt(key, val) : defaultValue;
    }

    private long getLong(Properties props, String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + val, e);
        }
    }

    @Override
    public String toString() {
        return "Config{bind=" + bind + ", port=" + port + ", dir=" + dir
                + ", aof=" + appendOnly + "/" + appendFilename + "/" + appendFlushSeconds + "s"
                + ", rdb=" + rdbEnabled + "/" + rdbFilename + "/" + rdbSaveIntervalSeconds + "s}";
    }
}
