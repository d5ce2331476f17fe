package com.lux032.maestro.config;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * 专辑整理工具配置类
 */
@Slf4j
@Data
public class MaestroConfig {

    public static final String DEFAULT_CONFIG_FILE = "maestro.properties";

    // 封面配置
    private int standardCoverSize; // 标准封面边长
    private int carSafeCoverSize; // 车载封面边长
    private float jpegQuality; // JPEG 压缩质量

    // 批处理配置
    private int batchThreads; // 并行处理曲目的线程数, 1 表示顺序执行

    // 运行配置
    private String exportRoot; // 默认导出根目录
    private boolean dryRun; // 只打印动作, 不实际执行

    private static MaestroConfig instance;

    public MaestroConfig() {
        // 默认配置
        this.standardCoverSize = 1000;
        this.carSafeCoverSize = 300;
        this.jpegQuality = 0.9f;
        this.batchThreads = 1;
        this.exportRoot = null;
        this.dryRun = false;
    }

    /**
     * 获取配置单例 (从工作目录的 maestro.properties 加载)
     */
    public static synchronized MaestroConfig getInstance() {
        if (instance == null) {
            instance = load(Paths.get(DEFAULT_CONFIG_FILE));
        }
        return instance;
    }

    /**
     * 从指定文件加载配置, 文件不存在时使用默认配置
     */
    public static MaestroConfig load(Path file) {
        MaestroConfig config = new MaestroConfig();
        if (!Files.exists(file)) {
            log.debug("未找到配置文件 {}, 使用默认配置", file);
            return config;
        }

        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
            config.apply(props);
            log.info("配置文件加载成功: {}", file);
        } catch (IOException e) {
            log.warn("读取配置文件失败, 使用默认配置: {}", file, e);
        }
        return config;
    }

    /**
     * 应用配置项, 格式错误的数值保留默认值
     */
    void apply(Properties props) {
        if (props.containsKey("cover.standard.size")) {
            this.standardCoverSize = parsePositiveInt(props, "cover.standard.size", standardCoverSize);
        }
        if (props.containsKey("cover.carSafe.size")) {
            this.carSafeCoverSize = parsePositiveInt(props, "cover.carSafe.size", carSafeCoverSize);
        }
        if (props.containsKey("cover.jpeg.quality")) {
            try {
                float quality = Float.parseFloat(props.getProperty("cover.jpeg.quality").trim());
                if (quality > 0 && quality <= 1) {
                    this.jpegQuality = quality;
                } else {
                    log.warn("JPEG 质量超出范围 (0, 1]: {}", quality);
                }
            } catch (NumberFormatException e) {
                log.warn("JPEG 质量配置错误: {}", props.getProperty("cover.jpeg.quality"));
            }
        }
        if (props.containsKey("batch.threads")) {
            this.batchThreads = parsePositiveInt(props, "batch.threads", batchThreads);
        }
        if (props.containsKey("export.root")) {
            String root = props.getProperty("export.root").trim();
            this.exportRoot = root.isEmpty() ? null : root;
        }
        if (props.containsKey("run.dryRun")) {
            this.dryRun = Boolean.parseBoolean(props.getProperty("run.dryRun").trim());
        }
    }

    private static int parsePositiveInt(Properties props, String key, int defaultValue) {
        String raw = props.getProperty(key);
        try {
            int value = Integer.parseInt(raw.trim());
            if (value > 0) {
                return value;
            }
            log.warn("配置项 {} 必须为正数: {}", key, raw);
        } catch (NumberFormatException e) {
            log.warn("配置项 {} 格式错误: {}", key, raw);
        }
        return defaultValue;
    }
}
