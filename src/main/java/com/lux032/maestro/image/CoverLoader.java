package com.lux032.maestro.image;

import com.lux032.maestro.config.MaestroConfig;
import lombok.extern.slf4j.Slf4j;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * 封面图片缓存服务
 * 按查找名依次探测缓存目录和原始图片目录; 原始图片命中时转换后写入缓存,
 * 之后的查找直接读取缓存文件, 不再调用编解码器
 */
@Slf4j
public class CoverLoader {

    /**
     * 按优先级排列的扩展名
     */
    static final String[] EXTENSIONS = {"png", "jpg", "jpeg"};

    private final ImageCodec codec;
    private final Map<CoverVariant, CoverTransform> transforms = new EnumMap<>(CoverVariant.class);

    public CoverLoader(ImageCodec codec, MaestroConfig config) {
        this.codec = codec;
        this.transforms.put(CoverVariant.STANDARD, CoverTransform.standard(codec, config.getStandardCoverSize()));
        this.transforms.put(CoverVariant.CAR_SAFE, CoverTransform.carSafe(codec, config.getCarSafeCoverSize()));
    }

    public CoverLoader(MaestroConfig config) {
        this(new ImageIoCodec(config.getJpegQuality()), config);
    }

    /**
     * 查找封面
     *
     * @param imagesDirectory 原始图片目录 (extras/images)
     * @param cacheDirectory 该变体的缓存目录 (extras/.cache/covers 或 covers-vw)
     * @param name 查找名 (不含扩展名)
     * @param variant 封面变体
     * @return 找到的封面; 两个目录都没有该查找名的文件时为空
     * @throws CoverException 读取、转换或写入缓存失败
     */
    public Optional<Image> load(Path imagesDirectory, Path cacheDirectory, String name, CoverVariant variant)
            throws CoverException {
        Path cached = findExisting(cacheDirectory, name);
        if (cached != null) {
            log.debug("使用缓存的封面: {}", cached);
            return Optional.of(readCached(cached));
        }

        Path source = findExisting(imagesDirectory, name);
        if (source == null) {
            log.debug("没有找到封面: {} ({})", name, variant);
            return Optional.empty();
        }

        log.info("转换封面: {} ({})", source, variant);
        Image image = transform(source, variant);
        writeCache(cacheDirectory, name, image);
        return Optional.of(image);
    }

    private static Path findExisting(Path directory, String name) {
        for (String extension : EXTENSIONS) {
            Path candidate = directory.resolve(name + "." + extension);
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private static Image readCached(Path path) throws CoverException {
        byte[] data;
        try {
            data = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new CoverException(CoverException.Reason.CACHE_READ, path, "读取缓存封面失败", e);
        }
        ImageFormat format = ImageFormat.detect(data);
        if (format == null) {
            throw new CoverException(CoverException.Reason.CACHE_READ, path, "无法识别缓存封面的格式");
        }
        if (!format.isComplete(data)) {
            throw new CoverException(CoverException.Reason.CACHE_READ, path, "缓存封面不完整, 请删除后重试");
        }
        return new Image(data, format);
    }

    private Image transform(Path source, CoverVariant variant) throws CoverException {
        byte[] raw;
        try {
            raw = Files.readAllBytes(source);
        } catch (IOException e) {
            throw new CoverException(CoverException.Reason.SOURCE_READ, source, "读取原始封面失败", e);
        }

        BufferedImage decoded;
        try {
            decoded = codec.decode(raw);
        } catch (IOException e) {
            throw new CoverException(CoverException.Reason.DECODE, source, "原始封面解码失败", e);
        }

        try {
            return transforms.get(variant).apply(decoded);
        } catch (IOException e) {
            throw new CoverException(CoverException.Reason.ENCODE, source, "封面转换失败", e);
        }
    }

    /**
     * 保存封面到缓存, 扩展名取实际输出格式
     * 先写入同目录的临时文件再移动到目标名, 缓存中不会出现写了一半的文件
     */
    private static void writeCache(Path cacheDirectory, String name, Image image) throws CoverException {
        try {
            Files.createDirectories(cacheDirectory);
        } catch (IOException e) {
            throw new CoverException(CoverException.Reason.CACHE_DIRECTORY, cacheDirectory, "创建封面缓存目录失败", e);
        }

        Path target = cacheDirectory.resolve(name + "." + image.getFormat().extension());
        Path temp = null;
        try {
            temp = Files.createTempFile(cacheDirectory, ".cover-", ".tmp");
            Files.write(temp, image.getData());
            moveIntoPlace(temp, target);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new CoverException(CoverException.Reason.CACHE_WRITE, target, "写入封面缓存失败", e);
        }
        log.info("封面已缓存到文件: {}", target);
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("删除临时缓存文件失败: {}", temp, e);
        }
    }
}
