package com.lux032.maestro.album;

import com.lux032.maestro.config.MaestroConfig;
import com.lux032.maestro.definition.DefinitionException;
import com.lux032.maestro.definition.DefinitionLoader;
import com.lux032.maestro.image.CoverException;
import com.lux032.maestro.image.CoverLoader;
import com.lux032.maestro.image.CoverVariant;
import com.lux032.maestro.image.Image;
import com.lux032.maestro.image.LazyCover;
import com.lux032.maestro.model.Album;
import com.lux032.maestro.model.Disc;
import com.lux032.maestro.text.TextValue;
import com.lux032.maestro.util.PathNamer;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * 专辑视图
 * 将专辑定义与它在磁盘上的根目录绑定, 是碟片/曲目视图的根
 *
 * 目录结构:
 * <pre>
 * 专辑根目录/
 *   extras/album.yaml          专辑定义
 *   extras/images/             原始封面
 *   extras/.cache/covers/      标准封面缓存
 *   extras/.cache/covers-vw/   车载封面缓存
 * </pre>
 */
@Slf4j
public class AlbumView {

    public static final String FRONT_COVER_NAME = "Front Cover";

    private final Album album;
    private final Path path;
    private final CoverLoader coverLoader;
    private final Map<CoverVariant, LazyCover> covers = new EnumMap<>(CoverVariant.class);

    public AlbumView(Album album, Path path, CoverLoader coverLoader) {
        this.album = album;
        this.path = path;
        this.coverLoader = coverLoader;
        for (CoverVariant variant : CoverVariant.values()) {
            covers.put(variant, new LazyCover());
        }
    }

    public AlbumView(Album album, Path path) {
        this(album, path, new CoverLoader(MaestroConfig.getInstance()));
    }

    /**
     * 从专辑根目录加载 extras/album.yaml
     */
    public static AlbumView load(Path root, CoverLoader coverLoader) throws DefinitionException {
        Album album = new DefinitionLoader().load(definitionPath(root));
        log.info("已加载专辑: {} ({} 张碟, {} 首曲目)", album.getTitle(), album.numDiscs(), album.numTracks());
        return new AlbumView(album, root, coverLoader);
    }

    public static AlbumView load(Path root) throws DefinitionException {
        return load(root, new CoverLoader(MaestroConfig.getInstance()));
    }

    public static Path definitionPath(Path root) {
        return root.resolve("extras").resolve("album.yaml");
    }

    public Album getAlbum() {
        return album;
    }

    public TextValue title() {
        return album.getTitle();
    }

    public List<TextValue> artists() {
        return album.getArtists();
    }

    public TextValue artist() {
        return album.artist();
    }

    public Optional<Integer> year() {
        return Optional.ofNullable(album.getYear());
    }

    public Optional<TextValue> genre() {
        return Optional.ofNullable(album.getGenre());
    }

    public int numDiscs() {
        return album.numDiscs();
    }

    public int numTracks() {
        return album.numTracks();
    }

    /**
     * 获取指定碟片 (从 1 开始)
     */
    public DiscInContext disc(int discNumber) {
        if (discNumber < 1 || discNumber > album.numDiscs()) {
            throw new IndexOutOfBoundsException("碟片编号超出范围: " + discNumber);
        }
        return new DiscInContext(this, album.getDiscs().get(discNumber - 1), discNumber);
    }

    public List<DiscInContext> discs() {
        List<DiscInContext> discs = new ArrayList<>(album.numDiscs());
        int discNumber = 1;
        for (Disc disc : album.getDiscs()) {
            discs.add(new DiscInContext(this, disc, discNumber++));
        }
        return Collections.unmodifiableList(discs);
    }

    /**
     * 按碟片、曲目顺序遍历所有曲目
     * 同一张碟的曲目共享同一个碟片视图
     */
    public Iterable<TrackInContext> tracks() {
        return AllTracks::new;
    }

    public Path path() {
        return path;
    }

    public Path extrasPath() {
        return path.resolve("extras");
    }

    public Path imagesPath() {
        return extrasPath().resolve("images");
    }

    public Path cachePath() {
        return extrasPath().resolve(".cache");
    }

    public Path coversPath(CoverVariant variant) {
        return cachePath().resolve(variant.cacheDirectoryName());
    }

    public Path coversPath() {
        return coversPath(CoverVariant.STANDARD);
    }

    public Path carSafeCoversPath() {
        return coversPath(CoverVariant.CAR_SAFE);
    }

    CoverLoader coverLoader() {
        return coverLoader;
    }

    /**
     * 查找名是否被专辑或碟片封面占用 ("Front Cover" 或任一碟片文件夹名, 不区分大小写)
     */
    boolean isAlbumOrDiscCoverName(String name) {
        if (FRONT_COVER_NAME.equalsIgnoreCase(name)) {
            return true;
        }
        for (int n = 1; n <= numDiscs(); n++) {
            Optional<String> folder = PathNamer.discFolderName(n, numDiscs());
            if (folder.isPresent() && folder.get().equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 专辑封面 ("Front Cover"), 是降级链的终点
     */
    public Optional<Image> cover(CoverVariant variant) throws CoverException {
        return covers.get(variant).get(
            () -> coverLoader.load(imagesPath(), coversPath(variant), FRONT_COVER_NAME, variant));
    }

    public Optional<Image> cover() throws CoverException {
        return cover(CoverVariant.STANDARD);
    }

    public Optional<Image> carSafeCover() throws CoverException {
        return cover(CoverVariant.CAR_SAFE);
    }

    @Override
    public String toString() {
        return "AlbumView{" + album.getTitle() + " @ " + path + "}";
    }

    private class AllTracks implements Iterator<TrackInContext> {

        private final Iterator<DiscInContext> discs = discs().iterator();
        private DiscInContext disc;
        private int trackNumber;

        @Override
        public boolean hasNext() {
            while (disc == null || trackNumber > disc.numTracks()) {
                if (!discs.hasNext()) {
                    return false;
                }
                disc = discs.next();
                trackNumber = 1;
            }
            return true;
        }

        @Override
        public TrackInContext next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return disc.track(trackNumber++);
        }
    }
}
