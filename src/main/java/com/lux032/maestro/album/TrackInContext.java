package com.lux032.maestro.album;

import com.lux032.maestro.image.CoverException;
import com.lux032.maestro.image.CoverVariant;
import com.lux032.maestro.image.Image;
import com.lux032.maestro.image.LazyCover;
import com.lux032.maestro.model.Track;
import com.lux032.maestro.text.TextValue;
import com.lux032.maestro.util.PathNamer;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 曲目视图
 * 负责属性继承 (曲目 → 专辑)、编号、文件路径和封面降级 (曲目 → 碟片 → 专辑)
 */
@Slf4j
public class TrackInContext {

    private final DiscInContext disc;
    private final Track track;
    private final int trackNumber;
    private final Map<CoverVariant, LazyCover> covers = new EnumMap<>(CoverVariant.class);

    TrackInContext(DiscInContext disc, Track track, int trackNumber) {
        this.disc = disc;
        this.track = track;
        this.trackNumber = trackNumber;
        for (CoverVariant variant : CoverVariant.values()) {
            covers.put(variant, new LazyCover());
        }
    }

    public DiscInContext disc() {
        return disc;
    }

    public AlbumView album() {
        return disc.album();
    }

    public Track getTrack() {
        return track;
    }

    public int trackNumber() {
        return trackNumber;
    }

    public int discNumber() {
        return disc.discNumber();
    }

    public TextValue title() {
        return track.getTitle();
    }

    /**
     * 曲目自己的艺术家 (非空时), 否则为专辑艺术家
     * 专辑艺术家列表为空也是合法值, 不会继续降级
     */
    public List<TextValue> artists() {
        List<TextValue> own = track.getArtists();
        if (own != null && !own.isEmpty()) {
            return own;
        }
        return album().artists();
    }

    public TextValue artist() {
        return TextValue.commaSeparated(artists());
    }

    /**
     * 只有曲目艺术家与专辑艺术家不同时才返回专辑艺术家,
     * 表示需要单独写入 "专辑艺术家" 标签
     */
    public Optional<List<TextValue>> albumArtists() {
        List<TextValue> albumArtists = album().artists();
        if (artists().equals(albumArtists)) {
            return Optional.empty();
        }
        return Optional.of(albumArtists);
    }

    public Optional<TextValue> albumArtist() {
        return albumArtists().map(TextValue::commaSeparated);
    }

    public Optional<Integer> year() {
        if (track.getYear() != null) {
            return Optional.of(track.getYear());
        }
        return album().year();
    }

    public Optional<TextValue> genre() {
        if (track.getGenre() != null) {
            return Optional.of(track.getGenre());
        }
        return album().genre();
    }

    public Optional<TextValue> comment() {
        return Optional.ofNullable(track.getComment());
    }

    public Optional<TextValue> lyrics() {
        return Optional.ofNullable(track.getLyrics());
    }

    public String canonicalFilename() {
        return PathNamer.trackFilename(trackNumber, disc.numTracks(), album().numDiscs(), title());
    }

    /**
     * 源文件名: 定义中的显式文件名优先
     */
    public String filename() {
        String explicit = track.getFilename();
        return explicit != null ? explicit : canonicalFilename();
    }

    /**
     * 车载导出文件名, 总是按规则生成
     */
    public String carSafeFilename() {
        return PathNamer.carSafeTrackFilename(disc.discNumber(), album().numDiscs(),
            trackNumber, disc.numTracks(), title());
    }

    public Path canonicalPath() {
        return disc.path().resolve(canonicalFilename());
    }

    /**
     * 源文件路径
     * 显式文件名相对于专辑根目录, 生成的文件名相对于碟片目录
     */
    public Path path() {
        String explicit = track.getFilename();
        if (explicit != null) {
            return album().path().resolve(explicit);
        }
        return canonicalPath();
    }

    public boolean exists() {
        return Files.exists(path());
    }

    /**
     * 曲目封面, 查找名为标题的文件名安全形式; 没有时降级到碟片封面
     * 标题与专辑或碟片封面的查找名相同时不查找自己的封面, 直接降级
     */
    public Optional<Image> cover(CoverVariant variant) throws CoverException {
        AlbumView album = album();
        String name = title().fileSafe();
        Optional<Image> own = covers.get(variant).get(() -> {
            if (album.isAlbumOrDiscCoverName(name)) {
                log.warn("曲目标题与专辑/碟片封面同名, 使用上级封面: {}", name);
                return Optional.empty();
            }
            return album.coverLoader().load(album.imagesPath(), album.coversPath(variant), name, variant);
        });
        if (own.isPresent()) {
            return own;
        }
        return disc.cover(variant);
    }

    public Optional<Image> cover() throws CoverException {
        return cover(CoverVariant.STANDARD);
    }

    public Optional<Image> carSafeCover() throws CoverException {
        return cover(CoverVariant.CAR_SAFE);
    }

    @Override
    public String toString() {
        return "TrackInContext{" + disc.discNumber() + "-" + trackNumber + " " + title() + "}";
    }
}
