package com.lux032.maestro.album;

import com.lux032.maestro.image.CoverException;
import com.lux032.maestro.image.CoverVariant;
import com.lux032.maestro.image.Image;
import com.lux032.maestro.image.LazyCover;
import com.lux032.maestro.model.Disc;
import com.lux032.maestro.model.Track;
import com.lux032.maestro.util.PathNamer;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 碟片视图: 碟片定义 + 所属专辑 + 碟片编号
 */
public class DiscInContext {

    private final AlbumView album;
    private final Disc disc;
    private final int discNumber;
    private final Map<CoverVariant, LazyCover> covers = new EnumMap<>(CoverVariant.class);

    DiscInContext(AlbumView album, Disc disc, int discNumber) {
        this.album = album;
        this.disc = disc;
        this.discNumber = discNumber;
        for (CoverVariant variant : CoverVariant.values()) {
            covers.put(variant, new LazyCover());
        }
    }

    public AlbumView album() {
        return album;
    }

    public Disc getDisc() {
        return disc;
    }

    public int discNumber() {
        return discNumber;
    }

    public int numTracks() {
        return disc.numTracks();
    }

    public boolean isOnlyDisc() {
        return album.numDiscs() == 1;
    }

    /**
     * 获取指定曲目 (从 1 开始)
     */
    public TrackInContext track(int trackNumber) {
        if (trackNumber < 1 || trackNumber > disc.numTracks()) {
            throw new IndexOutOfBoundsException("曲目编号超出范围: " + trackNumber);
        }
        return new TrackInContext(this, disc.getTracks().get(trackNumber - 1), trackNumber);
    }

    public List<TrackInContext> tracks() {
        List<TrackInContext> tracks = new ArrayList<>(disc.numTracks());
        int trackNumber = 1;
        for (Track track : disc.getTracks()) {
            tracks.add(new TrackInContext(this, track, trackNumber++));
        }
        return Collections.unmodifiableList(tracks);
    }

    /**
     * 碟片文件夹名, 单碟专辑没有
     */
    public Optional<String> folderName() {
        return PathNamer.discFolderName(discNumber, album.numDiscs());
    }

    public Path path() {
        return folderName().map(album.path()::resolve).orElse(album.path());
    }

    /**
     * 碟片封面, 查找名为碟片文件夹名; 没有自己的封面时使用专辑封面
     */
    public Optional<Image> cover(CoverVariant variant) throws CoverException {
        Optional<Image> own = covers.get(variant).get(() -> {
            Optional<String> name = folderName();
            if (name.isEmpty()) {
                return Optional.empty();
            }
            return album.coverLoader().load(album.imagesPath(), album.coversPath(variant), name.get(), variant);
        });
        if (own.isPresent()) {
            return own;
        }
        return album.cover(variant);
    }

    public Optional<Image> cover() throws CoverException {
        return cover(CoverVariant.STANDARD);
    }

    public Optional<Image> carSafeCover() throws CoverException {
        return cover(CoverVariant.CAR_SAFE);
    }

    @Override
    public String toString() {
        return "DiscInContext{" + discNumber + "/" + album.numDiscs() + "}";
    }
}
