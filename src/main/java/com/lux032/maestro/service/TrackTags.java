package com.lux032.maestro.service;

import com.lux032.maestro.album.TrackInContext;
import com.lux032.maestro.image.CoverException;
import com.lux032.maestro.image.Image;
import com.lux032.maestro.text.TextValue;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.Optional;

/**
 * 写入音频文件的标签内容
 * null 表示该字段不写入 (或读取时文件中不存在)
 */
@Data
public class TrackTags {

    private String title;
    private String artist;
    private String albumArtist;
    private String album;
    private Integer trackNumber;
    private Integer discNumber; // 单碟专辑不写
    private Integer year;
    private String genre;
    private String comment;
    private String lyrics;
    private byte[] coverData;
    @EqualsAndHashCode.Exclude
    private String coverMimeType;

    /**
     * 完整标签: 原始文本 + 标准封面
     */
    public static TrackTags standard(TrackInContext track) throws CoverException {
        TrackTags tags = standardText(track);
        tags.setCover(track.cover());
        return tags;
    }

    /**
     * 完整标签中的文本部分 (不含封面)
     */
    static TrackTags standardText(TrackInContext track) {
        TrackTags tags = new TrackTags();
        tags.setTitle(track.title().value());
        if (!track.artists().isEmpty()) {
            tags.setArtist(track.artist().value());
        }
        tags.setAlbumArtist(track.albumArtist().map(TextValue::value).orElse(null));
        tags.setAlbum(track.album().title().value());
        tags.setTrackNumber(track.trackNumber());
        if (!track.disc().isOnlyDisc()) {
            tags.setDiscNumber(track.discNumber());
        }
        tags.setYear(track.year().orElse(null));
        tags.setGenre(track.genre().map(TextValue::value).orElse(null));
        tags.setComment(track.comment().map(TextValue::value).orElse(null));
        tags.setLyrics(track.lyrics().map(TextValue::value).orElse(null));
        return tags;
    }

    /**
     * 车载标签: 只用 ASCII 文本和车载封面, 不写年份、流派、备注和歌词
     */
    public static TrackTags carSafe(TrackInContext track) throws CoverException {
        TrackTags tags = new TrackTags();
        tags.setTitle(track.title().ascii());
        if (!track.artists().isEmpty()) {
            tags.setArtist(track.artist().ascii());
        }
        tags.setAlbumArtist(track.albumArtist().map(TextValue::ascii).orElse(null));
        tags.setAlbum(track.album().title().ascii());
        tags.setTrackNumber(track.trackNumber());
        if (!track.disc().isOnlyDisc()) {
            tags.setDiscNumber(track.discNumber());
        }
        tags.setCover(track.carSafeCover());
        return tags;
    }

    void setCover(Optional<Image> cover) {
        if (cover.isPresent()) {
            this.coverData = cover.get().getData();
            this.coverMimeType = cover.get().getMimeType();
        } else {
            this.coverData = null;
            this.coverMimeType = null;
        }
    }

    public boolean hasCover() {
        return coverData != null;
    }

    @Override
    public String toString() {
        return String.format("TrackTags{title='%s', artist='%s', album='%s', track=%s, disc=%s}",
            title, artist, album, trackNumber, discNumber);
    }
}
