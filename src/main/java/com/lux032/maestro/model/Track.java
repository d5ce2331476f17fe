package com.lux032.maestro.model;

import com.lux032.maestro.text.TextValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.With;

import java.util.List;

/**
 * 专辑定义中的单曲
 * 曲目编号不保存在这里, 由所在碟片中的位置决定
 */
@Getter
@With
@EqualsAndHashCode
@ToString
public final class Track {

    private final TextValue title;
    // null 表示继承专辑艺术家
    private final List<TextValue> artists;
    private final Integer year;
    private final TextValue genre;
    private final TextValue comment;
    private final TextValue lyrics;
    // 显式文件名 (相对专辑根目录), null 表示按规则生成
    private final String filename;

    public Track(TextValue title, List<TextValue> artists, Integer year, TextValue genre,
                 TextValue comment, TextValue lyrics, String filename) {
        if (title == null) {
            throw new IllegalArgumentException("title 不能为 null");
        }
        this.title = title;
        this.artists = artists == null ? null : List.copyOf(artists);
        this.year = year;
        this.genre = genre;
        this.comment = comment;
        this.lyrics = lyrics;
        this.filename = filename;
    }

    public Track(TextValue title) {
        this(title, null, null, null, null, null, null);
    }

    public Track(String title) {
        this(TextValue.of(title));
    }
}
