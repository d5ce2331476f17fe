package com.lux032.maestro.model;

import com.lux032.maestro.text.TextValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.With;

import java.util.List;

/**
 * 专辑定义 (对应 extras/album.yaml)
 * 专辑独占它的碟片, 碟片独占它的曲目; 实体上不保存反向引用
 */
@Getter
@With
@EqualsAndHashCode
@ToString
public final class Album {

    private final TextValue title;
    private final List<TextValue> artists;
    private final Integer year;
    private final TextValue genre;
    private final List<Disc> discs;

    public Album(TextValue title, List<TextValue> artists, Integer year, TextValue genre, List<Disc> discs) {
        if (title == null) {
            throw new IllegalArgumentException("title 不能为 null");
        }
        this.title = title;
        this.artists = artists == null ? List.of() : List.copyOf(artists);
        this.year = year;
        this.genre = genre;
        this.discs = discs == null ? List.of() : List.copyOf(discs);
    }

    public Album(String title) {
        this(TextValue.of(title), List.of(), null, null, List.of());
    }

    /**
     * 专辑艺术家, 多位时用 ", " 连接
     */
    public TextValue artist() {
        return TextValue.commaSeparated(artists);
    }

    public int numDiscs() {
        return discs.size();
    }

    public int numTracks() {
        int count = 0;
        for (Disc disc : discs) {
            count += disc.numTracks();
        }
        return count;
    }
}
