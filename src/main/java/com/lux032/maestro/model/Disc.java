package com.lux032.maestro.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 碟片: 按顺序排列的曲目
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Disc {

    private final List<Track> tracks;

    public Disc(List<Track> tracks) {
        this.tracks = List.copyOf(tracks);
    }

    public static Disc of(Track... tracks) {
        return new Disc(List.of(tracks));
    }

    public int numTracks() {
        return tracks.size();
    }
}
