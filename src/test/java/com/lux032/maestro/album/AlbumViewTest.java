package com.lux032.maestro.album;

import com.lux032.maestro.config.MaestroConfig;
import com.lux032.maestro.image.CoverLoader;
import com.lux032.maestro.model.Album;
import com.lux032.maestro.model.Disc;
import com.lux032.maestro.model.Track;
import com.lux032.maestro.text.TextValue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlbumViewTest {

    private static final Path ROOT = Paths.get("music", "album");
    private static final List<TextValue> ALBUM_ARTISTS = List.of(TextValue.of("a"), TextValue.withAscii("b", "c"));

    private static AlbumView view(Album album) {
        return new AlbumView(album, ROOT, new CoverLoader(new MaestroConfig()));
    }

    private static Album singleTrackAlbum(Track track) {
        return new Album("foo").withArtists(ALBUM_ARTISTS).withDiscs(List.of(Disc.of(track)));
    }

    private static Album twoDiscAlbum() {
        List<Track> second = new ArrayList<>();
        for (int i = 1; i <= 10; i++) {
            second.add(new Track("Track " + i));
        }
        return new Album("Double")
            .withArtists(List.of(TextValue.of("Band")))
            .withYear(2001)
            .withGenre(TextValue.of("Rock"))
            .withDiscs(List.of(Disc.of(new Track("One"), new Track("Two")), new Disc(second)));
    }

    @Test
    void artistsAreInheritedFromAlbum() {
        TrackInContext track = view(singleTrackAlbum(new Track("song"))).disc(1).track(1);

        assertThat(track.artists()).isEqualTo(ALBUM_ARTISTS);
        assertThat(track.artist()).isEqualTo(TextValue.withAscii("a, b", "a, c"));
        assertThat(track.albumArtists()).isEmpty();
        assertThat(track.albumArtist()).isEmpty();
    }

    @Test
    void artistsAreOverriddenByTrack() {
        Track song = new Track("song").withArtists(List.of(TextValue.of("d")));
        TrackInContext track = view(singleTrackAlbum(song)).disc(1).track(1);

        assertThat(track.artists()).containsExactly(TextValue.of("d"));
        assertThat(track.albumArtists()).contains(ALBUM_ARTISTS);
        assertThat(track.albumArtist()).contains(TextValue.withAscii("a, b", "a, c"));
    }

    @Test
    void emptyTrackArtistsFallBackToAlbum() {
        Track song = new Track("song").withArtists(List.of());
        TrackInContext track = view(singleTrackAlbum(song)).disc(1).track(1);

        assertThat(track.artists()).isEqualTo(ALBUM_ARTISTS);
    }

    @Test
    void yearAndGenreFallBackToAlbum() {
        AlbumView album = view(twoDiscAlbum().withDiscs(List.of(Disc.of(
            new Track("own").withYear(1999).withGenre(TextValue.of("Jazz")),
            new Track("inherited")))));

        TrackInContext own = album.disc(1).track(1);
        TrackInContext inherited = album.disc(1).track(2);

        assertThat(own.year()).contains(1999);
        assertThat(own.genre()).contains(TextValue.of("Jazz"));
        assertThat(inherited.year()).contains(2001);
        assertThat(inherited.genre()).contains(TextValue.of("Rock"));
        assertThat(inherited.comment()).isEmpty();
        assertThat(inherited.lyrics()).isEmpty();
    }

    @Test
    void albumAttributes() {
        AlbumView album = view(twoDiscAlbum());

        assertThat(album.title()).isEqualTo(TextValue.of("Double"));
        assertThat(album.artist()).isEqualTo(TextValue.of("Band"));
        assertThat(album.year()).contains(2001);
        assertThat(album.genre()).contains(TextValue.of("Rock"));
        assertThat(album.numDiscs()).isEqualTo(2);
        assertThat(album.numTracks()).isEqualTo(12);
    }

    @Test
    void discNumbersStartAtOne() {
        AlbumView album = view(twoDiscAlbum());

        assertThat(album.disc(2).discNumber()).isEqualTo(2);
        assertThat(album.disc(2).numTracks()).isEqualTo(10);
        assertThat(album.disc(2).track(10).title()).isEqualTo(TextValue.of("Track 10"));
        assertThatThrownBy(() -> album.disc(0)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> album.disc(3)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> album.disc(1).track(3)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void singleTrackFilenameHasNoNumber() {
        TrackInContext track = view(singleTrackAlbum(new Track("song"))).disc(1).track(1);

        assertThat(track.canonicalFilename()).isEqualTo("song.mp3");
        assertThat(track.path()).isEqualTo(ROOT.resolve("song.mp3"));
    }

    @Test
    void singleDiscHasNoFolder() {
        AlbumView album = view(twoDiscAlbum().withDiscs(List.of(Disc.of(new Track("x"), new Track("y")))));
        DiscInContext disc = album.disc(1);

        assertThat(disc.isOnlyDisc()).isTrue();
        assertThat(disc.folderName()).isEmpty();
        assertThat(disc.path()).isEqualTo(ROOT);
        assertThat(disc.track(2).canonicalPath()).isEqualTo(ROOT.resolve("2 - y.mp3"));
    }

    @Test
    void tracksOfLaterDiscsLiveInDiscFolder() {
        AlbumView album = view(twoDiscAlbum());
        TrackInContext track = album.disc(2).track(1);

        assertThat(album.disc(2).isOnlyDisc()).isFalse();
        assertThat(album.disc(2).folderName()).contains("Disc 2");
        assertThat(track.canonicalFilename()).isEqualTo("01 - Track 1.mp3");
        assertThat(track.filename()).isEqualTo("01 - Track 1.mp3");
        assertThat(track.path()).isEqualTo(ROOT.resolve("Disc 2").resolve("01 - Track 1.mp3"));
        assertThat(track.carSafeFilename()).isEqualTo("2-01 - Track 1.mp3");
    }

    @Test
    void explicitFilenameIsRelativeToAlbumRoot() {
        AlbumView album = view(twoDiscAlbum().withDiscs(List.of(
            Disc.of(new Track("a")),
            Disc.of(new Track("b").withFilename("raw/track b.mp3")))));
        TrackInContext track = album.disc(2).track(1);

        assertThat(track.filename()).isEqualTo("raw/track b.mp3");
        assertThat(track.path()).isEqualTo(ROOT.resolve("raw/track b.mp3"));
        assertThat(track.canonicalPath()).isEqualTo(ROOT.resolve("Disc 2").resolve("1 - b.mp3"));
    }

    @Test
    void tracksIterateAcrossDiscs() {
        AlbumView album = view(twoDiscAlbum().withDiscs(List.of(
            Disc.of(new Track("a"), new Track("b")),
            new Disc(List.of()),
            Disc.of(new Track("c")))));

        List<TrackInContext> tracks = new ArrayList<>();
        album.tracks().forEach(tracks::add);

        assertThat(tracks).extracting(t -> t.title().value()).containsExactly("a", "b", "c");
        assertThat(tracks).extracting(TrackInContext::discNumber).containsExactly(1, 1, 3);
        assertThat(tracks).extracting(TrackInContext::trackNumber).containsExactly(1, 2, 1);
        assertThat(tracks.get(0).disc()).isSameAs(tracks.get(1).disc());
    }

    @Test
    void emptyAlbumHasNoTracks() {
        assertThat(view(new Album("empty")).tracks()).isEmpty();
    }

    @Test
    void extrasPaths() {
        AlbumView album = view(twoDiscAlbum());

        assertThat(album.extrasPath()).isEqualTo(ROOT.resolve("extras"));
        assertThat(album.imagesPath()).isEqualTo(ROOT.resolve("extras").resolve("images"));
        assertThat(album.cachePath()).isEqualTo(ROOT.resolve("extras").resolve(".cache"));
        assertThat(album.coversPath()).isEqualTo(album.cachePath().resolve("covers"));
        assertThat(album.carSafeCoversPath()).isEqualTo(album.cachePath().resolve("covers-vw"));
        assertThat(AlbumView.definitionPath(ROOT)).isEqualTo(ROOT.resolve("extras").resolve("album.yaml"));
    }

    @Test
    void existsChecksSourceFile(@TempDir Path root) throws IOException {
        Album album = singleTrackAlbum(new Track("song"));
        AlbumView view = new AlbumView(album, root, new CoverLoader(new MaestroConfig()));
        TrackInContext track = view.disc(1).track(1);

        assertThat(track.exists()).isFalse();
        Files.writeString(root.resolve("song.mp3"), "");
        assertThat(track.exists()).isTrue();
    }
}
