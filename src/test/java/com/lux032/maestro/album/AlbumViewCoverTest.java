package com.lux032.maestro.album;

import com.lux032.maestro.config.MaestroConfig;
import com.lux032.maestro.image.CoverException;
import com.lux032.maestro.image.CoverLoader;
import com.lux032.maestro.image.CoverVariant;
import com.lux032.maestro.image.Image;
import com.lux032.maestro.image.ImageFormat;
import com.lux032.maestro.image.TestImages;
import com.lux032.maestro.model.Album;
import com.lux032.maestro.model.Disc;
import com.lux032.maestro.model.Track;
import com.lux032.maestro.text.TextValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class AlbumViewCoverTest {

    @TempDir
    Path root;

    private MaestroConfig config;
    private CoverLoader loader;

    @BeforeEach
    void setUp() {
        config = new MaestroConfig();
        config.setStandardCoverSize(40);
        config.setCarSafeCoverSize(20);
        loader = spy(new CoverLoader(config));
    }

    private AlbumView twoDiscAlbum() {
        Album album = new Album("Album")
            .withArtists(List.of(TextValue.of("Artist")))
            .withDiscs(List.of(
                Disc.of(new Track("Own Cover"), new Track("Plain")),
                Disc.of(new Track("Second A"), new Track("Second B"))));
        return new AlbumView(album, root, loader);
    }

    private Path image(String name) {
        return root.resolve("extras").resolve("images").resolve(name + ".png");
    }

    private List<TrackInContext> tracks(AlbumView album) {
        List<TrackInContext> tracks = new ArrayList<>();
        album.tracks().forEach(tracks::add);
        return tracks;
    }

    /**
     * 用不经过 spy 的加载器读取 (已缓存的) 封面, 用来比较结果
     */
    private Optional<Image> cached(String name) throws CoverException {
        AlbumView album = twoDiscAlbum();
        return new CoverLoader(config).load(album.imagesPath(), album.coversPath(), name, CoverVariant.STANDARD);
    }

    @Test
    void noImagesMeansNoCover() throws CoverException {
        AlbumView album = twoDiscAlbum();

        assertThat(album.disc(1).track(1).cover()).isEmpty();
        assertThat(album.disc(2).cover()).isEmpty();
        assertThat(album.cover()).isEmpty();
    }

    @Test
    void coversFallBackFromTrackToDiscToAlbum() throws Exception {
        TestImages.writePng(image("Front Cover"), 30, 30, Color.RED);
        TestImages.writePng(image("Disc 2"), 30, 30, Color.GREEN);
        TestImages.writePng(image("Own Cover"), 30, 30, Color.BLUE);
        List<TrackInContext> tracks = tracks(twoDiscAlbum());

        Optional<Image> own = tracks.get(0).cover();
        Optional<Image> plain = tracks.get(1).cover();
        Optional<Image> second = tracks.get(2).cover();

        assertThat(own).isPresent().isEqualTo(cached("Own Cover"));
        assertThat(plain).isPresent().isEqualTo(cached("Front Cover"));
        assertThat(second).isPresent().isEqualTo(cached("Disc 2"));
        assertThat(own).isNotEqualTo(plain);
    }

    @Test
    void trackCoverUsesFileSafeTitle() throws Exception {
        Album album = new Album("Album")
            .withArtists(List.of(TextValue.of("Artist")))
            .withDiscs(List.of(Disc.of(new Track("Who? Me: Yes"), new Track("Other"))));
        TestImages.writePng(image("Who Me - Yes"), 30, 30, Color.BLUE);

        AlbumView view = new AlbumView(album, root, loader);

        assertThat(view.disc(1).track(1).cover()).isPresent();
        assertThat(view.disc(1).track(2).cover()).isEmpty();
    }

    @Test
    void trackNamedLikeAlbumOrDiscCoverFallsBackToItsOwnDisc() throws Exception {
        Album album = new Album("Album")
            .withArtists(List.of(TextValue.of("Artist")))
            .withDiscs(List.of(
                Disc.of(new Track("Disc 2"), new Track("front cover")),
                Disc.of(new Track("Other"))));
        TestImages.writePng(image("Front Cover"), 30, 30, Color.RED);
        TestImages.writePng(image("Disc 2"), 30, 30, Color.GREEN);
        AlbumView view = new AlbumView(album, root, loader);

        Optional<Image> namedLikeDisc = view.disc(1).track(1).cover();
        Optional<Image> namedLikeAlbum = view.disc(1).track(2).cover();

        assertThat(namedLikeDisc).isPresent().isEqualTo(view.cover());
        assertThat(namedLikeDisc).isNotEqualTo(view.disc(2).cover());
        assertThat(namedLikeAlbum).isEqualTo(view.cover());
        verify(loader, times(1)).load(any(), any(), eq("Disc 2"), eq(CoverVariant.STANDARD));
        verify(loader, times(1)).load(any(), any(), eq("Front Cover"), eq(CoverVariant.STANDARD));
    }

    @Test
    void onlyDiscNeverHasItsOwnCover() throws Exception {
        Album album = new Album("Album")
            .withArtists(List.of(TextValue.of("Artist")))
            .withDiscs(List.of(Disc.of(new Track("Song"), new Track("Other"))));
        TestImages.writePng(image("Disc 1"), 30, 30, Color.GREEN);

        AlbumView view = new AlbumView(album, root, loader);

        assertThat(view.disc(1).cover()).isEmpty();
        assertThat(view.disc(1).track(1).cover()).isEmpty();
    }

    @Test
    void eachLookupHappensOnce() throws Exception {
        TestImages.writePng(image("Front Cover"), 30, 30, Color.RED);
        AlbumView album = twoDiscAlbum();
        List<TrackInContext> tracks = tracks(album);

        for (int i = 0; i < 2; i++) {
            for (TrackInContext track : tracks) {
                assertThat(track.cover()).isPresent();
            }
        }

        verify(loader, times(1)).load(any(), any(), eq("Front Cover"), eq(CoverVariant.STANDARD));
        verify(loader, times(1)).load(any(), any(), eq("Disc 2"), eq(CoverVariant.STANDARD));
        verify(loader, times(1)).load(any(), any(), eq("Plain"), eq(CoverVariant.STANDARD));
    }

    @Test
    void sourceImageIsConvertedOnlyOnceAcrossRuns() throws Exception {
        TestImages.writePng(image("Front Cover"), 30, 30, Color.RED);

        Optional<Image> first = twoDiscAlbum().cover();
        Files.delete(image("Front Cover"));
        Optional<Image> second = twoDiscAlbum().cover();

        assertThat(second).isPresent().isEqualTo(first);
    }

    @Test
    void carSafeCoverIsSeparateJpeg() throws Exception {
        TestImages.writePng(image("Front Cover"), 30, 30, Color.RED);
        AlbumView album = twoDiscAlbum();

        Image carSafe = album.disc(1).track(2).carSafeCover().orElseThrow();

        assertThat(carSafe.getFormat()).isEqualTo(ImageFormat.JPEG);
        assertThat(album.carSafeCoversPath().resolve("Front Cover.jpg")).exists();
        assertThat(album.coversPath()).doesNotExist();
    }

    @Test
    void failedCoverIsRememberedForEveryTrack() throws Exception {
        Files.createDirectories(image("Front Cover").getParent());
        Files.writeString(image("Front Cover"), "broken");
        AlbumView album = twoDiscAlbum();
        List<TrackInContext> tracks = tracks(album);

        Throwable first = catchThrowable(() -> tracks.get(0).cover());
        Throwable second = catchThrowable(() -> tracks.get(3).cover());

        assertThat(first).isInstanceOf(CoverException.class);
        assertThat(second).isSameAs(first);
        assertThat(((CoverException) first).getReason()).isEqualTo(CoverException.Reason.DECODE);
        verify(loader, times(1)).load(any(), any(), eq("Front Cover"), eq(CoverVariant.STANDARD));
    }

    @Test
    void parallelTracksShareAlbumCover() throws Exception {
        TestImages.writePng(image("Front Cover"), 30, 30, Color.RED);
        AlbumView album = twoDiscAlbum();
        List<TrackInContext> tracks = tracks(album);
        List<Thread> threads = new ArrayList<>();
        List<Throwable> errors = new java.util.concurrent.CopyOnWriteArrayList<>();

        for (TrackInContext track : tracks) {
            Thread thread = new Thread(() -> {
                try {
                    track.cover();
                } catch (CoverException | RuntimeException e) {
                    errors.add(e);
                }
            });
            threads.add(thread);
            thread.start();
        }
        for (Thread thread : threads) {
            thread.join();
        }

        assertThat(errors).isEmpty();
        verify(loader, times(1)).load(any(), any(), eq("Front Cover"), eq(CoverVariant.STANDARD));
    }

    @Test
    void missingImagesDirectoryIsNotAnError() throws IOException, CoverException {
        Files.createDirectories(root.resolve("extras"));

        assertThat(twoDiscAlbum().carSafeCover()).isEmpty();
    }
}
