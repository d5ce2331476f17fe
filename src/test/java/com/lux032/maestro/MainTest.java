package com.lux032.maestro;

import com.lux032.maestro.album.AlbumView;
import com.lux032.maestro.config.MaestroConfig;
import com.lux032.maestro.image.CoverLoader;
import com.lux032.maestro.model.Album;
import com.lux032.maestro.text.TextValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MainTest {

    @TempDir
    Path folder;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    private MaestroConfig config;

    @BeforeEach
    void setUp() {
        config = new MaestroConfig();
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private int run(String... args) {
        return Main.run(args, config, out);
    }

    private void writeDefinition() throws IOException {
        Path definition = AlbumView.definitionPath(folder);
        Files.createDirectories(definition.getParent());
        Files.writeString(definition, "title: Café\nartist: AC/DC\ntracks: [One, Two]\n");
    }

    @Test
    void missingCommandPrintsUsage() {
        assertThat(run()).isEqualTo(Main.EXIT_USAGE);
        assertThat(output()).contains("用法");
    }

    @Test
    void unknownCommandAndOptionAreRejected() {
        assertThat(run("dance")).isEqualTo(Main.EXIT_USAGE);
        assertThat(run("--loud", "show")).isEqualTo(Main.EXIT_USAGE);
        assertThat(run("show", "extra")).isEqualTo(Main.EXIT_USAGE);
    }

    @Test
    void exportNeedsDestination() {
        assertThat(run("--folder", folder.toString(), "export")).isEqualTo(Main.EXIT_USAGE);
        assertThat(run("--folder", folder.toString(), "export", "--format", "mp4", "out"))
            .isEqualTo(Main.EXIT_USAGE);
    }

    @Test
    void showPrintsDefinition() throws IOException {
        writeDefinition();

        assertThat(run("--folder", folder.toString(), "show")).isEqualTo(Main.EXIT_OK);
        assertThat(output()).contains("title: Café").contains("- One");
    }

    @Test
    void missingDefinitionFails() {
        assertThat(run("--folder", folder.toString(), "update")).isEqualTo(Main.EXIT_FAILED);
        assertThat(output()).contains("album.yaml");
    }

    @Test
    void trackFailuresGiveNonZeroExit() throws IOException {
        writeDefinition();

        assertThat(run("--folder", folder.toString(), "validate")).isEqualTo(Main.EXIT_FAILED);
        assertThat(output()).contains("0/2").contains("\"One\"").contains("\"Two\"");
    }

    @Test
    void dryRunRenameSucceeds() throws IOException {
        writeDefinition();

        assertThat(run("--folder", folder.toString(), "--dry-run", "rename")).isEqualTo(Main.EXIT_OK);
        assertThat(config.isDryRun()).isTrue();
    }

    @Test
    void exportToRootUsesArtistAndTitle(@TempDir Path root) throws IOException {
        writeDefinition();
        Files.writeString(folder.resolve("1 - One.mp3"), "one");
        Files.writeString(folder.resolve("2 - Two.mp3"), "two");

        assertThat(run("--folder", folder.toString(), "export", "--root", root.toString())).isEqualTo(Main.EXIT_OK);

        Path target = root.resolve("AC-DC").resolve("Cafe");
        assertThat(target.resolve("1 - One.mp3")).hasContent("one");
        assertThat(target.resolve("2 - Two.mp3")).hasContent("two");
    }

    @Test
    void defaultExportPathUsesFileSafeNames(@TempDir Path root) {
        Album album = new Album("What?").withArtists(List.of(TextValue.of("Sigur Rós")));
        AlbumView view = new AlbumView(album, folder, new CoverLoader(config));

        assertThat(Main.defaultExportPath(root, view)).isEqualTo(root.resolve("Sigur Ros").resolve("What"));
    }
}
