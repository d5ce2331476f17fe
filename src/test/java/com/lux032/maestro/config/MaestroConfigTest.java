package com.lux032.maestro.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

class MaestroConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsWithoutFile() {
        MaestroConfig config = MaestroConfig.load(tempDir.resolve("missing.properties"));

        assertThat(config.getStandardCoverSize()).isEqualTo(1000);
        assertThat(config.getCarSafeCoverSize()).isEqualTo(300);
        assertThat(config.getJpegQuality()).isEqualTo(0.9f);
        assertThat(config.getBatchThreads()).isEqualTo(1);
        assertThat(config.getExportRoot()).isNull();
        assertThat(config.isDryRun()).isFalse();
    }

    @Test
    void loadsValuesFromFile() throws IOException {
        Path file = tempDir.resolve("maestro.properties");
        Files.writeString(file, String.join("\n",
            "cover.standard.size = 800",
            "cover.carSafe.size = 240",
            "cover.jpeg.quality = 0.75",
            "batch.threads = 4",
            "export.root = /media/usb",
            "run.dryRun = true"));

        MaestroConfig config = MaestroConfig.load(file);

        assertThat(config.getStandardCoverSize()).isEqualTo(800);
        assertThat(config.getCarSafeCoverSize()).isEqualTo(240);
        assertThat(config.getJpegQuality()).isEqualTo(0.75f);
        assertThat(config.getBatchThreads()).isEqualTo(4);
        assertThat(config.getExportRoot()).isEqualTo("/media/usb");
        assertThat(config.isDryRun()).isTrue();
    }

    @Test
    void invalidValuesKeepDefaults() {
        Properties props = new Properties();
        props.setProperty("cover.standard.size", "big");
        props.setProperty("cover.carSafe.size", "-5");
        props.setProperty("cover.jpeg.quality", "1.5");
        props.setProperty("batch.threads", "0");
        props.setProperty("export.root", "  ");

        MaestroConfig config = new MaestroConfig();
        config.apply(props);

        assertThat(config.getStandardCoverSize()).isEqualTo(1000);
        assertThat(config.getCarSafeCoverSize()).isEqualTo(300);
        assertThat(config.getJpegQuality()).isEqualTo(0.9f);
        assertThat(config.getBatchThreads()).isEqualTo(1);
        assertThat(config.getExportRoot()).isNull();
    }
}
