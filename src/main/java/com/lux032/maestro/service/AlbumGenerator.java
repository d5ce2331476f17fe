package com.lux032.maestro.service;

import com.lux032.maestro.album.AlbumView;
import com.lux032.maestro.definition.DefinitionException;
import com.lux032.maestro.definition.DefinitionWriter;
import com.lux032.maestro.model.Album;
import com.lux032.maestro.model.Disc;
import com.lux032.maestro.model.Track;
import com.lux032.maestro.text.TextValue;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 根据文件夹中现有 MP3 的标签生成专辑定义
 *
 * 专辑级字段取所有文件中出现次数最多的值; 曲目按碟号分组, 组内按路径排序,
 * 并记录相对专辑根目录的显式文件名
 */
@Slf4j
public class AlbumGenerator {

    private final TagWriterService tagService;
    private final DefinitionWriter definitionWriter;

    public AlbumGenerator(TagWriterService tagService, DefinitionWriter definitionWriter) {
        this.tagService = tagService;
        this.definitionWriter = definitionWriter;
    }

    /**
     * 扫描文件夹生成专辑定义
     */
    public Album generate(Path folder) throws IOException {
        Path extras = folder.resolve("extras");
        List<Path> files;
        try (Stream<Path> stream = Files.walk(folder)) {
            files = stream
                .filter(Files::isRegularFile)
                .filter(p -> !p.startsWith(extras))
                .filter(p -> p.getFileName().toString().toLowerCase().endsWith(".mp3"))
                .sorted()
                .collect(Collectors.toList());
        }
        log.info("找到 {} 个 MP3 文件: {}", files.size(), folder);

        Map<Path, TrackTags> tagsByFile = new LinkedHashMap<>();
        for (Path file : files) {
            tagsByFile.put(file, tagService.readTags(file).orElse(new TrackTags()));
        }
        List<TrackTags> allTags = new ArrayList<>(tagsByFile.values());

        String title = mostFrequent(allTags, TrackTags::getAlbum).orElse("");
        String artist = mostFrequent(allTags, TrackTags::getAlbumArtist)
            .or(() -> mostFrequent(allTags, TrackTags::getArtist))
            .orElse("");
        List<TextValue> albumArtists = List.of(TextValue.of(artist));
        Integer year = mostFrequent(allTags, TrackTags::getYear).orElse(null);
        TextValue genre = mostFrequent(allTags, TrackTags::getGenre).map(TextValue::of).orElse(null);

        Map<Integer, List<Track>> discs = new TreeMap<>();
        for (Map.Entry<Path, TrackTags> entry : tagsByFile.entrySet()) {
            Path file = entry.getKey();
            TrackTags tags = entry.getValue();

            String trackTitle = tags.getTitle() != null ? tags.getTitle() : stripExtension(file);
            List<TextValue> trackArtists = null;
            if (tags.getArtist() != null && !tags.getArtist().equals(artist)) {
                trackArtists = List.of(TextValue.of(tags.getArtist()));
            }
            Integer trackYear = tags.getYear() != null && !tags.getYear().equals(year) ? tags.getYear() : null;
            TextValue trackGenre = null;
            if (tags.getGenre() != null && (genre == null || !tags.getGenre().equals(genre.value()))) {
                trackGenre = TextValue.of(tags.getGenre());
            }
            String filename = folder.relativize(file).toString().replace(File.separatorChar, '/');

            Track track = new Track(TextValue.of(trackTitle), trackArtists, trackYear, trackGenre,
                null, null, filename);
            int discNumber = tags.getDiscNumber() != null ? tags.getDiscNumber() : 1;
            discs.computeIfAbsent(discNumber, k -> new ArrayList<>()).add(track);
        }

        List<Disc> discList = new ArrayList<>();
        for (List<Track> tracks : discs.values()) {
            discList.add(new Disc(tracks));
        }

        Album album = new Album(TextValue.of(title), albumArtists, year, genre, discList);
        log.info("已生成专辑定义: {} ({} 张碟, {} 首曲目)", title, album.numDiscs(), album.numTracks());
        return album;
    }

    /**
     * 生成专辑定义并保存到 extras/album.yaml
     *
     * @return 定义文件路径
     */
    public Path generateAndWrite(Path folder) throws IOException, DefinitionException {
        Album album = generate(folder);
        Path target = AlbumView.definitionPath(folder);
        definitionWriter.write(album, target);
        return target;
    }

    /**
     * 出现次数最多的值; 次数相同时取最先出现的
     */
    static <T> Optional<T> mostFrequent(List<TrackTags> tags, Function<TrackTags, T> getter) {
        Map<T, Integer> occurrences = new LinkedHashMap<>();
        for (TrackTags t : tags) {
            T value = getter.apply(t);
            if (value != null) {
                occurrences.merge(value, 1, Integer::sum);
            }
        }

        T best = null;
        int bestCount = 0;
        for (Map.Entry<T, Integer> entry : occurrences.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return Optional.ofNullable(best);
    }

    private static String stripExtension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
