package com.lux032.maestro.definition;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.lux032.maestro.model.Album;
import com.lux032.maestro.model.Disc;
import com.lux032.maestro.model.Track;
import com.lux032.maestro.text.TextValue;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 专辑定义序列化, 输出格式与 {@link DefinitionLoader} 接受的格式一致
 * 只有一位艺术家时写 artist, 只有一张碟时写 tracks; 没有手动 ASCII 的文本写成普通字符串
 */
@Slf4j
public class DefinitionWriter {

    private final ObjectMapper objectMapper;
    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    public DefinitionWriter() {
        YAMLFactory factory = YAMLFactory.builder()
            .stringQuotingChecker(new YamlQuotingChecker())
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
            .enable(YAMLGenerator.Feature.LITERAL_BLOCK_STYLE)
            .build();
        this.objectMapper = new ObjectMapper(factory);
    }

    public String toYaml(Album album) throws DefinitionException {
        try {
            return objectMapper.writeValueAsString(toTree(album));
        } catch (JsonProcessingException e) {
            throw new DefinitionException("专辑定义序列化失败", null, e);
        }
    }

    public void write(Album album, Path file) throws DefinitionException {
        String yaml = toYaml(album);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, yaml);
        } catch (IOException e) {
            throw new DefinitionException("无法写入专辑定义", file, e);
        }
        log.info("专辑定义已保存: {}", file);
    }

    JsonNode toTree(Album album) {
        ObjectNode root = nodes.objectNode();
        root.set("title", text(album.getTitle()));
        putArtists(root, album.getArtists());
        if (album.getYear() != null) {
            root.put("year", album.getYear());
        }
        if (album.getGenre() != null) {
            root.set("genre", text(album.getGenre()));
        }

        if (album.numDiscs() == 1) {
            root.set("tracks", disc(album.getDiscs().get(0)));
        } else {
            ArrayNode discs = root.putArray("discs");
            for (Disc disc : album.getDiscs()) {
                discs.add(disc(disc));
            }
        }
        return root;
    }

    private ArrayNode disc(Disc disc) {
        ArrayNode tracks = nodes.arrayNode();
        for (Track track : disc.getTracks()) {
            tracks.add(track(track));
        }
        return tracks;
    }

    private JsonNode track(Track track) {
        boolean titleOnly = track.getArtists() == null && track.getYear() == null
            && track.getGenre() == null && track.getComment() == null
            && track.getLyrics() == null && track.getFilename() == null
            && !track.getTitle().hasOverriddenAscii();
        if (titleOnly) {
            return nodes.textNode(track.getTitle().value());
        }

        ObjectNode node = nodes.objectNode();
        node.set("title", text(track.getTitle()));
        if (track.getArtists() != null) {
            putArtists(node, track.getArtists());
        }
        if (track.getYear() != null) {
            node.put("year", track.getYear());
        }
        putOptional(node, "genre", track.getGenre());
        putOptional(node, "comment", track.getComment());
        putOptional(node, "lyrics", track.getLyrics());
        if (track.getFilename() != null) {
            node.put("filename", track.getFilename());
        }
        return node;
    }

    private void putArtists(ObjectNode node, List<TextValue> artists) {
        if (artists.size() == 1) {
            node.set("artist", text(artists.get(0)));
            return;
        }
        ArrayNode array = node.putArray("artists");
        for (TextValue artist : artists) {
            array.add(text(artist));
        }
    }

    private void putOptional(ObjectNode node, String field, TextValue value) {
        if (value != null) {
            node.set(field, text(value));
        }
    }

    private JsonNode text(TextValue value) {
        if (!value.hasOverriddenAscii()) {
            return nodes.textNode(value.value());
        }
        ObjectNode node = nodes.objectNode();
        node.put("text", value.value());
        node.put("ascii", value.ascii());
        return node;
    }
}
