package com.lux032.maestro.definition;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.lux032.maestro.model.Album;
import com.lux032.maestro.model.Disc;
import com.lux032.maestro.model.Track;
import com.lux032.maestro.text.TextValue;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 专辑定义解析器 (YAML)
 *
 * 文本字段可以是字符串, 也可以是 {text, ascii} 对象 (手动指定 ASCII);
 * "artist" 等价于只有一个元素的 "artists", "tracks" 等价于只有一张碟的 "discs";
 * 曲目可以直接写标题 (未加引号的数字按其文本读取). 专辑中不认识的键会被忽略.
 */
@Slf4j
public class DefinitionLoader {

    private final ObjectMapper objectMapper;

    public DefinitionLoader() {
        this.objectMapper = new ObjectMapper(new YAMLFactory());
    }

    public Album load(Path file) throws DefinitionException {
        String yaml;
        try {
            yaml = Files.readString(file);
        } catch (IOException e) {
            throw new DefinitionException("无法读取专辑定义", file, e);
        }

        try {
            return parse(yaml);
        } catch (DefinitionException e) {
            throw new DefinitionException(e.getMessage(), file, e.getCause());
        }
    }

    public Album parse(String yaml) throws DefinitionException {
        JsonNode root;
        try {
            root = objectMapper.readTree(yaml);
        } catch (JsonProcessingException e) {
            throw new DefinitionException("专辑定义不是合法的 YAML: " + e.getOriginalMessage(), null, e);
        }
        if (root == null || !root.isObject()) {
            throw new DefinitionException("专辑定义必须是一个映射");
        }
        return parseAlbum(root);
    }

    private Album parseAlbum(JsonNode node) throws DefinitionException {
        TextValue title = requiredText(node, "title", "专辑");
        List<TextValue> artists = parseArtists(node, "专辑");
        if (artists == null) {
            throw new DefinitionException("专辑缺少字段 artists (或 artist)");
        }
        Integer year = parseYear(node, "专辑");
        TextValue genre = optionalText(node, "genre", "专辑");

        List<Disc> discs = new ArrayList<>();
        if (node.has("tracks")) {
            discs.add(parseDisc(node.get("tracks"), 1));
        } else if (node.has("discs")) {
            JsonNode discsNode = node.get("discs");
            if (!discsNode.isArray()) {
                throw new DefinitionException("discs 必须是列表");
            }
            int discNumber = 1;
            for (JsonNode disc : discsNode) {
                discs.add(parseDisc(disc, discNumber++));
            }
        } else {
            throw new DefinitionException("专辑缺少字段 discs (或 tracks)");
        }

        return new Album(title, artists, year, genre, discs);
    }

    private Disc parseDisc(JsonNode node, int discNumber) throws DefinitionException {
        if (!node.isArray()) {
            throw new DefinitionException("第 " + discNumber + " 张碟的曲目必须是列表");
        }
        List<Track> tracks = new ArrayList<>();
        int trackNumber = 1;
        for (JsonNode track : node) {
            tracks.add(parseTrack(track, discNumber + "-" + trackNumber++));
        }
        return new Disc(tracks);
    }

    private Track parseTrack(JsonNode node, String position) throws DefinitionException {
        String owner = "曲目 " + position;
        if (node.isValueNode() && !node.isNull()) {
            return new Track(parseText(node, owner));
        }
        if (!node.isObject()) {
            throw new DefinitionException(owner + " 必须是字符串或映射");
        }

        String filename = null;
        if (node.hasNonNull("filename")) {
            JsonNode filenameNode = node.get("filename");
            if (!filenameNode.isTextual()) {
                throw new DefinitionException(owner + " 的 filename 必须是字符串");
            }
            filename = filenameNode.asText();
        }

        return new Track(
            requiredText(node, "title", owner),
            parseArtists(node, owner),
            parseYear(node, owner),
            optionalText(node, "genre", owner),
            optionalText(node, "comment", owner),
            optionalText(node, "lyrics", owner),
            filename);
    }

    /**
     * @return 艺术家列表; 两个键都不存在时为 null
     */
    private List<TextValue> parseArtists(JsonNode node, String owner) throws DefinitionException {
        if (node.has("artist")) {
            JsonNode artist = node.get("artist");
            if (artist.isArray()) {
                throw new DefinitionException(owner + " 的 artist 只能是单个值, 多位艺术家请使用 artists");
            }
            return List.of(parseText(artist, owner + ".artist"));
        }
        if (node.has("artists")) {
            JsonNode artistsNode = node.get("artists");
            if (!artistsNode.isArray()) {
                throw new DefinitionException(owner + " 的 artists 必须是列表");
            }
            List<TextValue> artists = new ArrayList<>();
            for (JsonNode artist : artistsNode) {
                artists.add(parseText(artist, owner + ".artists"));
            }
            return artists;
        }
        return null;
    }

    private Integer parseYear(JsonNode node, String owner) throws DefinitionException {
        if (!node.hasNonNull("year")) {
            return null;
        }
        JsonNode year = node.get("year");
        if (!year.canConvertToInt() || !year.isIntegralNumber()) {
            throw new DefinitionException(owner + " 的 year 必须是整数: " + year.asText());
        }
        return year.asInt();
    }

    private TextValue requiredText(JsonNode node, String field, String owner) throws DefinitionException {
        if (!node.hasNonNull(field)) {
            throw new DefinitionException(owner + " 缺少字段 " + field);
        }
        return parseText(node.get(field), owner + "." + field);
    }

    private TextValue optionalText(JsonNode node, String field, String owner) throws DefinitionException {
        if (!node.hasNonNull(field)) {
            return null;
        }
        return parseText(node.get(field), owner + "." + field);
    }

    private TextValue parseText(JsonNode node, String field) throws DefinitionException {
        if (node.isValueNode() && !node.isNull()) {
            return TextValue.of(node.asText());
        }
        if (node.isObject()) {
            JsonNode text = node.get("text");
            if (text == null || !text.isValueNode() || text.isNull()) {
                throw new DefinitionException(field + " 缺少 text");
            }
            JsonNode ascii = node.get("ascii");
            if (ascii == null || ascii.isNull()) {
                return TextValue.of(text.asText());
            }
            return TextValue.withAscii(text.asText(), ascii.asText());
        }
        throw new DefinitionException(field + " 必须是字符串或 {text, ascii}");
    }
}
