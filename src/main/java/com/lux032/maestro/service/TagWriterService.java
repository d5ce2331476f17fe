package com.lux032.maestro.service;

import com.lux032.maestro.album.TrackInContext;
import com.lux032.maestro.config.MaestroConfig;
import com.lux032.maestro.image.CoverException;
import lombok.extern.slf4j.Slf4j;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;
import org.jaudiotagger.tag.TagOptionSingleton;
import org.jaudiotagger.tag.images.Artwork;
import org.jaudiotagger.tag.images.StandardArtwork;
import org.jaudiotagger.tag.reference.PictureTypes;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 音乐标签写入服务
 * 使用 JAudioTagger 库读写曲目文件的标签, 以及导出和重命名曲目文件
 */
@Slf4j
public class TagWriterService {

    static {
        // 流派按原文写入, 不转换为 ID3 数字编号
        TagOptionSingleton.getInstance().setWriteMp3GenresAsText(true);
    }

    private final MaestroConfig config;

    public TagWriterService(MaestroConfig config) {
        this.config = config;
    }

    /**
     * 按专辑定义更新曲目标签
     * 文件中的标签已经一致时不写入
     *
     * @return 是否写入了文件
     */
    public boolean update(TrackInContext track) throws TrackActionException {
        Path path = track.path();
        TrackTags expected;
        try {
            expected = TrackTags.standard(track);
        } catch (CoverException e) {
            throw new TrackActionException("无法加载封面", path, e);
        }

        Optional<TrackTags> current = readTags(path);
        if (current.isPresent() && current.get().equals(expected)) {
            log.debug("标签已是最新: {}", path);
            return false;
        }

        if (config.isDryRun()) {
            log.info("[dry-run] 更新标签: {}", path);
            return false;
        }

        writeTags(path, expected);
        log.info("标签已更新: {}", path.getFileName());
        return true;
    }

    /**
     * 删除曲目文件中的全部标签
     */
    public void clear(TrackInContext track) throws TrackActionException {
        Path path = track.path();
        if (config.isDryRun()) {
            log.info("[dry-run] 清除标签: {}", path);
            return;
        }

        try {
            AudioFile audioFile = AudioFileIO.read(path.toFile());
            AudioFileIO.delete(audioFile);
            log.info("标签已清除: {}", path.getFileName());
        } catch (Exception e) {
            throw new TrackActionException("清除标签失败", path, e);
        }
    }

    /**
     * 比较文件中的标签与专辑定义
     *
     * @return 发现的问题, 完全一致时为空列表
     * @throws TrackActionException 无法读取文件标签
     */
    public List<TagIssue> validate(TrackInContext track) throws TrackActionException {
        Path path = track.path();
        TrackTags actual = readTags(path)
            .orElseThrow(() -> new TrackActionException("无法读取标签", path));
        TrackTags expected = TrackTags.standardText(track);

        List<TagIssue> issues = new ArrayList<>();
        compare(issues, "title", expected.getTitle(), actual.getTitle());
        compare(issues, "artist", expected.getArtist(), actual.getArtist());
        compare(issues, "track", expected.getTrackNumber(), actual.getTrackNumber());
        compare(issues, "album artist", expected.getAlbumArtist(), actual.getAlbumArtist());
        compare(issues, "disc", expected.getDiscNumber(), actual.getDiscNumber());
        compare(issues, "album", expected.getAlbum(), actual.getAlbum());
        compare(issues, "year", expected.getYear(), actual.getYear());
        compare(issues, "genre", expected.getGenre(), actual.getGenre());
        compare(issues, "comment", expected.getComment(), actual.getComment());
        compare(issues, "lyrics", expected.getLyrics(), actual.getLyrics());

        try {
            expected.setCover(track.cover());
            byte[] want = expected.getCoverData();
            byte[] have = actual.getCoverData();
            if (want == null && have != null) {
                issues.add(new TagIssue(TagIssue.Kind.UNEXPECTED, "cover"));
            } else if (want != null && have == null) {
                issues.add(new TagIssue(TagIssue.Kind.MISSING, "cover"));
            } else if (want != null && !Arrays.equals(want, have)) {
                issues.add(new TagIssue(TagIssue.Kind.INCORRECT, "cover", "..."));
            }
        } catch (CoverException e) {
            issues.add(new TagIssue(TagIssue.Kind.COVER_UNAVAILABLE, "cover", e.getMessage()));
        }

        if (!issues.isEmpty()) {
            log.warn("标签校验未通过: {} {}", path.getFileName(), issues);
        }
        return issues;
    }

    private static void compare(List<TagIssue> issues, String field, Object expected, Object actual) {
        if (expected == null && actual != null) {
            issues.add(new TagIssue(TagIssue.Kind.UNEXPECTED, field));
        } else if (expected != null && actual == null) {
            issues.add(new TagIssue(TagIssue.Kind.MISSING, field));
        } else if (!Objects.equals(expected, actual)) {
            issues.add(new TagIssue(TagIssue.Kind.INCORRECT, field, String.valueOf(actual)));
        }
    }

    /**
     * 完整导出: 复制到 输出目录/[碟片文件夹]/车载文件名, 保留原有标签
     *
     * @return 导出后的文件
     */
    public Path exportFull(TrackInContext track, Path outputDirectory) throws TrackActionException {
        Path folder = track.disc().folderName().map(outputDirectory::resolve).orElse(outputDirectory);
        Path target = folder.resolve(track.carSafeFilename());
        copy(track.path(), target);
        return target;
    }

    /**
     * 车载导出: 复制到 输出目录/车载文件名 (扁平结构), 并重写为 ASCII 标签和车载封面
     *
     * @return 导出后的文件
     */
    public Path exportCarSafe(TrackInContext track, Path outputDirectory) throws TrackActionException {
        Path target = outputDirectory.resolve(track.carSafeFilename());
        TrackTags tags;
        try {
            tags = TrackTags.carSafe(track);
        } catch (CoverException e) {
            throw new TrackActionException("无法加载车载封面", track.path(), e);
        }

        copy(track.path(), target);
        if (!config.isDryRun()) {
            writeTags(target, tags);
        }
        return target;
    }

    /**
     * 把曲目文件移动到规范路径
     *
     * @return 是否移动了文件
     */
    public boolean rename(TrackInContext track) throws TrackActionException {
        Path path = track.path();
        Path canonical = track.canonicalPath();
        if (path.equals(canonical)) {
            return false;
        }
        if (config.isDryRun()) {
            log.info("[dry-run] 重命名: {} -> {}", path, canonical);
            return false;
        }

        try {
            Path parent = canonical.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.move(path, canonical);
        } catch (IOException e) {
            throw new TrackActionException("重命名失败", path, e);
        }
        log.info("重命名: {} -> {}", path.getFileName(), canonical.getFileName());
        return true;
    }

    private void copy(Path source, Path target) throws TrackActionException {
        if (config.isDryRun()) {
            log.info("[dry-run] 复制文件: {} -> {}", source, target);
            return;
        }
        try {
            Files.createDirectories(target.toAbsolutePath().getParent());
            log.info("复制文件: {} -> {}", source.getFileName(), target);
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new TrackActionException("复制文件失败", source, e);
        }
    }

    /**
     * 用新标签整体替换文件中的标签
     */
    void writeTags(Path path, TrackTags tags) throws TrackActionException {
        try {
            AudioFile audioFile = AudioFileIO.read(path.toFile());
            Tag tag = audioFile.createDefaultTag();
            updateTags(tag, tags);
            audioFile.setTag(tag);
            audioFile.commit();
        } catch (Exception e) {
            throw new TrackActionException("写入标签失败", path, e);
        }
    }

    private void updateTags(Tag tag, TrackTags tags) throws Exception {
        setIfPresent(tag, FieldKey.TITLE, tags.getTitle());
        setIfPresent(tag, FieldKey.ARTIST, tags.getArtist());
        setIfPresent(tag, FieldKey.ALBUM_ARTIST, tags.getAlbumArtist());
        setIfPresent(tag, FieldKey.ALBUM, tags.getAlbum());
        if (tags.getTrackNumber() != null) {
            tag.setField(FieldKey.TRACK, String.valueOf(tags.getTrackNumber()));
        }
        if (tags.getDiscNumber() != null) {
            tag.setField(FieldKey.DISC_NO, String.valueOf(tags.getDiscNumber()));
        }
        if (tags.getYear() != null) {
            tag.setField(FieldKey.YEAR, String.valueOf(tags.getYear()));
        }
        setIfPresent(tag, FieldKey.GENRE, tags.getGenre());
        setIfPresent(tag, FieldKey.COMMENT, tags.getComment());
        setIfPresent(tag, FieldKey.LYRICS, tags.getLyrics());

        if (tags.hasCover()) {
            Artwork artwork = new StandardArtwork();
            artwork.setBinaryData(tags.getCoverData());
            artwork.setMimeType(tags.getCoverMimeType());
            artwork.setPictureType(PictureTypes.DEFAULT_ID);
            tag.setField(artwork);
        }
    }

    private static void setIfPresent(Tag tag, FieldKey key, String value) throws Exception {
        if (value != null) {
            tag.setField(key, value);
        }
    }

    /**
     * 读取现有标签
     *
     * @return 文件中的标签; 文件无法读取或没有标签时为空
     */
    public Optional<TrackTags> readTags(Path path) {
        try {
            AudioFile audioFile = AudioFileIO.read(path.toFile());
            Tag tag = audioFile.getTag();
            if (tag == null) {
                return Optional.empty();
            }

            TrackTags tags = new TrackTags();
            tags.setTitle(first(tag, FieldKey.TITLE));
            tags.setArtist(first(tag, FieldKey.ARTIST));
            tags.setAlbumArtist(first(tag, FieldKey.ALBUM_ARTIST));
            tags.setAlbum(first(tag, FieldKey.ALBUM));
            tags.setTrackNumber(parseNumber(first(tag, FieldKey.TRACK)));
            tags.setDiscNumber(parseNumber(first(tag, FieldKey.DISC_NO)));
            tags.setYear(parseYear(first(tag, FieldKey.YEAR)));
            tags.setGenre(first(tag, FieldKey.GENRE));
            tags.setComment(first(tag, FieldKey.COMMENT));
            tags.setLyrics(first(tag, FieldKey.LYRICS));

            Artwork artwork = tag.getFirstArtwork();
            if (artwork != null && artwork.getBinaryData() != null) {
                tags.setCoverData(artwork.getBinaryData());
                tags.setCoverMimeType(artwork.getMimeType());
            }
            return Optional.of(tags);
        } catch (Exception e) {
            log.warn("读取标签失败: {} - {}", path.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    private static String first(Tag tag, FieldKey key) {
        String value = tag.getFirst(key);
        return value == null || value.isEmpty() ? null : value;
    }

    /**
     * 解析 "3" 或 "3/12" 形式的编号
     */
    static Integer parseNumber(String raw) {
        if (raw == null) {
            return null;
        }
        String number = raw.trim();
        int slash = number.indexOf('/');
        if (slash >= 0) {
            number = number.substring(0, slash).trim();
        }
        try {
            return Integer.parseInt(number);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * 从日期字符串中提取年份 ("2001" 或 "2001-05-12")
     */
    static Integer parseYear(String raw) {
        if (raw == null || raw.length() < 4) {
            return null;
        }
        try {
            return Integer.parseInt(raw.substring(0, 4));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
