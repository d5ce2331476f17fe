package com.lux032.maestro;

import com.lux032.maestro.album.AlbumView;
import com.lux032.maestro.config.MaestroConfig;
import com.lux032.maestro.definition.DefinitionException;
import com.lux032.maestro.definition.DefinitionWriter;
import com.lux032.maestro.image.CoverLoader;
import com.lux032.maestro.service.AlbumBatchProcessor;
import com.lux032.maestro.service.AlbumGenerator;
import com.lux032.maestro.service.BatchResult;
import com.lux032.maestro.service.TagIssue;
import com.lux032.maestro.service.TagWriterService;
import com.lux032.maestro.service.TrackActionException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 专辑整理与标签工具主程序
 *
 * 用法: maestro [--folder DIR] [--dry-run] COMMAND
 * 命令:
 * - update    按定义更新曲目标签
 * - export    导出专辑 ([--format full|vw] [--root DIR | OUTPUT])
 * - validate  校验曲目标签
 * - show      打印专辑定义
 * - clear     清除曲目标签
 * - rename    把曲目文件移动到规范路径
 * - generate  根据现有 MP3 标签生成专辑定义
 */
@Slf4j
public class Main {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    // JAudioTagger 使用 java.util.logging, 默认输出过多
    private static final Logger JAUDIOTAGGER_LOGGER = Logger.getLogger("org.jaudiotagger");

    private static final String USAGE = String.join("\n",
        "用法: maestro [--folder DIR] [--dry-run] COMMAND",
        "",
        "命令:",
        "  update                               按定义更新曲目标签",
        "  export [--format full|vw] [--root DIR | OUTPUT]  导出专辑",
        "  validate                             校验曲目标签",
        "  show                                 打印专辑定义",
        "  clear                                清除曲目标签",
        "  rename                               把曲目文件移动到规范路径",
        "  generate                             根据现有 MP3 标签生成专辑定义");

    public static void main(String[] args) {
        JAUDIOTAGGER_LOGGER.setLevel(Level.WARNING);
        int code = run(args, MaestroConfig.getInstance(), System.out);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    /**
     * 解析参数并执行命令
     *
     * @return 进程退出码
     */
    static int run(String[] args, MaestroConfig config, PrintStream out) {
        Path folder = Paths.get(".");
        String command;
        String format = "full";
        Path root = config.getExportRoot() != null ? Paths.get(config.getExportRoot()) : null;
        Path output = null;

        List<String> rest = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--folder":
                    if (++i >= args.length) {
                        return usage(out, "--folder 缺少参数");
                    }
                    folder = Paths.get(args[i]);
                    break;
                case "--dry-run":
                    config.setDryRun(true);
                    break;
                case "--format":
                case "-f":
                    if (++i >= args.length) {
                        return usage(out, "--format 缺少参数");
                    }
                    format = args[i];
                    break;
                case "--root":
                    if (++i >= args.length) {
                        return usage(out, "--root 缺少参数");
                    }
                    root = Paths.get(args[i]);
                    break;
                case "--help":
                case "-h":
                    out.println(USAGE);
                    return EXIT_OK;
                default:
                    if (arg.startsWith("-")) {
                        return usage(out, "未知选项: " + arg);
                    }
                    rest.add(arg);
            }
        }

        if (rest.isEmpty()) {
            return usage(out, "缺少命令");
        }
        command = rest.get(0);
        if (rest.size() > 2 || (rest.size() == 2 && !"export".equals(command))) {
            return usage(out, "多余的参数: " + rest.get(rest.size() - 1));
        }
        if (rest.size() == 2) {
            output = Paths.get(rest.get(1));
        }

        try {
            switch (command) {
                case "update":
                case "validate":
                case "clear":
                case "rename":
                    return runTracks(command, folder, config, out);
                case "export":
                    if (!"full".equals(format) && !"vw".equals(format)) {
                        return usage(out, "无效的导出格式 \"" + format + "\"");
                    }
                    if (output == null && root == null) {
                        return usage(out, "export 需要 OUTPUT 或 --root");
                    }
                    return export(folder, config, out, "vw".equals(format), root, output);
                case "show":
                    AlbumView album = AlbumView.load(folder, new CoverLoader(config));
                    out.print(new DefinitionWriter().toYaml(album.getAlbum()));
                    return EXIT_OK;
                case "generate":
                    AlbumGenerator generator = new AlbumGenerator(new TagWriterService(config), new DefinitionWriter());
                    Path written = generator.generateAndWrite(folder);
                    out.println("专辑定义已生成: " + written);
                    return EXIT_OK;
                default:
                    return usage(out, "未知命令: " + command);
            }
        } catch (DefinitionException e) {
            log.error("无法加载专辑: {}", e.getMessage(), e);
            out.println("无法加载专辑: " + e.getMessage());
            return EXIT_FAILED;
        } catch (IOException e) {
            log.error("生成专辑定义失败", e);
            out.println("生成专辑定义失败: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    private static int runTracks(String command, Path folder, MaestroConfig config, PrintStream out)
            throws DefinitionException {
        AlbumView album = AlbumView.load(folder, new CoverLoader(config));
        TagWriterService tagWriter = new TagWriterService(config);
        AlbumBatchProcessor processor = new AlbumBatchProcessor(config);

        BatchResult result;
        switch (command) {
            case "update":
                result = processor.process(album, "更新标签", tagWriter::update);
                break;
            case "validate":
                result = processor.process(album, "校验标签", track -> {
                    List<TagIssue> issues = tagWriter.validate(track);
                    if (!issues.isEmpty()) {
                        throw new TrackActionException("标签校验未通过 " + issues, track.path());
                    }
                });
                break;
            case "clear":
                result = processor.process(album, "清除标签", tagWriter::clear);
                break;
            default:
                result = processor.process(album, "重命名", tagWriter::rename);
                break;
        }
        return report(result, out);
    }

    private static int export(Path folder, MaestroConfig config, PrintStream out, boolean carSafe,
                              Path root, Path output) throws DefinitionException {
        AlbumView album = AlbumView.load(folder, new CoverLoader(config));
        Path target = output != null ? output : defaultExportPath(root, album);
        log.info("导出目录: {}", target);

        TagWriterService tagWriter = new TagWriterService(config);
        AlbumBatchProcessor processor = new AlbumBatchProcessor(config);
        BatchResult result = carSafe
            ? processor.process(album, "车载导出", track -> tagWriter.exportCarSafe(track, target))
            : processor.process(album, "导出", track -> tagWriter.exportFull(track, target));
        return report(result, out);
    }

    /**
     * 根目录/专辑艺术家/专辑标题 (均为文件名安全形式)
     */
    static Path defaultExportPath(Path root, AlbumView album) {
        return root.resolve(album.artist().fileSafe()).resolve(album.title().fileSafe());
    }

    private static int report(BatchResult result, PrintStream out) {
        out.printf("%s: %d/%d 成功%n", result.getAction(), result.getSucceeded(), result.getTotal());
        if (result.isSuccess()) {
            return EXIT_OK;
        }
        out.println("错误:");
        for (BatchResult.TrackFailure failure : result.getFailures()) {
            out.println(failure);
        }
        return EXIT_FAILED;
    }

    private static int usage(PrintStream out, String error) {
        out.println(error);
        out.println(USAGE);
        return EXIT_USAGE;
    }
}
