package com.lux032.maestro.util;

import com.lux032.maestro.text.TextValue;

import java.util.Optional;

/**
 * 文件命名规则
 * 根据碟片/曲目位置和标题生成规范的文件夹名与文件名
 */
public final class PathNamer {

    public static final String TRACK_EXTENSION = ".mp3";

    private PathNamer() {
    }

    /**
     * 碟片文件夹名
     * 只有一张碟时返回空; 否则为 "Disc N", 编号位数与碟片总数的位数一致 (11 张碟时为 "Disc 01")
     */
    public static Optional<String> discFolderName(int discNumber, int numDiscs) {
        if (numDiscs == 1) {
            return Optional.empty();
        }
        int digits = FileNameUtils.numDigits(numDiscs);
        return Optional.of("Disc " + FileNameUtils.zeroPad(discNumber, digits));
    }

    /**
     * 规范曲目文件名
     * 单碟单曲时省略曲目编号, 否则为 "NN - 标题.mp3", 编号位数与该碟曲目总数的位数一致
     */
    public static String trackFilename(int trackNumber, int numTracks, int numDiscs, TextValue title) {
        if (numTracks == 1 && numDiscs == 1) {
            return title.fileSafe() + TRACK_EXTENSION;
        }
        int digits = FileNameUtils.numDigits(numTracks);
        return FileNameUtils.zeroPad(trackNumber, digits) + " - " + title.fileSafe() + TRACK_EXTENSION;
    }

    /**
     * 车载导出文件名 (扁平目录)
     * 单碟专辑与规范文件名相同; 多碟时为 "D-TT - 标题.mp3", 碟号和曲号各自按自身总数补零
     */
    public static String carSafeTrackFilename(int discNumber, int numDiscs,
                                              int trackNumber, int numTracks, TextValue title) {
        if (numDiscs == 1) {
            return trackFilename(trackNumber, numTracks, numDiscs, title);
        }
        int discDigits = FileNameUtils.numDigits(numDiscs);
        int trackDigits = FileNameUtils.numDigits(numTracks);
        return FileNameUtils.zeroPad(discNumber, discDigits) + "-"
            + FileNameUtils.zeroPad(trackNumber, trackDigits) + " - "
            + title.fileSafe() + TRACK_EXTENSION;
    }
}
