package com.lux032.maestro.service;

import com.lux032.maestro.album.TrackInContext;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * 一次批量操作的结果, 失败按曲目顺序排列
 */
@Getter
public class BatchResult {

    private final String action;
    private final int total;
    private final List<TrackFailure> failures;

    public BatchResult(String action, int total, List<TrackFailure> failures) {
        this.action = action;
        this.total = total;
        this.failures = Collections.unmodifiableList(failures);
    }

    public int getSucceeded() {
        return total - failures.size();
    }

    public boolean isSuccess() {
        return failures.isEmpty();
    }

    /**
     * 单个曲目的失败记录
     */
    @Getter
    public static class TrackFailure {
        private final TrackInContext track;
        private final Exception error;

        public TrackFailure(TrackInContext track, Exception error) {
            this.track = track;
            this.error = error;
        }

        @Override
        public String toString() {
            return "\"" + track.title().value() + "\": " + error.getMessage();
        }
    }
}
