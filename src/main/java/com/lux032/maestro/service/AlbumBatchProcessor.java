package com.lux032.maestro.service;

import com.lux032.maestro.album.AlbumView;
import com.lux032.maestro.album.TrackInContext;
import com.lux032.maestro.config.MaestroConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 专辑批量处理服务
 * 对专辑中的每个曲目执行同一个操作; 单个曲目失败不会中断其余曲目
 */
@Slf4j
public class AlbumBatchProcessor {

    /**
     * 对单个曲目执行的操作
     */
    @FunctionalInterface
    public interface TrackAction {
        void apply(TrackInContext track) throws TrackActionException;
    }

    private final MaestroConfig config;

    public AlbumBatchProcessor(MaestroConfig config) {
        this.config = config;
    }

    /**
     * 依次 (或按 batch.threads 并行) 处理专辑的全部曲目
     *
     * @param album 专辑
     * @param action 操作名称, 只用于日志
     * @param task 操作
     */
    public BatchResult process(AlbumView album, String action, TrackAction task) {
        List<TrackInContext> tracks = new ArrayList<>(album.numTracks());
        for (TrackInContext track : album.tracks()) {
            tracks.add(track);
        }

        log.info("开始{}: {} ({} 首曲目)", action, album.title(), tracks.size());
        List<BatchResult.TrackFailure> failures = config.getBatchThreads() > 1
            ? processParallel(tracks, action, task)
            : processSequential(tracks, action, task);

        log.info("========================================");
        log.info("{}完成: 成功 {} 个, 失败 {} 个", action, tracks.size() - failures.size(), failures.size());
        if (!failures.isEmpty()) {
            log.warn("失败曲目列表:");
            for (BatchResult.TrackFailure failure : failures) {
                log.warn("  - {}", failure);
            }
        }
        log.info("========================================");

        return new BatchResult(action, tracks.size(), failures);
    }

    private List<BatchResult.TrackFailure> processSequential(List<TrackInContext> tracks, String action,
                                                             TrackAction task) {
        List<BatchResult.TrackFailure> failures = new ArrayList<>();
        for (int i = 0; i < tracks.size(); i++) {
            TrackInContext track = tracks.get(i);
            log.info("{} [{}/{}]: {}", action, i + 1, tracks.size(), track.title());
            Exception error = runOne(track, task);
            if (error != null) {
                failures.add(new BatchResult.TrackFailure(track, error));
            }
        }
        return failures;
    }

    private List<BatchResult.TrackFailure> processParallel(List<TrackInContext> tracks, String action,
                                                           TrackAction task) {
        ExecutorService executor = Executors.newFixedThreadPool(config.getBatchThreads());
        try {
            List<Future<Exception>> futures = new ArrayList<>(tracks.size());
            for (TrackInContext track : tracks) {
                futures.add(executor.submit(() -> {
                    log.info("{}: {}", action, track.title());
                    return runOne(track, task);
                }));
            }

            List<BatchResult.TrackFailure> failures = new ArrayList<>();
            for (int i = 0; i < tracks.size(); i++) {
                Exception error;
                try {
                    error = futures.get(i).get();
                } catch (ExecutionException e) {
                    error = e.getCause() instanceof Exception ? (Exception) e.getCause() : e;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    error = e;
                }
                if (error != null) {
                    failures.add(new BatchResult.TrackFailure(tracks.get(i), error));
                }
            }
            return failures;
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * @return 失败原因, 成功时为 null
     */
    private Exception runOne(TrackInContext track, TrackAction task) {
        try {
            task.apply(track);
            return null;
        } catch (TrackActionException e) {
            log.error("✗ 处理失败: {} - {}", track.title(), e.getMessage());
            return e;
        } catch (RuntimeException e) {
            log.error("✗ 处理失败: {}", track.title(), e);
            return e;
        }
    }
}
