package com.lux032.coverfinder.service;

import com.lux032.coverfinder.config.RunOptions;
import com.lux032.coverfinder.model.BatchSummary;
import com.lux032.coverfinder.model.WorkResult;
import com.lux032.coverfinder.util.I18nUtil;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 批量处理服务
 * 固定大小的线程池，同时在途的任务不超过并发数，结果按完成顺序收集
 */
@Slf4j
public class BatchTaggingService {

    private final RunOptions options;
    private final AudioFileProcessorService processor;
    private final ResultReporter reporter;
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile boolean stopRequested = false;

    public BatchTaggingService(RunOptions options, AudioFileProcessorService processor, ResultReporter reporter) {
        this.options = options;
        this.processor = processor;
        this.reporter = reporter;
    }

    /**
     * 处理全部文件并输出每个结果和最终汇总
     * 汇总总会输出，包括没有文件或中途停止的情况
     */
    public BatchSummary run(List<Path> files) {
        BatchSummary summary = new BatchSummary(files.size());
        try {
            if (files.isEmpty()) {
                reporter.noFiles(options);
                return summary;
            }
            reporter.header(options, files.size());
            dispatch(files, summary);
            return summary;
        } finally {
            reporter.summary(summary, options.isDryRun());
            log.debug("Batch finished: {}", summary);
            finished.countDown();
        }
    }

    private void dispatch(List<Path> files, BatchSummary summary) {
        int concurrency = Math.max(1, options.getConcurrency());
        ExecutorService executor = Executors.newFixedThreadPool(concurrency, new WorkerThreadFactory());
        CompletionService<WorkResult> completionService = new ExecutorCompletionService<>(executor);
        Map<Future<WorkResult>, Path> inFlight = new HashMap<>();
        Iterator<Path> pending = files.iterator();

        try {
            while (inFlight.size() < concurrency && pending.hasNext() && !stopRequested) {
                submit(completionService, inFlight, pending.next());
            }
            while (!inFlight.isEmpty()) {
                Future<WorkResult> future = completionService.take();
                Path path = inFlight.remove(future);
                WorkResult result = collect(future, path);
                summary.record(result);
                reporter.report(result);

                if (pending.hasNext() && !stopRequested) {
                    submit(completionService, inFlight, pending.next());
                }
            }
            if (stopRequested && pending.hasNext()) {
                log.warn(I18nUtil.getMessage("batch.stopped"), summary.getCompleted(), files.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn(I18nUtil.getMessage("batch.interrupted"), summary.getCompleted(), files.size());
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private void submit(CompletionService<WorkResult> completionService, Map<Future<WorkResult>, Path> inFlight, Path path) {
        Future<WorkResult> future = completionService.submit(() -> processIsolated(path));
        inFlight.put(future, path);
    }

    /**
     * 任务边界：任何逃逸的异常都转换为 ERROR，不影响其他文件
     */
    private WorkResult processIsolated(Path path) {
        try {
            return processor.process(path);
        } catch (Exception e) {
            log.warn("Unexpected failure while processing {}", path, e);
            return WorkResult.error(path, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private static WorkResult collect(Future<WorkResult> future, Path path) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Worker failed for {}", path, cause);
            return WorkResult.error(path, cause.getClass().getSimpleName() + ": " + cause.getMessage());
        }
    }

    /**
     * 停止派发新任务，已在处理中的文件会继续完成
     */
    public void requestStop() {
        if (!stopRequested) {
            stopRequested = true;
            log.info(I18nUtil.getMessage("batch.stop.requested"));
        }
    }

    /**
     * 等待 {@link #run(List)} 结束（包括汇总输出）
     * @return 超时前结束返回 true
     */
    public boolean awaitFinished(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "tagger-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
