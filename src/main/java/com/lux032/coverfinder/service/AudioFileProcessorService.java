package com.lux032.coverfinder.service;

import com.lux032.coverfinder.config.RunOptions;
import com.lux032.coverfinder.model.FileState;
import com.lux032.coverfinder.model.ResolvedRecord;
import com.lux032.coverfinder.model.TrackMeta;
import com.lux032.coverfinder.model.WorkResult;
import com.lux032.coverfinder.model.WorkStatus;
import com.lux032.coverfinder.model.WriteReport;
import com.lux032.coverfinder.tag.TagStore;
import com.lux032.coverfinder.tag.TagStoreException;
import com.lux032.coverfinder.tag.TagStoreFactory;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Optional;

/**
 * 单个文件的处理流程
 * 读取标签 -> 构建查询 -> 解析 -> 写入，各步骤都在调用线程内顺序执行
 */
@Slf4j
public class AudioFileProcessorService {

    static final String ALREADY_HAS_ART = "already has art";

    private final RunOptions options;
    private final TagStoreFactory tagStoreFactory;
    private final TrackMetaReader metaReader;
    private final MetadataResolver resolver;
    private final TagWriterService tagWriter;

    public AudioFileProcessorService(RunOptions options,
                                     TagStoreFactory tagStoreFactory,
                                     TrackMetaReader metaReader,
                                     MetadataResolver resolver,
                                     TagWriterService tagWriter) {
        this.options = options;
        this.tagStoreFactory = tagStoreFactory;
        this.metaReader = metaReader;
        this.resolver = resolver;
        this.tagWriter = tagWriter;
    }

    /**
     * 处理单个文件
     * 未命中与写入失败都以结果返回；未预期的异常由调用方兜底
     */
    public WorkResult process(Path path) {
        transition(path, FileState.NEW);

        TagStore store = null;
        String openError = null;
        try {
            store = tagStoreFactory.open(path);
        } catch (TagStoreException e) {
            openError = e.getMessage();
            log.warn("Cannot read tags of {}, using file name only: {}", path.getFileName(), openError);
        }

        TrackMeta meta = metaReader.read(path, store);
        transition(path, FileState.META_READ);
        log.debug("{}: artist='{}', album='{}', title='{}'",
            path.getFileName(), meta.getArtist(), meta.getAlbum(), meta.getTitle());

        transition(path, FileState.RESOLVING);
        Optional<ResolvedRecord> resolved = resolver.resolve(meta);
        if (resolved.isEmpty()) {
            transition(path, FileState.MISS);
            return WorkResult.miss(path);
        }
        ResolvedRecord record = resolved.get();
        transition(path, FileState.RESOLVED);

        if (store == null) {
            if (options.isDryRun()) {
                transition(path, FileState.FOUND);
                return WorkResult.builder()
                    .path(path)
                    .status(WorkStatus.FOUND)
                    .source(record.getSource())
                    .detail("tags unreadable")
                    .imageBytes(foundImageBytes(record))
                    .build();
            }
            transition(path, FileState.ERROR);
            return WorkResult.error(path, "cannot read tags: " + openError);
        }

        WriteReport report = tagWriter.apply(store, record);

        if (options.isDryRun()) {
            transition(path, FileState.FOUND);
            return toResult(path, WorkStatus.FOUND, record, report);
        }

        transition(path, report.isArtworkKept() ? FileState.WRITE_SKIPPED : FileState.WRITE_ATTEMPTED);
        if (!report.isSuccess()) {
            transition(path, FileState.ERROR);
            return WorkResult.builder()
                .path(path)
                .status(WorkStatus.ERROR)
                .source(record.getSource())
                .detail(report.getMessage())
                .fieldOutcomes(report.getFieldOutcomes())
                .build();
        }
        if (report.isArtworkKept()) {
            return toResult(path, WorkStatus.SKIP, record, report);
        }
        transition(path, FileState.OK);
        return toResult(path, WorkStatus.OK, record, report);
    }

    private static WorkResult toResult(Path path, WorkStatus status, ResolvedRecord record, WriteReport report) {
        String detail = null;
        if (report.isArtworkKept()) {
            detail = ALREADY_HAS_ART;
        } else if (!record.hasImage()) {
            detail = "no image to embed";
        }
        return WorkResult.builder()
            .path(path)
            .status(status)
            .source(record.getSource())
            .detail(detail)
            .imageBytes(status == WorkStatus.FOUND ? foundImageBytes(record) : report.getImageBytes())
            .fieldOutcomes(report.getFieldOutcomes())
            .build();
    }

    /**
     * dry-run 下报告找到的图片大小，不论是否会写入
     */
    private static int foundImageBytes(ResolvedRecord record) {
        return record.hasImage() ? record.getImageData().length : 0;
    }

    private static void transition(Path path, FileState state) {
        log.debug("[{}] {}", state, path.getFileName());
    }
}
