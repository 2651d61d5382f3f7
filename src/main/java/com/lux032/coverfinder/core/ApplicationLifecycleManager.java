package com.lux032.coverfinder.core;

import com.lux032.coverfinder.config.RunOptions;
import com.lux032.coverfinder.config.TaggerConfig;
import com.lux032.coverfinder.model.BatchSummary;
import com.lux032.coverfinder.service.AudioFileProcessorService;
import com.lux032.coverfinder.service.BatchTaggingService;
import com.lux032.coverfinder.service.CoverArtService;
import com.lux032.coverfinder.service.HttpFetcher;
import com.lux032.coverfinder.service.ITunesSource;
import com.lux032.coverfinder.service.MetadataResolver;
import com.lux032.coverfinder.service.MusicBrainzClient;
import com.lux032.coverfinder.service.MusicBrainzSource;
import com.lux032.coverfinder.service.ResultReporter;
import com.lux032.coverfinder.service.TagWriterService;
import com.lux032.coverfinder.service.TrackMetaReader;
import com.lux032.coverfinder.tag.TagStoreFactory;
import com.lux032.coverfinder.util.FileSystemUtils;
import com.lux032.coverfinder.util.I18nUtil;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * 应用程序生命周期管理器
 * 负责创建所有服务、执行一次批处理并释放资源
 */
@Slf4j
@Getter
public class ApplicationLifecycleManager {

    private final TaggerConfig config;
    private final RunOptions options;
    private final TagStoreFactory tagStoreFactory;

    private HttpFetcher httpFetcher;
    private MusicBrainzClient musicBrainzClient;
    private CoverArtService coverArtService;
    private ITunesSource iTunesSource;
    private MusicBrainzSource musicBrainzSource;
    private MetadataResolver metadataResolver;
    private TagWriterService tagWriter;
    private AudioFileProcessorService audioFileProcessorService;
    private BatchTaggingService batchTaggingService;

    public ApplicationLifecycleManager(TaggerConfig config, RunOptions options) {
        this(config, options, TagStoreFactory.JAUDIOTAGGER);
    }

    public ApplicationLifecycleManager(TaggerConfig config, RunOptions options, TagStoreFactory tagStoreFactory) {
        this.config = config;
        this.options = options;
        this.tagStoreFactory = tagStoreFactory;
    }

    /**
     * 按依赖顺序初始化所有服务
     * @param out 结果输出流
     */
    public void initializeServices(PrintStream out) {
        log.info(I18nUtil.getMessage("app.init.services"));

        // Level 1: 网络层
        httpFetcher = new HttpFetcher(config, options.getConcurrency());

        // Level 2: 数据源
        log.info(I18nUtil.getMessage("app.init.sources"));
        musicBrainzClient = new MusicBrainzClient(config, httpFetcher);
        coverArtService = new CoverArtService(config, httpFetcher);
        iTunesSource = new ITunesSource(config, httpFetcher);
        musicBrainzSource = new MusicBrainzSource(musicBrainzClient, coverArtService);
        metadataResolver = new MetadataResolver(iTunesSource, musicBrainzSource);

        // Level 3: 写入与调度
        tagWriter = new TagWriterService(options);
        audioFileProcessorService = new AudioFileProcessorService(
            options,
            tagStoreFactory,
            new TrackMetaReader(),
            metadataResolver,
            tagWriter
        );
        batchTaggingService = new BatchTaggingService(options, audioFileProcessorService, new ResultReporter(out));

        log.info(I18nUtil.getMessage("app.all.services.ready"));
    }

    /**
     * 扫描目录并处理全部文件
     * @throws IOException 目录无法遍历
     */
    public BatchSummary run() throws IOException {
        Path directory = options.getDirectory();
        List<Path> files = FileSystemUtils.listAudioFiles(directory, options.getExtension(), options.isRecursive());
        log.info(I18nUtil.getMessage("app.scan.result"), files.size(), directory);
        return batchTaggingService.run(files);
    }

    /**
     * 停止派发新文件，并等待当前批处理结束
     */
    public void requestStop(Duration timeout) {
        if (batchTaggingService == null) {
            return;
        }
        batchTaggingService.requestStop();
        try {
            if (!batchTaggingService.awaitFinished(timeout)) {
                log.warn(I18nUtil.getMessage("app.stop.timeout"), timeout.getSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 释放网络资源
     */
    public void shutdown() {
        log.debug(I18nUtil.getMessage("app.shutting.down"));
        if (httpFetcher != null) {
            try {
                httpFetcher.close();
            } catch (IOException e) {
                log.warn(I18nUtil.getMessage("app.shutdown.http.error"), e);
            }
        }
        log.debug(I18nUtil.getMessage("app.shutdown.complete"));
    }
}
