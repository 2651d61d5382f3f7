package com.lux032.coverfinder;

import com.lux032.coverfinder.config.CommandLineParser;
import com.lux032.coverfinder.config.RunOptions;
import com.lux032.coverfinder.config.TaggerConfig;
import com.lux032.coverfinder.core.ApplicationLifecycleManager;
import com.lux032.coverfinder.util.I18nUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 封面与标签补全工具主程序
 * 功能：
 * 1. 扫描目录下的音频文件
 * 2. 通过 iTunes 和 MusicBrainz / Cover Art Archive 查找封面与专辑信息
 * 3. 按写入策略更新文件的内嵌标签
 */
@Slf4j
public class Main {

    // jaudiotagger 使用 java.util.logging，保持强引用以免级别设置被回收
    private static final Logger JAUDIOTAGGER_LOGGER = Logger.getLogger("org.jaudiotagger");

    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(60);

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * @return 进程退出码：目录缺失或参数错误时为 1，其余为 0
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (CommandLineParser.isHelpRequested(args)) {
            out.println(CommandLineParser.usage());
            return 0;
        }

        RunOptions options;
        try {
            options = CommandLineParser.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("[!] " + e.getMessage());
            err.println(CommandLineParser.usage());
            return 1;
        }

        if (!Files.isDirectory(options.getDirectory())) {
            err.println("[!] Path does not exist: " + options.getDirectory());
            return 1;
        }

        // 1. 加载配置
        TaggerConfig config = TaggerConfig.load();
        I18nUtil.init(config.getLanguage());
        JAUDIOTAGGER_LOGGER.setLevel(Level.WARNING);
        log.info(I18nUtil.getMessage("app.config.loaded"), config.getLanguage());

        // 2. 创建并初始化生命周期管理器
        ApplicationLifecycleManager lifecycleManager = new ApplicationLifecycleManager(config, options);
        lifecycleManager.initializeServices(out);

        // 3. 收到终止信号时停止派发新文件
        Thread shutdownHook = new Thread(() -> lifecycleManager.requestStop(STOP_TIMEOUT), "coverfinder-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        try {
            lifecycleManager.run();
            return 0;
        } catch (IOException e) {
            log.error(I18nUtil.getMessage("main.scan.error"), options.getDirectory(), e);
            err.println("[!] Cannot scan " + options.getDirectory() + ": " + e.getMessage());
            return 1;
        } finally {
            lifecycleManager.shutdown();
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                log.debug("JVM is already shutting down");
            }
        }
    }
}
