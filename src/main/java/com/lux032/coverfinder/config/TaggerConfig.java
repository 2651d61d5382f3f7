package com.lux032.coverfinder.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * 服务端点与调优配置
 * 启动时加载一次，之后只读，可在工作线程间共享
 */
@Slf4j
@Value
@Builder(toBuilder = true)
public class TaggerConfig {

    public static final String CONFIG_FILE = "config.properties";
    public static final String CONFIG_PROPERTY = "coverfinder.config";

    // HTTP 配置
    @Builder.Default
    String userAgent = "CoverFinder/1.0 ( contact@example.com )";
    @Builder.Default
    int timeoutSeconds = 12;
    @Builder.Default
    int maxAttempts = 3;
    @Builder.Default
    long backoffBaseMillis = 500;
    @Builder.Default
    double backoffFactor = 1.7;
    @Builder.Default
    long backoffJitterMillis = 300;
    @Builder.Default
    long backoffMaxDelayMillis = 5000;

    // iTunes Search API 配置
    @Builder.Default
    String itunesSearchUrl = "https://itunes.apple.com/search";
    @Builder.Default
    int itunesResultLimit = 5;
    @Singular
    List<Integer> itunesArtworkSizes;
    @Builder.Default
    int itunesMinImageBytes = 25_000;

    // MusicBrainz / Cover Art Archive 配置
    @Builder.Default
    String musicBrainzApiUrl = "https://musicbrainz.org/ws/2";
    @Builder.Default
    long musicBrainzRequestIntervalMillis = 1000; // MusicBrainz 要求至少1秒间隔
    @Builder.Default
    String coverArtApiUrl = "https://coverartarchive.org";
    @Builder.Default
    int coverArtMinImageBytes = 20_000;

    // HTTP 代理配置
    boolean proxyEnabled;
    String proxyHost;
    int proxyPort;

    // 国际化配置
    @Builder.Default
    String language = "en_US";

    /**
     * 封面尺寸列表为空时使用默认的 1200/1000/800/600
     */
    public List<Integer> getItunesArtworkSizes() {
        if (itunesArtworkSizes == null || itunesArtworkSizes.isEmpty()) {
            return List.of(1200, 1000, 800, 600);
        }
        return itunesArtworkSizes;
    }

    /**
     * 全部使用默认值
     */
    public static TaggerConfig defaults() {
        return TaggerConfig.builder().build();
    }

    /**
     * 从工作目录下的 config.properties 加载配置
     * 可通过 -Dcoverfinder.config=路径 指定其他文件；文件不存在时使用默认值
     */
    public static TaggerConfig load() {
        Path path = Paths.get(System.getProperty(CONFIG_PROPERTY, CONFIG_FILE));
        if (!Files.isRegularFile(path)) {
            log.debug("No configuration file at {}, using defaults", path.toAbsolutePath());
            return defaults();
        }
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(path)) {
            props.load(in);
            log.info("Loaded configuration from {}", path.toAbsolutePath());
        } catch (IOException e) {
            log.warn("Failed to read configuration file {}, using defaults: {}", path, e.getMessage());
            return defaults();
        }
        return fromProperties(props);
    }

    /**
     * 将配置项覆盖到默认值上，非法数值会被忽略并记录警告
     */
    public static TaggerConfig fromProperties(Properties props) {
        TaggerConfigBuilder builder = TaggerConfig.builder();

        if (props.containsKey("http.userAgent")) {
            builder.userAgent(props.getProperty("http.userAgent").trim());
        }
        Integer timeout = parseInt(props, "http.timeoutSeconds");
        if (timeout != null) {
            builder.timeoutSeconds(timeout);
        }
        Integer attempts = parseInt(props, "http.maxAttempts");
        if (attempts != null) {
            builder.maxAttempts(Math.max(1, attempts));
        }
        Long base = parseLong(props, "http.backoff.baseMillis");
        if (base != null) {
            builder.backoffBaseMillis(base);
        }
        Double factor = parseDouble(props, "http.backoff.factor");
        if (factor != null) {
            builder.backoffFactor(factor);
        }
        Long jitter = parseLong(props, "http.backoff.jitterMillis");
        if (jitter != null) {
            builder.backoffJitterMillis(jitter);
        }
        Long maxDelay = parseLong(props, "http.backoff.maxDelayMillis");
        if (maxDelay != null) {
            builder.backoffMaxDelayMillis(maxDelay);
        }

        if (props.containsKey("itunes.searchUrl")) {
            builder.itunesSearchUrl(props.getProperty("itunes.searchUrl").trim());
        }
        Integer limit = parseInt(props, "itunes.resultLimit");
        if (limit != null) {
            builder.itunesResultLimit(limit);
        }
        if (props.containsKey("itunes.artworkSizes")) {
            builder.itunesArtworkSizes(parseSizes(props.getProperty("itunes.artworkSizes")));
        }
        Integer itunesFloor = parseInt(props, "itunes.minImageBytes");
        if (itunesFloor != null) {
            builder.itunesMinImageBytes(itunesFloor);
        }

        if (props.containsKey("musicbrainz.apiUrl")) {
            builder.musicBrainzApiUrl(props.getProperty("musicbrainz.apiUrl").trim());
        }
        Long interval = parseLong(props, "musicbrainz.requestIntervalMillis");
        if (interval != null) {
            builder.musicBrainzRequestIntervalMillis(interval);
        }
        if (props.containsKey("coverart.apiUrl")) {
            builder.coverArtApiUrl(props.getProperty("coverart.apiUrl").trim());
        }
        Integer coverFloor = parseInt(props, "coverart.minImageBytes");
        if (coverFloor != null) {
            builder.coverArtMinImageBytes(coverFloor);
        }

        // 加载代理配置
        if (props.containsKey("proxy.enabled")) {
            builder.proxyEnabled(Boolean.parseBoolean(props.getProperty("proxy.enabled").trim()));
        }
        if (props.containsKey("proxy.host")) {
            builder.proxyHost(props.getProperty("proxy.host").trim());
        }
        Integer proxyPort = parseInt(props, "proxy.port");
        if (proxyPort != null) {
            builder.proxyPort(proxyPort);
        }

        // 加载国际化配置
        if (props.containsKey("i18n.language")) {
            builder.language(props.getProperty("i18n.language").trim());
        }

        return builder.build();
    }

    private static List<Integer> parseSizes(String value) {
        List<Integer> sizes = new ArrayList<>();
        for (String part : value.split(",")) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                sizes.add(Integer.parseInt(trimmed));
            } catch (NumberFormatException e) {
                log.warn("Invalid artwork size in itunes.artworkSizes: {}", trimmed);
            }
        }
        return sizes;
    }

    private static Integer parseInt(Properties props, String key) {
        if (!props.containsKey(key)) {
            return null;
        }
        try {
            return Integer.parseInt(props.getProperty(key).trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid {} configuration: {}", key, props.getProperty(key));
            return null;
        }
    }

    private static Long parseLong(Properties props, String key) {
        if (!props.containsKey(key)) {
            return null;
        }
        try {
            return Long.parseLong(props.getProperty(key).trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid {} configuration: {}", key, props.getProperty(key));
            return null;
        }
    }

    private static Double parseDouble(Properties props, String key) {
        if (!props.containsKey(key)) {
            return null;
        }
        try {
            return Double.parseDouble(props.getProperty(key).trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid {} configuration: {}", key, props.getProperty(key));
            return null;
        }
    }
}
