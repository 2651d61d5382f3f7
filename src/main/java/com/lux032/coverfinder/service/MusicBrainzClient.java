package com.lux032.coverfinder.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lux032.coverfinder.config.TaggerConfig;
import com.lux032.coverfinder.util.Sleeper;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * MusicBrainz WS/2 查询客户端
 * 所有请求共享同一个速率限制；任何网络或解析失败都返回空结果
 */
@Slf4j
public class MusicBrainzClient {

    private static final Map<String, String> JSON_HEADERS = Map.of("Accept", "application/json");
    private static final String LUCENE_SPECIAL = "+-&|!(){}[]^\"~*?:\\/";

    private final TaggerConfig config;
    private final HttpFetcher fetcher;
    private final ObjectMapper objectMapper;
    private final Sleeper sleeper;
    private long lastRequestTime = 0;

    public MusicBrainzClient(TaggerConfig config, HttpFetcher fetcher) {
        this(config, fetcher, Sleeper.SYSTEM);
    }

    public MusicBrainzClient(TaggerConfig config, HttpFetcher fetcher, Sleeper sleeper) {
        this.config = config;
        this.fetcher = fetcher;
        this.sleeper = sleeper;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * 按专辑名搜索发行（艺术家可选）
     * @return 第一个匹配的发行
     */
    public Optional<ReleaseRef> findReleaseByAlbum(String artist, String album) {
        if (isBlank(album)) {
            return Optional.empty();
        }
        String query = isBlank(artist)
            ? "release:\"" + escape(album) + "\""
            : "artist:\"" + escape(artist) + "\" AND release:\"" + escape(album) + "\"";

        Map<String, String> params = new LinkedHashMap<>();
        params.put("query", query);
        params.put("fmt", "json");
        params.put("limit", "1");

        return request("/release", params)
            .map(root -> root.path("releases"))
            .flatMap(MusicBrainzClient::firstRelease);
    }

    /**
     * 按艺术家 + 标题搜索录音，取第一条录音的第一个发行
     */
    public Optional<ReleaseRef> findReleaseByRecording(String artist, String title) {
        if (isBlank(artist) || isBlank(title)) {
            return Optional.empty();
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("query", "artist:\"" + escape(artist) + "\" AND recording:\"" + escape(title) + "\"");
        params.put("fmt", "json");
        params.put("limit", "1");
        params.put("inc", "releases");

        return request("/recording", params)
            .map(root -> root.path("recordings"))
            .filter(recordings -> recordings.isArray() && recordings.size() > 0)
            .map(recordings -> recordings.get(0).path("releases"))
            .flatMap(MusicBrainzClient::firstRelease);
    }

    /**
     * 获取发行日期与流派
     * 优先使用官方 genres，没有时退回按投票数降序排列的社区 tags
     */
    public ReleaseDetails fetchReleaseDetails(String releaseId) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("fmt", "json");
        params.put("inc", "genres+tags");

        Optional<JsonNode> response = request("/release/" + releaseId, params);
        if (response.isEmpty()) {
            return ReleaseDetails.EMPTY;
        }
        JsonNode root = response.get();

        List<String> genres = names(root.path("genres"));
        if (genres.isEmpty()) {
            List<JsonNode> tags = new ArrayList<>();
            root.path("tags").forEach(tags::add);
            tags.sort(Comparator.comparingInt((JsonNode tag) -> tag.path("count").asInt(0)).reversed());
            for (JsonNode tag : tags) {
                String name = tag.path("name").asText("").trim();
                if (!name.isEmpty()) {
                    genres.add(name);
                }
            }
        }

        String date = root.path("date").asText("").trim();
        return new ReleaseDetails(date.isEmpty() ? null : date, Collections.unmodifiableList(genres));
    }

    private Optional<JsonNode> request(String path, Map<String, String> params) {
        String url = config.getMusicBrainzApiUrl() + path;
        try {
            rateLimit();
            FetchResponse response = fetcher.get(url, params, JSON_HEADERS);
            return Optional.of(objectMapper.readTree(response.getBody()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("MusicBrainz request interrupted: {}", path);
            return Optional.empty();
        } catch (IOException | RuntimeException e) {
            log.debug("MusicBrainz request {} failed: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * 速率限制，所有工作线程共享
     */
    private synchronized void rateLimit() throws InterruptedException {
        long interval = config.getMusicBrainzRequestIntervalMillis();
        long timeSinceLastRequest = System.currentTimeMillis() - lastRequestTime;

        if (interval > 0 && timeSinceLastRequest < interval) {
            long sleepTime = interval - timeSinceLastRequest;
            log.debug("Waiting {} ms to respect the MusicBrainz rate limit", sleepTime);
            sleeper.sleep(Duration.ofMillis(sleepTime));
        }

        lastRequestTime = System.currentTimeMillis();
    }

    private static Optional<ReleaseRef> firstRelease(JsonNode releases) {
        if (!releases.isArray() || releases.size() == 0) {
            return Optional.empty();
        }
        JsonNode release = releases.get(0);
        String id = release.path("id").asText("").trim();
        if (id.isEmpty()) {
            return Optional.empty();
        }
        String title = release.path("title").asText("").trim();
        return Optional.of(new ReleaseRef(id, title.isEmpty() ? null : title));
    }

    private static List<String> names(JsonNode array) {
        List<String> names = new ArrayList<>();
        for (JsonNode node : array) {
            String name = node.path("name").asText("").trim();
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }

    /**
     * Lucene 查询语法转义
     */
    static String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (char c : value.trim().toCharArray()) {
            if (LUCENE_SPECIAL.indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    /**
     * 搜索命中的发行
     */
    @Value
    public static class ReleaseRef {
        String id;
        String title;
    }

    /**
     * 发行详情
     */
    @Value
    public static class ReleaseDetails {
        static final ReleaseDetails EMPTY = new ReleaseDetails(null, Collections.emptyList());

        String date;
        List<String> genres;
    }
}
