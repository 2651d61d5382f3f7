package com.lux032.coverfinder.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lux032.coverfinder.config.TaggerConfig;
import com.lux032.coverfinder.model.Candidate;
import com.lux032.coverfinder.model.TrackMeta;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * iTunes Search API 数据源（首选数据源，无需 API Key）
 * 依次尝试 艺术家+专辑 / 艺术家+标题 / 专辑 / 标题 四种查询，
 * 每个结果按 1200/1000/800/600 的尺寸逐级尝试下载封面
 */
@Slf4j
public class ITunesSource implements MetadataSource {

    // 封面 URL 中的尺寸片段，如 /100x100bb.jpg
    private static final Pattern ARTWORK_SIZE = Pattern.compile("/\\d+x\\d+bb\\.");

    private final TaggerConfig config;
    private final HttpFetcher fetcher;
    private final ObjectMapper objectMapper;

    public ITunesSource(TaggerConfig config, HttpFetcher fetcher) {
        this.config = config;
        this.fetcher = fetcher;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String getName() {
        return "iTunes";
    }

    @Override
    public Stream<Candidate> candidates(TrackMeta meta) {
        return buildQueries(meta).stream()
            .flatMap(query -> runQuery(query).stream())
            .map(item -> toCandidate(item, meta))
            .flatMap(Optional::stream);
    }

    /**
     * 按固定优先级构建查询，缺少所需字段的查询被跳过
     */
    List<SearchQuery> buildQueries(TrackMeta meta) {
        List<SearchQuery> queries = new ArrayList<>();
        if (meta.hasArtist() && meta.hasAlbum()) {
            queries.add(new SearchQuery(meta.getArtist().trim() + " " + meta.getAlbum().trim(), "album"));
        }
        if (meta.hasArtist() && meta.hasTitle()) {
            queries.add(new SearchQuery(meta.getArtist().trim() + " " + meta.getTitle().trim(), "song"));
        }
        if (meta.hasAlbum()) {
            queries.add(new SearchQuery(meta.getAlbum().trim(), "album"));
        }
        if (meta.hasTitle()) {
            queries.add(new SearchQuery(meta.getTitle().trim(), "song"));
        }
        return queries;
    }

    private List<JsonNode> runQuery(SearchQuery query) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("term", query.getTerm());
        params.put("entity", query.getEntity());
        params.put("limit", String.valueOf(config.getItunesResultLimit()));
        params.put("media", "music");

        try {
            FetchResponse response = fetcher.get(config.getItunesSearchUrl(), params, Collections.emptyMap());
            JsonNode results = objectMapper.readTree(response.getBody()).path("results");
            if (!results.isArray()) {
                return Collections.emptyList();
            }
            List<JsonNode> items = new ArrayList<>();
            results.forEach(items::add);
            log.debug("iTunes {} query '{}' returned {} result(s)", query.getEntity(), query.getTerm(), items.size());
            return items;
        } catch (IOException | RuntimeException e) {
            log.debug("iTunes {} query '{}' failed: {}", query.getEntity(), query.getTerm(), e.getMessage());
            return Collections.emptyList();
        }
    }

    /**
     * 为单个搜索结果寻找可用封面，所有尺寸都不合格时丢弃该结果
     */
    private Optional<Candidate> toCandidate(JsonNode item, TrackMeta meta) {
        String artworkUrl = text(item, "artworkUrl100");
        if (artworkUrl == null) {
            return Optional.empty();
        }

        Set<String> tried = new HashSet<>();
        for (int size : config.getItunesArtworkSizes()) {
            String url = upscaleArtwork(artworkUrl, size);
            if (!tried.add(url)) {
                continue;
            }
            FetchResponse image;
            try {
                image = fetcher.get(url);
            } catch (FetchException e) {
                log.debug("Artwork {}px unavailable: {}", size, e.getMessage());
                continue;
            }
            if (!image.isImage()) {
                log.debug("Artwork {}px is not an image ({})", size, image.getContentType());
                continue;
            }
            if (image.size() < config.getItunesMinImageBytes()) {
                log.debug("Artwork {}px too small ({} bytes), skipping", size, image.size());
                continue;
            }

            Candidate.CandidateBuilder builder = Candidate.builder()
                .imageData(image.getBody())
                .contentType(image.getContentType())
                .source("iTunes " + size + "px")
                .albumTitle(text(item, "collectionName"))
                .releaseDate(releaseDate(item))
                .artistName(text(item, "artistName"))
                .trackTitle(Optional.ofNullable(text(item, "trackName")).orElse(meta.getTitle()))
                .trackNumber(integer(item, "trackNumber"))
                .trackCount(integer(item, "trackCount"));
            String genre = text(item, "primaryGenreName");
            if (genre != null) {
                builder.genre(genre);
            }
            return Optional.of(builder.build());
        }

        log.debug("No acceptable artwork for iTunes result '{}'", text(item, "collectionName"));
        return Optional.empty();
    }

    /**
     * 把封面 URL 中的尺寸替换为目标尺寸
     */
    static String upscaleArtwork(String url, int size) {
        Matcher matcher = ARTWORK_SIZE.matcher(url);
        return matcher.replaceAll(Matcher.quoteReplacement("/" + size + "x" + size + "bb."));
    }

    /**
     * 只保留 YYYY-MM-DD 部分
     */
    private static String releaseDate(JsonNode item) {
        String value = text(item, "releaseDate");
        if (value == null) {
            return null;
        }
        return value.length() > 10 ? value.substring(0, 10) : value;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static Integer integer(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.canConvertToInt() && value.isNumber() ? value.asInt() : null;
    }

    @Value
    static class SearchQuery {
        String term;
        String entity;
    }
}
