package com.lux032.coverfinder.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lux032.coverfinder.config.TaggerConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Cover Art Archive 封面获取服务
 * 优先级：front 图片的 large 缩略图 -> small 缩略图 -> 原图，最后尝试 /release/{id}/front
 */
@Slf4j
public class CoverArtService {

    private final TaggerConfig config;
    private final HttpFetcher fetcher;
    private final ObjectMapper objectMapper;

    public CoverArtService(TaggerConfig config, HttpFetcher fetcher) {
        this.config = config;
        this.fetcher = fetcher;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * 获取发行的正面封面
     * @return 满足大小下限的图片；都不满足时为空
     */
    public Optional<FetchResponse> fetchFrontCover(String releaseId) {
        for (String url : listCandidateUrls(releaseId)) {
            Optional<FetchResponse> image = download(url);
            if (image.isPresent()) {
                return image;
            }
        }

        log.debug("No usable image in cover listing for release {}, trying /front", releaseId);
        return download(config.getCoverArtApiUrl() + "/release/" + releaseId + "/front");
    }

    /**
     * 从封面列表中按优先级整理出下载地址
     * 有 front 标记时只取 front 图片，否则取全部
     */
    List<String> listCandidateUrls(String releaseId) {
        JsonNode images;
        try {
            FetchResponse response = fetcher.get(config.getCoverArtApiUrl() + "/release/" + releaseId,
                Collections.emptyMap(), Map.of("Accept", "application/json"));
            images = objectMapper.readTree(response.getBody()).path("images");
        } catch (IOException | RuntimeException e) {
            log.debug("Cover listing unavailable for release {}: {}", releaseId, e.getMessage());
            return Collections.emptyList();
        }
        if (!images.isArray()) {
            return Collections.emptyList();
        }

        List<JsonNode> fronts = new ArrayList<>();
        List<JsonNode> all = new ArrayList<>();
        for (JsonNode image : images) {
            all.add(image);
            if (image.path("front").asBoolean(false)) {
                fronts.add(image);
            }
        }

        Set<String> urls = new LinkedHashSet<>();
        for (JsonNode image : fronts.isEmpty() ? all : fronts) {
            JsonNode thumbnails = image.path("thumbnails");
            addIfPresent(urls, thumbnails.path("large"));
            addIfPresent(urls, thumbnails.path("small"));
            addIfPresent(urls, image.path("image"));
        }
        return new ArrayList<>(urls);
    }

    private Optional<FetchResponse> download(String url) {
        try {
            FetchResponse image = fetcher.get(url);
            if (!image.isImage()) {
                log.debug("Not an image ({}): {}", image.getContentType(), url);
                return Optional.empty();
            }
            if (image.size() < config.getCoverArtMinImageBytes()) {
                log.debug("Image too small ({} bytes): {}", image.size(), url);
                return Optional.empty();
            }
            return Optional.of(image);
        } catch (FetchException e) {
            log.debug("Cover download failed: {} - {}", url, e.getMessage());
            return Optional.empty();
        }
    }

    private static void addIfPresent(Set<String> urls, JsonNode node) {
        String url = node.asText("").trim();
        if (!url.isEmpty()) {
            urls.add(url);
        }
    }
}
