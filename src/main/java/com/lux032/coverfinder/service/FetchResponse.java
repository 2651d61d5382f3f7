package com.lux032.coverfinder.service;

import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * 成功（2xx）的 HTTP 响应
 */
@Value
public class FetchResponse {
    int statusCode;
    String contentType;
    byte[] body;

    public String bodyAsString() {
        return body == null ? "" : new String(body, StandardCharsets.UTF_8);
    }

    public int size() {
        return body == null ? 0 : body.length;
    }

    /**
     * Content-Type 是否为 image/*
     */
    public boolean isImage() {
        return contentType != null && contentType.toLowerCase(Locale.ROOT).contains("image");
    }
}
