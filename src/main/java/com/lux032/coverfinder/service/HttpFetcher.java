package com.lux032.coverfinder.service;

import com.lux032.coverfinder.config.TaggerConfig;
import com.lux032.coverfinder.util.BackoffPolicy;
import com.lux032.coverfinder.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.net.URIBuilder;
import org.apache.hc.core5.util.Timeout;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * 统一的 HTTP GET 封装（带超时、重试与退避）
 * 429/500/502/503/504 与传输层错误会重试，其他非 2xx 状态立即失败
 */
@Slf4j
public class HttpFetcher implements Closeable {

    private static final Set<Integer> TRANSIENT_STATUS = Set.of(429, 500, 502, 503, 504);

    private final TaggerConfig config;
    private final CloseableHttpClient httpClient;
    private final BackoffPolicy backoffPolicy;
    private final Sleeper sleeper;
    private final int maxAttempts;

    public HttpFetcher(TaggerConfig config, int maxConnections) {
        this(config, maxConnections, BackoffPolicy.from(config), Sleeper.SYSTEM);
    }

    public HttpFetcher(TaggerConfig config, int maxConnections, BackoffPolicy backoffPolicy, Sleeper sleeper) {
        this.config = config;
        this.httpClient = createHttpClient(config, maxConnections);
        this.backoffPolicy = backoffPolicy;
        this.sleeper = sleeper;
        this.maxAttempts = Math.max(1, config.getMaxAttempts());
    }

    /**
     * 创建 HttpClient,支持代理配置
     * 连接池按工作线程数放大，重试由本类负责，关闭客户端自带的重试
     */
    private CloseableHttpClient createHttpClient(TaggerConfig config, int maxConnections) {
        Timeout timeout = Timeout.ofSeconds(config.getTimeoutSeconds());

        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
            .setDefaultConnectionConfig(ConnectionConfig.custom()
                .setConnectTimeout(timeout)
                .setSocketTimeout(timeout)
                .build())
            .setMaxConnTotal(Math.max(20, maxConnections * 2))
            .setMaxConnPerRoute(Math.max(5, maxConnections))
            .build();

        RequestConfig requestConfig = RequestConfig.custom()
            .setConnectionRequestTimeout(timeout)
            .setResponseTimeout(timeout)
            .build();

        HttpClientBuilder builder = HttpClients.custom()
            .setConnectionManager(connectionManager)
            .setDefaultRequestConfig(requestConfig)
            .disableAutomaticRetries();

        if (config.isProxyEnabled() && config.getProxyHost() != null && !config.getProxyHost().isEmpty()) {
            builder.setProxy(new HttpHost(config.getProxyHost(), config.getProxyPort()));
            log.info("HTTP proxy enabled: {}:{}", config.getProxyHost(), config.getProxyPort());
        } else if (config.isProxyEnabled()) {
            log.warn("proxy.enabled is true but proxy.host is not set, connecting directly");
        }

        return builder.build();
    }

    public FetchResponse get(String url) throws FetchException {
        return get(url, Collections.emptyMap(), Collections.emptyMap());
    }

    /**
     * 执行 GET 请求（带重试机制）
     * @param params 查询参数，会进行 URL 编码
     * @param headers 额外的请求头，User-Agent 总是会附加
     * @throws FetchException 非临时性错误，或重试次数用尽
     */
    public FetchResponse get(String url, Map<String, String> params, Map<String, String> headers) throws FetchException {
        URI uri = buildUri(url, params);

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            boolean lastAttempt = attempt == maxAttempts - 1;
            RawResponse raw;
            try {
                raw = execute(uri, headers);
            } catch (IOException e) {
                if (lastAttempt) {
                    log.debug("Request failed after {} attempts: {} - {}", maxAttempts, uri, e.getMessage());
                    throw new FetchException("Request failed after " + maxAttempts + " attempts: " + uri, e);
                }
                Duration delay = backoffPolicy.delayFor(attempt);
                log.debug("Network error ({}/{}): {} - {}, retrying in {} ms",
                    attempt + 1, maxAttempts, uri, e.getMessage(), delay.toMillis());
                pause(delay);
                continue;
            }

            if (raw.statusCode >= 200 && raw.statusCode < 300) {
                return new FetchResponse(raw.statusCode, raw.contentType, raw.body);
            }
            if (!TRANSIENT_STATUS.contains(raw.statusCode)) {
                throw new FetchException("HTTP " + raw.statusCode + " for " + uri, raw.statusCode);
            }
            if (lastAttempt) {
                throw new FetchException("HTTP " + raw.statusCode + " after " + maxAttempts + " attempts: " + uri,
                    raw.statusCode);
            }

            Duration delay = backoffPolicy.fromRetryAfter(raw.retryAfter);
            if (delay == null) {
                delay = backoffPolicy.delayFor(attempt);
            }
            log.debug("HTTP {} ({}/{}): {}, retrying in {} ms",
                raw.statusCode, attempt + 1, maxAttempts, uri, delay.toMillis());
            pause(delay);
        }

        // maxAttempts >= 1，循环内必然返回或抛出
        throw new FetchException("No attempt was made: " + uri, 0);
    }

    private RawResponse execute(URI uri, Map<String, String> headers) throws IOException {
        HttpGet httpGet = new HttpGet(uri);
        httpGet.setHeader(HttpHeaders.USER_AGENT, config.getUserAgent());
        for (Map.Entry<String, String> header : headers.entrySet()) {
            httpGet.setHeader(header.getKey(), header.getValue());
        }

        return httpClient.execute(httpGet, response -> {
            HttpEntity entity = response.getEntity();
            byte[] body = entity != null ? EntityUtils.toByteArray(entity) : new byte[0];
            Header contentType = response.getFirstHeader(HttpHeaders.CONTENT_TYPE);
            Header retryAfter = response.getFirstHeader(HttpHeaders.RETRY_AFTER);
            return new RawResponse(
                response.getCode(),
                contentType != null ? contentType.getValue() : null,
                retryAfter != null ? retryAfter.getValue() : null,
                body);
        });
    }

    private void pause(Duration delay) throws FetchException {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new FetchException("Interrupted while waiting to retry", ie);
        }
    }

    private static URI buildUri(String url, Map<String, String> params) throws FetchException {
        try {
            URIBuilder builder = new URIBuilder(url);
            for (Map.Entry<String, String> param : params.entrySet()) {
                builder.addParameter(param.getKey(), param.getValue());
            }
            return builder.build();
        } catch (URISyntaxException e) {
            throw new FetchException("Invalid URL: " + url, e);
        }
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }

    private static final class RawResponse {
        private final int statusCode;
        private final String contentType;
        private final String retryAfter;
        private final byte[] body;

        private RawResponse(int statusCode, String contentType, String retryAfter, byte[] body) {
            this.statusCode = statusCode;
            this.contentType = contentType;
            this.retryAfter = retryAfter;
            this.body = body;
        }
    }
}
