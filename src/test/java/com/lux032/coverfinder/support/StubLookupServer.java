package com.lux032.coverfinder.support;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 嵌入式 Jetty，按路径返回预设响应，替代 iTunes / MusicBrainz / Cover Art Archive
 * 同一路径注册多个响应时按顺序返回，最后一个重复使用
 */
public final class StubLookupServer implements AutoCloseable {

    private final Server server;
    private final Map<String, List<StubResponse>> routes = new ConcurrentHashMap<>();
    private final Map<String, Integer> hits = new ConcurrentHashMap<>();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();

    public StubLookupServer() throws Exception {
        server = new Server(0);
        ServletContextHandler context = new ServletContextHandler();
        context.addServlet(new ServletHolder(new StubServlet()), "/*");
        server.setHandler(context);
        server.start();
    }

    public String baseUrl() {
        return "http://localhost:" + ((ServerConnector) server.getConnectors()[0]).getLocalPort();
    }

    public StubLookupServer on(String path, StubResponse... responses) {
        routes.put(path, new ArrayList<>(Arrays.asList(responses)));
        hits.put(path, 0);
        return this;
    }

    public int hitCount(String path) {
        return hits.getOrDefault(path, 0);
    }

    public List<RecordedRequest> getRequests() {
        return Collections.unmodifiableList(requests);
    }

    public List<RecordedRequest> requestsTo(String path) {
        List<RecordedRequest> matching = new ArrayList<>();
        for (RecordedRequest request : requests) {
            if (request.getPath().equals(path)) {
                matching.add(request);
            }
        }
        return matching;
    }

    @Override
    public void close() throws Exception {
        server.stop();
    }

    public static StubResponse json(String body) {
        return new StubResponse(200, "application/json", body.getBytes(StandardCharsets.UTF_8), Collections.emptyMap());
    }

    public static StubResponse image(int size) {
        return image("image/jpeg", size);
    }

    public static StubResponse image(String contentType, int size) {
        byte[] body = new byte[size];
        Arrays.fill(body, (byte) 0x5A);
        return new StubResponse(200, contentType, body, Collections.emptyMap());
    }

    public static StubResponse status(int code) {
        return new StubResponse(code, "text/plain", ("status " + code).getBytes(StandardCharsets.UTF_8),
            Collections.emptyMap());
    }

    public static StubResponse status(int code, String header, String value) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(header, value);
        return new StubResponse(code, "text/plain", ("status " + code).getBytes(StandardCharsets.UTF_8), headers);
    }

    public static final class StubResponse {
        private final int status;
        private final String contentType;
        private final byte[] body;
        private final Map<String, String> headers;

        private StubResponse(int status, String contentType, byte[] body, Map<String, String> headers) {
            this.status = status;
            this.contentType = contentType;
            this.body = body;
            this.headers = headers;
        }
    }

    public static final class RecordedRequest {
        private final String path;
        private final Map<String, String> params;
        private final Map<String, String> headers;

        private RecordedRequest(String path, Map<String, String> params, Map<String, String> headers) {
            this.path = path;
            this.params = params;
            this.headers = headers;
        }

        public String getPath() {
            return path;
        }

        public String param(String name) {
            return params.get(name);
        }

        public String header(String name) {
            return headers.get(name.toLowerCase());
        }
    }

    private final class StubServlet extends HttpServlet {
        @Override
        protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            String path = req.getRequestURI();

            Map<String, String> params = new LinkedHashMap<>();
            req.getParameterMap().forEach((name, values) -> params.put(name, values.length > 0 ? values[0] : null));
            Map<String, String> headers = new LinkedHashMap<>();
            Collections.list(req.getHeaderNames())
                .forEach(name -> headers.put(name.toLowerCase(), req.getHeader(name)));
            requests.add(new RecordedRequest(path, params, headers));

            List<StubResponse> sequence = routes.get(path);
            if (sequence == null || sequence.isEmpty()) {
                resp.sendError(404);
                return;
            }
            int hit = hits.merge(path, 1, Integer::sum);
            StubResponse response = sequence.get(Math.min(hit, sequence.size()) - 1);

            resp.setStatus(response.status);
            resp.setContentType(response.contentType);
            response.headers.forEach(resp::setHeader);
            resp.setContentLength(response.body.length);
            resp.getOutputStream().write(response.body);
        }
    }
}
