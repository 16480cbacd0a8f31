package com.example.devslegacy.fetch;

import com.example.devslegacy.config.DevsProperties;
import com.example.devslegacy.config.FetchClientConfig;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FetchServiceTest {

    private static final String MARKER = "\n\n...[truncated]";

    private HttpServer upstream;
    private ExecutorService upstreamThreads;
    private ThreadPoolTaskExecutor fetchExecutor;
    private String base;

    @BeforeEach
    void startUpstream() throws IOException {
        upstream = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        upstreamThreads = Executors.newCachedThreadPool();
        upstream.setExecutor(upstreamThreads);
        upstream.createContext("/hello", ex -> reply(ex, 200, "hello from upstream"));
        upstream.createContext("/big", ex -> reply(ex, 200, "x".repeat(2500)));
        upstream.createContext("/missing", ex -> reply(ex, 404, "nope"));
        upstream.createContext("/hop", ex -> {
            ex.getResponseHeaders().add("Location", "/hello");
            ex.sendResponseHeaders(302, -1);
            ex.close();
        });
        upstream.createContext("/to-https", ex -> {
            ex.getResponseHeaders().add("Location", "https://127.0.0.1:" + closedPort() + "/");
            ex.sendResponseHeaders(302, -1);
            ex.close();
        });
        upstream.createContext("/slow", ex -> {
            try {
                Thread.sleep(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            reply(ex, 200, "too late");
        });
        upstream.start();
        base = "http://127.0.0.1:" + upstream.getAddress().getPort();

        fetchExecutor = new ThreadPoolTaskExecutor();
        fetchExecutor.setThreadNamePrefix("fetch-test-");
        fetchExecutor.initialize();
    }

    @AfterEach
    void stopUpstream() {
        upstream.stop(0);
        upstreamThreads.shutdownNow();
        fetchExecutor.shutdown();
    }

    private FetchService service(Duration timeout) {
        return new FetchService(FetchClientConfig.buildFetchRestTemplate(timeout), fetchExecutor,
                new DevsProperties.Fetch(timeout, 2000, MARKER));
    }

    @Test
    void returnsStatusBodyAndOriginalUrl() throws Exception {
        FetchResult r = service(Duration.ofSeconds(5)).fetch(base + "/hello");

        assertThat(r.statusCode()).isEqualTo(200);
        assertThat(r.url()).isEqualTo(base + "/hello");
        assertThat(r.body()).isEqualTo("hello from upstream");
        assertThat(r.truncated()).isFalse();
    }

    @Test
    void upstreamErrorStatusIsPassedThrough() throws Exception {
        FetchResult r = service(Duration.ofSeconds(5)).fetch(base + "/missing");

        assertThat(r.statusCode()).isEqualTo(404);
        assertThat(r.body()).isEqualTo("nope");
    }

    @Test
    void largeBodyIsTruncated() throws Exception {
        FetchResult r = service(Duration.ofSeconds(5)).fetch(base + "/big");

        assertThat(r.truncated()).isTrue();
        assertThat(r.body()).isEqualTo("x".repeat(2000) + MARKER);
    }

    @Test
    void redirectsAreFollowedAndOriginalUrlIsEchoed() throws Exception {
        FetchResult r = service(Duration.ofSeconds(5)).fetch(base + "/hop");

        assertThat(r.statusCode()).isEqualTo(200);
        assertThat(r.body()).isEqualTo("hello from upstream");
        assertThat(r.url()).isEqualTo(base + "/hop");
    }

    @Test
    void redirectToAnotherSchemeIsFollowed() {
        FetchService service = service(Duration.ofSeconds(5));

        // the https hop is attempted and fails, so the 302 itself is never returned
        assertThatThrownBy(() -> service.fetch(base + "/to-https"))
                .isInstanceOf(FetchNetworkException.class);
    }

    @Test
    void saturatedPoolIsReportedAsAFetchFailure() {
        ThreadPoolTaskExecutor stopped = new ThreadPoolTaskExecutor();
        stopped.initialize();
        stopped.shutdown();
        FetchService service = new FetchService(FetchClientConfig.buildFetchRestTemplate(Duration.ofSeconds(5)),
                stopped, new DevsProperties.Fetch(Duration.ofSeconds(5), 2000, MARKER));

        assertThatThrownBy(() -> service.fetch(base + "/hello"))
                .isInstanceOf(FetchNetworkException.class)
                .satisfies(e -> assertThat(((FetchException) e).getDetail()).startsWith("TaskRejectedException"));
    }

    @Test
    void slowUpstreamTimesOut() {
        FetchService service = service(Duration.ofMillis(300));

        assertThatThrownBy(() -> service.fetch(base + "/slow"))
                .isInstanceOf(FetchTimeoutException.class)
                .satisfies(e -> {
                    FetchException fe = (FetchException) e;
                    assertThat(fe.kind()).isEqualTo(FetchException.Kind.TIMEOUT);
                    assertThat(fe.getDetail()).contains("network timeout at: " + base + "/slow");
                });
    }

    @Test
    void refusedConnectionIsANetworkError() throws Exception {
        int closedPort = closedPort();
        FetchService service = service(Duration.ofSeconds(5));

        assertThatThrownBy(() -> service.fetch("http://127.0.0.1:" + closedPort + "/"))
                .isInstanceOf(FetchNetworkException.class)
                .satisfies(e -> {
                    FetchException fe = (FetchException) e;
                    assertThat(fe.kind()).isEqualTo(FetchException.Kind.NETWORK);
                    assertThat(fe.getDetail()).isNotBlank();
                });
    }

    @Test
    void malformedUrlIsANetworkError() {
        FetchService service = service(Duration.ofSeconds(5));

        assertThatThrownBy(() -> service.fetch("http://exa mple.com/"))
                .isInstanceOf(FetchNetworkException.class);
    }

    private static int closedPort() throws IOException {
        try (ServerSocket s = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            return s.getLocalPort();
        }
    }

    private static void reply(HttpExchange ex, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", "text/plain; charset=utf-8");
        ex.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }
}
