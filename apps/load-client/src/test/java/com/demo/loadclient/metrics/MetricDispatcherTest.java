package com.demo.loadclient.metrics;

import com.demo.loadclient.errors.ErrorClassifier;
import com.demo.loadclient.tracer.Trail;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MetricDispatcherTest {

    private final ErrorClassifier classifier = new ErrorClassifier("Linux");
    private final RecordingSampleSink sink = new RecordingSampleSink();

    private MetricDispatcher dispatcher(Set<SystemTag> systemTags, ExpectedStatuses callback) {
        TagsAndMeta base = new TagsAndMeta();
        base.setTag("scenario", "default");
        return new MetricDispatcher(new ExecutionState(base, systemTags, sink, callback), classifier);
    }

    private MetricDispatcher dispatcher() {
        return dispatcher(SystemTag.defaults(), null);
    }

    private static Trail trail() {
        return new Trail(Instant.now(), Duration.ZERO, Duration.ofMillis(5),
            new InetSocketAddress("127.0.0.1", 8080));
    }

    private static UnfinishedRequest request(String url, Integer status, Throwable error) {
        return new UnfinishedRequest("GET", url, Map.of(), status, "HTTP/1.1", trail(), error);
    }

    @Test
    void testDrainWithNothingStaged() {
        MetricDispatcher dispatcher = dispatcher();
        assertTrue(dispatcher.drainAndEmit(null).isEmpty());
        assertTrue(sink.containers().isEmpty());
    }

    @Test
    void testStagedRequestIsEmittedOnDrain() {
        MetricDispatcher dispatcher = dispatcher();
        dispatcher.stage(request("http://a/", 200, null));
        assertTrue(dispatcher.hasStaged());
        assertTrue(sink.containers().isEmpty());

        Optional<FinishedRequest> finished = dispatcher.drainAndEmit(null);

        assertTrue(finished.isPresent());
        assertFalse(dispatcher.hasStaged());
        Map<String, String> tags = sink.containers().get(0).getTags();
        assertEquals("200", tags.get("status"));
        assertEquals("http://a/", tags.get("name"));
        assertEquals("http://a/", tags.get("url"));
        assertEquals("GET", tags.get("method"));
        assertEquals("HTTP/1.1", tags.get("proto"));
        assertEquals("default", tags.get("scenario"));
        assertFalse(tags.containsKey("error_code"));
        assertFalse(tags.containsKey("ip"));
    }

    @Test
    void testStagingTwiceEmitsThePreviousFirst() {
        MetricDispatcher dispatcher = dispatcher();
        dispatcher.stage(request("http://first/", 200, null));
        dispatcher.stage(request("http://second/", 200, null));

        assertEquals(1, sink.containers().size());
        assertEquals("http://first/", sink.containers().get(0).getTags().get("url"));

        dispatcher.drainAndEmit(null);
        assertEquals(2, sink.containers().size());
        assertEquals("http://second/", sink.containers().get(1).getTags().get("url"));
    }

    @Test
    void testHttpErrorStatusGetsErrorCode() {
        MetricDispatcher dispatcher = dispatcher();
        dispatcher.stage(request("http://a/missing", 404, null));

        FinishedRequest finished = dispatcher.drainAndEmit(null).orElseThrow();

        assertEquals(1404, finished.errorCode().value());
        Map<String, String> tags = sink.containers().get(0).getTags();
        assertEquals("404", tags.get("status"));
        assertEquals("1404", tags.get("error_code"));
    }

    @Test
    void testTransportErrorHasStatusZero() {
        MetricDispatcher dispatcher = dispatcher();
        ConnectException refused = new ConnectException("Failed to connect");
        refused.initCause(new ConnectException("Connection refused"));
        dispatcher.stage(request("http://a/", null, refused));

        FinishedRequest finished = dispatcher.drainAndEmit(null).orElseThrow();

        assertEquals(1212, finished.errorCode().value());
        assertEquals("dial: connection refused", finished.errorMessage());
        Map<String, String> tags = sink.containers().get(0).getTags();
        assertEquals("0", tags.get("status"));
        assertEquals("1212", tags.get("error_code"));
        assertEquals("dial: connection refused", tags.get("error"));
    }

    @Test
    void testLateErrorIsAttached() {
        MetricDispatcher dispatcher = dispatcher();
        dispatcher.stage(request("http://a/", 200, null));

        FinishedRequest finished = dispatcher.drainAndEmit(new SocketTimeoutException("Read timed out")).orElseThrow();

        assertEquals(1050, finished.errorCode().value());
        assertEquals("0", sink.containers().get(0).getTags().get("status"));
    }

    @Test
    void testLateErrorDoesNotOverrideEarlierOne() {
        MetricDispatcher dispatcher = dispatcher();
        dispatcher.stage(request("http://a/", null, new SocketTimeoutException("connect timed out")));

        FinishedRequest finished = dispatcher.drainAndEmit(new SocketTimeoutException("Read timed out")).orElseThrow();

        assertEquals(1211, finished.errorCode().value());
    }

    @Test
    void testNameTagReplacesUrl() {
        MetricDispatcher dispatcher = dispatcher();
        dispatcher.stage(new UnfinishedRequest("GET", "http://a/users/42", Map.of("name", "users"), 200, null,
            trail(), null));
        dispatcher.drainAndEmit(null);

        Map<String, String> tags = sink.containers().get(0).getTags();
        assertEquals("users", tags.get("name"));
        assertEquals("users", tags.get("url"));
        assertFalse(tags.containsKey("proto"));
    }

    @Test
    void testDisabledSystemTagsAreLeftOut() {
        MetricDispatcher dispatcher = dispatcher(EnumSet.of(SystemTag.STATUS), null);
        dispatcher.stage(request("http://a/", 500, null));
        dispatcher.drainAndEmit(null);

        Map<String, String> tags = sink.containers().get(0).getTags();
        assertEquals("500", tags.get("status"));
        assertFalse(tags.containsKey("url"));
        assertFalse(tags.containsKey("method"));
        assertFalse(tags.containsKey("error_code"));
    }

    @Test
    void testIpTagWhenEnabled() {
        MetricDispatcher dispatcher = dispatcher(EnumSet.of(SystemTag.IP), null);
        dispatcher.stage(request("http://a/", 200, null));
        dispatcher.drainAndEmit(null);

        assertEquals("127.0.0.1", sink.containers().get(0).getTags().get("ip"));
    }

    @Test
    void testResponseCallbackAddsFailedSample() {
        MetricDispatcher dispatcher = dispatcher(SystemTag.defaults(), ExpectedStatuses.range(200, 399));
        dispatcher.stage(request("http://ok/", 200, null));
        dispatcher.stage(request("http://bad/", 503, null));
        dispatcher.drainAndEmit(null);

        List<Sample> failed = sink.samples("http_req_failed");
        assertEquals(2, failed.size());
        assertEquals(0.0, failed.get(0).value());
        assertEquals(1.0, failed.get(1).value());
        assertEquals("true", failed.get(0).tags().get("expected_response"));
        assertEquals("false", failed.get(1).tags().get("expected_response"));
    }

    @Test
    void testTransportErrorIsUnexpectedResponse() {
        MetricDispatcher dispatcher = dispatcher(SystemTag.defaults(), ExpectedStatuses.range(200, 399));
        dispatcher.stage(request("http://a/", null, new SocketTimeoutException("Read timed out")));
        FinishedRequest finished = dispatcher.drainAndEmit(null).orElseThrow();

        assertEquals(Boolean.TRUE, finished.trail().getFailed().orElseThrow());
        assertEquals(1.0, sink.samples("http_req_failed").get(0).value());
    }

    @Test
    void testNoFailedSampleWithoutCallback() {
        MetricDispatcher dispatcher = dispatcher();
        dispatcher.stage(request("http://a/", 500, null));
        FinishedRequest finished = dispatcher.drainAndEmit(null).orElseThrow();

        assertTrue(sink.samples("http_req_failed").isEmpty());
        assertTrue(finished.trail().getFailed().isEmpty());
        assertEquals(1, sink.samples("http_reqs").size());
        assertEquals(1, sink.samples("http_req_duration").size());
    }

    @Test
    void testConcurrentStageAndDrainEmitEveryRequestOnce() throws Exception {
        MetricDispatcher dispatcher = dispatcher();
        int threads = 8;
        int perThread = 200;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int id = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        dispatcher.stage(request("http://t" + id + "/" + i, 200, null));
                        if (i % 3 == 0) {
                            dispatcher.drainAndEmit(null);
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        dispatcher.drainAndEmit(null);

        assertEquals(threads * perThread, sink.samples("http_reqs").size());
        assertEquals(threads * perThread,
            sink.containers().stream().map(c -> c.getTags().get("url")).distinct().count());
    }
}
