package com.demo.loadclient.client;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RequestPoolTest {

    private final RequestPool pool = new RequestPool();

    @Test
    void testFreshThenReused() {
        RequestPool.PooledRequest first = pool.acquire();
        assertFalse(first.isReused());
        okhttp3.Request.Builder builder = first.builder();
        first.close();
        assertEquals(1, pool.idleCount());

        try (RequestPool.PooledRequest second = pool.acquire()) {
            assertTrue(second.isReused());
            assertSame(builder, second.builder());
            assertEquals(0, pool.idleCount());
        }
        assertEquals(1, pool.idleCount());
    }

    @Test
    void testConcurrentHoldersGetDistinctBuilders() {
        try (RequestPool.PooledRequest a = pool.acquire(); RequestPool.PooledRequest b = pool.acquire()) {
            assertNotSame(a.builder(), b.builder());
        }
        assertEquals(2, pool.idleCount());
    }

    @Test
    void testReleasedHandleCannotBeUsed() {
        RequestPool.PooledRequest pooled = pool.acquire();
        pooled.close();
        pooled.close();
        assertEquals(1, pool.idleCount());
        assertThrows(IllegalStateException.class, pooled::builder);
    }

    @Test
    void testDiscardedBuilderIsNotReturned() {
        try (RequestPool.PooledRequest pooled = pool.acquire()) {
            pooled.discard();
            assertThrows(IllegalStateException.class, pooled::builder);
        }
        assertEquals(0, pool.idleCount());
        assertFalse(pool.acquire().isReused());
    }

    @Test
    void testBlankUrlRejected() {
        assertThrows(IllegalArgumentException.class, () -> RequestDefinition.builder(" "));
    }
}
