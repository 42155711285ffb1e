package com.demo.loadclient.client;

import okhttp3.Request;

import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Reusable request builders of one request definition.
 */
public class RequestPool {

    private final ConcurrentLinkedDeque<Request.Builder> idle = new ConcurrentLinkedDeque<>();

    /**
     * Take an idle builder, or a fresh one if none is available. Closing the returned
     * handle puts the builder back.
     */
    public PooledRequest acquire() {
        Request.Builder builder = idle.pollFirst();
        if (builder == null) {
            return new PooledRequest(this, new Request.Builder(), false);
        }
        return new PooledRequest(this, builder, true);
    }

    public int idleCount() {
        return idle.size();
    }

    void release(Request.Builder builder) {
        idle.offerFirst(builder);
    }

    /**
     * Scoped hold on a pooled builder.
     */
    public static final class PooledRequest implements AutoCloseable {
        private final RequestPool pool;
        private Request.Builder builder;
        private final boolean reused;

        private PooledRequest(RequestPool pool, Request.Builder builder, boolean reused) {
            this.pool = pool;
            this.builder = builder;
            this.reused = reused;
        }

        public Request.Builder builder() {
            if (builder == null) {
                throw new IllegalStateException("pooled request already released");
            }
            return builder;
        }

        /** True if the builder was used by an earlier call and still carries its settings. */
        public boolean isReused() {
            return reused;
        }

        /**
         * Drop the builder instead of returning it to the pool.
         */
        public void discard() {
            builder = null;
        }

        @Override
        public void close() {
            if (builder != null) {
                pool.release(builder);
                builder = null;
            }
        }
    }
}
