package com.demo.loadclient.client;

import okhttp3.MediaType;
import okhttp3.RequestBody;
import okio.BufferedSink;
import okio.Okio;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.io.Closeable;
import java.io.IOException;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * File streamed as a request body, chunked, without loading it into memory.
 *
 * The same open file backs every request using it: each send rewinds to the start, and
 * writing the body never closes the file. {@link #close()} releases it.
 */
public class FileStream implements RequestPayload, Closeable {
    private static final Logger logger = LoggerFactory.getLogger(FileStream.class);

    private final Path path;
    private final FileChannel channel;

    private FileStream(Path path, FileChannel channel) {
        this.path = path;
        this.channel = channel;
    }

    public static FileStream open(Path path) throws IOException {
        try {
            return new FileStream(path, FileChannel.open(path, StandardOpenOption.READ));
        } catch (IOException e) {
            logger.error("Failed to open file {}", path, e);
            throw e;
        }
    }

    public Path getPath() {
        return path;
    }

    /**
     * Reset to the beginning of the file.
     */
    public void rewind() throws IOException {
        channel.position(0);
    }

    @Override
    public RequestBody toRequestBody() {
        return new RequestBody() {
            @Nullable
            @Override
            public MediaType contentType() {
                return null;
            }

            @Override
            public long contentLength() {
                return -1;
            }

            @Override
            public boolean isOneShot() {
                return true;
            }

            @Override
            public void writeTo(BufferedSink sink) throws IOException {
                // the source is not closed, it would close the channel
                sink.writeAll(Okio.source(Channels.newInputStream(channel)));
            }
        };
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
