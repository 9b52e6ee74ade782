package com.edushield.audit.sink;

import com.edushield.audit.AuditRecord;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends one JSON object per line to a file.
 * <p>
 * Each record is rendered in full, then written with its newline in a single unbuffered
 * call, so a failed write leaves nothing pending to be replayed by a retry. After any
 * write failure the stream is discarded and the next write reopens the file. Writes
 * after {@link #close()} are refused.
 */
public class JsonLinesAuditSink implements AuditSink {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesAuditSink.class);

    public static final String NAME = "file";

    private final Path file;
    private OutputStream out;
    private boolean closed;

    public JsonLinesAuditSink(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("file must not be null");
        }
        this.file = file;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public synchronized void write(AuditRecord record) throws IOException {
        if (closed) {
            throw new IOException("Audit log " + file + " is closed");
        }
        byte[] line = (record.toJsonLine() + "\n").getBytes(StandardCharsets.UTF_8);
        OutputStream stream = stream();
        try {
            stream.write(line);
            stream.flush();
        } catch (IOException e) {
            discardStream();
            throw e;
        }
    }

    @Override
    public synchronized void close() throws IOException {
        closed = true;
        if (out != null) {
            try {
                out.close();
            } finally {
                out = null;
            }
            log.info("Closed audit log {}", file);
        }
    }

    public Path file() {
        return file;
    }

    /**
     * Opens the file for appending. Called lazily before the first write and again after
     * a failed write.
     */
    protected OutputStream open(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return Files.newOutputStream(file,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
    }

    private OutputStream stream() throws IOException {
        if (out == null) {
            out = open(file);
            log.info("Appending audit records to {}", file.toAbsolutePath());
        }
        return out;
    }

    private void discardStream() {
        OutputStream failed = out;
        out = null;
        try {
            failed.close();
        } catch (IOException e) {
            log.warn("Failed to close audit log {} after a write error: {}", file, e.getMessage());
        }
    }
}
