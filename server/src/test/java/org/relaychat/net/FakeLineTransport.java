package org.relaychat.net;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketException;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * In-memory transport. The test plays the peer: {@link #peerSends} feeds the server's reads and
 * {@link #nextWritten} returns what the server wrote.
 */
public class FakeLineTransport implements LineTransport {
    private static final String EOF = new String("<eof>");

    private final String remoteAddress;
    private final BlockingQueue<String> incoming = new LinkedBlockingQueue<>();
    private final BlockingQueue<String> pending = new LinkedBlockingQueue<>();
    private final List<String> written = new CopyOnWriteArrayList<>();
    private volatile boolean failWrites;
    private volatile String failingLine;
    private volatile boolean closed;

    public FakeLineTransport(String remoteAddress) {
        this.remoteAddress = remoteAddress;
    }

    public void peerSends(String... lines) {
        for (String line : lines) {
            incoming.add(line);
        }
    }

    public void peerCloses() {
        incoming.add(EOF);
    }

    public void failWrites() {
        this.failWrites = true;
    }

    /** Fails the write of {@code line} and everything written after it. */
    public void failWritesOf(String line) {
        this.failingLine = line;
    }

    /** Next line the server wrote, or null after two seconds. */
    public String nextWritten() throws InterruptedException {
        return pending.poll(2, TimeUnit.SECONDS);
    }

    public List<String> written() {
        return List.copyOf(written);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public String readLine() throws IOException {
        String line;
        try {
            line = incoming.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted");
        }
        if (line == EOF) {
            if (closed) {
                throw new SocketException("Socket closed");
            }
            return null;
        }
        return line;
    }

    @Override
    public void writeLine(String line) throws IOException {
        if (closed) {
            throw new SocketException("Socket closed");
        }
        if (line.equals(failingLine)) {
            failWrites = true;
        }
        if (failWrites) {
            throw new SocketException("Broken pipe");
        }
        written.add(line);
        pending.add(line);
    }

    @Override
    public String remoteAddress() {
        return remoteAddress;
    }

    @Override
    public void close() {
        closed = true;
        incoming.add(EOF);
    }
}
