package org.relaychat.net;

import java.io.Closeable;
import java.io.IOException;

/**
 * A bidirectional, line oriented byte stream. One line is one protocol token or one encoded envelope.
 */
public interface LineTransport extends Closeable {

    /**
     * Blocks until a full line arrives.
     *
     * @return the line without its terminator, or {@code null} once the peer closed the stream
     */
    String readLine() throws IOException;

    void writeLine(String line) throws IOException;

    String remoteAddress();

    /** Closing unblocks a pending {@link #readLine()} on another thread. Never throws. */
    @Override
    void close();
}
