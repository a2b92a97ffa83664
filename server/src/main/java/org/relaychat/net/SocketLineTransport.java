package org.relaychat.net;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * UTF-8 lines over a (possibly TLS) socket. Incoming lines are capped at {@code maxLineLength}
 * characters; a longer line fails the read instead of growing without bound.
 */
public class SocketLineTransport implements LineTransport {
    private static final Logger log = LoggerFactory.getLogger(SocketLineTransport.class);

    private final Socket socket;
    private final BufferedReader in;
    private final BufferedWriter out;
    private final String remoteAddress;
    private final int maxLineLength;

    public SocketLineTransport(Socket socket, int maxLineLength) throws IOException {
        if (maxLineLength < 1) {
            throw new IllegalArgumentException("maxLineLength must be positive");
        }
        this.socket = socket;
        this.maxLineLength = maxLineLength;
        this.remoteAddress = String.valueOf(socket.getRemoteSocketAddress());
        this.in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        this.out = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
    }

    @Override
    public String readLine() throws IOException {
        StringBuilder line = new StringBuilder();
        int c;
        while ((c = in.read()) != -1) {
            if (c == '\n') {
                return stripCarriageReturn(line);
            }
            if (line.length() == maxLineLength) {
                throw new LineTooLongException(maxLineLength);
            }
            line.append((char) c);
        }
        // A trailing partial line is still delivered, like BufferedReader.readLine.
        return line.length() == 0 ? null : stripCarriageReturn(line);
    }

    private static String stripCarriageReturn(StringBuilder line) {
        int end = line.length();
        if (end > 0 && line.charAt(end - 1) == '\r') {
            end--;
        }
        return line.substring(0, end);
    }

    @Override
    public void writeLine(String line) throws IOException {
        out.write(line);
        out.write('\n');
        out.flush();
    }

    @Override
    public String remoteAddress() {
        return remoteAddress;
    }

    @Override
    public void close() {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing socket {}", remoteAddress, e);
        }
    }
}
