package org.relaychat.net;

import java.io.IOException;

/** A peer sent more than the allowed number of characters without a line break. */
public class LineTooLongException extends IOException {
    private final int maxLineLength;

    public LineTooLongException(int maxLineLength) {
        super("Line exceeds " + maxLineLength + " characters");
        this.maxLineLength = maxLineLength;
    }

    public int getMaxLineLength() {
        return maxLineLength;
    }
}
