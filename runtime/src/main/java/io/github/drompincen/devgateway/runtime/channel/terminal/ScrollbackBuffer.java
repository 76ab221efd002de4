package io.github.drompincen.devgateway.runtime.channel.terminal;

import java.util.regex.Pattern;

/**
 * Bounded terminal output history. Appends beyond the cap drop the oldest characters.
 * Not thread safe; guarded by the owning session.
 */
public class ScrollbackBuffer {

    private static final Pattern ANSI_SGR = Pattern.compile("\u001B\\[[0-9;]*m");
    private static final int PREVIEW_LENGTH = 80;

    private final int maxChars;
    private final StringBuilder buffer = new StringBuilder();

    public ScrollbackBuffer(int maxChars) {
        this.maxChars = maxChars;
    }

    public void append(String data) {
        if (data.length() >= maxChars) {
            buffer.setLength(0);
            buffer.append(data, data.length() - maxChars, data.length());
            return;
        }
        buffer.append(data);
        int overflow = buffer.length() - maxChars;
        if (overflow > 0) {
            buffer.delete(0, overflow);
        }
    }

    public String contents() {
        return buffer.toString();
    }

    public int length() {
        return buffer.length();
    }

    /** Last non-blank line with color codes removed, cut to 80 characters. */
    public String preview() {
        int end = buffer.length();
        while (end > 0) {
            int start = buffer.lastIndexOf("\n", end - 1) + 1;
            String line = buffer.substring(start, end);
            if (!line.isBlank()) {
                String plain = ANSI_SGR.matcher(line).replaceAll("");
                return plain.length() > PREVIEW_LENGTH ? plain.substring(0, PREVIEW_LENGTH) : plain;
            }
            end = start - 1;
        }
        return "";
    }
}
