package com.flintkv.network.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP request decoder.
 *
 * Accepted request format (array of bulk strings):
 * <pre>
 * *&lt;count&gt;\r\n
 * $&lt;len&gt;\r\n&lt;data&gt;\r\n     (repeated count times)
 * </pre>
 *
 * Length headers are parsed and checked against the data that follows, so a
 * frame is either decoded exactly or rejected. Frames may arrive split over
 * several reads: callers buffer bytes and ask {@link #hasCompleteCommand}
 * before decoding.
 */
public final class RespDecoder {

    // Maximum sizes
    public static final int MAX_ARRAY_LENGTH = 1024 * 1024;
    public static final int MAX_BULK_LENGTH = 16 * 1024 * 1024; // 16MB max argument
    // Longest "<marker><digits>\r\n" header we wait for before giving up
    static final int MAX_HEADER_LENGTH = 32;

    private static final byte ARRAY_MARKER = '*';
    private static final byte BULK_MARKER = '$';

    private RespDecoder() {
        // Utility class
    }

    /**
     * Check if a buffer holds at least one complete command frame.
     * The buffer position is not changed.
     *
     * @param buffer the buffer to check, in read mode
     * @return true if a complete command is available
     * @throws ProtocolException if the buffered bytes can never form a valid frame
     */
    public static boolean hasCompleteCommand(ByteBuffer buffer) {
        return scan(buffer, null) >= 0;
    }

    /**
     * Decode one command from a buffer, advancing its position past the frame.
     * Bytes after the frame (pipelined commands) are left in place.
     *
     * @param buffer the buffer to decode from, in read mode
     * @return the decoded command
     * @throws ProtocolException if the frame is malformed or incomplete
     */
    public static Command decodeCommand(ByteBuffer buffer) {
        List<String> tokens = new ArrayList<>();
        int end = scan(buffer, tokens);
        if (end < 0) {
            throw new ProtocolException("Incomplete command: only " + buffer.remaining() + " bytes buffered");
        }
        buffer.position(end);
        return new Command(tokens.get(0), tokens.subList(1, tokens.size()));
    }

    /**
     * Walk one frame starting at the buffer position.
     *
     * @param tokens receives decoded tokens, or null to only measure
     * @return absolute index just past the frame, or -1 if more bytes are needed
     */
    private static int scan(ByteBuffer buffer, List<String> tokens) {
        int start = buffer.position();
        int limit = buffer.limit();
        if (start >= limit) {
            return -1;
        }

        byte first = buffer.get(start);
        if (first != ARRAY_MARKER) {
            throw new ProtocolException("Expected '*' at start of command, got " + describe(first));
        }
        int headerEnd = findLineEnd(buffer, start + 1, limit);
        if (headerEnd < 0) {
            return -1;
        }
        int count = parseLength(buffer, start + 1, headerEnd, "array");
        if (count < 1 || count > MAX_ARRAY_LENGTH) {
            throw new ProtocolException("Invalid array length: " + count);
        }

        int cursor = headerEnd + 2;
        for (int i = 0; i < count; i++) {
            if (cursor >= limit) {
                return -1;
            }
            byte marker = buffer.get(cursor);
            if (marker != BULK_MARKER) {
                throw new ProtocolException("Expected '$' for element " + i + ", got " + describe(marker));
            }
            int lineEnd = findLineEnd(buffer, cursor + 1, limit);
            if (lineEnd < 0) {
                return -1;
            }
            int length = parseLength(buffer, cursor + 1, lineEnd, "bulk string");
            if (length < 0 || length > MAX_BULK_LENGTH) {
                throw new ProtocolException("Invalid bulk string length: " + length);
            }

            int dataStart = lineEnd + 2;
            long dataEnd = (long) dataStart + length;
            if (dataEnd + 2 > limit) {
                return -1;
            }
            if (buffer.get((int) dataEnd) != '\r' || buffer.get((int) dataEnd + 1) != '\n') {
                throw new ProtocolException("Bulk string for element " + i
                        + " is not terminated by CRLF after " + length + " bytes");
            }
            if (tokens != null) {
                tokens.add(readString(buffer, dataStart, length));
            }
            cursor = (int) dataEnd + 2;
        }
        return cursor;
    }

    /**
     * Find the CR of the CRLF ending a header line.
     *
     * @return index of CR, or -1 if the line is not complete yet
     */
    private static int findLineEnd(ByteBuffer buffer, int from, int limit) {
        for (int i = from; i < limit; i++) {
            byte b = buffer.get(i);
            if (b == '\n') {
                if (i == from || buffer.get(i - 1) != '\r') {
                    throw new ProtocolException("Header line not terminated by CRLF");
                }
                return i - 1;
            }
            if (i - from >= MAX_HEADER_LENGTH) {
                throw new ProtocolException("Header line exceeds " + MAX_HEADER_LENGTH + " bytes");
            }
        }
        return -1;
    }

    private static int parseLength(ByteBuffer buffer, int from, int to, String what) {
        if (from == to) {
            throw new ProtocolException("Missing " + what + " length");
        }
        boolean negative = buffer.get(from) == '-';
        int i = negative ? from + 1 : from;
        if (i == to) {
            throw new ProtocolException("Invalid " + what + " length: '-'");
        }
        long value = 0;
        for (; i < to; i++) {
            byte b = buffer.get(i);
            if (b < '0' || b > '9') {
                throw new ProtocolException("Invalid " + what + " length: '"
                        + readString(buffer, from, to - from) + "'");
            }
            value = value * 10 + (b - '0');
            if (value > Integer.MAX_VALUE) {
                throw new ProtocolException("Invalid " + what + " length: too large");
            }
        }
        return (int) (negative ? -value : value);
    }

    private static String readString(ByteBuffer buffer, int from, int length) {
        byte[] bytes = new byte[length];
        ByteBuffer view = buffer.duplicate();
        view.position(from);
        view.get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static String describe(byte b) {
        if (b >= 0x20 && b < 0x7F) {
            return "'" + (char) b + "'";
        }
        return String.format("0x%02X", b & 0xFF);
    }
}
