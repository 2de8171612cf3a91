package com.flintkv.network.protocol;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable reply produced by command dispatch and consumed by {@link RespEncoder}.
 */
public final class Reply {

    /**
     * Reply variants supported on the wire.
     */
    public enum Type {
        SIMPLE_STRING,
        BULK_STRING,
        NULL,
        ARRAY,
        ERROR
    }

    private static final Reply OK = new Reply(Type.SIMPLE_STRING, "OK", null);
    private static final Reply PONG = new Reply(Type.SIMPLE_STRING, "PONG", null);
    private static final Reply NULL = new Reply(Type.NULL, null, null);

    private final Type type;
    private final String text;          // SIMPLE_STRING, BULK_STRING, ERROR
    private final List<String> elements; // ARRAY

    private Reply(Type type, String text, List<String> elements) {
        this.type = type;
        this.text = text;
        this.elements = elements;
    }

    /**
     * Create a simple string reply. The text must not contain CR or LF.
     */
    public static Reply simpleString(String text) {
        requireLine(text);
        return new Reply(Type.SIMPLE_STRING, text, null);
    }

    public static Reply bulkString(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Bulk string cannot be null, use nullReply()");
        }
        return new Reply(Type.BULK_STRING, text, null);
    }

    public static Reply nullReply() {
        return NULL;
    }

    public static Reply array(List<String> elements) {
        if (elements == null) {
            throw new IllegalArgumentException("Array elements cannot be null");
        }
        return new Reply(Type.ARRAY, null, List.copyOf(elements));
    }

    public static Reply array(String... elements) {
        return array(Arrays.asList(elements));
    }

    /**
     * Create an error reply. The text must not contain CR or LF.
     */
    public static Reply error(String message) {
        requireLine(message);
        return new Reply(Type.ERROR, message, null);
    }

    public static Reply ok() {
        return OK;
    }

    public static Reply pong() {
        return PONG;
    }

    public Type getType() {
        return type;
    }

    /**
     * Get the text of a simple string, bulk string or error reply.
     *
     * @return the text, or null for NULL and ARRAY replies
     */
    public String getText() {
        return text;
    }

    /**
     * Get the elements of an array reply.
     *
     * @return the elements, empty for non-array replies
     */
    public List<String> getElements() {
        return elements != null ? elements : Collections.emptyList();
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    public boolean isNull() {
        return type == Type.NULL;
    }

    private static void requireLine(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Reply text cannot be null");
        }
        if (text.indexOf('\r') >= 0 || text.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("Reply text cannot contain CR or LF");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Reply reply = (Reply) o;
        return type == reply.type &&
               Objects.equals(text, reply.text) &&
               Objects.equals(elements, reply.elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, elements);
    }

    @Override
    public String toString() {
        switch (type) {
            case NULL: return "Reply{NULL}";
            case ARRAY: return "Reply{ARRAY, size=" + elements.size() + '}';
            default: return "Reply{" + type + ", text='" + text + "'}";
        }
    }
}
