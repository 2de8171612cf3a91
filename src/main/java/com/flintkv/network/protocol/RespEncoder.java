package com.flintkv.network.protocol;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * RESP reply encoder.
 *
 * <pre>
 * SIMPLE_STRING  +&lt;text&gt;\r\n
 * BULK_STRING    $&lt;byte length&gt;\r\n&lt;text&gt;\r\n
 * NULL           $-1\r\n
 * ARRAY          *&lt;count&gt;\r\n followed by count bulk strings
 * ERROR          -&lt;text&gt;\r\n
 * </pre>
 */
public final class RespEncoder {

    private static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] NULL_BULK = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    private RespEncoder() {
        // Utility class
    }

    /**
     * Encode a reply into a ByteBuffer.
     *
     * @param reply the reply to encode
     * @return ByteBuffer positioned at start, ready to read
     */
    public static ByteBuffer encode(Reply reply) {
        return ByteBuffer.wrap(toBytes(reply));
    }

    /**
     * Encode a reply into a byte array.
     *
     * @param reply the reply to encode
     * @return the wire bytes
     */
    public static byte[] toBytes(Reply reply) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        switch (reply.getType()) {
            case SIMPLE_STRING:
                writeLine(out, '+', reply.getText());
                break;
            case ERROR:
                writeLine(out, '-', reply.getText());
                break;
            case BULK_STRING:
                writeBulk(out, reply.getText());
                break;
            case NULL:
                out.writeBytes(NULL_BULK);
                break;
            case ARRAY:
                writeLine(out, '*', Integer.toString(reply.getElements().size()));
                for (String element : reply.getElements()) {
                    writeBulk(out, element);
                }
                break;
            default:
                throw new IllegalStateException("Unhandled reply type: " + reply.getType());
        }
        return out.toByteArray();
    }

    private static void writeLine(ByteArrayOutputStream out, char marker, String text) {
        out.write(marker);
        out.writeBytes(text.getBytes(StandardCharsets.UTF_8));
        out.writeBytes(CRLF);
    }

    private static void writeBulk(ByteArrayOutputStream out, String text) {
        byte[] data = text.getBytes(StandardCharsets.UTF_8);
        writeLine(out, '$', Integer.toString(data.length));
        out.writeBytes(data);
        out.writeBytes(CRLF);
    }
}
