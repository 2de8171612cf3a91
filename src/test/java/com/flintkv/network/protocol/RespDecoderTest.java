package com.flintkv.network.protocol;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class RespDecoderTest {

    private static ByteBuffer bytes(String s) {
        return ByteBuffer.wrap(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void decodeCommand_setWithArguments() {
        ByteBuffer buffer = bytes("*3\r\n$3\r\nSET\r\n$3\r\nfoo\r\n$3\r\nbar\r\n");

        Command command = RespDecoder.decodeCommand(buffer);

        assertThat(command.getName()).isEqualTo("SET");
        assertThat(command.getArgs()).containsExactly("foo", "bar");
        assertThat(buffer.hasRemaining()).isFalse();
    }

    @Test
    void decodeCommand_preservesNameCase() {
        Command command = RespDecoder.decodeCommand(bytes("*1\r\n$4\r\npInG\r\n"));

        assertThat(command.getName()).isEqualTo("pInG");
        assertThat(command.getNormalizedName()).isEqualTo("PING");
        assertThat(command.getArgs()).isEmpty();
    }

    @Test
    void decodeCommand_argumentMayContainCrlf() {
        Command command = RespDecoder.decodeCommand(bytes("*2\r\n$4\r\nECHO\r\n$4\r\na\r\nb\r\n"));

        assertThat(command.getArgs()).containsExactly("a\r\nb");
    }

    @Test
    void decodeCommand_emptyBulkString() {
        Command command = RespDecoder.decodeCommand(bytes("*2\r\n$4\r\nECHO\r\n$0\r\n\r\n"));

        assertThat(command.getArgs()).containsExactly("");
    }

    @Test
    void decodeCommand_usesByteLengthsForUtf8() {
        String value = "héllo";
        int byteLength = value.getBytes(StandardCharsets.UTF_8).length;
        ByteBuffer buffer = bytes("*2\r\n$4\r\nECHO\r\n$" + byteLength + "\r\n" + value + "\r\n");

        assertThat(RespDecoder.decodeCommand(buffer).getArgs()).containsExactly(value);
    }

    @Test
    void decodeCommand_leavesPipelinedCommandInBuffer() {
        ByteBuffer buffer = bytes("*1\r\n$4\r\nPING\r\n*2\r\n$3\r\nGET\r\n$1\r\nk\r\n");

        Command first = RespDecoder.decodeCommand(buffer);
        assertThat(first.getName()).isEqualTo("PING");
        assertThat(RespDecoder.hasCompleteCommand(buffer)).isTrue();

        Command second = RespDecoder.decodeCommand(buffer);
        assertThat(second.getName()).isEqualTo("GET");
        assertThat(second.getArgs()).containsExactly("k");
        assertThat(buffer.hasRemaining()).isFalse();
    }

    @Test
    void hasCompleteCommand_doesNotMovePosition() {
        ByteBuffer buffer = bytes("*1\r\n$4\r\nPING\r\n");

        assertThat(RespDecoder.hasCompleteCommand(buffer)).isTrue();
        assertThat(buffer.position()).isZero();
    }

    @Test
    void hasCompleteCommand_falseForEveryStrictPrefix() {
        String frame = "*2\r\n$4\r\nECHO\r\n$5\r\nhello\r\n";
        for (int cut = 0; cut < frame.length(); cut++) {
            ByteBuffer partial = bytes(frame.substring(0, cut));
            assertThat(RespDecoder.hasCompleteCommand(partial))
                .as("prefix of length %d", cut)
                .isFalse();
        }
        assertThat(RespDecoder.hasCompleteCommand(bytes(frame))).isTrue();
    }

    @Test
    void decodeCommand_incompleteFrame_throws() {
        assertThatThrownBy(() -> RespDecoder.decodeCommand(bytes("*2\r\n$4\r\nECHO\r\n$5\r\nhel")))
            .isInstanceOf(ProtocolException.class)
            .hasMessageContaining("Incomplete");
    }

    @Test
    void missingArrayMarker_isRejected() {
        assertThatThrownBy(() -> RespDecoder.hasCompleteCommand(bytes("PING\r\n")))
            .isInstanceOf(ProtocolException.class)
            .hasMessageContaining("'*'");
    }

    @Test
    void nonBulkElement_isRejected() {
        assertThatThrownBy(() -> RespDecoder.decodeCommand(bytes("*1\r\n+PING\r\n")))
            .isInstanceOf(ProtocolException.class)
            .hasMessageContaining("'$'");
    }

    @Test
    void nonNumericLength_isRejected() {
        assertThatThrownBy(() -> RespDecoder.decodeCommand(bytes("*x\r\n$4\r\nPING\r\n")))
            .isInstanceOf(ProtocolException.class)
            .hasMessageContaining("array length");
    }

    @Test
    void zeroOrNegativeArrayLength_isRejected() {
        assertThatThrownBy(() -> RespDecoder.decodeCommand(bytes("*0\r\n")))
            .isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> RespDecoder.decodeCommand(bytes("*-1\r\n")))
            .isInstanceOf(ProtocolException.class);
    }

    @Test
    void negativeBulkLength_isRejected() {
        assertThatThrownBy(() -> RespDecoder.decodeCommand(bytes("*1\r\n$-1\r\n")))
            .isInstanceOf(ProtocolException.class)
            .hasMessageContaining("bulk string length");
    }

    @Test
    void bulkLengthMismatch_isRejected() {
        // Declared 3 bytes but 4 precede the CRLF
        assertThatThrownBy(() -> RespDecoder.decodeCommand(bytes("*1\r\n$3\r\nPING\r\n")))
            .isInstanceOf(ProtocolException.class)
            .hasMessageContaining("not terminated by CRLF");
    }

    @Test
    void bareLineFeedInHeader_isRejected() {
        assertThatThrownBy(() -> RespDecoder.decodeCommand(bytes("*1\n$4\r\nPING\r\n")))
            .isInstanceOf(ProtocolException.class)
            .hasMessageContaining("CRLF");
    }

    @Test
    void overlongHeader_isRejectedWithoutWaitingForMoreData() {
        StringBuilder header = new StringBuilder("*");
        for (int i = 0; i < RespDecoder.MAX_HEADER_LENGTH + 1; i++) {
            header.append('1');
        }

        assertThatThrownBy(() -> RespDecoder.hasCompleteCommand(bytes(header.toString())))
            .isInstanceOf(ProtocolException.class)
            .hasMessageContaining("Header line");
    }

    @Test
    void emptyBuffer_isNotComplete() {
        assertThat(RespDecoder.hasCompleteCommand(ByteBuffer.allocate(0))).isFalse();
    }
}
