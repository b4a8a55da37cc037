package io.github.redisclone.client;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import io.github.redisclone.RedisString;
import io.github.redisclone.command.Command;
import io.github.redisclone.command.CommandParseException;
import io.github.redisclone.command.CommandResponse;
import io.github.redisclone.kv.ServerCodec;
import io.github.redisclone.resp.RespArray;
import io.github.redisclone.resp.RespBulkString;
import io.github.redisclone.resp.RespData;
import io.github.redisclone.resp.RespError;
import io.github.redisclone.resp.RespSimpleString;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ClientCodecTest {
    private ClientCodec clientCodec;
    private ServerCodec serverCodec;

    @BeforeEach
    void setUp() {
        clientCodec = new ClientCodec();
        serverCodec = new ServerCodec();
    }

    @Test
    void encodeCommand() {
        assertEquals("*1\r\n$4\r\nPING\r\n", encoded(clientCodec.encodeCommand(Command.ping())));
        assertEquals("*2\r\n$3\r\nGET\r\n$5\r\nmykey\r\n",
                encoded(clientCodec.encodeCommand(Command.get(RedisString.utf8("mykey")))));
        assertEquals("*3\r\n$3\r\nSET\r\n$5\r\nmykey\r\n$5\r\nhello\r\n",
                encoded(clientCodec.encodeCommand(Command.set(RedisString.utf8("mykey"), RedisString.utf8("hello")))));
    }

    @Test
    void encodeRawKeepsArray() {
        RespArray a = RespArray.with(RespBulkString.withUTF8("nonsense"), RespSimpleString.withUTF8("x"));
        assertSame(a, clientCodec.encodeCommand(Command.raw(a)));
    }

    @Test
    void commandRoundTrip() throws Exception {
        byte[] binary = {0, '\r', '\n', (byte) 0x80, (byte) 0xff};
        List<Command> commands = Arrays.asList(
                Command.ping(),
                Command.get(RedisString.utf8("k")),
                Command.get(RedisString.wrap(binary)),
                Command.set(RedisString.utf8(""), RedisString.utf8("")),
                Command.set(RedisString.wrap(binary), RedisString.utf8("v")));

        for (Command c : commands) {
            assertEquals(c, serverCodec.decodeCommand(clientCodec.encodeCommand(c)));
        }
    }

    @Test
    void responseRoundTrip() throws Exception {
        List<CommandResponse> responses = Arrays.asList(
                CommandResponse.pong(),
                CommandResponse.ok(),
                CommandResponse.error("unknown command: \"x\""),
                CommandResponse.bulkString(RedisString.wrap(new byte[]{'\r', '\n', 0})),
                CommandResponse.bulkString(RedisString.utf8("")),
                CommandResponse.nullBulkString());

        for (CommandResponse r : responses) {
            RespData wire = serverCodec.encodeResponse(r);
            assertEquals(r, clientCodec.decodeResponse(wire));
            assertEquals(wire, serverCodec.encodeResponse(clientCodec.decodeResponse(wire)));
        }
    }

    @Test
    void decodeResponse() throws Exception {
        assertEquals(CommandResponse.pong(), clientCodec.decodeResponse(RespSimpleString.withUTF8("PONG")));
        assertEquals(CommandResponse.ok(), clientCodec.decodeResponse(RespSimpleString.withUTF8("OK")));
        assertEquals("ERR x", clientCodec.decodeResponse(RespError.withUTF8("ERR x")).getError());
        assertFalse(clientCodec.decodeResponse(RespBulkString.nullBulkString()).getValue().isPresent());
        assertEquals(RedisString.utf8("v"),
                clientCodec.decodeResponse(RespBulkString.withUTF8("v")).getValue().get());
    }

    @Test
    void rejectUnknownSimpleString() {
        assertThrows(CommandParseException.class,
                () -> clientCodec.decodeResponse(RespSimpleString.withUTF8("QUEUED")));
        assertThrows(CommandParseException.class,
                () -> clientCodec.decodeResponse(RespSimpleString.withUTF8("pong")));
    }

    @Test
    void rejectArray() {
        assertThrows(CommandParseException.class, () -> clientCodec.decodeResponse(RespArray.empty()));
        assertThrows(CommandParseException.class,
                () -> clientCodec.decodeResponse(RespArray.with(RespSimpleString.withUTF8("OK"))));
    }

    private static String encoded(RespData data) {
        return new String(data.toBytes(), StandardCharsets.ISO_8859_1);
    }
}
