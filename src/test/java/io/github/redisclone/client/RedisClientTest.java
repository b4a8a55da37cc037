package io.github.redisclone.client;

import java.net.InetSocketAddress;
import java.util.Optional;

import io.github.redisclone.RedisString;
import io.github.redisclone.command.Command;
import io.github.redisclone.command.CommandResponse;
import io.github.redisclone.kv.KeyValueServer;
import io.github.redisclone.resp.RespArray;
import io.github.redisclone.resp.RespBulkString;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RedisClientTest {
    private KeyValueServer server;
    private RedisClient    client;

    @BeforeEach
    void setUp() throws Exception {
        server = KeyValueServer.start(new InetSocketAddress("127.0.0.1", 0));
        client = RedisClient.connect(server.getLocalAddress());
    }

    @AfterEach
    void tearDown() throws Exception {
        client.close();
        server.shutdown();
    }

    @Test
    void ping() throws Exception {
        client.ping();
        assertEquals(CommandResponse.pong(), client.execute(Command.ping()));
    }

    @Test
    void setThenGet() throws Exception {
        RedisString key = RedisString.utf8("mykey");
        assertEquals(Optional.empty(), client.get(key));

        client.set(key, RedisString.utf8("hello"));
        assertEquals(Optional.of(RedisString.utf8("hello")), client.get(key));

        client.set(key, RedisString.utf8("world"));
        assertEquals(Optional.of(RedisString.utf8("world")), client.get(key));
    }

    @Test
    void binarySafe() throws Exception {
        RedisString key = RedisString.wrap(new byte[]{0, '\r', '\n', (byte) 0xc3});
        RedisString value = RedisString.wrap(new byte[]{'\r', '\n', '$', '-', '1', '\r', '\n', (byte) 0xff});
        client.set(key, value);
        assertEquals(Optional.of(value), client.get(key));

        client.set(RedisString.utf8(""), RedisString.utf8(""));
        assertEquals(Optional.of(RedisString.utf8("")), client.get(RedisString.utf8("")));
    }

    @Test
    void sharedBetweenClients() throws Exception {
        client.set(RedisString.utf8("k"), RedisString.utf8("v"));
        try (RedisClient other = RedisClient.connect(server.getLocalAddress())) {
            assertEquals(Optional.of(RedisString.utf8("v")), other.get(RedisString.utf8("k")));
        }
    }

    @Test
    void unknownCommand() throws Exception {
        CommandResponse r = client.execute(Command.raw(RespArray.with(RespBulkString.withUTF8("nonsense"))));
        assertEquals(CommandResponse.Type.ERROR, r.getType());
        assertTrue(r.getError().contains("unknown command"), r.getError());

        client.ping();
    }

    @Test
    void wrongArityReply() throws Exception {
        CommandResponse r = client.execute(Command.raw(RespArray.with(RespBulkString.withUTF8("GET"))));
        assertEquals("ERR wrong number of arguments for 'get' command, expected 1 but got 0", r.getError());
    }

    @Test
    void remote() {
        assertEquals(server.getLocalAddress(), client.getRemote());
    }
}
