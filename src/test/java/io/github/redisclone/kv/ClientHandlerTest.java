package io.github.redisclone.kv;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ByteChannel;
import java.nio.charset.StandardCharsets;

import io.github.redisclone.command.Command;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ClientHandlerTest {
    private KeyValueEngine engine;
    private long           nextId = 0;

    /**
     * 输入读完以后返回-1，输出写入内存。
     */
    private static class MemoryChannel implements ByteChannel {
        private final ByteBuffer            in;
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();
        private       boolean               open = true;

        MemoryChannel(String input) {
            this.in = ByteBuffer.wrap(input.getBytes(StandardCharsets.ISO_8859_1));
        }

        @Override
        public int read(ByteBuffer dst) throws IOException {
            if (!open) {
                throw new IOException("closed");
            }
            if (!in.hasRemaining()) {
                return -1;
            }
            int n = Math.min(dst.remaining(), in.remaining());
            ByteBuffer slice = in.slice();
            slice.limit(n);
            dst.put(slice);
            in.position(in.position() + n);
            return n;
        }

        @Override
        public int write(ByteBuffer src) throws IOException {
            if (!open) {
                throw new IOException("closed");
            }
            int n = src.remaining();
            while (src.hasRemaining()) {
                out.write(src.get());
            }
            return n;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close() {
            open = false;
        }

        String output() {
            return new String(out.toByteArray(), StandardCharsets.ISO_8859_1);
        }
    }

    @BeforeEach
    void setUp() {
        engine = KeyValueEngine.builder().build();
        engine.start();
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private ClientHandler handler(ByteChannel channel) {
        long id = nextId++;
        ResponseChannel responses = new ResponseChannel();
        engine.getRouter().register(id, responses);
        return new ClientHandler(id, channel, engine, responses);
    }

    private String serve(String input) {
        MemoryChannel channel = new MemoryChannel(input);
        handler(channel).run();
        assertFalse(channel.isOpen());
        return channel.output();
    }

    @Test
    void ping() {
        assertEquals("+PONG\r\n", serve("*1\r\n$4\r\nPING\r\n"));
    }

    @Test
    void setThenGet() {
        assertEquals("+OK\r\n$5\r\nhello\r\n",
                serve("*3\r\n$3\r\nSET\r\n$5\r\nmykey\r\n$5\r\nhello\r\n*2\r\n$3\r\nGET\r\n$5\r\nmykey\r\n"));
    }

    @Test
    void getMissingKey() {
        assertEquals("$-1\r\n", serve("*2\r\n$3\r\nGET\r\n$7\r\nmissing\r\n"));
    }

    @Test
    void unknownCommand() {
        String out = serve("*1\r\n$8\r\nnonsense\r\n");
        assertTrue(out.startsWith("-"));
        assertTrue(out.contains("unknown command"));
        assertTrue(out.endsWith("\r\n"));
        assertEquals("-unknown command: \"nonsense\"\r\n", out);
    }

    @Test
    void binaryValue() {
        assertEquals("+OK\r\n$6\r\na\r\nb\u0000c\r\n",
                serve("*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$6\r\na\r\nb\u0000c\r\n*2\r\n$3\r\nGET\r\n$1\r\nk\r\n"));
    }

    @Test
    void caseInsensitiveName() {
        assertEquals("+PONG\r\n", serve("*1\r\n$4\r\nping\r\n"));
    }

    @Test
    void valuesAreSharedBetweenConnections() {
        assertEquals("+OK\r\n", serve("*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$1\r\nv\r\n"));
        assertEquals("$1\r\nv\r\n", serve("*2\r\n$3\r\nGET\r\n$1\r\nk\r\n"));
    }

    @Test
    void commandErrorKeepsConnection() {
        String out = serve("*0\r\n$4\r\nPING\r\n*2\r\n$4\r\nPING\r\n$1\r\nx\r\n*1\r\n$4\r\nPING\r\n");
        assertEquals("-ERR command must not be an empty array\r\n"
                + "-ERR command must be an array, got RespBulkString\r\n"
                + "-ERR wrong number of arguments for 'ping' command, expected 0 but got 1\r\n"
                + "+PONG\r\n", out);
    }

    @Test
    void protocolErrorClosesConnection() {
        String out = serve("*1\r\n$4\r\nPING\r\n:1\r\n*1\r\n$4\r\nPING\r\n");
        assertEquals("+PONG\r\n-ERR Protocol error: unknown RESP type byte 0x3a\r\n", out);
    }

    @Test
    void truncatedRequest() {
        String out = serve("*2\r\n$3\r\nGET\r\n");
        assertEquals("-ERR Protocol error: truncated array element 1\r\n", out);
    }

    @Test
    void routeRemovedOnExit() {
        long id = nextId;
        serve("*1\r\n$4\r\nPING\r\n");
        assertFalse(engine.getRouter().lookup(id).isPresent());
        assertEquals(0, engine.getRouter().size());
    }

    @Test
    void engineStopped() {
        KeyValueEngine stopped = KeyValueEngine.builder().build();
        ResponseChannel responses = new ResponseChannel();
        stopped.getRouter().register(0, responses);
        MemoryChannel channel = new MemoryChannel("*1\r\n$4\r\nPING\r\n");

        new ClientHandler(0, channel, stopped, responses).run();

        assertEquals("", channel.output());
        assertFalse(channel.isOpen());
        assertEquals(0, stopped.getRouter().size());
    }

    @Test
    void ioErrorClosesChannel() throws Exception {
        ByteChannel channel = mock(ByteChannel.class);
        when(channel.read(any(ByteBuffer.class))).thenThrow(new IOException("connection reset"));

        handler(channel).run();

        verify(channel).close();
        verify(channel, never()).write(any(ByteBuffer.class));
    }

    @Test
    void parseErrorDoesNotReachEngine() throws Exception {
        KeyValueEngine mocked = mock(KeyValueEngine.class);
        when(mocked.getRouter()).thenReturn(new ResponseRouter());
        MemoryChannel channel = new MemoryChannel("*1\r\n$3\r\nGET\r\n");

        new ClientHandler(0, channel, mocked, new ResponseChannel()).run();

        assertEquals("-ERR wrong number of arguments for 'get' command, expected 1 but got 0\r\n", channel.output());
        verify(mocked, never()).submit(any(Request.class));
    }

    @Test
    void submitsWithConnectionId() throws Exception {
        KeyValueEngine mocked = mock(KeyValueEngine.class);
        when(mocked.getRouter()).thenReturn(new ResponseRouter());
        doThrow(new EngineStoppedException("stopped")).when(mocked).submit(any(Request.class));
        MemoryChannel channel = new MemoryChannel("*1\r\n$4\r\nPING\r\n");

        new ClientHandler(9, channel, mocked, new ResponseChannel()).run();

        verify(mocked).submit(new Request(9, Command.ping()));
        assertFalse(channel.isOpen());
    }
}
