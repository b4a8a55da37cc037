package io.github.redisclone.resp;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.WritableByteChannel;
import java.util.List;

public class RespWriter {
    private final WritableByteChannel byteChannel;

    public static RespWriter with(WritableByteChannel byteChannel) {
        return new RespWriter(byteChannel);
    }

    private RespWriter(WritableByteChannel byteChannel) {
        this.byteChannel = byteChannel;
    }

    public void write(RespData respData) throws IOException {
        ByteBuffer src = respData.toByteBuffer();
        while (src.hasRemaining()) {
            byteChannel.write(src);
        }
    }

    public void write(RespData... respDatas) throws IOException {
        for (RespData respData : respDatas) {
            write(respData);
        }
    }

    public void write(List<? extends RespData> respDatas) throws IOException {
        for (RespData respData : respDatas) {
            write(respData);
        }
    }
}
