package io.github.redisclone.resp;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Bytes;

import lombok.EqualsAndHashCode;
import lombok.Getter;

@EqualsAndHashCode
public class RespArray implements RespData {
    public static final char firstByte = '*';

    private static final RespArray EMPTY = new RespArray(Collections.emptyList());

    @Getter
    private final List<RespData> datas;

    public static RespArray empty() {
        return EMPTY;
    }

    public static RespArray with(List<? extends RespData> datas) {
        return new RespArray(Collections.unmodifiableList(new ArrayList<>(datas)));
    }

    public static RespArray with(RespData... datas) {
        return with(Arrays.asList(datas));
    }

    private RespArray(List<RespData> datas) {
        for (RespData data : datas) {
            Preconditions.checkNotNull(data, "resp array element");
        }
        this.datas = datas;
    }

    public int size() {
        return datas.size();
    }

    public boolean isEmpty() {
        return datas.isEmpty();
    }

    public RespData get(int i) {
        return datas.get(i);
    }

    @Override
    public byte[] toBytes() {
        byte[][] parts = new byte[datas.size() + 1][];
        parts[0] = (firstByte + String.valueOf(datas.size()) + "\r\n").getBytes(StandardCharsets.US_ASCII);
        for (int i = 0; i < datas.size(); i++) {
            parts[i + 1] = datas.get(i).toBytes();
        }
        return Bytes.concat(parts);
    }

    @Override
    public String toString() {
        final int maxLen = 20;
        return "RespArray [datas=" + datas.subList(0, Math.min(datas.size(), maxLen)) + "]";
    }
}
