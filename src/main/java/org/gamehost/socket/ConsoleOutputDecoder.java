package org.gamehost.socket;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * 控制台输出的流式 UTF-8 解码
 * 帧边界可能切断多字节字符，不完整的尾部字节留到下一帧一起解码
 */
class ConsoleOutputDecoder {

    private static final byte[] EMPTY = new byte[0];

    private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPLACE)
        .onUnmappableCharacter(CodingErrorAction.REPLACE);
    private byte[] pending = EMPTY;

    /**
     * 解码一帧，返回可以完整输出的文本（可能为空串）
     */
    synchronized String decode(byte[] payload) {
        return decode(payload, false);
    }

    /**
     * 流结束时输出剩余字节，残缺字符替换为 U+FFFD
     */
    synchronized String finish() {
        String rest = decode(EMPTY, true);
        decoder.reset();
        return rest;
    }

    private String decode(byte[] payload, boolean endOfInput) {
        ByteBuffer in = ByteBuffer.allocate(pending.length + payload.length);
        in.put(pending).put(payload).flip();
        // UTF-8 解码出的字符数不超过字节数
        CharBuffer out = CharBuffer.allocate(in.remaining() + 1);
        decoder.decode(in, out, endOfInput);
        if (endOfInput) {
            decoder.flush(out);
        }
        pending = new byte[in.remaining()];
        in.get(pending);
        out.flip();
        return out.toString();
    }
}
