package protocol;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 명령어 실행 결과. {@link RespProtocol#encode(Reply)}로 와이어 바이트가 됩니다.
 */
@EqualsAndHashCode
public final class Reply {

    public enum Type {
        STATUS, // +text\r\n
        BULK,   // $len\r\nbytes\r\n
        NULL    // $-1\r\n
    }

    private static final Reply NULL_REPLY = new Reply(Type.NULL, new byte[0]);

    @Getter
    private final Type type;
    private final byte[] payload;

    private Reply(Type type, byte[] payload) {
        this.type = type;
        this.payload = payload;
    }

    /**
     * 응답 내용의 복사본. 공유되는 응답 상수가 바뀌지 않도록 내부 배열은 내보내지 않습니다.
     */
    public byte[] getPayload() {
        return payload.clone();
    }

    byte[] payload() {
        return payload;
    }

    public static Reply status(String text) {
        return new Reply(Type.STATUS, text.getBytes(StandardCharsets.UTF_8));
    }

    public static Reply bulk(byte[] content) {
        return new Reply(Type.BULK, content);
    }

    public static Reply bulk(String value) {
        return value == null ? NULL_REPLY : bulk(value.getBytes(StandardCharsets.UTF_8));
    }

    public static Reply nullReply() {
        return NULL_REPLY;
    }

    @Override
    public String toString() {
        return type == Type.NULL ? "Reply(NULL)" : "Reply(" + type + ", " + new String(payload, StandardCharsets.UTF_8) + ")";
    }
}
