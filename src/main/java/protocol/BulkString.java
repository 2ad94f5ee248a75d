package protocol;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 길이가 앞에 붙는 불투명한 바이트 문자열 ($&lt;len&gt;\r\n&lt;bytes&gt;\r\n)
 */
@Getter
@EqualsAndHashCode
public final class BulkString implements RespValue {

    private final byte[] content;

    public BulkString(byte[] content) {
        this.content = content;
    }

    public static BulkString of(String value) {
        return new BulkString(value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 내용을 UTF-8 문자열로 반환합니다. 잘못된 시퀀스는 대체 문자로 바뀝니다.
     */
    public String asString() {
        return new String(content, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "BulkString(" + asString() + ")";
    }
}
