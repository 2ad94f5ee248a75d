package protocol;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.List;

/**
 * 길이가 앞에 붙는 RESP 값의 순서 있는 목록 (*&lt;count&gt;\r\n...)
 */
@Getter
@EqualsAndHashCode
public final class RespArray implements RespValue {

    private final List<RespValue> elements;

    public RespArray(List<RespValue> elements) {
        this.elements = List.copyOf(elements);
    }

    public static RespArray of(RespValue... elements) {
        return new RespArray(List.of(elements));
    }

    public int size() {
        return elements.size();
    }

    @Override
    public String toString() {
        return "RespArray" + elements;
    }
}
