package protocol;

/**
 * 디코딩된 RESP 값. {@link BulkString} 또는 {@link RespArray} 중 하나입니다.
 */
public interface RespValue {
}
