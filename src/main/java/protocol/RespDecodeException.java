package protocol;

/**
 * 바이트 스트림을 RESP 값으로 해석할 수 없을 때 발생합니다.
 * (숫자가 아닌 길이 헤더, 잘린 본문, 알 수 없는 타입 바이트 등)
 */
public class RespDecodeException extends RespProtocolException {

    public RespDecodeException(String message) {
        super(message);
    }

    public RespDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
