package protocol;

/**
 * 올바르게 디코딩된 값이 유효한 요청을 이루지 못할 때 발생합니다.
 * (최상위 값이 배열이 아님, 인자가 bulk string이 아님, 필수 인자 누락 등)
 */
public class ProtocolViolationException extends RespProtocolException {

    public ProtocolViolationException(String message) {
        super(message);
    }
}
