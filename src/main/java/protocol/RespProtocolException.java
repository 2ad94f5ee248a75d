package protocol;

import java.io.IOException;

/**
 * 연결을 더 이상 유지할 수 없는 프로토콜 오류의 공통 상위 클래스
 */
public class RespProtocolException extends IOException {

    public RespProtocolException(String message) {
        super(message);
    }

    public RespProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
