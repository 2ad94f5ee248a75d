package command;

import protocol.ProtocolViolationException;
import protocol.Reply;

/**
 * 모든 명령어 클래스가 구현해야 하는 공통 인터페이스
 */
public interface Command {

    /**
     * 명령어 실행 로직
     * @param args 명령어 이름 다음의 요소들. 명령어는 필요한 인자만 앞에서부터 꺼내 씁니다.
     * @return 클라이언트에게 보낼 응답
     * @throws ProtocolViolationException 필수 인자가 없거나 형식이 맞지 않을 때
     */
    Reply execute(CommandQueue args) throws ProtocolViolationException;
}
