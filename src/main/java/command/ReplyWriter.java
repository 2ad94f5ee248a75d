package command;

import protocol.Reply;

import java.io.IOException;

/**
 * 명령어 하나가 끝날 때마다 응답을 받아 클라이언트로 보냅니다.
 */
@FunctionalInterface
public interface ReplyWriter {

    void write(Reply reply) throws IOException;
}
