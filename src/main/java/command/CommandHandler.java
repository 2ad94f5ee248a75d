package command;

import lombok.extern.slf4j.Slf4j;
import protocol.BulkString;
import protocol.ProtocolViolationException;
import protocol.Reply;
import protocol.RespArray;
import protocol.RespValue;
import service.StorageService;

import java.io.IOException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 모든 명령어를 관리하고, 요청에 맞는 명령어를 찾아 실행하는 핸들러 클래스
 */
@Slf4j
public class CommandHandler {

    private final Map<String, Command> commandMap = new HashMap<>();

    public CommandHandler(StorageService storageService) {
        commandMap.put("ping", new PingCommand());
        commandMap.put("echo", new EchoCommand());
        commandMap.put("set", new SetCommand(storageService));
        commandMap.put("get", new GetCommand(storageService));
    }

    /**
     * 요청 배열에 담긴 명령어들을 앞에서부터 순서대로 실행하고, 응답이 나올 때마다 바로 전달합니다.
     * 알 수 없는 명령어를 만나면 배열의 나머지는 응답 없이 버립니다.
     *
     * @param request 디코딩된 최상위 값 (배열이어야 함)
     * @param out 응답을 받는 쪽
     * @throws ProtocolViolationException 요청이 배열이 아니거나 인자가 잘못된 경우
     * @throws IOException 응답 쓰기 실패
     */
    public void handleRequest(RespValue request, ReplyWriter out) throws IOException {
        if (!(request instanceof RespArray)) {
            throw new ProtocolViolationException("request must be an array, got " + request);
        }

        CommandQueue queue = new CommandQueue((RespArray) request);
        while (!queue.isEmpty()) {
            Reply reply = handleNext(queue);
            if (reply == null) {
                return;
            }
            out.write(reply);
        }
    }

    /**
     * 큐 맨 앞의 명령어 하나를 실행합니다.
     *
     * @return 응답, 알 수 없는 명령어면 null
     */
    public Reply handleNext(CommandQueue queue) throws ProtocolViolationException {
        BulkString name = queue.nextBulkString("command name");
        Command command = commandMap.get(name.asString().toLowerCase(Locale.ROOT));
        if (command == null) {
            log.debug("Unknown command '{}', dropping {} queued element(s)", name.asString(), queue.remaining());
            return null;
        }
        return command.execute(queue);
    }
}
