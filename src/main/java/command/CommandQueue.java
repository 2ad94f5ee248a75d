package command;

import protocol.BulkString;
import protocol.ProtocolViolationException;
import protocol.RespArray;
import protocol.RespValue;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 요청 배열 하나의 요소들을 앞에서부터 소비하는 큐
 */
public class CommandQueue {

    private final Deque<RespValue> elements;

    public CommandQueue(RespArray request) {
        this.elements = new ArrayDeque<>(request.getElements());
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public int remaining() {
        return elements.size();
    }

    /**
     * 다음 요소를 필수 bulk string으로 꺼냅니다.
     *
     * @param what 오류 메시지에 쓸 인자 이름
     */
    public BulkString nextBulkString(String what) throws ProtocolViolationException {
        RespValue value = elements.pollFirst();
        if (value == null) {
            throw new ProtocolViolationException("missing " + what);
        }
        if (!(value instanceof BulkString)) {
            throw new ProtocolViolationException(what + " must be a bulk string, got " + value);
        }
        return (BulkString) value;
    }

    public void pushBack(BulkString value) {
        elements.addFirst(value);
    }
}
