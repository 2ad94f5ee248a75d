package command;

import protocol.ProtocolViolationException;
import protocol.Reply;
import service.StorageService;

public class GetCommand implements Command {

    private final StorageService storageService;

    public GetCommand(StorageService storageService) {
        this.storageService = storageService;
    }

    @Override
    public Reply execute(CommandQueue args) throws ProtocolViolationException {
        String key = args.nextBulkString("GET key").asString();
        // 없거나 만료된 키는 null bulk string
        return Reply.bulk(storageService.get(key));
    }
}
