package command;

import protocol.ProtocolViolationException;
import protocol.Reply;

public class EchoCommand implements Command {

    @Override
    public Reply execute(CommandQueue args) throws ProtocolViolationException {
        return Reply.bulk(args.nextBulkString("ECHO value").getContent());
    }
}
