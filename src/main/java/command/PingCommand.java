package command;

import protocol.Reply;

public class PingCommand implements Command {

    private static final Reply PONG = Reply.status("PONG");

    @Override
    public Reply execute(CommandQueue args) {
        return PONG;
    }
}
