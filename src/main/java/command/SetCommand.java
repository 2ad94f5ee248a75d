package command;

import protocol.BulkString;
import protocol.ProtocolViolationException;
import protocol.Reply;
import service.StorageService;

/**
 * SET key value [PX milliseconds]
 */
public class SetCommand implements Command {

    private static final Reply OK = Reply.status("OK");

    private final StorageService storageService;

    public SetCommand(StorageService storageService) {
        this.storageService = storageService;
    }

    @Override
    public Reply execute(CommandQueue args) throws ProtocolViolationException {
        String key = args.nextBulkString("SET key").asString();
        String value = args.nextBulkString("SET value").asString();

        if (!args.isEmpty()) {
            BulkString option = args.nextBulkString("SET option");
            if ("px".equalsIgnoreCase(option.asString())) {
                long ttl = parseMillis(args.nextBulkString("PX milliseconds").asString());
                storageService.setWithExpiry(key, value, expiryTime(storageService.now(), ttl));
                return OK;
            }
            // Not an option we know: leave it for the next command in the queue.
            args.pushBack(option);
        }

        storageService.set(key, value);
        return OK;
    }

    private static long expiryTime(long now, long ttl) {
        long expiresAt = now + ttl;
        // saturate instead of wrapping into the past
        return expiresAt < now ? Long.MAX_VALUE : expiresAt;
    }

    private static long parseMillis(String raw) throws ProtocolViolationException {
        try {
            long millis = Long.parseLong(raw);
            if (millis < 0 || raw.startsWith("+")) {
                throw new ProtocolViolationException("PX value must be an unsigned integer: " + raw);
            }
            return millis;
        } catch (NumberFormatException e) {
            throw new ProtocolViolationException("PX value must be an unsigned integer: " + raw);
        }
    }
}
