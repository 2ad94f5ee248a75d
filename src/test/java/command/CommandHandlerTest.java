package command;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import protocol.BulkString;
import protocol.ProtocolViolationException;
import protocol.Reply;
import protocol.RespArray;
import protocol.RespProtocol;
import protocol.RespValue;
import service.InMemoryStorageService;
import service.ManualTimeSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CommandHandlerTest {

    private ManualTimeSource clock;
    private InMemoryStorageService storage;
    private CommandHandler handler;

    @BeforeEach
    void setUp() {
        clock = new ManualTimeSource(0L);
        storage = new InMemoryStorageService(clock);
        handler = new CommandHandler(storage);
    }

    private static RespArray command(String... parts) {
        List<RespValue> elements = new ArrayList<>();
        for (String part : parts) {
            elements.add(BulkString.of(part));
        }
        return new RespArray(elements);
    }

    /**
     * 요청을 실행하고 인코딩된 응답들을 순서대로 돌려줍니다.
     */
    private List<String> run(RespValue request) throws IOException {
        List<String> replies = new ArrayList<>();
        handler.handleRequest(request, reply ->
                replies.add(new String(RespProtocol.encode(reply), StandardCharsets.UTF_8)));
        return replies;
    }

    @Test
    void pingRepliesPong() throws IOException {
        assertEquals(List.of("+PONG\r\n"), run(command("PING")));
    }

    @Test
    void commandNamesAreCaseInsensitive() throws IOException {
        assertEquals(List.of("+PONG\r\n"), run(command("ping")));
        assertEquals(List.of("$2\r\nhi\r\n"), run(command("eChO", "hi")));
    }

    @Test
    void commandLookupIgnoresDefaultLocale() throws IOException {
        Locale original = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            // 'I' lowercases to a dotless 'ı' under Turkish rules
            assertEquals(List.of("+PONG\r\n"), run(command("PING")));
            assertEquals(List.of("+OK\r\n"), run(command("SET", "K", "V", "PX", "10")));
            assertEquals(List.of("$1\r\nV\r\n"), run(command("GET", "K")));
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    void echoRepliesWithArgument() throws IOException {
        assertEquals(List.of("$4\r\nHIHI\r\n"), run(command("ECHO", "HIHI")));
    }

    @Test
    void setThenGet() throws IOException {
        assertEquals(List.of("+OK\r\n"), run(command("SET", "HI", "BYE")));
        assertEquals(List.of("$3\r\nBYE\r\n"), run(command("GET", "HI")));
    }

    @Test
    void getOnUnknownKeyRepliesNull() throws IOException {
        assertEquals(List.of("$-1\r\n"), run(command("GET", "BYE")));
        assertEquals(0, storage.size());
    }

    @Test
    void setWithPxExpiresLazily() throws IOException {
        run(command("SET", "K", "V", "PX", "50"));

        clock.advance(49);
        assertEquals(List.of("$1\r\nV\r\n"), run(command("GET", "K")));

        clock.advance(2);
        assertEquals(1, storage.size());
        assertEquals(List.of("$-1\r\n"), run(command("GET", "K")));
        assertEquals(0, storage.size());
    }

    @Test
    void pxOptionIsCaseInsensitive() throws IOException {
        run(command("SET", "K", "V", "px", "10"));
        clock.advance(10);
        assertEquals(List.of("$-1\r\n"), run(command("GET", "K")));
    }

    @Test
    void setWithoutPxMakesKeyPermanentAgain() throws IOException {
        run(command("SET", "K", "V", "PX", "10"));
        run(command("SET", "K", "W"));

        clock.advance(1_000_000);
        assertEquals(List.of("$1\r\nW\r\n"), run(command("GET", "K")));
    }

    @Test
    void hugePxDoesNotWrapIntoThePast() throws IOException {
        clock.advance(1_000);
        run(command("SET", "K", "V", "PX", String.valueOf(Long.MAX_VALUE)));
        assertEquals("V", storage.get("K"));
    }

    @Test
    void drainsEveryCommandInOneArray() throws IOException {
        RespArray request = command("PING", "ECHO", "x", "PING");
        assertEquals(List.of("+PONG\r\n", "$1\r\nx\r\n", "+PONG\r\n"), run(request));
    }

    @Test
    void unknownCommandDropsRestOfArrayWithoutReply() throws IOException {
        assertEquals(List.of("+PONG\r\n"), run(command("PING", "FLUSHALL", "PING")));
        assertEquals(List.of(), run(command("NOPE", "SET", "K", "V")));
        assertNull(storage.get("K"));
    }

    @Test
    void unrecognizedSetOptionIsLeftForTheNextCommand() throws IOException {
        assertEquals(List.of("+OK\r\n", "+PONG\r\n"), run(command("SET", "K", "V", "PING")));

        // EX is not an option here: it is read as an unknown command name
        assertEquals(List.of("+OK\r\n"), run(command("SET", "K", "V", "EX", "1")));
        clock.advance(10_000);
        assertEquals("V", storage.get("K"));
    }

    @Test
    void handleNextReturnsNullForUnknownCommand() throws IOException {
        CommandQueue queue = new CommandQueue(command("HELLO", "PING"));
        assertNull(handler.handleNext(queue));
        assertEquals(1, queue.remaining());
    }

    @Test
    void handleNextConsumesOnlyItsOwnArguments() throws IOException {
        CommandQueue queue = new CommandQueue(command("ECHO", "a", "GET", "k"));
        assertEquals(Reply.bulk("a"), handler.handleNext(queue));
        assertEquals(2, queue.remaining());
        assertEquals(Reply.nullReply(), handler.handleNext(queue));
        assertEquals(0, queue.remaining());
    }

    @Test
    void missingArgumentsAreProtocolViolations() {
        assertThrows(ProtocolViolationException.class, () -> run(command("ECHO")));
        assertThrows(ProtocolViolationException.class, () -> run(command("GET")));
        assertThrows(ProtocolViolationException.class, () -> run(command("SET", "K")));
        assertThrows(ProtocolViolationException.class, () -> run(command("SET", "K", "V", "PX")));
    }

    @Test
    void pxValueMustBeUnsignedInteger() {
        assertThrows(ProtocolViolationException.class, () -> run(command("SET", "K", "V", "PX", "soon")));
        assertThrows(ProtocolViolationException.class, () -> run(command("SET", "K", "V", "PX", "-5")));
        assertThrows(ProtocolViolationException.class, () -> run(command("SET", "K", "V", "PX", "+5")));
        assertNull(storage.get("K"));
    }

    @Test
    void requestMustBeAnArrayOfBulkStrings() {
        assertThrows(ProtocolViolationException.class, () -> run(BulkString.of("PING")));
        assertThrows(ProtocolViolationException.class, () -> run(RespArray.of(command("PING"))));
        assertThrows(ProtocolViolationException.class,
                () -> run(RespArray.of(BulkString.of("ECHO"), command("nested"))));
    }

    @Test
    void repliesBeforeAViolationAreStillWritten() {
        List<Reply> written = new ArrayList<>();
        assertThrows(ProtocolViolationException.class,
                () -> handler.handleRequest(command("PING", "ECHO"), written::add));
        assertEquals(Arrays.asList(Reply.status("PONG")), written);
    }

    @Test
    void sharedReplyConstantsCannotBeModifiedByCallers() throws IOException {
        List<Reply> written = new ArrayList<>();
        handler.handleRequest(command("PING"), written::add);
        byte[] payload = written.get(0).getPayload();
        payload[0] = 'X';

        assertEquals(List.of("+PONG\r\n"), run(command("PING")));
    }

    @Test
    void emptyArrayProducesNoReplies() throws IOException {
        assertEquals(List.of(), run(RespArray.of()));
    }
}
