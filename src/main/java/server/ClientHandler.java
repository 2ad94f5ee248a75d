package server;

import command.CommandHandler;
import lombok.extern.slf4j.Slf4j;
import protocol.Reply;
import protocol.RespProtocol;
import protocol.RespProtocolException;
import protocol.RespValue;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketException;

/**
 * 클라이언트 연결 하나를 전담하는 핸들러. 연결마다 별도의 스레드에서 실행됩니다.
 */
@Slf4j
public class ClientHandler implements Runnable {

    private final Socket clientSocket;
    private final CommandHandler commandHandler;

    public ClientHandler(Socket clientSocket, CommandHandler commandHandler) {
        this.clientSocket = clientSocket;
        this.commandHandler = commandHandler;
    }

    @Override
    public void run() {
        String clientAddress = String.valueOf(clientSocket.getRemoteSocketAddress());

        try (InputStream in = new BufferedInputStream(clientSocket.getInputStream());
             OutputStream out = new BufferedOutputStream(clientSocket.getOutputStream())) {

            handleClientLoop(in, out);

        } catch (RespProtocolException e) {
            log.warn("Closing connection to {} after protocol error: {}", clientAddress, e.getMessage());
        } catch (SocketException e) {
            log.info("Client disconnected: {} ({})", clientAddress, e.getMessage());
        } catch (IOException e) {
            log.warn("Error handling client {}", clientAddress, e);
        } finally {
            try {
                clientSocket.close();
            } catch (IOException e) {
                log.warn("Error closing client socket {}: {}", clientAddress, e.getMessage());
            }
        }

        log.info("Client connection closed: {}", clientAddress);
    }

    /**
     * 요청을 하나씩 읽어 실행하고 응답마다 flush합니다. 스트림이 요청 경계에서 끝나면 정상 반환합니다.
     *
     * @throws RespProtocolException 잘못된 입력 또는 요청 형식 위반. 연결을 끊어야 합니다.
     */
    void handleClientLoop(InputStream in, OutputStream out) throws IOException {
        RespValue request;
        while ((request = RespProtocol.decode(in)) != null) {
            log.debug("Received: {}", request);
            commandHandler.handleRequest(request, reply -> sendResponse(out, reply));
        }
    }

    /**
     * 클라이언트에게 응답을 전송합니다.
     */
    private void sendResponse(OutputStream out, Reply reply) throws IOException {
        out.write(RespProtocol.encode(reply));
        out.flush();
    }
}
