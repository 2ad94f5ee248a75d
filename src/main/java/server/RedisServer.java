package server;

import command.CommandHandler;
import config.ServerConfig;
import lombok.extern.slf4j.Slf4j;
import service.StorageService;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;

/**
 * Redis 서버의 메인 클래스
 * 서버 시작, 클라이언트 연결 처리를 담당
 */
@Slf4j
public class RedisServer implements Closeable {

    private final ServerConfig config;
    private final CommandHandler commandHandler;

    private volatile ServerSocket serverSocket;
    private volatile boolean closed;

    public RedisServer(ServerConfig config, StorageService storageService) {
        this.config = config;
        this.commandHandler = new CommandHandler(storageService);
    }

    /**
     * 서버를 시작합니다. 서버가 닫힐 때까지 반환하지 않습니다.
     */
    public void start() throws IOException {
        bind();
        serve();
    }

    /**
     * 설정된 주소에 서버 소켓을 엽니다.
     *
     * @return 실제로 바인딩된 포트 (설정 포트가 0이면 임의 포트)
     */
    public int bind() throws IOException {
        serverSocket = createServerSocket(config.getHost(), config.getPort());
        log.info("Redis server listening on {}:{}", config.getHost(), serverSocket.getLocalPort());
        return serverSocket.getLocalPort();
    }

    /**
     * 연결을 받아 연결마다 새 스레드에서 처리합니다.
     */
    public void serve() {
        if (serverSocket == null) {
            throw new IllegalStateException("server socket is not bound");
        }
        log.info("Waiting for connections...");

        while (!closed) {
            try {
                Socket clientSocket = serverSocket.accept();
                log.info("Client connected: {}", clientSocket.getRemoteSocketAddress());

                // 클라이언트 연결을 별도의 스레드로 처리
                ClientHandler clientHandler = new ClientHandler(clientSocket, commandHandler);
                new Thread(clientHandler, "client-" + clientSocket.getPort()).start();
            } catch (IOException e) {
                if (closed) {
                    break;
                }
                log.error("Error accepting client connection", e);
            }
        }
        log.info("Redis server stopped");
    }

    @Override
    public void close() throws IOException {
        closed = true;
        if (serverSocket != null) {
            serverSocket.close();
        }
    }

    /**
     * 서버 소켓을 생성하고 설정합니다.
     */
    private ServerSocket createServerSocket(String host, int port) throws IOException {
        ServerSocket socket = new ServerSocket();
        // 서버 재시작 시 'Address already in use' 에러 방지
        socket.setReuseAddress(true);
        socket.bind(new InetSocketAddress(host, port));
        return socket;
    }
}
