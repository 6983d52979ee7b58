package org.filexfer.server;

import org.filexfer.protocol.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

//принимает соединения и отдает каждое отдельному потоку ClientHandler
public class Server implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(Server.class);

    private final int port;
    private final Path servedDir;
    private final AtomicInteger clientCounter = new AtomicInteger(0);
    private final Workers workers = new Workers();
    private volatile ServerSocket serverSocket;
    private volatile boolean closing;

    public Server(int port, Path servedDir) {
        this.port = port;
        this.servedDir = servedDir;
    }

    public void start() throws IOException {
        bind();
        serve();
    }

    public void bind() throws IOException {
        createServedDir();

        ServerSocket socket = new ServerSocket();
        try {
            //повторный запуск не ждет освобождения порта
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress(port), Protocol.BACKLOG);
        } catch (IOException e) {
            socket.close();
            logger.error("Failed to bind port {}: {}", port, e.getMessage());
            throw e;
        }
        serverSocket = socket;
        logger.info("Server listening on port {}, serving directory: {}", getLocalPort(), servedDir.toAbsolutePath());
    }

    //неудача не останавливает сервер, ошибки всплывут в ответах на команды
    private void createServedDir() {
        try {
            if (!Files.exists(servedDir)) {
                Files.createDirectories(servedDir);
                logger.info("Created served directory {}", servedDir.toAbsolutePath());
            }
        } catch (IOException e) {
            logger.warn("Could not create served directory {}: {}", servedDir, e.getMessage());
        }
    }

    //цикл accept в текущем потоке до ошибки или закрытия сокета, потом ждет клиентов
    public void serve() {
        if (serverSocket == null) {
            throw new IllegalStateException("bind() must be called before serve()");
        }

        while (true) {
            Socket clientSocket;
            try {
                clientSocket = serverSocket.accept();
            } catch (IOException e) {
                if (closing) {
                    logger.info("Server socket closed, stopping accept loop");
                } else {
                    logger.error("accept() failed: {}", e.getMessage());
                }
                break;
            }

            int clientId = clientCounter.incrementAndGet();
            logger.info("Accepted connection from {}:{} as client {}",
                    clientSocket.getInetAddress().getHostAddress(), clientSocket.getPort(), clientId);

            Thread clientThread = new Thread(new ClientHandler(clientSocket, servedDir, clientId), "client-" + clientId);
            clientThread.start();
            workers.track(clientThread);
        }

        shutdown();
    }

    private void shutdown() {
        logger.info("Waiting for {} client threads", workers.size());
        try {
            workers.awaitAll();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for client threads");
        }

        try {
            serverSocket.close();
        } catch (IOException e) {
            logger.warn("Error closing server socket: {}", e.getMessage());
        }
        logger.info("Server stopped");
    }

    //прерывает accept, дальше serve() сам дождется клиентов
    @Override
    public void close() throws IOException {
        closing = true;
        if (serverSocket != null) {
            serverSocket.close();
        }
    }

    public int getLocalPort() {
        return serverSocket == null ? port : serverSocket.getLocalPort();
    }

    public static void main(String[] args) {
        ServerConfig config;
        try {
            config = ServerConfig.load().applyArgs(args);
        } catch (IllegalArgumentException e) {
            System.out.println(e.getMessage());
            System.out.println("Usage: Server [--port <port>] [--dir <serve_dir>]");
            System.exit(1);
            return;
        }

        Server server = new Server(config.getPort(), config.getServedDir());
        try {
            server.start();
        } catch (IOException e) {
            System.out.println("Failed to start server: " + e.getMessage());
            System.exit(1);
        }
    }
}
