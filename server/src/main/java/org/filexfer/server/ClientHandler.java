package org.filexfer.server;

import org.filexfer.protocol.Command;
import org.filexfer.protocol.DirectoryListing;
import org.filexfer.protocol.FilenameGuard;
import org.filexfer.protocol.FrameChannel;
import org.filexfer.protocol.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

//обслуживает одно соединение: читает команды и отвечает на них до QUIT или разрыва
public class ClientHandler implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(ClientHandler.class);

    enum State {
        AWAIT_COMMAND, LISTING, DOWNLOADING, UPLOADING, CLOSED
    }

    private final Socket clientSocket;
    private final Path servedDir;
    private final int clientId;
    private final String clientAddress;
    private FrameChannel channel;
    private State state = State.AWAIT_COMMAND;

    public ClientHandler(Socket socket, Path servedDir, int clientId) {
        this.clientSocket = socket;
        this.servedDir = servedDir;
        this.clientId = clientId;
        this.clientAddress = socket.getInetAddress().getHostAddress() + ":" + socket.getPort();
    }

    @Override
    public void run() {
        try {
            channel = FrameChannel.of(clientSocket);
            serve();
        } catch (IOException e) {
            logger.warn("[{}] client {}: connection error in state {} - {}", clientAddress, clientId, state, e.getMessage());
        } finally {
            state = State.CLOSED;
            closeResources();
        }
    }

    //цикл команд, выходит по QUIT или когда клиент закрыл соединение
    private void serve() throws IOException {
        while (true) {
            String line = channel.readLine();
            if (line == null) {
                logger.info("[{}] client {} disconnected", clientAddress, clientId);
                return;
            }

            Command command = Command.parse(line);
            logger.debug("[{}] client {}: {}", clientAddress, clientId, command);

            switch (command.getType()) {
                case LIST:
                    state = State.LISTING;
                    handleList();
                    break;
                case GET:
                    state = State.DOWNLOADING;
                    handleGet(command.getArgument());
                    break;
                case PUT:
                    state = State.UPLOADING;
                    if (!handlePut(command.getArgument())) {
                        return;
                    }
                    break;
                case QUIT:
                    logger.info("[{}] client {} quit", clientAddress, clientId);
                    return;
                default:
                    sendError(Protocol.MSG_UNKNOWN_COMMAND);
                    break;
            }
            channel.flush();
            state = State.AWAIT_COMMAND;
        }
    }

    private void handleList() throws IOException {
        String listing;
        try {
            listing = DirectoryListing.of(servedDir);
        } catch (IOException e) {
            logger.warn("[{}] client {}: cannot list {} - {}", clientAddress, clientId, servedDir, e.getMessage());
            sendError(Protocol.MSG_LIST_FAILED);
            return;
        }

        byte[] body = listing.getBytes(Protocol.STRING_ENCODING);
        channel.sendLine(Protocol.OK);
        channel.sendLine(Long.toString(body.length));
        channel.sendAll(body, 0, body.length);
    }

    private void handleGet(String filename) throws IOException {
        Path filePath = resolve(filename);
        if (filePath == null) {
            sendError(Protocol.MSG_INVALID_FILENAME);
            return;
        }

        if (!Files.isRegularFile(filePath)) {
            sendError(Protocol.MSG_FILE_NOT_FOUND);
            return;
        }

        long fileSize;
        InputStream fileIn;
        try {
            fileSize = Files.size(filePath);
            fileIn = Files.newInputStream(filePath);
        } catch (IOException e) {
            logger.warn("[{}] client {}: cannot open '{}' - {}", clientAddress, clientId, filename, e.getMessage());
            sendError(Protocol.MSG_OPEN_FAILED);
            return;
        }

        //после заголовка с размером отказ уже не сообщить, ошибка закрывает соединение
        try (InputStream in = fileIn) {
            channel.sendLine(Protocol.OK);
            channel.sendLine(Long.toString(fileSize));
            channel.copyFrom(in, fileSize);
        }
        logger.info("[{}] client {}: sent '{}', {} bytes", clientAddress, clientId, filename, fileSize);
    }

    //принимает загрузку; при отказе данные все равно вычитываются, чтобы следующая команда читалась с начала строки
    //false значит, что потоку больше нельзя доверять и сессию надо закрыть
    private boolean handlePut(String filename) throws IOException {
        Path filePath = resolve(filename);
        boolean safe = filePath != null;
        if (!safe) {
            sendError(Protocol.MSG_INVALID_FILENAME);
            channel.flush();
        }

        String sizeLine = channel.readLine();
        if (sizeLine == null) {
            return false;
        }
        long fileSize = Protocol.parseSize(sizeLine);
        if (fileSize < 0) {
            //истинный размер неизвестен, вычитывать нечего
            logger.warn("[{}] client {}: bad size header '{}'", clientAddress, clientId, sizeLine);
            if (safe) {
                sendError(Protocol.MSG_INVALID_SIZE);
            }
            return true;
        }

        if (!safe) {
            channel.drain(fileSize);
            return true;
        }

        OutputStream fileOut;
        try {
            fileOut = Files.newOutputStream(filePath);
        } catch (IOException e) {
            logger.warn("[{}] client {}: cannot create '{}' - {}", clientAddress, clientId, filename, e.getMessage());
            sendError(Protocol.MSG_CREATE_FAILED);
            channel.flush();
            channel.drain(fileSize);
            return true;
        }

        return receiveFile(fileOut, filename, fileSize);
    }

    private boolean receiveFile(OutputStream fileOut, String filename, long expectedSize) throws IOException {
        try (OutputStream out = fileOut) {
            channel.copyTo(out, expectedSize);
        } catch (EOFException e) {
            logger.warn("[{}] client {}: upload of '{}' cut short - {}", clientAddress, clientId, filename, e.getMessage());
            sendError(Protocol.MSG_TRANSFER_ERROR);
            channel.flush();
            return false;
        } catch (IOException e) {
            //запись на диск не удалась, остаток файла в потоке уже не пропустить корректно
            logger.error("[{}] client {}: failed to save '{}' - {}", clientAddress, clientId, filename, e.getMessage());
            sendError(Protocol.MSG_TRANSFER_ERROR);
            channel.flush();
            return false;
        }

        channel.sendLine(Protocol.OK);
        logger.info("[{}] client {}: received '{}', {} bytes", clientAddress, clientId, filename, expectedSize);
        return true;
    }

    //путь внутри servedDir или null, если имя не прошло проверку
    private Path resolve(String filename) {
        if (!FilenameGuard.isSafeFilename(filename)) {
            return null;
        }
        try {
            return servedDir.resolve(filename);
        } catch (InvalidPathException e) {
            return null;
        }
    }

    private void sendError(String message) throws IOException {
        channel.sendLine(Protocol.ERR);
        channel.sendLine(message);
        logger.info("[{}] client {}: {}", clientAddress, clientId, message);
    }

    private void closeResources() {
        try {
            if (channel != null) {
                channel.flush();
            }
        } catch (IOException e) {
            logger.debug("[{}] client {}: unsent data dropped - {}", clientAddress, clientId, e.getMessage());
        }
        try {
            clientSocket.close();
        } catch (IOException e) {
            logger.warn("[{}] error closing client {}: {}", clientAddress, clientId, e.getMessage());
        }
    }
}
