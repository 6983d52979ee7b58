package org.filexfer.client;

import org.filexfer.protocol.FrameChannel;
import org.filexfer.protocol.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;

//клиентская сторона протокола: одна команда на вызов, ответы разбираются по мере чтения
public class Client implements FileSession {
    private static final Logger logger = LoggerFactory.getLogger(Client.class);

    private final Socket socket;
    private final FrameChannel channel;
    private final Path localDir;

    public Client(String serverHost, int serverPort, Path localDir) throws IOException {
        this.socket = new Socket(serverHost, serverPort);
        this.localDir = localDir;
        FrameChannel frameChannel;
        try {
            frameChannel = FrameChannel.of(socket);
        } catch (IOException e) {
            socket.close();
            throw e;
        }
        this.channel = frameChannel;
        logger.debug("Connected to {}:{}", serverHost, serverPort);
    }

    @Override
    public String list() throws IOException {
        sendCommand(Protocol.LIST);
        long size = readSizedResponse();
        if (size > Integer.MAX_VALUE) {
            throw new IOException("Listing too large: " + size + " bytes");
        }

        byte[] body = new byte[(int) size];
        channel.recvExact(body, 0, body.length);
        return new String(body, Protocol.STRING_ENCODING);
    }

    @Override
    public long get(String filename) throws IOException {
        if (filename == null || filename.isEmpty()) {
            throw new IllegalArgumentException("Usage: GET <filename>");
        }

        sendCommand(Protocol.GET + " " + filename);
        long size = readSizedResponse();

        OutputStream fileOut;
        try {
            fileOut = Files.newOutputStream(localDir.resolve(filename));
        } catch (IOException e) {
            //файл уже идет по соединению, его надо вычитать
            channel.drain(size);
            throw new IOException("Failed to open local file for writing: " + e.getMessage(), e);
        }

        try (OutputStream out = fileOut) {
            channel.copyTo(out, size);
        } catch (EOFException e) {
            throw new EOFException("Connection error during download: " + e.getMessage());
        }
        logger.debug("Downloaded '{}', {} bytes", filename, size);
        return size;
    }

    @Override
    public long put(String filename) throws IOException {
        if (filename == null || filename.isEmpty()) {
            throw new IllegalArgumentException("Usage: PUT <filename>");
        }

        Path filePath = localDir.resolve(filename);
        if (!Files.isRegularFile(filePath)) {
            throw new NoSuchFileException(filename, null, "Local file not found");
        }

        long fileSize = Files.size(filePath);
        try (InputStream fileIn = Files.newInputStream(filePath)) {
            channel.sendLine(Protocol.PUT + " " + filename);
            channel.sendLine(Long.toString(fileSize));
            channel.copyFrom(fileIn, fileSize);
            channel.flush();
        }

        String status = channel.readLine();
        if (status == null) {
            throw new EOFException("No response after PUT");
        }
        if (status.equals(Protocol.OK)) {
            logger.debug("Uploaded '{}', {} bytes", filename, fileSize);
            return fileSize;
        }
        if (status.equals(Protocol.ERR)) {
            throw new ServerErrorException(readErrorMessage());
        }
        throw new IOException("Unexpected server response: " + status);
    }

    //QUIT остается без ответа, соединение закрывается сразу
    @Override
    public void quit() throws IOException {
        try {
            sendCommand(Protocol.QUIT);
        } finally {
            close();
        }
    }

    private void sendCommand(String line) throws IOException {
        channel.sendLine(line);
        channel.flush();
    }

    //читает OK и размер, ERR превращает в ServerErrorException
    private long readSizedResponse() throws IOException {
        String status = channel.readLine();
        if (status == null) {
            throw new EOFException("Connection closed by server");
        }

        if (status.equals(Protocol.OK)) {
            String sizeLine = channel.readLine();
            if (sizeLine == null) {
                throw new EOFException("Connection closed by server");
            }
            long size = Protocol.parseSize(sizeLine);
            if (size < 0) {
                throw new IOException("Invalid size from server: " + sizeLine);
            }
            return size;
        }
        if (status.equals(Protocol.ERR)) {
            throw new ServerErrorException(readErrorMessage());
        }
        throw new IOException("Unexpected response: " + status);
    }

    private String readErrorMessage() throws IOException {
        String message = channel.readLine();
        if (message == null) {
            throw new EOFException("Connection closed by server");
        }
        return message;
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }

    public static void main(String[] args) {
        if (args.length < 1) {
            printUsage();
            System.exit(1);
            return;
        }

        String serverHost = null;
        int serverPort = Protocol.DEFAULT_PORT;
        Path servedDir = Paths.get(".");
        boolean local = false;

        try {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (arg.equals("--local")) {
                    local = true;
                } else if (arg.equals("--port") && i + 1 < args.length) {
                    serverPort = parsePort(args[++i]);
                } else if (arg.equals("--dir") && i + 1 < args.length) {
                    servedDir = Paths.get(args[++i]);
                } else if (serverHost == null && !arg.startsWith("--")) {
                    serverHost = arg;
                } else {
                    throw new IllegalArgumentException("Unexpected argument: " + arg);
                }
            }
            if (!local && serverHost == null) {
                throw new IllegalArgumentException("Client requires host argument");
            }
        } catch (IllegalArgumentException e) {
            System.out.println(e.getMessage());
            printUsage();
            System.exit(1);
            return;
        }

        BufferedReader console = new BufferedReader(new InputStreamReader(System.in, Protocol.STRING_ENCODING));
        Path workingDir = Paths.get(".");

        if (local) {
            System.out.println("Running in local mode. Serving directory: " + servedDir.toAbsolutePath());
            new ClientConsole(new LocalSession(servedDir, workingDir), console, System.out, System.err).run();
            System.out.println("Local mode exited.");
            return;
        }

        FileSession session;
        try {
            session = new Client(serverHost, serverPort, workingDir);
        } catch (IOException e) {
            System.err.println("Failed to connect to " + serverHost + ":" + serverPort + ": " + e.getMessage());
            System.exit(1);
            return;
        }

        System.out.println("Connected to " + serverHost + ":" + serverPort);
        new ClientConsole(session, console, System.out, System.err).run();
        System.out.println("Disconnected.");
    }

    //в отличие от сервера 0 не принимается: подключиться к нему нельзя
    static int parsePort(String value) {
        int port;
        try {
            port = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port number: " + value);
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Port must be between 1 and 65535");
        }
        return port;
    }

    private static void printUsage() {
        System.out.println("Usage:");
        System.out.println("  Client <host> [--port <port>]");
        System.out.println("  Client --local [--dir <serve_dir>]");
    }
}
