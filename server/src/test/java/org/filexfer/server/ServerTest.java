package org.filexfer.server;

import org.filexfer.protocol.FrameChannel;
import org.filexfer.protocol.Protocol;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ServerTest {

    @TempDir
    Path root;

    private Path servedDir;
    private Server server;
    private Thread acceptThread;
    private Socket socket;
    private FrameChannel channel;

    @BeforeEach
    void setUp() throws IOException {
        servedDir = root.resolve("served");
        server = new Server(0, servedDir);
        server.bind();
        acceptThread = new Thread(server::serve, "accept");
        acceptThread.start();

        socket = new Socket("127.0.0.1", server.getLocalPort());
        channel = FrameChannel.of(socket);
    }

    @AfterEach
    void tearDown() throws Exception {
        socket.close();
        server.close();
        acceptThread.join(5000);
        assertFalse(acceptThread.isAlive());
    }

    private void send(String... lines) throws IOException {
        for (String line : lines) {
            channel.sendLine(line);
        }
        channel.flush();
    }

    private void sendPayload(String payload) throws IOException {
        byte[] bytes = payload.getBytes(StandardCharsets.US_ASCII);
        channel.sendAll(bytes, 0, bytes.length);
        channel.flush();
    }

    private byte[] readPayload() throws IOException {
        assertEquals(Protocol.OK, channel.readLine());
        long size = Protocol.parseSize(channel.readLine());
        assertTrue(size >= 0);
        byte[] body = new byte[(int) size];
        channel.recvExact(body, 0, body.length);
        return body;
    }

    private void expectError(String message) throws IOException {
        assertEquals(Protocol.ERR, channel.readLine());
        assertEquals(message, channel.readLine());
    }

    private Set<String> list() throws IOException {
        send("LIST");
        String body = new String(readPayload(), StandardCharsets.UTF_8);
        Set<String> lines = new HashSet<>();
        if (!body.isEmpty()) {
            lines.addAll(Arrays.asList(body.split("\n")));
        }
        return lines;
    }

    @Test
    void bindCreatesMissingServedDirectory() {
        assertTrue(Files.isDirectory(servedDir));
    }

    @Test
    void listOfEmptyDirectorySendsZeroLength() throws IOException {
        send("LIST");
        assertEquals("OK", channel.readLine());
        assertEquals("0", channel.readLine());
        send("LIST");
        assertEquals("OK", channel.readLine());
    }

    @Test
    void listReportsKindsAndIsRepeatable() throws IOException {
        Files.writeString(servedDir.resolve("notes.txt"), "hi");
        Files.createDirectory(servedDir.resolve("docs"));

        Set<String> first = list();
        assertEquals(Set.of("notes.txt\tfile", "docs\tdir"), first);
        assertEquals(first, list());
    }

    @Test
    void getMissingFileKeepsSessionUsable() throws IOException {
        send("GET missing.txt");
        expectError("File not found");

        assertEquals(Set.of(), list());
    }

    @Test
    void getDirectoryIsNotFound() throws IOException {
        Files.createDirectory(servedDir.resolve("docs"));
        send("GET docs");
        expectError("File not found");
    }

    @Test
    void getRejectsTraversal() throws IOException {
        Files.writeString(root.resolve("secret.txt"), "secret");
        send("GET ../secret.txt");
        expectError("Invalid filename");
        send("GET ");
        expectError("Invalid filename");
    }

    @Test
    void getSendsExactBytes() throws IOException {
        byte[] data = new byte[Protocol.BUFFER_SIZE * 3 + 5];
        new Random(42).nextBytes(data);
        Files.write(servedDir.resolve("blob.bin"), data);

        send("GET blob.bin");
        assertArrayEquals(data, readPayload());
    }

    @Test
    void getOfEmptyFileHasNoPayload() throws IOException {
        Files.createFile(servedDir.resolve("empty"));
        send("GET empty", "LIST");
        assertEquals("OK", channel.readLine());
        assertEquals("0", channel.readLine());
        assertEquals("OK", channel.readLine());
    }

    @Test
    void putStoresFileAndAnswersOk() throws IOException {
        byte[] data = "line one\nline two\n".getBytes(StandardCharsets.UTF_8);
        send("PUT upload.txt", Integer.toString(data.length));
        channel.sendAll(data, 0, data.length);
        channel.flush();

        assertEquals("OK", channel.readLine());
        assertArrayEquals(data, Files.readAllBytes(servedDir.resolve("upload.txt")));
    }

    @Test
    void putOfZeroBytesCreatesEmptyFile() throws IOException {
        send("PUT empty.dat", "0");
        assertEquals("OK", channel.readLine());
        Path file = servedDir.resolve("empty.dat");
        assertTrue(Files.isRegularFile(file));
        assertEquals(0, Files.size(file));
    }

    @Test
    void putOverwritesExistingFile() throws IOException {
        Files.writeString(servedDir.resolve("a.txt"), "a much longer original content");
        send("PUT a.txt", "3");
        sendPayload("new");
        assertEquals("OK", channel.readLine());
        assertEquals("new", Files.readString(servedDir.resolve("a.txt")));
    }

    @Test
    void putTraversalIsRejectedAndNothingIsWritten() throws IOException {
        send("PUT ../etc/passwd", "0");
        expectError("Invalid filename");

        assertFalse(Files.exists(root.resolve("etc")));
        assertEquals(Set.of(), list());
    }

    @Test
    void rejectedPutPayloadIsDrained() throws IOException {
        send("PUT ../escape.txt", "10");
        sendPayload("LIST\nLIST\n");
        expectError("Invalid filename");

        assertFalse(Files.exists(root.resolve("escape.txt")));
        assertEquals(Set.of(), list());
    }

    @Test
    void rejectedNameWithBadSizeAnswersOnce() throws IOException {
        send("PUT ../x", "abc");
        expectError("Invalid filename");

        //следующий ответ должен быть уже на LIST, а не второй ERR
        assertEquals(Set.of(), list());
    }

    @Test
    void putWithBadSizeHeaderAnswersError() throws IOException {
        send("PUT a.txt", "twelve");
        expectError("Invalid size header");
        assertFalse(Files.exists(servedDir.resolve("a.txt")));
    }

    @Test
    void putOntoDirectoryFailsAndDrains() throws IOException {
        Files.createDirectory(servedDir.resolve("docs"));
        send("PUT docs", "4");
        sendPayload("abcd");
        expectError("Failed to create file");

        assertEquals(Set.of("docs\tdir"), list());
    }

    @Test
    void truncatedUploadClosesSession() throws IOException {
        send("PUT partial.bin", "100");
        sendPayload("only a few bytes");
        socket.shutdownOutput();

        expectError("Transfer error");
        assertNull(channel.readLine());
        assertTrue(Files.size(servedDir.resolve("partial.bin")) < 100);
    }

    @Test
    void unknownCommandKeepsSessionOpen() throws IOException {
        send("HELLO");
        expectError("Unknown command");
        send("GET");
        expectError("Unknown command");
        assertEquals(Set.of(), list());
    }

    @Test
    void quitClosesWithoutResponse() throws IOException {
        send("QUIT");
        assertNull(channel.readLine());
    }

    @Test
    void crlfLinesAreAccepted() throws IOException {
        Files.writeString(servedDir.resolve("x.txt"), "x");
        sendPayload("GET x.txt\r\n");
        assertArrayEquals("x".getBytes(StandardCharsets.US_ASCII), readPayload());
    }

    @Test
    void connectionsAreIndependent() throws IOException {
        try (Socket other = new Socket("127.0.0.1", server.getLocalPort())) {
            FrameChannel otherChannel = FrameChannel.of(other);
            otherChannel.sendLine("QUIT");
            otherChannel.flush();
            assertNull(otherChannel.readLine());
        }

        send("PUT still-here.txt", "2");
        sendPayload("ok");
        assertEquals("OK", channel.readLine());
    }

    @Test
    void unusableServedDirectoryAnswersEachCommandWithError() throws Exception {
        Path plainFile = root.resolve("plain.txt");
        Files.writeString(plainFile, "x");
        Server broken = new Server(0, plainFile.resolve("served"));
        broken.bind();
        Thread brokenAccept = new Thread(broken::serve, "accept-broken");
        brokenAccept.start();

        try (Socket brokenSocket = new Socket("127.0.0.1", broken.getLocalPort())) {
            FrameChannel brokenChannel = FrameChannel.of(brokenSocket);
            brokenChannel.sendLine("LIST");
            brokenChannel.flush();
            assertEquals(Protocol.ERR, brokenChannel.readLine());
            assertEquals("Failed to list directory", brokenChannel.readLine());

            brokenChannel.sendLine("PUT a.txt");
            brokenChannel.sendLine("3");
            byte[] payload = "abc".getBytes(StandardCharsets.US_ASCII);
            brokenChannel.sendAll(payload, 0, payload.length);
            brokenChannel.flush();
            assertEquals(Protocol.ERR, brokenChannel.readLine());
            assertEquals("Failed to create file", brokenChannel.readLine());

            brokenChannel.sendLine("LIST");
            brokenChannel.flush();
            assertEquals(Protocol.ERR, brokenChannel.readLine());
            assertEquals("Failed to list directory", brokenChannel.readLine());
        } finally {
            broken.close();
            brokenAccept.join(5000);
        }
        assertFalse(brokenAccept.isAlive());
        assertTrue(Files.isRegularFile(plainFile));
    }

    @Test
    void closeStopsAcceptLoopAfterClientsFinish() throws Exception {
        assertEquals(Set.of(), list());
        server.close();
        assertEquals(Set.of(), list());
        send("QUIT");
        acceptThread.join(5000);
        assertFalse(acceptThread.isAlive());
    }
}
