package org.filexfer.client;

import org.filexfer.protocol.DirectoryListing;
import org.filexfer.protocol.FilenameGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

//те же команды, что у Client, но прямо над каталогом на локальном диске, без сети
public class LocalSession implements FileSession {
    private static final Logger logger = LoggerFactory.getLogger(LocalSession.class);

    private final Path servedDir;
    private final Path localDir;

    public LocalSession(Path servedDir, Path localDir) {
        this.servedDir = servedDir;
        this.localDir = localDir;
        createServedDir();
    }

    private void createServedDir() {
        try {
            Files.createDirectories(servedDir);
        } catch (IOException e) {
            logger.warn("Could not create served directory {}: {}", servedDir, e.getMessage());
        }
    }

    @Override
    public String list() throws IOException {
        return DirectoryListing.of(servedDir);
    }

    @Override
    public long get(String filename) throws IOException {
        checkFilename(filename);
        Path source = servedDir.resolve(filename);
        if (!Files.isRegularFile(source)) {
            throw new ServerErrorException("File not found on server: " + filename);
        }
        Files.copy(source, localDir.resolve(filename), StandardCopyOption.REPLACE_EXISTING);
        return Files.size(source);
    }

    @Override
    public long put(String filename) throws IOException {
        checkFilename(filename);
        Path source = localDir.resolve(filename);
        if (!Files.isRegularFile(source)) {
            throw new NoSuchFileException(filename, null, "Local file not found");
        }
        Files.copy(source, servedDir.resolve(filename), StandardCopyOption.REPLACE_EXISTING);
        return Files.size(source);
    }

    @Override
    public void quit() {
    }

    @Override
    public void close() {
    }

    private static void checkFilename(String filename) {
        if (!FilenameGuard.isSafeFilename(filename)) {
            throw new IllegalArgumentException("Invalid filename");
        }
    }
}
