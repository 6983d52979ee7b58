package org.filexfer.protocol;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

public class Protocol {
    public static final int DEFAULT_PORT = 12345;
    public static final int BACKLOG = 10;
    public static final int BUFFER_SIZE = 8192;

    public static final String OK = "OK";
    public static final String ERR = "ERR";

    public static final String LIST = "LIST";
    public static final String GET = "GET";
    public static final String PUT = "PUT";
    public static final String QUIT = "QUIT";

    public static final String MSG_INVALID_FILENAME = "Invalid filename";
    public static final String MSG_FILE_NOT_FOUND = "File not found";
    public static final String MSG_OPEN_FAILED = "Failed to open file";
    public static final String MSG_INVALID_SIZE = "Invalid size header";
    public static final String MSG_CREATE_FAILED = "Failed to create file";
    public static final String MSG_TRANSFER_ERROR = "Transfer error";
    public static final String MSG_LIST_FAILED = "Failed to list directory";
    public static final String MSG_UNKNOWN_COMMAND = "Unknown command";

    public static final String KIND_FILE = "file";
    public static final String KIND_DIR = "dir";
    public static final String KIND_OTHER = "other";

    public static final Charset STRING_ENCODING = StandardCharsets.UTF_8;

    private Protocol() {
    }

    //разбирает строку с размером, -1 если это не неотрицательное десятичное число
    public static long parseSize(String line) {
        if (line == null || line.isEmpty()) {
            return -1;
        }
        try {
            long size = Long.parseLong(line);
            return size < 0 ? -1 : size;
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
