package org.filexfer.protocol;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;

//строки с \n вперемешку с бинарными данными известной длины в одном потоке
//строки и байты читаются из одного буфера, поэтому данные начинаются сразу после \n заголовка
public class FrameChannel implements Closeable {
    private final InputStream in;
    private final OutputStream out;
    private final byte[] buffer = new byte[Protocol.BUFFER_SIZE];

    public FrameChannel(InputStream in, OutputStream out) {
        this.in = new BufferedInputStream(in, Protocol.BUFFER_SIZE);
        this.out = new BufferedOutputStream(out, Protocol.BUFFER_SIZE);
    }

    public static FrameChannel of(Socket socket) throws IOException {
        return new FrameChannel(socket.getInputStream(), socket.getOutputStream());
    }

    //пишет строку и завершающий \n
    public void sendLine(String line) throws IOException {
        out.write(line.getBytes(Protocol.STRING_ENCODING));
        out.write('\n');
    }

    //читает до \n и отбрасывает один \r в конце, null если поток закончился раньше
    public String readLine() throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        while (true) {
            int b = in.read();
            if (b == -1) {
                return null;
            }
            if (b == '\n') {
                break;
            }
            line.write(b);
        }

        byte[] bytes = line.toByteArray();
        int length = bytes.length;
        if (length > 0 && bytes[length - 1] == '\r') {
            length--;
        }
        return new String(bytes, 0, length, Protocol.STRING_ENCODING);
    }

    public void sendAll(byte[] data, int offset, int length) throws IOException {
        out.write(data, offset, length);
    }

    //читает ровно length байт или бросает EOFException
    public void recvExact(byte[] data, int offset, int length) throws IOException {
        int total = 0;
        while (total < length) {
            int bytesRead = in.read(data, offset + total, length - total);
            if (bytesRead == -1) {
                throw new EOFException("stream ended after " + total + " of " + length + " bytes");
            }
            total += bytesRead;
        }
    }

    //переносит ровно size байт из соединения в sink кусками по BUFFER_SIZE
    public void copyTo(OutputStream sink, long size) throws IOException {
        long remaining = size;
        while (remaining > 0) {
            int chunk = (int) Math.min(buffer.length, remaining);
            recvExact(buffer, 0, chunk);
            sink.write(buffer, 0, chunk);
            remaining -= chunk;
        }
    }

    //отправляет ровно size байт из source, короткий файл считается ошибкой
    public void copyFrom(InputStream source, long size) throws IOException {
        long remaining = size;
        while (remaining > 0) {
            int chunk = (int) Math.min(buffer.length, remaining);
            int bytesRead = source.read(buffer, 0, chunk);
            if (bytesRead == -1) {
                throw new EOFException("source ended with " + remaining + " bytes left to send");
            }
            sendAll(buffer, 0, bytesRead);
            remaining -= bytesRead;
        }
    }

    //вычитывает и выбрасывает size байт, чтобы следующая команда читалась с начала строки
    public void drain(long size) throws IOException {
        long remaining = size;
        while (remaining > 0) {
            int chunk = (int) Math.min(buffer.length, remaining);
            recvExact(buffer, 0, chunk);
            remaining -= chunk;
        }
    }

    public void flush() throws IOException {
        out.flush();
    }

    @Override
    public void close() throws IOException {
        try {
            in.close();
        } finally {
            out.close();
        }
    }
}
