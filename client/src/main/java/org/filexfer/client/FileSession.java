package org.filexfer.client;

import java.io.Closeable;
import java.io.IOException;

//операции, на которые консоль отображает команды: по сети в Client, локально в LocalSession
public interface FileSession extends Closeable {

    String list() throws IOException;

    //возвращает число полученных байт
    long get(String filename) throws IOException;

    //возвращает число отправленных байт
    long put(String filename) throws IOException;

    void quit() throws IOException;
}
