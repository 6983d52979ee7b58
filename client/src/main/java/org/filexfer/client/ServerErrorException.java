package org.filexfer.client;

import java.io.IOException;

//сервер ответил ERR, сообщение берется из строки после статуса
public class ServerErrorException extends IOException {

    public ServerErrorException(String message) {
        super(message);
    }
}
