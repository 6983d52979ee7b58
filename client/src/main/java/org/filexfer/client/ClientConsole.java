package org.filexfer.client;

import org.filexfer.protocol.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.EOFException;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.NoSuchFileException;

//интерактивный цикл: строка с консоли превращается в один вызов FileSession
public class ClientConsole implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(ClientConsole.class);

    static final String PROMPT = "> ";
    static final String USAGE = "Unknown command. Supported: LIST, GET <file>, PUT <file>, QUIT";

    private final FileSession session;
    private final BufferedReader in;
    private final PrintStream out;
    private final PrintStream err;

    public ClientConsole(FileSession session, BufferedReader in, PrintStream out, PrintStream err) {
        this.session = session;
        this.in = in;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run() {
        try {
            while (true) {
                out.print(PROMPT);
                out.flush();
                String line = in.readLine();
                if (line == null) {
                    break;
                }
                if (line.isEmpty()) {
                    continue;
                }
                if (!execute(line)) {
                    break;
                }
            }
        } catch (IOException e) {
            err.println("Console read error: " + e.getMessage());
        } finally {
            closeSession();
        }
    }

    //выполняет одну введенную команду, false когда сессия закончена
    boolean execute(String line) {
        try {
            if (line.startsWith(Protocol.LIST)) {
                String listing = session.list();
                out.println("Server listing:");
                out.print(listing);
                out.println();
            } else if (line.startsWith(Protocol.GET + " ")) {
                String filename = line.substring(Protocol.GET.length() + 1);
                long size = session.get(filename);
                out.println("Downloaded " + filename + " (" + size + " bytes)");
            } else if (line.startsWith(Protocol.PUT + " ")) {
                String filename = line.substring(Protocol.PUT.length() + 1);
                session.put(filename);
                out.println("Upload successful");
            } else if (line.startsWith(Protocol.QUIT)) {
                session.quit();
                return false;
            } else {
                out.println(USAGE);
            }
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
        } catch (ServerErrorException e) {
            err.println("Server error: " + e.getMessage());
        } catch (NoSuchFileException e) {
            err.println("Local file not found: " + e.getFile());
        } catch (EOFException e) {
            //соединение закрыто или поток рассинхронизирован коротким файлом, продолжать нет смысла
            err.println(e.getMessage());
            return false;
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            logger.debug("Command '{}' failed", line, e);
        }
        return true;
    }

    private void closeSession() {
        try {
            session.close();
        } catch (IOException e) {
            logger.debug("Error closing session: {}", e.getMessage());
        }
    }
}
