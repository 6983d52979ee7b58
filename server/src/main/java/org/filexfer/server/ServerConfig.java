package org.filexfer.server;

import org.filexfer.protocol.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

//настройки сервера: значения по умолчанию, файл filexfer.properties и аргументы командной строки
public class ServerConfig {
    private static final Logger logger = LoggerFactory.getLogger(ServerConfig.class);

    static final String PROPERTIES_FILE = "filexfer.properties";
    static final String PORT_KEY = "server.port";
    static final String DIR_KEY = "server.dir";

    private int port;
    private Path servedDir;

    public ServerConfig(int port, Path servedDir) {
        this.port = port;
        this.servedDir = servedDir;
    }

    public static ServerConfig load() {
        return fromProperties(loadProperties(PROPERTIES_FILE));
    }

    static ServerConfig fromProperties(Properties properties) {
        int port = Protocol.DEFAULT_PORT;
        String portValue = properties.getProperty(PORT_KEY);
        if (portValue != null) {
            port = parsePort(portValue.trim());
        }

        String dir = properties.getProperty(DIR_KEY, ".");
        return new ServerConfig(port, Paths.get(dir.trim()));
    }

    //флаги --port и --dir перекрывают значения из файла
    public ServerConfig applyArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("--port") && i + 1 < args.length) {
                port = parsePort(args[++i]);
            } else if (arg.equals("--dir") && i + 1 < args.length) {
                servedDir = Paths.get(args[++i]);
            } else {
                throw new IllegalArgumentException("Unexpected argument: " + arg);
            }
        }
        return this;
    }

    //0 допустим: сервер займет свободный порт
    static int parsePort(String value) {
        int port;
        try {
            port = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port number: " + value);
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port must be between 0 and 65535");
        }
        return port;
    }

    private static Properties loadProperties(String resource) {
        Properties properties = new Properties();
        try (InputStream input = ServerConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                logger.debug("No {} on classpath, using defaults", resource);
                return properties;
            }
            properties.load(input);
        } catch (IOException e) {
            logger.warn("Cannot read {}: {}", resource, e.getMessage());
        }
        return properties;
    }

    public int getPort() {
        return port;
    }

    public Path getServedDir() {
        return servedDir;
    }
}
