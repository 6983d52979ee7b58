package org.filexfer.server;

import org.filexfer.protocol.Protocol;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfigTest {

    @Test
    void defaultsWhenPropertiesAreEmpty() {
        ServerConfig config = ServerConfig.fromProperties(new Properties());
        assertEquals(Protocol.DEFAULT_PORT, config.getPort());
        assertEquals(Paths.get("."), config.getServedDir());
    }

    @Test
    void readsPortAndDirectoryFromProperties() {
        Properties properties = new Properties();
        properties.setProperty(ServerConfig.PORT_KEY, " 2121 ");
        properties.setProperty(ServerConfig.DIR_KEY, "shared");

        ServerConfig config = ServerConfig.fromProperties(properties);
        assertEquals(2121, config.getPort());
        assertEquals(Paths.get("shared"), config.getServedDir());
    }

    @Test
    void argumentsOverrideProperties() {
        ServerConfig config = new ServerConfig(2121, Paths.get("shared"))
                .applyArgs(new String[]{"--dir", "/srv/files", "--port", "9000"});
        assertEquals(9000, config.getPort());
        assertEquals(Paths.get("/srv/files"), config.getServedDir());
    }

    @Test
    void rejectsBadPorts() {
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.parsePort("http"));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.parsePort("65536"));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.parsePort("-1"));
    }

    @Test
    void acceptsPortZeroForEphemeralBind() {
        assertEquals(0, ServerConfig.parsePort("0"));
        assertEquals(65535, ServerConfig.parsePort("65535"));
    }

    @Test
    void rejectsUnknownArguments() {
        ServerConfig config = new ServerConfig(Protocol.DEFAULT_PORT, Paths.get("."));
        assertThrows(IllegalArgumentException.class, () -> config.applyArgs(new String[]{"--verbose"}));
        assertThrows(IllegalArgumentException.class, () -> config.applyArgs(new String[]{"--port"}));
    }

    @Test
    void loadsBundledProperties() {
        ServerConfig config = ServerConfig.load();
        assertEquals(Protocol.DEFAULT_PORT, config.getPort());
    }
}
