package com.questrail.dtchat.runtime;

import com.questrail.dtchat.config.ChatConfig;
import com.questrail.dtchat.config.ConfigException;
import com.questrail.dtchat.config.YamlChatConfigLoader;
import com.questrail.dtchat.message.MessageContent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Map;
import java.util.Optional;

/**
 * Terminal entry point.
 *
 * <p>Environment: {@code CONFIG_PATH} (default {@value #DEFAULT_CONFIG_PATH})
 * and {@code PEER_UUID} (required). Each stdin line is sent to the first room;
 * {@code /file PATH} sends a file; {@code quit} or {@code exit} stops.</p>
 */
public final class DtChatApplication
{
    private static final Logger log = LoggerFactory.getLogger(DtChatApplication.class);

    static final String DEFAULT_CONFIG_PATH = "default.yaml";
    static final String CONFIG_PATH_ENV = "CONFIG_PATH";
    static final String PEER_UUID_ENV = "PEER_UUID";

    private DtChatApplication() {
    }

    public static void main(String[] args) {
        ChatConfig config;
        try {
            config = loadConfig(System.getenv());
        } catch (ConfigException e) {
            log.error("Cannot start: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }

        PrintStream out = System.out;
        DtChatRuntime runtime = DtChatRuntime.builder()
                .withConfig(config)
                .withObserver(new TerminalChatObserver(out, config.fileReceptionDir(), ZoneId.systemDefault()))
                .build();
        runtime.start();

        Optional<String> room = runtime.store().rooms().keySet().stream().findFirst();
        out.println("Connected as " + config.localPeer().name()
                + room.map(r -> ", sending to room " + r).orElse(", no room configured"));

        try (BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                String command = line.trim();
                if (command.equals("quit") || command.equals("exit")) {
                    break;
                }
                if (command.isEmpty() || room.isEmpty()) {
                    continue;
                }
                Optional<MessageContent> content = toContent(command, out);
                content.ifPresent(c -> {
                    if (runtime.engine().sendToRoom(c, room.get(), true).isEmpty()) {
                        out.println("! nobody to send to in room " + room.get());
                    }
                });
            }
        } catch (IOException e) {
            log.error("Terminal input failed", e);
        } finally {
            runtime.stop();
        }
    }

    static ChatConfig loadConfig(Map<String, String> env) {
        String peerUuid = env.get(PEER_UUID_ENV);
        if (peerUuid == null || peerUuid.isBlank()) {
            throw new ConfigException(PEER_UUID_ENV + " is not set");
        }
        String configPath = env.getOrDefault(CONFIG_PATH_ENV, DEFAULT_CONFIG_PATH);
        return YamlChatConfigLoader.load(Path.of(configPath), peerUuid);
    }

    static Optional<MessageContent> toContent(String command, PrintStream out) {
        if (!command.startsWith("/file ")) {
            return Optional.of(new MessageContent.Text(command));
        }
        Path path = Path.of(command.substring("/file ".length()).trim());
        try {
            Path name = path.getFileName();
            return Optional.of(new MessageContent.File(
                    name != null ? name.toString() : path.toString(),
                    Files.readAllBytes(path)));
        } catch (IOException e) {
            out.println("! cannot read " + path + ": " + e.getMessage());
            return Optional.empty();
        }
    }
}
