package com.questrail.dtchat.runtime;

import com.questrail.dtchat.message.ChatMessage;
import com.questrail.dtchat.message.MessageContent;
import com.questrail.dtchat.observability.ChatEvent;
import com.questrail.dtchat.observability.ChatEventObserver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Prints chat activity for a terminal user and stores received files under
 * the configured reception directory.
 */
final class TerminalChatObserver implements ChatEventObserver
{
    private static final Logger log = LoggerFactory.getLogger(TerminalChatObserver.class);

    static final String FALLBACK_NAME = "received.bin";

    private final PrintStream out;
    private final Path fileReceptionDir;
    private final ZoneId zone;

    TerminalChatObserver(PrintStream out, Path fileReceptionDir, ZoneId zone) {
        this.out = Objects.requireNonNull(out, "out");
        this.fileReceptionDir = Objects.requireNonNull(fileReceptionDir, "fileReceptionDir");
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    @Override
    public void onEvent(ChatEvent event) {
        if (event instanceof ChatEvent.Info info && info.message().isPresent()) {
            ChatMessage m = info.message().get();
            switch (info.kind()) {
                case RECEIVED -> {
                    out.printf("[%s] %s: %s%n", m.sendTime().format(false, true, null, zone),
                            m.senderUuid(), m.content().describe());
                    if (m.content() instanceof MessageContent.File file) {
                        save(file);
                    }
                }
                case SENT -> out.printf("  sent %s%n", shortId(m));
                case ACK_RECEIVED -> {
                    out.printf("  %s received by peer at %s%n", shortId(m),
                            m.receiveTime().map(t -> t.format(false, true, null, zone)).orElse("?"));
                    m.deliveryTimestamps().predictionErrorMillis().ifPresent(delta ->
                            out.printf("  %s arrival was %+d ms off prediction%n", shortId(m), delta));
                }
                default -> {
                }
            }
        } else if (event instanceof ChatEvent.Info info) {
            out.println("* " + info.detail());
        } else if (event instanceof ChatEvent.Error error) {
            out.println("! " + error.kind() + ": " + error.detail());
        }
    }

    /**
     * Writes a received file, keeping only the last path segment of its name.
     */
    Path save(MessageContent.File file) {
        Path target = fileReceptionDir.resolve(baseName(file.name()));
        try {
            Files.createDirectories(fileReceptionDir);
            Files.write(target, file.data());
            out.println("  saved " + target);
        } catch (IOException e) {
            log.warn("Could not store received file {}", target, e);
        }
        return target;
    }

    /**
     * Last path segment of a peer-supplied name, or {@value #FALLBACK_NAME} when
     * the name is not a usable file name on this platform.
     */
    static String baseName(String wireName) {
        Path last;
        try {
            last = Path.of(wireName).getFileName();
        } catch (InvalidPathException e) {
            log.debug("Received file name '{}' is not a valid path: {}", wireName, e.getMessage());
            return FALLBACK_NAME;
        }
        String name = last == null ? "" : last.toString();
        if (name.isEmpty() || name.equals(".") || name.equals("..")) {
            return FALLBACK_NAME;
        }
        return name;
    }

    private static String shortId(ChatMessage m) {
        return m.uuid().length() > 8 ? m.uuid().substring(0, 8) : m.uuid();
    }
}
