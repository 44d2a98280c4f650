package tech.noetzold.guardrail_api.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import tech.noetzold.guardrail_api.model.AuditEvent;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.regex.Pattern;

/**
 * Writes one JSON object per line. Each event is appended and synced in a single write,
 * so a crash can lose at most the line being written.
 */
@Slf4j
public class JsonlAuditSink implements AuditSink {

    private static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");
    private static final Pattern PHONE = Pattern.compile("\\b(\\+?\\d[\\d\\- ]{8,}\\d)\\b");
    private static final Pattern IPV4 = Pattern.compile("\\b(?:\\d{1,3}\\.){3}\\d{1,3}\\b");

    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonlAuditSink(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create audit directory for " + path, e);
        }
        log.info("Audit events go to {}", path.toAbsolutePath());
    }

    @Override
    public synchronized void append(AuditEvent event) {
        AuditEvent masked = event.toBuilder().reason(mask(event.getReason())).build();
        try {
            byte[] line = (objectMapper.writeValueAsString(masked) + "\n").getBytes(StandardCharsets.UTF_8);
            Files.write(path, line,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND,
                    StandardOpenOption.WRITE, StandardOpenOption.SYNC);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise audit event " + event.getRequestId(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot append audit event to " + path, e);
        }
    }

    static String mask(String text) {
        if (text == null || text.isEmpty()) return text;
        String out = EMAIL.matcher(text).replaceAll("[EMAIL]");
        out = PHONE.matcher(out).replaceAll("[PHONE]");
        return IPV4.matcher(out).replaceAll("[IPV4]");
    }
}
