package com.mimecast.forwarder.state;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.OptionalLong;

/**
 * JSON file progress store.
 *
 * <p>The file holds one object with a member per progress key:
 * <pre>
 * {
 *   "alice@school.example:imap.school.example:INBOX": 1042
 * }
 * </pre>
 * <p>The whole file is read on every lookup and rewritten on every advance.
 * Writes go to a sibling temporary file which is then moved over the target, so a crash
 * leaves either the old or the new state, never a truncated one.
 * <p>A missing file is empty state. A corrupt file is logged and treated as empty state.
 * Members belonging to other keys are kept as they are.
 */
public class JsonProgressStore implements ProgressStore {
    private static final Logger log = LogManager.getLogger(JsonProgressStore.class);

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();
    private final Path path;

    /**
     * Constructs a new JsonProgressStore instance.
     *
     * @param path State file path.
     */
    public JsonProgressStore(Path path) {
        this.path = path;
    }

    @Override
    public synchronized OptionalLong getWatermark(ProgressKey key) throws IOException {
        JsonElement value = read().get(key.asKey());
        return toLong(key, value);
    }

    @Override
    public synchronized long advance(ProgressKey key, long uid) throws IOException {
        JsonObject state = read();
        OptionalLong current = toLong(key, state.get(key.asKey()));

        if (current.isPresent() && current.getAsLong() >= uid) {
            return current.getAsLong();
        }

        state.add(key.asKey(), new JsonPrimitive(uid));
        write(state);
        log.debug("Watermark advanced: key={}, from={}, to={}", key, current.isPresent() ? current.getAsLong() : "none", uid);

        return uid;
    }

    /**
     * Gets the state file path.
     *
     * @return Path.
     */
    public Path getPath() {
        return path;
    }

    private JsonObject read() throws IOException {
        if (!Files.exists(path)) {
            return new JsonObject();
        }

        String content = Files.readString(path, StandardCharsets.UTF_8);
        try {
            JsonElement element = JsonParser.parseString(content);
            if (element.isJsonObject()) {
                return element.getAsJsonObject();
            }
            log.warn("State file is not a JSON object, starting from empty state: {}", path);
        } catch (JsonParseException e) {
            log.warn("State file is corrupt, starting from empty state: {}, error={}", path, e.getMessage());
        }

        return new JsonObject();
    }

    private void write(JsonObject state) throws IOException {
        Path absolute = path.toAbsolutePath();
        Path dir = absolute.getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }

        Path tmp = Files.createTempFile(dir, absolute.getFileName().toString(), ".tmp");
        try {
            Files.writeString(tmp, gson.toJson(state), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported, replacing state file: {}", absolute);
                Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private OptionalLong toLong(ProgressKey key, JsonElement value) {
        if (value == null || !value.isJsonPrimitive()) {
            return OptionalLong.empty();
        }

        JsonPrimitive primitive = value.getAsJsonPrimitive();
        try {
            if (primitive.isNumber()) {
                return OptionalLong.of(primitive.getAsLong());
            }
            if (primitive.isString() && primitive.getAsString().trim().matches("\\d+")) {
                return OptionalLong.of(Long.parseLong(primitive.getAsString().trim()));
            }
        } catch (NumberFormatException e) {
            log.warn("Ignoring unreadable watermark for {}: {}", key, value);
        }

        return OptionalLong.empty();
    }
}
