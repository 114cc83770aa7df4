package com.mimecast.forwarder.state;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class JsonProgressStoreTest {

    private static final ProgressKey KEY = new ProgressKey("user@example.com", "imap.example.com", "INBOX");

    @TempDir
    Path tempDir;

    @Test
    void testMissingFileIsEmpty() throws Exception {
        JsonProgressStore store = new JsonProgressStore(tempDir.resolve("state.json"));

        assertEquals(OptionalLong.empty(), store.getWatermark(KEY));
        assertFalse(Files.exists(store.getPath()));
    }

    @Test
    void testAdvanceSurvivesReopen() throws Exception {
        Path file = tempDir.resolve("state.json");

        assertEquals(42L, new JsonProgressStore(file).advance(KEY, 42L));

        assertEquals(OptionalLong.of(42L), new JsonProgressStore(file).getWatermark(KEY));
    }

    @Test
    void testWatermarkNeverDecreases() throws Exception {
        JsonProgressStore store = new JsonProgressStore(tempDir.resolve("state.json"));

        store.advance(KEY, 10L);
        assertEquals(10L, store.advance(KEY, 7L));
        assertEquals(OptionalLong.of(10L), store.getWatermark(KEY));

        assertEquals(11L, store.advance(KEY, 11L));
    }

    @Test
    void testFileFormatKeepsOtherKeys() throws Exception {
        Path file = tempDir.resolve("state.json");
        Files.writeString(file, "{\"other@example.com:imap.other.com:Archive\": 99}", StandardCharsets.UTF_8);

        new JsonProgressStore(file).advance(KEY, 5L);

        JsonObject json = JsonParser.parseString(Files.readString(file, StandardCharsets.UTF_8)).getAsJsonObject();
        assertEquals(99L, json.get("other@example.com:imap.other.com:Archive").getAsLong());
        assertEquals(5L, json.get("user@example.com:imap.example.com:INBOX").getAsLong());
    }

    @Test
    void testCorruptFileIsEmpty() throws Exception {
        Path file = tempDir.resolve("state.json");
        Files.writeString(file, "{not json at all", StandardCharsets.UTF_8);
        JsonProgressStore store = new JsonProgressStore(file);

        assertEquals(OptionalLong.empty(), store.getWatermark(KEY));
        assertEquals(3L, store.advance(KEY, 3L));
        assertEquals(OptionalLong.of(3L), store.getWatermark(KEY));
    }

    @Test
    void testNonObjectFileIsEmpty() throws Exception {
        Path file = tempDir.resolve("state.json");
        Files.writeString(file, "[1, 2, 3]", StandardCharsets.UTF_8);

        assertEquals(OptionalLong.empty(), new JsonProgressStore(file).getWatermark(KEY));
    }

    @Test
    void testNumericStringWatermark() throws Exception {
        Path file = tempDir.resolve("state.json");
        Files.writeString(file, "{\"" + KEY.asKey() + "\": \"17\"}", StandardCharsets.UTF_8);

        assertEquals(OptionalLong.of(17L), new JsonProgressStore(file).getWatermark(KEY));
    }

    @Test
    void testNoTemporaryFilesLeft() throws Exception {
        Path file = tempDir.resolve("nested").resolve("state.json");
        JsonProgressStore store = new JsonProgressStore(file);

        store.advance(KEY, 1L);
        store.advance(KEY, 2L);

        try (var files = Files.list(file.getParent())) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void testKeyFormat() {
        assertEquals("user@example.com:imap.example.com:INBOX", KEY.asKey());
        assertEquals(KEY, new ProgressKey("user@example.com", "imap.example.com", "INBOX"));
        assertNotEquals(KEY, new ProgressKey("user@example.com", "imap.example.com", "Sent"));
    }
}
