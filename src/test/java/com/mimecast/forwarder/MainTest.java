package com.mimecast.forwarder;

import org.apache.commons.cli.Options;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @TempDir
    Path tempDir;

    @Test
    void testOptions() {
        Options options = Main.options();

        assertTrue(options.hasLongOption("once"));
        assertTrue(options.hasOption("c"));
        assertTrue(options.getOption("conf").hasArg());
        assertTrue(options.hasOption("h"));
    }

    @Test
    void testHelp() {
        assertEquals(Main.EXIT_OK, Main.run(new String[]{"--help"}));
    }

    @Test
    void testUnknownOption() {
        assertEquals(Main.EXIT_CONFIG, Main.run(new String[]{"--bogus"}));
    }

    @Test
    void testMissingConfigFile() {
        String path = tempDir.resolve("missing.json5").toString();
        assertEquals(Main.EXIT_CONFIG, Main.run(new String[]{"--once", "-c", path}));
    }

    @Test
    void testInvalidConfigFile() throws Exception {
        Path file = tempDir.resolve("forwarder.json5");
        Files.writeString(file, "{\n" +
                "  SRC_EMAIL: 'user@example.com',\n" +
                "  SRC_PASSWORD: 'secret',\n" +
                "  IMAP_HOST: 'imap.example.com',\n" +
                "  SMTP_USER: 'relay@example.com',\n" +
                "  SMTP_PASSWORD: 'secret',\n" +
                "  SMTP_HOST: 'smtp.example.com',\n" +
                "  DEST_EMAIL: 'dest@example.com',\n" +
                "  MAX_ATTEMPTS: 0\n" +
                "}\n");

        assertEquals(Main.EXIT_CONFIG, Main.run(new String[]{"--once", "-c", file.toString()}));
    }
}
