package com.mimecast.forwarder.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.mimecast.forwarder.state.ProgressKey;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;

import javax.naming.ConfigurationException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Forwarder configuration container.
 *
 * <p>Values are assembled in layers, later layers winning:
 * <ol>
 *     <li>Optional JSON5 file.</li>
 *     <li>Process environment variables.</li>
 *     <li>JVM system properties with the same names.</li>
 * </ol>
 * <p>Only the keys listed in {@link #KEYS} are picked up from the environment and system properties.
 * <p>{@link #validate()} must pass before the configuration is used; any failure is fatal.
 *
 * @see MailboxConfig
 * @see RelayConfig
 */
public class ForwarderConfig extends ConfigFoundation {

    /**
     * Recognised configuration keys.
     */
    public static final List<String> KEYS = List.of(
            "SRC_EMAIL", "SRC_PASSWORD", "IMAP_HOST", "IMAP_PORT", "IMAP_SSL", "IMAP_FOLDER", "IMAP_TIMEOUT",
            "SMTP_USER", "SMTP_PASSWORD", "SMTP_HOST", "SMTP_PORT", "SMTP_SSL", "SMTP_TIMEOUT",
            "DEST_EMAIL", "POLL_INTERVAL_SECONDS", "STATE_FILE",
            "MAX_ATTEMPTS", "RETRY_BACKOFF_SECONDS", "MESSAGE_DELAY_SECONDS", "FETCH_CHUNK_BYTES");

    private final MailboxConfig mailbox;
    private final RelayConfig relay;

    /**
     * Constructs a new ForwarderConfig instance.
     *
     * @param map Configuration map.
     */
    public ForwarderConfig(Map<String, Object> map) {
        super(map);
        this.mailbox = new MailboxConfig(map);
        this.relay = new RelayConfig(map);
    }

    /**
     * Loads configuration from the current process environment and system properties.
     *
     * @param path Optional JSON5 file path, may be null.
     * @return ForwarderConfig instance.
     * @throws IOException            Unable to read file.
     * @throws ConfigurationException Unable to parse file.
     */
    public static ForwarderConfig load(String path) throws IOException, ConfigurationException {
        return load(path, System.getenv(), System.getProperties());
    }

    /**
     * Loads configuration from the given layers.
     *
     * @param path       Optional JSON5 file path, may be null.
     * @param env        Environment variables.
     * @param properties System properties.
     * @return ForwarderConfig instance.
     * @throws IOException            Unable to read file.
     * @throws ConfigurationException Unable to parse file.
     */
    @SuppressWarnings("unchecked")
    public static ForwarderConfig load(String path, Map<String, String> env, Properties properties) throws IOException, ConfigurationException {
        Map<String, Object> map = new HashMap<>();

        if (path != null) {
            String content = Files.readString(Path.of(path), StandardCharsets.UTF_8);
            try {
                Map<String, Object> file = new Gson().fromJson(content, Map.class);
                if (file != null) {
                    map.putAll(file);
                }
            } catch (JsonParseException e) {
                throw new ConfigurationException("Unable to parse configuration file " + path + ": " + e.getMessage());
            }
            log.debug("Loaded configuration file: {}", path);
        }

        for (String key : KEYS) {
            if (env.get(key) != null) {
                map.put(key, env.get(key));
            }
            if (properties.getProperty(key) != null) {
                map.put(key, properties.getProperty(key));
            }
        }

        return new ForwarderConfig(map);
    }

    /**
     * Validates every setting the forwarder needs.
     *
     * @return Self.
     * @throws ConfigurationException First invalid or missing setting.
     */
    public ForwarderConfig validate() throws ConfigurationException {
        mailbox.getAccount();
        mailbox.getPassword();
        mailbox.getHost();
        relay.getUser();
        relay.getPassword();
        relay.getHost();

        requirePositive("IMAP_PORT", mailbox.getPort());
        requirePositive("IMAP_TIMEOUT", mailbox.getTimeout());
        requirePositive("FETCH_CHUNK_BYTES", mailbox.getChunkSize());
        requirePositive("SMTP_PORT", relay.getPort());
        requirePositive("SMTP_TIMEOUT", relay.getTimeout());
        requirePositive("POLL_INTERVAL_SECONDS", getPollIntervalSeconds());
        requirePositive("MAX_ATTEMPTS", getMaxAttempts());
        requireNotNegative("RETRY_BACKOFF_SECONDS", getRetryBackoffSeconds());
        requireNotNegative("MESSAGE_DELAY_SECONDS", getMessageDelaySeconds());

        String destination = relay.getDestination();
        try {
            new InternetAddress(destination, true);
        } catch (AddressException e) {
            throw new ConfigurationException("Invalid DEST_EMAIL: " + destination);
        }

        return this;
    }

    private static void requirePositive(String key, long value) throws ConfigurationException {
        if (value <= 0) {
            throw new ConfigurationException(key + " must be positive: " + value);
        }
    }

    private static void requireNotNegative(String key, long value) throws ConfigurationException {
        if (value < 0) {
            throw new ConfigurationException(key + " must not be negative: " + value);
        }
    }

    /**
     * Gets source mailbox config.
     *
     * @return MailboxConfig.
     */
    public MailboxConfig getMailbox() {
        return mailbox;
    }

    /**
     * Gets relay config.
     *
     * @return RelayConfig.
     */
    public RelayConfig getRelay() {
        return relay;
    }

    /**
     * Gets the progress key of the configured source stream.
     *
     * @return ProgressKey.
     * @throws ConfigurationException Missing source settings.
     */
    public ProgressKey getProgressKey() throws ConfigurationException {
        return new ProgressKey(mailbox.getAccount(), mailbox.getHost(), mailbox.getFolder());
    }

    /**
     * Gets poll interval in seconds.
     *
     * @return Seconds.
     * @throws ConfigurationException Invalid value.
     */
    public long getPollIntervalSeconds() throws ConfigurationException {
        return getLongProperty("POLL_INTERVAL_SECONDS", 3600L);
    }

    /**
     * Gets progress store file path.
     *
     * @return Path string.
     */
    public String getStateFile() {
        return getStringProperty("STATE_FILE", "state.json");
    }

    /**
     * Gets attempts allowed per message.
     *
     * @return Attempts.
     * @throws ConfigurationException Invalid value.
     */
    public int getMaxAttempts() throws ConfigurationException {
        return getIntProperty("MAX_ATTEMPTS", 3);
    }

    /**
     * Gets backoff after a failed attempt in seconds.
     *
     * @return Seconds.
     * @throws ConfigurationException Invalid value.
     */
    public long getRetryBackoffSeconds() throws ConfigurationException {
        return getLongProperty("RETRY_BACKOFF_SECONDS", 2L);
    }

    /**
     * Gets delay between messages in seconds.
     *
     * @return Seconds.
     * @throws ConfigurationException Invalid value.
     */
    public long getMessageDelaySeconds() throws ConfigurationException {
        return getLongProperty("MESSAGE_DELAY_SECONDS", 3L);
    }
}
