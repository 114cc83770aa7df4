package com.mimecast.forwarder.config;

import javax.naming.ConfigurationException;
import java.util.Map;

/**
 * Source mailbox configuration.
 *
 * <p>This class provides type safe access to the IMAP source settings.
 * <p>TLS is used when either the explicit flag is set or the port is the implicit TLS port.
 */
public class MailboxConfig extends ConfigFoundation {

    /**
     * Implicit TLS port for IMAP.
     */
    public static final int IMPLICIT_TLS_PORT = 993;

    /**
     * Constructs a new MailboxConfig instance.
     *
     * @param map Configuration map.
     */
    public MailboxConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets source account.
     *
     * @return Account string.
     * @throws ConfigurationException Missing value.
     */
    public String getAccount() throws ConfigurationException {
        return getRequiredStringProperty("SRC_EMAIL");
    }

    /**
     * Gets source credential.
     *
     * @return Password string.
     * @throws ConfigurationException Missing value.
     */
    public String getPassword() throws ConfigurationException {
        return getRequiredStringProperty("SRC_PASSWORD");
    }

    /**
     * Gets IMAP host.
     *
     * @return Host string.
     * @throws ConfigurationException Missing value.
     */
    public String getHost() throws ConfigurationException {
        return getRequiredStringProperty("IMAP_HOST");
    }

    /**
     * Gets IMAP port.
     *
     * @return Port number.
     * @throws ConfigurationException Invalid value.
     */
    public int getPort() throws ConfigurationException {
        return getIntProperty("IMAP_PORT", IMPLICIT_TLS_PORT);
    }

    /**
     * Checks if TLS should be used.
     *
     * @return Boolean.
     * @throws ConfigurationException Invalid port.
     */
    public boolean isTls() throws ConfigurationException {
        return getBooleanProperty("IMAP_SSL", true) || getPort() == IMPLICIT_TLS_PORT;
    }

    /**
     * Gets folder name.
     *
     * @return Folder string.
     */
    public String getFolder() {
        return getStringProperty("IMAP_FOLDER", "INBOX");
    }

    /**
     * Gets socket timeout in seconds.
     *
     * @return Timeout in seconds.
     * @throws ConfigurationException Invalid value.
     */
    public int getTimeout() throws ConfigurationException {
        return getIntProperty("IMAP_TIMEOUT", 120);
    }

    /**
     * Gets full fetch chunk size in bytes.
     *
     * @return Chunk size.
     * @throws ConfigurationException Invalid value.
     */
    public int getChunkSize() throws ConfigurationException {
        return getIntProperty("FETCH_CHUNK_BYTES", 512 * 1024);
    }
}
