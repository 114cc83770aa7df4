package com.mimecast.forwarder.config;

import javax.naming.ConfigurationException;
import java.util.Map;

/**
 * Outbound relay configuration.
 *
 * <p>This class provides type safe access to the SMTP relay settings and the destination.
 * <p>TLS is used when either the explicit flag is set or the port is the implicit TLS port.
 * Otherwise STARTTLS is required.
 */
public class RelayConfig extends ConfigFoundation {

    /**
     * Implicit TLS port for SMTP submission.
     */
    public static final int IMPLICIT_TLS_PORT = 465;

    /**
     * Constructs a new RelayConfig instance.
     *
     * @param map Configuration map.
     */
    public RelayConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets relay account.
     * <p>Also used as the From address of forwarded messages.
     *
     * @return Account string.
     * @throws ConfigurationException Missing value.
     */
    public String getUser() throws ConfigurationException {
        return getRequiredStringProperty("SMTP_USER");
    }

    /**
     * Gets relay credential.
     *
     * @return Password string.
     * @throws ConfigurationException Missing value.
     */
    public String getPassword() throws ConfigurationException {
        return getRequiredStringProperty("SMTP_PASSWORD");
    }

    /**
     * Gets SMTP host.
     *
     * @return Host string.
     * @throws ConfigurationException Missing value.
     */
    public String getHost() throws ConfigurationException {
        return getRequiredStringProperty("SMTP_HOST");
    }

    /**
     * Gets SMTP port.
     *
     * @return Port number.
     * @throws ConfigurationException Invalid value.
     */
    public int getPort() throws ConfigurationException {
        return getIntProperty("SMTP_PORT", IMPLICIT_TLS_PORT);
    }

    /**
     * Checks if implicit TLS should be used.
     *
     * @return Boolean.
     * @throws ConfigurationException Invalid port.
     */
    public boolean isTls() throws ConfigurationException {
        return getBooleanProperty("SMTP_SSL", true) || getPort() == IMPLICIT_TLS_PORT;
    }

    /**
     * Gets socket timeout in seconds.
     *
     * @return Timeout in seconds.
     * @throws ConfigurationException Invalid value.
     */
    public int getTimeout() throws ConfigurationException {
        return getIntProperty("SMTP_TIMEOUT", 120);
    }

    /**
     * Gets destination address.
     *
     * @return Address string.
     * @throws ConfigurationException Missing value.
     */
    public String getDestination() throws ConfigurationException {
        return getRequiredStringProperty("DEST_EMAIL");
    }
}
