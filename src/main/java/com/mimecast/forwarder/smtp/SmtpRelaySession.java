package com.mimecast.forwarder.smtp;

import com.mimecast.forwarder.config.RelayConfig;
import com.mimecast.forwarder.error.ConnectionException;
import com.mimecast.forwarder.error.DeliveryException;
import com.mimecast.forwarder.error.Endpoint;
import jakarta.mail.Address;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.MimeMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.naming.ConfigurationException;
import java.util.Properties;

/**
 * Jakarta Mail backed relay session.
 *
 * <p>Uses {@code smtps} for implicit TLS, otherwise {@code smtp} with STARTTLS required.
 * <br>Connect, read and write timeouts all come from the relay timeout setting.
 */
public class SmtpRelaySession implements RelaySession {
    private static final Logger log = LogManager.getLogger(SmtpRelaySession.class);

    private final Transport transport;

    /**
     * Constructs a new SmtpRelaySession instance.
     *
     * @param transport Connected transport.
     */
    SmtpRelaySession(Transport transport) {
        this.transport = transport;
    }

    /**
     * Builds a connector for the given relay configuration.
     * <p>Settings are resolved once so a bad value fails here and not mid-cycle.
     *
     * @param config Relay configuration.
     * @return RelayConnector instance.
     * @throws ConfigurationException Missing or invalid setting.
     */
    public static RelayConnector connector(RelayConfig config) throws ConfigurationException {
        final String host = config.getHost();
        final int port = config.getPort();
        final boolean tls = config.isTls();
        final String user = config.getUser();
        final String password = config.getPassword();
        final Properties props = buildProperties(host, port, tls, config.getTimeout());

        return () -> open(Session.getInstance(props), tls, host, port, user, password);
    }

    /**
     * Builds Jakarta Mail session properties for SMTP/SMTPS.
     *
     * @param host    Server host.
     * @param port    Server port.
     * @param tls     Implicit TLS.
     * @param timeout Timeout in seconds.
     * @return Properties instance.
     */
    static Properties buildProperties(String host, int port, boolean tls, int timeout) {
        Properties props = new Properties();
        String protocol = tls ? "smtps" : "smtp";
        String millis = String.valueOf(timeout * 1000L);

        props.put("mail.transport.protocol", protocol);
        props.put("mail." + protocol + ".host", host);
        props.put("mail." + protocol + ".port", String.valueOf(port));
        props.put("mail." + protocol + ".auth", "true");
        props.put("mail." + protocol + ".connectiontimeout", millis);
        props.put("mail." + protocol + ".timeout", millis);
        props.put("mail." + protocol + ".writetimeout", millis);

        if (tls) {
            props.put("mail.smtps.ssl.enable", "true");
        } else {
            props.put("mail.smtp.starttls.enable", "true");
            props.put("mail.smtp.starttls.required", "true");
        }

        return props;
    }

    private static RelaySession open(Session session, boolean tls, String host, int port, String user, String password) throws ConnectionException {
        Transport transport = null;
        try {
            transport = session.getTransport(tls ? "smtps" : "smtp");
            transport.connect(host, port, user, password);
            log.info("Connected to SMTP {}:{} as {}", host, port, user);

            return new SmtpRelaySession(transport);

        } catch (MessagingException | RuntimeException e) {
            closeQuietly(transport);
            throw new ConnectionException(Endpoint.RELAY, "SMTP connect to " + host + ":" + port + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void send(MimeMessage message) throws DeliveryException {
        try {
            Address[] recipients = message.getAllRecipients();
            if (recipients == null || recipients.length == 0) {
                throw new DeliveryException("Message has no recipients");
            }
            transport.sendMessage(message, recipients);

        } catch (MessagingException e) {
            throw new DeliveryException("SMTP send failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isConnected() {
        return transport.isConnected();
    }

    @Override
    public void close() {
        closeQuietly(transport);
    }

    private static void closeQuietly(Transport transport) {
        if (transport == null) {
            return;
        }

        try {
            transport.close();
        } catch (MessagingException e) {
            log.debug("Error closing SMTP transport: {}", e.getMessage());
        }
    }
}
