package com.mimecast.forwarder.smtp;

import com.mimecast.forwarder.config.RelayConfig;
import com.mimecast.forwarder.error.ConnectionException;
import com.mimecast.forwarder.error.DeliveryException;
import com.mimecast.forwarder.error.Endpoint;
import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SmtpRelaySessionTest {

    private static MimeMessage message() throws MessagingException {
        MimeMessage message = new MimeMessage(Session.getInstance(new Properties()));
        message.setFrom(new InternetAddress("relay@example.com"));
        message.setRecipient(MimeMessage.RecipientType.TO, new InternetAddress("dest@example.com"));
        message.setText("Hello");
        return message;
    }

    @Test
    void testImplicitTlsProperties() {
        Properties props = SmtpRelaySession.buildProperties("smtp.example.com", 465, true, 60);

        assertEquals("smtps", props.getProperty("mail.transport.protocol"));
        assertEquals("465", props.getProperty("mail.smtps.port"));
        assertEquals("true", props.getProperty("mail.smtps.ssl.enable"));
        assertEquals("true", props.getProperty("mail.smtps.auth"));
        assertEquals("60000", props.getProperty("mail.smtps.timeout"));
    }

    @Test
    void testPlainPortRequiresStartTls() {
        Properties props = SmtpRelaySession.buildProperties("smtp.example.com", 587, false, 60);

        assertEquals("smtp", props.getProperty("mail.transport.protocol"));
        assertEquals("true", props.getProperty("mail.smtp.starttls.enable"));
        assertEquals("true", props.getProperty("mail.smtp.starttls.required"));
    }

    @Test
    void testSendPassesAllRecipients() throws Exception {
        Transport transport = mock(Transport.class);
        MimeMessage message = message();

        new SmtpRelaySession(transport).send(message);

        verify(transport).sendMessage(message, message.getAllRecipients());
    }

    @Test
    void testRefusalIsDeliveryFailure() throws Exception {
        Transport transport = mock(Transport.class);
        doThrow(new SendFailedException("552 message too large")).when(transport).sendMessage(any(), any());

        DeliveryException e = assertThrows(DeliveryException.class, () -> new SmtpRelaySession(transport).send(message()));

        assertEquals(Endpoint.RELAY, e.getResetEndpoint());
        assertTrue(e.getMessage().contains("552"));
    }

    @Test
    void testConnectRefusedIsRelayConnectionFailure() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }

        Map<String, Object> map = new HashMap<>();
        map.put("SMTP_USER", "relay@example.com");
        map.put("SMTP_PASSWORD", "secret");
        map.put("SMTP_HOST", "127.0.0.1");
        map.put("SMTP_PORT", String.valueOf(port));
        map.put("SMTP_SSL", "false");
        map.put("SMTP_TIMEOUT", "2");

        RelayConnector connector = SmtpRelaySession.connector(new RelayConfig(map));
        ConnectionException e = assertThrows(ConnectionException.class, connector::connect);

        assertEquals(Endpoint.RELAY, e.getEndpoint());
    }
}
