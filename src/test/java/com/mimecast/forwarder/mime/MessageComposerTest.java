package com.mimecast.forwarder.mime;

import com.mimecast.forwarder.error.CompositionException;
import jakarta.mail.BodyPart;
import jakarta.mail.Message;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class MessageComposerTest {

    private final MessageComposer composer = new MessageComposer("relay@example.com", "dest@example.com");

    private static RawMessage raw(String message) {
        return RawMessage.full(message.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[][] split(String message) {
        byte[] bytes = message.getBytes(StandardCharsets.UTF_8);
        int end = message.indexOf("\r\n\r\n") + 4;
        return new byte[][]{Arrays.copyOfRange(bytes, 0, end), Arrays.copyOfRange(bytes, end, bytes.length)};
    }

    /**
     * Writes the composed message out and parses it back as a receiver would.
     */
    private static MimeMessage reparse(ComposedMessage composed) throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        composed.getMessage().writeTo(out);
        return new MimeMessage(Session.getInstance(new Properties()), new ByteArrayInputStream(out.toByteArray()));
    }

    @Test
    void testFullPlainMessage() throws Exception {
        ComposedMessage composed = composer.composeFull(raw(MessageFixtures.plain("Hello", "Hi Bob")));
        MimeMessage message = reparse(composed);

        assertEquals(Fidelity.FULL, composed.getFidelity());
        assertEquals("Hello", composed.getOriginalSubject());
        assertEquals("Alice <alice@example.com>", composed.getOriginalSender());
        assertTrue(composed.getAttachmentNames().isEmpty());

        assertEquals("[forwarded] Hello", message.getSubject());
        assertEquals("relay@example.com", message.getFrom()[0].toString());
        assertEquals("dest@example.com", message.getRecipients(Message.RecipientType.TO)[0].toString());
        assertEquals("FULL", message.getHeader(MessageComposer.FIDELITY_HEADER, null));
        assertTrue(message.isMimeType("text/plain"));

        String body = (String) message.getContent();
        assertTrue(body.startsWith("--- Original sender: Alice <alice@example.com> ---"));
        assertTrue(body.contains("Hi Bob"));
    }

    @Test
    void testFullKeepsEveryNamedPart() throws Exception {
        ComposedMessage composed = composer.composeFull(raw(MessageFixtures.withAttachments()));
        MimeMessage message = reparse(composed);

        assertEquals("[forwarded] 你好café", message.getSubject());
        assertEquals("你好 <sender@example.com>", composed.getOriginalSender());
        assertEquals(List.of("résumé.pdf", "data.bin"), composed.getAttachmentNames());

        MimeMultipart mixed = (MimeMultipart) message.getContent();
        assertEquals(3, mixed.getCount());

        BodyPart body = mixed.getBodyPart(0);
        assertTrue(body.isMimeType("text/html"));
        String html = (String) body.getContent();
        assertTrue(html.contains("Original sender: 你好 &lt;sender@example.com&gt;"));
        assertTrue(html.contains("<p>Html body</p>"));
        assertFalse(html.contains("Plain body"));

        BodyPart pdf = mixed.getBodyPart(1);
        assertEquals("résumé.pdf", pdf.getFileName());
        assertTrue(pdf.isMimeType("application/pdf"));
        assertEquals(BodyPart.ATTACHMENT, pdf.getDisposition());
        assertEquals("%PDF-1.4 test", new String(pdf.getInputStream().readAllBytes(), StandardCharsets.US_ASCII));

        BodyPart bin = mixed.getBodyPart(2);
        assertEquals("data.bin", bin.getFileName());
        assertTrue(bin.isMimeType("application/octet-stream"));
    }

    @Test
    void testFullWithoutBodyUsesPlaceholder() throws Exception {
        ComposedMessage composed = composer.composeFull(raw(MessageFixtures.attachmentOnly()));
        MimeMultipart mixed = (MimeMultipart) reparse(composed).getContent();

        assertEquals(List.of("scan.png"), composed.getAttachmentNames());
        assertEquals(2, mixed.getCount());

        String body = (String) mixed.getBodyPart(0).getContent();
        assertTrue(body.contains("Original sender: carol@example.com"));
        assertTrue(body.contains("(no body content)"));
        assertTrue(mixed.getBodyPart(1).isMimeType("image/png"));
    }

    @Test
    void testDegradedNeverAttaches() throws Exception {
        byte[][] parts = split(MessageFixtures.withAttachments());
        ComposedMessage composed = composer.composeDegraded(parts[0], parts[1]);
        MimeMessage message = reparse(composed);

        assertEquals(Fidelity.DEGRADED, composed.getFidelity());
        assertTrue(composed.getAttachmentNames().isEmpty());
        assertEquals("DEGRADED", message.getHeader(MessageComposer.FIDELITY_HEADER, null));
        assertEquals("[forwarded] 你好café", message.getSubject());

        assertTrue(message.isMimeType("text/html"));
        String html = (String) message.getContent();
        assertTrue(html.contains(MessageComposer.OMITTED_NOTICE));
        assertTrue(html.contains("<p>Html body</p>"));
    }

    @Test
    void testDegradedPlainNotice() throws Exception {
        byte[][] parts = split(MessageFixtures.plain("Status", "All good"));
        ComposedMessage composed = composer.composeDegraded(parts[0], parts[1]);

        String body = (String) reparse(composed).getContent();
        assertTrue(body.contains(MessageComposer.OMITTED_NOTICE));
        assertTrue(body.contains("Original sender: Alice <alice@example.com>"));
        assertTrue(body.contains("Subject: Status"));
        assertTrue(body.contains("All good"));
    }

    @Test
    void testDegradedRestoresMissingSeparator() throws Exception {
        byte[] header = "From: dave@example.com\r\nSubject: Joined\r\n".getBytes(StandardCharsets.US_ASCII);
        byte[] text = "Body after header\r\n".getBytes(StandardCharsets.US_ASCII);

        ComposedMessage composed = composer.composeDegraded(header, text);

        assertEquals("Joined", composed.getOriginalSubject());
        assertTrue(((String) reparse(composed).getContent()).contains("Body after header"));
    }

    @Test
    void testRawUtf8HeadersAreReadAsUtf8() throws Exception {
        String source = "From: 李雷 <lilei@example.com>\r\n" +
                "To: user@example.com\r\n" +
                "Subject: 你好 report\r\n" +
                "MIME-Version: 1.0\r\n" +
                "Content-Type: text/plain; charset=UTF-8\r\n" +
                "\r\n" +
                "Quarterly numbers attached inline.\r\n";

        ComposedMessage full = composer.composeFull(raw(source));
        assertEquals("你好 report", full.getOriginalSubject());
        assertEquals("李雷 <lilei@example.com>", full.getOriginalSender());
        assertEquals("[forwarded] 你好 report", reparse(full).getSubject());

        byte[][] parts = split(source);
        ComposedMessage degraded = composer.composeDegraded(parts[0], parts[1]);
        assertEquals("你好 report", degraded.getOriginalSubject());
        assertEquals("[forwarded] 你好 report", reparse(degraded).getSubject());
    }

    @Test
    void testFullRejectsSplitMessage() {
        byte[][] parts = split(MessageFixtures.plain("Hello", "Hi"));

        assertThrows(CompositionException.class, () -> composer.composeFull(RawMessage.split(parts[0], parts[1])));
    }

    @Test
    void testEmptyInputFails() {
        assertThrows(CompositionException.class, () -> composer.composeFull(RawMessage.full(new byte[0])));
        assertThrows(CompositionException.class, () -> composer.composeDegraded(new byte[0], new byte[0]));
    }

    @Test
    void testNoHeaderFieldsFails() {
        assertThrows(CompositionException.class, () -> composer.composeFull(raw("\r\nbody without any header\r\n")));
    }
}
