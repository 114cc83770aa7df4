package com.mimecast.forwarder.mime;

import com.mimecast.forwarder.error.CompositionException;
import jakarta.activation.DataHandler;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.internet.ContentDisposition;
import jakarta.mail.internet.ContentType;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import jakarta.mail.internet.ParameterList;
import jakarta.mail.util.ByteArrayDataSource;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Properties;

/**
 * Builds the outbound forward of a source message.
 *
 * <p>This is a pure transform: no I/O and no state beyond the sender and destination
 * addresses given at construction.
 * <p>Two modes are supported:
 * <ul>
 *     <li><b>{@link Fidelity#FULL}</b> - the best body part plus every other part that carries a file name,
 *     re-attached as an opaque binary part with its original file name and content type.</li>
 *     <li><b>{@link Fidelity#DEGRADED}</b> - the best body part only, with a visible notice that
 *     attachments were omitted. No attachment part is ever produced.</li>
 * </ul>
 * <p>The body part is chosen by preference: HTML over plain text. Exactly one is used.
 * <p>Both modes prefix the subject with {@value #SUBJECT_PREFIX} and prepend an attribution
 * banner naming the original sender.
 * <p>Source bytes that cannot be parsed into a structured message fail with
 * {@link CompositionException}; no partially built message is returned.
 */
public class MessageComposer {
    private static final Logger log = LogManager.getLogger(MessageComposer.class);

    /**
     * Subject prefix of forwarded messages.
     */
    public static final String SUBJECT_PREFIX = "[forwarded] ";

    /**
     * Header recording the composition mode on the outbound message.
     */
    public static final String FIDELITY_HEADER = "X-Forwarder-Fidelity";

    /**
     * Notice shown in degraded forwards.
     */
    public static final String OMITTED_NOTICE = "Attachments were omitted from this forward. Open the original mailbox to retrieve them.";

    private static final String NO_BODY = "(no body content)";
    private static final String UNREADABLE_BODY = "(the message body could not be read, open the original mailbox to view it)";

    private final Session parseSession = Session.getInstance(utf8Properties());
    private final Session session = Session.getInstance(new Properties());
    private final String fromAddress;
    private final String destination;

    /**
     * Constructs a new MessageComposer instance.
     *
     * @param fromAddress Sender of forwarded messages, usually the relay account.
     * @param destination Destination address.
     */
    public MessageComposer(String fromAddress, String destination) {
        this.fromAddress = fromAddress;
        this.destination = destination;
    }

    /**
     * Session properties reading raw UTF-8 header bytes (RFC 6532) as UTF-8 instead of ISO-8859-1.
     *
     * @return Properties instance.
     */
    private static Properties utf8Properties() {
        Properties props = new Properties();
        props.setProperty("mail.mime.allowutf8", "true");
        return props;
    }

    /**
     * Composes a full fidelity forward.
     *
     * @param raw Complete source message.
     * @return ComposedMessage tagged FULL.
     * @throws CompositionException Source bytes are not a structured message.
     */
    public ComposedMessage composeFull(RawMessage raw) throws CompositionException {
        if (raw.isSplit()) {
            throw new CompositionException("Full composition needs the complete message");
        }

        return compose(parse(raw.getBytes()), Fidelity.FULL);
    }

    /**
     * Composes a degraded, text only forward.
     * <p>The header block and body text are rejoined so multipart boundaries declared in the
     * header still resolve.
     *
     * @param header   Source header block.
     * @param bodyText Source body text.
     * @return ComposedMessage tagged DEGRADED.
     * @throws CompositionException Source bytes are not a structured message.
     */
    public ComposedMessage composeDegraded(byte[] header, byte[] bodyText) throws CompositionException {
        return compose(parse(join(header, bodyText)), Fidelity.DEGRADED);
    }

    /**
     * Parses source bytes.
     *
     * @param bytes Message bytes.
     * @return MimeMessage.
     * @throws CompositionException Empty input, no header fields or unparsable content.
     */
    private MimeMessage parse(byte[] bytes) throws CompositionException {
        if (bytes == null || bytes.length == 0) {
            throw new CompositionException("Source message is empty");
        }

        try {
            MimeMessage message = new MimeMessage(parseSession, new ByteArrayInputStream(bytes));
            if (!message.getAllHeaders().hasMoreElements()) {
                throw new CompositionException("Source message has no header fields");
            }
            return message;
        } catch (MessagingException e) {
            throw new CompositionException("Unable to parse source message: " + e.getMessage(), e);
        }
    }

    private ComposedMessage compose(MimeMessage source, Fidelity fidelity) throws CompositionException {
        try {
            String subject = HeaderDecoder.decode(source.getHeader("Subject", " "));
            String sender = HeaderDecoder.decode(source.getHeader("From", ", "));
            if (sender.isEmpty()) {
                sender = "unknown";
            }

            Part body = findBody(source);
            String content = body != null ? readText(body) : null;
            boolean html = body != null && body.isMimeType("text/html");

            List<Part> attachments = new ArrayList<>();
            if (fidelity == Fidelity.FULL) {
                collectAttachments(source, body, attachments);
            }

            MimeMessage out = new MimeMessage(session);
            out.setFrom(new InternetAddress(fromAddress));
            out.setRecipients(Message.RecipientType.TO, InternetAddress.parse(destination));
            out.setSubject(SUBJECT_PREFIX + subject, StandardCharsets.UTF_8.name());
            out.setSentDate(new Date());
            out.setHeader(FIDELITY_HEADER, fidelity.name());

            String text = html
                    ? htmlBanner(sender, subject, fidelity) + content
                    : textBanner(sender, subject, fidelity) + (content != null ? content : placeholder(fidelity));
            String subtype = html ? "html" : "plain";

            List<String> names = new ArrayList<>();
            if (attachments.isEmpty()) {
                out.setText(text, StandardCharsets.UTF_8.name(), subtype);
            } else {
                MimeMultipart mixed = new MimeMultipart("mixed");

                MimeBodyPart bodyPart = new MimeBodyPart();
                bodyPart.setText(text, StandardCharsets.UTF_8.name(), subtype);
                mixed.addBodyPart(bodyPart);

                for (Part attachment : attachments) {
                    String name = fileName(attachment);
                    mixed.addBodyPart(toAttachment(attachment, name));
                    names.add(name);
                    log.info("Attached file: {}", name);
                }
                out.setContent(mixed);
            }

            out.saveChanges();
            log.debug("Composed {} forward: subject={}, body={}, attachments={}",
                    fidelity, subject, body != null ? body.getContentType() : "none", names.size());

            return new ComposedMessage(out, fidelity, subject, sender, names);

        } catch (MessagingException | IOException e) {
            throw new CompositionException("Unable to compose " + fidelity + " forward: " + e.getMessage(), e);
        }
    }

    /**
     * Finds the body part: first inline HTML part, otherwise first inline plain text part.
     *
     * @param root Message root.
     * @return Part or null when there is no text body.
     */
    private Part findBody(Part root) throws MessagingException, IOException {
        List<Part> candidates = new ArrayList<>();
        collectTextParts(root, candidates);

        for (Part part : candidates) {
            if (part.isMimeType("text/html")) {
                return part;
            }
        }
        for (Part part : candidates) {
            if (part.isMimeType("text/plain")) {
                return part;
            }
        }
        return null;
    }

    private void collectTextParts(Part part, List<Part> candidates) throws MessagingException, IOException {
        if (part.isMimeType("multipart/*")) {
            for (Part child : children(part)) {
                collectTextParts(child, candidates);
            }
        } else if ((part.isMimeType("text/html") || part.isMimeType("text/plain")) && !isAttachment(part)) {
            candidates.add(part);
        }
    }

    private void collectAttachments(Part part, Part body, List<Part> attachments) throws MessagingException, IOException {
        if (part.isMimeType("multipart/*")) {
            for (Part child : children(part)) {
                collectAttachments(child, body, attachments);
            }
        } else if (part != body && StringUtils.isNotBlank(fileName(part))) {
            attachments.add(part);
        }
    }

    private List<Part> children(Part part) throws MessagingException, IOException {
        Object content = part.getContent();
        if (!(content instanceof Multipart)) {
            throw new MessagingException("Multipart content expected but got " + (content == null ? "null" : content.getClass().getSimpleName()));
        }

        Multipart multipart = (Multipart) content;
        List<Part> parts = new ArrayList<>();
        for (int i = 0; i < multipart.getCount(); i++) {
            parts.add(multipart.getBodyPart(i));
        }
        return parts;
    }

    private boolean isAttachment(Part part) throws MessagingException {
        return Part.ATTACHMENT.equalsIgnoreCase(part.getDisposition()) || StringUtils.isNotBlank(fileName(part));
    }

    private String fileName(Part part) throws MessagingException {
        return HeaderDecoder.decode(part.getFileName());
    }

    /**
     * Reads a text part as a string.
     * <p>Falls back to UTF-8 when the declared charset is not supported.
     */
    private String readText(Part part) throws MessagingException, IOException {
        try {
            Object content = part.getContent();
            if (content instanceof String) {
                return (String) content;
            }
        } catch (UnsupportedEncodingException e) {
            log.debug("Unsupported body charset, reading as UTF-8: {}", e.getMessage());
        }

        return new String(readBytes(part), StandardCharsets.UTF_8);
    }

    private byte[] readBytes(Part part) throws MessagingException, IOException {
        try (InputStream stream = part.getInputStream()) {
            return stream.readAllBytes();
        }
    }

    private MimeBodyPart toAttachment(Part source, String name) throws MessagingException, IOException {
        MimeBodyPart attachment = new MimeBodyPart();
        attachment.setDataHandler(new DataHandler(new ByteArrayDataSource(readBytes(source), baseType(source))));

        // File name is RFC 2231 encoded as UTF-8 whatever the platform charset.
        ParameterList params = new ParameterList();
        params.set("filename", name, StandardCharsets.UTF_8.name());
        attachment.setHeader("Content-Disposition", new ContentDisposition(Part.ATTACHMENT, params).toString());
        return attachment;
    }

    private String baseType(Part part) {
        try {
            String declared = part.getContentType();
            if (declared != null) {
                String baseType = new ContentType(declared).getBaseType();
                if (baseType.matches("[^/\\s]+/[^/\\s]+")) {
                    return baseType.toLowerCase();
                }
            }
        } catch (MessagingException e) {
            log.debug("Unusable attachment content type, using application/octet-stream: {}", e.getMessage());
        }
        return "application/octet-stream";
    }

    private String textBanner(String sender, String subject, Fidelity fidelity) {
        if (fidelity == Fidelity.DEGRADED) {
            return "--- " + OMITTED_NOTICE + " ---\n"
                    + "Original sender: " + sender + "\n"
                    + "Subject: " + subject + "\n\n";
        }
        return "--- Original sender: " + sender + " ---\n\n";
    }

    private String htmlBanner(String sender, String subject, Fidelity fidelity) {
        if (fidelity == Fidelity.DEGRADED) {
            return "<div style='background:#f9f9f9;padding:10px;border:1px solid #eee'>"
                    + "<b>Original sender:</b> " + escape(sender) + "<br>"
                    + "<b>Subject:</b> " + escape(subject) + "<br>"
                    + "<i>" + OMITTED_NOTICE + "</i></div><br>";
        }
        return "<p style='color:gray;font-size:12px;'>--- Original sender: " + escape(sender) + " ---</p><hr>";
    }

    private String placeholder(Fidelity fidelity) {
        return fidelity == Fidelity.DEGRADED ? UNREADABLE_BODY : NO_BODY;
    }

    private static String escape(String value) {
        return StringUtils.replaceEach(value,
                new String[]{"&", "<", ">", "\""},
                new String[]{"&amp;", "&lt;", "&gt;", "&quot;"});
    }

    /**
     * Rejoins a header block and body text, making sure a blank line separates them.
     */
    private static byte[] join(byte[] header, byte[] bodyText) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(header.length + bodyText.length + 4);
        out.writeBytes(header);

        String tail = new String(header, Math.max(0, header.length - 4), Math.min(4, header.length), StandardCharsets.US_ASCII);
        if (header.length > 0 && !tail.endsWith("\r\n\r\n") && !tail.endsWith("\n\n")) {
            out.writeBytes(tail.endsWith("\n") ? "\r\n".getBytes(StandardCharsets.US_ASCII) : "\r\n\r\n".getBytes(StandardCharsets.US_ASCII));
        }

        out.writeBytes(bodyText);
        return out.toByteArray();
    }
}
