package com.mimecast.forwarder.mime;

import jakarta.mail.internet.MimeMessage;

import java.util.List;

/**
 * Outbound message built for one attempt.
 *
 * <p>Sent once by the relay and then discarded.
 */
public final class ComposedMessage {
    private final MimeMessage message;
    private final Fidelity fidelity;
    private final String originalSubject;
    private final String originalSender;
    private final List<String> attachmentNames;

    /**
     * Constructs a new ComposedMessage instance.
     *
     * @param message         Outbound MIME message.
     * @param fidelity        Composition mode.
     * @param originalSubject Decoded subject of the source message.
     * @param originalSender  Decoded sender of the source message.
     * @param attachmentNames File names of the attached parts.
     */
    public ComposedMessage(MimeMessage message, Fidelity fidelity, String originalSubject, String originalSender, List<String> attachmentNames) {
        this.message = message;
        this.fidelity = fidelity;
        this.originalSubject = originalSubject;
        this.originalSender = originalSender;
        this.attachmentNames = List.copyOf(attachmentNames);
    }

    public MimeMessage getMessage() {
        return message;
    }

    public Fidelity getFidelity() {
        return fidelity;
    }

    public String getOriginalSubject() {
        return originalSubject;
    }

    public String getOriginalSender() {
        return originalSender;
    }

    public List<String> getAttachmentNames() {
        return attachmentNames;
    }
}
