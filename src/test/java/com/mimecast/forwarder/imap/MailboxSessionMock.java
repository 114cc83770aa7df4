package com.mimecast.forwarder.imap;

import com.mimecast.forwarder.error.ConnectionException;
import com.mimecast.forwarder.error.ForwardingException;
import com.mimecast.forwarder.error.ProtocolException;
import com.mimecast.forwarder.mime.RawMessage;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In memory mailbox session for testing.
 * <p>Messages are held in listing order. Queued failures are thrown at the start of the next
 * fetch for that UID, one per attempt.
 */
public class MailboxSessionMock implements MailboxSession {

    private final Map<Long, byte[]> messages = new LinkedHashMap<>();
    private final Map<Long, Long> reportedSizes = new HashMap<>();
    private final Map<Long, Deque<ForwardingException>> failures = new HashMap<>();
    private final Set<Long> seen = new HashSet<>();
    private final List<Long> extraListing = new ArrayList<>();

    private ProtocolException markSeenFailure;
    private boolean dropAfterSearch;
    private boolean alive = true;
    private boolean closed;

    private int connects;
    private int sizeFetches;
    private int rangeFetches;
    private int wholeFetches;
    private int headerAndTextFetches;

    public MailboxSessionMock add(long uid, byte[] bytes) {
        messages.put(uid, bytes);
        return this;
    }

    public MailboxSessionMock add(long uid, String message) {
        return add(uid, message.getBytes(StandardCharsets.UTF_8));
    }

    public MailboxSessionMock listAgain(long uid) {
        extraListing.add(uid);
        return this;
    }

    public MailboxSessionMock reportSize(long uid, long size) {
        reportedSizes.put(uid, size);
        return this;
    }

    public MailboxSessionMock fail(long uid, ForwardingException... exceptions) {
        failures.computeIfAbsent(uid, k -> new ArrayDeque<>()).addAll(Arrays.asList(exceptions));
        return this;
    }

    public MailboxSessionMock failMarkSeen(ProtocolException exception) {
        this.markSeenFailure = exception;
        return this;
    }

    public MailboxSessionMock dropAfterSearch() {
        this.dropAfterSearch = true;
        return this;
    }

    /**
     * Connector handing out this session, reopened on every connect.
     *
     * @return MailboxConnector instance.
     */
    public MailboxConnector connector() {
        return () -> {
            connects++;
            alive = true;
            closed = false;
            return this;
        };
    }

    @Override
    public List<Long> searchUnseen() {
        List<Long> uids = new ArrayList<>();
        for (Long uid : messages.keySet()) {
            if (!seen.contains(uid)) {
                uids.add(uid);
            }
        }
        uids.addAll(extraListing);

        if (dropAfterSearch) {
            alive = false;
            dropAfterSearch = false;
        }
        return uids;
    }

    @Override
    public long fetchSize(long uid) throws ConnectionException, ProtocolException {
        sizeFetches++;
        throwQueued(uid);
        return reportedSizes.getOrDefault(uid, (long) bytes(uid).length);
    }

    @Override
    public byte[] fetchRange(long uid, long offset, int length) throws ProtocolException {
        rangeFetches++;
        byte[] bytes = bytes(uid);
        int from = (int) Math.min(offset, bytes.length);
        int to = (int) Math.min(offset + length, bytes.length);
        return Arrays.copyOfRange(bytes, from, to);
    }

    @Override
    public byte[] fetchWhole(long uid) throws ProtocolException {
        wholeFetches++;
        return bytes(uid).clone();
    }

    @Override
    public RawMessage fetchHeaderAndText(long uid) throws ConnectionException, ProtocolException {
        headerAndTextFetches++;
        throwQueued(uid);

        byte[] bytes = bytes(uid);
        String text = new String(bytes, StandardCharsets.ISO_8859_1);
        int split = text.indexOf("\r\n\r\n");
        int end = split < 0 ? bytes.length : split + 4;
        return RawMessage.split(Arrays.copyOfRange(bytes, 0, end), Arrays.copyOfRange(bytes, end, bytes.length));
    }

    @Override
    public void markSeen(long uid) throws ProtocolException {
        if (markSeenFailure != null) {
            throw markSeenFailure;
        }
        seen.add(uid);
    }

    @Override
    public boolean isAlive() {
        return alive && !closed;
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isSeen(long uid) {
        return seen.contains(uid);
    }

    public boolean isClosed() {
        return closed;
    }

    public int getConnects() {
        return connects;
    }

    public int getSizeFetches() {
        return sizeFetches;
    }

    public int getRangeFetches() {
        return rangeFetches;
    }

    public int getWholeFetches() {
        return wholeFetches;
    }

    public int getHeaderAndTextFetches() {
        return headerAndTextFetches;
    }

    private byte[] bytes(long uid) throws ProtocolException {
        byte[] bytes = messages.get(uid);
        if (bytes == null) {
            throw new ProtocolException("No message with UID " + uid);
        }
        return bytes;
    }

    private void throwQueued(long uid) throws ConnectionException, ProtocolException {
        Deque<ForwardingException> queue = failures.get(uid);
        if (queue == null || queue.isEmpty()) {
            return;
        }

        ForwardingException failure = queue.poll();
        if (failure instanceof ConnectionException) {
            throw (ConnectionException) failure;
        }
        if (failure instanceof ProtocolException) {
            throw (ProtocolException) failure;
        }
        throw new IllegalArgumentException("Mailbox can only fail with connection or protocol errors: " + failure);
    }
}
