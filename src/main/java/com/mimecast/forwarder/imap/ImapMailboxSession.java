package com.mimecast.forwarder.imap;

import com.mimecast.forwarder.config.MailboxConfig;
import com.mimecast.forwarder.error.ConnectionException;
import com.mimecast.forwarder.error.Endpoint;
import com.mimecast.forwarder.error.ProtocolException;
import com.mimecast.forwarder.mime.RawMessage;
import jakarta.mail.FetchProfile;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.FolderClosedException;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.StoreClosedException;
import jakarta.mail.UIDFolder;
import jakarta.mail.search.FlagTerm;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.angus.mail.iap.ByteArray;
import org.eclipse.angus.mail.iap.Response;
import org.eclipse.angus.mail.imap.IMAPFolder;
import org.eclipse.angus.mail.imap.IMAPMessage;
import org.eclipse.angus.mail.imap.protocol.BODY;
import org.eclipse.angus.mail.imap.protocol.FetchResponse;
import org.eclipse.angus.mail.imap.protocol.Item;

import javax.naming.ConfigurationException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Jakarta Mail backed mailbox session.
 *
 * <p>Connects with {@code imaps} for implicit TLS, otherwise {@code imap} with STARTTLS enabled.
 * <br>Connect, read and write timeouts all come from the mailbox timeout setting.
 * <p>Byte level fetches go through {@link IMAPFolder#doCommand} so ranges and sections
 * are requested with {@code BODY.PEEK} and never set the seen flag.
 */
public class ImapMailboxSession implements MailboxSession {
    private static final Logger log = LogManager.getLogger(ImapMailboxSession.class);

    private final Store store;
    private final IMAPFolder folder;

    /**
     * Constructs a new ImapMailboxSession instance.
     *
     * @param store  Connected store.
     * @param folder Open folder.
     */
    ImapMailboxSession(Store store, IMAPFolder folder) {
        this.store = store;
        this.folder = folder;
    }

    /**
     * Builds a connector for the given mailbox configuration.
     * <p>Settings are resolved once so a bad value fails here and not mid-cycle.
     *
     * @param config Mailbox configuration.
     * @return MailboxConnector instance.
     * @throws ConfigurationException Missing or invalid setting.
     */
    public static MailboxConnector connector(MailboxConfig config) throws ConfigurationException {
        final String host = config.getHost();
        final int port = config.getPort();
        final boolean tls = config.isTls();
        final String account = config.getAccount();
        final String password = config.getPassword();
        final String folderName = config.getFolder();
        final Properties props = buildProperties(host, port, tls, config.getTimeout());

        return () -> open(Session.getInstance(props), tls, host, port, account, password, folderName);
    }

    /**
     * Builds Jakarta Mail session properties for IMAP/IMAPS.
     *
     * @param host    Server host.
     * @param port    Server port.
     * @param tls     Implicit TLS.
     * @param timeout Timeout in seconds.
     * @return Properties instance.
     */
    static Properties buildProperties(String host, int port, boolean tls, int timeout) {
        Properties props = new Properties();
        String protocol = tls ? "imaps" : "imap";
        String millis = String.valueOf(timeout * 1000L);

        props.put("mail.store.protocol", protocol);
        props.put("mail." + protocol + ".host", host);
        props.put("mail." + protocol + ".port", String.valueOf(port));
        props.put("mail." + protocol + ".connectiontimeout", millis);
        props.put("mail." + protocol + ".timeout", millis);
        props.put("mail." + protocol + ".writetimeout", millis);

        if (tls) {
            props.put("mail.imaps.ssl.enable", "true");
        } else {
            props.put("mail.imap.starttls.enable", "true");
        }

        return props;
    }

    /**
     * Opens a store and selects the folder read-write.
     */
    private static MailboxSession open(Session session, boolean tls, String host, int port,
                                       String account, String password, String folderName) throws ConnectionException {
        Store store = null;
        try {
            store = session.getStore(tls ? "imaps" : "imap");
            store.connect(host, port, account, password);

            Folder folder = store.getFolder(folderName);
            if (!folder.exists()) {
                throw new MessagingException("Folder '" + folderName + "' does not exist");
            }
            folder.open(Folder.READ_WRITE);
            log.info("Connected to IMAP {}:{} as {} folder {}", host, port, account, folderName);

            return new ImapMailboxSession(store, (IMAPFolder) folder);

        } catch (MessagingException | RuntimeException e) {
            closeQuietly(store);
            throw new ConnectionException(Endpoint.MAILBOX,
                    "IMAP connect to " + host + ":" + port + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<Long> searchUnseen() throws ConnectionException, ProtocolException {
        try {
            Message[] messages = folder.search(new FlagTerm(new Flags(Flags.Flag.SEEN), false));

            FetchProfile profile = new FetchProfile();
            profile.add(UIDFolder.FetchProfileItem.UID);
            folder.fetch(messages, profile);

            List<Long> uids = new ArrayList<>(messages.length);
            for (Message message : messages) {
                uids.add(folder.getUID(message));
            }
            return uids;

        } catch (MessagingException e) {
            throw translate("UNSEEN search", e);
        }
    }

    @Override
    public long fetchSize(long uid) throws ConnectionException, ProtocolException {
        try {
            return message(uid).getSize();
        } catch (MessagingException e) {
            throw translate("RFC822.SIZE fetch of UID " + uid, e);
        }
    }

    @Override
    public byte[] fetchRange(long uid, long offset, int length) throws ConnectionException, ProtocolException {
        try {
            int msgno = message(uid).getMessageNumber();
            BODY body = (BODY) folder.doCommand(p -> p.peekBody(msgno, "", Math.toIntExact(offset), length));
            return bytes(body);
        } catch (MessagingException e) {
            throw translate("Range fetch of UID " + uid + " at " + offset, e);
        }
    }

    @Override
    public byte[] fetchWhole(long uid) throws ConnectionException, ProtocolException {
        try {
            int msgno = message(uid).getMessageNumber();
            BODY body = (BODY) folder.doCommand(p -> p.peekBody(msgno, ""));
            return bytes(body);
        } catch (MessagingException e) {
            throw translate("Whole fetch of UID " + uid, e);
        }
    }

    @Override
    public RawMessage fetchHeaderAndText(long uid) throws ConnectionException, ProtocolException {
        try {
            int msgno = message(uid).getMessageNumber();
            byte[][] sections = (byte[][]) folder.doCommand(p -> {
                Response[] responses = p.fetch(msgno, "BODY.PEEK[HEADER] BODY.PEEK[TEXT]");
                byte[][] found = new byte[2][];

                for (Response response : responses) {
                    if (!(response instanceof FetchResponse) || ((FetchResponse) response).getNumber() != msgno) {
                        continue;
                    }
                    FetchResponse fetch = (FetchResponse) response;
                    for (int i = 0; i < fetch.getItemCount(); i++) {
                        Item item = fetch.getItem(i);
                        if (item instanceof BODY) {
                            BODY body = (BODY) item;
                            if ("HEADER".equalsIgnoreCase(body.getSection())) {
                                found[0] = bytes(body);
                            } else if ("TEXT".equalsIgnoreCase(body.getSection())) {
                                found[1] = bytes(body);
                            }
                        }
                    }
                }

                p.notifyResponseHandlers(responses);
                p.handleResult(responses[responses.length - 1]);
                return found;
            });

            if (sections[0] == null || sections[1] == null) {
                throw new ProtocolException("Server returned no " + (sections[0] == null ? "HEADER" : "TEXT") + " section for UID " + uid);
            }
            return RawMessage.split(sections[0], sections[1]);

        } catch (MessagingException e) {
            throw translate("Header and text fetch of UID " + uid, e);
        }
    }

    @Override
    public void markSeen(long uid) throws ConnectionException, ProtocolException {
        try {
            message(uid).setFlag(Flags.Flag.SEEN, true);
        } catch (MessagingException e) {
            throw translate("Seen flag store on UID " + uid, e);
        }
    }

    @Override
    public boolean isAlive() {
        if (!store.isConnected() || !folder.isOpen()) {
            return false;
        }

        try {
            folder.doCommand(p -> {
                p.noop();
                return null;
            });
            return true;
        } catch (MessagingException e) {
            log.debug("IMAP NOOP failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        try {
            if (folder.isOpen()) {
                folder.close(false);
            }
        } catch (MessagingException e) {
            log.debug("Error closing IMAP folder: {}", e.getMessage());
        }
        closeQuietly(store);
    }

    /**
     * Resolves a UID to its message in the open folder.
     */
    private IMAPMessage message(long uid) throws MessagingException {
        Message message = folder.getMessageByUID(uid);
        if (message == null) {
            throw new MessagingException("No message with UID " + uid);
        }
        return (IMAPMessage) message;
    }

    private static byte[] bytes(BODY body) {
        if (body == null) {
            return new byte[0];
        }

        ByteArray array = body.getByteArray();
        return array == null ? new byte[0] : array.getNewBytes();
    }

    /**
     * Maps a Jakarta Mail failure to the forwarding taxonomy.
     * <p>Closed folder or store and I/O causes mean the session is gone. Anything else is a rejected command.
     */
    private static ProtocolException translate(String operation, MessagingException e) throws ConnectionException {
        if (e instanceof FolderClosedException || e instanceof StoreClosedException || hasIoCause(e)) {
            throw new ConnectionException(Endpoint.MAILBOX, operation + " lost the session: " + e.getMessage(), e);
        }
        return new ProtocolException(operation + " failed: " + e.getMessage(), e);
    }

    private static boolean hasIoCause(Throwable e) {
        for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof IOException || cause instanceof org.eclipse.angus.mail.iap.ConnectionException) {
                return true;
            }
        }
        return false;
    }

    private static void closeQuietly(Store store) {
        if (store == null) {
            return;
        }

        try {
            if (store.isConnected()) {
                store.close();
            }
        } catch (MessagingException e) {
            log.debug("Error closing IMAP store: {}", e.getMessage());
        }
    }
}
