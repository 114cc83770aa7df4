package com.mimecast.forwarder.state;

import java.util.Objects;

/**
 * Identifies one independent watermark stream: source account, host and folder.
 *
 * <p>The string form {@code account:host:folder} is the key used in the state file.
 */
public final class ProgressKey {
    private final String account;
    private final String host;
    private final String folder;

    /**
     * Constructs a new ProgressKey instance.
     *
     * @param account Source account.
     * @param host    Source host.
     * @param folder  Source folder.
     */
    public ProgressKey(String account, String host, String folder) {
        this.account = Objects.requireNonNull(account, "account");
        this.host = Objects.requireNonNull(host, "host");
        this.folder = Objects.requireNonNull(folder, "folder");
    }

    public String getAccount() {
        return account;
    }

    public String getHost() {
        return host;
    }

    public String getFolder() {
        return folder;
    }

    /**
     * Gets the state file key.
     *
     * @return Key string.
     */
    public String asKey() {
        return account + ":" + host + ":" + folder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProgressKey)) return false;
        ProgressKey that = (ProgressKey) o;
        return account.equals(that.account) && host.equals(that.host) && folder.equals(that.folder);
    }

    @Override
    public int hashCode() {
        return Objects.hash(account, host, folder);
    }

    @Override
    public String toString() {
        return asKey();
    }
}
