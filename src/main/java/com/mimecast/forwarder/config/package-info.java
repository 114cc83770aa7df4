/**
 * Forwarder configuration.
 *
 * <p>Provides the configuration foundation and the typed views over it.
 * <ul>
 *     <li><b>ForwarderConfig</b> - layered loading, validation and cycle settings.</li>
 *     <li><b>MailboxConfig</b> - IMAP source account, server, folder and fetch chunk size.</li>
 *     <li><b>RelayConfig</b> - SMTP relay account, server and destination address.</li>
 * </ul>
 *
 * <p>Keys follow environment variable naming so the same names work in a JSON5 file,
 * the environment and as system properties.
 * <br><b>Example:</b>
 * <pre>
 * {
 *   SRC_EMAIL: "alice@school.example",
 *   IMAP_HOST: "imap.school.example",
 *   SMTP_USER: "alice@home.example",
 *   SMTP_HOST: "smtp.home.example",
 *   DEST_EMAIL: "alice@home.example",
 *   POLL_INTERVAL_SECONDS: 600
 * }
 * </pre>
 * <p>Passwords are best supplied through the environment.
 */
package com.mimecast.forwarder.config;
