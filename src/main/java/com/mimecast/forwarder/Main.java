package com.mimecast.forwarder;

import com.mimecast.forwarder.config.ForwarderConfig;
import com.mimecast.forwarder.error.ForwardingException;
import com.mimecast.forwarder.forward.CycleResult;
import com.mimecast.forwarder.forward.ForwardingOrchestrator;
import com.mimecast.forwarder.imap.ChunkedFetcher;
import com.mimecast.forwarder.imap.ImapMailboxSession;
import com.mimecast.forwarder.imap.MailboxSource;
import com.mimecast.forwarder.main.ForwarderCron;
import com.mimecast.forwarder.metrics.ForwarderMetrics;
import com.mimecast.forwarder.metrics.MetricsRegistry;
import com.mimecast.forwarder.mime.MessageComposer;
import com.mimecast.forwarder.smtp.RelaySink;
import com.mimecast.forwarder.smtp.SmtpRelaySession;
import com.mimecast.forwarder.state.JsonProgressStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.cli.help.HelpFormatter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.naming.ConfigurationException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Main runnable.
 *
 * <p>Runs forwarding cycles forever, or a single one with --once.
 * <p>Exit codes:
 * <ul>
 *     <li>0 - single cycle completed, help shown or stopped</li>
 *     <li>1 - single cycle aborted</li>
 *     <li>2 - bad options or configuration</li>
 * </ul>
 */
public class Main {
    private static final Logger log = LogManager.getLogger(Main.class);

    /**
     * Application jar name.
     */
    private static final String NAME = "mail-forwarder.jar";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar " + NAME;

    /**
     * Application description.
     */
    public static final String DESCRIPTION = "Relays unseen IMAP messages to a fixed address over SMTP";

    public static final int EXIT_OK = 0;
    public static final int EXIT_CYCLE_ABORTED = 1;
    public static final int EXIT_CONFIG = 2;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs the forwarder.
     *
     * @param args String array.
     * @return Exit code.
     */
    static int run(String[] args) {
        Options options = options();

        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            print("Options error: " + e.getMessage());
            print("");
            optionsUsage(options);
            return EXIT_CONFIG;
        }

        if (cmd.hasOption("help")) {
            optionsUsage(options);
            return EXIT_OK;
        }

        ForwarderConfig config;
        ForwarderCron cron;
        try {
            config = ForwarderConfig.load(cmd.getOptionValue("conf")).validate();
            cron = new ForwarderCron(orchestrator(config), config.getPollIntervalSeconds());
        } catch (ConfigurationException | IOException e) {
            log.error("Configuration error: {}", e.getMessage());
            return EXIT_CONFIG;
        }

        MetricsRegistry.register(new SimpleMeterRegistry());
        ForwarderMetrics.initialize();

        if (cmd.hasOption("once")) {
            try {
                CycleResult result = cron.runOnce();
                log.info("Single cycle complete: forwarded={}", result.getForwarded());
                return EXIT_OK;
            } catch (ForwardingException | IOException e) {
                log.error("Cycle aborted: {}", e.getMessage(), e);
                return EXIT_CYCLE_ABORTED;
            }
        }

        try {
            cron.runForever();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cron.stop();
        }
        return EXIT_OK;
    }

    /**
     * Wires an orchestrator from configuration.
     *
     * @param config Validated configuration.
     * @return ForwardingOrchestrator instance.
     * @throws ConfigurationException Invalid setting.
     */
    static ForwardingOrchestrator orchestrator(ForwarderConfig config) throws ConfigurationException {
        MailboxSource source = new MailboxSource(
                ImapMailboxSession.connector(config.getMailbox()),
                new ChunkedFetcher(config.getMailbox().getChunkSize()));
        RelaySink sink = new RelaySink(SmtpRelaySession.connector(config.getRelay()));
        MessageComposer composer = new MessageComposer(config.getRelay().getUser(), config.getRelay().getDestination());

        return new ForwardingOrchestrator(source, composer, sink,
                new JsonProgressStore(Path.of(config.getStateFile())), config.getProgressKey())
                .setMaxAttempts(config.getMaxAttempts())
                .setRetryBackoffSeconds(config.getRetryBackoffSeconds())
                .setMessageDelaySeconds(config.getMessageDelaySeconds());
    }

    /**
     * CLI options.
     * <i>Listing order will be alphabetical</i>.
     *
     * @return Options instance.
     */
    static Options options() {
        Options options = new Options();
        options.addOption(null, "once", false, "Run a single cycle and exit");
        options.addOption("c", "conf", true, "JSON5 configuration file");
        options.addOption("h", "help", false, "Show usage");
        return options;
    }

    /**
     * CLI usage.
     *
     * @param options Options instance.
     */
    static void optionsUsage(Options options) {
        print(USAGE);
        print(" " + DESCRIPTION);
        print("");

        // Capture System.out to get help output.
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        PrintStream oldOut = System.out;
        System.setOut(new PrintStream(baos, true, StandardCharsets.UTF_8));

        try {
            HelpFormatter formatter = HelpFormatter.builder()
                    .setShowSince(false)
                    .get();
            formatter.printHelp(" ", "", options, "", true);
            System.out.flush();
        } catch (IOException e) {
            throw new IllegalStateException("Unable to render usage", e);
        } finally {
            System.setOut(oldOut);
        }

        print(baos.toString(StandardCharsets.UTF_8));
    }

    private static void print(String string) {
        System.out.println(string);
    }
}
