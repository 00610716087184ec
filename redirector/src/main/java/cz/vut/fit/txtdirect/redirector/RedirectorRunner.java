package cz.vut.fit.txtdirect.redirector;

import cz.vut.fit.txtdirect.TxtDirectConfig;
import cz.vut.fit.txtdirect.redirector.handlers.VertxProxyForwarder;
import cz.vut.fit.txtdirect.redirector.metrics.MetricsRecorder;
import cz.vut.fit.txtdirect.redirector.metrics.MicrometerMetricsRecorder;
import cz.vut.fit.txtdirect.resolver.DnsJavaTxtLookup;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Vertx;
import org.apache.commons.cli.*;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;

/**
 * The main class of the redirector.
 * <p>
 * Reads the configuration from a properties file and the command line, starts the HTTP server and keeps running
 * until the process is asked to shut down.
 */
public class RedirectorRunner {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(RedirectorRunner.class);

    public static void main(String[] args) {
        final var options = makeOptions();
        final var cmd = parseCommandLine(args, options);
        if (cmd == null) return;

        final var properties = initProperties(cmd);
        final TxtDirectConfig config;
        try {
            config = TxtDirectConfig.fromProperties(properties);
        } catch (NumberFormatException e) {
            Logger.error("Invalid configuration value: {}", e.getMessage());
            System.exit(3);
            return;
        }

        Logger.info("Enabled record types: {}", config.enabled());

        final MicrometerMetricsRecorder micrometer = config.metrics().enabled()
                ? new MicrometerMetricsRecorder(new SimpleMeterRegistry())
                : null;
        final MetricsRecorder metrics = micrometer == null ? MetricsRecorder.NOOP : micrometer;

        final var dnsExecutor = Executors.newFixedThreadPool(config.workers());
        final var vertx = Vertx.vertx();

        final DnsJavaTxtLookup lookup;
        try {
            lookup = new DnsJavaTxtLookup(config, dnsExecutor);
        } catch (IOException e) {
            Logger.error("Failed to initialize the DNS resolver: {}", e.getMessage());
            System.exit(4);
            return;
        }

        final var proxy = new VertxProxyForwarder(vertx, config);
        final var dispatcher = RedirectDispatcher.create(config, lookup, proxy, metrics);
        final var server = new RedirectServer(vertx, config, dispatcher);

        // A latch used to wait for the shutdown signal
        final CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(latch::countDown, "system-shutdown-hook"));

        try {
            server.start().toCompletionStage().toCompletableFuture().join();
        } catch (RuntimeException e) {
            Logger.error("Failed to start the HTTP server", e);
            System.exit(5);
            return;
        }

        try {
            latch.await();
            Logger.info("Exiting");

            server.close();
            proxy.close();
            vertx.close().toCompletionStage().toCompletableFuture().join();
            dnsExecutor.shutdownNow();

            if (micrometer != null) {
                Logger.info("Requests by type: {}, responses: {}, path redirects: {}",
                        micrometer.total(MicrometerMetricsRecorder.REQUESTS_BY_TYPE),
                        micrometer.total(MicrometerMetricsRecorder.REQUESTS_BY_STATUS),
                        micrometer.total(MicrometerMetricsRecorder.PATH_REDIRECTS));
            }
            System.exit(0);
        } catch (InterruptedException e) {
            Logger.error("Unhandled exception", e);
            System.exit(1);
        }
    }

    /**
     * Parses the command line arguments using the specified options.
     *
     * @return The parsed CommandLine instance, or null if parsing fails or help is requested.
     */
    @Nullable
    private static CommandLine parseCommandLine(String[] args, Options options) {
        final var parser = new DefaultParser();

        CommandLine cmd;
        try {
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            if (Arrays.stream(args).anyMatch(arg -> arg.equals("-h") || arg.equals("--help"))) {
                printHelpAndExit(options, 0);
                return null;
            }

            System.err.println(e.getMessage());
            printHelpAndExit(options, 1);
            return null;
        }

        if (cmd.hasOption("h")) {
            printHelpAndExit(options, 0);
            return null;
        }
        return cmd;
    }

    @NotNull
    static Options makeOptions() {
        final var options = new Options();
        options.addOption("h", "help", false, "Print this help message");

        options.addOption(Option.builder("p")
                .longOpt("properties")
                .desc("Path to a configuration file")
                .argName("path")
                .hasArg()
                .build());
        options.addOption(Option.builder("o")
                .longOpt("option")
                .desc("A properties key/value to add to the configuration")
                .argName("key=value")
                .hasArg()
                .build()
        );

        return options;
    }

    /**
     * Initializes the properties from the file and the --option passed in the command line.
     *
     * @param cmd The parsed command line arguments.
     * @return The initialized Properties instance.
     */
    static Properties initProperties(CommandLine cmd) {
        final Properties props = new Properties();

        if (cmd.hasOption("properties")) {
            var path = cmd.getOptionValue("properties");
            try (var inStream = new FileInputStream(path)) {
                props.load(inStream);
            } catch (IOException e) {
                Logger.error("Failed to load properties: {}", e.getMessage());
                System.exit(2);
                return null;
            }
        }

        // Add the --option properties
        var cmdLineProperties = cmd.getOptionValues("option");
        if (cmdLineProperties != null) {
            for (var option : cmdLineProperties) {
                if (option.contains("=")) {
                    var parts = option.split("=", 2);
                    props.put(parts[0], parts[1]);
                } else {
                    Logger.warn("Ignoring invalid command-line option: {}", option);
                }
            }
        }

        return props;
    }

    private static void printHelpAndExit(Options options, int exitCode) {
        final var formatter = new HelpFormatter();
        formatter.printHelp(119, "txtdirect [-p <path>] [-o <key=value>]...", "", options, "");
        System.exit(exitCode);
    }
}
