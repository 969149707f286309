package com.visitsense.loadgen;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.visitsense.loadgen.config.ConfigurationException;
import com.visitsense.loadgen.config.ConfigurationManager;
import com.visitsense.loadgen.config.LoadGeneratorConfig;
import com.visitsense.loadgen.core.PageUrl;
import com.visitsense.loadgen.core.funnel.FunnelEngine;
import com.visitsense.loadgen.core.funnel.FunnelRegistry;
import com.visitsense.loadgen.generator.EcommerceOrderGenerator;
import com.visitsense.loadgen.generator.EventCatalog;
import com.visitsense.loadgen.generator.HitFactory;
import com.visitsense.loadgen.generator.UrlListLoader;
import com.visitsense.loadgen.generator.VisitComposer;
import com.visitsense.loadgen.monitoring.StatusServer;
import com.visitsense.loadgen.routing.TargetConfigParser;
import com.visitsense.loadgen.routing.TargetRouter;
import com.visitsense.loadgen.scheduler.BackfillScheduler;
import com.visitsense.loadgen.scheduler.DaySummary;
import com.visitsense.loadgen.scheduler.PipelineDayRunner;
import com.visitsense.loadgen.scheduler.RealtimeScheduler;
import com.visitsense.loadgen.scheduler.RunSummary;
import com.visitsense.loadgen.scheduler.StartGate;
import com.visitsense.loadgen.scheduler.VisitRunner;
import com.visitsense.loadgen.transport.HttpHitSender;

/**
 * Application principale VisitSense Load
 * Point d'entrée du générateur de trafic analytique (backfill puis temps réel)
 */
public class LoadGenApplication {
    private static final Logger logger = LoggerFactory.getLogger(LoadGenApplication.class);

    private static final long SHUTDOWN_WAIT_SECONDS = 30;

    private final LoadGeneratorConfig config;

    private List<PageUrl> urls;
    private TargetRouter router;
    private HttpHitSender sender;
    private VisitComposer composer;
    private FunnelEngine funnelEngine;
    private VisitRunner runner;
    private BackfillScheduler backfillScheduler;
    private RealtimeScheduler realtimeScheduler;
    private StatusServer statusServer;

    private final CountDownLatch shutdownLatch;
    private volatile boolean running;
    private volatile boolean stopRequested;

    public LoadGenApplication(LoadGeneratorConfig config) {
        this.config = config;
        this.shutdownLatch = new CountDownLatch(1);
        this.running = false;
        this.stopRequested = false;
    }

    /**
     * Initialise tous les composants
     */
    public void initialize() throws IOException {
        logger.info("=== Initializing VisitSense Load ===");
        logger.info("Configuration: {}", config);

        // 1. Pages à visiter
        urls = UrlListLoader.load(Paths.get(config.getUrlsFile()));

        // 2. Cibles et envoi
        router = TargetConfigParser.createRouter(config);
        sender = new HttpHitSender(router, config.getRequestTimeoutSeconds());

        // 3. Générateurs ; avec BACKFILL_SEED les visites de backfill reçoivent leur propre graine
        Random random = new Random();
        HitFactory hitFactory = new HitFactory(config, random);
        EcommerceOrderGenerator orderGenerator = new EcommerceOrderGenerator(config, random);
        EventCatalog eventCatalog = loadEvents();
        composer = new VisitComposer(config, sender, hitFactory, eventCatalog, orderGenerator, Clock.systemUTC());

        // 4. Funnels (optionnels)
        if (config.getFunnelConfigPath() != null) {
            FunnelRegistry registry = new FunnelRegistry(Paths.get(config.getFunnelConfigPath()));
            funnelEngine = new FunnelEngine(registry, sender, hitFactory, orderGenerator, Clock.systemUTC());
        } else {
            logger.info("No funnel definitions configured, random visits only");
        }
        runner = new VisitRunner(composer, funnelEngine);

        // 5. Planificateurs
        if (config.isBackfillEnabled()) {
            backfillScheduler = new BackfillScheduler(config,
                new PipelineDayRunner(runner, config.getConcurrency()));
        }
        realtimeScheduler = new RealtimeScheduler(config, runner, urls);

        // 6. Serveur d'état
        if (config.isStatusServerEnabled()) {
            statusServer = new StatusServer(config.getStatusServerPort(), router, composer, funnelEngine);
            statusServer.setBackfillScheduler(backfillScheduler);
            statusServer.setRealtimeScheduler(realtimeScheduler);
        }

        logger.info("=== VisitSense Load Initialized Successfully ===");
    }

    private EventCatalog loadEvents() throws IOException {
        if (config.getEventsConfigPath() == null) {
            return new EventCatalog();
        }
        return EventCatalog.load(Paths.get(config.getEventsConfigPath()));
    }

    /**
     * Exécute la génération jusqu'à sa fin naturelle ou jusqu'à {@link #stop()}.
     */
    public void run() throws IOException, InterruptedException {
        if (running) {
            logger.warn("Generator already running");
            return;
        }
        running = true;

        try {
            if (statusServer != null) {
                statusServer.start();
            }

            StartGate gate = new StartGate(config.isAutoStart(), Paths.get(config.getStartSignalFile()),
                config.getStartCheckIntervalSeconds());
            if (!gate.await(() -> stopRequested)) {
                logger.info("Stopped before the start signal was received");
                return;
            }

            logger.info("=== Starting VisitSense Load ===");

            if (backfillScheduler != null && !stopRequested) {
                List<DaySummary> days = backfillScheduler.runBackfill(urls);
                for (DaySummary day : days) {
                    logger.info("  {}", day);
                }
                if (config.isBackfillRunOnce()) {
                    logger.info("BACKFILL_RUN_ONCE set, skipping realtime generation");
                    return;
                }
            }

            if (!stopRequested) {
                RunSummary summary = realtimeScheduler.run();
                logger.info("Run summary: {}", summary);
            }
        } finally {
            running = false;
            printStatistics();
            if (statusServer != null) {
                statusServer.stop();
            }
            logger.info("=== VisitSense Load Stopped ===");
            shutdownLatch.countDown();
        }
    }

    /**
     * Demande l'arrêt ; {@link #run()} rend la main une fois les workers arrêtés.
     */
    public void stop() {
        if (stopRequested) {
            return;
        }
        logger.info("=== Stopping VisitSense Load ===");
        stopRequested = true;
        if (backfillScheduler != null) {
            backfillScheduler.stop();
        }
        if (realtimeScheduler != null) {
            realtimeScheduler.stop();
        }
    }

    /**
     * Configure le hook d'arrêt
     */
    private void setupShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown hook triggered");
            stop();
            try {
                if (!shutdownLatch.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                    logger.warn("Generator did not stop within {}s", SHUTDOWN_WAIT_SECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));
    }

    /**
     * Affiche les statistiques
     */
    public void printStatistics() {
        logger.info("=== Generator Statistics ===");
        if (composer != null) {
            logger.info("Visits composed: {}, hits attempted: {}, sent: {}, failed: {}",
                       composer.getVisitsComposed(), composer.getHitsAttempted(),
                       sender.getSentCount(), sender.getFailedCount());
        }
        if (funnelEngine != null) {
            logger.info("Funnel executions: {}", funnelEngine.getExecutionCounts());
        }
        if (router != null) {
            router.logReport();
        }
    }

    /**
     * Point d'entrée principal
     */
    public static void main(String[] args) {
        CommandLineOptions options = parseCommandLine(args);
        ScheduledExecutorService timer = null;

        try {
            ConfigurationManager manager = options.configFile != null
                ? new ConfigurationManager(Paths.get(options.configFile))
                : new ConfigurationManager();
            LoadGeneratorConfig config = LoadGeneratorConfig.fromConfiguration(manager);
            options.applyTo(config);

            LoadGenApplication app = new LoadGenApplication(config);
            app.initialize();
            app.setupShutdownHook();

            // Si durée spécifiée, arrêter après ce temps
            if (options.duration > 0) {
                logger.info("Running for {} seconds...", options.duration);
                timer = Executors.newSingleThreadScheduledExecutor();
                timer.schedule(app::stop, options.duration, TimeUnit.SECONDS);
            } else {
                logger.info("Press Ctrl+C to stop...");
            }

            app.run();

        } catch (ConfigurationException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted", e);
            System.exit(1);
        } catch (Exception e) {
            logger.error("Fatal error in VisitSense Load", e);
            System.exit(1);
        } finally {
            if (timer != null) {
                timer.shutdownNow();
            }
        }
    }

    /**
     * Parse les arguments de ligne de commande
     */
    static CommandLineOptions parseCommandLine(String[] args) {
        Options options = buildOptions();
        CommandLineParser parser = new DefaultParser();
        CommandLineOptions result = new CommandLineOptions();

        try {
            CommandLine cmd = parser.parse(options, args);

            if (cmd.hasOption("help")) {
                printHelp(options);
                System.exit(0);
            }

            result.configFile = cmd.getOptionValue("config");
            result.urlsFile = cmd.getOptionValue("urls");
            result.funnelsFile = cmd.getOptionValue("funnels");
            result.mode = cmd.getOptionValue("mode");
            if (result.mode != null && !"realtime".equals(result.mode) && !"backfill".equals(result.mode)) {
                throw new ParseException("Unknown mode: " + result.mode + " (expected realtime or backfill)");
            }
            result.duration = Integer.parseInt(cmd.getOptionValue("duration", "0"));

        } catch (ParseException | NumberFormatException e) {
            logger.error("Error parsing command line: {}", e.getMessage());
            printHelp(options);
            System.exit(1);
        }

        return result;
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption("c", "config", true, "Properties file overriding the bundled defaults");
        options.addOption("u", "urls", true, "URL list file (overrides URLS_FILE)");
        options.addOption("f", "funnels", true, "Funnel definitions file (overrides FUNNEL_CONFIG_PATH)");
        options.addOption("m", "mode", true, "Execution mode (realtime/backfill)");
        options.addOption("d", "duration", true, "Run duration in seconds (0 = until stopped)");
        options.addOption("h", "help", false, "Show help");
        return options;
    }

    /**
     * Affiche l'aide
     */
    private static void printHelp(Options options) {
        HelpFormatter formatter = new HelpFormatter();
        formatter.printHelp("visitsense-load", options);
    }

    /**
     * Options de ligne de commande
     */
    static class CommandLineOptions {
        String configFile;
        String urlsFile;
        String funnelsFile;
        String mode;
        int duration = 0;

        void applyTo(LoadGeneratorConfig config) {
            if (urlsFile != null) {
                config.setUrlsFile(urlsFile);
            }
            if (funnelsFile != null) {
                config.setFunnelConfigPath(funnelsFile);
            }
            if ("backfill".equals(mode)) {
                config.setBackfillEnabled(true);
                config.setBackfillRunOnce(true);
            } else if ("realtime".equals(mode)) {
                config.setBackfillEnabled(false);
            }
        }
    }

    // Getters pour les tests
    public TargetRouter getRouter() { return router; }
    public VisitComposer getComposer() { return composer; }
    public FunnelEngine getFunnelEngine() { return funnelEngine; }
    public RealtimeScheduler getRealtimeScheduler() { return realtimeScheduler; }
    public BackfillScheduler getBackfillScheduler() { return backfillScheduler; }
    public boolean isRunning() { return running; }
}
