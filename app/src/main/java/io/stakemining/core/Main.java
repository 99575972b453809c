package io.stakemining.core;

import io.stakemining.core.api.ApiServer;
import io.stakemining.core.config.MiningConfig;
import io.stakemining.core.config.MiningConfigLoader;
import io.stakemining.core.identity.IdentityIssuer;
import io.stakemining.core.identity.IdentityProof;
import io.stakemining.core.metrics.MiningMetrics;
import io.stakemining.core.node.MiningNode;
import io.stakemining.core.node.NodeConfig;
import io.stakemining.core.protocol.Amounts;
import io.stakemining.core.protocol.Keys;
import io.stakemining.core.protocol.MiningException;
import io.stakemining.core.reward.RewardRange;
import io.stakemining.core.session.MiningSessions;
import io.stakemining.core.session.SessionPhase;
import io.stakemining.core.session.SessionStatus;
import io.stakemining.core.token.SignedPermit;
import io.stakemining.core.token.TransferAuthorization;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import java.time.Clock;
import java.util.Comparator;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.stream.Stream;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) throws Exception {
        configureLogging();
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        Path configPath = options.configFile();
        MiningConfig miningConfig = MiningConfigLoader.load(configPath);
        if (configPath != null && !Files.exists(configPath)) {
            MiningConfigLoader.save(configPath, miningConfig);
            LOG.info("Wrote default mining config to " + configPath);
        }

        NodeConfig nodeConfig = NodeConfig.defaultLocal();
        if (options.administrator() != null) {
            nodeConfig = nodeConfig.withAdministrator(options.administrator());
        }
        if (options.treasuryMinor() >= 0) {
            nodeConfig = nodeConfig.withTreasuryFunding(options.treasuryMinor());
        }

        // Local attestation issuer; production deployments plug in the oracle's verifier instead.
        IdentityIssuer issuer = IdentityIssuer.generate();
        Clock clock = Clock.systemUTC();
        MiningNode node;
        if (options.inMemory()) {
            node = MiningNode.inMemory(nodeConfig, miningConfig, issuer.verifier(), clock);
        } else {
            Path dataPath = options.dataDir().toAbsolutePath().normalize();
            if (options.resetState()) {
                resetState(dataPath);
            }
            Files.createDirectories(dataPath);
            node = MiningNode.rocks(nodeConfig, miningConfig, issuer.verifier(), clock, dataPath.toString());
        }

        ApiServer apiServer = null;
        try {
            node.start();
            LOG.info("Pool " + nodeConfig.poolAddress + " treasury="
                    + Amounts.format(node.sessions().treasuryBalance()) + " " + MiningNode.REWARD_SYMBOL
                    + ", administrator=" + node.admin().administrator());

            if (options.demo()) {
                runDemoFlow(node, issuer);
            } else {
                LOG.info("Demo flow disabled (--no-demo)");
            }

            if (options.enableApi()) {
                apiServer = new ApiServer(node.sessions(), options.apiBind(), options.apiPort(), options.apiToken());
                apiServer.start();
            }

            if (options.keepAlive()) {
                CountDownLatch shutdownLatch = new CountDownLatch(1);
                Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "stake-mining-shutdown"));
                LOG.info("Node running. Press CTRL+C to exit.");
                shutdownLatch.await();
            } else if (options.demoDurationMillis() > 0) {
                try {
                    Thread.sleep(options.demoDurationMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        } finally {
            if (apiServer != null) {
                apiServer.stop();
            }
            node.close();
        }
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to load logging.properties, using JVM defaults", e);
        }
    }

    private static void runDemoFlow(MiningNode node, IdentityIssuer issuer) {
        MiningSessions sessions = node.sessions();
        String pool = sessions.poolAddress();
        long stake = 10 * Amounts.UNIT;
        String alice = "alice123456";
        String bob = "bob654321";

        // Alice stakes through a plain allowance and nominates Bob.
        if (sessions.status(alice).phase() == SessionPhase.IDLE) {
            node.spendToken().approve(alice, pool, stake);
            IdentityProof aliceProof = issuer.issue("person-alice", alice, sessions.scope());
            tryOpen(sessions, alice, bob, stake, aliceProof, TransferAuthorization.allowance());
        }
        if (sessions.status(bob).phase() == SessionPhase.IDLE) {
            node.spendToken().approve(bob, pool, stake);
            IdentityProof bobProof = issuer.issue("person-bob", bob, sessions.scope());
            tryOpen(sessions, bob, null, stake, bobProof, TransferAuthorization.allowance());
        }

        // Carol holds her own key and stakes with a signed permit instead of an allowance.
        KeyPair carolKeys = Keys.generate();
        String carol = Keys.deriveAddress(carolKeys.getPublic());
        node.spendToken().mint(carol, 50 * Amounts.UNIT);
        long deadline = Clock.systemUTC().instant().getEpochSecond() + 3_600;
        SignedPermit permit = SignedPermit.sign(carolKeys, MiningNode.SPEND_SYMBOL, pool, stake, 1L, deadline);
        IdentityProof carolProof = issuer.issue("person-carol", carol, sessions.scope());
        tryOpen(sessions, carol, alice, stake, carolProof, permit);

        // The same person cannot mine twice under another address.
        IdentityProof replay = issuer.issue("person-alice", bob, sessions.scope());
        tryOpen(sessions, bob, null, stake, replay, TransferAuthorization.allowance());

        for (String caller : new String[] {alice, bob, carol}) {
            SessionStatus status = sessions.status(caller);
            LOG.info(caller + " phase=" + status.phase() + " unlocksAt=" + status.unlocksAt()
                    + " referralEligible=" + sessions.isReferralEligible(caller));
        }

        RewardRange range = sessions.estimateReward(stake);
        LOG.info("Reward for " + Amounts.format(stake) + " " + MiningNode.SPEND_SYMBOL + ": "
                + Amounts.format(range.minimum()) + " .. " + Amounts.format(range.maximum())
                + " " + MiningNode.REWARD_SYMBOL);
        long activeStake = sessions.pool().activeStake();
        LOG.info("Active stake=" + Amounts.format(activeStake)
                + " requiredReserve=" + Amounts.format(sessions.requiredReserve(activeStake))
                + " treasury=" + Amounts.format(sessions.treasuryBalance()));
        LOG.info("=== Metrics ===\n" + MiningMetrics.scrapeMetrics());
    }

    private static void tryOpen(MiningSessions sessions, String caller, String referral, long stake,
                                IdentityProof proof, TransferAuthorization authorization) {
        try {
            sessions.openSession(caller, referral, stake, proof, authorization);
        } catch (MiningException e) {
            LOG.info(() -> "Open rejected for " + caller + ": " + e.error().code() + " (" + e.getMessage() + ")");
        }
    }

    private static void resetState(Path dataPath) {
        if (!Files.exists(dataPath)) {
            return;
        }
        try (Stream<Path> stream = Files.walk(dataPath)) {
            stream.sorted(Comparator.reverseOrder())
                    .filter(path -> !path.equals(dataPath))
                    .forEach(path -> {
                        try {
                            Files.deleteIfExists(path);
                        } catch (IOException e) {
                            throw new IllegalStateException("Failed to delete " + path, e);
                        }
                    });
        } catch (IOException e) {
            throw new IllegalStateException("Failed to reset mining state in " + dataPath, e);
        }
        LOG.info("Cleared mining state under " + dataPath);
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path dataDir,
            boolean inMemory,
            boolean resetState,
            Path configFile,
            boolean keepAlive,
            boolean demo,
            long demoDurationMillis,
            boolean enableApi,
            String apiBind,
            int apiPort,
            String apiToken,
            String administrator,
            long treasuryMinor
    ) {
        static CliOptions parse(String[] args) {
            Path dataDir = envPath("STAKE_MINING_DATA_DIR", Path.of("./data/mining"));
            boolean inMemory = "true".equalsIgnoreCase(System.getenv("STAKE_MINING_IN_MEMORY"));
            boolean reset = false;
            Path configFile = envPath("STAKE_MINING_CONFIG", null);
            boolean keepAlive = false;
            boolean demo = true;
            long demoDurationMillis = 0L;
            boolean enableApi = "true".equalsIgnoreCase(System.getenv("STAKE_MINING_ENABLE_API"));
            String apiBind = envOrDefault("STAKE_MINING_API_BIND", "127.0.0.1");
            int apiPort = 8080;
            String apiToken = null;
            String administrator = envOrDefault("STAKE_MINING_ADMIN", null);
            long treasuryMinor = -1L;
            boolean showHelp = false;
            String error = null;

            try {
                apiPort = envPort("STAKE_MINING_API_PORT", 8080);
                String treasuryEnv = System.getenv("STAKE_MINING_TREASURY");
                if (treasuryEnv != null && !treasuryEnv.isBlank()) {
                    treasuryMinor = parseTokens(treasuryEnv, "STAKE_MINING_TREASURY");
                }
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                error = ex.getMessage();
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--data-dir=")) {
                        dataDir = Path.of(arg.substring("--data-dir=".length()));
                    } else if (arg.equals("--in-memory")) {
                        inMemory = true;
                    } else if (arg.equals("--reset-state")) {
                        reset = true;
                    } else if (arg.startsWith("--config=")) {
                        configFile = Path.of(arg.substring("--config=".length()));
                    } else if (arg.equals("--keep-alive")) {
                        keepAlive = true;
                    } else if (arg.equals("--demo")) {
                        demo = true;
                    } else if (arg.equals("--no-demo")) {
                        demo = false;
                    } else if (arg.startsWith("--demo-duration-ms=")) {
                        try {
                            demoDurationMillis = parseNonNegativeLong(arg.substring("--demo-duration-ms=".length()), "--demo-duration-ms");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.equals("--enable-api")) {
                        enableApi = true;
                    } else if (arg.startsWith("--api-bind=")) {
                        apiBind = arg.substring("--api-bind=".length());
                    } else if (arg.startsWith("--api-port=")) {
                        try {
                            apiPort = parsePort(arg.substring("--api-port=".length()), "--api-port");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--api-token=")) {
                        apiToken = arg.substring("--api-token=".length());
                    } else if (arg.startsWith("--admin=")) {
                        administrator = arg.substring("--admin=".length()).trim();
                    } else if (arg.startsWith("--treasury=")) {
                        try {
                            treasuryMinor = parseTokens(arg.substring("--treasury=".length()), "--treasury");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (!arg.startsWith("--")) {
                        dataDir = Path.of(arg);
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            if (apiToken == null || apiToken.isBlank()) {
                apiToken = System.getenv("STAKE_MINING_API_TOKEN");
            }
            if (administrator != null && administrator.isBlank()) {
                administrator = null;
            }
            keepAlive = keepAlive || enableApi || "true".equalsIgnoreCase(System.getenv("STAKE_MINING_KEEP_ALIVE"));

            return new CliOptions(
                    showHelp,
                    error,
                    dataDir,
                    inMemory,
                    reset,
                    configFile,
                    keepAlive,
                    demo,
                    demoDurationMillis,
                    enableApi,
                    apiBind,
                    apiPort,
                    apiToken,
                    administrator,
                    treasuryMinor
            );
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: stake-mining [options]

Options:
  --help, -h                 Show this help message and exit
  --data-dir=<path>          Path for the RocksDB session ledger (default ./data/mining)
  --in-memory                Keep the ledger in memory only
  --reset-state              Delete the ledger under --data-dir before starting
  --config=<file>            Mining config JSON (written with defaults if missing)
  --keep-alive               Keep the node running until interrupted
  --demo / --no-demo         Enable (default) or disable the demo staking flow
  --demo-duration-ms=<ms>    How long to keep the JVM alive when not using --keep-alive (default 0)
  --enable-api               Start the HTTP API (default bind 127.0.0.1:8080)
  --api-bind=<host>          Bind address for the HTTP API
  --api-port=<port>          Port for the HTTP API (default 8080)
  --api-token=<token>        Require Bearer/X-API-Key token for the HTTP API
  --admin=<address>          Administrator allowed to change the mining config
  --treasury=<tokens>        Reward tokens minted to the pool treasury at start (e.g. 250000.5)

Environment overrides:
  STAKE_MINING_DATA_DIR      Override --data-dir
  STAKE_MINING_IN_MEMORY     Set to "true" for an in-memory ledger
  STAKE_MINING_CONFIG        Override --config
  STAKE_MINING_ENABLE_API    Set to "true" to enable the HTTP API without CLI flag
  STAKE_MINING_API_BIND      Override --api-bind
  STAKE_MINING_API_PORT      Override --api-port
  STAKE_MINING_API_TOKEN     Token for API auth (if --api-token not supplied)
  STAKE_MINING_ADMIN         Override --admin
  STAKE_MINING_TREASURY      Override --treasury
  STAKE_MINING_KEEP_ALIVE    Set to "true" to force keep-alive mode
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static String envOrDefault(String key, String fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static int envPort(String key, int fallback) {
            String value = System.getenv(key);
            if (value == null || value.isBlank()) {
                return fallback;
            }
            return parsePort(value, key);
        }

        private static int parsePort(String value, String flag) {
            try {
                int port = Integer.parseInt(value);
                if (port <= 0 || port > 65_535) {
                    throw new NumberFormatException();
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port for " + flag + ": " + value);
            }
        }

        private static long parseNonNegativeLong(String value, String flag) {
            try {
                long parsed = Long.parseLong(value);
                if (parsed < 0) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }

        private static long parseTokens(String value, String flag) {
            try {
                long minor = Amounts.parseDecimal(value);
                if (minor < 0) {
                    throw new NumberFormatException();
                }
                return minor;
            } catch (NumberFormatException | ArithmeticException e) {
                throw new IllegalArgumentException("Invalid token amount for " + flag + ": " + value);
            }
        }
    }
}
