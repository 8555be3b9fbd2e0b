package io.tokenfeed.gateway.core;

import io.tokenfeed.gateway.model.SubscriptionKind;
import io.tokenfeed.gateway.subscription.SubscriptionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Polls a token list file (one mint per line) and applies its changes to the desired
 * token-trade set. Lines added since the last poll are subscribed, lines removed are
 * unsubscribed. Only mints this watcher added are ever removed: a mint that was already
 * desired through seeds or discovery when the file listed it stays desired after it leaves
 * the file. A missing file reads as empty.
 */
public class TokenListWatcher implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TokenListWatcher.class);

    private final Path file;
    private final long pollIntervalMs;
    private final SubscriptionManager subscriptions;
    private final ScheduledExecutorService scheduler;
    private final Set<String> ownedTokens = new HashSet<>();

    private Set<String> lastTokens = Set.of();
    private volatile boolean running = false;

    public TokenListWatcher(Path file, long pollIntervalMs, SubscriptionManager subscriptions) {
        this.file = file;
        this.pollIntervalMs = pollIntervalMs;
        this.subscriptions = subscriptions;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "token-list-watcher");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Reads the file once synchronously, then keeps polling in the background.
     */
    public void start() {
        if (running) {
            return;
        }
        running = true;
        poll();
        scheduler.scheduleWithFixedDelay(this::pollSafely, pollIntervalMs, pollIntervalMs, TimeUnit.MILLISECONDS);
        LOGGER.info("Watching token list {} (interval: {} ms)", file, pollIntervalMs);
    }

    /**
     * Reads the file and applies the difference to the previous read.
     *
     * @return true if the desired set changed
     */
    public synchronized boolean poll() {
        Set<String> current = readTokens();

        Set<String> added = new LinkedHashSet<>(current);
        added.removeAll(lastTokens);
        Set<String> removed = new LinkedHashSet<>(lastTokens);
        removed.removeAll(current);
        lastTokens = current;

        if (added.isEmpty() && removed.isEmpty()) {
            return false;
        }

        boolean changed = false;
        if (!added.isEmpty()) {
            LOGGER.info("Token list added {} mint(s): {}", added.size(), added);
            for (String mint : added) {
                if (subscriptions.addDesired(SubscriptionKind.TOKEN_TRADE, mint)) {
                    ownedTokens.add(mint);
                    changed = true;
                }
            }
        }
        if (!removed.isEmpty()) {
            LOGGER.info("Token list removed {} mint(s): {}", removed.size(), removed);
            for (String mint : removed) {
                if (!ownedTokens.remove(mint)) {
                    LOGGER.debug("Keeping {}, it was desired before the token list named it", mint);
                    continue;
                }
                changed |= subscriptions.removeDesired(SubscriptionKind.TOKEN_TRADE, mint);
            }
        }
        if (changed) {
            subscriptions.reconcile(SubscriptionKind.TOKEN_TRADE);
        }
        return changed;
    }

    private void pollSafely() {
        try {
            poll();
        } catch (Exception e) {
            LOGGER.error("Failed to apply token list {}", file, e);
        }
    }

    private Set<String> readTokens() {
        if (!Files.exists(file)) {
            return Set.of();
        }
        try {
            Set<String> tokens = new LinkedHashSet<>();
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                String token = line.trim();
                if (!token.isEmpty() && !token.startsWith("#")) {
                    tokens.add(token);
                }
            }
            return tokens;
        } catch (IOException e) {
            LOGGER.warn("Could not read token list {}, keeping previous contents: {}", file, e.getMessage());
            return new HashSet<>(lastTokens);
        }
    }

    public void stop() {
        running = false;
        scheduler.shutdownNow();
    }

    @Override
    public void close() {
        stop();
    }
}
