package com.proxyhub.aggregator.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.proxyhub.aggregator.model.Subscription;
import com.proxyhub.config.HubProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Stores each subscription in its own JSON file. Files are independent: there is no
 * cross-file transaction, and loading skips any file that cannot be read back.
 */
@Repository
public class SubscriptionRepository {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionRepository.class);
    private static final String EXTENSION = ".json";
    private static final Pattern ID_PATTERN = Pattern.compile("[0-9a-f]{32}");

    private final ObjectMapper objectMapper;
    private final Path storageDir;
    private final long defaultUpdateIntervalSeconds;

    public SubscriptionRepository(HubProperties properties, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.storageDir = Path.of(properties.getStorage().getDir());
        this.defaultUpdateIntervalSeconds = properties.getSubscription().getDefaultUpdateIntervalSeconds();
    }

    public synchronized boolean save(Subscription subscription) {
        Path target = pathFor(subscription.id());
        Path temp = storageDir.resolve(subscription.id() + EXTENSION + ".tmp");
        try {
            Files.createDirectories(storageDir);
            byte[] json = objectMapper.writerWithDefaultPrettyPrinter()
                .writeValueAsBytes(SubscriptionDocument.from(subscription));
            Files.write(temp, json);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            return true;
        } catch (IOException e) {
            log.error("Failed to save subscription {} to {}", subscription.name(), target, e);
            return false;
        }
    }

    public synchronized boolean delete(String subscriptionId) {
        if (!ID_PATTERN.matcher(subscriptionId).matches()) {
            return false;
        }
        try {
            return Files.deleteIfExists(pathFor(subscriptionId));
        } catch (IOException e) {
            log.error("Failed to delete persisted subscription {}", subscriptionId, e);
            return false;
        }
    }

    /**
     * Loads every readable subscription file. A corrupt or partially written file is logged and skipped.
     */
    public List<Subscription> loadAll() {
        List<Subscription> loaded = new ArrayList<>();
        if (!Files.isDirectory(storageDir)) {
            return loaded;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(storageDir, "*" + EXTENSION)) {
            for (Path file : files) {
                Subscription subscription = load(file);
                if (subscription != null) {
                    loaded.add(subscription);
                }
            }
        } catch (IOException e) {
            log.error("Failed to list subscriptions in {}", storageDir, e);
        }
        log.info("Loaded {} subscriptions from {}", loaded.size(), storageDir);
        return loaded;
    }

    private Subscription load(Path file) {
        try {
            SubscriptionDocument document = objectMapper.readValue(file.toFile(), SubscriptionDocument.class);
            if (document == null) {
                log.error("Failed to load subscription from {}: empty document", file);
                return null;
            }
            if (document.id() != null && !ID_PATTERN.matcher(document.id()).matches()) {
                log.warn("Subscription file {} carries an invalid id, deriving it from the URL", file);
                document = withoutId(document);
            }
            return document.toSubscription(defaultUpdateIntervalSeconds);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to load subscription from {}: {}", file, e.getMessage());
            return null;
        }
    }

    private SubscriptionDocument withoutId(SubscriptionDocument document) {
        return new SubscriptionDocument(
            null,
            document.name(),
            document.url(),
            document.enabled(),
            document.priority(),
            document.tags(),
            document.autoUpdate(),
            document.updateInterval(),
            document.lastUpdateTime(),
            document.lastFetchSuccess(),
            document.lastErrorMessage(),
            document.totalUpdates(),
            document.successfulUpdates(),
            document.failedUpdates(),
            document.configs()
        );
    }

    private Path pathFor(String subscriptionId) {
        return storageDir.resolve(subscriptionId + EXTENSION);
    }
}
