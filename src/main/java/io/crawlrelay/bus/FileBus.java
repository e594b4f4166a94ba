package io.crawlrelay.bus;

import io.crawlrelay.util.AtomicFiles;
import io.crawlrelay.util.Jsons;
import io.crawlrelay.util.SafeNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Directory-backed {@link MessageBus}.
 *
 * <p>Layout under the root:
 * <ul>
 *   <li>{@code topics/<topic>.json} lists the subscriptions bound to a topic. A topic
 *   with no bindings delivers to the subscription of the same name.</li>
 *   <li>{@code subscriptions/<sub>/inbox} holds messages waiting for delivery.</li>
 *   <li>{@code subscriptions/<sub>/processing} holds delivered, unsettled messages.
 *   They go back to the inbox on nack, and on the next subscribe after a crash.</li>
 *   <li>{@code subscriptions/<sub>/dead} holds inbox files that could not be parsed.</li>
 * </ul>
 */
public final class FileBus implements MessageBus {
    public static final long DEFAULT_POLL_INTERVAL_MS = 500L;
    static final String MESSAGE_SUFFIX = ".msg.json";

    private static final Logger LOG = LoggerFactory.getLogger(FileBus.class);

    private final Path root;
    private final long pollIntervalMs;
    private final ConcurrentMap<String, Object> claimLocks;

    public FileBus(Path root) {
        this(root, DEFAULT_POLL_INTERVAL_MS);
    }

    public FileBus(Path root, long pollIntervalMs) {
        this.root = root;
        this.pollIntervalMs = Math.max(10L, pollIntervalMs);
        this.claimLocks = new ConcurrentHashMap<>();
    }

    public Path root() {
        return root;
    }

    public synchronized void bind(String topic, String subscription) {
        Path topicFile = topicFile(topic);
        Set<String> subscriptions = new LinkedHashSet<>(subscribersOf(topic));
        subscriptions.add(subscription);
        try {
            Files.createDirectories(topicFile.getParent());
            AtomicFiles.write(topicFile, Jsons.toJsonBytes(new TopicFile(List.copyOf(subscriptions))));
        } catch (IOException e) {
            throw new BusException("Failed to bind subscription " + subscription + " to topic " + topic, e);
        }
    }

    public List<String> subscribersOf(String topic) {
        Path topicFile = topicFile(topic);
        if (!Files.exists(topicFile)) {
            return List.of();
        }
        try {
            TopicFile file = Jsons.mapper().readValue(topicFile.toFile(), TopicFile.class);
            return file == null || file.subscriptions() == null ? List.of() : file.subscriptions();
        } catch (IOException e) {
            throw new BusException("Failed to read topic bindings: " + topicFile, e);
        }
    }

    @Override
    public String publish(String channel, byte[] data, Map<String, String> attributes) {
        if (channel == null || channel.isBlank()) {
            throw new BusException("Publish channel cannot be empty");
        }
        List<String> targets = subscribersOf(channel);
        if (targets.isEmpty()) {
            targets = List.of(channel);
        }
        long now = Instant.now().toEpochMilli();
        String msgId = "msg_" + UUID.randomUUID().toString().replace("-", "");
        BusEnvelope envelope = new BusEnvelope(
                msgId,
                channel,
                now,
                attributes == null ? Map.of() : Map.copyOf(attributes),
                Base64.getEncoder().encodeToString(data == null ? new byte[0] : data)
        );
        byte[] json = Jsons.toJsonBytes(envelope);
        String fileName = String.format("%015d_%s%s", now, msgId, MESSAGE_SUFFIX);
        for (String subscription : targets) {
            Path inbox = inboxDir(subscription);
            try {
                Files.createDirectories(inbox);
                AtomicFiles.write(inbox.resolve(fileName), json);
            } catch (IOException e) {
                throw new BusException("Failed to publish message " + msgId + " to " + subscription, e);
            }
        }
        return msgId;
    }

    public Optional<ClaimedMessage> claimNext(String subscription) {
        Object lock = claimLocks.computeIfAbsent(subscription, key -> new Object());
        synchronized (lock) {
            for (Path candidate : listMessageFiles(inboxDir(subscription))) {
                Path processing = processingDir(subscription);
                Path claimed = processing.resolve(candidate.getFileName().toString());
                try {
                    Files.createDirectories(processing);
                    AtomicFiles.move(candidate, claimed);
                } catch (IOException e) {
                    LOG.warn("Failed to claim bus message. subscription={} file={}", subscription, candidate, e);
                    continue;
                }
                try {
                    BusEnvelope envelope = Jsons.mapper().readValue(claimed.toFile(), BusEnvelope.class);
                    validate(envelope);
                    return Optional.of(new ClaimedMessage(subscription, envelope, claimed));
                } catch (IOException | RuntimeException e) {
                    moveToDead(subscription, claimed, e);
                }
            }
            return Optional.empty();
        }
    }

    public void ack(ClaimedMessage message) {
        try {
            Files.deleteIfExists(message.processingFile());
        } catch (IOException e) {
            throw new BusException("Failed to ack message: " + message.envelope().msgId(), e);
        }
    }

    public void nack(ClaimedMessage message) {
        try {
            Path inbox = inboxDir(message.subscription());
            Files.createDirectories(inbox);
            AtomicFiles.move(message.processingFile(), inbox.resolve(message.processingFile().getFileName().toString()));
        } catch (IOException e) {
            throw new BusException("Failed to nack message: " + message.envelope().msgId(), e);
        }
    }

    /**
     * Returns messages left in {@code processing} by a previous process to the inbox.
     */
    public int recoverUnsettled(String subscription) {
        int moved = 0;
        Path inbox = inboxDir(subscription);
        for (Path leased : listMessageFiles(processingDir(subscription))) {
            try {
                Files.createDirectories(inbox);
                AtomicFiles.move(leased, inbox.resolve(leased.getFileName().toString()));
                moved++;
            } catch (IOException e) {
                LOG.warn("Failed to return unsettled message. subscription={} file={}", subscription, leased, e);
            }
        }
        return moved;
    }

    public int pendingCount(String subscription) {
        return listMessageFiles(inboxDir(subscription)).size();
    }

    @Override
    public BusSubscription subscribe(String subscription, FlowControl flowControl, MessageHandler handler) {
        try {
            Files.createDirectories(inboxDir(subscription));
            Files.createDirectories(processingDir(subscription));
        } catch (IOException e) {
            throw new BusException("Failed to initialize subscription: " + subscription, e);
        }
        int recovered = recoverUnsettled(subscription);
        if (recovered > 0) {
            LOG.info("Returned unsettled messages for redelivery. subscription={} count={}", subscription, recovered);
        }
        PollingSubscription polling = new PollingSubscription(subscription, flowControl, handler);
        polling.start();
        return polling;
    }

    // A message that can never be handed out intact goes to dead instead of cycling through nack.
    private static void validate(BusEnvelope envelope) {
        if (envelope == null || envelope.msgId() == null || envelope.msgId().isBlank()) {
            throw new BusException("Bus message without msgId");
        }
        if (envelope.dataB64() != null) {
            Base64.getDecoder().decode(envelope.dataB64());
        }
    }

    private void moveToDead(String subscription, Path file, Exception cause) {
        Path dead = subscriptionDir(subscription).resolve("dead");
        try {
            Files.createDirectories(dead);
            AtomicFiles.move(file, dead.resolve(file.getFileName().toString()));
            LOG.error("Unreadable bus message moved aside. subscription={} file={}", subscription, file, cause);
        } catch (IOException e) {
            LOG.error("Unreadable bus message could not be moved. subscription={} file={}", subscription, file, e);
        }
    }

    private List<Path> listMessageFiles(Path dir) {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + MESSAGE_SUFFIX)) {
            for (Path path : stream) {
                files.add(path);
            }
        } catch (IOException e) {
            LOG.warn("Failed to list bus directory: {}", dir, e);
            return files;
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }

    private Path topicFile(String topic) {
        return root.resolve("topics").resolve(SafeNames.sanitizeOrDefault(topic, "topic") + ".json");
    }

    private Path subscriptionDir(String subscription) {
        return root.resolve("subscriptions").resolve(SafeNames.sanitizeOrDefault(subscription, "subscription"));
    }

    Path inboxDir(String subscription) {
        return subscriptionDir(subscription).resolve("inbox");
    }

    Path processingDir(String subscription) {
        return subscriptionDir(subscription).resolve("processing");
    }

    public record BusEnvelope(
            String msgId,
            String channel,
            long publishedAtMs,
            Map<String, String> attributes,
            String dataB64
    ) {
    }

    public record ClaimedMessage(String subscription, BusEnvelope envelope, Path processingFile) {
    }

    private record TopicFile(List<String> subscriptions) {
    }

    private final class FileDelivery implements Delivery {
        private final ClaimedMessage claimed;
        private final AtomicBoolean settled = new AtomicBoolean(false);
        private volatile boolean nacked;

        private FileDelivery(ClaimedMessage claimed) {
            this.claimed = claimed;
        }

        @Override
        public String messageId() {
            return claimed.envelope().msgId();
        }

        @Override
        public Map<String, String> attributes() {
            Map<String, String> attributes = claimed.envelope().attributes();
            return attributes == null ? Map.of() : attributes;
        }

        @Override
        public byte[] data() {
            String encoded = claimed.envelope().dataB64();
            return encoded == null ? new byte[0] : Base64.getDecoder().decode(encoded);
        }

        @Override
        public void ack() {
            if (settled.compareAndSet(false, true)) {
                FileBus.this.ack(claimed);
            }
        }

        @Override
        public void nack() {
            if (settled.compareAndSet(false, true)) {
                nacked = true;
                FileBus.this.nack(claimed);
            }
        }

        boolean isSettled() {
            return settled.get();
        }

        boolean wasNacked() {
            return nacked;
        }
    }

    private final class PollingSubscription implements BusSubscription {
        private final String subscription;
        private final MessageHandler handler;
        private final Semaphore permits;
        private final ExecutorService handlers;
        private final Thread poller;
        private final CountDownLatch stopSignal = new CountDownLatch(1);
        private final AtomicBoolean active = new AtomicBoolean(true);

        private PollingSubscription(String subscription, FlowControl flowControl, MessageHandler handler) {
            this.subscription = subscription;
            this.handler = handler;
            this.permits = new Semaphore(flowControl.maxInFlight());
            AtomicInteger counter = new AtomicInteger();
            this.handlers = Executors.newFixedThreadPool(flowControl.maxInFlight(), runnable -> {
                Thread thread = new Thread(runnable, "crawlrelay-bus-" + subscription + "-handler-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
            this.poller = new Thread(this::pollLoop, "crawlrelay-bus-" + subscription + "-poller");
            this.poller.setDaemon(true);
        }

        private void start() {
            poller.start();
        }

        private void pollLoop() {
            try {
                while (active.get()) {
                    if (!permits.tryAcquire(pollIntervalMs, TimeUnit.MILLISECONDS)) {
                        continue;
                    }
                    if (!active.get()) {
                        permits.release();
                        break;
                    }
                    Optional<ClaimedMessage> next;
                    try {
                        next = claimNext(subscription);
                    } catch (RuntimeException e) {
                        LOG.error("Bus poll failed. subscription={}", subscription, e);
                        next = Optional.empty();
                    }
                    if (next.isEmpty()) {
                        permits.release();
                        stopSignal.await(pollIntervalMs, TimeUnit.MILLISECONDS);
                        continue;
                    }
                    FileDelivery delivery = new FileDelivery(next.get());
                    handlers.execute(() -> handle(delivery));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                handlers.shutdown();
            }
        }

        private void handle(FileDelivery delivery) {
            try {
                handler.onMessage(delivery);
            } catch (RuntimeException e) {
                LOG.error("Message handler failed. subscription={} message_id={}", subscription, delivery.messageId(), e);
            } finally {
                if (!delivery.isSettled()) {
                    LOG.warn("Handler returned without settling; returning message. subscription={} message_id={}",
                            subscription, delivery.messageId());
                    try {
                        delivery.nack();
                    } catch (BusException e) {
                        LOG.error("Failed to return message. subscription={} message_id={}", subscription, delivery.messageId(), e);
                    }
                }
                if (delivery.wasNacked()) {
                    pauseAfterNack();
                }
                permits.release();
            }
        }

        // Holding the permit for one poll interval keeps a returned message from being reclaimed at once.
        private void pauseAfterNack() {
            try {
                stopSignal.await(pollIntervalMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        @Override
        public void stop() {
            if (active.compareAndSet(true, false)) {
                stopSignal.countDown();
            }
        }

        @Override
        public boolean awaitTermination(Duration timeout) throws InterruptedException {
            long deadline = System.nanoTime() + timeout.toNanos();
            poller.join(Math.max(1L, timeout.toMillis()));
            if (poller.isAlive()) {
                return false;
            }
            long remaining = deadline - System.nanoTime();
            return handlers.awaitTermination(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }
}
