package io.crawlrelay.runtime;

import io.crawlrelay.bus.FileBus;
import io.crawlrelay.bus.RecordingBus;
import io.crawlrelay.config.WorkerConfig;
import io.crawlrelay.model.ErrorGenre;
import io.crawlrelay.model.JobAttributes;
import io.crawlrelay.retry.Sleeper;
import io.crawlrelay.sink.ErrorSink;
import io.crawlrelay.stage.DurableStage;
import io.crawlrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

final class WorkerSupervisorTest {
    private static final Logger LOG = LoggerFactory.getLogger(WorkerSupervisorTest.class);

    @Test
    void successfulDeliveryIsAckedAndCleanedUp() throws Exception {
        Path root = Files.createTempDirectory("crawlrelay-supervisor-ok-");
        try {
            RecordingBus bus = new RecordingBus();
            RecordingSink sink = new RecordingSink();
            WorkerSupervisor supervisor = new WorkerSupervisor(config(root, "retry-topic", 3), bus, sink, noSleep(), LOG);
            RecordingBus.TestDelivery delivery = delivery("m1", Map.of(), "exit 0");

            supervisor.onMessage(delivery);

            Assertions.assertEquals(1, delivery.acks());
            Assertions.assertEquals(0, delivery.nacks());
            Assertions.assertTrue(supervisor.stage().pendingFiles().isEmpty());
            Assertions.assertTrue(bus.published().isEmpty());
            Assertions.assertTrue(sink.genres.isEmpty());
            Assertions.assertEquals(1L, supervisor.stats().completed());
            Assertions.assertEquals(WorkerState.LISTENING, supervisor.state());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void proxyBlockIsResubmittedWithCooldown() throws Exception {
        Path root = Files.createTempDirectory("crawlrelay-supervisor-proxy-");
        try {
            RecordingBus bus = new RecordingBus();
            RecordingSink sink = new RecordingSink();
            List<Duration> sleeps = new ArrayList<>();
            WorkerSupervisor supervisor = new WorkerSupervisor(config(root, "retry-topic", 3), bus, sink, sleeps::add, LOG);
            RecordingBus.TestDelivery delivery = delivery("m1", Map.of(), "exit 41");

            supervisor.onMessage(delivery);

            Assertions.assertEquals(1, delivery.acks());
            Assertions.assertEquals(List.of(ErrorGenre.PROXY_BLOCK), sink.genres);
            Assertions.assertEquals(List.of(Duration.ofSeconds(300)), sleeps);
            Assertions.assertEquals(1, bus.published().size());
            Map<String, String> attributes = bus.published().get(0).attributes();
            Assertions.assertEquals("retry-topic", bus.published().get(0).channel());
            Assertions.assertEquals("1", attributes.get(JobAttributes.RETRY_COUNT));
            Assertions.assertEquals("proxy_block", attributes.get(JobAttributes.ERROR_GENRE));
            Assertions.assertEquals("m1", attributes.get(JobAttributes.ORIGIN_MESSAGE_ID));
            Assertions.assertEquals("sub-a", attributes.get(JobAttributes.ORIGIN_SUBSCRIPTION));
            Assertions.assertTrue(supervisor.stage().pendingFiles().isEmpty());
            Assertions.assertEquals(1L, supervisor.stats().resubmitted());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void secondNonProxyFailureIsAbandoned() throws Exception {
        Path root = Files.createTempDirectory("crawlrelay-supervisor-exhausted-");
        try {
            RecordingBus bus = new RecordingBus();
            RecordingSink sink = new RecordingSink();
            WorkerSupervisor supervisor = new WorkerSupervisor(config(root, "retry-topic", 3), bus, sink, noSleep(), LOG);
            RecordingBus.TestDelivery delivery = delivery("m2", Map.of(JobAttributes.RETRY_COUNT, "1"), "exit 42");

            supervisor.onMessage(delivery);

            Assertions.assertEquals(1, delivery.acks());
            Assertions.assertEquals(List.of(ErrorGenre.CHROME_VERSION), sink.genres);
            Assertions.assertTrue(bus.published().isEmpty());
            Assertions.assertTrue(supervisor.stage().pendingFiles().isEmpty());
            Assertions.assertEquals(1L, supervisor.stats().abandoned());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unclassifiedFailureRetriesWithoutErrorEvent() throws Exception {
        Path root = Files.createTempDirectory("crawlrelay-supervisor-unclassified-");
        try {
            RecordingBus bus = new RecordingBus();
            RecordingSink sink = new RecordingSink();
            WorkerSupervisor supervisor = new WorkerSupervisor(config(root, "retry-topic", 3), bus, sink, noSleep(), LOG);

            supervisor.onMessage(delivery("m3", Map.of(), "exit 1"));

            Assertions.assertTrue(sink.genres.isEmpty());
            Assertions.assertEquals(1, bus.published().size());
            Assertions.assertEquals("1", bus.published().get(0).attributes().get(JobAttributes.RETRY_COUNT));
            Assertions.assertFalse(bus.published().get(0).attributes().containsKey(JobAttributes.ERROR_GENRE));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unclassifiedFailureGetsExactlyOneImmediateRetry() throws Exception {
        Path root = Files.createTempDirectory("crawlrelay-supervisor-single-retry-");
        try {
            RecordingBus bus = new RecordingBus();
            List<Duration> sleeps = new ArrayList<>();
            WorkerSupervisor supervisor = new WorkerSupervisor(config(root, "retry-topic", 5), bus, ErrorSink.disabled(), sleeps::add, LOG);

            supervisor.onMessage(delivery("m1", Map.of(), "exit 1"));
            Assertions.assertEquals(1, bus.published().size());
            RecordingBus.Published retry = bus.published().get(0);
            Assertions.assertEquals("1", retry.attributes().get(JobAttributes.RETRY_COUNT));

            supervisor.onMessage(new RecordingBus.TestDelivery("pub-redelivered", retry.attributes(), retry.data()));

            Assertions.assertEquals(1, bus.published().size());
            Assertions.assertTrue(sleeps.isEmpty());
            Assertions.assertTrue(supervisor.stage().pendingFiles().isEmpty());
            Assertions.assertEquals(1L, supervisor.stats().resubmitted());
            Assertions.assertEquals(1L, supervisor.stats().abandoned());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unreadableDeliveryIsNackedWithoutStaging() throws Exception {
        Path root = Files.createTempDirectory("crawlrelay-supervisor-unreadable-");
        try {
            RecordingBus bus = new RecordingBus();
            WorkerSupervisor supervisor = new WorkerSupervisor(config(root, "retry-topic", 3), bus, ErrorSink.disabled(), noSleep(), LOG);
            RecordingBus.TestDelivery delivery = new RecordingBus.TestDelivery("bad", Map.of(), new byte[0]) {
                @Override
                public byte[] data() {
                    throw new IllegalArgumentException("Illegal base64 character 2a");
                }
            };

            supervisor.onMessage(delivery);

            Assertions.assertEquals(0, delivery.acks());
            Assertions.assertEquals(1, delivery.nacks());
            Assertions.assertTrue(supervisor.stage().pendingFiles().isEmpty());
            Assertions.assertEquals(1L, supervisor.stats().nacked());
            Assertions.assertEquals(WorkerState.LISTENING, supervisor.state());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void corruptBusMessageDoesNotBlockLaterJobs() throws Exception {
        Path root = Files.createTempDirectory("crawlrelay-supervisor-corrupt-");
        try {
            FileBus bus = new FileBus(root.resolve("bus"), 20L);
            Path inbox = root.resolve("bus/subscriptions/sub-a/inbox");
            Files.createDirectories(inbox);
            Files.writeString(inbox.resolve("000000000000001_bad.msg.json"), """
                    {"msgId":"bad","channel":"sub-a","publishedAtMs":1,"attributes":{},"dataB64":"***"}
                    """, StandardCharsets.UTF_8);
            bus.publish("sub-a", body("touch good.txt"), Map.of());

            WorkerSupervisor supervisor = new WorkerSupervisor(config(root, null, 0), bus, ErrorSink.disabled(), noSleep(), LOG);
            Thread worker = new Thread(supervisor::run, "supervisor-corrupt-test");
            worker.start();
            try {
                Assertions.assertTrue(waitFor(() -> supervisor.stats().completed() == 1L, Duration.ofSeconds(20)));
                Assertions.assertTrue(Files.exists(root.resolve("good.txt")));
                Assertions.assertTrue(Files.exists(root.resolve("bus/subscriptions/sub-a/dead/000000000000001_bad.msg.json")));
            } finally {
                supervisor.stop();
                worker.join(10_000L);
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void stagingFailureNacksWithoutRunning() throws Exception {
        Path root = Files.createTempDirectory("crawlrelay-supervisor-nack-");
        try {
            Path blocked = root.resolve("queue");
            Files.writeString(blocked, "not a directory", StandardCharsets.UTF_8);
            WorkerConfig config = new WorkerConfig("sub-a", root, "/bin/sh", List.of("-c"), List.of(), blocked, null,
                    "retry-topic", 3, 0L);
            RecordingBus bus = new RecordingBus();
            WorkerSupervisor supervisor = new WorkerSupervisor(config, bus, ErrorSink.disabled(), noSleep(), LOG);
            RecordingBus.TestDelivery delivery = delivery("m1", Map.of(), "touch ran.txt");

            supervisor.onMessage(delivery);

            Assertions.assertEquals(0, delivery.acks());
            Assertions.assertEquals(1, delivery.nacks());
            Assertions.assertFalse(Files.exists(root.resolve("ran.txt")));
            Assertions.assertTrue(bus.published().isEmpty());
            Assertions.assertEquals(1L, supervisor.stats().nacked());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void throwingErrorSinkDoesNotStopRetry() throws Exception {
        Path root = Files.createTempDirectory("crawlrelay-supervisor-sink-");
        try {
            RecordingBus bus = new RecordingBus();
            ErrorSink failing = (subscription, genre, at) -> {
                throw new IllegalStateException("store down");
            };
            WorkerSupervisor supervisor = new WorkerSupervisor(config(root, "retry-topic", 3), bus, failing, noSleep(), LOG);

            supervisor.onMessage(delivery("m1", Map.of(), "exit 43"));

            Assertions.assertEquals(1, bus.published().size());
            Assertions.assertEquals("other_process_exist",
                    bus.published().get(0).attributes().get(JobAttributes.ERROR_GENRE));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failedPublishKeepsStagedFile() throws Exception {
        Path root = Files.createTempDirectory("crawlrelay-supervisor-kept-");
        try {
            RecordingBus bus = new RecordingBus();
            bus.failPublish(true);
            WorkerSupervisor supervisor = new WorkerSupervisor(config(root, "retry-topic", 3), bus, ErrorSink.disabled(), noSleep(), LOG);

            supervisor.onMessage(delivery("m1", Map.of(), "exit 1"));

            List<Path> left = supervisor.stage().pendingFiles();
            Assertions.assertEquals(1, left.size());
            Assertions.assertEquals("subprocess_failed:1", supervisor.stage().load(left.get(0)).job().job().lastError());
            Assertions.assertEquals(1L, supervisor.stats().kept());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void backlogIsDrainedBeforeListening() throws Exception {
        Path root = Files.createTempDirectory("crawlrelay-supervisor-backlog-");
        try {
            WorkerConfig config = config(root, "retry-topic", 3);
            DurableStage previous = new DurableStage(config.stagingDir(), LOG);
            previous.stage("old-1", body("echo one >> order.txt"), Map.of());
            previous.stage("old-2", body("echo two >> order.txt; exit 1"), Map.of());

            RecordingBus bus = new RecordingBus();
            WorkerSupervisor supervisor = new WorkerSupervisor(config, bus, ErrorSink.disabled(), noSleep(), LOG);
            supervisor.drainBacklog();

            Assertions.assertEquals(List.of("one", "two"), Files.readAllLines(root.resolve("order.txt")));
            Assertions.assertTrue(supervisor.stage().pendingFiles().isEmpty());
            Assertions.assertEquals(1, bus.published().size());
            Assertions.assertEquals("old-2", bus.published().get(0).attributes().get(JobAttributes.ORIGIN_MESSAGE_ID));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void runSubscribesWithSingleInFlightAndStops() throws Exception {
        Path root = Files.createTempDirectory("crawlrelay-supervisor-run-");
        try {
            RecordingBus bus = new RecordingBus();
            WorkerSupervisor supervisor = new WorkerSupervisor(config(root, null, 0), bus, ErrorSink.disabled(), noSleep(), LOG);
            Thread worker = new Thread(supervisor::run, "supervisor-test");
            worker.start();

            Assertions.assertTrue(waitFor(() -> bus.subscribedTo() != null, Duration.ofSeconds(10)));
            Assertions.assertEquals("sub-a", bus.subscribedTo());
            Assertions.assertEquals(1, bus.flowControl().maxInFlight());

            supervisor.stop();
            worker.join(10_000L);
            Assertions.assertFalse(worker.isAlive());
            Assertions.assertEquals(WorkerState.STOPPED, supervisor.state());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void stopBeforeRunSkipsSubscribe() throws Exception {
        Path root = Files.createTempDirectory("crawlrelay-supervisor-early-stop-");
        try {
            RecordingBus bus = new RecordingBus();
            WorkerSupervisor supervisor = new WorkerSupervisor(config(root, null, 0), bus, ErrorSink.disabled(), noSleep(), LOG);
            supervisor.stop();
            supervisor.run();

            Assertions.assertNull(bus.subscribedTo());
            Assertions.assertEquals(WorkerState.STOPPED, supervisor.state());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fileBusDeliveryRunsEndToEnd() throws Exception {
        Path root = Files.createTempDirectory("crawlrelay-supervisor-filebus-");
        try {
            FileBus bus = new FileBus(root.resolve("bus"), 20L);
            WorkerSupervisor supervisor = new WorkerSupervisor(config(root, "retry-topic", 3), bus, ErrorSink.disabled(), noSleep(), LOG);
            Thread worker = new Thread(supervisor::run, "supervisor-filebus-test");
            worker.start();
            try {
                bus.publish("sub-a", body("touch delivered.txt"), Map.of());

                Assertions.assertTrue(waitFor(() -> supervisor.stats().completed() == 1L, Duration.ofSeconds(20)));
                Assertions.assertTrue(Files.exists(root.resolve("delivered.txt")));
                Assertions.assertEquals(0, bus.pendingCount("sub-a"));
                Assertions.assertTrue(supervisor.stage().pendingFiles().isEmpty());
            } finally {
                supervisor.stop();
                worker.join(10_000L);
            }
            Assertions.assertFalse(worker.isAlive());
        } finally {
            deleteRecursively(root);
        }
    }

    private static WorkerConfig config(Path root, String retryChannel, int maxRetries) {
        return new WorkerConfig("sub-a", root, "/bin/sh", List.of("-c"), List.of(), root.resolve("queue").resolve("sub-a"),
                null, retryChannel, maxRetries, 0L);
    }

    private static RecordingBus.TestDelivery delivery(String messageId, Map<String, String> attributes, String script) {
        return new RecordingBus.TestDelivery(messageId, attributes, body(script));
    }

    private static byte[] body(String script) {
        return Jsons.toJsonBytes(Map.of("args", List.of(script)));
    }

    private static Sleeper noSleep() {
        return duration -> { };
    }

    private static boolean waitFor(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20L);
        }
        return condition.getAsBoolean();
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    private static final class RecordingSink implements ErrorSink {
        private final List<ErrorGenre> genres = Collections.synchronizedList(new ArrayList<>());

        @Override
        public boolean record(String subscription, ErrorGenre genre, Instant at) {
            genres.add(genre);
            return true;
        }
    }
}
