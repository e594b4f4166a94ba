package io.crawlrelay.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class AgentConfigTest {

    @Test
    void rootDefaultsMergeIntoEachSubscription() throws Exception {
        Path root = Files.createTempDirectory("crawlrelay-config-merge-");
        try {
            Path file = root.resolve("agent_config.json");
            Files.writeString(file, """
                    {
                      "retryChannel": "crawl-retry",
                      "maxRetries": 3,
                      "stagingDir": "state/queue",
                      "timeoutMs": 60000,
                      "entryArgs": ["main.py"],
                      "errorLog": {},
                      "subscriptions": [
                        {
                          "subscriptionName": "shop-a",
                          "workingDir": "crawlers/a",
                          "executablePath": "python3"
                        },
                        {
                          "subscriptionName": "shop-b",
                          "workingDir": "/srv/b",
                          "executablePath": "/srv/b/run.sh",
                          "entryArgs": [],
                          "extraArgs": ["--headless"],
                          "maxRetries": 5,
                          "retryChannel": "crawl-retry-b",
                          "logDir": "/var/log/crawl"
                        }
                      ]
                    }
                    """, StandardCharsets.UTF_8);

            AgentConfig config = AgentConfig.load(file);
            Path base = file.toAbsolutePath().normalize().getParent();

            Assertions.assertEquals(2, config.workers().size());
            WorkerConfig a = config.worker("shop-a");
            Assertions.assertEquals(base.resolve("crawlers/a"), a.workingDir());
            Assertions.assertEquals(List.of("main.py"), a.entryArgs());
            Assertions.assertEquals(List.of(), a.extraArgs());
            Assertions.assertEquals("crawl-retry", a.retryChannel());
            Assertions.assertEquals(3, a.maxRetries());
            Assertions.assertEquals(60000L, a.timeoutMs());
            Assertions.assertEquals(base.resolve("state/queue/shop-a"), a.stagingDir());
            Assertions.assertEquals(base.resolve("crawlers/a/logs"), a.logDir());

            WorkerConfig b = config.worker("shop-b");
            Assertions.assertEquals(Path.of("/srv/b"), b.workingDir());
            Assertions.assertEquals(List.of(), b.entryArgs());
            Assertions.assertEquals(List.of("--headless"), b.extraArgs());
            Assertions.assertEquals("crawl-retry-b", b.retryChannel());
            Assertions.assertEquals(5, b.maxRetries());
            Assertions.assertEquals(Path.of("/var/log/crawl"), b.logDir());

            Assertions.assertEquals(base.resolve("bus"), config.busRoot());
            Assertions.assertEquals(AgentConfig.DEFAULT_BUS_POLL_INTERVAL_MS, config.busPollIntervalMs());
            Assertions.assertEquals("jdbc:sqlite:" + base.resolve("error-log.db"), config.errorLogJdbcUrl());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void singleSubscriptionFallbackUsesRootKeys() throws Exception {
        Path root = Files.createTempDirectory("crawlrelay-config-single-");
        try {
            Path file = root.resolve("agent_config.json");
            Files.writeString(file, """
                    {
                      "subscriptionName": "legacy",
                      "workingDir": ".",
                      "executablePath": "/usr/bin/python3",
                      "entryArgs": ["crawl.py"]
                    }
                    """, StandardCharsets.UTF_8);

            AgentConfig config = AgentConfig.load(file);

            WorkerConfig worker = config.worker("legacy");
            Path base = file.toAbsolutePath().normalize().getParent();
            Assertions.assertEquals(base, worker.workingDir());
            Assertions.assertEquals(base.resolve("queue/legacy"), worker.stagingDir());
            Assertions.assertFalse(worker.retryEnabled());
            Assertions.assertEquals(0L, worker.timeoutMs());
            Assertions.assertNull(config.errorLogJdbcUrl());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidConfigsAreRejected() throws Exception {
        Path root = Files.createTempDirectory("crawlrelay-config-invalid-");
        try {
            Assertions.assertThrows(IllegalArgumentException.class, () -> AgentConfig.load(root.resolve("missing.json")));

            Path duplicate = root.resolve("duplicate.json");
            Files.writeString(duplicate, """
                    {"subscriptions": [
                      {"subscriptionName": "s", "workingDir": ".", "executablePath": "sh"},
                      {"subscriptionName": "s", "workingDir": ".", "executablePath": "sh"}
                    ]}
                    """, StandardCharsets.UTF_8);
            IllegalArgumentException dup = Assertions.assertThrows(IllegalArgumentException.class, () -> AgentConfig.load(duplicate));
            Assertions.assertTrue(dup.getMessage().contains("Duplicate subscription"));

            Path collision = root.resolve("collision.json");
            Files.writeString(collision, """
                    {"stagingDir": "q", "subscriptions": [
                      {"subscriptionName": "crawl.tiktok", "workingDir": ".", "executablePath": "sh"},
                      {"subscriptionName": "crawltiktok", "workingDir": ".", "executablePath": "sh"}
                    ]}
                    """, StandardCharsets.UTF_8);
            IllegalArgumentException collides = Assertions.assertThrows(IllegalArgumentException.class, () -> AgentConfig.load(collision));
            Assertions.assertTrue(collides.getMessage().contains("crawltiktok"), collides.getMessage());

            Path noExecutable = root.resolve("no-executable.json");
            Files.writeString(noExecutable, """
                    {"subscriptions": [{"subscriptionName": "s", "workingDir": "."}]}
                    """, StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> AgentConfig.load(noExecutable));

            Path empty = root.resolve("empty.json");
            Files.writeString(empty, "{}", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> AgentConfig.load(empty));

            Path broken = root.resolve("broken.json");
            Files.writeString(broken, "{\"subscriptions\": [", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> AgentConfig.load(broken));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void relativeSqliteUrlResolvesAgainstConfigDir() throws Exception {
        Path root = Files.createTempDirectory("crawlrelay-config-jdbc-");
        try {
            Path file = root.resolve("agent_config.json");
            Files.writeString(file, """
                    {
                      "errorLog": {"jdbcUrl": "jdbc:sqlite:data/error-log.db"},
                      "subscriptions": [{"subscriptionName": "s", "workingDir": ".", "executablePath": "sh"}]
                    }
                    """, StandardCharsets.UTF_8);

            AgentConfig config = AgentConfig.load(file);

            Path base = file.toAbsolutePath().normalize().getParent();
            Assertions.assertEquals("jdbc:sqlite:" + base.resolve("data/error-log.db"), config.errorLogJdbcUrl());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void nonFileJdbcUrlsAreKeptAsIs() {
        Path base = Path.of("/etc/crawlrelay");
        Assertions.assertEquals("jdbc:sqlite::memory:", AgentConfig.resolveSqliteUrl(base, "jdbc:sqlite::memory:"));
        Assertions.assertEquals("jdbc:sqlite:/var/db/e.db", AgentConfig.resolveSqliteUrl(base, "jdbc:sqlite:/var/db/e.db"));
        Assertions.assertEquals("jdbc:sqlite:/etc/crawlrelay/e.db?journal_mode=WAL",
                AgentConfig.resolveSqliteUrl(base, "jdbc:sqlite:e.db?journal_mode=WAL"));
        Assertions.assertEquals("jdbc:postgresql://db/crawl", AgentConfig.resolveSqliteUrl(base, "jdbc:postgresql://db/crawl"));
    }

    @Test
    void unknownSubscriptionLookupFails() {
        Path base = Path.of("/srv");
        WorkerConfig worker = new WorkerConfig("s", base, "sh", List.of(), List.of(), base.resolve("q"), null, null, 0, 0L);
        AgentConfig config = new AgentConfig(base, base.resolve("bus"), 0L, null, List.of(worker));

        Assertions.assertSame(worker, config.worker("s"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> config.worker("other"));
        Assertions.assertEquals(AgentConfig.DEFAULT_BUS_POLL_INTERVAL_MS, config.busPollIntervalMs());
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
}
