package io.crawlrelay.cli;

import io.crawlrelay.bus.FileBus;
import io.crawlrelay.config.AgentConfig;
import io.crawlrelay.runtime.CrawlRelayRuntime;
import io.crawlrelay.runtime.WorkerSupervisor;
import io.crawlrelay.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "crawlrelay",
        mixinStandardHelpOptions = true,
        description = "Durable crawler job worker for message bus subscriptions",
        subcommands = {
                CrawlRelayCommand.RunCommand.class,
                CrawlRelayCommand.PublishCommand.class,
                CrawlRelayCommand.PendingCommand.class,
                CrawlRelayCommand.ReleaseCommand.class
        }
)
public final class CrawlRelayCommand implements Runnable {

    @Option(names = {"--config"}, description = "Agent config JSON file", defaultValue = "agent_config.json")
    String config;

    @Override
    public void run() {
        System.out.println("Use subcommands: run | publish | pending | release");
    }

    AgentConfig agentConfig() {
        return AgentConfig.load(Path.of(config));
    }

    @Command(name = "run", description = "Start one worker per configured subscription and block until stopped")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        CrawlRelayCommand parent;

        @Option(names = {"--graceful-timeout-ms"}, defaultValue = "0",
                description = "Upper bound on waiting for in-flight jobs at shutdown; 0 waits for them to finish")
        long gracefulTimeoutMs;

        @Override
        public Integer call() throws Exception {
            CrawlRelayRuntime runtime = new CrawlRelayRuntime(parent.agentConfig());
            CountDownLatch exited = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                System.out.println("[MAIN] Shutting down...");
                runtime.stop();
                try {
                    if (gracefulTimeoutMs > 0L) {
                        runtime.awaitTermination(Duration.ofMillis(gracefulTimeoutMs));
                    } else {
                        exited.await();
                    }
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
            }, "crawlrelay-shutdown-hook"));

            runtime.start();
            System.out.println("[MAIN] Started " + runtime.supervisors().size() + " worker(s). Ctrl+C to exit.");
            try {
                boolean terminated = false;
                while (!terminated) {
                    terminated = runtime.awaitTermination(Duration.ofMinutes(1));
                }
            } finally {
                exited.countDown();
            }
            for (WorkerSupervisor supervisor : runtime.supervisors()) {
                System.out.println(Jsons.toJson(supervisor.stats()));
            }
            return 0;
        }
    }

    @Command(name = "publish", description = "Publish a message to a channel on the local file bus")
    static final class PublishCommand implements Callable<Integer> {
        @ParentCommand
        CrawlRelayCommand parent;

        @Option(names = {"--channel"}, required = true, description = "Topic or subscription name")
        String channel;

        @Option(names = {"--data"}, defaultValue = "", description = "Message body, e.g. {\"args\":[\"--user\",\"alice\"]}")
        String data;

        @Option(names = {"--attr"}, description = "Message attribute key=value (repeatable)")
        Map<String, String> attributes;

        @Option(names = {"--bind"}, split = ",", description = "Bind these subscriptions to the channel before publishing")
        List<String> bind;

        @Override
        public Integer call() {
            AgentConfig config = parent.agentConfig();
            FileBus bus = new FileBus(config.busRoot(), config.busPollIntervalMs());
            if (bind != null) {
                for (String subscription : bind) {
                    bus.bind(channel, subscription.trim());
                }
            }
            String publishId = bus.publish(
                    channel,
                    data.getBytes(StandardCharsets.UTF_8),
                    attributes == null ? Map.of() : attributes
            );
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("channel", channel);
            out.put("publishId", publishId);
            List<String> bound = bus.subscribersOf(channel);
            out.put("subscriptions", bound.isEmpty() ? List.of(channel) : bound);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "pending", description = "List staged and quarantined jobs per subscription")
    static final class PendingCommand implements Callable<Integer> {
        @ParentCommand
        CrawlRelayCommand parent;

        @Override
        public Integer call() {
            CrawlRelayRuntime runtime = CrawlRelayRuntime.forInspection(parent.agentConfig());
            System.out.println(Jsons.toJson(runtime.stagingReport()));
            return 0;
        }
    }

    @Command(name = "release", description = "Return a quarantined (.bad) staged file to the queue")
    static final class ReleaseCommand implements Callable<Integer> {
        @ParentCommand
        CrawlRelayCommand parent;

        @Option(names = {"--subscription"}, required = true, description = "Subscription that owns the file")
        String subscription;

        @Option(names = {"--file"}, required = true, description = "Quarantined file name, e.g. 000..._id_ab12cd34.json.bad")
        String file;

        @Override
        public Integer call() {
            CrawlRelayRuntime runtime = CrawlRelayRuntime.forInspection(parent.agentConfig());
            Path restored = runtime.release(subscription, file);
            System.out.println("Released: " + restored);
            return 0;
        }
    }
}
