package io.crawlrelay;

import io.crawlrelay.cli.CrawlRelayCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new CrawlRelayCommand()).execute(args);
        System.exit(code);
    }
}
