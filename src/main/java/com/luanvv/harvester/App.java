package com.luanvv.harvester;

import com.luanvv.harvester.core.Config;
import com.luanvv.harvester.core.HarvestSummary;
import com.luanvv.harvester.core.Harvester;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class App {
    static final int EXIT_OK = 0;
    static final int EXIT_CRAWL_FAILED = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        Config config;
        try {
            CliOptions options = CliOptions.parse(args);
            if (options.isHelp()) {
                System.out.println(CliOptions.USAGE);
                return EXIT_OK;
            }
            config = options.loadConfig();
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println(CliOptions.USAGE);
            return EXIT_USAGE;
        }

        try {
            HarvestSummary summary = new Harvester(config).run();
            if (!summary.allSucceeded()) {
                summary.outcomes().stream()
                        .filter(o -> !o.success())
                        .forEach(o -> System.err.println("Crawler " + o.dataset() + " failed: " + o.error()));
                return EXIT_CRAWL_FAILED;
            }
            return EXIT_OK;
        } catch (Exception e) {
            log.error("Harvest failed", e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_CRAWL_FAILED;
        }
    }
}
