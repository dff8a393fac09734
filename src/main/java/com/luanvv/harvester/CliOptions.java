package com.luanvv.harvester;

import com.luanvv.harvester.core.Config;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class CliOptions {
    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: harvester [options]",
            "  --outdir <dir>                 output directory (default: data)",
            "  --sleep <seconds>              delay between requests of one crawler (default: 0)",
            "  --products-per-category        also walk every product category listing",
            "  --reviews-first <n>            GraphQL page size (default: 20)",
            "  --reviews-max-pages <n>        GraphQL page cap (default: 200)",
            "  --testimonials-max-pages <n>   fragment page cap (default: 200)",
            "  --config <file>                YAML config instead of the bundled harvester.yaml",
            "  --base-url <url>               site root",
            "  --csv                          also write <dataset>.csv",
            "  --parallelism <n>              crawlers run at once, 1 = sequential (default: 3)",
            "  --only <a,b>                   subset of products,testimonials,reviews",
            "  --help                         print this help");

    private static final Set<String> SWITCHES = Set.of("--products-per-category", "--csv", "--help");
    private static final Set<String> VALUED = Set.of("--outdir", "--sleep", "--reviews-first",
            "--reviews-max-pages", "--testimonials-max-pages", "--config", "--base-url", "--parallelism", "--only");
    private static final List<String> DATASETS = List.of("products", "testimonials", "reviews");

    private final Map<String, String> args;

    private CliOptions(Map<String, String> args) {
        this.args = args;
    }

    public static CliOptions parse(String[] argv) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i < argv.length; i++) {
            String a = argv[i];
            String value = null;
            int eq = a.indexOf('=');
            if (a.startsWith("--") && eq > 0) {
                value = a.substring(eq + 1);
                a = a.substring(0, eq);
            }
            if (SWITCHES.contains(a)) {
                m.put(a, value == null ? "true" : value);
            } else if (VALUED.contains(a)) {
                if (value == null) {
                    if (i + 1 >= argv.length) throw new IllegalArgumentException("Missing value for " + a);
                    value = argv[++i];
                }
                m.put(a, value);
            } else {
                throw new IllegalArgumentException("Unknown argument: " + a);
            }
        }
        return new CliOptions(m);
    }

    public boolean isHelp() {
        return args.containsKey("--help");
    }

    public Config loadConfig() throws IOException {
        Config config = args.containsKey("--config")
                ? Config.load(Path.of(args.get("--config")))
                : Config.loadDefault();
        applyTo(config);
        return config;
    }

    void applyTo(Config config) {
        if (args.containsKey("--outdir")) config.getOutput().setDir(args.get("--outdir"));
        if (args.containsKey("--sleep")) config.getRateLimit().setDelaySeconds(nonNegativeDouble("--sleep"));
        if (flag("--products-per-category")) config.getProducts().setPerCategory(true);
        if (args.containsKey("--reviews-first")) config.getReviews().setPageSize(positiveInt("--reviews-first"));
        if (args.containsKey("--reviews-max-pages")) config.getReviews().setMaxPages(positiveInt("--reviews-max-pages"));
        if (args.containsKey("--testimonials-max-pages")) {
            config.getTestimonials().setMaxPages(positiveInt("--testimonials-max-pages"));
        }
        if (args.containsKey("--base-url")) config.setBaseUrl(args.get("--base-url"));
        if (flag("--csv")) config.getOutput().setCsv(true);
        if (args.containsKey("--parallelism")) config.setParallelism(positiveInt("--parallelism"));
        if (args.containsKey("--only")) {
            List<String> only = Arrays.stream(args.get("--only").split(","))
                    .map(String::trim).filter(s -> !s.isBlank()).toList();
            for (String name : only) {
                if (!DATASETS.contains(name)) throw new IllegalArgumentException("Unknown dataset in --only: " + name);
            }
            config.getProducts().setEnabled(only.contains("products"));
            config.getTestimonials().setEnabled(only.contains("testimonials"));
            config.getReviews().setEnabled(only.contains("reviews"));
        }
    }

    private boolean flag(String name) {
        return Boolean.parseBoolean(args.getOrDefault(name, "false"));
    }

    private int positiveInt(String name) {
        try {
            int v = Integer.parseInt(args.get(name).trim());
            if (v < 1) throw new IllegalArgumentException(name + " must be at least 1");
            return v;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " expects an integer, got '" + args.get(name) + "'");
        }
    }

    private double nonNegativeDouble(String name) {
        try {
            double v = Double.parseDouble(args.get(name).trim());
            if (v < 0) throw new IllegalArgumentException(name + " must not be negative");
            return v;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " expects a number, got '" + args.get(name) + "'");
        }
    }
}
