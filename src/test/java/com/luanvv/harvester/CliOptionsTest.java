package com.luanvv.harvester;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.luanvv.harvester.core.Config;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliOptionsTest {

    @Test
    void defaultsComeFromTheBundledConfig() throws Exception {
        Config config = CliOptions.parse(new String[0]).loadConfig();

        assertThat(config.getOutput().getDir()).isEqualTo("data");
        assertThat(config.getRateLimit().getDelaySeconds()).isZero();
        assertThat(config.getProducts().isPerCategory()).isFalse();
        assertThat(config.getReviews().getPageSize()).isEqualTo(20);
        assertThat(config.getReviews().getMaxPages()).isEqualTo(200);
        assertThat(config.getTestimonials().getMaxPages()).isEqualTo(200);
        assertThat(config.getHttp().getTimeoutSeconds()).isEqualTo(30);
        assertThat(config.getTestimonials().getSecretToken()).isEqualTo("secret123");
    }

    @Test
    void flagsOverrideTheConfig() throws Exception {
        Config config = CliOptions.parse(new String[] {
                "--outdir", "out", "--sleep", "0.5", "--products-per-category",
                "--reviews-first=50", "--reviews-max-pages", "3", "--testimonials-max-pages", "4",
                "--csv", "--parallelism", "1", "--base-url", "http://localhost:8080"
        }).loadConfig();

        assertThat(config.getOutput().getDir()).isEqualTo("out");
        assertThat(config.getRateLimit().getDelaySeconds()).isEqualTo(0.5);
        assertThat(config.getProducts().isPerCategory()).isTrue();
        assertThat(config.getReviews().getPageSize()).isEqualTo(50);
        assertThat(config.getReviews().getMaxPages()).isEqualTo(3);
        assertThat(config.getTestimonials().getMaxPages()).isEqualTo(4);
        assertThat(config.getOutput().isCsv()).isTrue();
        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getBaseUrl()).isEqualTo("http://localhost:8080");
    }

    @Test
    void onlySelectsDatasets() throws Exception {
        Config config = CliOptions.parse(new String[] {"--only", "reviews, products"}).loadConfig();

        assertThat(config.getReviews().isEnabled()).isTrue();
        assertThat(config.getProducts().isEnabled()).isTrue();
        assertThat(config.getTestimonials().isEnabled()).isFalse();
    }

    @Test
    void readsAnExternalYamlFile(@TempDir Path dir) throws Exception {
        Path yaml = dir.resolve("custom.yaml");
        Files.writeString(yaml, String.join("\n",
                "baseUrl: http://example.test",
                "reviews:",
                "  pageSize: 5",
                "unknownKey: ignored"));

        Config config = CliOptions.parse(new String[] {"--config", yaml.toString()}).loadConfig();

        assertThat(config.getBaseUrl()).isEqualTo("http://example.test");
        assertThat(config.getReviews().getPageSize()).isEqualTo(5);
        assertThat(config.getReviews().getMaxPages()).isEqualTo(200);
    }

    @Test
    void rejectsBadArguments() {
        assertThatThrownBy(() -> CliOptions.parse(new String[] {"--bogus"}))
                .hasMessageContaining("Unknown argument");
        assertThatThrownBy(() -> CliOptions.parse(new String[] {"--outdir"}))
                .hasMessageContaining("Missing value");
        assertThatThrownBy(() -> CliOptions.parse(new String[] {"--reviews-first", "zero"}).loadConfig())
                .hasMessageContaining("expects an integer");
        assertThatThrownBy(() -> CliOptions.parse(new String[] {"--reviews-max-pages", "0"}).loadConfig())
                .hasMessageContaining("at least 1");
        assertThatThrownBy(() -> CliOptions.parse(new String[] {"--sleep", "-1"}).loadConfig())
                .hasMessageContaining("must not be negative");
        assertThatThrownBy(() -> CliOptions.parse(new String[] {"--only", "users"}).loadConfig())
                .hasMessageContaining("users");
    }

    @Test
    void usageErrorsExitWithTwo() {
        assertThat(App.run(new String[] {"--bogus"})).isEqualTo(App.EXIT_USAGE);
        assertThat(App.run(new String[] {"--help"})).isEqualTo(App.EXIT_OK);
    }
}
