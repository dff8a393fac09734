package com.luanvv.harvester.core;

import java.nio.file.Path;
import java.util.List;

public record HarvestSummary(List<Outcome> outcomes) {

    public record Outcome(String dataset, boolean success, int count, Path file, String error) {

        static Outcome ok(String dataset, int count, Path file) {
            return new Outcome(dataset, true, count, file, null);
        }

        static Outcome failed(String dataset, String error) {
            return new Outcome(dataset, false, 0, null, error);
        }

        @Override
        public String toString() {
            return success
                    ? String.format("%-13s OK      %5d records -> %s", dataset, count, file)
                    : String.format("%-13s FAILED  %s", dataset, error);
        }
    }

    public boolean allSucceeded() {
        return outcomes.stream().allMatch(Outcome::success);
    }

    public Outcome outcome(String dataset) {
        return outcomes.stream()
                .filter(o -> o.dataset().equals(dataset))
                .findFirst()
                .orElse(null);
    }
}
