package io.codeforesight.gate;

import io.codeforesight.config.ConfigException;
import io.codeforesight.model.TrajectoryPoint;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrajectoryLoaderTest {

    private final TrajectoryLoader loader = new TrajectoryLoader();

    @Test
    void load_readsArrayWithTimestamps(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("history.json");
        Files.writeString(file, """
                [
                  {"timestamp": "2024-05-01T00:00:00Z", "riskLoad": 3.5},
                  {"timestamp": "2024-05-08T00:00:00Z", "riskLoad": 4}
                ]
                """);

        List<TrajectoryPoint> points = loader.load(file);

        assertThat(points).containsExactly(
                new TrajectoryPoint(Instant.parse("2024-05-01T00:00:00Z"), 3.5),
                new TrajectoryPoint(Instant.parse("2024-05-08T00:00:00Z"), 4.0));
    }

    @Test
    void load_acceptsWrappedHistoryWithoutTimestamps() throws Exception {
        List<TrajectoryPoint> points = load("{\"history\": [{\"riskLoad\": 1}, {\"riskLoad\": 2.5}]}");

        assertThat(points).extracting(TrajectoryPoint::riskLoad).containsExactly(1.0, 2.5);
        assertThat(points).allMatch(p -> p.timestamp() == null);
    }

    @Test
    void load_emptyArrayIsEmptyHistory() throws Exception {
        assertThat(load("[]")).isEmpty();
    }

    @Test
    void load_rejectsMissingRiskLoad() {
        assertThatThrownBy(() -> load("[{\"riskLoad\": 1}, {\"timestamp\": \"2024-05-01T00:00:00Z\"}]"))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("entry 2");
    }

    @Test
    void load_rejectsNegativeLoad() {
        assertThatThrownBy(() -> load("[{\"riskLoad\": -1}]"))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("non-negative");
    }

    @Test
    void load_rejectsBadTimestamp() {
        assertThatThrownBy(() -> load("[{\"timestamp\": \"last tuesday\", \"riskLoad\": 1}]"))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("last tuesday");
    }

    @Test
    void load_rejectsNonArray() {
        assertThatThrownBy(() -> load("{\"riskLoad\": 1}"))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("must be a JSON array");
    }

    @Test
    void load_rejectsMalformedJson() {
        assertThatThrownBy(() -> load("[{"))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("not valid JSON");
    }

    private List<TrajectoryPoint> load(String json) throws Exception {
        return loader.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "test");
    }
}
