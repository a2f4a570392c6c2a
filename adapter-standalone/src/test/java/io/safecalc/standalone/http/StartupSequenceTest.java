package io.safecalc.standalone.http;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.safecalc.standalone.config.ConfigLoadException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Full startup through {@link CalculatorApp#start(String[], Function)}: config
 * file, environment overlay, logging setup, engine limits, routes.
 */
class StartupSequenceTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient client =
            HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();

    private CalculatorApp app;

    @TempDir
    Path tempDir;

    @AfterEach
    void cleanup() {
        if (app != null) {
            app.stop();
        }
    }

    private Path writeConfig(String yaml) throws Exception {
        return Files.writeString(tempDir.resolve("safecalc.yaml"), yaml);
    }

    private HttpResponse<String> get(String path) throws Exception {
        return client.send(
                HttpRequest.newBuilder()
                        .uri(URI.create("http://127.0.0.1:" + app.port() + path))
                        .GET()
                        .build(),
                HttpResponse.BodyHandlers.ofString());
    }

    @Test
    @DisplayName("Valid config → server starts and evaluates")
    void validStartup_serverStartsAndAcceptsRequests() throws Exception {
        Path configFile = writeConfig("""
            server:
              host: "127.0.0.1"
              port: 0
            logging:
              format: text
              level: INFO
            """);

        app = CalculatorApp.start(new String[] {"--config", configFile.toString()}, name -> null);

        assertThat(app.port()).isPositive();
        HttpResponse<String> response = get("/evaluate?expression=2%2B2");
        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode body = MAPPER.readTree(response.body());
        assertThat(body.get("result").asDouble()).isEqualTo(4.0);

        assertThat(get("/health").statusCode()).isEqualTo(200);
    }

    @Test
    @DisplayName("Configured limits reach the engine")
    void limitsApplied() throws Exception {
        Path configFile = writeConfig("""
            server:
              host: "127.0.0.1"
              port: 0
            logging:
              format: text
            limits:
              max-pow-exponent: 20
            """);

        app = CalculatorApp.start(new String[] {"--config", configFile.toString()}, name -> null);

        assertThat(app.engine().policy().maxPowExponent()).isEqualTo(20.0);
        assertThat(MAPPER.readTree(get("/evaluate?expression=2**20").body())
                        .get("result")
                        .asDouble())
                .isEqualTo(1048576.0);
    }

    @Test
    @DisplayName("Environment overrides win over the file")
    void envOverrides() throws Exception {
        Path configFile = writeConfig("""
            server:
              host: "127.0.0.1"
              port: 0
            logging:
              format: text
            """);
        Map<String, String> env = Map.of("EVALUATE_PATH", "/calc", "INPUT_CARET_AS_POWER", "true");

        app = CalculatorApp.start(new String[] {"--config", configFile.toString()}, env::get);

        assertThat(app.config().evaluatePath()).isEqualTo("/calc");
        HttpResponse<String> response = get("/calc?expression=3%5E2");
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(MAPPER.readTree(response.body()).get("display").asText()).isEqualTo("9");
    }

    @Test
    @DisplayName("Missing config file → ConfigLoadException, nothing started")
    void missingConfig() {
        String missing = tempDir.resolve("absent.yaml").toString();

        assertThatThrownBy(() -> CalculatorApp.start(new String[] {"--config", missing}, name -> null))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("absent.yaml");
    }

    @Test
    @DisplayName("Invalid limits → ConfigLoadException")
    void invalidLimits() throws Exception {
        Path configFile = writeConfig("""
            limits:
              max-input-length: -5
            """);

        assertThatThrownBy(() -> CalculatorApp.start(new String[] {"--config", configFile.toString()}, name -> null))
                .isInstanceOf(ConfigLoadException.class);
    }
}
