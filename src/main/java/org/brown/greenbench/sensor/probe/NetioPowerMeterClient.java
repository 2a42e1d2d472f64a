package org.brown.greenbench.sensor.probe;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.brown.greenbench.sensor.SensorProbeException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * NETIO PowerBOX JSON API 클라이언트
 *
 * GET {endpoint} → {"Outputs":[{"ID":1,"Load":123,"Energy":4567}, ...]}
 * Load 는 W, Energy 는 누적 Wh 이다.
 */
@Slf4j
public class NetioPowerMeterClient implements PowerMeterClient {

    private static final double JOULES_PER_WH = 3600.0;

    private final URI endpoint;
    private final int outputId;
    private final Duration timeout;
    private final ObjectMapper objectMapper;
    private final HttpClient http;

    public NetioPowerMeterClient(String endpoint, int outputId, Duration timeout, ObjectMapper objectMapper) {
        this.endpoint = URI.create(endpoint);
        this.outputId = outputId;
        this.timeout = timeout;
        this.objectMapper = objectMapper;
        this.http = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public String endpoint() {
        return endpoint.toString();
    }

    @Override
    public PowerMeterSnapshot poll() throws SensorProbeException {
        HttpRequest req = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .GET()
                .build();
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() != 200) {
                throw new SensorProbeException("Power meter returned HTTP " + resp.statusCode());
            }
            return parse(objectMapper, resp.body(), outputId);
        } catch (IOException e) {
            throw new SensorProbeException("Failed to contact power meter at " + endpoint, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SensorProbeException("Interrupted while polling power meter", e);
        }
    }

    static PowerMeterSnapshot parse(ObjectMapper objectMapper, String body, int outputId) throws SensorProbeException {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new SensorProbeException("Malformed power meter response", e);
        }
        JsonNode outputs = root.path("Outputs");
        for (JsonNode output : outputs) {
            if (output.path("ID").asInt(-1) == outputId) {
                JsonNode load = output.get("Load");
                if (load == null || !load.isNumber()) {
                    throw new SensorProbeException("Output " + outputId + " has no numeric Load");
                }
                JsonNode energy = output.get("Energy");
                Double joules = energy != null && energy.isNumber() ? energy.asDouble() * JOULES_PER_WH : null;
                return new PowerMeterSnapshot(load.asDouble(), joules);
            }
        }
        throw new SensorProbeException("Output " + outputId + " not found in power meter response");
    }
}
