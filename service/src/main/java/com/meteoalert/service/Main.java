package com.meteoalert.service;

import com.meteoalert.engine.api.PolygonRegistry;
import com.meteoalert.engine.config.AlertThresholds;
import com.meteoalert.engine.scan.AlertScanEngine;
import com.meteoalert.service.config.ConfigLoader;
import com.meteoalert.service.config.GatewaySettings;
import com.meteoalert.service.gateway.HttpDeliveryGateway;
import com.meteoalert.service.http.HttpClientFactory;
import com.meteoalert.service.meteogram.JsonMeteogramSource;
import com.meteoalert.service.runtime.AlertRun;
import com.meteoalert.service.runtime.RunMarker;
import com.meteoalert.service.runtime.RunOutcome;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Map;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) {
        Map<String, String> env = System.getenv();
        Path configDir = Path.of(env.getOrDefault("CONFIG_DIR", "config"));
        Path meteogramDir = Path.of(env.getOrDefault("METEOGRAM_DIR", "tmp_files"));
        Clock clock = Clock.system(ZoneId.of(env.getOrDefault("CLOCK_ZONE", "America/Sao_Paulo")));

        Path meteogram = args.length > 0
                ? Path.of(args[0])
                : JsonMeteogramSource.pathFor(meteogramDir, LocalDate.now(clock));

        PolygonRegistry registry = ConfigLoader.loadPolygons(configDir);
        AlertThresholds thresholds = ConfigLoader.loadAlertSettings(configDir).toThresholds();
        GatewaySettings gatewaySettings = GatewaySettings.fromEnvironment(env);
        HttpClient httpClient = HttpClientFactory.create(Duration.ofSeconds(10), gatewaySettings.truststore());

        AlertRun run = new AlertRun(
                AlertScanEngine.withThresholds(thresholds),
                registry,
                new JsonMeteogramSource(meteogram),
                new HttpDeliveryGateway(httpClient, gatewaySettings),
                clock
        );
        LOGGER.info("Starting alert run: meteogram=" + meteogram + " polygons=" + registry.polygonIds().size()
                + " thresholds=" + thresholds);
        RunOutcome outcome = run.execute(new RunMarker(meteogram, clock));
        LOGGER.info("Alert run finished: " + outcome.status() + " - " + outcome.message());
        if (outcome.isFailure()) {
            System.exit(1);
        }
    }
}
