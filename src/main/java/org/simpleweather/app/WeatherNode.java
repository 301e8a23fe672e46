package org.simpleweather.app;

import com.google.gson.JsonParseException;
import org.simpleweather.engine.UpdateOutcome;
import org.simpleweather.engine.WeatherEngine;
import org.simpleweather.exceptions.UnauthorizedMutationException;
import org.simpleweather.exceptions.WeatherException;
import org.simpleweather.model.Biome;
import org.simpleweather.model.TimeSnapshot;
import org.simpleweather.persistence.FileSettingsStore;
import org.simpleweather.persistence.SettingsWeatherStore;
import org.simpleweather.settings.ClimateSettings;
import org.simpleweather.util.Json;
import org.simpleweather.view.WeatherView;
import org.simpleweather.view.WeatherViewFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one weather instance against a store directory shared with other nodes.
 * <p>
 * Each stdin line is either a JSON calendar reading (the time feed, {@code null}
 * for "no reading this tick") or a command:
 * <ul>
 *   <li>{@code regenerate}: regenerate from the saved climate selections</li>
 *   <li>{@code reload}: re-read the shared record</li>
 *   <li>{@code biome <name>}: select a biome (gm only)</li>
 *   <li>{@code role gm|observer}: change this node's role</li>
 *   <li>{@code show}: print the current view</li>
 * </ul>
 * <pre>
 * java -cp target/classes org.simpleweather.app.WeatherNode ./weather-store gm
 * </pre>
 */
public final class WeatherNode {

    private static final Logger log = LoggerFactory.getLogger(WeatherNode.class);

    static final String DEFAULT_STORE_DIR = "weather-store";

    private final AtomicBoolean gm;
    private final FileSettingsStore settings;
    private final ClimateSettings climate;
    private final WeatherEngine engine;
    private final WeatherViewFactory views;
    private final PrintStream out;

    WeatherNode(Path storeDir, boolean gm, Random random, PrintStream out) {
        this.gm = new AtomicBoolean(gm);
        this.settings = new FileSettingsStore(storeDir);
        this.climate = new ClimateSettings(settings);
        this.engine = new WeatherEngine(
                new SettingsWeatherStore(settings),
                new ClimateTableGenerator(random),
                climate,
                this.gm::get);
        this.views = new WeatherViewFactory(settings);
        this.out = out;
    }

    /**
     * Starts a node: {@code WeatherNode [storeDir] [gm|observer]}, defaulting to
     * {@value #DEFAULT_STORE_DIR} and observer.
     */
    public static void main(String[] args) throws IOException {
        Path dir = Paths.get(args.length > 0 ? args[0] : DEFAULT_STORE_DIR);
        boolean gm = args.length > 1 && isGmRole(args[1]);

        WeatherNode node = new WeatherNode(dir, gm, new Random(), System.out);
        node.run(System.in);
    }

    /** Bootstraps, then processes stdin lines until end of input. */
    void run(InputStream in) throws IOException {
        log.info("Weather node on {} as {}", settings.documentPath(), gm.get() ? "gm" : "observer");
        engine.subscribe(this::printView);
        try {
            engine.start();
        } catch (WeatherException e) {
            out.println("Startup failed: " + e.getMessage());
        }

        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String line;
        while ((line = reader.readLine()) != null) {
            handleLine(line.trim());
        }
    }

    void handleLine(String line) {
        if (line.isEmpty()) {
            return;
        }
        try {
            if (line.startsWith("{") || "null".equals(line)) {
                TimeSnapshot snapshot = Json.gson().fromJson(line, TimeSnapshot.class);
                UpdateOutcome outcome = engine.onTimeUpdate(snapshot);
                log.debug("Time update -> {}", outcome);
                return;
            }
            String[] parts = line.split("\\s+", 2);
            String command = parts[0].toLowerCase(Locale.ROOT);
            String argument = parts.length > 1 ? parts[1] : "";
            switch (command) {
                case "regenerate":
                    engine.manualRegenerate(climate.current());
                    break;
                case "reload":
                    engine.onStoreUpdated();
                    break;
                case "biome":
                    selectBiome(argument);
                    break;
                case "role":
                    gm.set(isGmRole(argument));
                    out.println("Role: " + (gm.get() ? "gm" : "observer"));
                    break;
                case "show":
                    printView();
                    break;
                default:
                    out.println("Unknown command: " + command);
            }
        } catch (JsonParseException e) {
            out.println("Invalid time reading: " + e.getMessage());
        } catch (WeatherException e) {
            out.println("Error: " + e.getMessage());
        }
    }

    private void selectBiome(String name) throws WeatherException {
        if (!gm.get()) {
            throw new UnauthorizedMutationException("biome selection");
        }
        Biome biome = Biome.fromName(name);
        if (biome == null) {
            out.println("Unknown biome: " + name);
            return;
        }
        climate.selectBiome(biome);
        out.println("Biome: " + biome.label());
    }

    private void printView() {
        try {
            WeatherView v = views.build(engine);
            if (v.hideWeather()) {
                out.println(v.formattedDate() + " " + v.formattedTime());
            } else {
                out.println(v.formattedDate() + " " + v.formattedTime() + " "
                        + v.currentTemperature() + " " + v.currentDescription());
            }
        } catch (WeatherException e) {
            out.println("Cannot read settings: " + e.getMessage());
        }
    }

    private static boolean isGmRole(String role) {
        return "gm".equalsIgnoreCase(role.trim());
    }

    WeatherEngine engine() {
        return engine;
    }
}
