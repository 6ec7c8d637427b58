package io.evalrelay.config;

import io.evalrelay.relay.RelayAddress;
import io.evalrelay.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

public final class EvalRelayConfig {
    public static final String ENV_ADDRESS = "EVALRELAY_ADDRESS";
    public static final String ENV_SCORED_RUN = "EVALRELAY_IS_SCORED_RUN";
    public static final String DEFAULT_ADDRESS = "127.0.0.1:50051";
    public static final String SETTINGS_FILE = "evalrelay-settings.json";

    private final Path rootDir;
    private final String address;
    private final boolean scoredRun;

    public EvalRelayConfig(Path rootDir, String address, boolean scoredRun) {
        this.rootDir = rootDir;
        this.address = address;
        this.scoredRun = scoredRun;
    }

    public static EvalRelayConfig fromRoot(String root) {
        return fromRoot(root, null, System.getenv());
    }

    public static EvalRelayConfig fromRoot(String root, String addressOverride) {
        return fromRoot(root, addressOverride, System.getenv());
    }

    static EvalRelayConfig fromRoot(String root, String addressOverride, Map<String, String> env) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        String address = addressOverride;
        if (address == null || address.isBlank()) {
            address = env.get(ENV_ADDRESS);
        }
        if (address == null || address.isBlank()) {
            address = DEFAULT_ADDRESS;
        }
        return new EvalRelayConfig(resolved.toAbsolutePath().normalize(), address.trim(), parseFlag(env.get(ENV_SCORED_RUN)));
    }

    static boolean parseFlag(String raw) {
        if (raw == null) {
            return false;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return normalized.equals("true") || normalized.equals("1") || normalized.equals("yes") || normalized.equals("on");
    }

    public Path rootDir() {
        return rootDir;
    }

    public boolean scoredRun() {
        return scoredRun;
    }

    public RelayAddress relayAddress() {
        return RelayAddress.parse(address);
    }

    public Path dbFile() {
        return rootDir.resolve("evalrelay.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path resultsDir() {
        return rootDir.resolve("results");
    }

    /**
     * Reads {@code evalrelay-settings.json} from the root; a missing file means defaults.
     */
    public RelaySettings loadSettings() {
        Path file = settingsFile();
        if (!Files.isRegularFile(file)) {
            return RelaySettings.defaults();
        }
        try {
            RelaySettings.RelaySettingsFile raw = Jsons.mapper().readValue(file.toFile(), RelaySettings.RelaySettingsFile.class);
            return RelaySettings.fromFile(raw, RelaySettings.defaults());
        } catch (IOException e) {
            throw new IllegalStateException("Invalid settings file: " + file, e);
        }
    }
}
