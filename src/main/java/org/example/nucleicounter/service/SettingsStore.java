package org.example.nucleicounter.service;

import org.example.nucleicounter.model.EngineSettings;

import java.util.Optional;

public interface SettingsStore {
    Optional<EngineSettings> load();

    EngineSettings save(EngineSettings settings);

    boolean reset();

    default EngineSettings require() {
        return load().orElseThrow(() -> new SettingsNotConfiguredException(
                "Engine not configured. Select your Fiji executable (e.g. ImageJ-linux64) and, optionally, a macro file."));
    }
}
