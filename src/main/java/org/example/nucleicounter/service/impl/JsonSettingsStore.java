package org.example.nucleicounter.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.example.nucleicounter.model.EngineSettings;
import org.example.nucleicounter.model.RecipeOptions;
import org.example.nucleicounter.service.SettingsStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

@Slf4j
@Component
public class JsonSettingsStore implements SettingsStore {

    private final ObjectMapper objectMapper;
    private final Path file;

    public JsonSettingsStore(ObjectMapper objectMapper,
                             @Value("${settings.file:${user.home}/.nuclei_counter_config.json}") String file) {
        this.objectMapper = objectMapper;
        this.file = Paths.get(file).toAbsolutePath().normalize();
    }

    @Override
    public Optional<EngineSettings> load() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            EngineSettings settings = objectMapper.readValue(file.toFile(), EngineSettings.class);
            if (settings.getRecipe() == null) {
                settings.setRecipe(new RecipeOptions());
            }
            log.debug("Loaded settings from {}", file);
            return Optional.of(settings);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read settings file " + file, e);
        }
    }

    @Override
    public EngineSettings save(EngineSettings settings) {
        if (settings.getRecipe() == null) {
            settings.setRecipe(new RecipeOptions());
        }
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = Files.createTempFile(parent, ".nuclei-settings-", ".json");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), settings);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            log.info("Settings saved to {}", file);
            return settings;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write settings file " + file, e);
        }
    }

    @Override
    public boolean reset() {
        try {
            boolean deleted = Files.deleteIfExists(file);
            if (deleted) {
                log.info("Settings file {} deleted", file);
            }
            return deleted;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete settings file " + file, e);
        }
    }
}
