package org.example.nucleicounter.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.example.nucleicounter.dto.request.UpdateSettingsRequest;
import org.example.nucleicounter.model.EngineSettings;
import org.example.nucleicounter.service.SettingsStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/settings")
@RequiredArgsConstructor
public class SettingsController {

    private final SettingsStore settingsStore;

    @GetMapping
    public EngineSettings get() {
        return settingsStore.require();
    }

    @PutMapping
    public EngineSettings update(@Valid @RequestBody UpdateSettingsRequest request) {
        return settingsStore.save(request.toSettings());
    }

    @DeleteMapping
    public ResponseEntity<Void> reset() {
        settingsStore.reset();
        return ResponseEntity.noContent().build();
    }
}
