package org.example.nucleicounter.script;

import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class MacroTemplateLoader {

    private final ResourceLoader resourceLoader;
    private final Map<String, MacroTemplate> cache = new ConcurrentHashMap<>();

    public MacroTemplateLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    public MacroTemplate load(String name, Set<String> required) {
        return cache.computeIfAbsent(name, n -> MacroTemplate.of(n, read(n), required));
    }

    private String read(String name) {
        Resource resource = resourceLoader.getResource("classpath:macro/" + name + ".ijm");
        if (!resource.exists()) {
            throw new IllegalArgumentException("Macro template not found: " + name);
        }
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load macro template: " + name, e);
        }
    }
}
