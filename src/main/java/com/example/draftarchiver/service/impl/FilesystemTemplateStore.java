package com.example.draftarchiver.service.impl;

import com.example.draftarchiver.service.TemplateStore;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

@Service
public class FilesystemTemplateStore implements TemplateStore {

    private static final Logger log = LoggerFactory.getLogger(FilesystemTemplateStore.class);

    private final Path templatesRoot;
    private final Set<String> templateNames;

    public FilesystemTemplateStore(@Value("${draft.templates.path}") String templatesPath,
                                   @Value("${draft.templates.names:template}") String[] templateNames) {
        if (templatesPath == null || templatesPath.isBlank()) {
            throw new IllegalArgumentException("Template path cannot be blank in configuration.");
        }
        try {
            this.templatesRoot = Paths.get(templatesPath).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid path format configured for templates: " + templatesPath, e);
        }
        Set<String> names = new LinkedHashSet<>();
        Arrays.stream(templateNames)
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .forEach(name -> {
                    if (name.contains("/") || name.contains("\\") || name.contains("..")) {
                        throw new IllegalArgumentException("Invalid template name in configuration: " + name);
                    }
                    names.add(name);
                });
        this.templateNames = Collections.unmodifiableSet(names);
    }

    @PostConstruct
    private void initialize() {
        for (String name : templateNames) {
            Path tree = templatesRoot.resolve(name);
            if (Files.isDirectory(tree)) {
                log.info("Draft template '{}' available at {}", name, tree);
            } else {
                log.warn("Draft template '{}' is configured but missing at {}", name, tree);
            }
        }
    }

    @Override
    public Set<String> templateNames() {
        return templateNames;
    }

    @Override
    public Optional<Path> resolve(String templateName) {
        if (templateName == null || !templateNames.contains(templateName)) {
            return Optional.empty();
        }
        Path tree = templatesRoot.resolve(templateName).normalize();
        if (!tree.startsWith(templatesRoot) || !Files.isDirectory(tree)) {
            return Optional.empty();
        }
        return Optional.of(tree);
    }
}
