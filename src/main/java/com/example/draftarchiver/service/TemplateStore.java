package com.example.draftarchiver.service;

import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only access to the named draft template trees.
 */
public interface TemplateStore {

    /**
     * @return The logical template names this store serves.
     */
    Set<String> templateNames();

    /**
     * Resolves a template name to its directory tree.
     *
     * @param templateName The logical template name.
     * @return The template directory, or empty if the name is unknown or its tree is absent.
     */
    Optional<Path> resolve(String templateName);
}
