package com.example.draftarchiver.service;

import com.example.draftarchiver.domain.DraftWorkspace;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Supplies the fully assembled draft metadata document. Invoked once, after every asset
 * of the workspace has been verified.
 */
@FunctionalInterface
public interface DraftMetadataBuilder {

    JsonNode build(DraftWorkspace workspace);
}
