package com.example.draftarchiver.service;

import com.example.draftarchiver.domain.DraftWorkspace;
import com.example.draftarchiver.exceptions.ProvisionIOException;
import com.example.draftarchiver.exceptions.TemplateNotFoundException;
import com.example.draftarchiver.exceptions.WorkspaceAlreadyExistsException;

import java.nio.file.Path;

public interface TemplateProvisioner {

    /**
     * Materializes a fresh working directory for a draft by copying a template tree,
     * seeded with an empty draft metadata document.
     *
     * @param templateName One of the configured template names.
     * @param draftId      The draft ID; becomes the directory name.
     * @return The new workspace, in state CREATED.
     * @throws TemplateNotFoundException       If the template is unknown or its tree is missing.
     * @throws WorkspaceAlreadyExistsException If the draft's directory already exists.
     * @throws ProvisionIOException            If copying fails; the partial directory has been removed.
     */
    DraftWorkspace provision(String templateName, String draftId);

    /**
     * @return The root directory under which workspaces are created.
     */
    Path workspaceRoot();
}
