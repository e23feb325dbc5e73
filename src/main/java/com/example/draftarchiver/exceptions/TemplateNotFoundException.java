package com.example.draftarchiver.exceptions;

public class TemplateNotFoundException extends DraftLifecycleException {

    private final String templateName;

    public TemplateNotFoundException(String templateName) {
        super("Draft template not found: " + templateName);
        this.templateName = templateName;
    }

    public String getTemplateName() {
        return templateName;
    }

    @Override
    public String getErrorCode() {
        return "TemplateNotFound";
    }
}
