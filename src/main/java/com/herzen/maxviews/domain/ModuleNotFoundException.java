package com.herzen.maxviews.domain;

public class ModuleNotFoundException extends RuntimeException {
    public ModuleNotFoundException(String moduleId) {
        super("Course module not found: " + moduleId);
    }
}
