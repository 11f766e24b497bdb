package com.example.workflowgraph.codegen;

import javax.lang.model.SourceVersion;

/**
 * Target of generated source. An empty package name places the class in the default package.
 */
public record SourceGenerationOptions(String packageName, String className) {

    public static final String DEFAULT_PACKAGE = "workflows";
    public static final String DEFAULT_CLASS_NAME = "GeneratedWorkflow";

    public SourceGenerationOptions {
        packageName = packageName != null ? packageName.trim() : DEFAULT_PACKAGE;
        className = className != null && !className.isBlank() ? className.trim() : DEFAULT_CLASS_NAME;
        if (!packageName.isEmpty() && !SourceVersion.isName(packageName)) {
            throw new IllegalArgumentException("invalid package name '" + packageName + "'");
        }
        if (!SourceVersion.isIdentifier(className) || SourceVersion.isKeyword(className)) {
            throw new IllegalArgumentException("invalid class name '" + className + "'");
        }
    }

    public static SourceGenerationOptions defaults() {
        return new SourceGenerationOptions(DEFAULT_PACKAGE, DEFAULT_CLASS_NAME);
    }
}
