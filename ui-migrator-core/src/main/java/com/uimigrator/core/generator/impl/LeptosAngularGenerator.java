package com.uimigrator.core.generator.impl;

import com.uimigrator.core.generator.base.AbstractLeptosGenerator;
import com.uimigrator.core.model.ComponentType;

import java.util.List;

/**
 * Generates Leptos components from Angular components.
 *
 * <p>{@code ngOn*} hooks become effects; {@code @Output} emitters arrive as methods and become
 * handlers.
 */
public class LeptosAngularGenerator extends AbstractLeptosGenerator {

    private static final String GENERATOR_ID = "leptos-angular";
    private static final String GENERATOR_DISPLAY_NAME = "Leptos Generator (Angular)";

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public ComponentType getComponentType() {
        return ComponentType.ANGULAR;
    }

    @Override
    protected String frameworkName() {
        return "Angular";
    }

    @Override
    protected boolean isLifecycleMethod(String method) {
        return method.startsWith("ngOn") || method.startsWith("ngAfter") || method.equals("ngDoCheck");
    }

    @Override
    protected List<String> portingNotes() {
        return List.of("@Input fields map to props; injected services map to use_context");
    }
}
