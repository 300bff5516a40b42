package com.uimigrator.core.generator.impl;

import com.uimigrator.core.generator.base.AbstractLeptosGenerator;
import com.uimigrator.core.model.ComponentType;

import java.util.List;

/**
 * Generates Leptos components from React components.
 *
 * <p>Hooks such as {@code useEffect} are not listed as methods by the analyzer, so every method
 * is emitted as an event handler.
 */
public class LeptosReactGenerator extends AbstractLeptosGenerator {

    private static final String GENERATOR_ID = "leptos-react";
    private static final String GENERATOR_DISPLAY_NAME = "Leptos Generator (React)";

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
        return ComponentType.REACT;
    }

    @Override
    protected String frameworkName() {
        return "React";
    }

    @Override
    protected boolean isLifecycleMethod(String method) {
        return false;
    }

    @Override
    protected List<String> portingNotes() {
        return List.of(
            "useState pairs map to create_signal; useEffect bodies map to create_effect",
            "useMemo maps to create_memo"
        );
    }
}
