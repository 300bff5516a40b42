package com.uimigrator.core.generator.impl;

import com.uimigrator.core.generator.base.AbstractLeptosGenerator;
import com.uimigrator.core.model.ComponentType;

import java.util.List;
import java.util.Set;

/**
 * Generates Leptos components from Ember components.
 */
public class LeptosEmberGenerator extends AbstractLeptosGenerator {

    private static final String GENERATOR_ID = "leptos-ember";
    private static final String GENERATOR_DISPLAY_NAME = "Leptos Generator (Ember)";
    private static final Set<String> LIFECYCLE_HOOKS = Set.of(
        "init", "didReceiveAttrs", "didInsertElement", "didRender", "didUpdate",
        "willDestroyElement", "willDestroy", "willRender"
    );

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
        return ComponentType.EMBER;
    }

    @Override
    protected String frameworkName() {
        return "Ember";
    }

    @Override
    protected boolean isLifecycleMethod(String method) {
        return LIFECYCLE_HOOKS.contains(method);
    }

    @Override
    protected List<String> portingNotes() {
        return List.of("@tracked fields map to create_signal; @action methods map to handlers");
    }
}
