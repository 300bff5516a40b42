package com.uimigrator.core.generator.impl;

import com.uimigrator.core.generator.base.AbstractLeptosGenerator;
import com.uimigrator.core.model.ComponentType;

import java.util.List;
import java.util.Set;

/**
 * Generates Leptos components from Vue components.
 */
public class LeptosVueGenerator extends AbstractLeptosGenerator {

    private static final String GENERATOR_ID = "leptos-vue";
    private static final String GENERATOR_DISPLAY_NAME = "Leptos Generator (Vue)";
    private static final Set<String> LIFECYCLE_HOOKS = Set.of(
        "beforeCreate", "created", "beforeMount", "mounted", "beforeUpdate", "updated",
        "beforeDestroy", "destroyed", "beforeUnmount", "unmounted", "onMounted", "onUnmounted"
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
        return ComponentType.VUE;
    }

    @Override
    protected String frameworkName() {
        return "Vue";
    }

    @Override
    protected boolean isLifecycleMethod(String method) {
        return LIFECYCLE_HOOKS.contains(method);
    }

    @Override
    protected List<String> portingNotes() {
        return List.of("data() fields map to create_signal; computed properties map to create_memo");
    }
}
