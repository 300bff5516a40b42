package com.uimigrator.core.analyzer.impl;

import com.uimigrator.core.analyzer.AnalysisResult;
import com.uimigrator.core.analyzer.AnalyzerTestBase;
import com.uimigrator.core.model.ComponentType;
import com.uimigrator.core.model.ParsedComponent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link VueAnalyzer}.
 */
class VueAnalyzerTest extends AnalyzerTestBase {

    private VueAnalyzer analyzer;

    @BeforeEach
    void setUpAnalyzer() {
        analyzer = new VueAnalyzer();
    }

    @Test
    void analyze_withSingleFileComponent_extractsStructure() throws IOException {
        // Given: an options API single-file component
        createFile("components/UserCard.vue", """
<template>
  <div class="user-card">
    <user-avatar :src="user.avatar" />
    <BaseButton @click="toggle">More</BaseButton>
    <router-link to="/profile">Profile</router-link>
  </div>
</template>

<script>
import UserAvatar from './UserAvatar.vue';
import BaseButton from './BaseButton.vue';

export default {
  name: 'user-card',
  components: { UserAvatar, BaseButton },
  props: {
    user: { type: Object, required: true },
    compact: Boolean
  },
  data() {
    return { expanded: false, count: 0 };
  },
  methods: {
    toggle() {
      this.expanded = !this.expanded;
    },
    reset() {
      this.count = 0;
    }
  }
};
</script>
""");

        // When
        AnalysisResult result = analyzer.analyze(tempDir);

        // Then
        ParsedComponent card = component(result, "UserCard");
        assertThat(card.type()).isEqualTo(ComponentType.VUE);
        assertThat(card.dependencyHints()).containsExactlyInAnyOrder("UserAvatar", "BaseButton");
        assertThat(card.childComponents()).containsExactlyInAnyOrder("UserAvatar", "BaseButton");
        assertThat(card.props()).containsExactly("user", "compact");
        assertThat(card.stateFields()).containsExactly("expanded", "count");
        assertThat(card.methods()).containsExactly("toggle", "reset");
    }

    @Test
    void analyze_withGlobalRegistration_usesRegisteredName() throws IOException {
        createFile("legacy/todo.js", """
Vue.component('todo-item', {
  props: ['todo', 'done'],
  template: '<li>{{ todo.text }}</li>'
});
""");

        AnalysisResult result = analyzer.analyze(tempDir);

        ParsedComponent item = component(result, "TodoItem");
        assertThat(item.props()).containsExactly("todo", "done");
    }

    @Test
    void analyze_withCompositionApi_extractsRefsAndDefineProps() throws IOException {
        createFile("Counter.vue", """
<template>
  <button @click="count++">{{ label }}: {{ count }}</button>
</template>

<script setup>
import { ref } from 'vue';
const props = defineProps(['label']);
const count = ref(0);
</script>
""");

        AnalysisResult result = analyzer.analyze(tempDir);

        ParsedComponent counter = component(result, "Counter");
        assertThat(counter.props()).containsExactly("label");
        assertThat(counter.stateFields()).containsExactly("count");
        assertThat(counter.dependencyHints()).isEmpty();
    }

    @Test
    void analyze_ignoresPlainJavaScript() throws IOException {
        createFile("store/index.js", "export default { state: {} };\n");

        AnalysisResult result = analyzer.analyze(tempDir);

        assertThat(result.components()).isEmpty();
    }
}
