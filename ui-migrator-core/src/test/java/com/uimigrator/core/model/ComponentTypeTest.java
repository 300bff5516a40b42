package com.uimigrator.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ComponentType}.
 */
class ComponentTypeTest {

    @Test
    void label_forKnownType_returnsName() {
        assertThat(ComponentType.REACT.label()).isEqualTo("React");
        assertThat(ComponentType.ANGULAR.toString()).isEqualTo("Angular");
    }

    @Test
    void label_forOtherType_wrapsName() {
        assertThat(ComponentType.other("svelte").label()).isEqualTo("Other(svelte)");
    }

    @ParameterizedTest
    @ValueSource(strings = {"React", "react", "REACT", " React "})
    void fromLabel_withKnownName_isCaseInsensitive(String label) {
        assertThat(ComponentType.fromLabel(label)).isEqualTo(ComponentType.REACT);
    }

    @Test
    void fromLabel_withOtherLabel_returnsOtherType() {
        ComponentType type = ComponentType.fromLabel("Other(svelte)");

        assertThat(type.kind()).isEqualTo(ComponentType.Kind.OTHER);
        assertThat(type.name()).isEqualTo("svelte");
    }

    @Test
    void fromLabel_withUnknownName_returnsOtherType() {
        assertThat(ComponentType.fromLabel("Solid")).isEqualTo(ComponentType.other("Solid"));
    }

    @Test
    void fromLabel_withBlank_throwsException() {
        assertThatThrownBy(() -> ComponentType.fromLabel(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void directoryName_isLowerCaseAndPathSafe() {
        assertThat(ComponentType.VUE.directoryName()).isEqualTo("vue");
        assertThat(ComponentType.other("Web Components").directoryName()).isEqualTo("web_components");
    }

    @Test
    void json_serializesAsLabel() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        String json = mapper.writeValueAsString(ComponentType.other("svelte"));

        assertThat(json).isEqualTo("\"Other(svelte)\"");
        assertThat(mapper.readValue(json, ComponentType.class)).isEqualTo(ComponentType.other("svelte"));
        assertThat(mapper.readValue("\"Ember\"", ComponentType.class)).isEqualTo(ComponentType.EMBER);
    }
}
