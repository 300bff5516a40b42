package com.uimigrator.core.analyzer.impl;

import com.uimigrator.core.analyzer.AnalysisResult;
import com.uimigrator.core.analyzer.AnalyzerTestBase;
import com.uimigrator.core.model.ParsedComponent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link EmberAnalyzer}.
 */
class EmberAnalyzerTest extends AnalyzerTestBase {

    private EmberAnalyzer analyzer;

    @BeforeEach
    void setUpAnalyzer() {
        analyzer = new EmberAnalyzer();
    }

    @Test
    void analyze_withGlimmerComponent_foldsTemplateIntoClass() throws IOException {
        // Given: a Glimmer class with a co-located template
        createFile("components/user-card.js", """
import Component from '@glimmer/component';
import { tracked } from '@glimmer/tracking';
import { action } from '@ember/object';
import UserAvatar from 'my-app/components/user-avatar';

export default class UserCardComponent extends Component {
  @tracked expanded = false;

  get displayName() {
    return this.args.user.name;
  }

  @action
  toggle() {
    this.expanded = !this.expanded;
  }
}
""");
        createFile("components/user-card.hbs", """
<div class="user-card" {{on "click" this.toggle}}>
  <UserAvatar @src={{@user.avatar}} />
  {{#ui-badge count=@count}}New{{/ui-badge}}
  <Forms::SubmitButton />
  {{component 'widgets/status-pill'}}
</div>
""");

        // When
        AnalysisResult result = analyzer.analyze(tempDir);

        // Then: one component, not one per file
        assertThat(result.components()).hasSize(1);
        ParsedComponent card = component(result, "UserCard");
        assertThat(card.dependencyHints())
            .containsExactlyInAnyOrder("UserAvatar", "UiBadge", "SubmitButton", "StatusPill");
        assertThat(card.props()).contains("user", "count");
        assertThat(card.stateFields()).containsExactly("expanded");
        assertThat(card.methods()).containsExactly("toggle");
        assertThat(card.sourceText()).contains("{{#ui-badge");
    }

    @Test
    void analyze_withTemplateOnlyComponent_usesTemplate() throws IOException {
        createFile("app/components/status-pill.hbs", """
<span class="pill pill-{{@tone}}">{{@label}}</span>
""");

        AnalysisResult result = analyzer.analyze(tempDir);

        ParsedComponent pill = component(result, "StatusPill");
        assertThat(pill.props()).containsExactly("tone", "label");
        assertThat(pill.dependencyHints()).isEmpty();
    }

    @Test
    void analyze_withClassicComponent_readsActionsBlock() throws IOException {
        createFile("components/search-box.js", """
import Component from '@ember/component';

export default Component.extend({
  query: '',

  actions: {
    search() {
      this.sendAction('onSearch', this.query);
    },
    clear() {
      this.set('query', '');
    }
  }
});
""");

        AnalysisResult result = analyzer.analyze(tempDir);

        assertThat(component(result, "SearchBox").methods()).containsExactly("search", "clear");
    }

    @Test
    void analyze_ignoresFilesOutsideComponentsDirectory() throws IOException {
        createFile("routes/index.js", """
import Route from '@ember/routing/route';
export default class IndexRoute extends Route {}
""");
        createFile("helpers/format-date.js", """
import Component from '@glimmer/component';
""");

        AnalysisResult result = analyzer.analyze(tempDir);

        assertThat(result.components()).isEmpty();
    }
}
