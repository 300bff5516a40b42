package com.uimigrator.core.analyzer.impl;

import com.uimigrator.core.analyzer.AnalysisResult;
import com.uimigrator.core.analyzer.AnalyzerTestBase;
import com.uimigrator.core.model.ComponentType;
import com.uimigrator.core.model.ParsedComponent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link ReactAnalyzer}.
 */
class ReactAnalyzerTest extends AnalyzerTestBase {

    private ReactAnalyzer analyzer;

    @BeforeEach
    void setUpAnalyzer() {
        analyzer = new ReactAnalyzer();
    }

    @Test
    void analyze_withFunctionComponent_extractsStructure() throws IOException {
        // Given: a function component with imports, state and a handler
        createFile("components/UserCard.jsx", """
import React, { useState } from 'react';
import Avatar from './Avatar';
import { Button, Modal as Dialog } from './ui';

export default function UserCard({ user, onSelect }) {
  const [expanded, setExpanded] = useState(false);
  const handleClick = () => setExpanded(!expanded);
  return (
    <div>
      <Avatar src={user.avatar} />
      <Button onClick={handleClick}>More</Button>
      <Dialog open={expanded} />
    </div>
  );
}
""");

        // When
        AnalysisResult result = analyzer.analyze(tempDir);

        // Then
        assertThat(result.success()).isTrue();
        ParsedComponent card = component(result, "UserCard");
        assertThat(card.type()).isEqualTo(ComponentType.REACT);
        assertThat(card.dependencyHints()).containsExactlyInAnyOrder("Avatar", "Button", "Modal", "Dialog");
        assertThat(card.childComponents()).containsExactly("Avatar", "Button", "Dialog");
        assertThat(card.props()).containsExactly("user", "onSelect");
        assertThat(card.stateFields()).containsExactly("expanded");
        assertThat(card.methods()).contains("handleClick");
    }

    @Test
    void analyze_withArrowComponentAndPropsAccess_extractsProps() throws IOException {
        createFile("Badge.tsx", """
import React from 'react';

const Badge = (props) => {
  return <span className={props.tone}>{props.label}</span>;
};

export default Badge;
""");

        AnalysisResult result = analyzer.analyze(tempDir);

        ParsedComponent badge = component(result, "Badge");
        assertThat(badge.props()).containsExactly("tone", "label");
        assertThat(badge.dependencyHints()).isEmpty();
    }

    @Test
    void analyze_ignoresTestFilesAndPlainModules() throws IOException {
        createFile("components/UserCard.test.jsx", """
import React from 'react';
import UserCard from './UserCard';
""");
        createFile("utils/format.js", """
export function formatName(user) {
  return user.first + ' ' + user.last;
}
""");

        AnalysisResult result = analyzer.analyze(tempDir);

        assertThat(result.success()).isTrue();
        assertThat(result.components()).isEmpty();
        assertThat(result.filesScanned()).isEqualTo(2);
    }

    @Test
    void analyze_skipsSelfReferencesAndFragments() throws IOException {
        createFile("Tree.jsx", """
import React, { Fragment } from 'react';

export default function Tree({ nodes }) {
  return (
    <Fragment>
      {nodes.map(node => <Tree nodes={node.children} />)}
    </Fragment>
  );
}
""");

        AnalysisResult result = analyzer.analyze(tempDir);

        assertThat(component(result, "Tree").dependencyHints()).isEmpty();
    }

    @Test
    void analyze_withIndexFile_usesDirectoryName() throws IOException {
        createFile("user-profile/index.jsx", """
export default () => {
  return (<section>profile</section>);
};
""");

        AnalysisResult result = analyzer.analyze(tempDir);

        assertThat(result.components()).extracting(ParsedComponent::name).containsExactly("UserProfile");
    }

    @Test
    void analyze_withMissingRoot_returnsFailedResult() {
        AnalysisResult result = analyzer.analyze(tempDir.resolve("missing"));

        assertThat(result.success()).isFalse();
        assertThat(result.errors()).hasSize(1);
    }

    @Test
    void analyzeFile_withNonComponent_returnsEmpty() throws IOException {
        Path file = createFile("constants.js", "export const PAGE_SIZE = 20;\n");

        assertThat(analyzer.analyzeFile(file)).isEmpty();
    }
}
