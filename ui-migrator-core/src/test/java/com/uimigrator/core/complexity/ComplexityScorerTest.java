package com.uimigrator.core.complexity;

import com.uimigrator.core.model.ComponentType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ComplexityScorer}.
 */
class ComplexityScorerTest {

    private final ComplexityScorer scorer = new ComplexityScorer();

    static Stream<ComponentType> types() {
        return Stream.of(ComponentType.REACT, ComponentType.VUE, ComponentType.ANGULAR, ComponentType.EMBER,
            ComponentType.RUBY, ComponentType.other("svelte"));
    }

    @ParameterizedTest
    @MethodSource("types")
    void score_emptySource_returnsMinimum(ComponentType type) {
        assertThat(scorer.score("", type)).isEqualTo(1);
        assertThat(scorer.score(null, type)).isEqualTo(1);
    }

    @ParameterizedTest
    @MethodSource("types")
    void score_hugeSource_isCapped(ComponentType type) {
        String huge = "if (a) { function f() { return x => y; } }\n".repeat(5_000);

        assertThat(scorer.score(huge, type)).isEqualTo(100);
    }

    @ParameterizedTest
    @MethodSource("types")
    void score_neverDecreasesWhenSourceGrows(ComponentType type) {
        String base = """
            export default function Card() {
              const [open, setOpen] = useState(false);
              if (open) { return null; }
            }
            """;
        String grown = base + """
            function helper() {
              switch (mode) { default: return open ? a : b; }
            }
            methods: { data() { return {}; } }
            @Input() value; ngOnInit() {} @tracked x; actions: {}
            """;

        assertThat(scorer.score(grown, type)).isGreaterThanOrEqualTo(scorer.score(base, type));
    }

    @Test
    void score_countsFrameworkMarkers() {
        String react = "function A() { const [a, setA] = useState(0); const [b, setB] = useState(1); }";

        // 1 base + 1 function + 2 useState * 2
        assertThat(scorer.score(react, ComponentType.REACT)).isEqualTo(6);
        // same text has no Vue markers beyond "function"
        assertThat(scorer.score(react, ComponentType.VUE)).isEqualTo(2);
    }

    @Test
    void count_countsNonOverlappingOccurrences() {
        assertThat(ComplexityScorer.count("aaaa", "aa")).isEqualTo(2);
        assertThat(ComplexityScorer.count("v-if *ngIf {{#if", "if")).isEqualTo(2);
        assertThat(ComplexityScorer.count("none", "if")).isZero();
    }
}
