package com.uimigrator.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link NameUtils}.
 */
class NameUtilsTest {

    @ParameterizedTest
    @CsvSource({
        "UserCard, usercard",
        "user-card, usercard",
        "user_card, usercard",
        "user.card, usercard",
        "'User Card', usercard"
    })
    void matchKey_withNamingStyles_returnsSameKey(String name, String expected) {
        assertThat(NameUtils.matchKey(name)).isEqualTo(expected);
    }

    @Test
    void matchKey_withNull_returnsEmpty() {
        assertThat(NameUtils.matchKey(null)).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
        "UserCard, user_card",
        "userCard, user_card",
        "user-card, user_card",
        "HTMLParser, html_parser",
        "Button, button"
    })
    void toSnakeCase_convertsToSnakeCase(String name, String expected) {
        assertThat(NameUtils.toSnakeCase(name)).isEqualTo(expected);
    }

    @Test
    void toSnakeCase_withBlank_returnsEmpty() {
        assertThat(NameUtils.toSnakeCase("  ")).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
        "user-card, UserCard",
        "user_card, UserCard",
        "UserCard, UserCard",
        "x-foo-bar, XFooBar"
    })
    void toPascalCase_convertsToPascalCase(String name, String expected) {
        assertThat(NameUtils.toPascalCase(name)).isEqualTo(expected);
    }

    @Test
    void baseName_stripsAllExtensions() {
        assertThat(NameUtils.baseName("user-card.component.ts")).isEqualTo("user-card");
        assertThat(NameUtils.baseName("UserCard.jsx")).isEqualTo("UserCard");
        assertThat(NameUtils.baseName("README")).isEqualTo("README");
    }
}
