package com.purchasingpower.upmsync.service.impl;

import com.purchasingpower.upmsync.model.unity.IdentityToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Identity Deriver Tests")
class IdentityDeriverImplTest {

    private static final String ROOT = "com.example.pkg";

    private IdentityDeriverImpl deriver;

    @BeforeEach
    void setUp() {
        deriver = new IdentityDeriverImpl();
    }

    @Test
    @DisplayName("Should derive the documented SHA-256 token for a path")
    void derive_knownValue() {
        // When
        IdentityToken token = deriver.derive(ROOT, "Runtime/Foo.cs");

        // Then
        assertThat(token.value()).isEqualTo("fe058ee3-df46-d9e1-0ef3-7c152c403a00");
        assertThat(token.toGuid()).isEqualTo("fe058ee3df46d9e10ef37c152c403a00");
    }

    @Test
    @DisplayName("Should derive a token for the package root itself")
    void derive_root() {
        assertThat(deriver.derive(ROOT, "").value()).isEqualTo("381cf6d0-314b-ab5a-b7ea-2d0f7965a399");
    }

    @Test
    @DisplayName("Should return the same token on every call")
    void derive_isDeterministic() {
        IdentityToken first = deriver.derive(ROOT, "Runtime/Sub/Bar.cs");
        IdentityToken second = new IdentityDeriverImpl().derive(ROOT, "Runtime/Sub/Bar.cs");

        assertThat(first).isEqualTo(second);
    }

    @Test
    @DisplayName("Should treat equivalent spellings of a path as the same path")
    void derive_normalizesPath() {
        IdentityToken canonical = deriver.derive(ROOT, "Runtime/Foo.cs");

        assertThat(deriver.derive(ROOT, "Runtime\\Foo.cs")).isEqualTo(canonical);
        assertThat(deriver.derive(ROOT, "./Runtime//Foo.cs")).isEqualTo(canonical);
        assertThat(deriver.derive(ROOT, "/Runtime/Foo.cs/")).isEqualTo(canonical);
    }

    @Test
    @DisplayName("Should keep letter case significant")
    void derive_isCaseSensitive() {
        assertThat(deriver.derive(ROOT, "Runtime/Foo.cs"))
                .isNotEqualTo(deriver.derive(ROOT, "runtime/foo.cs"));
    }

    @Test
    @DisplayName("Should separate packages with different root tokens")
    void derive_dependsOnRootToken() {
        assertThat(deriver.derive(ROOT, "Runtime/Foo.cs"))
                .isNotEqualTo(deriver.derive("com.example.other", "Runtime/Foo.cs"));
    }

    @Test
    @DisplayName("Should not confuse token and path boundaries")
    void derive_separatorPreventsCollisions() {
        assertThat(deriver.derive("a", "b/c")).isNotEqualTo(deriver.derive("a/b", "c"));
    }

    @Test
    @DisplayName("Should reject a blank root token")
    void derive_blankRootToken() {
        assertThatThrownBy(() -> deriver.derive(" ", "Runtime/Foo.cs"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
