package com.agentmesh.core.model;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class ScopeKeyTest {

    @Test
    void render_shouldIncludeScopeAndOwner() {
        UUID id = UUID.fromString("00000000-0000-0000-0000-000000000001");

        assertThat(ScopeKey.workflow(id, "checkpoint").render())
            .isEqualTo("workflow:00000000-0000-0000-0000-000000000001/checkpoint");
        assertThat(ScopeKey.agent("writer-1", "notes").render()).isEqualTo("agent:writer-1/notes");
        assertThat(ScopeKey.global("pricing").render()).isEqualTo("global:pricing");
    }

    @Test
    void parse_shouldInvertRender() {
        ScopeKey key = ScopeKey.agent("writer-1", "drafts/2024");

        assertThat(ScopeKey.parse(key.render())).isEqualTo(key);
        assertThat(ScopeKey.parse("global:a/b")).isEqualTo(ScopeKey.global("a/b"));
    }

    @Test
    void parse_shouldRejectMalformedKeys() {
        assertThatThrownBy(() -> ScopeKey.parse("nocolon")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ScopeKey.parse("agent:missing-name")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ScopeKey.parse("team:x/y")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_shouldRequireOwnerOutsideGlobalScope() {
        assertThatThrownBy(() -> new ScopeKey(ScopeType.AGENT, null, "notes"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ScopeKey(ScopeType.AGENT, "a/b", "notes"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
