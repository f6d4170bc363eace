package com.inp2ops.core.renderer;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Validates SPI registration of {@link ScriptRenderer} implementations.
 */
class ScriptRenderersTest {

    @Test
    void serviceLoader_discoversOpenSeesPyRenderer() {
        List<ScriptRenderer> renderers = ServiceLoader.load(ScriptRenderer.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();

        assertThat(renderers)
            .extracting(ScriptRenderer::getId)
            .containsExactly("openseespy");
    }

    @Test
    void find_unknownId_isEmpty() {
        assertThat(ScriptRenderers.find("tcl")).isEmpty();
    }

    @Test
    void defaultRenderer_writesPythonFiles() {
        ScriptRenderer renderer = ScriptRenderers.defaultRenderer();

        assertThat(renderer.getId()).isEqualTo(ScriptRenderers.DEFAULT_ID);
        assertThat(renderer.getFileExtension()).isEqualTo("py");
        assertThat(renderer.getDisplayName()).isNotBlank();
    }
}
