package com.inp2ops.core.renderer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Discovers {@link ScriptRenderer} implementations through {@link ServiceLoader}.
 */
public final class ScriptRenderers {

    private static final Logger log = LoggerFactory.getLogger(ScriptRenderers.class);

    /** Renderer used when none is requested. */
    public static final String DEFAULT_ID = "openseespy";

    private ScriptRenderers() {
        // Utility class
    }

    /**
     * Returns all registered renderers sorted by id.
     *
     * @return renderers, possibly empty
     */
    public static List<ScriptRenderer> all() {
        List<ScriptRenderer> renderers = new ArrayList<>();
        ServiceLoader.load(ScriptRenderer.class).forEach(renderers::add);
        renderers.sort(Comparator.comparing(ScriptRenderer::getId));
        log.debug("Discovered {} script renderers", renderers.size());
        return renderers;
    }

    /**
     * Finds a renderer by id.
     *
     * @param id renderer id
     * @return the renderer, empty if none is registered under that id
     */
    public static Optional<ScriptRenderer> find(String id) {
        return all().stream().filter(r -> r.getId().equals(id)).findFirst();
    }

    /**
     * Returns the default renderer.
     *
     * @return the OpenSeesPy renderer
     */
    public static ScriptRenderer defaultRenderer() {
        return find(DEFAULT_ID).orElseGet(OpenSeesPyRenderer::new);
    }
}
