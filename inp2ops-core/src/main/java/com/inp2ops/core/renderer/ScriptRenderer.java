package com.inp2ops.core.renderer;

import com.inp2ops.core.translator.CommandSequence;

/**
 * Turns a {@link CommandSequence} into the text of a target-runtime script.
 *
 * <p>Renderers are pure: output depends only on the sequence, so identical input yields byte-identical
 * scripts. Writing the text anywhere is left to the caller.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.inp2ops.core.renderer.ScriptRenderer}
 *
 * @see OpenSeesPyRenderer
 */
public interface ScriptRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * @return lowercase renderer identifier (e.g., "openseespy")
     */
    String getId();

    /**
     * Returns human-readable display name for this renderer.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for rendered scripts.
     *
     * @return file extension without leading dot
     */
    String getFileExtension();

    /**
     * Renders a command sequence.
     *
     * @param sequence the commands to render
     * @return complete script text
     */
    String render(CommandSequence sequence);
}
