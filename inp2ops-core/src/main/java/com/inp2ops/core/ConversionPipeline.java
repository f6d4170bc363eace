package com.inp2ops.core;

import com.inp2ops.core.config.ConverterConfig;
import com.inp2ops.core.mapping.MappingTables;
import com.inp2ops.core.mapping.MappingTablesLoader;
import com.inp2ops.core.model.FeModel;
import com.inp2ops.core.parser.InpParser;
import com.inp2ops.core.parser.ParseException;
import com.inp2ops.core.renderer.ScriptRenderer;
import com.inp2ops.core.renderer.ScriptRenderers;
import com.inp2ops.core.translator.CommandSequence;
import com.inp2ops.core.translator.ConversionException;
import com.inp2ops.core.translator.ConversionOptions;
import com.inp2ops.core.translator.ConversionResult;
import com.inp2ops.core.translator.ConversionWarning;
import com.inp2ops.core.translator.EntityTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Entry point chaining parser, translator and renderer.
 *
 * <p>Each stage is exposed on its own for callers that need the intermediate results; {@link #run(String)}
 * performs all three. A parse failure stops the pipeline before translation and a conversion failure before
 * rendering, so no partial script is ever produced.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ConversionPipeline pipeline = ConversionPipeline.withDefaults();
 * ConversionReport report = pipeline.run(Files.readString(path));
 * report.warnings().forEach(System.out::println);
 * }</pre>
 */
public class ConversionPipeline {

    private static final Logger log = LoggerFactory.getLogger(ConversionPipeline.class);

    private final InpParser parser;
    private final EntityTranslator translator;
    private final ScriptRenderer renderer;

    public ConversionPipeline(MappingTables tables, ConversionOptions options, ScriptRenderer renderer) {
        this.parser = new InpParser();
        this.translator = new EntityTranslator(tables, options);
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
    }

    /**
     * Creates a pipeline with the bundled tables, default options and the OpenSeesPy renderer.
     *
     * @return a pipeline
     */
    public static ConversionPipeline withDefaults() {
        return new ConversionPipeline(MappingTablesLoader.loadDefault(), ConversionOptions.defaults(),
            ScriptRenderers.defaultRenderer());
    }

    /**
     * Creates a pipeline from configuration.
     *
     * <p>Relative mapping table paths are resolved against {@code baseDirectory}.
     *
     * @param config converter configuration
     * @param baseDirectory directory the configuration was loaded from
     * @return a pipeline
     * @throws IOException if a configured mapping table file cannot be loaded
     */
    public static ConversionPipeline fromConfig(ConverterConfig config, Path baseDirectory) throws IOException {
        MappingTables tables = MappingTablesLoader.loadDefault();
        String tablePath = config.mappings().path();
        if (tablePath != null && !tablePath.isBlank()) {
            tables = MappingTablesLoader.load(baseDirectory.resolve(tablePath));
        }
        return new ConversionPipeline(tables, config.conversion().toOptions(), ScriptRenderers.defaultRenderer());
    }

    public FeModel parse(String text) throws ParseException {
        return parser.parse(text);
    }

    public ConversionResult convert(FeModel model) throws ConversionException {
        ConversionResult result = translator.convert(model);
        for (ConversionWarning warning : result.warnings()) {
            log.warn("{}", warning);
        }
        return result;
    }

    public String render(CommandSequence sequence) {
        return renderer.render(sequence);
    }

    /**
     * Parses, converts and renders an input deck.
     *
     * @param text input text
     * @return model, commands, warnings and script
     * @throws ParseException if the input is malformed
     * @throws ConversionException if the model cannot be translated
     */
    public ConversionReport run(String text) throws ParseException, ConversionException {
        FeModel model = parse(text);
        ConversionResult result = convert(model);
        String script = render(result.commands());
        return new ConversionReport(model, result, script);
    }

    public ScriptRenderer getRenderer() {
        return renderer;
    }
}
