package com.inp2ops.core.parser;

import com.inp2ops.core.model.FeModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Parses Abaqus input text into an immutable {@link FeModel}.
 *
 * <p>The input is read as a stream of lines driven by a keyword state machine. Each directive line produces a
 * new {@link SectionContext} and the data lines that follow are interpreted against it. Cross references are
 * resolved only after the last line has been read.
 *
 * <p>Instances hold no state between calls and may be shared.
 */
public class InpParser {

    private static final Logger log = LoggerFactory.getLogger(InpParser.class);

    private static final char BYTE_ORDER_MARK = '\uFEFF';
    private static final String CONTINUATION = ",";

    /**
     * Parses a complete input deck.
     *
     * @param text the input text
     * @return the validated model
     * @throws ParseException on the first malformed line, duplicate id or unresolved reference
     */
    public FeModel parse(String text) throws ParseException {
        Objects.requireNonNull(text, "text must not be null");
        List<String> lines = text.lines().toList();

        ModelCollector collector = new ModelCollector();
        SectionContext context = SectionContexts.initial();

        int index = 0;
        while (index < lines.size()) {
            int lineNumber = index + 1;
            String line = clean(lines.get(index), index);
            index++;

            if (isIgnorable(line)) {
                continue;
            }

            if (line.startsWith(DirectiveLine.MARKER)) {
                StringBuilder directive = new StringBuilder(line);
                while (directive.toString().endsWith(CONTINUATION) && index < lines.size()) {
                    String next = clean(lines.get(index), index);
                    if (isIgnorable(next) || next.startsWith(DirectiveLine.MARKER)) {
                        break;
                    }
                    directive.append(next);
                    index++;
                }
                context = SectionContexts.enter(DirectiveLine.parse(directive.toString(), lineNumber), context);
                collector.open(context);
                continue;
            }

            if (!SectionContexts.interpretsData(context)) {
                collector.accept(context, DataRecord.split(line, lineNumber, context.keyword()));
                continue;
            }

            StringBuilder data = new StringBuilder(line);
            if (context instanceof SectionContext.ElementBlock) {
                // Element records with many nodes wrap onto following lines
                while (data.toString().endsWith(CONTINUATION) && index < lines.size()) {
                    String next = clean(lines.get(index), index);
                    if (isIgnorable(next) || next.startsWith(DirectiveLine.MARKER)) {
                        break;
                    }
                    data.append(next);
                    index++;
                }
            }

            DataRecord record = DataRecord.split(data.toString(), lineNumber, context.keyword());
            if (record.isEmpty()) {
                continue;
            }
            collector.accept(context, record);
        }

        FeModel model = new ReferenceResolver(collector).resolve();
        log.debug("Parsed {} nodes, {} elements, {} materials, {} sections, {} skipped keywords",
            model.nodes().size(), model.elements().size(), model.materials().size(),
            model.sections().size(), model.skippedSections().size());
        return model;
    }

    private static String clean(String raw, int index) {
        String line = raw;
        if (index == 0 && !line.isEmpty() && line.charAt(0) == BYTE_ORDER_MARK) {
            line = line.substring(1);
        }
        return line.trim();
    }

    private static boolean isIgnorable(String line) {
        return line.isEmpty() || line.startsWith(DirectiveLine.COMMENT_MARKER);
    }
}
