package com.omega.hoa.parser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.omega.hoa.config.HoaParserConfig;
import com.omega.hoa.diagnostics.Diagnostic;
import com.omega.hoa.diagnostics.DiagnosticKind;
import com.omega.hoa.model.ParseResult;
import com.omega.hoa.symbolic.SymbolicCompiler;
import com.omega.hoa.symbolic.SymbolicContext;

/**
 * Entry point for reading HOA text.
 *
 * Automata read through the same reader share its {@link SymbolicContext}, so their guards and
 * acceptance conditions can be compared with {@code equals}.
 */
public class HoaReader {
    private static final Logger log = LoggerFactory.getLogger(HoaReader.class);

    private final HoaParserConfig config;
    private final SymbolicContext context;
    private final HoaPipeline pipeline;

    public HoaReader() {
        this(HoaParserConfig.defaults());
    }

    public HoaReader(HoaParserConfig config) {
        this(config, config.newSymbolicContext());
    }

    public HoaReader(HoaParserConfig config, SymbolicContext context) {
        this.config = config;
        this.context = context;
        this.pipeline = new HoaPipeline(config, new SymbolicCompiler(context));
    }

    public SymbolicContext getContext() {
        return context;
    }

    /**
     * Lazily reads the automata of {@code text}, one result per automaton.
     */
    public HoaStream stream(String text) {
        return new HoaStream(text, config, pipeline);
    }

    /**
     * Reads the first automaton of {@code text}.
     */
    public ParseResult read(String text) {
        HoaStream stream = stream(text);
        if (!stream.hasNext()) {
            return ParseResult.failure(List.of(Diagnostic.error(DiagnosticKind.SYNTAX_ERROR, null,
                    "Input contains no automaton")));
        }
        return stream.next();
    }

    public List<ParseResult> readAll(String text) {
        List<ParseResult> results = new ArrayList<>();
        stream(text).forEachRemaining(results::add);
        return results;
    }

    public List<ParseResult> readAll(Path path) throws IOException {
        log.debug("Reading {}", path);
        return readAll(Files.readString(path, StandardCharsets.UTF_8));
    }
}
