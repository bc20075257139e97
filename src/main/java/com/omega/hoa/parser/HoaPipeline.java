package com.omega.hoa.parser;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.omega.hoa.build.AutomatonBuilder;
import com.omega.hoa.config.HoaParserConfig;
import com.omega.hoa.diagnostics.Diagnostics;
import com.omega.hoa.model.AbortSignal;
import com.omega.hoa.model.Automaton;
import com.omega.hoa.model.Header;
import com.omega.hoa.model.ParseResult;
import com.omega.hoa.model.RawAutomaton;
import com.omega.hoa.model.RawEdge;
import com.omega.hoa.model.RawState;
import com.omega.hoa.resolve.AliasResolver;
import com.omega.hoa.resolve.AliasTable;
import com.omega.hoa.symbolic.SymbolicCompiler;
import com.omega.hoa.validation.AcceptanceNameChecker;
import com.omega.hoa.validation.SemanticValidator;
import com.omega.hoa.validation.ValidationResult;

/**
 * Turns the tokens of one automaton into a {@link ParseResult}:
 * parse, resolve aliases, validate, build, then check the acceptance name.
 * Stops after the first stage that reports an error.
 */
public class HoaPipeline {
    private static final Logger log = LoggerFactory.getLogger(HoaPipeline.class);

    private final HoaParserConfig config;
    private final SymbolicCompiler compiler;

    public HoaPipeline(HoaParserConfig config, SymbolicCompiler compiler) {
        this.config = config;
        this.compiler = compiler;
    }

    public ParseResult process(List<HoaToken> tokens, Diagnostics diagnostics, int index) {
        RawAutomaton raw = new HoaParser(tokens).parse(diagnostics);
        Header header = raw.getHeader();

        if (raw.isAborted()) {
            log.info("Automaton #{} aborted by producer at {}", index, raw.getTerminatorSpan());
            AbortSignal signal = new AbortSignal(raw.getTerminatorSpan(), index,
                    raw.isHeaderSeen(), raw.isBodySeen(), header.getName());
            return ParseResult.aborted(signal, diagnostics.ranked());
        }
        if (diagnostics.hasErrors()) {
            return reject(index, diagnostics);
        }

        AliasTable aliases = new AliasResolver().resolve(header.getAliases(), diagnostics);
        for (RawState state : raw.getStates()) {
            if (state.getLabel() != null) {
                state.setLabel(AliasResolver.expand(state.getLabel(), aliases, diagnostics));
            }
            for (RawEdge edge : state.getEdges()) {
                if (edge.getLabel() != null) {
                    edge.setLabel(AliasResolver.expand(edge.getLabel(), aliases, diagnostics));
                }
            }
        }

        ValidationResult validation = new SemanticValidator(config).validate(raw, diagnostics);
        if (diagnostics.hasErrors()) {
            return reject(index, diagnostics);
        }

        Automaton automaton = new AutomatonBuilder(compiler).build(raw, aliases, validation);
        if (config.isCheckAcceptanceName()) {
            new AcceptanceNameChecker(compiler).check(header.getAcceptanceName(), automaton.getAcceptance(), diagnostics);
        }

        log.info("Automaton #{} '{}' read: {} state(s), {} edge(s), {} warning(s)", index,
                automaton.getName() == null ? "" : automaton.getName(), automaton.getStateCount(),
                automaton.edgeCount(), diagnostics.getWarnings().size());
        return ParseResult.success(automaton, diagnostics.ranked());
    }

    private static ParseResult reject(int index, Diagnostics diagnostics) {
        log.warn("Automaton #{} rejected with {} error(s)", index,
                diagnostics.getErrors().size() + diagnostics.getSuppressedCount());
        return ParseResult.failure(diagnostics.ranked());
    }
}
