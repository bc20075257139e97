package com.omega.hoa.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.omega.hoa.diagnostics.Diagnostic;
import com.omega.hoa.model.Automaton;
import com.omega.hoa.model.ParseResult;

/**
 * Responsible only for printing CLI output for the "hoa-check" command.
 * No reading, no validation.
 */
public class CheckResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(CheckResultsPrinter.class);

    private final DiagnosticRenderer renderer = new DiagnosticRenderer();

    public void printResult(String sourceName, int index, ParseResult result, String source) {
        switch (result.getKind()) {
            case AUTOMATON -> {
                Automaton automaton = result.getAutomaton();
                log.info("{} #{}: OK {} - {} state(s), {} AP(s), acceptance {}",
                        sourceName, index,
                        automaton.getName() != null ? "\"" + automaton.getName() + "\"" : "(unnamed)",
                        automaton.getStateCount(), automaton.apCount(), automaton.getAcceptance());
            }
            case ABORTED -> log.info("{} #{}: ABORTED by producer at {}", sourceName, index,
                    result.getAbortSignal().getSpan());
            case FAILURE -> log.warn("{} #{}: REJECTED with {} error(s)", sourceName, index, result.errors().size());
        }
        for (Diagnostic diagnostic : result.getDiagnostics()) {
            String rendered = renderer.render(diagnostic, source, sourceName);
            for (String line : rendered.split("\n")) {
                if (diagnostic.isError()) {
                    log.warn(line);
                } else {
                    log.info(line);
                }
            }
        }
    }

    public void printSummary(int automata, int aborted, int rejected) {
        log.info("=================================================");
        log.info("Automata read: {}", automata);
        log.info("Aborted:       {}", aborted);
        log.info("Rejected:      {}", rejected);
        log.info("=================================================");
    }
}
