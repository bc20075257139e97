package com.omega.hoa.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.omega.hoa.cli.output.CheckResultsPrinter;
import com.omega.hoa.config.AliasPolicy;
import com.omega.hoa.config.HoaParserConfig;
import com.omega.hoa.config.HoaWriterConfig;
import com.omega.hoa.model.ParseResult;
import com.omega.hoa.output.HoaWriter;
import com.omega.hoa.parser.HoaReader;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * CLI command that reads HOA files, reports what it finds and optionally normalizes them.
 */
@Command(
        name = "hoa-check",
        mixinStandardHelpOptions = true,
        version = "hoa-check 1.0.0",
        description = "Reads and validates every automaton in the given HOA files."
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "HOA files to check; '-' reads standard input")
    private List<String> files;

    @Option(names = {"--max-errors"}, defaultValue = "100", description = "Errors reported per automaton (default: 100)")
    private int maxErrors;

    @Option(names = {"--normalize", "-n"}, description = "Print every accepted automaton in canonical HOA form")
    private boolean normalize;

    @Option(names = {"--alias-policy"}, defaultValue = "INLINE", description = "Aliases in normalized output: INLINE or EXTRACT")
    private AliasPolicy aliasPolicy;

    @Option(names = {"--implicit-labels"}, description = "Use implicit labels in normalized output where possible")
    private boolean implicitLabels;

    @Option(names = {"--no-acc-name-check"}, description = "Do not compare acceptance conditions with their acc-name")
    private boolean noAccNameCheck;

    @Option(names = {"--strict-labels"}, description = "Reject unlabeled bodies that do not declare implicit-labels")
    private boolean strictLabels;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        HoaParserConfig parserConfig = HoaParserConfig.builder()
                .maxErrors(maxErrors)
                .checkAcceptanceName(!noAccNameCheck)
                .inferImplicitLabels(!strictLabels)
                .build();
        HoaWriter writer = new HoaWriter(HoaWriterConfig.builder()
                .aliasPolicy(aliasPolicy)
                .implicitLabels(implicitLabels)
                .build());
        HoaReader reader = new HoaReader(parserConfig);
        CheckResultsPrinter printer = new CheckResultsPrinter();
        PrintWriter out = spec.commandLine().getOut();

        int automata = 0;
        int aborted = 0;
        int rejected = 0;
        for (String file : files) {
            String source;
            try {
                source = readSource(file);
            } catch (IOException e) {
                log.error("Cannot read {}", file, e);
                rejected++;
                continue;
            }

            List<ParseResult> results = reader.readAll(source);
            for (int i = 0; i < results.size(); i++) {
                ParseResult result = results.get(i);
                printer.printResult(file, i, result, source);
                switch (result.getKind()) {
                    case AUTOMATON -> {
                        automata++;
                        if (normalize) {
                            out.print(writer.write(result.getAutomaton()));
                        }
                    }
                    case ABORTED -> aborted++;
                    case FAILURE -> rejected++;
                }
            }
        }
        out.flush();

        printer.printSummary(automata, aborted, rejected);
        return rejected == 0 ? 0 : 1;
    }

    private static String readSource(String file) throws IOException {
        if ("-".equals(file)) {
            return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(Path.of(file), StandardCharsets.UTF_8);
    }
}
