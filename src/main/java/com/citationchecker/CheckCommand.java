package com.citationchecker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line front end: checks one manuscript and prints (or saves) the report.
 *
 * <p>Exit codes: 0 clean, 1 unreadable input or bad arguments, 2 error-level findings or an
 * aborted renumbering.
 */
@Command(
        name = "citation-checker",
        mixinStandardHelpOptions = true,
        version = "citation-checker 1.0.0",
        exitCodeOnInvalidInput = CheckCommand.EXIT_USAGE,
        description = "Checks in-text citations against the bibliography of a .txt, .md or .pdf manuscript."
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_FINDINGS = 2;

    static final String RENUMBERED_SUFFIX = ".renumbered.txt";

    public enum StyleOption { AUTO, APA, VANCOUVER, CHICAGO, NUMERIC }

    @Spec
    private CommandSpec spec;

    @Option(names = {"--style", "-s"}, defaultValue = "AUTO",
            description = "Citation style: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private StyleOption style;

    @Option(names = {"--renumber", "-r"},
            description = "Renumber numeric citations in order of first appearance (implies --style=numeric)")
    private boolean renumber;

    @Option(names = {"--output", "-o"}, description = "Write the report to this file instead of standard output")
    private Path output;

    @Parameters(index = "0", paramLabel = "FILE", description = "Manuscript to check (.txt, .md or .pdf)")
    private Path input;

    /**
     * Picocli command line with the options this tool relies on.
     */
    public static CommandLine commandLine() {
        return new CommandLine(new CheckCommand())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        if (!Files.isRegularFile(input)) {
            log.error("Manuscript does not exist or is not a file: {}", input);
            return EXIT_USAGE;
        }

        try {
            List<String> texts = ManuscriptReader.read(input);
            String documentName = input.getFileName().toString();

            String report;
            int exitCode;
            if (renumber || style == StyleOption.NUMERIC) {
                NumericSequencer.RenumberOutcome outcome =
                        NumericSequencer.renumber(NumberedDocument.fromPlainParagraphs(texts));
                report = ValidationReport.renderNumeric(outcome, documentName);
                exitCode = outcome.aborted() ? EXIT_FINDINGS : EXIT_OK;
                if (renumber && !outcome.plan().isEmpty()) {
                    Path target = renumberedPath();
                    Files.writeString(target, outcome.document().toPlainText() + "\n", StandardCharsets.UTF_8);
                    log.info("Renumbered manuscript written to {}", target);
                }
            } else {
                List<Paragraph> paragraphs = Paragraph.of(texts);
                ValidationResult result = style == StyleOption.AUTO
                        ? CitationValidator.validate(paragraphs)
                        : CitationValidator.validate(paragraphs, CitationStyle.fromName(style.name()));
                report = ValidationReport.render(result, documentName);
                exitCode = result.hasErrors() ? EXIT_FINDINGS : EXIT_OK;
            }

            if (output != null) {
                Files.writeString(output, report + "\n", StandardCharsets.UTF_8);
                log.info("Report written to {}", output);
            } else {
                PrintWriter out = spec.commandLine().getOut();
                out.println(report);
                out.flush();
            }
            return exitCode;
        } catch (IOException e) {
            log.error("Could not process {}: {}", input, e.getMessage());
            return EXIT_USAGE;
        }
    }

    private Path renumberedPath() {
        Path anchor = output != null ? output.toAbsolutePath() : input.toAbsolutePath();
        String name = anchor.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return anchor.resolveSibling(stem + RENUMBERED_SUFFIX);
    }
}
