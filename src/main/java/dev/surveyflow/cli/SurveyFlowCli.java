package dev.surveyflow.cli;

import ch.qos.logback.classic.Level;
import dev.surveyflow.engine.ActivationReport;
import dev.surveyflow.engine.SurveyFlowEngine;
import dev.surveyflow.engine.SurveyLoader;
import dev.surveyflow.error.SurveyFlowException;
import dev.surveyflow.model.FlowSettings;
import dev.surveyflow.model.ResponseState;
import dev.surveyflow.model.SurveyDefinition;
import dev.surveyflow.store.InMemoryFlowStore;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Checks a survey flow definition and optionally walks a simulated response through it.
 */
@Command(
    name = "survey-flow",
    mixinStandardHelpOptions = true,
    description = "Validate a branching survey flow and simulate responses."
)
public class SurveyFlowCli implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_ERROR = 2;

    @Parameters(index = "0", description = "Survey definition (JSON)")
    private Path definitionFile;

    @Option(names = "--answer",
        description = "Answer for the next question; '#<optionId>' or '#<optionId>:<text>' selects an option. Repeatable.")
    private List<String> answers = new ArrayList<>();

    @Option(names = "--verbose", description = "Log flow decisions")
    private boolean verbose;

    @Option(names = "--label-length", description = "Characters of question text shown in diagnostics")
    private Integer labelLength;

    private final PrintStream out;
    private final PrintStream err;

    public SurveyFlowCli() {
        this(System.out, System.err);
    }

    SurveyFlowCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("dev.surveyflow")).setLevel(Level.DEBUG);
        }

        SurveyDefinition definition;
        InMemoryFlowStore store;
        try {
            definition = SurveyLoader.loadFromFile(definitionFile);
            store = InMemoryFlowStore.of(definition);
        } catch (IOException | IllegalArgumentException | SurveyFlowException e) {
            err.println("Error: cannot load " + definitionFile + ": " + e.getMessage());
            return EXIT_ERROR;
        }

        FlowSettings settings = labelLength != null
            ? definition.settings().withQuestionLabelLength(labelLength)
            : definition.settings();
        var engine = new SurveyFlowEngine(store, settings);
        int surveyId = definition.survey().id();

        ActivationReport report = engine.activator().validateForActivation(surveyId);
        printReport(definition, report);
        if (!report.isValid()) {
            return EXIT_INVALID;
        }
        if (answers.isEmpty()) {
            return EXIT_OK;
        }

        try {
            walk(engine, surveyId);
        } catch (SurveyFlowException | IllegalStateException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
        return EXIT_OK;
    }

    private void printReport(SurveyDefinition definition, ActivationReport report) {
        out.printf("Survey %d (%s): %d question(s), %d branching rule(s)%n",
            report.surveyId(), definition.survey().title(),
            definition.questions().size(), definition.branchingRules().size());
        out.println("  endpoints: " + report.endpoints());
        if (report.hasCycle()) {
            out.println("  cycle: " + report.cyclePath());
        }
        if (report.isValid()) {
            out.println("  ready for activation");
        } else {
            report.errors().forEach(e -> out.println("  error: " + e));
        }
    }

    private void walk(SurveyFlowEngine engine, int surveyId) {
        ResponseState state = engine.tracker().start(surveyId);
        for (String raw : answers) {
            if (!(state instanceof ResponseState.InProgress current)) {
                out.println("  extra answer ignored: " + raw);
                continue;
            }
            Answer answer = Answer.parse(raw);
            state = engine.tracker().advance(current, answer.text(), answer.optionId());
            out.printf("  Q%d <- %s%n", current.currentQuestionId(), raw);
        }

        if (state instanceof ResponseState.InProgress current) {
            out.printf("  response waiting at question %d (visited %s)%n",
                current.currentQuestionId(), current.visited());
        } else {
            out.println("  response complete (visited " + state.visited() + ")");
        }
    }

    /** An answer given on the command line. */
    record Answer(String text, Integer optionId) {

        static Answer parse(String raw) {
            if (!raw.startsWith("#")) {
                return new Answer(raw, null);
            }
            String body = raw.substring(1);
            int colon = body.indexOf(':');
            String id = colon < 0 ? body : body.substring(0, colon);
            String text = colon < 0 ? "" : body.substring(colon + 1);
            try {
                return new Answer(text, Integer.parseInt(id));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid option reference: " + raw, e);
            }
        }
    }
}
