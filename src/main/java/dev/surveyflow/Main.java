package dev.surveyflow;

import dev.surveyflow.cli.SurveyFlowCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new SurveyFlowCli()).execute(args);
        System.exit(exitCode);
    }
}
