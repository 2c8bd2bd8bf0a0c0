package org.strata.cli;

import picocli.CommandLine;

/**
 * Main CLI entry point for strata.
 * Plans schema migrations from declared models and the stored migration history.
 */
@CommandLine.Command(
        name = "strata",
        mixinStandardHelpOptions = true,
        version = "strata 0.1.0",
        description = "선언된 모델과 마이그레이션 이력을 비교해 스키마 마이그레이션을 계획합니다.",
        subcommands = {
                MakeMigrationsCommand.class,
                ShowMigrationsCommand.class
        }
)
public class StrataCli {

    static final int EXIT_OK = 0;
    static final int EXIT_USER_ERROR = 1;
    static final int EXIT_FAILURE = 2;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new StrataCli()).execute(args);
        System.exit(exitCode);
    }
}
