package org.strata.cli;

import lombok.extern.slf4j.Slf4j;
import org.strata.config.ConfigurationLoader;
import org.strata.migration.MigrationNaming;
import org.strata.migration.MigrationPlanner;
import org.strata.migration.MigrationPlanningException;
import org.strata.migration.PlanRequest;
import org.strata.migration.repository.MigrationRepository;
import org.strata.model.GeneratedMigration;
import org.strata.model.ModelSet;
import org.strata.model.dependency.Dependency;
import org.strata.model.operation.Operation;
import org.strata.options.StrataOptions;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Detects model changes and writes the next migration of a group.
 */
@Slf4j
@CommandLine.Command(
        name = "make-migrations",
        mixinStandardHelpOptions = true,
        showDefaultValues = true,
        description = "모델 변경 사항을 감지하여 다음 마이그레이션을 생성합니다."
)
public class MakeMigrationsCommand implements Callable<Integer> {

    @CommandLine.Option(names = {"-m", "--models"}, required = true, description = "현재 모델 JSON 파일")
    private Path modelsFile;
    @CommandLine.Option(names = "--migrations", description = "마이그레이션 저장 폴더 (기본값: 설정 파일 또는 'migrations')")
    private Path migrationsDir;
    @CommandLine.Option(names = {"-g", "--group"}, description = "마이그레이션 그룹 이름 (기본값: 설정 파일 또는 모델 파일)")
    private String group;
    @CommandLine.Option(names = "--external", description = "다른 그룹의 모델 JSON 파일 (여러 번 지정 가능)")
    private List<Path> externalModelFiles = new ArrayList<>();
    @CommandLine.Option(names = "--profile", description = "사용할 설정 프로파일 (dev, prod, test 등)")
    private String profile;
    @CommandLine.Option(names = "--dry-run", description = "파일을 쓰지 않고 생성될 마이그레이션을 출력합니다.")
    private boolean dryRun;

    private Clock clock = Clock.systemUTC();

    MakeMigrationsCommand withClock(Clock clock) {
        this.clock = clock;
        return this;
    }

    @Override
    public Integer call() {
        try {
            Map<String, String> config = new ConfigurationLoader().loadConfiguration(profile);
            Path directory = migrationsDir != null
                    ? migrationsDir
                    : Path.of(config.get(StrataOptions.Migration.DIRECTORY_KEY));
            MigrationRepository repository = new MigrationRepository(directory);

            ModelSet current = repository.loadModelSet(modelsFile);
            String groupName = resolveGroup(config, current);
            if (groupName == null) {
                System.err.println("No group given. Use --group, set group.name in "
                        + StrataOptions.Profile.CONFIG_FILE + " or add 'group' to the model file.");
                return StrataCli.EXIT_USER_ERROR;
            }

            PlanRequest.PlanRequestBuilder request = PlanRequest.builder()
                    .groupIdentifier(groupName)
                    .currentModels(current.getModels())
                    .migrations(repository.loadAll());
            for (Path external : externalModelFiles) {
                request.externalModels(repository.loadModelSet(external).getModels());
            }

            MigrationNaming naming = new MigrationNaming(config.get(StrataOptions.Migration.PREFIX_KEY), clock);
            var planned = new MigrationPlanner(naming).plan(request.build());
            if (planned.isEmpty()) {
                System.out.println("No changes detected.");
                return StrataCli.EXIT_OK;
            }

            GeneratedMigration migration = planned.get();
            printSummary(migration);
            if (dryRun) {
                System.out.println(repository.toJson(migration));
            } else {
                Path written = repository.save(migration);
                System.out.println("Migration written to " + written);
            }
            return StrataCli.EXIT_OK;

        } catch (MigrationPlanningException e) {
            System.err.println("Unable to plan migration: " + e.getMessage());
            return StrataCli.EXIT_USER_ERROR;
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid input: " + e.getMessage());
            return StrataCli.EXIT_USER_ERROR;
        } catch (IOException e) {
            System.err.println("I/O error: " + e.getMessage());
            return StrataCli.EXIT_FAILURE;
        } catch (Exception e) {
            log.error("Migration planning failed", e);
            System.err.println("Migration planning failed: " + e);
            return StrataCli.EXIT_FAILURE;
        }
    }

    private String resolveGroup(Map<String, String> config, ModelSet current) {
        if (group != null && !group.isBlank()) {
            return group;
        }
        String configured = config.get(StrataOptions.Group.NAME_KEY);
        if (configured != null) {
            return configured;
        }
        return current.getGroup();
    }

    private static void printSummary(GeneratedMigration migration) {
        System.out.println("Migration '" + migration.getGroupIdentifier() + "::"
                + migration.getMigrationIdentifier() + "'");
        for (Operation operation : migration.getOperations()) {
            System.out.println("  " + OperationDescriptions.describe(operation));
        }
        for (Dependency dependency : migration.getDependencies()) {
            System.out.println("  depends on " + dependency);
        }
    }
}
