package org.strata.cli;

import org.strata.config.ConfigurationLoader;
import org.strata.migration.MigrationPlanningException;
import org.strata.migration.repository.MigrationRepository;
import org.strata.migration.sorter.MigrationSorter;
import org.strata.model.MigrationRecord;
import org.strata.options.StrataOptions;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Lists stored migrations of all groups in the order they have to be applied.
 */
@CommandLine.Command(
        name = "show-migrations",
        mixinStandardHelpOptions = true,
        description = "저장된 마이그레이션을 적용 순서대로 출력합니다."
)
public class ShowMigrationsCommand implements Callable<Integer> {

    @CommandLine.Option(names = "--migrations", description = "마이그레이션 저장 폴더 (기본값: 설정 파일 또는 'migrations')")
    private Path migrationsDir;
    @CommandLine.Option(names = "--profile", description = "사용할 설정 프로파일")
    private String profile;

    @Override
    public Integer call() {
        try {
            Path directory = migrationsDir;
            if (directory == null) {
                Map<String, String> config = new ConfigurationLoader().loadConfiguration(profile);
                directory = Path.of(config.get(StrataOptions.Migration.DIRECTORY_KEY));
            }

            List<MigrationRecord> ordered = new MigrationSorter().sort(new MigrationRepository(directory).loadAll());
            if (ordered.isEmpty()) {
                System.out.println("No migrations found in " + directory);
                return StrataCli.EXIT_OK;
            }
            for (MigrationRecord migration : ordered) {
                System.out.printf("%s::%s (%d operations)%n", migration.getGroupIdentifier(),
                        migration.getMigrationIdentifier(), migration.getOperations().size());
            }
            return StrataCli.EXIT_OK;

        } catch (MigrationPlanningException e) {
            System.err.println("Unable to order migrations: " + e.getMessage());
            return StrataCli.EXIT_USER_ERROR;
        } catch (IOException e) {
            System.err.println("I/O error: " + e.getMessage());
            return StrataCli.EXIT_FAILURE;
        }
    }
}
