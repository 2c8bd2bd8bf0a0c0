package org.strata.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.strata.options.StrataOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

@Slf4j
public class ConfigurationLoader {

    private static final String CONFIG_FILE_NAME = StrataOptions.Profile.CONFIG_FILE;
    private static final String DEFAULT_PROFILE = StrataOptions.Profile.DEFAULT;
    private static final String PROFILE_ENV_VAR = StrataOptions.Profile.ENV_VAR;

    private final ObjectMapper yamlMapper;
    private final Path startDirectory;
    private final Function<String, String> environment;

    public ConfigurationLoader() {
        this(Paths.get("").toAbsolutePath());
    }

    public ConfigurationLoader(Path startDirectory) {
        this(startDirectory, System::getenv);
    }

    ConfigurationLoader(Path startDirectory, Function<String, String> environment) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.startDirectory = startDirectory;
        this.environment = environment;
    }

    /**
     * 설정을 로드하고 지정된 프로파일을 적용
     *
     * 우선순위: CLI 프로파일 > 환경변수 > 기본값(dev)
     *
     * @param cliProfile CLI에서 지정된 프로파일 (null 가능)
     * @return 해석된 설정 맵
     */
    public Map<String, String> loadConfiguration(String cliProfile) {
        String activeProfile = resolveActiveProfile(cliProfile);

        Optional<StrataConfiguration> config = findAndLoadConfiguration();
        if (config.isEmpty()) {
            // 설정 파일이 없으면 기본값 사용
            return createDefaultConfiguration();
        }

        return extractConfigurationForProfile(config.get(), activeProfile);
    }

    /**
     * 활성 프로파일을 결정합니다.
     */
    String resolveActiveProfile(String cliProfile) {
        if (cliProfile != null && !cliProfile.trim().isEmpty()) {
            return cliProfile;
        }

        String envProfile = environment.apply(PROFILE_ENV_VAR);
        if (envProfile != null && !envProfile.trim().isEmpty()) {
            return envProfile;
        }

        return DEFAULT_PROFILE;
    }

    /**
     * 시작 디렉토리부터 상위 디렉토리로 올라가며 strata.yaml을 찾습니다.
     */
    private Optional<StrataConfiguration> findAndLoadConfiguration() {
        Path currentDir = startDirectory;

        while (currentDir != null) {
            Path configFile = currentDir.resolve(CONFIG_FILE_NAME);
            if (Files.exists(configFile)) {
                try {
                    return Optional.of(yamlMapper.readValue(configFile.toFile(), StrataConfiguration.class));
                } catch (IOException e) {
                    log.warn("Failed to parse {}: {}", configFile, e.getMessage());
                    return Optional.empty();
                }
            }
            currentDir = currentDir.getParent();
        }

        return Optional.empty();
    }

    private Map<String, String> extractConfigurationForProfile(StrataConfiguration config, String profile) {
        var profileConfig = config.getProfiles().get(profile);
        if (profileConfig == null) {
            log.warn("Profile '{}' not found in configuration. Using defaults.", profile);
            return createDefaultConfiguration();
        }

        var configMap = new HashMap<>(createDefaultConfiguration());

        var migration = profileConfig.getMigration();
        if (migration != null) {
            putIfPresent(configMap, StrataOptions.Migration.PREFIX_KEY, migration.getPrefix());
            putIfPresent(configMap, StrataOptions.Migration.DIRECTORY_KEY, migration.getDirectory());
        }
        if (profileConfig.getGroup() != null) {
            putIfPresent(configMap, StrataOptions.Group.NAME_KEY, profileConfig.getGroup().getName());
        }

        return configMap;
    }

    private static void putIfPresent(Map<String, String> configMap, String key, String value) {
        if (value != null && !value.isBlank()) {
            configMap.put(key, value.trim());
        }
    }

    private Map<String, String> createDefaultConfiguration() {
        return Map.of(
            StrataOptions.Migration.PREFIX_KEY, StrataOptions.Migration.PREFIX_DEFAULT,
            StrataOptions.Migration.DIRECTORY_KEY, StrataOptions.Migration.DIRECTORY_DEFAULT
        );
    }
}
