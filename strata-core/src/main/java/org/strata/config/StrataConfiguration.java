package org.strata.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

@Data
public class StrataConfiguration {

    /**
     * 프로파일별 설정 맵
     */
    @JsonProperty("profiles")
    private Map<String, ProfileConfiguration> profiles = new HashMap<>();

    /**
     * 개별 프로파일 설정
     */
    @Data
    public static class ProfileConfiguration {

        @JsonProperty("migration")
        private MigrationConfiguration migration;

        @JsonProperty("group")
        private GroupConfiguration group;
    }

    /**
     * 마이그레이션 이름/저장 위치 설정
     */
    @Data
    public static class MigrationConfiguration {

        @JsonProperty("prefix")
        private String prefix;

        @JsonProperty("directory")
        private String directory;
    }

    @Data
    public static class GroupConfiguration {

        @JsonProperty("name")
        private String name;
    }
}
