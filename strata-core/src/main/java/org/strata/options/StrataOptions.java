package org.strata.options;

/**
 * Configuration keys and defaults shared by the CLI and the configuration loader.
 */
public final class StrataOptions {

    private StrataOptions() {
    }

    /**
     * Profile-related settings.
     */
    public static final class Profile {
        private Profile() {}

        /**
         * Default profile name.
         */
        public static final String DEFAULT = "dev";

        /**
         * Profile environment variable name.
         */
        public static final String ENV_VAR = "STRATA_PROFILE";

        /**
         * Configuration file name.
         */
        public static final String CONFIG_FILE = "strata.yaml";
    }

    /**
     * Migration naming and storage.
     */
    public static final class Migration {
        private Migration() {}

        public static final String PREFIX_KEY = "strata.migration.prefix";
        public static final String PREFIX_DEFAULT = "m_";

        public static final String DIRECTORY_KEY = "strata.migration.directory";
        public static final String DIRECTORY_DEFAULT = "migrations";
    }

    /**
     * Model group settings. There is no default group name.
     */
    public static final class Group {
        private Group() {}

        public static final String NAME_KEY = "strata.group.name";
    }
}
