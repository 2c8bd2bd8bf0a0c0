package org.strata.migration;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Generates migration identifiers: {@code <prefix>0001_initial} for the first migration of a
 * group, {@code <prefix><NNNN>_auto_<yyyyMMdd_HHmmss>} (UTC) afterwards.
 */
public class MigrationNaming {

    public static final String DEFAULT_PREFIX = "m_";

    private static final Pattern PREFIX_PATTERN = Pattern.compile("[A-Za-z][A-Za-z0-9]*_");
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final String prefix;
    private final Clock clock;

    public MigrationNaming() {
        this(DEFAULT_PREFIX, Clock.systemUTC());
    }

    public MigrationNaming(String prefix, Clock clock) {
        Objects.requireNonNull(prefix, "prefix must not be null");
        // 번호는 '_' 기준 두 번째 토큰에서 읽으므로 prefix 안에 '_'가 하나만 있어야 함
        if (!PREFIX_PATTERN.matcher(prefix).matches()) {
            throw new IllegalArgumentException("Migration prefix must look like 'm_', got '" + prefix + "'");
        }
        this.prefix = prefix;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public String getPrefix() {
        return prefix;
    }

    public String initial() {
        return String.format("%s%04d_initial", prefix, 1);
    }

    public String next(String previousIdentifier) {
        int number = sequenceNumber(previousIdentifier) + 1;
        String timestamp = ZonedDateTime.now(clock).withZoneSameInstant(ZoneOffset.UTC).format(TIMESTAMP);
        return String.format("%s%04d_auto_%s", prefix, number, timestamp);
    }

    /**
     * Reads the number out of the second {@code _}-separated segment of an identifier.
     *
     * @throws InvalidMigrationNameException if there is no such segment or it is not a number
     */
    public static int sequenceNumber(String migrationIdentifier) {
        String[] segments = migrationIdentifier.split("_");
        if (segments.length < 2) {
            throw new InvalidMigrationNameException(migrationIdentifier, "migration number not found");
        }
        try {
            int number = Integer.parseInt(segments[1]);
            if (number < 0) {
                throw new InvalidMigrationNameException(migrationIdentifier, "negative migration number");
            }
            return number;
        } catch (NumberFormatException e) {
            throw new InvalidMigrationNameException(migrationIdentifier, e);
        }
    }
}
