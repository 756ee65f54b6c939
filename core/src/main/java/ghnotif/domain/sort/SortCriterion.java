package ghnotif.domain.sort;

import ghnotif.domain.exceptions.ConfigurationFailure;
import ghnotif.domain.model.Notification;
import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One link in a sort chain.
 */
public record SortCriterion(SortField field, SortDirection direction) {
    public SortCriterion {
        checkNotNull(field, "field must not be null");
        checkNotNull(direction, "direction must not be null");
    }

    public Comparator<Notification> comparator() {
        return field.comparator(direction);
    }

    /**
     * Parses the textual form used in settings, such as "time:desc" or "repository". The direction defaults
     * to ascending.
     */
    public static SortCriterion parse(final String text) {
        final String[] parts = StringUtils.trimToEmpty(text).split(":", 2);

        final SortField field = Arrays.stream(SortField.values())
                .filter(value -> value.name().equalsIgnoreCase(parts[0].trim()))
                .findFirst()
                .orElseThrow(() -> new ConfigurationFailure("Unknown sort field in " + text
                        + ", expected one of repository, type, title, time, status or reason"));

        if (parts.length == 1) {
            return new SortCriterion(field, SortDirection.ASCENDING);
        }

        return switch (parts[1].trim().toLowerCase(Locale.ROOT)) {
            case "asc", "ascending" -> new SortCriterion(field, SortDirection.ASCENDING);
            case "desc", "descending" -> new SortCriterion(field, SortDirection.DESCENDING);
            default -> throw new ConfigurationFailure("Unknown sort direction in " + text + ", expected asc or desc");
        };
    }

    /**
     * Parses a comma separated list of criteria. A blank string is an empty list.
     */
    public static List<SortCriterion> parseList(final String text) {
        if (StringUtils.isBlank(text)) {
            return List.of();
        }

        return Arrays.stream(text.split(","))
                .filter(StringUtils::isNotBlank)
                .map(SortCriterion::parse)
                .toList();
    }

    @Override
    public String toString() {
        return field.name().toLowerCase(Locale.ROOT) + ":" + (direction == SortDirection.ASCENDING ? "asc" : "desc");
    }
}
