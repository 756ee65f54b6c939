package ghnotif.domain.filter;

import ghnotif.domain.model.Notification;

import java.util.Locale;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Matches a regular expression against one field. Unknown field names search the title.
 */
public record RegexFilter(String field, Pattern pattern) implements Filter {
    public RegexFilter {
        checkNotNull(field, "field must not be null");
        checkNotNull(pattern, "pattern must not be null");
    }

    @Override
    public boolean apply(final Notification notification) {
        return pattern.matcher(fieldValue(notification)).find();
    }

    private String fieldValue(final Notification notification) {
        return switch (field.toLowerCase(Locale.ROOT)) {
            case "repository", "repo" -> notification.getRepository();
            case "type" -> notification.getType();
            case "reason" -> notification.getReasonName();
            default -> notification.getTitle();
        };
    }

    @Override
    public String describe() {
        return field + ":/" + pattern.pattern() + "/";
    }
}
