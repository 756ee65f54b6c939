package ghnotif.domain.filter;

import ghnotif.domain.model.Notification;
import org.apache.commons.lang3.StringUtils;

import java.util.stream.Stream;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A case-insensitive substring search over the title, repository, type and reason.
 */
public record TextFilter(String text) implements Filter {
    public TextFilter {
        checkNotNull(text, "text must not be null");
    }

    @Override
    public boolean apply(final Notification notification) {
        return Stream.of(
                        notification.getTitle(),
                        notification.getRepository(),
                        notification.getType(),
                        notification.getReasonName())
                .anyMatch(field -> StringUtils.containsIgnoreCase(field, text));
    }

    @Override
    public String describe() {
        return "\"" + text + "\"";
    }
}
