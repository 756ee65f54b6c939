package ghnotif.domain.model;

import org.jspecify.annotations.Nullable;

import java.util.Arrays;

/**
 * The kind of thing a notification is about, as named by the remote API.
 */
public enum SubjectType {
    PULL_REQUEST("PullRequest"),
    ISSUE("Issue"),
    DISCUSSION("Discussion"),
    RELEASE("Release"),
    COMMIT("Commit"),
    OTHER("");

    private final String apiName;

    SubjectType(final String apiName) {
        this.apiName = apiName;
    }

    public String getApiName() {
        return apiName;
    }

    /**
     * Maps the raw API value onto a known type. The match is exact, because the API is consistent about casing.
     */
    public static SubjectType fromApiName(@Nullable final String apiName) {
        return Arrays.stream(values())
                .filter(type -> type != OTHER)
                .filter(type -> type.apiName.equals(apiName))
                .findFirst()
                .orElse(OTHER);
    }
}
