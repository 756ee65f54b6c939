package ghnotif.domain.filter.parser;

import ghnotif.domain.exceptions.FilterParseFailure;
import ghnotif.domain.exceptions.FilterReferenceFailure;
import ghnotif.domain.filter.AndFilter;
import ghnotif.domain.filter.Filter;
import ghnotif.domain.filter.GlobPattern;
import ghnotif.domain.filter.MatchAllFilter;
import ghnotif.domain.filter.NotFilter;
import ghnotif.domain.filter.OrFilter;
import ghnotif.domain.filter.OrganizationFilter;
import ghnotif.domain.filter.ReadStateFilter;
import ghnotif.domain.filter.ReasonFilter;
import ghnotif.domain.filter.RegexFilter;
import ghnotif.domain.filter.RepositoryFilter;
import ghnotif.domain.filter.ScoreRangeFilter;
import ghnotif.domain.filter.TextFilter;
import ghnotif.domain.filter.TimeWindowFilter;
import ghnotif.domain.filter.TypeFilter;
import ghnotif.domain.filter.store.NamedFilterStore;
import ghnotif.domain.scoring.Scorer;
import io.vavr.API;
import io.vavr.control.Try;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Turns a query such as {@code is:unread AND (type:PullRequest OR reason:mention)} into a {@link Filter}.
 * <p>
 * Operators are NOT, AND and OR, in decreasing order of precedence. NOT is a right associative prefix
 * operator, AND and OR are left associative. A word of the form {@code key:value} is a field filter,
 * {@code @name} is a reference to a saved filter, and any other word is a text search. An empty query
 * matches everything.
 */
public class FilterParser {
    private static final Pattern RELATIVE_DURATION = Pattern.compile("(\\d+)([smhdw])");

    private final NamedFilterStore store;
    @Nullable
    private final Scorer scorer;
    private final Clock clock;

    public FilterParser(final NamedFilterStore store, @Nullable final Scorer scorer) {
        this(store, scorer, Clock.systemUTC());
    }

    public FilterParser(final NamedFilterStore store, @Nullable final Scorer scorer, final Clock clock) {
        this.store = checkNotNull(store, "store must not be null");
        this.scorer = scorer;
        this.clock = checkNotNull(clock, "clock must not be null");
    }

    /**
     * @throws FilterParseFailure     if the query is malformed
     * @throws FilterReferenceFailure if a referenced filter does not exist or refers back to itself
     */
    public Filter parse(final String query) {
        return parse(query, new LinkedHashSet<>());
    }

    private Filter parse(final String query, final Set<String> resolving) {
        final String trimmed = StringUtils.trimToEmpty(query);
        if (trimmed.isEmpty()) {
            return new MatchAllFilter();
        }

        return parseTokens(FilterTokenizer.tokenize(trimmed), resolving, trimmed);
    }

    /**
     * The shunting-yard algorithm, reducing operators onto a stack of filters as they are popped.
     */
    private Filter parseTokens(final List<Token> tokens, final Set<String> resolving, final String query) {
        final Deque<Filter> output = new ArrayDeque<>();
        final Deque<Token> operators = new ArrayDeque<>();

        for (final Token token : tokens) {
            switch (token.type()) {
                case OPERAND -> output.push(parseLeaf(token.text(), resolving));
                case LEFT_PAREN -> operators.push(token);
                case RIGHT_PAREN -> {
                    while (!operators.isEmpty() && operators.peek().type() != TokenType.LEFT_PAREN) {
                        reduce(operators.pop(), output);
                    }
                    if (operators.isEmpty()) {
                        throw new FilterParseFailure("Mismatched parentheses", query);
                    }
                    operators.pop();
                }
                case NOT -> operators.push(token);
                case AND, OR -> {
                    while (!operators.isEmpty()
                            && operators.peek().type().isOperator()
                            && operators.peek().type().getPrecedence() >= token.type().getPrecedence()) {
                        reduce(operators.pop(), output);
                    }
                    operators.push(token);
                }
            }
        }

        while (!operators.isEmpty()) {
            final Token operator = operators.pop();
            if (operator.type() == TokenType.LEFT_PAREN) {
                throw new FilterParseFailure("Mismatched parentheses", query);
            }
            reduce(operator, output);
        }

        if (output.size() != 1) {
            throw new FilterParseFailure("Invalid expression", query);
        }

        return output.pop();
    }

    private static void reduce(final Token operator, final Deque<Filter> output) {
        if (operator.type() == TokenType.NOT) {
            if (output.isEmpty()) {
                throw new FilterParseFailure("Not enough operands for NOT", operator.text());
            }
            output.push(new NotFilter(output.pop()));
            return;
        }

        if (output.size() < 2) {
            throw new FilterParseFailure("Not enough operands for " + operator.text(), operator.text());
        }

        final Filter right = output.pop();
        final Filter left = output.pop();
        output.push(operator.type() == TokenType.AND
                ? AndFilter.of(left, right)
                : OrFilter.of(left, right));
    }

    private Filter parseLeaf(final String word, final Set<String> resolving) {
        if (word.startsWith("@")) {
            return resolve(word.substring(1), resolving);
        }

        if (!word.contains(":")) {
            return new TextFilter(word);
        }

        final String key = StringUtils.substringBefore(word, ":").toLowerCase(Locale.ROOT);
        final String value = StringUtils.substringAfter(word, ":");

        return switch (key) {
            case "is" -> parseReadState(value, word);
            case "repo", "repository" -> new RepositoryFilter(GlobPattern.compile(value));
            case "org", "organization" -> new OrganizationFilter(GlobPattern.compile(value));
            case "type" -> parseTypes(value, word);
            case "reason" -> new ReasonFilter(requireValue(value, word));
            case "updated", "since" -> parseTime(value, word);
            case "score" -> parseScore(value, word);
            default -> parseRegex(key, value);
        };
    }

    private Filter resolve(final String name, final Set<String> resolving) {
        if (resolving.contains(name)) {
            throw new FilterReferenceFailure(name, "Filter reference cycle: "
                    + String.join(" -> ", resolving) + " -> " + name);
        }

        resolving.add(name);
        try {
            return parse(store.lookup(name), resolving);
        } finally {
            resolving.remove(name);
        }
    }

    private static Filter parseReadState(final String value, final String word) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "read" -> new ReadStateFilter(false);
            case "unread" -> new ReadStateFilter(true);
            default -> throw new FilterParseFailure("Unknown is: value, expected read or unread", word);
        };
    }

    private static Filter parseTypes(final String value, final String word) {
        final List<String> types = Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(StringUtils::isNotEmpty)
                .toList();

        if (types.isEmpty()) {
            throw new FilterParseFailure("Missing type", word);
        }

        return new TypeFilter(types);
    }

    private static String requireValue(final String value, final String word) {
        if (value.isEmpty()) {
            throw new FilterParseFailure("Missing value", word);
        }
        return value;
    }

    /**
     * {@code >7d} means updated within the last seven days, {@code <7d} means updated more than seven days ago,
     * and an RFC 3339 timestamp means updated within the 24 hours starting at that time.
     */
    private Filter parseTime(final String value, final String word) {
        if (value.startsWith(">")) {
            return new TimeWindowFilter(relativeInstant(value.substring(1), word), null);
        }

        if (value.startsWith("<")) {
            return new TimeWindowFilter(null, relativeInstant(value.substring(1), word));
        }

        final Instant start = Try.of(() -> OffsetDateTime.parse(value).toInstant())
                .mapFailure(API.Case(API.$(), ex -> new FilterParseFailure("Invalid time", word, ex)))
                .get();

        return new TimeWindowFilter(start, start.plus(Duration.ofHours(24)));
    }

    /**
     * Returns the instant the duration lies before now. Durations too large to represent are parse errors.
     */
    private Instant relativeInstant(final String value, final String word) {
        final Duration duration = parseDuration(value, word);
        return Try.of(() -> clock.instant().minus(duration))
                .mapFailure(API.Case(API.$(), ex -> new FilterParseFailure("Invalid duration", word, ex)))
                .get();
    }

    private static Duration parseDuration(final String value, final String word) {
        final Matcher matcher = RELATIVE_DURATION.matcher(value);
        if (!matcher.matches()) {
            throw new FilterParseFailure("Invalid duration, expected a number followed by s, m, h, d or w", word);
        }

        final long amount = NumberUtils.toLong(matcher.group(1), -1);
        if (amount < 0) {
            throw new FilterParseFailure("Invalid duration", word);
        }

        return Try.of(() -> switch (matcher.group(2)) {
                    case "s" -> Duration.ofSeconds(amount);
                    case "m" -> Duration.ofMinutes(amount);
                    case "h" -> Duration.ofHours(amount);
                    case "d" -> Duration.ofDays(amount);
                    default -> Duration.ofDays(Math.multiplyExact(amount, 7L));
                })
                .mapFailure(API.Case(API.$(), ex -> new FilterParseFailure("Invalid duration", word, ex)))
                .get();
    }

    private Filter parseScore(final String value, final String word) {
        if (scorer == null) {
            throw new FilterParseFailure("Score filters need a scorer", word);
        }

        if (value.startsWith(">")) {
            return new ScoreRangeFilter(parseScoreValue(value.substring(1), word), 0, scorer);
        }

        if (value.startsWith("<")) {
            return new ScoreRangeFilter(0, parseScoreValue(value.substring(1), word), scorer);
        }

        final int score = parseScoreValue(value, word);
        return new ScoreRangeFilter(score, score, scorer);
    }

    private static int parseScoreValue(final String value, final String word) {
        if (!NumberUtils.isDigits(value) || value.length() > 9) {
            throw new FilterParseFailure("Invalid score", word);
        }
        return Integer.parseInt(value);
    }

    private static Filter parseRegex(final String field, final String pattern) {
        return Try.of(() -> Pattern.compile(pattern))
                .map(compiled -> (Filter) new RegexFilter(field, compiled))
                .mapFailure(API.Case(API.$(), ex -> new FilterParseFailure("Invalid regular expression", pattern, ex)))
                .get();
    }
}
