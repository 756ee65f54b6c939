package ghnotif.domain.filter;

import ghnotif.domain.exceptions.FilterParseFailure;

import java.util.Objects;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A compiled glob. Supports {@code *}, {@code ?}, character classes ({@code [abc]}, {@code [a-z]},
 * {@code [!abc]}), alternatives ({@code {a,b}}) and backslash escapes. There is no path separator, so
 * {@code *} also matches "/". Matching is case-sensitive and covers the whole input.
 */
public final class GlobPattern {
    private final String glob;
    private final Pattern pattern;

    private GlobPattern(final String glob, final Pattern pattern) {
        this.glob = glob;
        this.pattern = pattern;
    }

    public static GlobPattern compile(final String glob) {
        checkNotNull(glob, "glob must not be null");
        return new GlobPattern(glob, Pattern.compile(toRegex(glob), Pattern.DOTALL));
    }

    public String glob() {
        return glob;
    }

    public boolean matches(final String input) {
        return pattern.matcher(input).matches();
    }

    private static String toRegex(final String glob) {
        final StringBuilder regex = new StringBuilder(glob.length() * 2);
        int alternatives = 0;

        for (int i = 0; i < glob.length(); i++) {
            final char c = glob.charAt(i);
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                case '\\' -> {
                    if (i + 1 >= glob.length()) {
                        throw new FilterParseFailure("Glob ends with an escape", glob);
                    }
                    regex.append(Pattern.quote(String.valueOf(glob.charAt(++i))));
                }
                case '[' -> i = appendCharacterClass(glob, i, regex);
                case '{' -> {
                    alternatives++;
                    regex.append("(?:");
                }
                case '}' -> {
                    if (alternatives == 0) {
                        regex.append("\\}");
                    } else {
                        alternatives--;
                        regex.append(')');
                    }
                }
                case ',' -> regex.append(alternatives > 0 ? "|" : ",");
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }

        if (alternatives != 0) {
            throw new FilterParseFailure("Glob has an unterminated alternative", glob);
        }

        return regex.toString();
    }

    /**
     * Appends the character class starting at {@code start} and returns the index of its closing bracket.
     */
    private static int appendCharacterClass(final String glob, final int start, final StringBuilder regex) {
        int i = start + 1;
        regex.append('[');

        if (i < glob.length() && glob.charAt(i) == '!') {
            regex.append('^');
            i++;
        }

        boolean empty = true;
        for (; i < glob.length(); i++) {
            final char c = glob.charAt(i);
            if (c == ']' && !empty) {
                regex.append(']');
                return i;
            }

            empty = false;
            if (c == '-') {
                regex.append('-');
            } else if (c == '\\' && i + 1 < glob.length()) {
                regex.append('\\').append(glob.charAt(++i));
            } else if (Character.isLetterOrDigit(c)) {
                regex.append(c);
            } else {
                regex.append('\\').append(c);
            }
        }

        throw new FilterParseFailure("Glob has an unterminated character class", glob);
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof GlobPattern other && glob.equals(other.glob);
    }

    @Override
    public int hashCode() {
        return Objects.hash(glob);
    }

    @Override
    public String toString() {
        return glob;
    }
}
