package ghnotif.domain.filter;

import ghnotif.domain.exceptions.FilterParseFailure;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class GlobPatternTest {
    @Test
    public void testStarMatchesAcrossSlashes() {
        Assertions.assertTrue(GlobPattern.compile("*").matches("octo/alpha"));
        Assertions.assertTrue(GlobPattern.compile("octo*").matches("octo/alpha"));
        Assertions.assertTrue(GlobPattern.compile("*/alpha").matches("octo/alpha"));
        Assertions.assertFalse(GlobPattern.compile("*/beta").matches("octo/alpha"));
    }

    @Test
    public void testWholeInputMustMatch() {
        Assertions.assertFalse(GlobPattern.compile("octo").matches("octo/alpha"));
        Assertions.assertTrue(GlobPattern.compile("octo/alpha").matches("octo/alpha"));
    }

    @Test
    public void testQuestionMark() {
        Assertions.assertTrue(GlobPattern.compile("oct?/alpha").matches("octo/alpha"));
        Assertions.assertFalse(GlobPattern.compile("oct?/alpha").matches("oct/alpha"));
    }

    @Test
    public void testCharacterClasses() {
        Assertions.assertTrue(GlobPattern.compile("[ab]cme").matches("acme"));
        Assertions.assertTrue(GlobPattern.compile("[a-c]cme").matches("bcme"));
        Assertions.assertFalse(GlobPattern.compile("[!a]cme").matches("acme"));
        Assertions.assertTrue(GlobPattern.compile("[!a]cme").matches("xcme"));
    }

    @Test
    public void testAlternatives() {
        final GlobPattern pattern = GlobPattern.compile("{octo,acme}/*");
        Assertions.assertTrue(pattern.matches("octo/alpha"));
        Assertions.assertTrue(pattern.matches("acme/widgets"));
        Assertions.assertFalse(pattern.matches("other/alpha"));
    }

    @Test
    public void testRegexCharactersAreLiteral() {
        Assertions.assertTrue(GlobPattern.compile("a.b+c").matches("a.b+c"));
        Assertions.assertFalse(GlobPattern.compile("a.b+c").matches("axbbc"));
        Assertions.assertTrue(GlobPattern.compile("a\\*").matches("a*"));
        Assertions.assertFalse(GlobPattern.compile("a\\*").matches("ab"));
    }

    @Test
    public void testMatchingIsCaseSensitive() {
        Assertions.assertFalse(GlobPattern.compile("Octo/*").matches("octo/alpha"));
    }

    @Test
    public void testMalformedGlobs() {
        final FilterParseFailure unterminatedClass = Assertions.assertThrows(
                FilterParseFailure.class, () -> GlobPattern.compile("[abc"));
        Assertions.assertEquals("[abc", unterminatedClass.getFragment());

        Assertions.assertThrows(FilterParseFailure.class, () -> GlobPattern.compile("{a,b"));
        Assertions.assertThrows(FilterParseFailure.class, () -> GlobPattern.compile("abc\\"));
    }
}
