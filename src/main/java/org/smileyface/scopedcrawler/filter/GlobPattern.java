package org.smileyface.scopedcrawler.filter;

import org.smileyface.scopedcrawler.config.ConfigurationException;

import java.util.regex.Pattern;

/**
 * A case-sensitive glob anchored against the whole input string.
 * <ul>
 *   <li>{@code *} matches any run of characters, including {@code /}</li>
 *   <li>{@code ?} matches exactly one character</li>
 *   <li>{@code [abc]}, {@code [a-z]} and {@code [!abc]} are character classes</li>
 * </ul>
 * Every other character matches itself.
 */
public final class GlobPattern {

    private final String glob;
    private final Pattern regex;

    private GlobPattern(String glob, Pattern regex) {
        this.glob = glob;
        this.regex = regex;
    }

    /**
     * @throws ConfigurationException if the glob is blank or has an unterminated or empty class
     */
    public static GlobPattern compile(String glob) {
        if (glob == null || glob.isBlank()) {
            throw new ConfigurationException("URL pattern must not be blank");
        }
        StringBuilder sb = new StringBuilder(glob.length() + 8);
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            switch (c) {
                case '*' -> sb.append(".*");
                case '?' -> sb.append('.');
                case '[' -> i = appendClass(glob, i, sb);
                default -> appendLiteral(c, sb);
            }
            i++;
        }
        return new GlobPattern(glob, Pattern.compile(sb.toString(), Pattern.DOTALL));
    }

    public boolean matches(String input) {
        return input != null && regex.matcher(input).matches();
    }

    public String getGlob() {
        return glob;
    }

    @Override
    public String toString() {
        return glob;
    }

    /**
     * Translates the class starting at {@code start} and returns the index of its closing bracket.
     */
    private static int appendClass(String glob, int start, StringBuilder sb) {
        int i = start + 1;
        boolean negated = i < glob.length() && glob.charAt(i) == '!';
        if (negated) i++;
        int close = glob.indexOf(']', i);
        if (close < 0) {
            throw new ConfigurationException("Unterminated character class in URL pattern: " + glob);
        }
        if (close == i) {
            throw new ConfigurationException("Empty character class in URL pattern: " + glob);
        }
        sb.append('[');
        if (negated) sb.append('^');
        for (int j = i; j < close; j++) {
            char c = glob.charAt(j);
            if (c == '\\' || c == '[' || c == '&' || c == '^') sb.append('\\');
            sb.append(c);
        }
        sb.append(']');
        return close;
    }

    private static void appendLiteral(char c, StringBuilder sb) {
        if (!Character.isLetterOrDigit(c)) sb.append('\\');
        sb.append(c);
    }
}
