// file: core/src/main/java/io/fastlist/core/KeyFilters.java
package io.fastlist.core;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles filter expressions into {@link KeyFilter}s.
 * <p>
 * Supported forms:
 *   prefix:&lt;p&gt;   key starts with p
 *   glob:&lt;g&gt;     whole key matches glob g ('*' any run without '/', '**' any run, '?' one char)
 *   regex:&lt;r&gt;    regex r found anywhere in the key
 *   &lt;r&gt;          same as regex:&lt;r&gt;
 * <p>
 * A null or blank expression yields {@link KeyFilter#ALL}.
 */
public final class KeyFilters {

    private KeyFilters() {
        // utility
    }

    public static KeyFilter compile(String expression) {
        if (expression == null || expression.isBlank()) {
            return KeyFilter.ALL;
        }
        if (expression.startsWith("prefix:")) {
            String p = expression.substring("prefix:".length());
            return key -> key.startsWith(p);
        }
        if (expression.startsWith("glob:")) {
            Pattern pattern = compilePattern(globToRegex(expression.substring("glob:".length())), expression);
            return key -> pattern.matcher(key).matches();
        }
        String regex = expression.startsWith("regex:")
                ? expression.substring("regex:".length())
                : expression;
        Pattern pattern = compilePattern(regex, expression);
        return key -> pattern.matcher(key).find();
    }

    static String globToRegex(String glob) {
        StringBuilder sb = new StringBuilder(glob.length() * 2);
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            switch (c) {
                case '*' -> {
                    if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                        sb.append(".*");
                        i++;
                    } else {
                        sb.append("[^/]*");
                    }
                }
                case '?' -> sb.append("[^/]");
                default -> {
                    if ("\\.[]{}()+-^$|".indexOf(c) >= 0) {
                        sb.append('\\');
                    }
                    sb.append(c);
                }
            }
        }
        return sb.toString();
    }

    private static Pattern compilePattern(String regex, String expression) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("invalid filter expression: " + expression, e);
        }
    }
}
