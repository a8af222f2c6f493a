package com.codesearch.ingest;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Include/exclude rule evaluation against '/'-separated relative paths. Three rule shapes are
 * recognised: {@code dir/**} prunes a subtree, {@code *.ext} is a case-sensitive suffix test, and
 * anything else is a whole-string glob where {@code *}, {@code **} and {@code ?} do not treat '/'
 * specially.
 */
public class PatternMatcher {
    private static final String SUBTREE_SUFFIX = "/**";
    private static final String EXTENSION_PREFIX = "*.";

    private final Map<String, Pattern> globCache = new ConcurrentHashMap<>();

    public boolean matches(String relativePath, String pattern) {
        if (pattern.endsWith(SUBTREE_SUFFIX)) {
            String base = pattern.substring(0, pattern.length() - SUBTREE_SUFFIX.length());
            return relativePath.equals(base) || relativePath.startsWith(base + "/");
        }
        if (pattern.startsWith(EXTENSION_PREFIX)) {
            return relativePath.endsWith(pattern.substring(1));
        }
        return globCache.computeIfAbsent(pattern, PatternMatcher::compileGlob)
                .matcher(relativePath)
                .matches();
    }

    public boolean matchesAny(String relativePath, Iterable<String> patterns) {
        for (String pattern : patterns) {
            if (matches(relativePath, pattern)) {
                return true;
            }
        }
        return false;
    }

    static Pattern compileGlob(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*' || c == '?') {
                flushLiteral(regex, literal);
                if (c == '?') {
                    regex.append('.');
                    i++;
                } else {
                    regex.append(".*");
                    i += glob.startsWith("**", i) ? 2 : 1;
                }
            } else {
                literal.append(c);
                i++;
            }
        }
        flushLiteral(regex, literal);
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private static void flushLiteral(StringBuilder regex, StringBuilder literal) {
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
        }
    }
}
