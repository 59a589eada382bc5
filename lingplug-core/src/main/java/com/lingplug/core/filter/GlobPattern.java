package com.lingplug.core.filter;

import java.util.regex.Pattern;

/**
 * shell 风格的通配符：{@code *} {@code ?} {@code [seq]} {@code [!seq]}
 */
public final class GlobPattern {

    private final String glob;
    private final Pattern regex;

    private GlobPattern(String glob) {
        this.glob = glob;
        this.regex = Pattern.compile(toRegex(glob), Pattern.DOTALL);
    }

    public static GlobPattern compile(String glob) {
        if (glob == null) {
            throw new IllegalArgumentException("glob must not be null");
        }
        return new GlobPattern(glob);
    }

    public boolean matches(String value) {
        return value != null && regex.matcher(value).matches();
    }

    public String getGlob() {
        return glob;
    }

    static String toRegex(String glob) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        int n = glob.length();
        while (i < n) {
            char c = glob.charAt(i++);
            if (c == '*') {
                sb.append(".*");
            } else if (c == '?') {
                sb.append('.');
            } else if (c == '[') {
                int j = i;
                if (j < n && glob.charAt(j) == '!') {
                    j++;
                }
                if (j < n && glob.charAt(j) == ']') {
                    j++;
                }
                while (j < n && glob.charAt(j) != ']') {
                    j++;
                }
                if (j >= n) {
                    // 没有闭合，按字面量处理
                    sb.append("\\[");
                } else {
                    String body = glob.substring(i, j);
                    i = j + 1;
                    sb.append('[');
                    if (body.startsWith("!")) {
                        sb.append('^');
                        body = body.substring(1);
                    } else if (body.startsWith("^")) {
                        sb.append('\\');
                    }
                    sb.append(body.replace("\\", "\\\\").replace("[", "\\[").replace("&&", "\\&\\&"));
                    sb.append(']');
                }
            } else {
                sb.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return glob;
    }
}
