package com.bookforge.core.template;

import org.apache.commons.text.StringEscapeUtils;

import java.util.function.UnaryOperator;

/**
 * Per-format text escaping.
 *
 * <p>Applied to leaf text and interpolated metadata only, never to markup the
 * renderers emit themselves.
 */
public enum Escaper implements UnaryOperator<String> {

    /** XML 1.0 entity escaping for HTML, XHTML and ODF content. */
    XML {
        @Override
        public String apply(String text) {
            return StringEscapeUtils.escapeXml10(text);
        }
    },

    /** LaTeX special characters; U+00A0 becomes {@code ~} and U+202F a thin space. */
    LATEX {
        @Override
        public String apply(String text) {
            StringBuilder sb = new StringBuilder(text.length() + 16);
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                switch (c) {
                    case '\\' -> sb.append("\\textbackslash{}");
                    case '{' -> sb.append("\\{");
                    case '}' -> sb.append("\\}");
                    case '%' -> sb.append("\\%");
                    case '_' -> sb.append("\\_");
                    case '&' -> sb.append("\\&");
                    case '#' -> sb.append("\\#");
                    case '$' -> sb.append("\\$");
                    case '~' -> sb.append("\\textasciitilde{}");
                    case '^' -> sb.append("\\textasciicircum{}");
                    case '\u00A0' -> sb.append('~');
                    case '\u202F' -> sb.append("\\,");
                    default -> sb.append(c);
                }
            }
            return sb.toString();
        }
    }
}
