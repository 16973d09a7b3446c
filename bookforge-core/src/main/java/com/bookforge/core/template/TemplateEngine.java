package com.bookforge.core.template;

import com.bookforge.core.error.RenderException;
import org.apache.commons.text.StringSubstitutor;

import java.nio.charset.CharsetEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Expands {@code {{name}}} placeholders with Apache Commons Text.
 *
 * <p>Values are inserted verbatim: callers escape them for the target format first, and
 * a value that itself contains {@code {{...}}} is never expanded again. Whitespace
 * inside the braces is ignored, so {@code {{ title }}} works too.
 *
 * <p>Expansion fails with a {@link RenderException} when a placeholder has no value or
 * when the result cannot be encoded as UTF-8 (e.g. a lone surrogate).
 */
public class TemplateEngine {

    private static final String PREFIX = "{{";
    private static final String SUFFIX = "}}";
    private static final char NO_ESCAPE = '\u0000';

    /**
     * Expands a template.
     *
     * @param template template text
     * @param variables placeholder values
     * @return expanded text
     * @throws RenderException if a placeholder is undefined or the result is not encodable
     */
    public String expand(String template, Map<String, String> variables) throws RenderException {
        StringSubstitutor substitutor = new StringSubstitutor(key -> variables.get(key.trim()));
        substitutor.setVariablePrefix(PREFIX);
        substitutor.setVariableSuffix(SUFFIX);
        substitutor.setEscapeChar(NO_ESCAPE);
        substitutor.setValueDelimiterMatcher(null);
        substitutor.setDisableSubstitutionInValues(true);
        substitutor.setEnableUndefinedVariableException(true);

        String result;
        try {
            result = substitutor.replace(template);
        } catch (IllegalArgumentException e) {
            throw new RenderException(null, "template expansion failed: " + e.getMessage(), e);
        }

        CharsetEncoder encoder = StandardCharsets.UTF_8.newEncoder();
        if (!encoder.canEncode(result)) {
            throw new RenderException(null, "template expansion produced text that is not valid UTF-8");
        }
        return result;
    }
}
