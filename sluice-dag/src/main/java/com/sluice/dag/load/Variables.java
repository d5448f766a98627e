package com.sluice.dag.load;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code ${name}} placeholders in raw pipeline text. Unknown placeholders are left as they are.
 */
public final class Variables {

    private static final Logger log = LoggerFactory.getLogger(Variables.class);
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}");

    private Variables() {
    }

    public static String apply(String text, Map<String, ?> variables) {
        if (text == null || variables == null || variables.isEmpty()) {
            return text;
        }
        Matcher m = PLACEHOLDER.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (m.find()) {
            String name = m.group(1);
            Object value = variables.get(name);
            if (value == null) {
                log.warn("Variable not defined; placeholder kept | name={}", name);
                m.appendReplacement(out, Matcher.quoteReplacement(m.group()));
            } else {
                m.appendReplacement(out, Matcher.quoteReplacement(String.valueOf(value)));
            }
        }
        m.appendTail(out);
        return out.toString();
    }
}
