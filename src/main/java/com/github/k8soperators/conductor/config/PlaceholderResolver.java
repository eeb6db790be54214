package com.github.k8soperators.conductor.config;

import org.jboss.logging.Logger;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands <code>${VAR}</code> and <code>${VAR:default}</code> in plan and manifest text. A doubled dollar sign
 * escapes the placeholder and is written out as a single one.
 */
public class PlaceholderResolver {

    private static final Logger log = Logger.getLogger(PlaceholderResolver.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$?\\$\\{([A-Za-z_][A-Za-z0-9_]*)(?::([^}]*))?\\}");

    private final Environment environment;

    public PlaceholderResolver(Environment environment) {
        this.environment = environment;
    }

    /**
     * @param source where the text comes from, used in error messages
     * @throws ConfigurationException listing every variable that is unset and has no default
     */
    public String resolve(String text, String source) throws ConfigurationException {
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder result = new StringBuilder();
        Set<String> missing = new LinkedHashSet<>();
        int replaced = 0;

        while (matcher.find()) {
            String token = matcher.group();
            String replacement;

            if (token.startsWith("$$")) {
                replacement = token.substring(1);
            } else {
                String variable = matcher.group(1);
                String fallback = matcher.group(2);
                replacement = environment.get(variable).orElse(fallback);

                if (replacement == null) {
                    missing.add(variable);
                    replacement = token;
                } else {
                    replaced++;
                }
            }

            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);

        if (!missing.isEmpty()) {
            throw new ConfigurationException(String.format("%s: unresolved environment placeholder(s) %s", source, missing));
        }

        log.tracef("%s: %d placeholder(s) resolved", source, replaced);
        return result.toString();
    }
}
