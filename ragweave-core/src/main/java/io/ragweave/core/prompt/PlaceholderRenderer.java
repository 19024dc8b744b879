package io.ragweave.core.prompt;

import io.ragweave.core.exception.ValidationException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Replaces `{name}` markers in a template with values from a map.
///
/// Rendering is strict: a marker without a value raises
/// {@link ValidationException} naming every missing placeholder.
public final class PlaceholderRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^{}\\s]+)}");

    private PlaceholderRenderer() {}

    /// Returns the distinct placeholder names in order of first appearance.
    ///
    /// @param template template text, not null
    /// @return placeholder names, never null
    public static Set<String> placeholders(String template) {
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    /// Renders the template.
    ///
    /// @param template template text, not null
    /// @param values placeholder values, rendered with `toString()`, not null
    /// @return rendered text, never null
    /// @throws ValidationException if any placeholder has no value
    public static String render(String template, Map<String, ?> values) {
        List<String> missing =
                placeholders(template).stream().filter(name -> values.get(name) == null).toList();
        if (!missing.isEmpty()) {
            throw new ValidationException("Missing template variables: " + missing);
        }

        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String replacement = String.valueOf(values.get(matcher.group(1)));
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
