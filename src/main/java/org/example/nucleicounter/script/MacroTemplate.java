package org.example.nucleicounter.script;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class MacroTemplate {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([A-Z][A-Z0-9_]*)}}");

    private final String name;
    private final String source;
    private final Set<String> insertionPoints;

    private MacroTemplate(String name, String source, Set<String> insertionPoints) {
        this.name = name;
        this.source = source;
        this.insertionPoints = insertionPoints;
    }

    public static MacroTemplate of(String name, String source, Set<String> required) {
        Set<String> found = new LinkedHashSet<>();
        Matcher m = PLACEHOLDER.matcher(source);
        while (m.find()) {
            found.add(m.group(1));
        }
        for (String point : required) {
            if (!found.contains(point)) {
                throw new IllegalStateException("Macro template '" + name + "' is missing insertion point {{" + point + "}}");
            }
        }
        return new MacroTemplate(name, source, Collections.unmodifiableSet(found));
    }

    Set<String> insertionPoints() {
        return insertionPoints;
    }

    public String render(Map<String, String> values) {
        Matcher m = PLACEHOLDER.matcher(source);
        StringBuilder out = new StringBuilder(source.length() * 2);
        while (m.find()) {
            String value = values.get(m.group(1));
            if (value == null) {
                throw new IllegalArgumentException("No value for {{" + m.group(1) + "}} in macro template '" + name + "'");
            }
            m.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        m.appendTail(out);
        return out.toString();
    }
}
