package id.go.kemenkeu.djpbn.sakti.zk.core.lock;

import id.go.kemenkeu.djpbn.sakti.zk.core.exception.KeyTemplateException;
import id.go.kemenkeu.djpbn.sakti.zk.core.exception.MissingKeyParameterException;
import id.go.kemenkeu.djpbn.sakti.zk.core.exception.UnexpectedKeyParameterException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Lock key with named placeholders, e.g. {@code "resource-{id}"}.
 * <p>
 * Doubled braces stand for literal braces. Formatting requires a non-null
 * value for every placeholder and rejects parameters the template does not use.
 */
public final class KeyTemplate {

    private final String template;
    private final List<Segment> segments;
    private final Set<String> placeholders;

    private KeyTemplate(String template, List<Segment> segments, Set<String> placeholders) {
        this.template = template;
        this.segments = segments;
        this.placeholders = placeholders;
    }

    public static KeyTemplate parse(String template) {
        if (template == null || template.isEmpty()) {
            throw new KeyTemplateException("Lock key cannot be empty");
        }

        List<Segment> segments = new ArrayList<>();
        Set<String> placeholders = new LinkedHashSet<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;

        while (i < template.length()) {
            char c = template.charAt(i);
            if (c == '{') {
                if (i + 1 < template.length() && template.charAt(i + 1) == '{') {
                    literal.append('{');
                    i += 2;
                    continue;
                }
                int end = template.indexOf('}', i + 1);
                if (end < 0) {
                    throw new KeyTemplateException("Unclosed '{' in lock key " + template);
                }
                String name = template.substring(i + 1, end);
                if (name.isBlank() || name.indexOf('{') >= 0) {
                    throw new KeyTemplateException("Placeholders must be named in lock key " + template);
                }
                if (literal.length() > 0) {
                    segments.add(Segment.literal(literal.toString()));
                    literal.setLength(0);
                }
                segments.add(Segment.placeholder(name));
                placeholders.add(name);
                i = end + 1;
            } else if (c == '}') {
                if (i + 1 < template.length() && template.charAt(i + 1) == '}') {
                    literal.append('}');
                    i += 2;
                    continue;
                }
                throw new KeyTemplateException("Single '}' in lock key " + template);
            } else {
                literal.append(c);
                i++;
            }
        }
        if (literal.length() > 0) {
            segments.add(Segment.literal(literal.toString()));
        }

        return new KeyTemplate(template, List.copyOf(segments), Collections.unmodifiableSet(placeholders));
    }

    /**
     * Substitute the parameters into the template
     *
     * @throws MissingKeyParameterException    if a placeholder has no (or a null) value
     * @throws UnexpectedKeyParameterException if a parameter matches no placeholder
     */
    public String format(Map<String, ?> params) {
        Map<String, ?> values = params == null ? Map.of() : params;

        Set<String> unexpected = new TreeSet<>(values.keySet());
        unexpected.removeAll(placeholders);
        if (!unexpected.isEmpty()) {
            throw new UnexpectedKeyParameterException(template, unexpected);
        }

        StringBuilder key = new StringBuilder();
        for (Segment segment : segments) {
            if (!segment.placeholder) {
                key.append(segment.text);
                continue;
            }
            Object value = values.get(segment.text);
            if (value == null) {
                throw new MissingKeyParameterException(template, segment.text);
            }
            key.append(value);
        }
        return key.toString();
    }

    public boolean hasPlaceholders() {
        return !placeholders.isEmpty();
    }

    public Set<String> getPlaceholders() {
        return placeholders;
    }

    public String getTemplate() {
        return template;
    }

    @Override
    public String toString() {
        return template;
    }

    private static final class Segment {
        private final String text;
        private final boolean placeholder;

        private Segment(String text, boolean placeholder) {
            this.text = text;
            this.placeholder = placeholder;
        }

        static Segment literal(String text) {
            return new Segment(text, false);
        }

        static Segment placeholder(String name) {
            return new Segment(name, true);
        }
    }
}
