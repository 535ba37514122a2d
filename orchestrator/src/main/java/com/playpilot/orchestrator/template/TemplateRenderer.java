package com.playpilot.orchestrator.template;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.playpilot.orchestrator.model.PlaybookTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes validated variables into a template body.
 *
 * Placeholders look like {@code {{ name }}} or
 * {@code {{ name | default('value') }}}. Only names the schema declares are
 * substituted; every other {@code {{ ... }}} expression is runtime Jinja for
 * Ansible and is copied through untouched. Substitution is one left-to-right
 * pass, so a value that itself contains {@code {{ }}} is emitted literally.
 *
 * Pure: no I/O, no shared state.
 */
@Component
public class TemplateRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile(
            "\\{\\{\\s*([A-Za-z_][A-Za-z0-9_]*)\\s*"
            + "(?:\\|\\s*default\\(\\s*(?:'([^']*)'|\"([^\"]*)\"|([^)\\s]*))\\s*\\)\\s*)?"
            + "\\}\\}"
    );

    private final ObjectMapper objectMapper;

    public TemplateRenderer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public RenderResult render(PlaybookTemplate template, Map<String, ?> variables) {
        VariableSchema schema = VariableSchema.parse(template.getVariablesSchema(), objectMapper);
        return render(template.getBody(), schema, variables);
    }

    public RenderResult render(String body, VariableSchema schema, Map<String, ?> variables) {
        Map<String, ?> supplied = variables == null ? Map.of() : variables;

        List<String> errors = validate(schema, supplied);
        if (!errors.isEmpty()) {
            return RenderResult.invalid(errors);
        }

        Map<String, Object> values = new LinkedHashMap<>();
        schema.fields().values().forEach(f -> {
            if (f.defaultValue() != null) values.put(f.name(), f.defaultValue());
        });
        supplied.forEach((k, v) -> {
            if (v != null) values.put(k, v);
        });

        Matcher m = PLACEHOLDER.matcher(body);
        StringBuilder out = new StringBuilder(body.length());
        while (m.find()) {
            String name = m.group(1);
            String replacement;
            if (!schema.declares(name)) {
                replacement = m.group(0);
            } else if (values.containsKey(name)) {
                replacement = format(values.get(name));
            } else {
                replacement = inlineDefault(m);
            }
            m.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(out);
        return RenderResult.rendered(out.toString());
    }

    /**
     * Every problem with {@code supplied}, in a stable order: missing
     * required fields in schema order, then supplied names alphabetically.
     */
    List<String> validate(VariableSchema schema, Map<String, ?> supplied) {
        List<String> errors = new ArrayList<>();

        for (VariableSchema.Field f : schema.fields().values()) {
            if (f.required() && supplied.get(f.name()) == null) {
                errors.add("Required field missing: " + f.name());
            }
        }

        for (Map.Entry<String, ?> e : new TreeMap<String, Object>(supplied).entrySet()) {
            String name  = e.getKey();
            Object value = e.getValue();
            VariableSchema.Field f = schema.field(name);
            if (f == null) {
                errors.add("Unknown field: " + name);
                continue;
            }
            if (value == null) {
                continue;
            }
            if (!f.type().accepts(value)) {
                errors.add("Field " + name + " must be " + f.type().article());
                continue;
            }
            if (f.allowed() != null && f.allowed().stream().noneMatch(a -> sameValue(a, value))) {
                errors.add("Field " + name + " must be one of: " + f.allowed());
            }
        }
        return errors;
    }

    private static boolean sameValue(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return a.toString().equals(b.toString());
        }
        return a.equals(b);
    }

    private static String inlineDefault(Matcher m) {
        for (int g = 2; g <= 4; g++) {
            if (m.group(g) != null) return m.group(g);
        }
        return "";
    }

    private String format(Object value) {
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot render value " + value, e);
        }
    }
}
