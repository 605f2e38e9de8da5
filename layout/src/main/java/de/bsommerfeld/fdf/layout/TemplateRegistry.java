package de.bsommerfeld.fdf.layout;

import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Templates by name, in registration order. A later registration under the
 * same name replaces the earlier one.
 */
public final class TemplateRegistry {

    private final Map<String, Template> templates = new LinkedHashMap<>();

    public TemplateRegistry() {
    }

    private TemplateRegistry(Map<String, Template> templates) {
        this.templates.putAll(templates);
    }

    public static TemplateRegistry copyOf(TemplateRegistry other) {
        return new TemplateRegistry(other.templates);
    }

    public void register(Template template) {
        templates.put(template.name(), template);
    }

    /** Adds all templates of {@code other}, replacing same-named ones. */
    public void registerAll(TemplateRegistry other) {
        templates.putAll(other.templates);
    }

    public Optional<Template> find(String name) {
        return Optional.ofNullable(templates.get(name));
    }

    public Set<String> names() {
        return ImmutableMap.copyOf(templates).keySet();
    }

    public int size() {
        return templates.size();
    }
}
