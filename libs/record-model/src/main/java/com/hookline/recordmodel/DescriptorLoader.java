package com.hookline.recordmodel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads {@link RecordDescriptor}s from JSON resources.
 *
 * <pre>{@code
 * {
 *   "User":      { "fields": { "login": "string", "name": "string?",
 *                              "links": { "type": "map?", "alias": "_links" } } },
 *   "PushEvent": { "extends": "WebhookEvent", "fields": { "commits": "[Commit]" } }
 * }
 * }</pre>
 *
 * <p>Type expressions are {@code string}, {@code integer}, {@code number}, {@code boolean},
 * {@code any}, {@code map}, a descriptor name, or {@code [elem]} for a list. A trailing {@code ?}
 * makes the field optional; a trailing {@code |null} keeps it required but accepts JSON null. The
 * object form additionally takes {@code alias} and {@code default}.
 *
 * <p>{@code extends} may name a descriptor from any document added to the same loader. Parent
 * fields come first; a child field with the same name replaces the parent's in place.
 *
 * <p>Resources are read once at start-up. Any format problem raises
 * {@link DescriptorFormatException} naming the source and descriptor.
 */
public final class DescriptorLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern DESCRIPTOR_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");
    private static final Set<String> DEFINITION_KEYS = Set.of("extends", "fields");
    private static final Set<String> FIELD_KEYS = Set.of("type", "alias", "default");

    private final Map<String, Definition> definitions = new LinkedHashMap<>();
    private final ClassLoader classLoader;

    public DescriptorLoader() {
        this(DescriptorLoader.class.getClassLoader());
    }

    public DescriptorLoader(ClassLoader classLoader) {
        if (classLoader == null) {
            throw new IllegalArgumentException("classLoader must not be null");
        }
        this.classLoader = classLoader;
    }

    /** Loads the given classpath resources into a catalog. */
    public static DescriptorCatalog fromClasspath(String... resourcePaths) {
        DescriptorLoader loader = new DescriptorLoader();
        for (String path : resourcePaths) {
            loader.addResource(path);
        }
        return loader.load();
    }

    /**
     * Adds a classpath resource.
     *
     * @throws DescriptorFormatException if the resource is missing or malformed
     */
    public DescriptorLoader addResource(String resourcePath) {
        try (InputStream in = classLoader.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new DescriptorFormatException("Descriptor resource not found: " + resourcePath);
            }
            return add(resourcePath, in);
        } catch (IOException e) {
            throw new DescriptorFormatException("Failed to read descriptor resource " + resourcePath, e);
        }
    }

    /** Adds a document read from a stream. The stream is not closed. */
    public DescriptorLoader add(String source, InputStream in) {
        try {
            return add(source, MAPPER.readTree(in));
        } catch (IOException e) {
            throw new DescriptorFormatException("Malformed JSON in " + source, e);
        }
    }

    /** Adds a document given as a JSON string. */
    public DescriptorLoader addJson(String source, String json) {
        try {
            return add(source, MAPPER.readTree(json));
        } catch (IOException e) {
            throw new DescriptorFormatException("Malformed JSON in " + source, e);
        }
    }

    private DescriptorLoader add(String source, JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new DescriptorFormatException(source + ": top level must be a JSON object");
        }
        Iterator<Map.Entry<String, JsonNode>> entries = root.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String name = entry.getKey();
            if (!DESCRIPTOR_NAME.matcher(name).matches()) {
                throw new DescriptorFormatException(source + ": invalid descriptor name '" + name + "'");
            }
            if (definitions.containsKey(name)) {
                throw new DescriptorFormatException(source + ": descriptor " + name
                        + " is already defined in " + definitions.get(name).source());
            }
            definitions.put(name, parseDefinition(source, name, entry.getValue()));
        }
        return this;
    }

    /**
     * Resolves {@code extends} chains and builds the catalog.
     *
     * @throws DescriptorFormatException on unknown parents, inheritance cycles or unresolved
     *     descriptor references
     */
    public DescriptorCatalog load() {
        Map<String, RecordDescriptor> resolved = new LinkedHashMap<>();
        for (String name : definitions.keySet()) {
            resolve(name, resolved, new ArrayDeque<>());
        }
        try {
            return DescriptorCatalog.builder().addAll(resolved.values()).build();
        } catch (IllegalArgumentException e) {
            throw new DescriptorFormatException(e.getMessage(), e);
        }
    }

    private RecordDescriptor resolve(
            String name, Map<String, RecordDescriptor> resolved, Deque<String> chain) {
        RecordDescriptor done = resolved.get(name);
        if (done != null) {
            return done;
        }
        if (chain.contains(name)) {
            throw new DescriptorFormatException("Inheritance cycle: " + String.join(" -> ", chain) + " -> " + name);
        }
        Definition definition = definitions.get(name);
        chain.addLast(name);
        RecordDescriptor descriptor;
        if (definition.parent() == null) {
            descriptor = newDescriptor(definition, name, definition.fields());
        } else {
            if (!definitions.containsKey(definition.parent())) {
                throw new DescriptorFormatException(definition.source() + ": " + name
                        + " extends unknown descriptor " + definition.parent());
            }
            RecordDescriptor parent = resolve(definition.parent(), resolved, chain);
            descriptor = parent.extend(name, definition.fields());
        }
        chain.removeLast();
        resolved.put(name, descriptor);
        return descriptor;
    }

    private static RecordDescriptor newDescriptor(Definition definition, String name, List<FieldSpec> fields) {
        try {
            return new RecordDescriptor(name, fields);
        } catch (IllegalArgumentException e) {
            throw new DescriptorFormatException(definition.source() + ": " + e.getMessage(), e);
        }
    }

    private static Definition parseDefinition(String source, String name, JsonNode node) {
        if (!node.isObject()) {
            throw new DescriptorFormatException(source + ": descriptor " + name + " must be an object");
        }
        node.fieldNames().forEachRemaining(key -> {
            if (!DEFINITION_KEYS.contains(key)) {
                throw new DescriptorFormatException(source + ": descriptor " + name + " has unknown key '" + key + "'");
            }
        });
        String parent = null;
        JsonNode extendsNode = node.get("extends");
        if (extendsNode != null) {
            if (!extendsNode.isTextual() || extendsNode.asText().isBlank()) {
                throw new DescriptorFormatException(source + ": " + name + ".extends must be a descriptor name");
            }
            parent = extendsNode.asText();
        }
        JsonNode fieldsNode = node.get("fields");
        List<FieldSpec> fields = new ArrayList<>();
        if (fieldsNode != null) {
            if (!fieldsNode.isObject()) {
                throw new DescriptorFormatException(source + ": " + name + ".fields must be an object");
            }
            Iterator<Map.Entry<String, JsonNode>> entries = fieldsNode.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                String where = source + ": " + name + "." + entry.getKey();
                try {
                    fields.add(parseField(where, entry.getKey(), entry.getValue()));
                } catch (IllegalArgumentException e) {
                    throw new DescriptorFormatException(where + ": " + e.getMessage(), e);
                }
            }
        }
        return new Definition(source, parent, fields);
    }

    private static FieldSpec parseField(String where, String name, JsonNode node) {
        if (node.isTextual()) {
            return parseType(where, name, node.asText());
        }
        if (!node.isObject()) {
            throw new DescriptorFormatException(where + ": field must be a type string or an object");
        }
        node.fieldNames().forEachRemaining(key -> {
            if (!FIELD_KEYS.contains(key)) {
                throw new DescriptorFormatException(where + ": unknown key '" + key + "'");
            }
        });
        JsonNode type = node.get("type");
        if (type == null || !type.isTextual()) {
            throw new DescriptorFormatException(where + ": 'type' is required");
        }
        FieldSpec spec = parseType(where, name, type.asText());
        JsonNode alias = node.get("alias");
        if (alias != null) {
            if (!alias.isTextual() || alias.asText().isBlank()) {
                throw new DescriptorFormatException(where + ": 'alias' must be a non-blank string");
            }
            spec = spec.withAlias(alias.asText());
        }
        JsonNode defaultNode = node.get("default");
        if (defaultNode != null && !defaultNode.isNull()) {
            spec = spec.withDefault(MAPPER.convertValue(defaultNode, Object.class));
        }
        return spec;
    }

    static FieldSpec parseType(String where, String name, String expression) {
        String type = expression.strip();
        boolean optional = false;
        boolean nullable = false;
        if (type.endsWith("?")) {
            optional = true;
            type = type.substring(0, type.length() - 1);
        } else if (type.endsWith("|null")) {
            nullable = true;
            type = type.substring(0, type.length() - "|null".length());
        }
        FieldSpec spec;
        if (type.startsWith("[") && type.endsWith("]")) {
            String element = type.substring(1, type.length() - 1);
            ScalarType scalar = ScalarType.fromLabel(element);
            if (scalar != null) {
                spec = FieldSpec.scalarList(name, scalar);
            } else {
                spec = FieldSpec.recordList(name, requireDescriptorName(where, element));
            }
        } else if ("map".equals(type)) {
            spec = FieldSpec.openMap(name);
        } else {
            ScalarType scalar = ScalarType.fromLabel(type);
            if (scalar != null) {
                spec = FieldSpec.scalar(name, scalar);
            } else {
                spec = FieldSpec.record(name, requireDescriptorName(where, type));
            }
        }
        if (optional) {
            return spec.optional();
        }
        return nullable ? spec.asNullable() : spec;
    }

    private static String requireDescriptorName(String where, String type) {
        if (!DESCRIPTOR_NAME.matcher(type).matches() || "map".equals(type)) {
            throw new DescriptorFormatException(where + ": invalid type expression '" + type + "'");
        }
        return type;
    }

    private record Definition(String source, String parent, List<FieldSpec> fields) {}
}
