package org.javai.dbresilience.profile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * A connection source read from a JSON document of the form:
 *
 * <pre>{@code
 * {
 *   "ConnectionStrings": {
 *     "myapp": "jdbc:postgresql://localhost:5432/myapp",
 *     "reporting": {
 *       "url": "jdbc:postgresql://replica:5432/reporting",
 *       "user": "report",
 *       "password": "secret",
 *       "operationTimeout": "300"
 *     }
 *   }
 * }
 * }</pre>
 *
 * <p>A string value is a bare JDBC URL. In an object value, every field other than
 * {@code url}, {@code user} and {@code password} is a profile override.
 */
public final class JsonConnectionSource implements ConnectionSource {

    static final String SECTION = "ConnectionStrings";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, RawConnectionParameters> entries;
    private final String origin;

    private JsonConnectionSource(Map<String, RawConnectionParameters> entries, String origin) {
        this.entries = Map.copyOf(entries);
        this.origin = origin;
    }

    public static JsonConnectionSource fromJson(String json, String origin) throws IOException {
        return parse(MAPPER.readTree(json), origin);
    }

    public static JsonConnectionSource fromFile(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return parse(MAPPER.readTree(in), path.toString());
        }
    }

    /**
     * Reads a classpath resource, or returns empty if there is no such resource.
     */
    public static Optional<JsonConnectionSource> fromClasspath(String resource) throws IOException {
        ClassLoader loader = JsonConnectionSource.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                return Optional.empty();
            }
            return Optional.of(parse(MAPPER.readTree(in), "classpath:" + resource));
        }
    }

    private static JsonConnectionSource parse(JsonNode root, String origin) throws IOException {
        Map<String, RawConnectionParameters> entries = new HashMap<>();
        if (root == null || root.isMissingNode() || root.isNull()) {
            return new JsonConnectionSource(entries, origin);
        }
        if (!root.isObject()) {
            throw new IOException("Expected a JSON object at the root of " + origin);
        }

        JsonNode section = root.path(SECTION);
        Iterator<Map.Entry<String, JsonNode>> fields = section.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            entries.put(field.getKey(), toParameters(field.getKey(), field.getValue(), origin));
        }
        return new JsonConnectionSource(entries, origin);
    }

    private static RawConnectionParameters toParameters(String name, JsonNode value, String origin) throws IOException {
        if (value.isTextual()) {
            return RawConnectionParameters.ofUrl(value.asText());
        }
        if (!value.isObject() || !value.hasNonNull("url")) {
            throw new IOException("Connection '" + name + "' in " + origin
                    + " must be a JDBC URL or an object with a 'url' field");
        }

        Map<String, String> overrides = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            switch (field.getKey()) {
                case "url", "user", "password" -> { }
                default -> overrides.put(field.getKey(), field.getValue().asText());
            }
        }
        return new RawConnectionParameters(
                value.get("url").asText(),
                textOrNull(value, "user"),
                textOrNull(value, "password"),
                overrides);
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    @Override
    public Optional<RawConnectionParameters> lookup(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    @Override
    public Set<String> names() {
        return new TreeSet<>(entries.keySet());
    }

    /**
     * Where this source was read from, for diagnostics.
     */
    public String origin() {
        return origin;
    }
}
