package org.smpels.mcs.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.smpels.mcs.api.SchemaLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A {@link SchemaStore} backed by the {@code smpe.json} statement catalog.
 * The catalog is read once; afterwards the store is immutable and safe to share between threads.
 */
public final class CatalogSchemaStore implements SchemaStore {

    /** Classpath location of the bundled catalog. */
    public static final String BUNDLED_CATALOG = "/smpe.json";

    private static final Logger log = LoggerFactory.getLogger(CatalogSchemaStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, StatementDefinition> byName;
    private final List<StatementDefinition> statements;

    private CatalogSchemaStore(List<StatementDefinition> definitions) {
        Map<String, StatementDefinition> map = new LinkedHashMap<>();
        for (StatementDefinition definition : definitions) {
            if (map.putIfAbsent(definition.name(), definition) != null) {
                log.warn("Duplicate catalog entry for {} ignored", definition.name());
            }
        }
        this.byName = Collections.unmodifiableMap(map);
        this.statements = List.copyOf(map.values());
    }

    /**
     * Creates a store from definitions built in code.
     * @param definitions The statement definitions; later duplicates of a name are ignored.
     * @return A new store.
     */
    public static CatalogSchemaStore of(List<StatementDefinition> definitions) {
        return new CatalogSchemaStore(definitions);
    }

    /**
     * Loads the catalog bundled with this library.
     * @return A new store.
     * @throws SchemaLoadException if the resource is missing or malformed.
     */
    public static CatalogSchemaStore bundled() throws SchemaLoadException {
        try (InputStream in = CatalogSchemaStore.class.getResourceAsStream(BUNDLED_CATALOG)) {
            if (in == null) {
                throw new SchemaLoadException("Bundled catalog not found on classpath: " + BUNDLED_CATALOG);
            }
            return fromJson(in, "classpath:" + BUNDLED_CATALOG);
        } catch (IOException e) {
            throw new SchemaLoadException("Failed to read bundled catalog: " + e.getMessage(), e);
        }
    }

    /**
     * Loads a catalog file in {@code smpe.json} format.
     * @param path The catalog file.
     * @return A new store.
     * @throws SchemaLoadException if the file cannot be read or parsed.
     */
    public static CatalogSchemaStore fromFile(Path path) throws SchemaLoadException {
        try (InputStream in = Files.newInputStream(path)) {
            return fromJson(in, path.toString());
        } catch (IOException e) {
            throw new SchemaLoadException("Failed to read catalog " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses a catalog from a JSON stream.
     * @param in     The JSON input; not closed by this method.
     * @param origin A description of the source, used in messages.
     * @return A new store.
     * @throws SchemaLoadException if the JSON is malformed.
     */
    public static CatalogSchemaStore fromJson(InputStream in, String origin) throws SchemaLoadException {
        List<StatementJson> raw;
        try {
            raw = MAPPER.readValue(in, new TypeReference<List<StatementJson>>() {});
        } catch (IOException e) {
            throw new SchemaLoadException("Malformed catalog " + origin + ": " + e.getMessage(), e);
        }
        if (raw == null) {
            throw new SchemaLoadException("Empty catalog " + origin);
        }
        List<StatementDefinition> definitions = new ArrayList<>(raw.size());
        for (StatementJson statement : raw) {
            if (statement.name() == null || statement.name().isBlank()) {
                throw new SchemaLoadException("Catalog " + origin + " contains a statement without a name");
            }
            definitions.add(statement.toDefinition());
        }
        log.debug("Loaded {} statement definitions from {}", definitions.size(), origin);
        return new CatalogSchemaStore(definitions);
    }

    @Override
    public Optional<StatementDefinition> lookup(String statementName) {
        if (statementName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byName.get(statementName));
    }

    @Override
    public List<StatementDefinition> statements() {
        return statements;
    }

    private static List<String> splitNames(String names) {
        if (names == null || names.isBlank()) {
            return List.of();
        }
        return Arrays.stream(names.split("\\|"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record StatementJson(
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("parameter") String parameter,
            @JsonProperty("length") int length,
            @JsonProperty("type") String type,
            @JsonProperty("language_variants") boolean languageVariants,
            @JsonProperty("inline_data") boolean inlineData,
            @JsonProperty("operands") List<OperandJson> operands
    ) {
        StatementDefinition toDefinition() {
            List<OperandDefinition> defs = new ArrayList<>();
            if (operands != null) {
                for (OperandJson operand : operands) {
                    OperandDefinition def = operand.toDefinition();
                    if (def != null) {
                        defs.add(def);
                    }
                }
            }
            return new StatementDefinition(name, description, emptyToNull(parameter), length, type,
                    languageVariants, inlineData, defs);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record OperandJson(
            @JsonProperty("name") String name,
            @JsonProperty("parameter") String parameter,
            @JsonProperty("type") String type,
            @JsonProperty("length") int length,
            @JsonProperty("required") boolean required,
            @JsonProperty("required_group") boolean requiredGroup,
            @JsonProperty("required_group_id") String requiredGroupId,
            @JsonProperty("description") String description,
            @JsonProperty("values") List<ValueJson> values,
            @JsonProperty("mutually_exclusive") String mutuallyExclusive,
            @JsonProperty("allowed_if") String allowedIf
    ) {
        OperandDefinition toDefinition() {
            List<String> aliases = splitNames(name);
            if (aliases.isEmpty()) {
                log.warn("Catalog operand without a name skipped");
                return null;
            }
            List<SubOperandDefinition> subs = new ArrayList<>();
            if (values != null) {
                for (ValueJson value : values) {
                    List<String> subAliases = splitNames(value.name());
                    if (!subAliases.isEmpty()) {
                        subs.add(new SubOperandDefinition(subAliases, value.description(),
                                emptyToNull(value.parameter()), emptyToNull(value.type()), value.length()));
                    }
                }
            }
            return new OperandDefinition(aliases, description, emptyToNull(parameter), emptyToNull(type), length,
                    required, requiredGroup, emptyToNull(requiredGroupId), emptyToNull(allowedIf),
                    splitNames(mutuallyExclusive), subs);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ValueJson(
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("parameter") String parameter,
            @JsonProperty("type") String type,
            @JsonProperty("length") int length
    ) {
    }
}
