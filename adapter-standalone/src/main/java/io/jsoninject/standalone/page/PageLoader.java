package io.jsoninject.standalone.page;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.jsoninject.core.engine.JsonInjector;
import io.jsoninject.core.error.ConfigurationException;
import io.jsoninject.core.model.InjectionRequest;
import io.jsoninject.core.spec.InjectionSpecParser;
import io.jsoninject.standalone.config.ConfigLoadException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads page definitions from a directory of YAML files.
 *
 * <pre>{@code
 * id: employees
 * template-file: employees.html     # or an inline "template: <html>..."
 * injections:
 *   - name: load-employees
 *     source: sql
 *     target: myApp.employees
 *     query: select empno, ename from emp where deptno = :DEPTNO
 * }</pre>
 *
 * <p>Every injection is validated when the page loads, so a bad target path or a missing source
 * field stops startup instead of failing the first render.
 */
public final class PageLoader {

    private static final Logger LOG = LoggerFactory.getLogger(PageLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final Set<String> KNOWN_KEYS = Set.of("id", "template", "template-file", "injections");

    private final InjectionSpecParser parser = new InjectionSpecParser();
    private final JsonInjector injector;

    /**
     * @param injector used to validate every injection at load time
     */
    public PageLoader(JsonInjector injector) {
        this.injector = injector;
    }

    /**
     * Loads every {@code *.yaml} / {@code *.yml} file in {@code dir}, in file name order. A missing
     * directory yields no pages.
     *
     * @return pages by id, in load order
     * @throws ConfigLoadException if a file is unreadable, malformed or repeats a page id
     */
    public Map<String, PageDefinition> loadAll(Path dir) {
        Map<String, PageDefinition> pages = new LinkedHashMap<>();
        for (Path file : scanPageFiles(dir)) {
            PageDefinition page = load(file);
            if (pages.putIfAbsent(page.id(), page) != null) {
                throw new ConfigLoadException("Duplicate page id '" + page.id() + "' in " + file);
            }
        }
        LOG.info("Pages loaded: count={}, dir={}", pages.size(), dir);
        return pages;
    }

    /**
     * Loads a single page file.
     *
     * @throws ConfigLoadException if the file is unreadable, malformed, or an injection is invalid
     */
    public PageDefinition load(Path file) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(file.toFile());
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read or parse page file: " + file, e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigLoadException("Page file must contain a YAML mapping: " + file);
        }
        rejectUnknownKeys(root, file);

        JsonNode idNode = root.get("id");
        if (idNode == null || !idNode.isTextual() || idNode.asText().isBlank()) {
            throw new ConfigLoadException("Missing or invalid required field 'id' in " + file);
        }
        String id = idNode.asText();
        String template = template(root, file);

        List<InjectionRequest> injections = new ArrayList<>();
        Set<String> names = new HashSet<>();
        JsonNode list = root.path("injections");
        if (!list.isMissingNode() && !list.isArray()) {
            throw new ConfigLoadException("'injections' must be a list in " + file);
        }
        for (JsonNode node : list) {
            try {
                InjectionRequest request = parser.parseNode(node);
                injector.validate(request);
                if (!names.add(request.name())) {
                    throw new ConfigLoadException(
                            "Duplicate injection name '" + request.name() + "' on page '" + id + "'");
                }
                injections.add(request);
            } catch (ConfigurationException e) {
                throw new ConfigLoadException("Invalid injection on page '" + id + "' (" + file + "): "
                        + e.getMessage(), e);
            }
        }
        LOG.debug("Page loaded: id={}, injections={}, file={}", id, injections.size(), file);
        return new PageDefinition(id, template, injections);
    }

    private static String template(JsonNode root, Path file) {
        boolean inline = root.hasNonNull("template");
        boolean external = root.hasNonNull("template-file");
        if (inline == external) {
            throw new ConfigLoadException("Page needs exactly one of 'template' or 'template-file': " + file);
        }
        if (inline) {
            return root.get("template").asText();
        }
        Path templatePath = file.resolveSibling(root.get("template-file").asText());
        try {
            return Files.readString(templatePath);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read template " + templatePath + " for page file " + file, e);
        }
    }

    private static void rejectUnknownKeys(JsonNode root, Path file) {
        List<String> unknown = StreamSupport.stream(((Iterable<String>) root::fieldNames).spliterator(), false)
                .filter(key -> !KNOWN_KEYS.contains(key))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new ConfigLoadException("Unknown key" + (unknown.size() > 1 ? "s" : "") + " " + unknown
                    + " in page file " + file + "; recognized keys are: " + KNOWN_KEYS);
        }
    }

    /**
     * Scans {@code dir} for {@code *.yaml} and {@code *.yml} files, sorted for a deterministic load
     * order.
     */
    static List<Path> scanPageFiles(Path dir) {
        if (dir == null || !Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.list(dir)) {
            return stream.filter(p -> {
                        String name = p.getFileName().toString();
                        return name.endsWith(".yaml") || name.endsWith(".yml");
                    })
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to list pages directory: " + dir, e);
        }
    }
}
