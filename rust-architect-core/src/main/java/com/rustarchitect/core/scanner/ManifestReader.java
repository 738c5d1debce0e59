package com.rustarchitect.core.scanner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.rustarchitect.core.model.Manifest;
import com.rustarchitect.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Reads {@code Cargo.toml} package and workspace metadata.
 *
 * <p>Workspace members may be glob patterns ({@code crates/*}); they are expanded
 * against directories that contain their own {@code Cargo.toml}. Entries of
 * {@code workspace.exclude} are removed. A root {@code [package]} counts as one
 * more package when it is not itself listed as a member.
 *
 * <p>A missing manifest yields {@link Manifest#empty()}. A manifest that cannot be
 * parsed keeps its raw text (still useful as import evidence) with zero packages.
 */
public class ManifestReader {

    /** Manifest file name. */
    public static final String MANIFEST_FILE = "Cargo.toml";

    private static final Logger log = LoggerFactory.getLogger(ManifestReader.class);

    // Cargo.toml keys
    private static final String KEY_PACKAGE = "package";
    private static final String KEY_WORKSPACE = "workspace";
    private static final String KEY_NAME = "name";
    private static final String KEY_VERSION = "version";
    private static final String KEY_MEMBERS = "members";
    private static final String KEY_EXCLUDE = "exclude";
    private static final String KEY_DEPENDENCIES = "dependencies";

    private final TomlMapper tomlMapper = new TomlMapper();

    /**
     * Reads the manifest of a project.
     *
     * @param projectRoot project root directory
     * @return parsed manifest, never null
     */
    public Manifest read(Path projectRoot) {
        Objects.requireNonNull(projectRoot, "projectRoot must not be null");
        Path manifestFile = projectRoot.resolve(MANIFEST_FILE);

        if (!Files.isRegularFile(manifestFile)) {
            log.debug("No {} in {}", MANIFEST_FILE, projectRoot);
            return Manifest.empty();
        }

        String rawText;
        try {
            rawText = new String(Files.readAllBytes(manifestFile), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", manifestFile, e.getMessage());
            return Manifest.empty();
        }

        JsonNode root;
        try {
            root = tomlMapper.readTree(rawText);
        } catch (IOException e) {
            log.warn("Failed to parse {}: {}", manifestFile, e.getMessage());
            return Manifest.ofText(rawText, 0);
        }
        if (root == null || !root.isObject()) {
            return Manifest.ofText(rawText, 0);
        }

        JsonNode pkg = root.path(KEY_PACKAGE);
        String packageName = textOrNull(pkg.get(KEY_NAME));
        String packageVersion = textOrNull(pkg.get(KEY_VERSION));
        boolean hasPackage = pkg.isObject();

        List<String> dependencies = collectDependencies(root);
        List<String> members = List.of();
        int packageCount = hasPackage ? 1 : 0;

        JsonNode workspace = root.get(KEY_WORKSPACE);
        if (workspace != null && workspace.isObject()) {
            members = resolveMembers(projectRoot, workspace);
            boolean rootIsMember = members.contains(".");
            packageCount = members.size() + (hasPackage && !rootIsMember ? 1 : 0);
            log.debug("Workspace {} has {} members", projectRoot, members.size());
        }

        return new Manifest(rawText, packageName, packageVersion, dependencies, members, packageCount);
    }

    private List<String> collectDependencies(JsonNode root) {
        Set<String> names = new LinkedHashSet<>();
        addKeys(root.get(KEY_DEPENDENCIES), names);
        addKeys(root.path(KEY_WORKSPACE).get(KEY_DEPENDENCIES), names);
        return List.copyOf(names);
    }

    private void addKeys(JsonNode table, Set<String> names) {
        if (table == null || !table.isObject()) {
            return;
        }
        Iterator<String> fieldNames = table.fieldNames();
        while (fieldNames.hasNext()) {
            names.add(fieldNames.next());
        }
    }

    private List<String> resolveMembers(Path projectRoot, JsonNode workspace) {
        Set<String> excluded = new LinkedHashSet<>(textValues(workspace.get(KEY_EXCLUDE)));
        Set<String> resolved = new LinkedHashSet<>();

        for (String member : textValues(workspace.get(KEY_MEMBERS))) {
            String normalized = normalize(member);
            if (isGlob(normalized)) {
                resolved.addAll(expandGlob(projectRoot, normalized));
            } else if (Files.isRegularFile(projectRoot.resolve(normalized).resolve(MANIFEST_FILE))) {
                resolved.add(normalized);
            } else {
                log.warn("Workspace member {} has no {}, skipping", member, MANIFEST_FILE);
            }
        }

        List<String> members = new ArrayList<>();
        for (String member : resolved) {
            if (!excluded.contains(member)) {
                members.add(member);
            }
        }
        return members;
    }

    private List<String> expandGlob(Path projectRoot, String pattern) {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        int depth = pattern.split("/").length;
        try (Stream<Path> paths = Files.walk(projectRoot, depth)) {
            return paths
                .filter(Files::isDirectory)
                .filter(dir -> !dir.equals(projectRoot))
                .filter(dir -> matcher.matches(projectRoot.relativize(dir)))
                .filter(dir -> Files.isRegularFile(dir.resolve(MANIFEST_FILE)))
                .map(dir -> FileUtils.relativePath(projectRoot, dir))
                .sorted()
                .toList();
        } catch (IOException e) {
            log.warn("Failed to expand workspace member pattern {}: {}", pattern, e.getMessage());
            return List.of();
        }
    }

    private static List<String> textValues(JsonNode array) {
        if (array == null || !array.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : array) {
            if (item.isTextual()) {
                values.add(normalize(item.asText()));
            }
        }
        return values;
    }

    private static String normalize(String member) {
        String normalized = member.trim().replace('\\', '/');
        while (normalized.startsWith("./") && normalized.length() > 2) {
            normalized = normalized.substring(2);
        }
        while (normalized.endsWith("/") && normalized.length() > 1) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized.isEmpty() ? "." : normalized;
    }

    private static boolean isGlob(String member) {
        return member.indexOf('*') >= 0 || member.indexOf('?') >= 0 || member.indexOf('[') >= 0;
    }

    private static String textOrNull(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }
}
