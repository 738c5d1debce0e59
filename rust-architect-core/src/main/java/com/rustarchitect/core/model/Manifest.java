package com.rustarchitect.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Package metadata read from a {@code Cargo.toml} manifest.
 *
 * @param rawText manifest text, searched for import evidence
 * @param packageName root package name, or null for a virtual workspace
 * @param packageVersion root package version, or null
 * @param dependencies dependency crate names in manifest order
 * @param workspaceMembers resolved workspace member directories
 * @param packageCount number of packages in the workspace (1 for a single crate)
 */
public record Manifest(
    String rawText,
    String packageName,
    String packageVersion,
    List<String> dependencies,
    List<String> workspaceMembers,
    int packageCount
) {
    public Manifest {
        if (rawText == null) {
            rawText = "";
        }
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        workspaceMembers = workspaceMembers == null ? List.of() : List.copyOf(workspaceMembers);
        if (packageCount < 0) {
            packageCount = 0;
        }
    }

    /**
     * Creates the manifest of a project without {@code Cargo.toml}.
     *
     * @return manifest with no text and no packages
     */
    public static Manifest empty() {
        return new Manifest("", null, null, List.of(), List.of(), 0);
    }

    /**
     * Creates a manifest known only by its text and package count.
     *
     * @param rawText manifest text
     * @param packageCount workspace package count
     * @return manifest without parsed metadata
     */
    public static Manifest ofText(String rawText, int packageCount) {
        return new Manifest(rawText, null, null, List.of(), List.of(), packageCount);
    }

    /**
     * Returns true when the manifest describes more than one package.
     *
     * @return true for multi-package workspaces
     */
    @JsonIgnore
    public boolean isWorkspace() {
        return packageCount > 1;
    }
}
