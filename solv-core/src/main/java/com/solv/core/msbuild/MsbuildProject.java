package com.solv.core.msbuild;

import java.util.List;
import java.util.Objects;

/**
 * Declarative parts of an MSBuild project file ({@code .csproj}, {@code .vbproj}, ...).
 *
 * <p>Only what the NuGet report needs is kept; properties are not evaluated.
 *
 * @param sdk value of the root {@code Sdk} attribute, or null
 * @param projectReferences {@code ItemGroup/ProjectReference} items of all item groups
 * @param packageReferences {@code ItemGroup/PackageReference} items of all item groups
 * @param imports {@code Import} elements
 */
public record MsbuildProject(
    String sdk,
    List<ProjectReference> projectReferences,
    List<PackageReference> packageReferences,
    List<Import> imports
) {

    public MsbuildProject {
        projectReferences = projectReferences != null ? List.copyOf(projectReferences) : List.of();
        packageReferences = packageReferences != null ? List.copyOf(packageReferences) : List.of();
        imports = imports != null ? List.copyOf(imports) : List.of();
    }

    /**
     * Returns whether this is an SDK-style project: the root or any import names an SDK.
     */
    public boolean isSdkProject() {
        return sdk != null || imports.stream().anyMatch(i -> i.sdk() != null);
    }

    /**
     * @param include referenced project path
     */
    public record ProjectReference(String include) {
        public ProjectReference {
            Objects.requireNonNull(include, "include must not be null");
        }
    }

    /**
     * @param include package id
     * @param version requested version, empty when not declared
     */
    public record PackageReference(String include, String version) {
        public PackageReference {
            Objects.requireNonNull(include, "include must not be null");
            version = version != null ? version : "";
        }
    }

    /**
     * @param project imported file
     * @param sdk SDK attribute, or null
     * @param condition condition attribute, or null
     * @param label label attribute, or null
     */
    public record Import(String project, String sdk, String condition, String label) {
        public Import {
            Objects.requireNonNull(project, "project must not be null");
        }
    }
}
