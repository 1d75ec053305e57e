package com.solv.core.syntax;

import java.util.List;
import java.util.Objects;

/**
 * Concrete syntax tree of a solution file.
 *
 * <p>Each record mirrors one grammar production. Nodes are immutable; consumers dispatch
 * on the concrete record type.
 *
 * @see SyntaxTreeParser
 */
public interface SyntaxNode {

    /**
     * Whole file: the format line followed by top-level nodes in source order.
     *
     * @param firstLine format header
     * @param lines {@link Comment}, {@link VersionAssignment}, {@link Project} and {@link Global} nodes
     */
    record Root(FirstLine firstLine, List<SyntaxNode> lines) implements SyntaxNode {
        public Root {
            Objects.requireNonNull(firstLine, "firstLine must not be null");
            lines = lines != null ? List.copyOf(lines) : List.of();
        }
    }

    /**
     * {@code Microsoft Visual Studio Solution File, Format Version 12.00}.
     *
     * @param formatVersion trailing version number, e.g. "12.00"
     */
    record FirstLine(String formatVersion) implements SyntaxNode {
        public FirstLine {
            Objects.requireNonNull(formatVersion, "formatVersion must not be null");
        }
    }

    /**
     * @param text comment text including the leading {@code #}
     */
    record Comment(String text) implements SyntaxNode {
        public Comment {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    /**
     * {@code VisualStudioVersion = 17.0.31903.59}.
     */
    record VersionAssignment(String name, String value) implements SyntaxNode {
        public VersionAssignment {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record Project(ProjectHeader header, List<Section> sections) implements SyntaxNode {
        public Project {
            Objects.requireNonNull(header, "header must not be null");
            sections = sections != null ? List.copyOf(sections) : List.of();
        }
    }

    /**
     * {@code Project("{typeGuid}") = "name", "path", "{id}"}.
     */
    record ProjectHeader(String typeGuid, String name, String path, String id) implements SyntaxNode {
        public ProjectHeader {
            Objects.requireNonNull(typeGuid, "typeGuid must not be null");
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(path, "path must not be null");
            Objects.requireNonNull(id, "id must not be null");
        }
    }

    record Global(List<Section> sections) implements SyntaxNode {
        public Global {
            sections = sections != null ? List.copyOf(sections) : List.of();
        }
    }

    record Section(SectionHeader header, List<SectionLine> lines) implements SyntaxNode {
        public Section {
            Objects.requireNonNull(header, "header must not be null");
            lines = lines != null ? List.copyOf(lines) : List.of();
        }

        /**
         * Returns whether this section has the given name, e.g. "ProjectDependencies".
         */
        public boolean isNamed(String name) {
            return header.name().equals(name);
        }
    }

    /**
     * {@code GlobalSection(SolutionConfigurationPlatforms) = preSolution}.
     *
     * @param openKind section marker, {@code ProjectSection} or {@code GlobalSection}
     * @param name section name
     * @param phase pre/post marker, informational only
     */
    record SectionHeader(String openKind, String name, String phase) implements SyntaxNode {
        public SectionHeader {
            Objects.requireNonNull(openKind, "openKind must not be null");
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(phase, "phase must not be null");
        }
    }

    /**
     * {@code key = value} line of a section body.
     */
    record SectionLine(String key, String value) implements SyntaxNode {
        public SectionLine {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }
}
