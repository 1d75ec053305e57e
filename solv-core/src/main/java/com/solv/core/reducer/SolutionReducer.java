package com.solv.core.reducer;

import com.solv.core.graph.DependencyGraph;
import com.solv.core.model.ConfigPlatform;
import com.solv.core.model.Project;
import com.solv.core.model.ProjectConfigGroup;
import com.solv.core.model.ProjectTypes;
import com.solv.core.model.Solution;
import com.solv.core.model.VersionEntry;
import com.solv.core.syntax.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Folds a {@link SyntaxNode.Root} into a {@link Solution}.
 *
 * <p>Top-level nodes are handled in one pass:
 * <ul>
 *   <li>the first comment becomes the product label</li>
 *   <li>version assignments become {@link VersionEntry} values</li>
 *   <li>projects contribute their {@code ProjectDependencies} and {@code SolutionItems} sections</li>
 *   <li>global sections contribute solution and per-project configuration/platform pairs</li>
 * </ul>
 * Malformed configuration text is skipped, never reported.
 */
public final class SolutionReducer {

    private static final Logger log = LoggerFactory.getLogger(SolutionReducer.class);

    static final String PROJECT_DEPENDENCIES = "ProjectDependencies";
    static final String SOLUTION_ITEMS = "SolutionItems";
    static final String SOLUTION_CONFIGURATION_PLATFORMS = "SolutionConfigurationPlatforms";
    static final String PROJECT_CONFIGURATION_PLATFORMS = "ProjectConfigurationPlatforms";
    static final String SOLUTION_CONFIGURATION = "SolutionConfiguration";
    static final String PROJECT_CONFIGURATION = "ProjectConfiguration";

    private String product;
    private final List<SyntaxNode.Project> projects = new ArrayList<>();
    private final List<VersionEntry> versions = new ArrayList<>();
    private final Set<ConfigPlatform> solutionConfigurations = new LinkedHashSet<>();
    private final Map<String, GroupDraft> groups = new LinkedHashMap<>();

    private SolutionReducer() {
    }

    /**
     * Reduces a syntax tree.
     *
     * @param root parsed solution
     * @return immutable solution model
     */
    public static Solution reduce(SyntaxNode.Root root) {
        return new SolutionReducer().fold(root);
    }

    private Solution fold(SyntaxNode.Root root) {
        for (SyntaxNode node : root.lines()) {
            if (node instanceof SyntaxNode.Comment comment) {
                if (product == null) {
                    product = productOf(comment.text());
                }
            } else if (node instanceof SyntaxNode.VersionAssignment version) {
                versions.add(new VersionEntry(version.name(), version.value()));
            } else if (node instanceof SyntaxNode.Project project) {
                projects.add(project);
            } else if (node instanceof SyntaxNode.Global global) {
                foldGlobal(global);
            } else {
                log.debug("Ignoring unexpected top-level node: {}", node);
            }
        }

        List<Project> reduced = new ArrayList<>();
        DependencyGraph.Builder graph = DependencyGraph.builder();
        for (SyntaxNode.Project project : projects) {
            Project model = toProject(project);
            reduced.add(model);
            if (!model.isSolutionFolder()) {
                graph.addNode(model.id());
                model.dependsOn().forEach(target -> graph.addEdge(model.id(), target));
            }
        }

        List<ProjectConfigGroup> projectConfigurations = groups.values().stream()
            .map(g -> new ProjectConfigGroup(g.projectId, g.configurations))
            .toList();

        return new Solution(
            root.firstLine().formatVersion(),
            product,
            reduced,
            versions,
            new ArrayList<>(solutionConfigurations),
            projectConfigurations,
            graph.build()
        );
    }

    private Project toProject(SyntaxNode.Project project) {
        SyntaxNode.ProjectHeader header = project.header();
        List<String> items = new ArrayList<>();
        List<String> dependsOn = new ArrayList<>();
        for (SyntaxNode.Section section : project.sections()) {
            if (section.isNamed(PROJECT_DEPENDENCIES)) {
                section.lines().forEach(line -> dependsOn.add(line.key()));
            } else if (section.isNamed(SOLUTION_ITEMS)) {
                section.lines().forEach(line -> items.add(line.key()));
            }
        }

        GroupDraft group = groups.get(normalize(header.id()));
        SortedSet<ConfigPlatform> configurations = group != null ? group.configurations : null;

        return new Project(
            header.typeGuid(),
            ProjectTypes.describe(header.typeGuid()),
            header.id(),
            header.name(),
            header.path(),
            configurations,
            items,
            dependsOn
        );
    }

    private void foldGlobal(SyntaxNode.Global global) {
        Set<String> legacyNames = new HashSet<>();
        List<ConfigPlatform> legacyPairs = new ArrayList<>();

        for (SyntaxNode.Section section : global.sections()) {
            String name = section.header().name();
            for (SyntaxNode.SectionLine line : section.lines()) {
                switch (name) {
                    case SOLUTION_CONFIGURATION_PLATFORMS -> addSolutionConfiguration(ConfigPlatform.parse(line.key()));
                    case PROJECT_CONFIGURATION_PLATFORMS -> addProjectConfiguration(ConfigKeyParser.parse(line.key()));
                    case SOLUTION_CONFIGURATION -> legacyNames.add(line.value());
                    case PROJECT_CONFIGURATION -> {
                        ProjectConfigKey key = ConfigKeyParser.parseLegacy(line.key(), line.value());
                        if (addProjectConfiguration(key)) {
                            legacyPairs.add(key.configuration());
                        }
                    }
                    default -> {
                        // Other sections (NestedProjects, ExtensibilityGlobals, ...) carry no model data.
                    }
                }
            }
        }

        legacyPairs.stream()
            .filter(pair -> legacyNames.contains(pair.configuration()))
            .forEach(this::addSolutionConfiguration);
    }

    private void addSolutionConfiguration(ConfigPlatform configuration) {
        if (configuration.isValid()) {
            solutionConfigurations.add(configuration);
        } else {
            log.debug("Skipping malformed solution configuration");
        }
    }

    private boolean addProjectConfiguration(ProjectConfigKey key) {
        if (!key.isValid()) {
            log.debug("Skipping malformed project configuration key for {}", key.projectId());
            return false;
        }
        groups.computeIfAbsent(normalize(key.projectId()), k -> new GroupDraft(key.projectId()))
            .configurations.add(key.configuration());
        return true;
    }

    private static String productOf(String comment) {
        int start = 0;
        while (start < comment.length() && isProductPadding(comment.charAt(start))) {
            start++;
        }
        return comment.substring(start);
    }

    private static boolean isProductPadding(char c) {
        return c == '#' || c == ' ' || c == '\t';
    }

    private static String normalize(String id) {
        return id.toUpperCase(Locale.ROOT);
    }

    private static final class GroupDraft {
        private final String projectId;
        private final SortedSet<ConfigPlatform> configurations = new TreeSet<>();

        private GroupDraft(String projectId) {
            this.projectId = projectId;
        }
    }
}
