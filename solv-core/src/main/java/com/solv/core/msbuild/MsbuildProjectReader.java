package com.solv.core.msbuild;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.solv.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads MSBuild project files into {@link MsbuildProject} records using Jackson's {@link XmlMapper}.
 *
 * <p>Elements that may occur once or many times are normalized to arrays before reading.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * MsbuildProjectReader reader = new MsbuildProjectReader();
 * MsbuildProject project = reader.read(Paths.get("App/App.csproj"));
 * project.packageReferences().forEach(p -> System.out.println(p.include() + " " + p.version()));
 * }</pre>
 */
public class MsbuildProjectReader {

    private static final Logger log = LoggerFactory.getLogger(MsbuildProjectReader.class);

    // XML Element Names
    private static final String ITEM_GROUP = "ItemGroup";
    private static final String PACKAGE_REFERENCE = "PackageReference";
    private static final String PROJECT_REFERENCE = "ProjectReference";
    private static final String IMPORT = "Import";

    // XML Attribute Names
    private static final String SDK = "Sdk";
    private static final String INCLUDE = "Include";
    private static final String VERSION = "Version";
    private static final String PROJECT = "Project";
    private static final String CONDITION = "Condition";
    private static final String LABEL = "Label";

    private final XmlMapper xmlMapper = new XmlMapper();

    /**
     * Reads a project file.
     *
     * @param file project file
     * @return project model
     * @throws IOException if the file cannot be read or is not XML
     */
    public MsbuildProject read(Path file) throws IOException {
        log.debug("Reading MSBuild project: {}", file);
        return read(FileUtils.readString(file));
    }

    /**
     * Reads project XML.
     *
     * @param xml project file contents
     * @return project model
     * @throws IOException if the content is not XML
     */
    public MsbuildProject read(String xml) throws IOException {
        JsonNode root = xmlMapper.readTree(xml);
        if (root == null || !root.isObject()) {
            return new MsbuildProject(null, List.of(), List.of(), List.of());
        }

        List<MsbuildProject.ProjectReference> projectReferences = new ArrayList<>();
        List<MsbuildProject.PackageReference> packageReferences = new ArrayList<>();
        for (JsonNode itemGroup : normalizeToArray(root.get(ITEM_GROUP))) {
            for (JsonNode reference : normalizeToArray(itemGroup.get(PROJECT_REFERENCE))) {
                String include = extractAttribute(reference, INCLUDE);
                if (include != null) {
                    projectReferences.add(new MsbuildProject.ProjectReference(include));
                }
            }
            for (JsonNode reference : normalizeToArray(itemGroup.get(PACKAGE_REFERENCE))) {
                String include = extractAttribute(reference, INCLUDE);
                if (include != null) {
                    packageReferences.add(new MsbuildProject.PackageReference(include, extractAttribute(reference, VERSION)));
                }
            }
        }

        List<MsbuildProject.Import> imports = new ArrayList<>();
        for (JsonNode element : normalizeToArray(root.get(IMPORT))) {
            String project = extractAttribute(element, PROJECT);
            if (project != null) {
                imports.add(new MsbuildProject.Import(
                    project,
                    extractAttribute(element, SDK),
                    extractAttribute(element, CONDITION),
                    extractAttribute(element, LABEL)
                ));
            }
        }

        return new MsbuildProject(extractAttribute(root, SDK), projectReferences, packageReferences, imports);
    }

    private String extractAttribute(JsonNode node, String attributeName) {
        if (node == null) {
            return null;
        }
        JsonNode attrNode = node.get(attributeName);
        if (attrNode != null && attrNode.isValueNode()) {
            return attrNode.asText();
        }
        return null;
    }

    private JsonNode normalizeToArray(JsonNode node) {
        if (node == null || !node.isContainerNode()) {
            return xmlMapper.createArrayNode();
        }
        if (node.isArray()) {
            return node;
        }
        return xmlMapper.createArrayNode().add(node);
    }
}
