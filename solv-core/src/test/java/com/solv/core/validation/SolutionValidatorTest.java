package com.solv.core.validation;

import com.solv.core.Fixtures;
import com.solv.core.SolutionParser;
import com.solv.core.model.ConfigPlatform;
import com.solv.core.model.Project;
import com.solv.core.model.Solution;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

/**
 * Tests for {@link SolutionValidator}.
 */
class SolutionValidatorTest {

    @TempDir
    Path tempDir;

    @Test
    void hasCycles_correctSolution_isFalse() {
        Solution solution = SolutionParser.parse(Fixtures.solution(Fixtures.CORRECT));

        assertThat(SolutionValidator.hasCycles(solution)).isFalse();
    }

    @Test
    void hasCycles_mutuallyDependentProjects_isTrue() {
        Solution solution = SolutionParser.parse(Fixtures.solution(Fixtures.CYCLES));

        assertThat(SolutionValidator.hasCycles(solution)).isTrue();
    }

    @Test
    void danglingConfigurations_correctSolution_isEmpty() {
        Solution solution = SolutionParser.parse(Fixtures.solution(Fixtures.CORRECT));

        assertThat(SolutionValidator.danglingConfigurations(solution)).isEmpty();
    }

    @Test
    void danglingConfigurations_groupWithoutProject_isReported() {
        Solution solution = SolutionParser.parse(Fixtures.solution(Fixtures.DANGLINGS));

        assertThat(SolutionValidator.danglingConfigurations(solution))
            .containsExactly("{24848551-EF4F-47E8-9A9D-EA4D49BC3ECA}");
    }

    @Test
    void danglingConfigurations_idCaseDiffers_matchesDeclaredProject() {
        String content = """
            Microsoft Visual Studio Solution File, Format Version 12.00
            Project("{FAE04EC0-301F-11D3-BF4B-00C04F79EFBC}") = "App", "App\\App.csproj", "{AAAAAAAA-AAAA-AAAA-AAAA-AAAAAAAAAAAA}"
            EndProject
            Global
            	GlobalSection(SolutionConfigurationPlatforms) = preSolution
            		Debug|Any CPU = Debug|Any CPU
            	EndGlobalSection
            	GlobalSection(ProjectConfigurationPlatforms) = postSolution
            		{aaaaaaaa-aaaa-aaaa-aaaa-aaaaaaaaaaaa}.Debug|Any CPU.ActiveCfg = Debug|Any CPU
            		{aaaaaaaa-aaaa-aaaa-aaaa-aaaaaaaaaaaa}.Debug|Any CPU.Build.0 = Debug|Any CPU
            		{BBBBBBBB-BBBB-BBBB-BBBB-BBBBBBBBBBBB}.Release|x64.ActiveCfg = Release|x64
            	EndGlobalSection
            EndGlobal
            """;

        Solution solution = SolutionParser.parse(content);

        assertThat(SolutionValidator.danglingConfigurations(solution))
            .containsExactly("{BBBBBBBB-BBBB-BBBB-BBBB-BBBBBBBBBBBB}");
        assertThat(solution.findProject("{AAAAAAAA-AAAA-AAAA-AAAA-AAAAAAAAAAAA}"))
            .get()
            .extracting(Project::configurations)
            .isEqualTo(new TreeSet<>(Set.of(ConfigPlatform.of("Debug", "Any CPU"))));
        assertThat(solution.projects().stream().flatMap(p -> p.configurations().stream()))
            .doesNotContain(ConfigPlatform.of("Release", "x64"));
    }

    @Test
    void missingConfigurations_correctSolution_isEmpty() {
        Solution solution = SolutionParser.parse(Fixtures.solution(Fixtures.CORRECT));

        assertThat(SolutionValidator.missingConfigurations(solution)).isEmpty();
    }

    @Test
    void missingConfigurations_pairOutsideSolution_isReportedOncePerProject() {
        Solution solution = SolutionParser.parse(Fixtures.solution(Fixtures.MISSING_CONFIGS));

        assertThat(SolutionValidator.missingConfigurations(solution)).containsExactly(
            entry("{78965571-A6C2-4161-95B1-813B46610EA7}",
                List.of(ConfigPlatform.of("Debug", "x86"))),
            entry("{D9523F4D-6CB7-4431-85F6-8122F55EB144}",
                List.of(ConfigPlatform.of("Debug", "x86"))));
    }

    @Test
    void unresolvedPaths_missingProjectFile_isReported() throws IOException {
        Path solutionFile = tempDir.resolve("missing-configs.sln");
        Files.createDirectories(tempDir.resolve("a"));
        Files.writeString(tempDir.resolve("a").resolve("a.csproj"), "<Project />");
        Solution solution = SolutionParser.parse(Fixtures.solution(Fixtures.MISSING_CONFIGS));

        assertThat(SolutionValidator.unresolvedPaths(solutionFile, solution))
            .containsExactly(tempDir.resolve("b").resolve("b.csproj").toAbsolutePath().normalize());
    }

    @Test
    void unresolvedPaths_foldersAndUrls_areNotChecked() {
        String text = """
            Microsoft Visual Studio Solution File, Format Version 12.00
            Project("{2150E333-8FDC-42A3-9474-1A3956D46DE8}") = "docs", "docs", "{11111111-1111-1111-1111-111111111111}"
            EndProject
            Project("{E24C65DC-7377-472B-9ABA-BC803B73C61A}") = "site", "http://localhost:8080/site", "{22222222-2222-2222-2222-222222222222}"
            EndProject
            Project("{FAE04EC0-301F-11D3-BF4B-00C04F79EFBC}") = "remote", "http://example.com/remote.csproj", "{33333333-3333-3333-3333-333333333333}"
            EndProject
            """;
        Solution solution = SolutionParser.parse(text);

        assertThat(SolutionValidator.unresolvedPaths(tempDir.resolve("App.sln"), solution)).isEmpty();
    }

    @Test
    void validate_solutionWithCycles_collectsAllFindings() {
        Solution solution = SolutionParser.parse(Fixtures.solution(Fixtures.CYCLES));

        ValidationReport report = SolutionValidator.validate(tempDir.resolve("cycles.sln"), solution);

        assertThat(report.cycleDetected()).isTrue();
        assertThat(report.danglingConfigurations()).isEmpty();
        assertThat(report.missingConfigurations()).isEmpty();
        assertThat(report.unresolvedPaths()).hasSize(8);
        assertThat(report.isClean()).isFalse();
    }

    @Test
    void validate_emptyReport_isClean() {
        ValidationReport report = new ValidationReport(false, null, null, null);

        assertThat(report.isClean()).isTrue();
    }
}
