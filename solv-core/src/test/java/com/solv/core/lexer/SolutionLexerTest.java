package com.solv.core.lexer;

import com.solv.core.diagnostic.DiagnosticCategory;
import com.solv.core.diagnostic.SolutionSyntaxException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link SolutionLexer}.
 */
class SolutionLexerTest {

    @Test
    void tokenize_formatLine_producesIdentifiersCommaAndVersion() {
        List<SolutionToken> tokens = SolutionLexer.tokenize(
            "Microsoft Visual Studio Solution File, Format Version 12.00");

        assertThat(tokens).extracting(SolutionToken::kind, SolutionToken::text).containsExactly(
            tuple(TokenKind.IDENTIFIER, "Microsoft"),
            tuple(TokenKind.IDENTIFIER, "Visual"),
            tuple(TokenKind.IDENTIFIER, "Studio"),
            tuple(TokenKind.IDENTIFIER, "Solution"),
            tuple(TokenKind.IDENTIFIER, "File"),
            tuple(TokenKind.COMMA, ","),
            tuple(TokenKind.IDENTIFIER, "Format"),
            tuple(TokenKind.IDENTIFIER, "Version"),
            tuple(TokenKind.NUMERIC_VERSION, "12.00")
        );
    }

    @Test
    void tokenize_projectHeader_turnsQuotedGuidsIntoGuidTokens() {
        String line = "Project(\"{FAE04EC0-301F-11D3-BF4B-00C04F79EFBC}\") = \"App\", \"App\\App.csproj\", "
            + "\"{27060CA7-FB29-42BC-BA66-7FC80D498354}\"";

        List<SolutionToken> tokens = SolutionLexer.tokenize(line);

        assertThat(tokens).extracting(SolutionToken::kind, SolutionToken::text).containsExactly(
            tuple(TokenKind.SECTION_OPEN_MARKER, "Project"),
            tuple(TokenKind.GUID, "{FAE04EC0-301F-11D3-BF4B-00C04F79EFBC}"),
            tuple(TokenKind.EQUALS, "="),
            tuple(TokenKind.QUOTED_STRING, "App"),
            tuple(TokenKind.COMMA, ","),
            tuple(TokenKind.QUOTED_STRING, "App\\App.csproj"),
            tuple(TokenKind.COMMA, ","),
            tuple(TokenKind.GUID, "{27060CA7-FB29-42BC-BA66-7FC80D498354}")
        );
    }

    @Test
    void tokenize_quotedString_offsetsExcludeQuotes() {
        List<SolutionToken> tokens = SolutionLexer.tokenize("\"App\"");

        assertThat(tokens).singleElement().satisfies(token -> {
            assertThat(token.start()).isEqualTo(1);
            assertThat(token.end()).isEqualTo(4);
        });
    }

    @Test
    void tokenize_sectionBody_splitsLinesIntoKeyAndValue() {
        String section = """
            GlobalSection(ProjectConfigurationPlatforms) = postSolution
            \t\t{A}.Debug .NET 4.0|Any CPU.ActiveCfg = Debug .NET 4.0|Any CPU
            \t\t{A}.Release|x86.Build.0 =  Release|x86\t
            \tEndGlobalSection""";

        List<SolutionToken> tokens = SolutionLexer.tokenize(section);

        assertThat(tokens).extracting(SolutionToken::kind, SolutionToken::text).containsExactly(
            tuple(TokenKind.SECTION_OPEN_MARKER, "GlobalSection"),
            tuple(TokenKind.IDENTIFIER, "ProjectConfigurationPlatforms"),
            tuple(TokenKind.EQUALS, "="),
            tuple(TokenKind.IDENTIFIER, "postSolution"),
            tuple(TokenKind.SECTION_KEY, "{A}.Debug .NET 4.0|Any CPU.ActiveCfg"),
            tuple(TokenKind.SECTION_VALUE, "Debug .NET 4.0|Any CPU"),
            tuple(TokenKind.SECTION_KEY, "{A}.Release|x86.Build.0"),
            tuple(TokenKind.SECTION_VALUE, "Release|x86"),
            tuple(TokenKind.SECTION_CLOSE_MARKER, "EndGlobalSection")
        );
    }

    @Test
    void tokenize_emptySection_producesNoLineTokens() {
        String section = """
            ProjectSection(ProjectDependencies) = postProject
            \tEndProjectSection
            EndProject""";

        List<SolutionToken> tokens = SolutionLexer.tokenize(section);

        assertThat(tokens).extracting(SolutionToken::kind).containsExactly(
            TokenKind.SECTION_OPEN_MARKER,
            TokenKind.IDENTIFIER,
            TokenKind.EQUALS,
            TokenKind.IDENTIFIER,
            TokenKind.SECTION_CLOSE_MARKER,
            TokenKind.SECTION_CLOSE_MARKER
        );
    }

    @Test
    void tokenize_comment_runsToEndOfLine() {
        List<SolutionToken> tokens = SolutionLexer.tokenize("# Visual Studio Version 17\r\nVisualStudioVersion = 17.0.31903.59");

        assertThat(tokens).extracting(SolutionToken::kind, SolutionToken::text).containsExactly(
            tuple(TokenKind.COMMENT, "# Visual Studio Version 17"),
            tuple(TokenKind.IDENTIFIER, "VisualStudioVersion"),
            tuple(TokenKind.EQUALS, "="),
            tuple(TokenKind.NUMERIC_VERSION, "17.0.31903.59")
        );
    }

    @Test
    void tokenize_unknownCharacter_producesInvalidToken() {
        List<SolutionToken> tokens = SolutionLexer.tokenize("Global $");

        assertThat(tokens).extracting(SolutionToken::kind).containsExactly(TokenKind.IDENTIFIER, TokenKind.INVALID);
        assertThat(tokens.get(1).start()).isEqualTo(7);
    }

    @Test
    void tokenize_unterminatedString_failsWithPrematureEof() {
        assertThatThrownBy(() -> SolutionLexer.tokenize("Project(\"{A}\") = \"App"))
            .isInstanceOf(SolutionSyntaxException.class)
            .satisfies(e -> {
                SolutionSyntaxException failure = (SolutionSyntaxException) e;
                assertThat(failure.getDiagnostic().category()).isEqualTo(DiagnosticCategory.LEXER_PREMATURE_EOF);
                assertThat(failure.getDiagnostic().span().start()).isEqualTo(17);
            });
    }

    @Test
    void tokenize_unterminatedGuid_failsWithPrematureEof() {
        assertThatThrownBy(() -> SolutionLexer.tokenize("{27060CA7-FB29"))
            .isInstanceOf(SolutionSyntaxException.class)
            .satisfies(e -> assertThat(((SolutionSyntaxException) e).getDiagnostic().category())
                .isEqualTo(DiagnosticCategory.LEXER_PREMATURE_EOF));
    }

    @Test
    void tokenize_sectionKeyWithoutEquals_failsWithPrematureEof() {
        String text = "GlobalSection(SolutionProperties) = preSolution\n\t\tHideSolutionNode";

        assertThatThrownBy(() -> SolutionLexer.tokenize(text))
            .isInstanceOf(SolutionSyntaxException.class)
            .satisfies(e -> assertThat(((SolutionSyntaxException) e).getDiagnostic().span().start())
                .isEqualTo(text.indexOf("HideSolutionNode")));
    }

    @Test
    void nextToken_exhaustedInput_returnsNull() {
        SolutionLexer lexer = new SolutionLexer("Global");

        assertThat(lexer.nextToken()).isNotNull();
        assertThat(lexer.nextToken()).isNull();
        assertThat(lexer.hasNext()).isFalse();
        assertThat(lexer.position()).isEqualTo(6);
    }
}
