package com.solv.core.syntax;

import com.solv.parser.SolutionGrammar;
import com.solv.parser.SolutionGrammarBaseVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts ANTLR parse trees produced by {@link SolutionGrammar} into {@link SyntaxNode} records.
 */
final class SyntaxTreeBuilder extends SolutionGrammarBaseVisitor<SyntaxNode> {

    @Override
    public SyntaxNode visitSolution(SolutionGrammar.SolutionContext ctx) {
        SyntaxNode.FirstLine firstLine = (SyntaxNode.FirstLine) visit(ctx.firstLine());

        List<SyntaxNode> lines = new ArrayList<>();
        if (ctx.comment() != null) {
            lines.add(visit(ctx.comment()));
        }
        for (SolutionGrammar.LineContext line : ctx.line()) {
            lines.add(visit(line));
        }
        return new SyntaxNode.Root(firstLine, lines);
    }

    @Override
    public SyntaxNode visitFirstLine(SolutionGrammar.FirstLineContext ctx) {
        return new SyntaxNode.FirstLine(ctx.NUMERIC_VERSION().getText());
    }

    @Override
    public SyntaxNode visitComment(SolutionGrammar.CommentContext ctx) {
        return new SyntaxNode.Comment(ctx.COMMENT().getText());
    }

    @Override
    public SyntaxNode visitLine(SolutionGrammar.LineContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public SyntaxNode visitVersionAssignment(SolutionGrammar.VersionAssignmentContext ctx) {
        return new SyntaxNode.VersionAssignment(ctx.IDENTIFIER().getText(), ctx.NUMERIC_VERSION().getText());
    }

    @Override
    public SyntaxNode visitProject(SolutionGrammar.ProjectContext ctx) {
        SyntaxNode.ProjectHeader header = (SyntaxNode.ProjectHeader) visit(ctx.projectHeader());
        return new SyntaxNode.Project(header, sections(ctx.section()));
    }

    @Override
    public SyntaxNode visitProjectHeader(SolutionGrammar.ProjectHeaderContext ctx) {
        return new SyntaxNode.ProjectHeader(
            ctx.typeId.getText(),
            ctx.name.getText(),
            ctx.path.getText(),
            ctx.id.getText()
        );
    }

    @Override
    public SyntaxNode visitGlobal(SolutionGrammar.GlobalContext ctx) {
        return new SyntaxNode.Global(sections(ctx.section()));
    }

    @Override
    public SyntaxNode visitSection(SolutionGrammar.SectionContext ctx) {
        SyntaxNode.SectionHeader header = (SyntaxNode.SectionHeader) visit(ctx.sectionHeader());
        List<SyntaxNode.SectionLine> lines = new ArrayList<>();
        for (SolutionGrammar.SectionLineContext line : ctx.sectionLine()) {
            lines.add((SyntaxNode.SectionLine) visit(line));
        }
        return new SyntaxNode.Section(header, lines);
    }

    @Override
    public SyntaxNode visitSectionHeader(SolutionGrammar.SectionHeaderContext ctx) {
        return new SyntaxNode.SectionHeader(
            ctx.SECTION_OPEN().getText(),
            ctx.name.getText(),
            ctx.phase.getText()
        );
    }

    @Override
    public SyntaxNode visitSectionLine(SolutionGrammar.SectionLineContext ctx) {
        return new SyntaxNode.SectionLine(ctx.SECTION_KEY().getText(), ctx.SECTION_VALUE().getText());
    }

    private List<SyntaxNode.Section> sections(List<SolutionGrammar.SectionContext> contexts) {
        List<SyntaxNode.Section> sections = new ArrayList<>();
        for (SolutionGrammar.SectionContext section : contexts) {
            sections.add((SyntaxNode.Section) visit(section));
        }
        return sections;
    }
}
