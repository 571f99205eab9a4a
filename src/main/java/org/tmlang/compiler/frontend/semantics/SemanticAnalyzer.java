package org.tmlang.compiler.frontend.semantics;

import org.tmlang.compiler.api.CompilationException;
import org.tmlang.compiler.api.SourceSpan;
import org.tmlang.compiler.diagnostics.Diagnostic;
import org.tmlang.compiler.frontend.parser.ast.AlphabetNode;
import org.tmlang.compiler.frontend.parser.ast.AstNode;
import org.tmlang.compiler.frontend.parser.ast.AstVisitor;
import org.tmlang.compiler.frontend.parser.ast.BasicBlockNode;
import org.tmlang.compiler.frontend.parser.ast.BlockNode;
import org.tmlang.compiler.frontend.parser.ast.CaseNode;
import org.tmlang.compiler.frontend.parser.ast.ChangeToNode;
import org.tmlang.compiler.frontend.parser.ast.CoreBasicBlockNode;
import org.tmlang.compiler.frontend.parser.ast.ElseCaseNode;
import org.tmlang.compiler.frontend.parser.ast.GoToNode;
import org.tmlang.compiler.frontend.parser.ast.IfCaseNode;
import org.tmlang.compiler.frontend.parser.ast.ModuleNode;
import org.tmlang.compiler.frontend.parser.ast.MoveNode;
import org.tmlang.compiler.frontend.parser.ast.ProgramNode;
import org.tmlang.compiler.frontend.parser.ast.SwitchBlockNode;
import org.tmlang.compiler.frontend.parser.ast.Symbols;
import org.tmlang.compiler.frontend.parser.ast.TerminationNode;
import org.tmlang.compiler.frontend.parser.ast.WhileCaseNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks the semantic rules of a parsed program in a single pass over the tree.
 * <p>
 * The analyzer does not modify the tree and stops at the first violation, visiting
 * nodes in source order.
 */
public class SemanticAnalyzer implements AstVisitor<Void> {

    private static final Logger LOG = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private final ProgramNode program;
    private final Map<String, Integer> parameterCounts = new HashMap<>();
    private Set<String> alphabet = Set.of();
    private Set<String> parameters = Set.of();

    /**
     * Creates an analyzer for the given program.
     * @param program The syntax tree to check.
     */
    public SemanticAnalyzer(ProgramNode program) {
        this.program = program;
    }

    /**
     * Checks the whole program.
     * @throws CompilationException at the first semantic error.
     */
    public void analyze() throws CompilationException {
        try {
            visit(program);
        } catch (SemanticError e) {
            throw new CompilationException(e.diagnostic);
        }
        LOG.debug("Program passed semantic analysis.");
    }

    @Override
    public Void visit(ProgramNode node) {
        visit(node.alphabet());
        for (ModuleNode module : node.modules()) {
            if (parameterCounts.containsKey(module.identifier())) {
                throw error(module.span(), "Duplicate module with name \"%s\".", module.identifier());
            }
            parameterCounts.put(module.identifier(), module.parameters().size());
        }
        if (node.modules().isEmpty()) {
            throw error(node.span(), "A program should have at least one module.");
        }
        ModuleNode entry = node.modules().get(0);
        if (!entry.parameters().isEmpty()) {
            throw error(entry.span(), "The first module cannot have parameters.");
        }
        visitAll(node.modules());
        return null;
    }

    @Override
    public Void visit(AlphabetNode node) {
        if (node.symbols().isEmpty()) {
            throw error(node.span(), "The alphabet must have at least one letter.");
        }
        alphabet = new LinkedHashSet<>(node.symbols());
        return null;
    }

    @Override
    public Void visit(ModuleNode node) {
        parameters = new HashSet<>();
        for (String parameter : node.parameters()) {
            if (alphabet.contains(parameter)) {
                throw error(node.span(), "The letter \"%s\" is both in the alphabet and a module parameter.", parameter);
            }
            if (!parameters.add(parameter)) {
                throw error(node.span(), "Duplicate parameter \"%s\" in module \"%s\".", parameter, node.identifier());
            }
        }
        visitAll(node.blocks());
        return null;
    }

    @Override
    public Void visit(SwitchBlockNode node) {
        Set<String> uncovered = new LinkedHashSet<>(alphabet);
        uncovered.add(Symbols.BLANK);
        uncovered.addAll(parameters);

        Set<String> seenTriggers = new HashSet<>();
        boolean seenElse = false;
        boolean seenParameter = false;
        List<CaseNode> cases = node.cases();
        for (int i = 0; i < cases.size(); i++) {
            CaseNode switchCase = cases.get(i);
            if (switchCase instanceof ElseCaseNode) {
                if (i != cases.size() - 1) {
                    throw error(switchCase.span(), "A non-final case cannot be an else block");
                }
                seenElse = true;
                continue;
            }
            for (String trigger : triggersOf(switchCase)) {
                if (parameters.contains(trigger)) {
                    seenParameter = true;
                } else if (!trigger.equals(Symbols.BLANK) && !alphabet.contains(trigger)) {
                    throw error(switchCase.span(), "Undefined letter: \"%s\".", trigger);
                }
                if (!seenTriggers.add(trigger)) {
                    throw error(switchCase.span(), "The letter %s is covered by more than one case.", Symbols.describe(trigger));
                }
                uncovered.remove(trigger);
            }
        }

        visitAll(cases);

        if (seenParameter && !seenElse) {
            throw error(node.span(), "If parametrised letters are used then the switch block must have an else case.");
        }
        uncovered.removeAll(parameters);
        if (!seenElse && !uncovered.isEmpty()) {
            String missing = uncovered.stream().map(Symbols::describe).collect(Collectors.joining(", "));
            String noun = uncovered.size() == 1 ? "letter" : "letters";
            throw error(node.span(), "The switch block doesn't have a case for the %s: %s.", noun, missing);
        }
        return null;
    }

    private static List<String> triggersOf(CaseNode switchCase) {
        if (switchCase instanceof IfCaseNode) {
            return ((IfCaseNode) switchCase).triggers();
        } else if (switchCase instanceof WhileCaseNode) {
            return ((WhileCaseNode) switchCase).triggers();
        }
        return List.of();
    }

    @Override
    public Void visit(IfCaseNode node) {
        if (node.triggers().isEmpty()) {
            throw error(node.span(), "An if case must apply to at least one letter.");
        }
        requireBasicFirstBlock(node.blocks(), "if");
        visitAll(node.blocks());
        return null;
    }

    @Override
    public Void visit(WhileCaseNode node) {
        if (node.triggers().isEmpty()) {
            throw error(node.span(), "A while case must apply to at least one letter.");
        }
        visit(node.body());
        return null;
    }

    @Override
    public Void visit(ElseCaseNode node) {
        requireBasicFirstBlock(node.blocks(), "else");
        visitAll(node.blocks());
        return null;
    }

    private void requireBasicFirstBlock(List<BlockNode> blocks, String caseKind) {
        BlockNode first = blocks.get(0);
        if (!(first instanceof BasicBlockNode)) {
            throw error(first.span(), "The first block within an %s case must be a basic block.", caseKind);
        }
    }

    @Override
    public Void visit(BasicBlockNode node) {
        node.changeTo().ifPresent(this::visit);
        node.flow().ifPresent(this::visit);
        node.move().ifPresent(this::visit);
        return null;
    }

    @Override
    public Void visit(CoreBasicBlockNode node) {
        node.changeTo().ifPresent(this::visit);
        return null;
    }

    @Override
    public Void visit(ChangeToNode node) {
        requireLetter(node.span(), node.symbol(), true);
        return null;
    }

    @Override
    public Void visit(GoToNode node) {
        Integer expected = parameterCounts.get(node.moduleIdentifier());
        if (expected == null) {
            throw error(node.span(), "Undefined module \"%s\".", node.moduleIdentifier());
        }
        if (node.arguments().size() != expected) {
            throw error(node.span(), "Expected %d %s.", expected, expected == 1 ? "argument" : "arguments");
        }
        for (String argument : node.arguments()) {
            requireLetter(node.span(), argument, false);
        }
        return null;
    }

    @Override
    public Void visit(MoveNode node) {
        return null;
    }

    @Override
    public Void visit(TerminationNode node) {
        return null;
    }

    private void requireLetter(SourceSpan span, String symbol, boolean blankAllowed) {
        boolean blank = blankAllowed && symbol.equals(Symbols.BLANK);
        if (!blank && !alphabet.contains(symbol) && !parameters.contains(symbol)) {
            throw error(span, "Undefined letter: \"%s\".", symbol);
        }
    }

    private void visitAll(List<? extends AstNode> nodes) {
        for (AstNode node : nodes) {
            visit(node);
        }
    }

    private static SemanticError error(SourceSpan span, String format, Object... args) {
        return new SemanticError(new Diagnostic(Diagnostic.Category.SEMANTIC, String.format(format, args), span));
    }

    /**
     * Carries a diagnostic out of the visitor methods, which cannot declare checked exceptions.
     */
    private static final class SemanticError extends RuntimeException {
        private final transient Diagnostic diagnostic;

        SemanticError(Diagnostic diagnostic) {
            super(diagnostic.message(), null, false, false);
            this.diagnostic = diagnostic;
        }
    }
}
