package org.tmlang.compiler.frontend.parser;

import org.tmlang.compiler.api.CompilationException;
import org.tmlang.compiler.api.SourceSpan;
import org.tmlang.compiler.diagnostics.Diagnostic;
import org.tmlang.compiler.frontend.lexer.IndentationChange;
import org.tmlang.compiler.frontend.lexer.Lexer;
import org.tmlang.compiler.frontend.parser.ast.AlphabetNode;
import org.tmlang.compiler.frontend.parser.ast.BasicBlockNode;
import org.tmlang.compiler.frontend.parser.ast.BlockNode;
import org.tmlang.compiler.frontend.parser.ast.CaseNode;
import org.tmlang.compiler.frontend.parser.ast.ChangeToNode;
import org.tmlang.compiler.frontend.parser.ast.CoreBasicBlockNode;
import org.tmlang.compiler.frontend.parser.ast.Direction;
import org.tmlang.compiler.frontend.parser.ast.ElseCaseNode;
import org.tmlang.compiler.frontend.parser.ast.FlowCommandNode;
import org.tmlang.compiler.frontend.parser.ast.GoToNode;
import org.tmlang.compiler.frontend.parser.ast.IfCaseNode;
import org.tmlang.compiler.frontend.parser.ast.ModuleNode;
import org.tmlang.compiler.frontend.parser.ast.MoveNode;
import org.tmlang.compiler.frontend.parser.ast.ProgramNode;
import org.tmlang.compiler.frontend.parser.ast.SwitchBlockNode;
import org.tmlang.compiler.frontend.parser.ast.Symbols;
import org.tmlang.compiler.frontend.parser.ast.TerminationNode;
import org.tmlang.compiler.frontend.parser.ast.TerminationStatus;
import org.tmlang.compiler.frontend.parser.ast.WhileCaseNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A recursive-descent parser that consumes the tokens of a {@link Lexer} and produces
 * the syntax tree of a program.
 * <p>
 * Block structure is given by indentation alone: every move to the next token states
 * whether the indentation may grow, shrink or whether the input may end there. The parser
 * stops at the first error by throwing a {@link CompilationException}.
 */
public class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private static final Set<String> CASE_KEYWORDS = Set.of("if", "while", "else");
    private static final Set<String> BASIC_COMMANDS = Set.of("changeto", "move", "goto");
    private static final Pattern LETTER = Pattern.compile("[a-z0-9]");

    private final Lexer lexer;
    private boolean reachedEnd = false;

    /**
     * Constructs a new Parser for the given source code.
     * @param source The program text.
     */
    public Parser(String source) {
        this(new Lexer(source));
    }

    /**
     * Constructs a new Parser reading from the given lexer.
     * @param lexer A lexer that has not been advanced yet.
     */
    public Parser(Lexer lexer) {
        this.lexer = lexer;
    }

    /**
     * Parses the whole program.
     * @return The root of the syntax tree.
     * @throws CompilationException at the first indentation or syntax error.
     */
    public ProgramNode parse() throws CompilationException {
        moveNext();
        ProgramNode program = parseProgram();
        LOG.debug("Parsed program with {} module(s).", program.modules().size());
        return program;
    }

    // --- Token navigation ---

    private void moveNext() throws CompilationException {
        moveNext(false, false, false);
    }

    private void moveNext(boolean deIndentAllowed, boolean indentAllowed, boolean endAllowed)
            throws CompilationException {
        int previousDepth = lexer.indentationDepth();
        if (!lexer.advance()) {
            reachedEnd = true;
        }
        int depth = lexer.indentationDepth();
        if (lexer.lastIndentationChange() == IndentationChange.INVALID) {
            throw indentationError("Invalid indentation.");
        } else if (!deIndentAllowed && depth < previousDepth) {
            throw indentationError("Unexpected de-indentation.");
        } else if (!indentAllowed && depth > previousDepth) {
            throw indentationError("Unexpected indentation.");
        }
        if (reachedEnd && !endAllowed) {
            throw syntaxError("Unexpected end of file.");
        }
    }

    private String current() {
        return lexer.currentValue();
    }

    private SourceSpan position() {
        return reachedEnd || !lexer.hasCurrent() ? lexer.endOfInputSpan() : lexer.currentSpan();
    }

    private void match(String expected) throws CompilationException {
        if (!current().equals(expected)) {
            throw syntaxError(String.format("Expected value \"%s\" to be \"%s\".", current(), expected));
        }
    }

    private void matchIndent() throws CompilationException {
        int previousDepth = lexer.indentationDepth();
        moveNext(false, true, false);
        if (lexer.indentationDepth() != previousDepth + 1 || lexer.lastIndentationChange() != IndentationChange.INDENT) {
            throw indentationError("Expected indentation.");
        }
    }

    /**
     * Moves on and reports whether the move left the current indentation level.
     */
    private boolean checkDeIndent() throws CompilationException {
        int previousDepth = lexer.indentationDepth();
        moveNext(true, false, true);
        return reachedEnd || lexer.indentationDepth() < previousDepth;
    }

    private void doUntilDeIndent(ParseAction action) throws CompilationException {
        int depth = lexer.indentationDepth();
        while (!reachedEnd && lexer.indentationDepth() >= depth) {
            action.run();
        }
    }

    @FunctionalInterface
    private interface ParseAction {
        void run() throws CompilationException;
    }

    // --- Grammar ---

    private ProgramNode parseProgram() throws CompilationException {
        SourceSpan start = position();
        AlphabetNode alphabet = parseAlphabet();
        SourceSpan end = alphabet.span();
        moveNext(false, false, true);

        List<ModuleNode> modules = new ArrayList<>();
        while (!reachedEnd) {
            ModuleNode module = parseModule();
            modules.add(module);
            end = module.span();
        }
        return new ProgramNode(SourceSpan.combine(start, end), alphabet, modules);
    }

    /**
     * Parses a comma separated list of letters up to (not past) the closing token.
     * A trailing comma is tolerated.
     */
    private List<String> parseValues(String closing, boolean blankAllowed) throws CompilationException {
        List<String> values = new ArrayList<>();
        boolean commaMissing = false;
        while (!current().equals(closing)) {
            if (commaMissing) {
                throw syntaxError(String.format("Expected value \"%s\" to be \"%s\".", current(), closing));
            }
            String value = current();
            if (blankAllowed && value.equals(Symbols.BLANK_KEYWORD)) {
                values.add(Symbols.BLANK);
            } else {
                if (value.length() != 1) {
                    throw syntaxError(String.format("The value \"%s\" must have length 1.", value));
                }
                if (!LETTER.matcher(value).matches()) {
                    throw syntaxError(String.format("The value \"%s\" must be a lowercase character or a number.", value));
                }
                values.add(value);
            }
            moveNext();
            if (current().equals(",")) {
                moveNext();
            } else {
                commaMissing = true;
            }
        }
        return values;
    }

    private AlphabetNode parseAlphabet() throws CompilationException {
        SourceSpan start = position();
        match("alphabet");
        moveNext();
        match("=");
        moveNext();
        match("[");
        moveNext();
        List<String> symbols = parseValues("]", false);
        return new AlphabetNode(SourceSpan.combine(start, position()), symbols);
    }

    private ModuleNode parseModule() throws CompilationException {
        SourceSpan start = position();
        match("module");
        moveNext();

        String identifier = current();
        moveNext();

        match("(");
        moveNext();
        List<String> parameters = parseValues(")", false);
        moveNext();

        match(":");
        matchIndent();

        List<BlockNode> blocks = parseBlocks();
        SourceSpan end = blocks.get(blocks.size() - 1).span();
        return new ModuleNode(SourceSpan.combine(start, end), identifier, parameters, blocks);
    }

    private List<BlockNode> parseBlocks() throws CompilationException {
        List<BlockNode> blocks = new ArrayList<>();
        doUntilDeIndent(() -> blocks.add(parseBlock()));
        return blocks;
    }

    private BlockNode parseBlock() throws CompilationException {
        if (CASE_KEYWORDS.contains(current())) {
            return parseSwitchBlock();
        }
        return parseBasicBlock();
    }

    private SwitchBlockNode parseSwitchBlock() throws CompilationException {
        SourceSpan start = position();
        List<CaseNode> cases = new ArrayList<>();
        int depth = lexer.indentationDepth();
        // A basic command at the level of the cases starts the block after the switch.
        while (!reachedEnd && lexer.indentationDepth() >= depth && !startsBasicBlock()) {
            switch (current()) {
                case "if":
                    cases.add(parseIf());
                    break;
                case "while":
                    cases.add(parseWhile());
                    break;
                case "else":
                    cases.add(parseElse());
                    break;
                default:
                    throw syntaxError(String.format("Unexpected start of case: \"%s\".", current()));
            }
        }
        SourceSpan end = cases.get(cases.size() - 1).span();
        return new SwitchBlockNode(SourceSpan.combine(start, end), cases);
    }

    private boolean startsBasicBlock() {
        return BASIC_COMMANDS.contains(current()) || TerminationStatus.fromKeyword(current()).isPresent();
    }

    private IfCaseNode parseIf() throws CompilationException {
        SourceSpan start = position();
        match("if");
        moveNext();
        List<String> triggers = parseValues(":", true);
        matchIndent();
        List<BlockNode> blocks = parseBlocks();
        SourceSpan end = blocks.get(blocks.size() - 1).span();
        return new IfCaseNode(SourceSpan.combine(start, end), triggers, blocks);
    }

    private WhileCaseNode parseWhile() throws CompilationException {
        SourceSpan start = position();
        match("while");
        moveNext();
        List<String> triggers = parseValues(":", true);
        matchIndent();
        CoreBasicBlockNode body = parseCoreBlock();
        return new WhileCaseNode(SourceSpan.combine(start, body.span()), triggers, body);
    }

    private ElseCaseNode parseElse() throws CompilationException {
        SourceSpan start = position();
        match("else");
        moveNext();
        match(":");
        matchIndent();
        List<BlockNode> blocks = parseBlocks();
        SourceSpan end = blocks.get(blocks.size() - 1).span();
        return new ElseCaseNode(SourceSpan.combine(start, end), blocks);
    }

    private BasicBlockNode parseBasicBlock() throws CompilationException {
        SourceSpan start = position();
        SourceSpan end = null;
        ChangeToNode changeTo = null;
        MoveNode move = null;
        FlowCommandNode flow = null;
        boolean finished = false;

        if (current().equals("changeto")) {
            changeTo = parseChangeTo();
            end = changeTo.span();
            finished = checkDeIndent();
        }
        if (!finished && current().equals("move")) {
            move = parseMove();
            end = move.span();
            finished = checkDeIndent();
        }
        if (!finished && TerminationStatus.fromKeyword(current()).isPresent()) {
            flow = parseTermination();
            end = flow.span();
            moveNext(true, false, true);
        } else if (!finished && current().equals("goto")) {
            flow = parseGoTo();
            end = flow.span();
            moveNext(true, false, true);
        }

        if (end == null) {
            throw new CompilationException(Diagnostic.Category.SYNTAX,
                    String.format("Invalid basic command \"%s\".", current()), start);
        }
        return new BasicBlockNode(SourceSpan.combine(start, end),
                Optional.ofNullable(changeTo), Optional.ofNullable(move), Optional.ofNullable(flow));
    }

    private CoreBasicBlockNode parseCoreBlock() throws CompilationException {
        SourceSpan start = position();
        SourceSpan end = null;
        ChangeToNode changeTo = null;
        MoveNode move = null;
        boolean finished = false;

        if (current().equals("changeto")) {
            changeTo = parseChangeTo();
            end = changeTo.span();
            finished = checkDeIndent();
        }
        if (!finished && current().equals("move")) {
            move = parseMove();
            end = move.span();
            finished = checkDeIndent();
        }

        if (end == null) {
            throw new CompilationException(Diagnostic.Category.SYNTAX,
                    String.format("Invalid core command \"%s\".", current()), start);
        }
        if (!finished) {
            throw syntaxError("A core block must only be composed of a changeto and a move command.");
        }
        return new CoreBasicBlockNode(SourceSpan.combine(start, end),
                Optional.ofNullable(changeTo), Optional.ofNullable(move));
    }

    private ChangeToNode parseChangeTo() throws CompilationException {
        SourceSpan start = position();
        moveNext();
        String symbol = current().equals(Symbols.BLANK_KEYWORD) ? Symbols.BLANK : current();
        return new ChangeToNode(SourceSpan.combine(start, position()), symbol);
    }

    private MoveNode parseMove() throws CompilationException {
        SourceSpan start = position();
        moveNext();
        Optional<Direction> direction = Direction.fromKeyword(current());
        if (direction.isEmpty()) {
            throw syntaxError(String.format("Invalid direction \"%s\".", current()));
        }
        return new MoveNode(SourceSpan.combine(start, position()), direction.get());
    }

    private GoToNode parseGoTo() throws CompilationException {
        SourceSpan start = position();
        moveNext();

        String identifier = current();
        moveNext();

        match("(");
        moveNext();
        List<String> arguments = parseValues(")", false);
        return new GoToNode(SourceSpan.combine(start, position()), identifier, arguments);
    }

    private TerminationNode parseTermination() {
        TerminationStatus status = TerminationStatus.fromKeyword(current())
                .orElseThrow(() -> new IllegalStateException("Not a termination keyword: " + current()));
        return new TerminationNode(position(), status);
    }

    // --- Errors ---

    private CompilationException syntaxError(String message) {
        return new CompilationException(Diagnostic.Category.SYNTAX, message, position());
    }

    private CompilationException indentationError(String message) {
        return new CompilationException(Diagnostic.Category.INDENTATION, message, position());
    }
}
