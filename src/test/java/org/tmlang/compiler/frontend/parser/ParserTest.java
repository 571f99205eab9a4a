package org.tmlang.compiler.frontend.parser;

import org.tmlang.TestPrograms;
import org.tmlang.compiler.api.CompilationException;
import org.tmlang.compiler.api.SourceSpan;
import org.tmlang.compiler.frontend.parser.ast.BasicBlockNode;
import org.tmlang.compiler.frontend.parser.ast.CoreBasicBlockNode;
import org.tmlang.compiler.frontend.parser.ast.Direction;
import org.tmlang.compiler.frontend.parser.ast.ElseCaseNode;
import org.tmlang.compiler.frontend.parser.ast.GoToNode;
import org.tmlang.compiler.frontend.parser.ast.IfCaseNode;
import org.tmlang.compiler.frontend.parser.ast.ModuleNode;
import org.tmlang.compiler.frontend.parser.ast.ProgramNode;
import org.tmlang.compiler.frontend.parser.ast.SwitchBlockNode;
import org.tmlang.compiler.frontend.parser.ast.TerminationNode;
import org.tmlang.compiler.frontend.parser.ast.TerminationStatus;
import org.tmlang.compiler.frontend.parser.ast.WhileCaseNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Parser} on well-formed programs.
 */
@Tag("unit")
public class ParserTest {

    private static ProgramNode parse(String... lines) throws CompilationException {
        return new Parser(String.join("\n", lines)).parse();
    }

    /**
     * Verifies the overall shape of a program with parametrised modules and switch blocks.
     */
    @Test
    void parsesPalindromeProgram() throws CompilationException {
        // Act
        ProgramNode program = new Parser(TestPrograms.load("palindrome")).parse();

        // Assert
        assertThat(program.alphabet().symbols()).containsExactly("a", "b");
        assertThat(program.modules()).extracting(ModuleNode::identifier).containsExactly("palindrome", "check");
        assertThat(program.modules().get(1).parameters()).containsExactly("x");

        SwitchBlockNode entrySwitch = (SwitchBlockNode) program.modules().get(0).blocks().get(0);
        assertThat(entrySwitch.cases()).hasSize(3);
        IfCaseNode firstCase = (IfCaseNode) entrySwitch.cases().get(0);
        assertThat(firstCase.triggers()).containsExactly("a");
        BasicBlockNode body = (BasicBlockNode) firstCase.blocks().get(0);
        assertThat(body.changeTo()).hasValueSatisfying(c -> assertThat(c.symbol()).isEmpty());
        assertThat(body.move()).hasValueSatisfying(m -> assertThat(m.direction()).isEqualTo(Direction.END));
        assertThat(body.flow()).hasValueSatisfying(f -> {
            assertThat(f).isInstanceOf(GoToNode.class);
            assertThat(((GoToNode) f).moduleIdentifier()).isEqualTo("check");
            assertThat(((GoToNode) f).arguments()).containsExactly("a");
        });

        SwitchBlockNode checkSwitch = (SwitchBlockNode) program.modules().get(1).blocks().get(0);
        assertThat(((IfCaseNode) checkSwitch.cases().get(0)).triggers()).containsExactly("", "x");
        assertThat(checkSwitch.cases().get(1)).isInstanceOf(ElseCaseNode.class);
    }

    /**
     * Verifies that a basic block collects its parts across lines of the same level and that a
     * new command of an earlier kind starts the next block.
     */
    @Test
    void splitsBlocksByCommandOrder() throws CompilationException {
        // Act
        ProgramNode program = parse(
                "alphabet = [a]",
                "module m():",
                "    changeto a",
                "    move right",
                "    move left",
                "    accept");

        // Assert
        ModuleNode module = program.modules().get(0);
        assertThat(module.blocks()).hasSize(2);
        BasicBlockNode first = (BasicBlockNode) module.blocks().get(0);
        assertThat(first.changeTo()).isPresent();
        assertThat(first.move()).hasValueSatisfying(m -> assertThat(m.direction()).isEqualTo(Direction.RIGHT));
        assertThat(first.flow()).isEmpty();
        BasicBlockNode second = (BasicBlockNode) module.blocks().get(1);
        assertThat(second.changeTo()).isEmpty();
        assertThat(second.move()).hasValueSatisfying(m -> assertThat(m.direction()).isEqualTo(Direction.LEFT));
        assertThat(second.flow()).hasValueSatisfying(f ->
                assertThat(((TerminationNode) f).status()).isEqualTo(TerminationStatus.ACCEPT));
    }

    /**
     * Verifies that a while case holds a core block and that the switch continues with the
     * following case at the same level.
     */
    @Test
    void parsesWhileCase() throws CompilationException {
        // Act
        ProgramNode program = new Parser(TestPrograms.load("increment")).parse();

        // Assert
        ModuleNode module = program.modules().get(0);
        assertThat(module.blocks()).hasSize(2);
        SwitchBlockNode block = (SwitchBlockNode) module.blocks().get(1);
        WhileCaseNode whileCase = (WhileCaseNode) block.cases().get(0);
        assertThat(whileCase.triggers()).containsExactly("1");
        CoreBasicBlockNode core = whileCase.body();
        assertThat(core.changeTo()).hasValueSatisfying(c -> assertThat(c.symbol()).isEqualTo("0"));
        assertThat(core.move()).hasValueSatisfying(m -> assertThat(m.direction()).isEqualTo(Direction.LEFT));
        assertThat(((IfCaseNode) block.cases().get(1)).triggers()).containsExactly("0", "");
    }

    /**
     * Verifies that a block after a switch belongs to the enclosing sequence again.
     */
    @Test
    void returnsToEnclosingLevelAfterSwitch() throws CompilationException {
        // Act
        ProgramNode program = parse(
                "alphabet = [a]",
                "module m():",
                "    if a:",
                "        move right",
                "    else:",
                "        move left",
                "    accept");

        // Assert
        ModuleNode module = program.modules().get(0);
        assertThat(module.blocks()).hasSize(2);
        assertThat(module.blocks().get(0)).isInstanceOf(SwitchBlockNode.class);
        assertThat(module.blocks().get(1)).isInstanceOf(BasicBlockNode.class);
    }

    /**
     * Verifies that a basic command after a nested switch stays in the enclosing case body.
     */
    @Test
    void continuesCaseBodyAfterNestedSwitch() throws CompilationException {
        // Act
        ProgramNode program = parse(
                "alphabet = [a]",
                "module m():",
                "    if a:",
                "        if a:",
                "            move right",
                "        else:",
                "            move left",
                "        changeto a",
                "        accept",
                "    else:",
                "        reject");

        // Assert
        ModuleNode module = program.modules().get(0);
        assertThat(module.blocks()).hasSize(1);
        SwitchBlockNode outer = (SwitchBlockNode) module.blocks().get(0);
        assertThat(outer.cases()).hasSize(2);
        IfCaseNode first = (IfCaseNode) outer.cases().get(0);
        assertThat(first.blocks()).hasSize(2);
        assertThat(first.blocks().get(0)).isInstanceOf(SwitchBlockNode.class);
        assertThat(((SwitchBlockNode) first.blocks().get(0)).cases()).hasSize(2);
        assertThat(first.blocks().get(1)).isInstanceOf(BasicBlockNode.class);
        assertThat(outer.cases().get(1)).isInstanceOf(ElseCaseNode.class);
    }

    /**
     * Verifies that composite spans reach from their first to their last token.
     */
    @Test
    void computesSpans() throws CompilationException {
        // Act
        ProgramNode program = parse(
                "alphabet = [a, b]",
                "module m():",
                "    move right",
                "    goto m()");

        // Assert
        assertThat(program.alphabet().span()).isEqualTo(new SourceSpan(0, 1, 0, 17));
        ModuleNode module = program.modules().get(0);
        BasicBlockNode block = (BasicBlockNode) module.blocks().get(0);
        assertThat(block.span()).isEqualTo(new SourceSpan(2, 4, 4, 12));
        assertThat(module.span()).isEqualTo(new SourceSpan(1, 4, 0, 12));
        assertThat(program.span()).isEqualTo(new SourceSpan(0, 4, 0, 12));
    }

    /**
     * Verifies that a trailing comma in a value list is tolerated and that an empty trigger
     * list is left for the semantic analysis.
     */
    @Test
    void acceptsTrailingCommaAndEmptyTriggers() throws CompilationException {
        // Act
        ProgramNode program = parse(
                "alphabet = [a, b,]",
                "module m():",
                "    if :",
                "        accept");

        // Assert
        assertThat(program.alphabet().symbols()).containsExactly("a", "b");
        SwitchBlockNode block = (SwitchBlockNode) program.modules().get(0).blocks().get(0);
        assertThat(((IfCaseNode) block.cases().get(0)).triggers()).isEmpty();
    }

    /**
     * Verifies that a program consisting of the alphabet only parses without modules.
     */
    @Test
    void parsesProgramWithoutModules() throws CompilationException {
        // Act
        ProgramNode program = parse("alphabet = [a, b]");

        // Assert
        assertThat(program.modules()).isEmpty();
    }
}
