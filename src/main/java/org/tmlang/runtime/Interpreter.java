package org.tmlang.runtime;

import org.tmlang.compiler.frontend.parser.ast.BasicBlockNode;
import org.tmlang.compiler.frontend.parser.ast.BlockNode;
import org.tmlang.compiler.frontend.parser.ast.CaseNode;
import org.tmlang.compiler.frontend.parser.ast.ChangeToNode;
import org.tmlang.compiler.frontend.parser.ast.CoreBasicBlockNode;
import org.tmlang.compiler.frontend.parser.ast.Direction;
import org.tmlang.compiler.frontend.parser.ast.ElseCaseNode;
import org.tmlang.compiler.frontend.parser.ast.GoToNode;
import org.tmlang.compiler.frontend.parser.ast.IfCaseNode;
import org.tmlang.compiler.frontend.parser.ast.ModuleNode;
import org.tmlang.compiler.frontend.parser.ast.MoveNode;
import org.tmlang.compiler.frontend.parser.ast.ProgramNode;
import org.tmlang.compiler.frontend.parser.ast.SwitchBlockNode;
import org.tmlang.compiler.frontend.parser.ast.TerminationNode;
import org.tmlang.compiler.frontend.parser.ast.TerminationStatus;
import org.tmlang.compiler.frontend.parser.ast.WhileCaseNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Executes a validated syntax tree directly on a tape, one step per call to {@link #step()}.
 * <p>
 * The interpreter keeps a stack of frames, one per block sequence being executed: the module
 * body at the bottom and the bodies of the if and else cases entered on top of it. A goto
 * pushes a frame for the target module on top of the caller's frames. A block without a flow
 * command continues with the next block of the innermost frame that has one, so a module body
 * that runs out of blocks returns to the block after the goto that entered it. The run
 * rejects once no frame has a block left.
 */
public class Interpreter implements TapeMachine {

    private static final Logger LOG = LoggerFactory.getLogger(Interpreter.class);

    private final Map<String, ModuleNode> modules = new HashMap<>();
    private final Tape tape;
    private final Deque<Frame> frames = new ArrayDeque<>();
    private TerminationStatus terminationStatus;

    /**
     * Prepares a run of the program's first module on the given tape.
     * @param program A program that passed semantic analysis.
     * @param tapeContent The initial tape content.
     * @throws InvalidTapeException if the tape holds a letter outside the alphabet.
     */
    public Interpreter(ProgramNode program, String tapeContent) {
        this.tape = Tape.forAlphabet(tapeContent, new HashSet<>(program.alphabet().symbols()));
        for (ModuleNode module : program.modules()) {
            modules.putIfAbsent(module.identifier(), module);
        }
        ModuleNode entry = program.modules().get(0);
        frames.push(new Frame(entry.blocks(), 0, Map.of()));
    }

    @Override
    public Optional<StepResult> step() {
        if (terminationStatus != null) {
            return Optional.empty();
        }
        String symbol = tape.read();
        Frame frame = frames.peek();
        Map<String, String> bindings = frame.bindings();
        BlockNode block = frame.block();

        if (block instanceof SwitchBlockNode) {
            CaseNode switchCase = findCase((SwitchBlockNode) block, symbol, bindings);
            if (switchCase instanceof WhileCaseNode) {
                CoreBasicBlockNode body = ((WhileCaseNode) switchCase).body();
                return Optional.of(apply(symbol, body.changeTo(), body.move(), bindings));
            }
            List<BlockNode> caseBlocks = switchCase instanceof IfCaseNode
                    ? ((IfCaseNode) switchCase).blocks()
                    : ((ElseCaseNode) switchCase).blocks();
            frames.push(new Frame(caseBlocks, 0, bindings));
            block = caseBlocks.get(0);
        }

        if (!(block instanceof BasicBlockNode)) {
            throw new IllegalStateException("Expected a basic block, found " + block.getClass().getSimpleName() + ".");
        }

        BasicBlockNode basic = (BasicBlockNode) block;
        StepResult result = apply(symbol, basic.changeTo(), basic.move(), bindings);
        if (basic.flow().isEmpty()) {
            advance();
        } else if (basic.flow().get() instanceof TerminationNode) {
            terminate(((TerminationNode) basic.flow().get()).status());
        } else {
            jump((GoToNode) basic.flow().get(), bindings);
        }
        return Optional.of(finish(result));
    }

    private CaseNode findCase(SwitchBlockNode block, String symbol, Map<String, String> bindings) {
        for (CaseNode switchCase : block.cases()) {
            if (switchCase instanceof ElseCaseNode) {
                return switchCase;
            }
            List<String> triggers = switchCase instanceof IfCaseNode
                    ? ((IfCaseNode) switchCase).triggers()
                    : ((WhileCaseNode) switchCase).triggers();
            for (String trigger : triggers) {
                if (resolve(trigger, bindings).equals(symbol)) {
                    return switchCase;
                }
            }
        }
        throw new IllegalStateException(String.format("No case applies to the symbol \"%s\".", symbol));
    }

    private StepResult apply(String symbol, Optional<ChangeToNode> changeTo, Optional<MoveNode> move,
                             Map<String, String> bindings) {
        String written = changeTo.map(c -> resolve(c.symbol(), bindings)).orElse(symbol);
        Direction direction = move.map(MoveNode::direction).orElse(Direction.LEFT);
        tape.change(written);
        tape.move(direction);
        LOG.trace("Read \"{}\", wrote \"{}\", moved {}.", symbol, written, direction);
        return new StepResult(symbol, written, direction, Optional.empty());
    }

    private StepResult finish(StepResult result) {
        if (terminationStatus == null) {
            return result;
        }
        return new StepResult(result.read(), result.written(), result.direction(), Optional.of(terminationStatus));
    }

    private void jump(GoToNode goTo, Map<String, String> bindings) {
        ModuleNode target = modules.get(goTo.moduleIdentifier());
        if (target == null) {
            throw new IllegalStateException("Undefined module " + goTo.moduleIdentifier());
        }
        Map<String, String> targetBindings = new HashMap<>();
        for (int i = 0; i < target.parameters().size(); i++) {
            targetBindings.put(target.parameters().get(i), resolve(goTo.arguments().get(i), bindings));
        }
        frames.push(new Frame(target.blocks(), 0, targetBindings));
    }

    /**
     * Moves to the next pending block, leaving every finished case and module body.
     */
    private void advance() {
        while (!frames.isEmpty()) {
            Frame top = frames.pop();
            if (top.index() + 1 < top.blocks().size()) {
                frames.push(top.next());
                return;
            }
        }
        terminate(TerminationStatus.REJECT);
    }

    private void terminate(TerminationStatus status) {
        terminationStatus = status;
        frames.clear();
        LOG.debug("Run terminated with status {}.", status);
    }

    private static String resolve(String symbol, Map<String, String> bindings) {
        return bindings.getOrDefault(symbol, symbol);
    }

    /**
     * @return The block the next step starts with, or empty once the run has ended.
     */
    public Optional<BlockNode> getCurrentBlock() {
        return terminationStatus == null ? Optional.of(frames.peek().block()) : Optional.empty();
    }

    @Override
    public Optional<TerminationStatus> getTerminationStatus() {
        return Optional.ofNullable(terminationStatus);
    }

    @Override
    public Tape getTape() {
        return tape;
    }

    /**
     * One block sequence under execution.
     *
     * @param blocks The sequence.
     * @param index The position of the current block.
     * @param bindings Parameter values visible in the sequence.
     */
    private record Frame(List<BlockNode> blocks, int index, Map<String, String> bindings) {

        BlockNode block() {
            return blocks.get(index);
        }

        Frame next() {
            return new Frame(blocks, index + 1, bindings);
        }
    }
}
