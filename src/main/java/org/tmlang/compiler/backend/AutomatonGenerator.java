package org.tmlang.compiler.backend;

import org.tmlang.automaton.Automaton;
import org.tmlang.automaton.ConstantState;
import org.tmlang.automaton.State;
import org.tmlang.automaton.Transition;
import org.tmlang.automaton.VariableState;
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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lowers a validated program into an {@link Automaton}.
 * <p>
 * Every block becomes one state. A module is lowered once per distinct list of arguments it
 * is entered with; later gotos to the same instance reuse its first state, which keeps
 * recursive programs finite. Parameters are substituted by their bound letters while lowering.
 * <p>
 * A block without a flow command continues with the next pending block of the innermost
 * enclosing sequence that still has one: the rest of a case body, then the blocks after the
 * switch, then the blocks after the goto that first entered the module instance. When no
 * sequence has a block left the run rejects.
 * <p>
 * Since an instance is lowered once, its continuation is the one of the goto that entered it
 * first. A module whose body can run out of blocks and that is entered from several places
 * continues after the first of them.
 */
public class AutomatonGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(AutomatonGenerator.class);

    private final ProgramNode program;
    private final Map<String, ModuleNode> modules = new HashMap<>();
    private final Set<String> symbols = new LinkedHashSet<>();
    private final Map<String, State> states = new LinkedHashMap<>();
    private final Set<String> instantiated = new HashSet<>();
    private final Deque<Position> nesting = new ArrayDeque<>();

    /**
     * Creates a generator for the given program.
     * @param program A program that passed semantic analysis.
     */
    public AutomatonGenerator(ProgramNode program) {
        this.program = program;
        for (ModuleNode module : program.modules()) {
            modules.putIfAbsent(module.identifier(), module);
        }
        symbols.addAll(program.alphabet().symbols());
        symbols.add(Symbols.BLANK);
    }

    /**
     * Generates the automaton. The initial state is the first state of the first module.
     * @return The automaton.
     */
    public Automaton generate() {
        if (program.modules().isEmpty()) {
            throw new IllegalStateException("Cannot generate an automaton for a program without modules.");
        }
        String initial = instantiate(program.modules().get(0), List.of());
        LOG.debug("Generated {} state(s) from {} module instance(s).", states.size(), instantiated.size());
        return new Automaton(initial, new LinkedHashSet<>(program.alphabet().symbols()), states);
    }

    /**
     * Returns the label of the first state of a module instance, lowering the instance on first use.
     */
    private String instantiate(ModuleNode module, List<String> arguments) {
        String base = StateLabels.moduleBase(module.identifier(), arguments);
        if (instantiated.add(base)) {
            LOG.debug("Lowering module instance {}.", base);
            Map<String, String> bindings = new HashMap<>();
            for (int i = 0; i < module.parameters().size(); i++) {
                bindings.put(module.parameters().get(i), arguments.get(i));
            }
            // The caller's pending blocks stay on the nesting so a body that runs out continues there.
            lowerSequence(base, module.blocks(), bindings, 0);
        }
        return StateLabels.of(base, 0);
    }

    private void lowerSequence(String base, List<BlockNode> blocks, Map<String, String> bindings, int from) {
        for (int i = from; i < blocks.size(); i++) {
            nesting.push(new Position(base, blocks.size(), i));
            lowerBlock(blocks.get(i), StateLabels.of(base, i), bindings);
            nesting.pop();
        }
    }

    private void lowerBlock(BlockNode block, String label, Map<String, String> bindings) {
        if (block instanceof BasicBlockNode) {
            Transition transition = transitionOf((BasicBlockNode) block, bindings);
            states.put(label, new ConstantState(label, transition));
        } else if (block instanceof SwitchBlockNode) {
            lowerSwitch((SwitchBlockNode) block, label, bindings);
        } else {
            throw new IllegalStateException("Expected a basic or switch block at " + label + ".");
        }
    }

    private void lowerSwitch(SwitchBlockNode block, String label, Map<String, String> bindings) {
        Map<String, Transition> transitions = new LinkedHashMap<>();
        List<Runnable> bodies = new ArrayList<>();
        for (CaseNode switchCase : block.cases()) {
            if (switchCase instanceof WhileCaseNode) {
                WhileCaseNode whileCase = (WhileCaseNode) switchCase;
                CoreBasicBlockNode body = whileCase.body();
                Transition loop = transition(body.changeTo(), body.move(), label, bindings);
                claim(transitions, resolveAll(whileCase.triggers(), bindings), loop);
                continue;
            }

            List<BlockNode> blocks;
            List<String> claimed;
            String caseBase;
            if (switchCase instanceof IfCaseNode) {
                IfCaseNode ifCase = (IfCaseNode) switchCase;
                blocks = ifCase.blocks();
                claimed = resolveAll(ifCase.triggers(), bindings);
                caseBase = StateLabels.caseBase(label, ifCase.triggers());
            } else {
                blocks = ((ElseCaseNode) switchCase).blocks();
                claimed = new ArrayList<>(symbols);
                caseBase = StateLabels.elseBase(label);
            }
            if (!(blocks.get(0) instanceof BasicBlockNode)) {
                throw new IllegalStateException("The first block of case " + caseBase + " is not a basic block.");
            }

            // The first block of the body is executed by the switch state itself.
            nesting.push(new Position(caseBase, blocks.size(), 0));
            Transition entry = transitionOf((BasicBlockNode) blocks.get(0), bindings);
            nesting.pop();
            claim(transitions, claimed, entry);
            bodies.add(() -> lowerSequence(caseBase, blocks, bindings, 1));
        }
        states.put(label, new VariableState(label, transitions));
        bodies.forEach(Runnable::run);
    }

    /**
     * Earlier cases take precedence over later ones for the same symbol.
     */
    private static void claim(Map<String, Transition> transitions, List<String> symbols, Transition transition) {
        for (String symbol : symbols) {
            transitions.putIfAbsent(symbol, transition);
        }
    }

    private Transition transitionOf(BasicBlockNode block, Map<String, String> bindings) {
        String next = block.flow().map(flow -> targetOf(flow, bindings)).orElseGet(this::fallthrough);
        return transition(block.changeTo(), block.move(), next, bindings);
    }

    private static Transition transition(Optional<ChangeToNode> changeTo, Optional<MoveNode> move, String next,
                                         Map<String, String> bindings) {
        Optional<String> write = changeTo.map(c -> resolve(c.symbol(), bindings));
        Direction direction = move.map(MoveNode::direction).orElse(Direction.LEFT);
        return new Transition(next, write, direction);
    }

    private String targetOf(FlowCommandNode flow, Map<String, String> bindings) {
        if (flow instanceof TerminationNode) {
            return ((TerminationNode) flow).status().keyword();
        }
        GoToNode goTo = (GoToNode) flow;
        ModuleNode target = modules.get(goTo.moduleIdentifier());
        if (target == null) {
            throw new IllegalStateException("Undefined module " + goTo.moduleIdentifier());
        }
        return instantiate(target, resolveAll(goTo.arguments(), bindings));
    }

    private String fallthrough() {
        for (Position position : nesting) {
            if (position.index() + 1 < position.size()) {
                return StateLabels.of(position.base(), position.index() + 1);
            }
        }
        return TerminationStatus.REJECT.keyword();
    }

    private static String resolve(String symbol, Map<String, String> bindings) {
        return bindings.getOrDefault(symbol, symbol);
    }

    private static List<String> resolveAll(List<String> values, Map<String, String> bindings) {
        List<String> resolved = new ArrayList<>(values.size());
        for (String value : values) {
            resolved.add(resolve(value, bindings));
        }
        return resolved;
    }

    /**
     * The block being lowered within one sequence of the current nesting.
     */
    private record Position(String base, int size, int index) {
    }
}
