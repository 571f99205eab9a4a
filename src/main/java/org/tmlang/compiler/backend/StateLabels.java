package org.tmlang.compiler.backend;

import org.tmlang.compiler.frontend.parser.ast.Symbols;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the labels of generated states.
 * <p>
 * A module instance has the base {@code id} or {@code id-a,b} for the arguments {@code a, b}.
 * The body of an if or else case gets the base {@code <switch label>-<triggers>} or
 * {@code <switch label>-else}. The state of block {@code i} of a sequence is {@code <base>-i}.
 */
public final class StateLabels {

    private StateLabels() {
    }

    public static String moduleBase(String identifier, List<String> arguments) {
        if (arguments.isEmpty()) {
            return identifier;
        }
        return identifier + "-" + arguments.stream().map(Symbols::name).collect(Collectors.joining(","));
    }

    public static String caseBase(String switchLabel, List<String> triggers) {
        return switchLabel + "-" + triggers.stream().map(Symbols::name).collect(Collectors.joining(","));
    }

    public static String elseBase(String switchLabel) {
        return switchLabel + "-else";
    }

    public static String of(String base, int index) {
        return base + "-" + index;
    }
}
