package org.tmlang.compiler.frontend.parser.ast;

import java.util.Locale;
import java.util.Optional;

/**
 * The final status of a run.
 */
public enum TerminationStatus {
    ACCEPT,
    REJECT,
    HALT;

    /**
     * Looks up a status by its keyword.
     * @param keyword The keyword as written in source code, e.g. {@code accept}.
     * @return The status, or empty if the keyword names none.
     */
    public static Optional<TerminationStatus> fromKeyword(String keyword) {
        for (TerminationStatus status : values()) {
            if (status.keyword().equals(keyword)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    /**
     * @return The keyword of this status, which is also its reserved state label.
     */
    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }
}
