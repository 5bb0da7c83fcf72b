package org.logsim.compiler.frontend.parser.features.device;

import org.logsim.compiler.frontend.lexer.Symbol;
import org.logsim.compiler.frontend.lexer.SymbolType;
import org.logsim.compiler.frontend.lexer.WaveformCheck;
import org.logsim.compiler.frontend.parser.SyntaxError;

import java.util.Optional;

/**
 * The shape a device property must have, per device kind.
 */
public enum PropertyRule {
    /** The device takes no property. */
    NONE(null),
    /** Clock half-period or RC time constant: an integer without a leading zero. */
    POSITIVE_INTEGER(SyntaxError.INVALID_CLOCK_PERIOD),
    /** Initial switch state: 0 or 1. */
    BIT(SyntaxError.INVALID_SWITCH_STATE),
    /** Gate fan-in: an integer from 1 to {@value SymbolType#MAX_INPUT_PINS}. */
    FAN_IN(SyntaxError.INVALID_FAN_IN),
    /** Signal generator waveform: a run of 0s and 1s. */
    WAVEFORM(SyntaxError.INVALID_WAVEFORM);

    private final SyntaxError error;

    PropertyRule(SyntaxError error) {
        this.error = error;
    }

    /**
     * @return The error reported for a property that breaks the rule.
     * @throws IllegalStateException for {@link #NONE}.
     */
    public SyntaxError error() {
        if (error == null) {
            throw new IllegalStateException("Devices without a property have no property error");
        }
        return error;
    }

    /**
     * Checks a property symbol against the rule.
     * @param symbol The property symbol.
     * @param text The text of the symbol.
     * @return Empty if the property is valid, otherwise the caret offset within the symbol.
     */
    public Optional<Integer> violation(Symbol symbol, String text) {
        switch (this) {
            case POSITIVE_INTEGER:
                return symbol.type() == SymbolType.INTEGER ? Optional.empty() : Optional.of(0);
            case BIT:
                return "0".equals(text) || "1".equals(text) ? Optional.empty() : Optional.of(0);
            case FAN_IN:
                return isFanIn(symbol, text) ? Optional.empty() : Optional.of(0);
            case WAVEFORM:
                WaveformCheck check = Symbol.isWaveform(text);
                return check.valid() ? Optional.empty() : Optional.of(check.firstBadOffset());
            default:
                return Optional.of(0);
        }
    }

    private static boolean isFanIn(Symbol symbol, String text) {
        if (symbol.type() != SymbolType.INTEGER || text.length() > 2) {
            return false;
        }
        int fanIn = Integer.parseInt(text);
        return fanIn >= 1 && fanIn <= SymbolType.MAX_INPUT_PINS;
    }
}
