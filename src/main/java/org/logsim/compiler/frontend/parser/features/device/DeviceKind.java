package org.logsim.compiler.frontend.parser.features.device;

import org.logsim.compiler.frontend.parser.SyntaxError;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The device keywords and the property each of them takes.
 */
public enum DeviceKind {
    CLOCK(PropertyRule.POSITIVE_INTEGER),
    RC(PropertyRule.POSITIVE_INTEGER),
    SWITCH(PropertyRule.BIT),
    AND(PropertyRule.FAN_IN),
    NAND(PropertyRule.FAN_IN),
    OR(PropertyRule.FAN_IN),
    NOR(PropertyRule.FAN_IN),
    SIGGEN(PropertyRule.WAVEFORM),
    XOR(PropertyRule.NONE),
    DTYPE(PropertyRule.NONE);

    private static final Map<String, DeviceKind> BY_KEYWORD = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(DeviceKind::name, Function.identity()));

    private final PropertyRule propertyRule;

    DeviceKind(PropertyRule propertyRule) {
        this.propertyRule = propertyRule;
    }

    /**
     * @param keyword The keyword text, e.g. "NAND".
     * @return The device kind, or empty if the text is not a device keyword.
     */
    public static Optional<DeviceKind> fromKeyword(String keyword) {
        return Optional.ofNullable(BY_KEYWORD.get(keyword));
    }

    public PropertyRule propertyRule() {
        return propertyRule;
    }

    public boolean hasProperty() {
        return propertyRule != PropertyRule.NONE;
    }

    /**
     * @return The error for a device item that stops right after its keyword or name.
     */
    public SyntaxError missingParameterError() {
        return hasProperty() ? SyntaxError.MISSING_DEVICE_PARAMETER : SyntaxError.MISSING_DEVICE_NAME;
    }
}
