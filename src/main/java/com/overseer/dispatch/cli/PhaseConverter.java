package com.overseer.dispatch.cli;

import com.overseer.core.model.Phase;
import picocli.CommandLine;
import picocli.CommandLine.ITypeConverter;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Parses phase names as written in task files ({@code main}, {@code discovery}, ...).
 */
public class PhaseConverter implements ITypeConverter<Phase> {

    @Override
    public Phase convert(String value) {
        return Phase.fromWire(value).orElseThrow(() -> new CommandLine.TypeConversionException(
                "Unknown phase '" + value + "', expected one of " + Arrays.stream(Phase.values())
                        .map(Phase::wireName).collect(Collectors.joining(", "))));
    }
}
