package com.playgrounds.apptool.editor;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * An enum constant that stands for a member of a PackageDescription enum, such as
 * {@code .landscapeLeft} or {@code .developerTools}.
 */
public interface SwiftName {

    /**
     * The member name as written in Package.swift, without the leading period.
     */
    String swiftName();

    default String source() {
        return "." + swiftName();
    }

    static <E extends Enum<E> & SwiftName> Optional<E> find(Class<E> type, String name) {
        if (name == null) {
            return Optional.empty();
        }
        String trimmed = name.startsWith(".") ? name.substring(1) : name;
        for (E constant : type.getEnumConstants()) {
            if (constant.swiftName().equals(trimmed)) {
                return Optional.of(constant);
            }
        }
        for (E constant : type.getEnumConstants()) {
            if (constant.swiftName().equalsIgnoreCase(trimmed)) {
                return Optional.of(constant);
            }
        }
        return Optional.empty();
    }

    /**
     * Looks up a constant by its Swift name, ignoring case and an optional leading period.
     *
     * @throws IllegalArgumentException naming the valid values if there is no such constant
     */
    static <E extends Enum<E> & SwiftName> E fromName(Class<E> type, String name, String what) {
        return find(type, name).orElseThrow(() -> new IllegalArgumentException(
                "Unknown " + what + " '" + name + "'. Valid values: " + Arrays.stream(type.getEnumConstants())
                        .map(SwiftName::swiftName)
                        .collect(Collectors.joining(", "))));
    }
}
