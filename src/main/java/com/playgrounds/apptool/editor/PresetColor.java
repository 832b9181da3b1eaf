package com.playgrounds.apptool.editor;

import java.util.Optional;

/**
 * The SwiftUI preset colors an app product can use as its accent color.
 */
public enum PresetColor implements SwiftName {
    RED("red"),
    ORANGE("orange"),
    YELLOW("yellow"),
    GREEN("green"),
    MINT("mint"),
    TEAL("teal"),
    CYAN("cyan"),
    BLUE("blue"),
    INDIGO("indigo"),
    PURPLE("purple"),
    PINK("pink"),
    BROWN("brown");

    private final String swiftName;

    PresetColor(String swiftName) {
        this.swiftName = swiftName;
    }

    @Override
    public String swiftName() {
        return swiftName;
    }

    public static PresetColor fromName(String name) {
        return SwiftName.fromName(PresetColor.class, name, "preset color");
    }

    public static Optional<PresetColor> find(String name) {
        return SwiftName.find(PresetColor.class, name);
    }
}
