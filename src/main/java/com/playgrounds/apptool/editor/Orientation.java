package com.playgrounds.apptool.editor;

import java.util.Optional;

public enum Orientation implements SwiftName {
    PORTRAIT("portrait"),
    PORTRAIT_UPSIDE_DOWN("portraitUpsideDown"),
    LANDSCAPE_LEFT("landscapeLeft"),
    LANDSCAPE_RIGHT("landscapeRight");

    private final String swiftName;

    Orientation(String swiftName) {
        this.swiftName = swiftName;
    }

    @Override
    public String swiftName() {
        return swiftName;
    }

    public static Orientation fromName(String name) {
        return SwiftName.fromName(Orientation.class, name, "orientation");
    }

    public static Optional<Orientation> find(String name) {
        return SwiftName.find(Orientation.class, name);
    }
}
