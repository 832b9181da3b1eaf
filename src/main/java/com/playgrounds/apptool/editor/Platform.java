package com.playgrounds.apptool.editor;

import java.util.Optional;

public enum Platform implements SwiftName {
    IOS("iOS"),
    MACOS("macOS"),
    MAC_CATALYST("macCatalyst"),
    TVOS("tvOS"),
    WATCHOS("watchOS"),
    VISIONOS("visionOS"),
    DRIVERKIT("driverKit");

    private final String swiftName;

    Platform(String swiftName) {
        this.swiftName = swiftName;
    }

    @Override
    public String swiftName() {
        return swiftName;
    }

    public static Platform fromName(String name) {
        return SwiftName.fromName(Platform.class, name, "platform");
    }

    public static Optional<Platform> find(String name) {
        return SwiftName.find(Platform.class, name);
    }
}
