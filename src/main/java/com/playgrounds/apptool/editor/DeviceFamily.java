package com.playgrounds.apptool.editor;

import java.util.Optional;

public enum DeviceFamily implements SwiftName {
    PAD("pad"),
    PHONE("phone"),
    MAC("mac"),
    TV("tv"),
    VISION("vision");

    private final String swiftName;

    DeviceFamily(String swiftName) {
        this.swiftName = swiftName;
    }

    @Override
    public String swiftName() {
        return swiftName;
    }

    public static DeviceFamily fromName(String name) {
        return SwiftName.fromName(DeviceFamily.class, name, "device family");
    }

    public static Optional<DeviceFamily> find(String name) {
        return SwiftName.find(DeviceFamily.class, name);
    }
}
