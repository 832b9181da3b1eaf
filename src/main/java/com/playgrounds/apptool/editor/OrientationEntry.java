package com.playgrounds.apptool.editor;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * One element of {@code supportedInterfaceOrientations:}.
 *
 * @param name the orientation member name, e.g. {@code landscapeLeft}
 * @param deviceFamilies the families of a {@code .when(deviceFamilies:)} condition; empty when
 *                       the orientation applies everywhere
 * @param source the element as written, without surrounding trivia
 */
public record OrientationEntry(String name, ImmutableList<DeviceFamily> deviceFamilies, String source) {

    public boolean isConditional() {
        return deviceFamilies.notEmpty();
    }
}
