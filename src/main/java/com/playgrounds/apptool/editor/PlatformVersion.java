package com.playgrounds.apptool.editor;

/**
 * One entry of {@code platforms:}, e.g. {@code .iOS("17.0")}.
 *
 * @param platform the platform
 * @param version the minimum version in dotted form; {@code .v10_15} reads as {@code 10.15}
 */
public record PlatformVersion(Platform platform, String version) {
}
