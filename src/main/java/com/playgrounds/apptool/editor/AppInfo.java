package com.playgrounds.apptool.editor;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * The editable settings of an app product. A {@code null} or empty field means the argument is
 * absent; writing such a field removes the argument.
 */
public record AppInfo(
        String name,
        String bundleIdentifier,
        String teamIdentifier,
        String displayVersion,
        String bundleVersion,
        String iconAssetName,
        AppColor accentColor,
        ImmutableList<DeviceFamily> supportedDeviceFamilies,
        AppCategory appCategory,
        String infoPlistPath) {

    public static final AppInfo EMPTY = new AppInfo(null, null, null, null, null, null, null,
            Lists.immutable.empty(), null, null);

    public AppInfo {
        if (supportedDeviceFamilies == null) {
            supportedDeviceFamilies = Lists.immutable.empty();
        }
    }

    public boolean hasInfoPlist() {
        return infoPlistPath != null;
    }

    public AppInfo withName(String value) {
        return new AppInfo(value, bundleIdentifier, teamIdentifier, displayVersion, bundleVersion, iconAssetName,
                accentColor, supportedDeviceFamilies, appCategory, infoPlistPath);
    }

    public AppInfo withBundleIdentifier(String value) {
        return new AppInfo(name, value, teamIdentifier, displayVersion, bundleVersion, iconAssetName,
                accentColor, supportedDeviceFamilies, appCategory, infoPlistPath);
    }

    public AppInfo withTeamIdentifier(String value) {
        return new AppInfo(name, bundleIdentifier, value, displayVersion, bundleVersion, iconAssetName,
                accentColor, supportedDeviceFamilies, appCategory, infoPlistPath);
    }

    public AppInfo withDisplayVersion(String value) {
        return new AppInfo(name, bundleIdentifier, teamIdentifier, value, bundleVersion, iconAssetName,
                accentColor, supportedDeviceFamilies, appCategory, infoPlistPath);
    }

    public AppInfo withBundleVersion(String value) {
        return new AppInfo(name, bundleIdentifier, teamIdentifier, displayVersion, value, iconAssetName,
                accentColor, supportedDeviceFamilies, appCategory, infoPlistPath);
    }

    public AppInfo withAccentColor(AppColor value) {
        return new AppInfo(name, bundleIdentifier, teamIdentifier, displayVersion, bundleVersion, iconAssetName,
                value, supportedDeviceFamilies, appCategory, infoPlistPath);
    }

    public AppInfo withSupportedDeviceFamilies(ImmutableList<DeviceFamily> value) {
        return new AppInfo(name, bundleIdentifier, teamIdentifier, displayVersion, bundleVersion, iconAssetName,
                accentColor, value, appCategory, infoPlistPath);
    }

    public AppInfo withAppCategory(AppCategory value) {
        return new AppInfo(name, bundleIdentifier, teamIdentifier, displayVersion, bundleVersion, iconAssetName,
                accentColor, supportedDeviceFamilies, value, infoPlistPath);
    }

    public AppInfo withInfoPlistPath(String value) {
        return new AppInfo(name, bundleIdentifier, teamIdentifier, displayVersion, bundleVersion, iconAssetName,
                accentColor, supportedDeviceFamilies, appCategory, value);
    }
}
