package com.playgrounds.apptool.editor;

import com.playgrounds.apptool.syntax.StringLiterals;

/**
 * The accent color of an app product: a named color from the asset catalog or a SwiftUI preset.
 */
public sealed interface AppColor permits AppColor.Asset, AppColor.Preset {

    /**
     * Source text of the {@code accentColor:} value.
     */
    String source();

    static AppColor asset(String name) {
        return new Asset(name);
    }

    static AppColor preset(PresetColor color) {
        return new Preset(color);
    }

    record Asset(String name) implements AppColor {

        public Asset {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Asset name must not be empty");
            }
        }

        @Override
        public String source() {
            return ".asset(" + StringLiterals.quote(name) + ")";
        }
    }

    record Preset(PresetColor color) implements AppColor {

        @Override
        public String source() {
            return ".presetColor(" + color.source() + ")";
        }
    }
}
