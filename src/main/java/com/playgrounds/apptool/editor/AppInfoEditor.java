package com.playgrounds.apptool.editor;

import com.playgrounds.apptool.match.ArgumentLabel;
import com.playgrounds.apptool.match.CallMatcher;
import com.playgrounds.apptool.match.Matchers;
import com.playgrounds.apptool.rewrite.ArgumentListEdits;
import com.playgrounds.apptool.rewrite.ArrayEdits;
import com.playgrounds.apptool.rewrite.FormattingConventions;
import com.playgrounds.apptool.syntax.Argument;
import com.playgrounds.apptool.syntax.ArrayExpr;
import com.playgrounds.apptool.syntax.CallExpr;
import com.playgrounds.apptool.syntax.Expr;
import com.playgrounds.apptool.syntax.ManifestParser;
import com.playgrounds.apptool.syntax.MemberAccessExpr;
import com.playgrounds.apptool.syntax.SourceFile;
import com.playgrounds.apptool.syntax.StringLiteralExpr;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.Objects;
import java.util.Optional;

/**
 * Reads and writes the settings of the first app product.
 * <p>
 * A write only touches the arguments whose value differs from what {@link #read} reports, so
 * arguments this editor cannot interpret survive a read-modify-write cycle unchanged.
 */
public class AppInfoEditor extends ManifestEditor {

    static final ArgumentLabel NAME = ArgumentLabel.of("name");
    static final ArgumentLabel BUNDLE_IDENTIFIER = ArgumentLabel.of("bundleIdentifier", "id");
    static final ArgumentLabel TEAM_IDENTIFIER = ArgumentLabel.of("teamIdentifier");
    static final ArgumentLabel DISPLAY_VERSION = ArgumentLabel.of("displayVersion", "version");
    static final ArgumentLabel BUNDLE_VERSION = ArgumentLabel.of("bundleVersion", "buildNumber");
    static final ArgumentLabel APP_ICON = ArgumentLabel.of("appIcon");
    static final ArgumentLabel ACCENT_COLOR = ArgumentLabel.of("accentColor");
    static final ArgumentLabel DEVICE_FAMILIES = ArgumentLabel.of("supportedDeviceFamilies");
    static final ArgumentLabel APP_CATEGORY = ArgumentLabel.of("appCategory");

    public AppInfoEditor() {
        this(FormattingConventions.DEFAULT);
    }

    public AppInfoEditor(FormattingConventions conventions) {
        super(conventions);
    }

    /**
     * The settings of the first {@code .iOSApplication} or {@code .macOSApplication} product,
     * or empty when there is no such product.
     */
    public Optional<AppInfo> read(SourceFile tree) {
        return find(tree, CallMatcher.APPLICATION_PRODUCT).map(AppInfoEditor::readProduct);
    }

    private static AppInfo readProduct(CallExpr product) {
        ImmutableList<Argument> arguments = product.arguments();
        return new AppInfo(
                string(arguments, NAME),
                string(arguments, BUNDLE_IDENTIFIER),
                string(arguments, TEAM_IDENTIFIER),
                string(arguments, DISPLAY_VERSION),
                string(arguments, BUNDLE_VERSION),
                value(arguments, APP_ICON).flatMap(AppInfoEditor::assetName).orElse(null),
                value(arguments, ACCENT_COLOR).flatMap(AppInfoEditor::color).orElse(null),
                value(arguments, DEVICE_FAMILIES).map(AppInfoEditor::families).orElse(null),
                value(arguments, APP_CATEGORY).flatMap(Matchers::memberName).flatMap(AppCategory::find).orElse(null),
                string(arguments, InfoPlistEditor.INFO_PLIST));
    }

    /**
     * Brings the first app product in line with {@code info}. Each field is inserted, replaced,
     * or removed when {@code null} or empty. The icon is not written.
     */
    public EditResult write(SourceFile tree, AppInfo info) {
        return edit(tree, CallMatcher.APPLICATION_PRODUCT, APPLICATION_NOT_FOUND, product -> {
            AppInfo current = readProduct(product);
            ImmutableList<Argument> arguments = product.arguments();
            arguments = setString(arguments, NAME, current.name(), info.name());
            arguments = setString(arguments, BUNDLE_IDENTIFIER, current.bundleIdentifier(), info.bundleIdentifier());
            arguments = setString(arguments, TEAM_IDENTIFIER, current.teamIdentifier(), info.teamIdentifier());
            arguments = setString(arguments, DISPLAY_VERSION, current.displayVersion(), info.displayVersion());
            arguments = setString(arguments, BUNDLE_VERSION, current.bundleVersion(), info.bundleVersion());
            if (!Objects.equals(current.accentColor(), info.accentColor())) {
                arguments = setOrRemove(arguments, ACCENT_COLOR,
                        info.accentColor() == null ? null : ManifestParser.parseExpression(info.accentColor().source()));
            }
            if (!current.supportedDeviceFamilies().equals(info.supportedDeviceFamilies())) {
                arguments = setFamilies(arguments, info.supportedDeviceFamilies());
            }
            if (current.appCategory() != info.appCategory()) {
                arguments = setOrRemove(arguments, APP_CATEGORY,
                        info.appCategory() == null ? null : MemberAccessExpr.implicit(info.appCategory().swiftName()));
            }
            arguments = setString(arguments, InfoPlistEditor.INFO_PLIST, current.infoPlistPath(), info.infoPlistPath());
            return arguments == product.arguments() ? product : product.withArguments(arguments);
        });
    }

    private ImmutableList<Argument> setString(ImmutableList<Argument> arguments, ArgumentLabel label, String current,
            String desired) {
        String normalized = desired == null || desired.isEmpty() ? null : desired;
        if (Objects.equals(current, normalized)) {
            return arguments;
        }
        return setOrRemove(arguments, label, normalized == null ? null : StringLiteralExpr.of(normalized));
    }

    private ImmutableList<Argument> setOrRemove(ImmutableList<Argument> arguments, ArgumentLabel label, Expr value) {
        if (value == null) {
            return ArgumentListEdits.remove(arguments, label);
        }
        return ArgumentListEdits.set(arguments, label, value, conventions);
    }

    private ImmutableList<Argument> setFamilies(ImmutableList<Argument> arguments, ImmutableList<DeviceFamily> families) {
        if (families.isEmpty()) {
            return ArgumentListEdits.remove(arguments, DEVICE_FAMILIES);
        }
        ImmutableList<Expr> desired = families.collect(family -> (Expr) MemberAccessExpr.implicit(family.swiftName()));
        Optional<Expr> existing = value(arguments, DEVICE_FAMILIES);
        Expr array = existing.isPresent() && existing.get() instanceof ArrayExpr current
                ? ArrayEdits.sync(current, desired, conventions)
                : ManifestParser.parseExpression(
                        "[" + families.collect(DeviceFamily::source).makeString(", ") + "]");
        return ArgumentListEdits.set(arguments, DEVICE_FAMILIES, array, conventions);
    }

    private static Optional<Expr> value(ImmutableList<Argument> arguments, ArgumentLabel label) {
        return Matchers.argument(arguments, label).map(Argument::value);
    }

    private static String string(ImmutableList<Argument> arguments, ArgumentLabel label) {
        return value(arguments, label).flatMap(Matchers::stringValue).orElse(null);
    }

    private static Optional<String> assetName(Expr expr) {
        if (expr instanceof CallExpr call && call.calleeName().filter("asset"::equals).isPresent()
                && call.arguments().notEmpty()) {
            return Matchers.stringValue(call.arguments().getFirst().value());
        }
        return Optional.empty();
    }

    private static Optional<AppColor> color(Expr expr) {
        if (!(expr instanceof CallExpr call) || call.arguments().isEmpty()) {
            return Optional.empty();
        }
        Expr first = call.arguments().getFirst().value();
        String kind = call.calleeName().orElse("");
        if (kind.equals("asset")) {
            return Matchers.stringValue(first).filter(name -> !name.isBlank()).map(AppColor::asset);
        }
        if (kind.equals("presetColor")) {
            return Matchers.memberName(first).flatMap(PresetColor::find).map(AppColor::preset);
        }
        return Optional.empty();
    }

    private static ImmutableList<DeviceFamily> families(Expr expr) {
        if (!(expr instanceof ArrayExpr array)) {
            return null;
        }
        return array.values()
                .collect(element -> Matchers.memberName(element).flatMap(DeviceFamily::find).orElse(null))
                .select(Objects::nonNull);
    }
}
