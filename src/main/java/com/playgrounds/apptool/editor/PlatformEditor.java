package com.playgrounds.apptool.editor;

import com.playgrounds.apptool.match.ArgumentLabel;
import com.playgrounds.apptool.match.CallMatcher;
import com.playgrounds.apptool.match.Matchers;
import com.playgrounds.apptool.rewrite.ArgumentListEdits;
import com.playgrounds.apptool.rewrite.ArrayEdits;
import com.playgrounds.apptool.rewrite.FormattingConventions;
import com.playgrounds.apptool.syntax.Argument;
import com.playgrounds.apptool.syntax.ArrayElement;
import com.playgrounds.apptool.syntax.ArrayExpr;
import com.playgrounds.apptool.syntax.CallExpr;
import com.playgrounds.apptool.syntax.Expr;
import com.playgrounds.apptool.syntax.ManifestParser;
import com.playgrounds.apptool.syntax.MemberAccessExpr;
import com.playgrounds.apptool.syntax.SourceFile;
import com.playgrounds.apptool.syntax.StringLiterals;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads and edits the minimum deployment targets in {@code Package(platforms: [...])}.
 */
public class PlatformEditor extends ManifestEditor {

    static final ArgumentLabel PLATFORMS = ArgumentLabel.of("platforms");

    private static final Pattern VERSION = Pattern.compile("\\d+(\\.\\d+){0,2}");
    private static final Pattern VERSION_MEMBER = Pattern.compile("v\\d+(_\\d+){0,2}");
    private static final ImmutableList<String> PRECEDING_LABELS = Lists.immutable.with("name", "defaultLocalization");

    public PlatformEditor() {
        this(FormattingConventions.DEFAULT);
    }

    public PlatformEditor(FormattingConventions conventions) {
        super(conventions);
    }

    /**
     * The platform entries in source order. Entries for unknown platforms or with a version this
     * tool cannot read are skipped.
     */
    public ImmutableList<PlatformVersion> platforms(SourceFile tree) {
        Optional<ArrayExpr> array = platformsArray(tree);
        if (array.isEmpty()) {
            return Lists.immutable.empty();
        }
        MutableList<PlatformVersion> result = Lists.mutable.empty();
        for (Expr element : array.get().values()) {
            if (!(element instanceof CallExpr call) || call.arguments().isEmpty()) {
                continue;
            }
            Optional<Platform> platform = call.calleeName().flatMap(Platform::find);
            Optional<String> version = versionOf(call.arguments().getFirst().value());
            if (platform.isPresent() && version.isPresent()) {
                result.add(new PlatformVersion(platform.get(), version.get()));
            }
        }
        return result.toImmutable();
    }

    public Optional<String> minimumVersion(SourceFile tree, Platform platform) {
        return platforms(tree).detectOptional(entry -> entry.platform() == platform).map(PlatformVersion::version);
    }

    /**
     * Sets the minimum version of {@code platform}, replacing an existing entry for it or
     * adding one. Creates {@code platforms:} right after {@code name:} when the package has none.
     *
     * @throws IllegalArgumentException if {@code version} is not a dotted version number
     */
    public EditResult setMinimum(SourceFile tree, Platform platform, String version) {
        if (version == null || !VERSION.matcher(version).matches()) {
            throw new IllegalArgumentException("'" + version + "' is not a valid platform version string.");
        }
        Expr element = ManifestParser.parseExpression(platform.source() + "(" + StringLiterals.quote(version) + ")");
        Optional<Argument> existing = find(tree, CallMatcher.PACKAGE).flatMap(call -> Matchers.argument(call, PLATFORMS));
        if (existing.isPresent() && !(existing.get().value() instanceof ArrayExpr)) {
            return EditResult.notFound("The platforms argument of Package(...) is not an array literal.");
        }
        return edit(tree, CallMatcher.PACKAGE, PACKAGE_NOT_FOUND, call -> {
            Optional<Argument> argument = Matchers.argument(call, PLATFORMS);
            if (argument.isEmpty()) {
                Argument created = Argument.labeled(PLATFORMS.canonical(),
                        ArrayExpr.of(Lists.immutable.with(ArrayElement.of(element))));
                return call.withArguments(
                        ArgumentListEdits.insertOrdered(call.arguments(), created, PRECEDING_LABELS, conventions));
            }
            ArrayExpr array = (ArrayExpr) argument.get().value();
            ArrayExpr updated = ArrayEdits.upsert(array, element, conventions);
            return updated == array ? call : replaceValue(call, argument.get(), updated);
        });
    }

    /**
     * Drops the entry for {@code platform}. A package without one is left as is.
     */
    public EditResult remove(SourceFile tree, Platform platform) {
        return edit(tree, CallMatcher.PACKAGE, PACKAGE_NOT_FOUND, call -> {
            Optional<Argument> argument = Matchers.argument(call, PLATFORMS);
            if (argument.isEmpty() || !(argument.get().value() instanceof ArrayExpr array)) {
                return call;
            }
            ArrayExpr updated = ArrayEdits.removeByIdentity(array, platform.swiftName());
            return updated == array ? call : replaceValue(call, argument.get(), updated);
        });
    }

    private Optional<ArrayExpr> platformsArray(SourceFile tree) {
        return find(tree, CallMatcher.PACKAGE)
                .flatMap(call -> Matchers.argument(call, PLATFORMS))
                .map(Argument::value)
                .filter(ArrayExpr.class::isInstance)
                .map(ArrayExpr.class::cast);
    }

    static CallExpr replaceValue(CallExpr call, Argument argument, Expr value) {
        return call.withArguments(call.arguments().collect(
                candidate -> candidate == argument ? candidate.withValue(value) : candidate));
    }

    private static Optional<String> versionOf(Expr expr) {
        Optional<String> literal = Matchers.stringValue(expr);
        if (literal.isPresent()) {
            return literal;
        }
        if (expr instanceof MemberAccessExpr member && VERSION_MEMBER.matcher(member.memberName()).matches()) {
            return Optional.of(member.memberName().substring(1).replace('_', '.'));
        }
        return Optional.empty();
    }
}
