package com.playgrounds.apptool.editor;

import com.playgrounds.apptool.match.ArgumentLabel;
import com.playgrounds.apptool.match.BaseIdentity;
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
import com.playgrounds.apptool.syntax.SourceFile;
import com.playgrounds.apptool.syntax.SyntaxPrinter;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.SetIterable;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Optional;

/**
 * The interface orientations of the first {@code .iOSApplication} product.
 */
public class OrientationEditor extends ManifestEditor {

    static final ArgumentLabel ORIENTATIONS = ArgumentLabel.of("supportedInterfaceOrientations");

    public OrientationEditor() {
        this(FormattingConventions.DEFAULT);
    }

    public OrientationEditor(FormattingConventions conventions) {
        super(conventions);
    }

    public ImmutableList<OrientationEntry> list(SourceFile tree) {
        Optional<ArrayExpr> array = find(tree, CallMatcher.IOS_APPLICATION)
                .flatMap(call -> Matchers.argument(call, ORIENTATIONS))
                .map(Argument::value)
                .filter(ArrayExpr.class::isInstance)
                .map(ArrayExpr.class::cast);
        if (array.isEmpty()) {
            return Lists.immutable.empty();
        }
        MutableList<OrientationEntry> entries = Lists.mutable.empty();
        for (Expr element : array.get().values()) {
            BaseIdentity.of(element).ifPresent(name -> entries.add(
                    new OrientationEntry(name, conditionFamilies(element), SyntaxPrinter.print(element).strip())));
        }
        return entries.toImmutable();
    }

    /**
     * Adds {@code orientation}, limited to {@code families} unless they are empty or cover both
     * iPad and iPhone. An entry for the same orientation is replaced, so adding twice is a no-op
     * and adding with a different condition updates the condition. Creates
     * {@code supportedInterfaceOrientations:} when the product has none.
     */
    public EditResult add(SourceFile tree, Orientation orientation, SetIterable<DeviceFamily> families) {
        Expr element = ManifestParser.parseExpression(elementSource(orientation, families));
        Optional<Argument> existing = find(tree, CallMatcher.IOS_APPLICATION)
                .flatMap(call -> Matchers.argument(call, ORIENTATIONS));
        if (existing.isPresent() && !(existing.get().value() instanceof ArrayExpr)) {
            return EditResult.notFound("The supportedInterfaceOrientations argument is not an array literal.");
        }
        return editArguments(tree, CallMatcher.IOS_APPLICATION, IOS_APPLICATION_NOT_FOUND, arguments -> {
            Optional<Argument> argument = Matchers.argument(arguments, ORIENTATIONS);
            if (argument.isEmpty()) {
                return ArgumentListEdits.set(arguments, ORIENTATIONS,
                        ManifestParser.parseExpression("[" + SyntaxPrinter.print(element) + "]"), conventions);
            }
            ArrayExpr array = (ArrayExpr) argument.get().value();
            ArrayExpr updated = ArrayEdits.upsert(array, element, conventions);
            return updated == array ? arguments : ArgumentListEdits.set(arguments, ORIENTATIONS, updated, conventions);
        });
    }

    public EditResult remove(SourceFile tree, Orientation orientation) {
        return editArguments(tree, CallMatcher.IOS_APPLICATION, IOS_APPLICATION_NOT_FOUND, arguments -> {
            Optional<Argument> argument = Matchers.argument(arguments, ORIENTATIONS);
            if (argument.isEmpty() || !(argument.get().value() instanceof ArrayExpr array)) {
                return arguments;
            }
            ArrayExpr updated = ArrayEdits.removeByIdentity(array, orientation.swiftName());
            return updated == array ? arguments : ArgumentListEdits.set(arguments, ORIENTATIONS, updated, conventions);
        });
    }

    static String elementSource(Orientation orientation, SetIterable<DeviceFamily> families) {
        boolean everywhere = families.isEmpty()
                || families.contains(DeviceFamily.PAD) && families.contains(DeviceFamily.PHONE);
        if (everywhere) {
            return orientation.source();
        }
        String condition = Lists.immutable.with(DeviceFamily.values())
                .select(families::contains)
                .collect(DeviceFamily::source)
                .makeString(", ");
        return orientation.source() + "(.when(deviceFamilies: [" + condition + "]))";
    }

    private static ImmutableList<DeviceFamily> conditionFamilies(Expr element) {
        if (!(element instanceof CallExpr call) || call.arguments().isEmpty()
                || !(call.arguments().getFirst().value() instanceof CallExpr condition)) {
            return Lists.immutable.empty();
        }
        return Matchers.argument(condition, ArgumentLabel.of("deviceFamilies"))
                .map(Argument::value)
                .filter(ArrayExpr.class::isInstance)
                .map(value -> ((ArrayExpr) value).values()
                        .collectIf(family -> Matchers.memberName(family).flatMap(DeviceFamily::find).isPresent(),
                                family -> DeviceFamily.fromName(Matchers.memberName(family).get())))
                .orElse(Lists.immutable.empty());
    }
}
