package com.playgrounds.apptool.match;

import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Sets;

/**
 * An argument label together with the older spellings that mean the same thing. Reads accept
 * any of them; writes use {@link #canonical()}.
 */
public record ArgumentLabel(String canonical, ImmutableSet<String> aliases) {

    public static ArgumentLabel of(String canonical, String... aliases) {
        return new ArgumentLabel(canonical, Sets.immutable.with(aliases));
    }

    public boolean matches(String label) {
        return label != null && (canonical.equals(label) || aliases.contains(label));
    }

    public boolean isCanonical(String label) {
        return canonical.equals(label);
    }

    @Override
    public String toString() {
        return canonical;
    }
}
