package com.playgrounds.apptool.match;

/**
 * Thrown when a call spells the same argument more than once, for example under both its
 * current and its legacy label.
 */
public class AmbiguousArgumentException extends IllegalStateException {

    public AmbiguousArgumentException(ArgumentLabel label, int occurrences) {
        super("Argument '" + label.canonical() + "' appears " + occurrences + " times; remove the duplicate first");
    }
}
