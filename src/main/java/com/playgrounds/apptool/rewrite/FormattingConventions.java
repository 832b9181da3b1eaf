package com.playgrounds.apptool.rewrite;

import com.playgrounds.apptool.syntax.Trivia;

/**
 * Formatting used for text the tool introduces where nothing around it shows the local style.
 *
 * @param emptyListLeadingTrivia trivia in front of the first element inserted into an empty list
 * @param separatorSpacing text after an inserted comma when the next element is on the same line
 * @param directiveSeparator text between a newly prepended directive comment and the rest of the file
 */
public record FormattingConventions(String emptyListLeadingTrivia, String separatorSpacing, String directiveSeparator) {

    public static final FormattingConventions DEFAULT = new FormattingConventions("\n", " ", "\n\n");

    public Trivia emptyListTrivia() {
        return Trivia.parse(emptyListLeadingTrivia);
    }

    public Trivia separatorTrivia() {
        return Trivia.parse(separatorSpacing);
    }
}
