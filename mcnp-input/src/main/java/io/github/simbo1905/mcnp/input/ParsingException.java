package io.github.simbo1905.mcnp.input;

import java.util.ArrayList;
import java.util.List;

/// Thrown when a record cannot be parsed. The message renders every queued [ParseProblem] as a
/// small listing of the record with the offending line marked `>` and the token underlined.
public class ParsingException extends MalformedInputException {

    private static final long serialVersionUID = 1L;

    private final transient List<ParseProblem> problems;

    public ParsingException(InputRecord record, String message, List<ParseProblem> problems) {
        super(record, message, render(record, message, problems));
        this.problems = List.copyOf(problems);
    }

    public List<ParseProblem> problems() {
        return problems;
    }

    static String render(InputRecord record, String message, List<ParseProblem> problems) {
        if (problems.isEmpty()) {
            return message;
        }
        final var messages = new ArrayList<String>();
        for (ParseProblem problem : problems) {
            messages.add(renderProblem(record, problem));
        }
        messages.add(message);
        return String.join("\n", messages);
    }

    private static String renderProblem(InputRecord record, ParseProblem problem) {
        final String path = record == null ? "" : record.source();
        final int startLine = record == null ? 0 : record.lineNumber();
        final Token token = problem.token();
        final int lineNo = token == null ? 0 : problem.line();
        final int index = token == null ? 0 : problem.column();
        final var buffer = new ArrayList<String>();
        buffer.add("    " + path + ", line " + (startLine + lineNo - 1));
        buffer.add("");
        if (record != null) {
            final var lines = record.lines();
            for (int i = 0; i < lines.size(); i++) {
                if (i == lineNo - 1) {
                    buffer.add(String.format("    >%5d| %s", startLine + i, lines.get(i)));
                    if (token != null) {
                        buffer.add(" ".repeat(10) + "|" + " ".repeat(index + 1)
                                + "^".repeat(token.text().length()) + " not expected here.");
                    }
                } else {
                    buffer.add(String.format("     %5d| %s", startLine + i, lines.get(i)));
                }
            }
            buffer.add(token == null
                    ? "The input ended prematurely."
                    : "There was an error parsing \"" + token.text() + "\".");
            buffer.add(problem.message());
        }
        return String.join("\n", buffer);
    }
}
