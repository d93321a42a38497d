package io.github.simbo1905.mcnp.input;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/// Wraps record text to the line length of an MCNP version.
///
/// A long line is broken at the last space that fits; the rest goes on a continuation line
/// indented five columns. Breaks are only made in the code part of a line, never inside a comment,
/// and `c` comment lines are never wrapped.
public final class LineWrapper {

    private static final Logger LOG = Logger.getLogger(LineWrapper.class.getName());

    private LineWrapper() {}

    public static List<String> wrap(String text, McnpVersion version) {
        final int width = version.lineLength();
        final var out = new ArrayList<String>();
        for (String line : text.split("\n", -1)) {
            wrapLine(line, width, out);
        }
        return out;
    }

    private static void wrapLine(String line, int width, List<String> out) {
        if (line.length() <= width || CommentNode.isCommentLine(line)) {
            out.add(line);
            return;
        }
        final String indent = " ".repeat(InputConstants.CONTINUE_INDENT);
        String rest = line;
        boolean first = true;
        while (rest.length() > width) {
            final int dollar = rest.indexOf('$');
            final int codeEnd = dollar < 0 ? rest.length() : dollar;
            final int floor = first ? 1 : InputConstants.CONTINUE_INDENT + 1;
            int cut = -1;
            for (int i = Math.min(width, codeEnd); i >= floor; i--) {
                if (rest.charAt(i) == ' ') {
                    cut = i;
                    break;
                }
            }
            if (cut < 0 || rest.substring(0, cut).isBlank()) {
                break;
            }
            out.add(rest.substring(0, cut).stripTrailing());
            rest = indent + rest.substring(cut).stripLeading();
            first = false;
        }
        out.add(rest);
        if (!first) {
            StructuredLog.finer(LOG, "line_wrapped", "width", width, "length", line.length());
            InputWarnings.warn(new InputWarning(InputWarning.Kind.LINE_WRAPPED,
                    "The line exceeded the maximum length of " + width + " and was wrapped.", line, ""));
        }
    }
}
