package bio.treeio.io;

import java.util.ArrayList;
import java.util.List;

/**
 * Cuts a text holding several Newick trees into one piece per tree. A piece ends after a {@code ;} that is
 * neither quoted nor inside a bracket comment.
 */
public class TreeTextSplitter {

    public List<String> split(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> pieces = new ArrayList<>();
        boolean quoted = false;
        int bracketDepth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '"') {
                quoted = !quoted;
            } else if (quoted) {
                continue;
            } else if (ch == '[') {
                bracketDepth++;
            } else if (ch == ']' && bracketDepth > 0) {
                bracketDepth--;
            } else if (ch == ';' && bracketDepth == 0) {
                pieces.add(text.substring(start, i + 1));
                start = i + 1;
            }
        }
        String rest = text.substring(start);
        if (!rest.isBlank()) {
            pieces.add(rest);
        }
        return pieces;
    }
}
