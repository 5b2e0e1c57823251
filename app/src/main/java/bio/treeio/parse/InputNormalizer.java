package bio.treeio.parse;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prepares raw Newick text for {@link NewickParser}: whitespace outside double quotes is removed, quoted
 * labels lose their quotes, a leading bracket comment is turned into tree-level values and the text is
 * terminated with {@code ;}.
 */
public class InputNormalizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(InputNormalizer.class);
    private static final Pattern NUMERIC_LITERAL = Pattern.compile("[-\\d.+]+");

    public NormalizedInput normalize(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Newick text must be provided");
        }
        String text = collapseWhitespace(raw);
        Optional<Double> score = Optional.empty();
        Optional<Boolean> rooted = Optional.empty();
        if (text.startsWith("[")) {
            int close = text.indexOf(']');
            if (close > 0) {
                String comment = text.substring(1, close);
                text = text.substring(close + 1);
                rooted = parseRootedFlag(comment);
                if (rooted.isEmpty()) {
                    score = parseScore(comment);
                }
            }
        }
        if (!text.endsWith(";")) {
            text = text + ";";
        }
        return new NormalizedInput(text, score, rooted);
    }

    private String collapseWhitespace(String raw) {
        StringBuilder builder = new StringBuilder(raw.length());
        int index = 0;
        while (index < raw.length()) {
            char ch = raw.charAt(index);
            if (ch == '"') {
                int close = raw.indexOf('"', index + 1);
                int end = close < 0 ? raw.length() : close;
                builder.append(raw.substring(index + 1, end).replaceAll("[\\r\\n]", "").strip());
                index = end + 1;
                continue;
            }
            if (!Character.isWhitespace(ch)) {
                builder.append(ch);
            }
            index++;
        }
        return builder.toString();
    }

    private Optional<Boolean> parseRootedFlag(String comment) {
        String flag = comment.strip().toUpperCase(Locale.ROOT);
        if (flag.equals("&R")) {
            return Optional.of(Boolean.TRUE);
        }
        if (flag.equals("&U")) {
            return Optional.of(Boolean.FALSE);
        }
        return Optional.empty();
    }

    private Optional<Double> parseScore(String comment) {
        String compact = comment.replaceAll("\\s", "").replaceFirst("lh=", "");
        Matcher matcher = NUMERIC_LITERAL.matcher(compact);
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Double.parseDouble(matcher.group()));
        } catch (NumberFormatException ex) {
            LOGGER.debug("Ignoring non-numeric tree score '{}'", matcher.group());
            return Optional.empty();
        }
    }
}
