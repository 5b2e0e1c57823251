package bio.treeio.parse;

import bio.treeio.config.InternalNodeId;
import bio.treeio.config.NewickOptions;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finite-state parser for Newick and NHX text.
 *
 * <p>The parser pulls tokens from a {@link NewickTokenizer} and reports what it finds to a
 * {@link TreeEventSink}. It expects text that went through {@link InputNormalizer}. A parser holds no
 * per-call state and may be shared; each call works on its own {@link TextCursor}.
 */
public class NewickParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(NewickParser.class);
    private static final Pattern NHX_BLOCK = Pattern.compile("\\[&&NHX(?::(.*))?\\]", Pattern.DOTALL);
    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");
    private static final String LABEL_TERMINATORS = "[:,);";

    private final NewickOptions options;
    private final NewickTokenizer tokenizer;

    public NewickParser(NewickOptions options) {
        this(options, new NewickTokenizer());
    }

    NewickParser(NewickOptions options, NewickTokenizer tokenizer) {
        this.options = Objects.requireNonNull(options, "options");
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
    }

    /**
     * Parses one tree and returns what the sink builds from it.
     *
     * @throws NewickParseException if the text is not a well-formed tree
     */
    public <T> T parse(String text, TreeEventSink<T> sink) {
        emit(text, sink);
        return sink.endDocument();
    }

    /**
     * Runs the state machine over {@code text}, delivering events to {@code sink} without completing the
     * document.
     */
    public void emit(String text, TreeEventSink<?> sink) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(sink, "sink");
        new Run(new TextCursor(text), sink).execute();
    }

    static boolean isNumeric(String value) {
        return value != null && NUMBER.matcher(value).matches();
    }

    private final class Run {

        private final TextCursor cursor;
        private final TreeEventSink<?> sink;
        private String token;
        private int depth;
        private boolean leaf;

        Run(TextCursor cursor, TreeEventSink<?> sink) {
            this.cursor = cursor;
            this.sink = sink;
        }

        void execute() {
            sink.start(Element.TREE);
            token = fetch(NewickTokenizer.FIRST);
            ParserState state = ParserState.NEW_NODE;
            while (token != null) {
                state = switch (state) {
                    case NEW_NODE -> newNode();
                    case NAMING_NODE -> namingNode();
                    case BRANCH_LENGTH_OR_TAG -> branchLengthOrTag();
                    case NHX_TAG -> nhxTag();
                    case END_NODE -> endNode();
                    case TERMINAL -> throw new StructuralException(
                            "Unexpected trailing content after ';': '" + token + "'", cursor.offset());
                };
            }
            if (state != ParserState.TERMINAL || sink.isOpen(Element.TREE)) {
                recover(state);
            }
        }

        private ParserState newNode() {
            sink.start(Element.NODE);
            if ("(".equals(token)) {
                depth++;
                token = fetch(NewickTokenizer.AFTER_OPEN);
                return ParserState.NEW_NODE;
            }
            leaf = true;
            return ParserState.NAMING_NODE;
        }

        private ParserState namingNode() {
            if (!containsAny(token, LABEL_TERMINATORS)) {
                if (!leaf && options.internalNodeId() == InternalNodeId.BOOTSTRAP && isNumeric(token)) {
                    field(Element.BOOTSTRAP, token);
                } else {
                    field(Element.ID, token);
                }
                token = fetch(NewickTokenizer.AFTER_LABEL);
            }
            return ParserState.BRANCH_LENGTH_OR_TAG;
        }

        private ParserState branchLengthOrTag() {
            if (":".equals(token)) {
                String length = fetch(NewickTokenizer.BRANCH_LENGTH);
                if (!isNumeric(length)) {
                    throw new StructuralException("Invalid branch length '" + length + "'", cursor.offset());
                }
                field(Element.BRANCH_LENGTH, length);
                token = fetch(NewickTokenizer.AFTER_ANNOTATION);
            } else if ("[".equals(token)) {
                // annotation without a branch length: rebuild the whole bracket as one token
                String rest = fetch(NewickTokenizer.AFTER_ANNOTATION);
                if (rest != null) {
                    token = token + rest;
                }
            }
            return ParserState.NHX_TAG;
        }

        private ParserState nhxTag() {
            if (!token.startsWith("[") || !token.endsWith("]")) {
                return ParserState.END_NODE;
            }
            Matcher matcher = NHX_BLOCK.matcher(token);
            if (matcher.matches()) {
                emitNhxBlock(matcher.group(1));
            } else {
                bracketComment(token.substring(1, token.length() - 1));
            }
            token = fetch(NewickTokenizer.AFTER_ANNOTATION);
            return ParserState.END_NODE;
        }

        private ParserState endNode() {
            return switch (token) {
                case ")" -> closeClade();
                case "," -> {
                    sink.end(Element.NODE);
                    token = fetch(NewickTokenizer.AFTER_OPEN);
                    yield ParserState.NEW_NODE;
                }
                case ";" -> terminate();
                default -> throw new StructuralException(
                        "Expected ';', ')' or ',' but found '" + token + "'", cursor.offset());
            };
        }

        private ParserState closeClade() {
            if (depth == 0) {
                throw new StructuralException("Unbalanced parentheses: ')' without matching '('", cursor.offset());
            }
            sink.end(Element.NODE);
            depth--;
            leaf = false;
            token = fetch(NewickTokenizer.AFTER_LABEL);
            return ParserState.NAMING_NODE;
        }

        private ParserState terminate() {
            if (depth != 0) {
                throw new StructuralException("Unbalanced parentheses: " + depth + " clade(s) still open at ';'",
                        cursor.offset());
            }
            sink.end(Element.NODE);
            sink.end(Element.TREE);
            try {
                token = tokenizer.nextToken(cursor, NewickTokenizer.AFTER_TERMINATOR).orElse(null);
            } catch (TokenizationException ex) {
                throw new StructuralException("Unexpected trailing content after ';'", ex.position(), ex);
            }
            return ParserState.TERMINAL;
        }

        private void emitNhxBlock(String content) {
            sink.start(Element.NHX_TAG);
            if (content != null && !content.isEmpty()) {
                for (String attribute : content.split(":")) {
                    String trimmed = attribute.strip();
                    int separator = trimmed.indexOf('=');
                    if (separator < 0) {
                        LOGGER.debug("Skipping malformed NHX attribute '{}'", trimmed);
                        continue;
                    }
                    field(Element.TAG_NAME, trimmed.substring(0, separator));
                    field(Element.TAG_VALUE, trimmed.substring(separator + 1));
                }
            }
            sink.end(Element.NHX_TAG);
        }

        private void bracketComment(String content) {
            if (isNumeric(content)) {
                field(Element.BOOTSTRAP, content);
            } else {
                LOGGER.debug("Ignoring bracket comment '[{}]'", content);
            }
        }

        private void recover(ParserState state) {
            LOGGER.debug("Input ended in state {} at depth {}; closing open elements", state, depth);
            while (sink.isOpen(Element.NODE)) {
                sink.end(Element.NODE);
            }
            if (sink.isOpen(Element.TREE)) {
                sink.end(Element.TREE);
            }
        }

        private void field(Element element, String text) {
            sink.start(element);
            sink.characters(text);
            sink.end(element);
        }

        private String fetch(String delimiters) {
            try {
                return tokenizer.nextToken(cursor, delimiters).orElse(null);
            } catch (TokenizationException ex) {
                if (depth > 0) {
                    throw new StructuralException("Unbalanced parentheses: " + depth
                            + " clade(s) still open at end of input", ex.position(), ex);
                }
                throw ex;
            }
        }

        private boolean containsAny(String value, String characters) {
            for (int i = 0; i < value.length(); i++) {
                if (characters.indexOf(value.charAt(i)) >= 0) {
                    return true;
                }
            }
            return false;
        }
    }
}
