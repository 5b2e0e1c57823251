package bio.treeio.parse;

/**
 * Receiver of the structural events produced by {@link NewickParser}.
 *
 * <p>Field values arrive as {@code start(element)}, {@code characters(text)}, {@code end(element)}
 * while the node they belong to is the innermost open {@link Element#NODE}.
 *
 * @param <T> the document type produced once all events have been delivered
 */
public interface TreeEventSink<T> {

    void start(Element element);

    void end(Element element);

    void characters(String text);

    /**
     * Completes the document after the last event.
     *
     * @throws NewickParseException if the events did not describe exactly one tree
     */
    T endDocument();

    /**
     * Whether the given element has been started and not yet ended.
     */
    boolean isOpen(Element element);
}
