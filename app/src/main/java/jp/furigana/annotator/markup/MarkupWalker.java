package jp.furigana.annotator.markup;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import jp.furigana.annotator.annotate.AnnotatedSpan;
import jp.furigana.annotator.annotate.FuriganaAnnotator;
import jp.furigana.annotator.dictionary.RubyPairExtractor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Flattens an HTML tree into ruby-annotated text. Author ruby is copied through untouched, bare text is
 * glossed by the {@link FuriganaAnnotator}, images become {@code [IMAGE:name]} placeholder lines and
 * paragraphs and headings keep their line breaks.
 */
public class MarkupWalker {

    private static final Set<String> EXCLUDED = Set.of("nav", "script", "style", "meta", "link");
    private static final Set<String> PARAGRAPH_BLOCKS = Set.of("p", "h1", "h2", "h3", "h4", "h5", "h6");
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\n{3,}");

    private final FuriganaAnnotator annotator;
    private final boolean filterMode;

    public MarkupWalker(FuriganaAnnotator annotator, boolean filterMode) {
        this.annotator = Objects.requireNonNull(annotator, "annotator");
        this.filterMode = filterMode;
    }

    public String walkHtml(String html) {
        Document document = Jsoup.parse(html == null ? "" : html);
        document.outputSettings().prettyPrint(false);
        return walk(document.body());
    }

    public String walk(Node node) {
        Objects.requireNonNull(node, "node");
        if (node instanceof TextNode textNode) {
            return cleanUp(annotateText(textNode));
        }
        if (!(node instanceof Element element)) {
            return "";
        }
        return cleanUp(traverse(detach(element)));
    }

    /**
     * The root goes through the same rules as its descendants, so a ruby, excluded or image root is
     * handled exactly as it would be inside a paragraph.
     */
    private String traverse(Element root) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(null, List.<Node>of(root)));
        int imageCounter = 0;
        String result = "";
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.hasNext()) {
                Node child = frame.next();
                if (child instanceof TextNode textNode) {
                    frame.output.append(annotateText(textNode));
                } else if (child instanceof Element element) {
                    String name = element.normalName();
                    if (EXCLUDED.contains(name) || RubyPairExtractor.RT.equals(name)) {
                        continue;
                    }
                    switch (name) {
                        case RubyPairExtractor.RUBY -> frame.output.append(preservedRuby(element));
                        case "br" -> frame.output.append('\n');
                        case "img" -> {
                            imageCounter++;
                            frame.output.append(imagePlaceholder(element, imageCounter));
                        }
                        default -> stack.push(new Frame(element, element.childNodes()));
                    }
                }
                continue;
            }
            stack.pop();
            String content = frame.output.toString();
            if (stack.isEmpty()) {
                result = content;
            } else if (!content.isBlank()) {
                boolean paragraph = PARAGRAPH_BLOCKS.contains(frame.element.normalName());
                stack.peek().output.append(paragraph ? "\n" + content + "\n" : content);
            }
        }
        return result;
    }

    private String annotateText(TextNode textNode) {
        String text = textNode.getWholeText().strip();
        if (text.isEmpty()) {
            return "";
        }
        return FuriganaAnnotator.render(annotator.annotate(text, filterMode));
    }

    private String preservedRuby(Element ruby) {
        String markup = ruby.outerHtml();
        String reading = RubyPairExtractor.readingText(ruby);
        if (reading.isEmpty()) {
            return markup;
        }
        return AnnotatedSpan.preserved(RubyPairExtractor.baseText(ruby), reading, markup).markup();
    }

    static String imagePlaceholder(Element image, int position) {
        String source = image.attr("src");
        String fileName = source.isEmpty()
                ? "image-" + position
                : source.substring(source.lastIndexOf('/') + 1);
        return "\n[IMAGE:" + fileName + "]\n";
    }

    private static String cleanUp(String text) {
        return EXCESS_NEWLINES.matcher(text).replaceAll("\n\n").strip();
    }

    /**
     * Works on a copy whose document does not pretty-print, so preserved ruby markup is emitted as written.
     */
    private static Element detach(Element element) {
        Element copy = element.clone();
        if (copy instanceof Document document) {
            document.outputSettings().prettyPrint(false);
            return document;
        }
        Document shell = Document.createShell("");
        shell.outputSettings().prettyPrint(false);
        shell.body().appendChild(copy);
        return copy;
    }

    private static final class Frame {

        private final Element element;
        private final List<Node> children;
        private final StringBuilder output = new StringBuilder();
        private int cursor;

        private Frame(Element element, List<Node> children) {
            this.element = element;
            this.children = children;
        }

        private boolean hasNext() {
            return cursor < children.size();
        }

        private Node next() {
            return children.get(cursor++);
        }
    }
}
