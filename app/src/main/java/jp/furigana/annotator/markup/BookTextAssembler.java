package jp.furigana.annotator.markup;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Joins annotated chapters into a single reading text under a title and author header.
 */
public class BookTextAssembler {

    private static final Logger LOGGER = LoggerFactory.getLogger(BookTextAssembler.class);

    static final int MIN_CHAPTER_LENGTH = 10;

    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\n{3,}");
    private static final Pattern FLATTENED_XML_DECLARATION = Pattern.compile("xmlversion.*?html");
    private static final Pattern XML_DECLARATION = Pattern.compile("<\\?xml.*?\\?>");
    private static final Pattern DOCTYPE = Pattern.compile("<!DOCTYPE.*?>");

    /**
     * Removes declaration debris left over from extraction and collapses blank runs.
     */
    public String cleanChapter(String chapter) {
        if (chapter == null) {
            return "";
        }
        String cleaned = EXCESS_NEWLINES.matcher(chapter).replaceAll("\n\n");
        cleaned = FLATTENED_XML_DECLARATION.matcher(cleaned).replaceAll("");
        cleaned = XML_DECLARATION.matcher(cleaned).replaceAll("");
        cleaned = DOCTYPE.matcher(cleaned).replaceAll("");
        return cleaned.strip();
    }

    public String assemble(String title, String author, List<String> chapters) {
        List<String> kept = new ArrayList<>();
        for (String chapter : chapters) {
            String cleaned = cleanChapter(chapter);
            if (cleaned.length() > MIN_CHAPTER_LENGTH) {
                kept.add(cleaned);
            } else {
                LOGGER.debug("Skipping near-empty chapter ({} chars)", cleaned.length());
            }
        }
        if (kept.isEmpty()) {
            throw new IllegalArgumentException("No chapter with content to assemble");
        }
        LOGGER.info("Assembled {} of {} chapters", kept.size(), chapters.size());
        return "Title: " + blankToDefault(title, "Untitled") + "\n"
                + "Author: " + blankToDefault(author, "Unknown") + "\n\n"
                + String.join("\n\n", kept);
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.strip();
    }
}
