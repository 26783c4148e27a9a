package dev.collab.template;

import java.util.List;

/**
 * A prompt template compiled at load time, so rendering cannot hit a syntax error.
 */
public record PromptTemplate(String source, List<Segment> segments) {

    public PromptTemplate {
        segments = List.copyOf(segments);
    }

    /**
     * @throws TemplateSyntaxException for unclosed tags, unknown tags or nested conditionals
     */
    public static PromptTemplate compile(String source) {
        String text = source == null ? "" : source;
        return new PromptTemplate(text, new TemplateParser(text).parse());
    }
}
