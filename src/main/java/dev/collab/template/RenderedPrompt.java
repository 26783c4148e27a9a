package dev.collab.template;

import java.util.List;

/**
 * Rendered prompt text plus notes about variables that rendered as empty.
 */
public record RenderedPrompt(String text, List<String> notes) {

    public RenderedPrompt {
        notes = List.copyOf(notes);
    }
}
