package dev.collab.template;

/**
 * Default collaboration and output rules shown to agents through
 * {@code {{collaboration_guide}}}. Override per run via the driver configuration.
 */
public final class CollaborationGuide {

    public static final String DEFAULT = """
        ## Collaboration & Output Standards

        ### 1. File operations
        - Deliverables: every final artifact (code, documents, HTML, ...) goes into the `collab/` directory.
        - Action first: perform all file creation, edits and reads before anything else.
        - Full paths: always refer to files by their full path, e.g. `collab/design.md`.

        ### 2. Communication
        - Talk to your collaborators in plain, professional language.
        - State your decisions, suggestions and questions clearly.

        ### 3. Strict output format
        1. First, do all file operations and reasoning. Do not emit JSON here.
        2. Last, end your reply with exactly one JSON control block. Nothing may follow it.

        ```json
        {
          "content": "short summary of what you did",
          "decisions": {
            "key_decision_1": true,
            "key_decision_2": false
          }
        }
        ```
        """;

    private CollaborationGuide() {}
}
