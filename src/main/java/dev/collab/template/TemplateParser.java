package dev.collab.template;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles template text into segments. Supports {@code {{name}}} and a single,
 * non-nesting {@code if / else / endif} block comparing a variable to a string literal.
 */
final class TemplateParser {

    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");
    private static final Pattern IF_TAG = Pattern.compile(
        "if\\s+([A-Za-z_][A-Za-z0-9_.]*)\\s*==\\s*(?:\"([^\"]*)\"|'([^']*)')");

    private final String source;

    TemplateParser(String source) {
        this.source = source;
    }

    List<Segment> parse() {
        var root = new ArrayList<Segment>();
        List<Segment> current = root;

        String ifVariable = null;
        String ifLiteral = null;
        int ifStart = -1;
        List<Segment> thenBranch = null;
        List<Segment> elseBranch = null;

        int pos = 0;
        while (pos < source.length()) {
            int varOpen = source.indexOf("{{", pos);
            int tagOpen = source.indexOf("{%", pos);
            int open = nearest(varOpen, tagOpen);
            if (open < 0) {
                addText(current, source.substring(pos));
                break;
            }
            addText(current, source.substring(pos, open));

            if (open == varOpen) {
                int close = source.indexOf("}}", open + 2);
                if (close < 0) {
                    throw new TemplateSyntaxException("Unclosed '{{'", open);
                }
                String name = source.substring(open + 2, close).trim();
                if (!NAME.matcher(name).matches()) {
                    throw new TemplateSyntaxException("Invalid variable name '%s'".formatted(name), open);
                }
                current.add(new Segment.Variable(name));
                pos = close + 2;
                continue;
            }

            int close = source.indexOf("%}", open + 2);
            if (close < 0) {
                throw new TemplateSyntaxException("Unclosed '{%'", open);
            }
            String tag = source.substring(open + 2, close).trim();
            Matcher ifMatch = IF_TAG.matcher(tag);

            if (ifMatch.matches()) {
                if (thenBranch != null) {
                    throw new TemplateSyntaxException("Nested {% if %} blocks are not supported", open);
                }
                ifVariable = ifMatch.group(1);
                ifLiteral = ifMatch.group(2) != null ? ifMatch.group(2) : ifMatch.group(3);
                ifStart = open;
                thenBranch = new ArrayList<>();
                current = thenBranch;
            } else if (tag.equals("else")) {
                if (thenBranch == null) {
                    throw new TemplateSyntaxException("{% else %} without {% if %}", open);
                }
                if (elseBranch != null) {
                    throw new TemplateSyntaxException("Duplicate {% else %}", open);
                }
                elseBranch = new ArrayList<>();
                current = elseBranch;
            } else if (tag.equals("endif")) {
                if (thenBranch == null) {
                    throw new TemplateSyntaxException("{% endif %} without {% if %}", open);
                }
                root.add(new Segment.Conditional(ifVariable, ifLiteral, thenBranch,
                    elseBranch == null ? List.of() : elseBranch));
                thenBranch = null;
                elseBranch = null;
                current = root;
            } else if (tag.startsWith("if")) {
                throw new TemplateSyntaxException(
                    "Unsupported condition '%s'; only <name> == \"literal\" is allowed".formatted(tag), open);
            } else {
                throw new TemplateSyntaxException("Unknown tag '%s'".formatted(tag), open);
            }
            pos = close + 2;
        }

        if (thenBranch != null) {
            throw new TemplateSyntaxException("Missing {% endif %}", ifStart);
        }
        return root;
    }

    private static int nearest(int a, int b) {
        if (a < 0) {
            return b;
        }
        if (b < 0) {
            return a;
        }
        return Math.min(a, b);
    }

    private static void addText(List<Segment> target, String text) {
        if (!text.isEmpty()) {
            target.add(new Segment.Text(text));
        }
    }
}
