package info.isaksson.erland.codeatlas.parse;

import info.isaksson.erland.codeatlas.ir.DegradationReason;
import info.isaksson.erland.codeatlas.ir.Language;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Grammar path shared by the tree-sitter front ends: obtains the grammar, parses, rejects trees
 * with error or missing nodes and hands the root to the language-specific walk.
 *
 * <p>A parser instance is created per call; only the immutable grammar objects are shared.</p>
 */
abstract class TreeSitterExtractor implements GrammarExtractor {

    protected final Language language;

    protected TreeSitterExtractor(Language language) {
        this.language = language;
    }

    @Override
    public final ParseOutcome extract(String path, String text, List<String> lines) {
        if (!TreeSitterGrammars.supportsDialect(language, path)) {
            return ParseOutcome.degraded(DegradationReason.UNSUPPORTED_DIALECT);
        }
        Optional<TSLanguage> grammar = TreeSitterGrammars.forLanguage(language);
        if (grammar.isEmpty()) {
            return ParseOutcome.degraded(DegradationReason.UNSUPPORTED_DIALECT);
        }
        TSTree tree;
        try {
            TSParser parser = new TSParser();
            parser.setLanguage(grammar.get());
            tree = parser.parseString(null, text);
        } catch (RuntimeException | LinkageError e) {
            return ParseOutcome.degraded(DegradationReason.UNSUPPORTED_DIALECT);
        }
        if (tree == null) {
            return ParseOutcome.degraded(DegradationReason.UNSUPPORTED_DIALECT);
        }
        TSNode root = tree.getRootNode();
        // Any error or missing node sends the whole file to the fallback scanner, even when it lies
        // outside every function and class span.
        if (root.hasError()) {
            return ParseOutcome.degraded(DegradationReason.MALFORMED_SPAN);
        }
        Extraction out = new Extraction();
        collect(root, new NodeText(text, lines), out);
        return ParseOutcome.confident(out);
    }

    protected abstract void collect(TSNode root, NodeText src, Extraction out);

    static boolean absent(TSNode node) {
        return node == null || node.isNull();
    }

    static TSNode field(TSNode node, String name) {
        TSNode f = node.getChildByFieldName(name);
        return absent(f) ? null : f;
    }

    /** Named children in order, comments skipped. */
    static List<TSNode> namedChildren(TSNode node) {
        List<TSNode> out = new ArrayList<>();
        if (absent(node)) return out;
        int count = node.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = node.getNamedChild(i);
            if (absent(child) || "comment".equals(child.getType())) continue;
            out.add(child);
        }
        return out;
    }

    static int startLine(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    /** 1-based last line; a node ending at column 0 ends on the previous line. */
    static int endLine(TSNode node) {
        int row = node.getEndPoint().getRow();
        int startRow = node.getStartPoint().getRow();
        if (node.getEndPoint().getColumn() == 0 && row > startRow) return row;
        return row + 1;
    }

    /** Source slices by node byte range (tree-sitter offsets are UTF-8 bytes). */
    static final class NodeText {
        final List<String> lines;
        private final byte[] utf8;

        NodeText(String text, List<String> lines) {
            this.lines = lines;
            this.utf8 = text.getBytes(StandardCharsets.UTF_8);
        }

        String of(TSNode node) {
            if (absent(node)) return "";
            int s = Math.max(0, Math.min(node.getStartByte(), utf8.length));
            int e = Math.max(s, Math.min(node.getEndByte(), utf8.length));
            return new String(utf8, s, e - s, StandardCharsets.UTF_8);
        }
    }
}
