package info.isaksson.erland.codeatlas.parse;

import info.isaksson.erland.codeatlas.ir.Language;
import org.treesitter.TSNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Python grammar path. Extracts module-level functions and classes, the direct methods of those
 * classes and every import statement in the file.
 */
final class TreeSitterPythonExtractor extends TreeSitterExtractor {

    private static final Set<String> IMPORT_NODES = Set.of(
            "import_statement", "import_from_statement", "future_import_statement");

    TreeSitterPythonExtractor() {
        super(Language.PYTHON);
    }

    @Override
    protected void collect(TSNode root, NodeText src, Extraction out) {
        for (TSNode child : namedChildren(root)) {
            TSNode def = unwrapDecorated(child);
            if (def == null) continue;
            if ("function_definition".equals(def.getType())) {
                addFunction(def, null, src, out);
            } else if ("class_definition".equals(def.getType())) {
                addClass(def, src, out);
            }
        }
        collectImports(root, src, out);
    }

    private static TSNode unwrapDecorated(TSNode node) {
        if ("decorated_definition".equals(node.getType())) return field(node, "definition");
        return node;
    }

    private void addClass(TSNode node, NodeText src, Extraction out) {
        TSNode nameNode = field(node, "name");
        if (nameNode == null) return;
        String name = src.of(nameNode);
        TSNode supers = field(node, "superclasses");
        List<String> bases = supers == null ? List.of() : BaseNames.python(ParameterLists.stripParens(src.of(supers)));
        TSNode body = field(node, "body");
        int start = startLine(nameNode);
        out.addClass(new Extraction.ClassDraft(name, bases, docstring(body, src), start, codeEnd(src.lines, start, endLine(node))));
        for (TSNode member : namedChildren(body)) {
            TSNode def = unwrapDecorated(member);
            if (def != null && "function_definition".equals(def.getType())) {
                addFunction(def, name, src, out);
            }
        }
    }

    private void addFunction(TSNode node, String owner, NodeText src, Extraction out) {
        TSNode nameNode = field(node, "name");
        if (nameNode == null) return;
        TSNode params = field(node, "parameters");
        List<String> parameters = params == null
                ? List.of()
                : ParameterLists.split(ParameterLists.stripParens(src.of(params)), Language.PYTHON);
        int start = startLine(nameNode);
        out.addFunction(new Extraction.FunctionDraft(
                src.of(nameNode), parameters, docstring(field(node, "body"), src),
                start, codeEnd(src.lines, start, endLine(node)), owner));
    }

    private static String docstring(TSNode body, NodeText src) {
        List<TSNode> statements = namedChildren(body);
        if (statements.isEmpty()) return null;
        TSNode first = statements.get(0);
        if (!"expression_statement".equals(first.getType()) || first.getNamedChildCount() != 1) return null;
        String type = first.getNamedChild(0).getType();
        if (!"string".equals(type) && !"concatenated_string".equals(type)) return null;
        return DocComments.pythonDocstring(src.of(first));
    }

    private static void collectImports(TSNode root, NodeText src, Extraction out) {
        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if (IMPORT_NODES.contains(node.getType())) {
                out.addImports(ImportStatements.python(src.of(node)));
                continue;
            }
            int count = node.getNamedChildCount();
            for (int i = count - 1; i >= 0; i--) {
                TSNode child = node.getNamedChild(i);
                if (!absent(child)) stack.push(child);
            }
        }
    }

    /** Trailing blank and comment-only lines inside a block are not part of the declaration. */
    static int codeEnd(List<String> lines, int start, int end) {
        int e = Math.min(end, lines.size());
        while (e > start) {
            String t = lines.get(e - 1).trim();
            if (!t.isEmpty() && !t.startsWith("#")) break;
            e--;
        }
        return Math.max(start, e);
    }
}
