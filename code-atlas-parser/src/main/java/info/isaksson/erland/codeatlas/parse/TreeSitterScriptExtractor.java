package info.isaksson.erland.codeatlas.parse;

import info.isaksson.erland.codeatlas.ir.Language;
import org.treesitter.TSNode;

import java.util.List;
import java.util.Set;

/**
 * JavaScript / TypeScript grammar path. Extracts top-level function declarations, top-level
 * variable bindings to arrow functions or function expressions, classes with their methods, and
 * import / re-export declarations.
 */
final class TreeSitterScriptExtractor extends TreeSitterExtractor {

    private static final Set<String> FUNCTION_DECLARATIONS = Set.of(
            "function_declaration", "generator_function_declaration");
    private static final Set<String> CLASS_DECLARATIONS = Set.of(
            "class_declaration", "abstract_class_declaration");
    private static final Set<String> VARIABLE_DECLARATIONS = Set.of(
            "lexical_declaration", "variable_declaration");
    private static final Set<String> FUNCTION_VALUES = Set.of(
            "arrow_function", "function_expression", "function", "generator_function");

    TreeSitterScriptExtractor(Language language) {
        super(language);
    }

    @Override
    protected void collect(TSNode root, NodeText src, Extraction out) {
        for (TSNode child : namedChildren(root)) {
            String type = child.getType();
            if ("import_statement".equals(type)) {
                out.addImports(ImportStatements.script(src.of(child)));
            } else if ("export_statement".equals(type)) {
                if (field(child, "source") != null) {
                    out.addImports(ImportStatements.script(src.of(child)));
                    continue;
                }
                TSNode decl = field(child, "declaration");
                if (decl != null) declaration(decl, src, out);
            } else {
                declaration(child, src, out);
            }
        }
    }

    private void declaration(TSNode node, NodeText src, Extraction out) {
        String type = node.getType();
        if (FUNCTION_DECLARATIONS.contains(type)) {
            TSNode name = field(node, "name");
            if (name == null) return;
            out.addFunction(new Extraction.FunctionDraft(
                    src.of(name), parameters(node, src), DocComments.jsDocAbove(src.lines, startLine(name)),
                    startLine(name), endLine(node), null));
        } else if (CLASS_DECLARATIONS.contains(type)) {
            addClass(node, src, out);
        } else if (VARIABLE_DECLARATIONS.contains(type)) {
            for (TSNode declarator : namedChildren(node)) {
                if (!"variable_declarator".equals(declarator.getType())) continue;
                TSNode name = field(declarator, "name");
                TSNode value = field(declarator, "value");
                if (name == null || value == null) continue;
                if (!"identifier".equals(name.getType()) || !FUNCTION_VALUES.contains(value.getType())) continue;
                out.addFunction(new Extraction.FunctionDraft(
                        src.of(name), parameters(value, src), DocComments.jsDocAbove(src.lines, startLine(name)),
                        startLine(name), endLine(value), null));
            }
        }
    }

    private void addClass(TSNode node, NodeText src, Extraction out) {
        TSNode nameNode = field(node, "name");
        if (nameNode == null) return;
        String name = src.of(nameNode);
        List<String> bases = List.of();
        for (TSNode child : namedChildren(node)) {
            if ("class_heritage".equals(child.getType())) {
                bases = BaseNames.script(src.of(child));
                break;
            }
        }
        int start = startLine(nameNode);
        out.addClass(new Extraction.ClassDraft(name, bases, DocComments.jsDocAbove(src.lines, start), start, endLine(node)));

        for (TSNode member : namedChildren(field(node, "body"))) {
            if (!"method_definition".equals(member.getType())) continue;
            TSNode methodName = field(member, "name");
            if (methodName == null) continue;
            int mStart = startLine(methodName);
            out.addFunction(new Extraction.FunctionDraft(
                    src.of(methodName), parameters(member, src), DocComments.jsDocAbove(src.lines, mStart),
                    mStart, endLine(member), name));
        }
    }

    private List<String> parameters(TSNode fn, NodeText src) {
        TSNode params = field(fn, "parameters");
        if (params != null) {
            return ParameterLists.split(ParameterLists.stripParens(src.of(params)), language);
        }
        TSNode single = field(fn, "parameter");
        if (single != null) return List.of(SourceLines.squash(src.of(single)));
        return List.of();
    }
}
