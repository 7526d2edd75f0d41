package info.isaksson.erland.codeatlas.graph;

import info.isaksson.erland.codeatlas.ir.ClassDef;
import info.isaksson.erland.codeatlas.ir.FunctionDef;
import info.isaksson.erland.codeatlas.ir.NodeKind;

/**
 * Deterministic node ids: kind tag, defining file path and qualified name.
 *
 * <p>Ids are derived from structure only, never from a counter, so parsing order and parallelism
 * cannot change them.</p>
 */
public final class NodeIds {
    private NodeIds() {}

    public static String file(String path) {
        return NodeKind.FILE.tag + ":" + path;
    }

    public static String classNode(String path, ClassDef c) {
        return NodeKind.CLASS.tag + ":" + path + "::" + c.name;
    }

    /** {@code function:<path>::<Class>.<method>} for methods, {@code function:<path>::<name>} otherwise. */
    public static String function(String path, FunctionDef f) {
        return NodeKind.FUNCTION.tag + ":" + path + "::" + f.qualifiedName();
    }

    public static String module(String identifier) {
        return NodeKind.MODULE.tag + ":" + identifier;
    }

    /** Id for a repeated declaration: the base id with its start line appended. */
    public static String disambiguated(String baseId, int startLine) {
        return baseId + "@L" + startLine;
    }
}
