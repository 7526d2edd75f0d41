package info.isaksson.erland.codeatlas.ir;

/** Kinds of knowledge-graph nodes. {@code MODULE} nodes are synthetic import targets. */
public enum NodeKind {
    FILE("file"),
    CLASS("class"),
    FUNCTION("function"),
    MODULE("module");

    /** Prefix used in node ids. */
    public final String tag;

    NodeKind(String tag) {
        this.tag = tag;
    }
}
