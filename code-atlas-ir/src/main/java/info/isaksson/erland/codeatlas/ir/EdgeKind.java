package info.isaksson.erland.codeatlas.ir;

public enum EdgeKind {
    DEFINES("defines"),
    IMPORTS("imports");

    public final String label;

    EdgeKind(String label) {
        this.label = label;
    }
}
