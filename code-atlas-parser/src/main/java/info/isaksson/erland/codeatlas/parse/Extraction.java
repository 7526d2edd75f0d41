package info.isaksson.erland.codeatlas.parse;

import info.isaksson.erland.codeatlas.ir.ImportRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raw declarations collected by one parse path, before spans are clamped and class method lists
 * are derived. Mutable while a single extractor fills it; never shared between threads.
 */
public final class Extraction {

    public static final class ClassDraft {
        public final String name;
        public final List<String> baseNames;
        public final String docComment;
        public final int startLine;
        public final int endLine;

        public ClassDraft(String name, List<String> baseNames, String docComment, int startLine, int endLine) {
            this.name = name;
            this.baseNames = baseNames == null ? List.of() : List.copyOf(baseNames);
            this.docComment = docComment;
            this.startLine = startLine;
            this.endLine = endLine;
        }
    }

    public static final class FunctionDraft {
        public final String name;
        public final List<String> parameters;
        public final String docComment;
        public final int startLine;
        public final int endLine;
        public final String ownerClass;

        public FunctionDraft(String name, List<String> parameters, String docComment, int startLine, int endLine, String ownerClass) {
            this.name = name;
            this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
            this.docComment = docComment;
            this.startLine = startLine;
            this.endLine = endLine;
            this.ownerClass = ownerClass;
        }
    }

    private final List<ImportRef> imports = new ArrayList<>();
    private final List<ClassDraft> classes = new ArrayList<>();
    private final List<FunctionDraft> functions = new ArrayList<>();

    public void addImports(List<ImportRef> refs) {
        imports.addAll(refs);
    }

    public void addClass(ClassDraft c) {
        if (c.name != null && !c.name.isBlank()) classes.add(c);
    }

    public void addFunction(FunctionDraft f) {
        if (f.name != null && !f.name.isBlank()) functions.add(f);
    }

    public List<ImportRef> imports() {
        return Collections.unmodifiableList(imports);
    }

    public List<ClassDraft> classes() {
        return Collections.unmodifiableList(classes);
    }

    public List<FunctionDraft> functions() {
        return Collections.unmodifiableList(functions);
    }
}
