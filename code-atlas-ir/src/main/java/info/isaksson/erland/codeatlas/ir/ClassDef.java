package info.isaksson.erland.codeatlas.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

@JsonPropertyOrder({"name","baseNames","methodNames","docComment","startLine","endLine"})
public final class ClassDef {
    public final String name;
    public final List<String> baseNames;

    /** Names of the file's functions whose owner is this class, in declaration order. */
    public final List<String> methodNames;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String docComment;

    public final int startLine;
    public final int endLine;

    @JsonCreator
    public ClassDef(
            @JsonProperty("name") String name,
            @JsonProperty("baseNames") List<String> baseNames,
            @JsonProperty("methodNames") List<String> methodNames,
            @JsonProperty("docComment") String docComment,
            @JsonProperty("startLine") int startLine,
            @JsonProperty("endLine") int endLine
    ) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("class name must not be blank");
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("invalid span for class " + name + ": " + startLine + ".." + endLine);
        }
        this.name = name;
        this.baseNames = baseNames == null ? List.of() : List.copyOf(baseNames);
        this.methodNames = methodNames == null ? List.of() : List.copyOf(methodNames);
        this.docComment = docComment == null || docComment.isBlank() ? null : docComment;
        this.startLine = startLine;
        this.endLine = endLine;
    }

    /** Copy with a replaced method list (used once functions have been assigned to owners). */
    public ClassDef withMethodNames(List<String> methods) {
        return new ClassDef(name, baseNames, methods, docComment, startLine, endLine);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClassDef)) return false;
        ClassDef that = (ClassDef) o;
        return startLine == that.startLine &&
                endLine == that.endLine &&
                Objects.equals(name, that.name) &&
                Objects.equals(baseNames, that.baseNames) &&
                Objects.equals(methodNames, that.methodNames) &&
                Objects.equals(docComment, that.docComment);
    }

    @Override public int hashCode() {
        return Objects.hash(name, baseNames, methodNames, docComment, startLine, endLine);
    }

    @Override public String toString() {
        return "class " + name + baseNames + "@" + startLine + "-" + endLine;
    }
}
