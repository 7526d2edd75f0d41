package info.isaksson.erland.codeatlas.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * A function or method declaration.
 *
 * <p>{@code ownerClass} is a lookup key into the same file's class list, not a reference to the
 * {@link ClassDef} instance. Lines are 1-based and inclusive.</p>
 */
@JsonPropertyOrder({"name","parameters","docComment","startLine","endLine","ownerClass"})
public final class FunctionDef {
    public final String name;
    public final List<String> parameters;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String docComment;

    public final int startLine;
    public final int endLine;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String ownerClass;

    @JsonCreator
    public FunctionDef(
            @JsonProperty("name") String name,
            @JsonProperty("parameters") List<String> parameters,
            @JsonProperty("docComment") String docComment,
            @JsonProperty("startLine") int startLine,
            @JsonProperty("endLine") int endLine,
            @JsonProperty("ownerClass") String ownerClass
    ) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("function name must not be blank");
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("invalid span for " + name + ": " + startLine + ".." + endLine);
        }
        this.name = name;
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.docComment = docComment == null || docComment.isBlank() ? null : docComment;
        this.startLine = startLine;
        this.endLine = endLine;
        this.ownerClass = ownerClass == null || ownerClass.isBlank() ? null : ownerClass;
    }

    @JsonIgnore
    public boolean isMethod() {
        return ownerClass != null;
    }

    /** {@code Owner.name} for methods, {@code name} otherwise. */
    @JsonIgnore
    public String qualifiedName() {
        return ownerClass == null ? name : ownerClass + "." + name;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionDef)) return false;
        FunctionDef that = (FunctionDef) o;
        return startLine == that.startLine &&
                endLine == that.endLine &&
                Objects.equals(name, that.name) &&
                Objects.equals(parameters, that.parameters) &&
                Objects.equals(docComment, that.docComment) &&
                Objects.equals(ownerClass, that.ownerClass);
    }

    @Override public int hashCode() {
        return Objects.hash(name, parameters, docComment, startLine, endLine, ownerClass);
    }

    @Override public String toString() {
        return qualifiedName() + "(" + String.join(", ", parameters) + ")@" + startLine + "-" + endLine;
    }
}
