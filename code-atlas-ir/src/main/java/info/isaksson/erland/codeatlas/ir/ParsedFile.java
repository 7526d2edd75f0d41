package info.isaksson.erland.codeatlas.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Normalized per-file extraction: declarations, imports and the raw physical lines.
 *
 * <p>Immutable. The constructor enforces the model invariants:</p>
 * <ul>
 *   <li>every function {@code ownerClass} names a class of this file</li>
 *   <li>every declaration span lies within {@code [1, lines.size()]}</li>
 *   <li>{@code degraded} is true whenever a {@link DegradationReason} is present</li>
 * </ul>
 */
@JsonPropertyOrder({"path","language","degraded","degradationReason","imports","classes","functions","lines"})
public final class ParsedFile {
    public final String path;
    public final Language language;
    public final List<ImportRef> imports;
    public final List<FunctionDef> functions;
    public final List<ClassDef> classes;
    public final List<String> lines;
    public final boolean degraded;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final DegradationReason degradationReason;

    public ParsedFile(
            String path,
            Language language,
            List<ImportRef> imports,
            List<FunctionDef> functions,
            List<ClassDef> classes,
            List<String> lines,
            DegradationReason degradationReason
    ) {
        this(path, language, imports, functions, classes, lines, degradationReason != null, degradationReason);
    }

    @JsonCreator
    ParsedFile(
            @JsonProperty("path") String path,
            @JsonProperty("language") Language language,
            @JsonProperty("imports") List<ImportRef> imports,
            @JsonProperty("functions") List<FunctionDef> functions,
            @JsonProperty("classes") List<ClassDef> classes,
            @JsonProperty("lines") List<String> lines,
            @JsonProperty("degraded") boolean degraded,
            @JsonProperty("degradationReason") DegradationReason degradationReason
    ) {
        if (path == null || path.isBlank()) throw new IllegalArgumentException("path must not be blank");
        this.path = path;
        this.language = Objects.requireNonNull(language, "language");
        this.imports = imports == null ? List.of() : List.copyOf(imports);
        this.functions = functions == null ? List.of() : List.copyOf(functions);
        this.classes = classes == null ? List.of() : List.copyOf(classes);
        this.lines = lines == null ? List.of() : List.copyOf(lines);
        if (degraded && degradationReason == null) degradationReason = DegradationReason.EXTRACTION_FAILURE;
        this.degradationReason = degradationReason;
        this.degraded = degradationReason != null;
        validate();
    }

    /** A file with no declarations, produced when both parse paths failed. */
    public static ParsedFile failed(String path, Language language, List<String> lines) {
        return new ParsedFile(path, language, null, null, null, lines, DegradationReason.EXTRACTION_FAILURE);
    }

    private void validate() {
        int max = lines.size();
        Set<String> classNames = new HashSet<>();
        for (ClassDef c : classes) {
            classNames.add(c.name);
            if (c.endLine > max) {
                throw new IllegalArgumentException(path + ": class " + c.name + " ends at line " + c.endLine + " but file has " + max + " lines");
            }
        }
        for (FunctionDef f : functions) {
            if (f.endLine > max) {
                throw new IllegalArgumentException(path + ": function " + f.name + " ends at line " + f.endLine + " but file has " + max + " lines");
            }
            if (f.ownerClass != null && !classNames.contains(f.ownerClass)) {
                throw new IllegalArgumentException(path + ": function " + f.name + " refers to unknown class " + f.ownerClass);
            }
        }
    }

    @JsonIgnore
    public int lineCount() {
        return lines.size();
    }

    public Optional<ClassDef> classNamed(String name) {
        for (ClassDef c : classes) {
            if (c.name.equals(name)) return Optional.of(c);
        }
        return Optional.empty();
    }

    public Optional<FunctionDef> functionNamed(String qualifiedName) {
        for (FunctionDef f : functions) {
            if (f.qualifiedName().equals(qualifiedName)) return Optional.of(f);
        }
        return Optional.empty();
    }

    /** Functions whose owner is {@code className}, in declaration order. */
    public List<FunctionDef> methodsOf(String className) {
        List<FunctionDef> out = new ArrayList<>();
        for (FunctionDef f : functions) {
            if (className.equals(f.ownerClass)) out.add(f);
        }
        return out;
    }

    /** Functions that are not owned by a class. */
    public List<FunctionDef> topLevelFunctions() {
        List<FunctionDef> out = new ArrayList<>();
        for (FunctionDef f : functions) {
            if (f.ownerClass == null) out.add(f);
        }
        return out;
    }

    /** 1-based line access; returns an empty string outside the file. */
    public String line(int lineNumber) {
        if (lineNumber < 1 || lineNumber > lines.size()) return "";
        return lines.get(lineNumber - 1);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParsedFile)) return false;
        ParsedFile that = (ParsedFile) o;
        return degraded == that.degraded &&
                Objects.equals(path, that.path) &&
                language == that.language &&
                Objects.equals(imports, that.imports) &&
                Objects.equals(functions, that.functions) &&
                Objects.equals(classes, that.classes) &&
                Objects.equals(lines, that.lines) &&
                degradationReason == that.degradationReason;
    }

    @Override public int hashCode() {
        return Objects.hash(path, language, imports, functions, classes, lines, degraded, degradationReason);
    }

    @Override public String toString() {
        return "ParsedFile{" + path + ", " + language +
                ", classes=" + classes.size() +
                ", functions=" + functions.size() +
                ", imports=" + imports.size() +
                (degraded ? ", degraded=" + degradationReason : "") + "}";
    }
}
