package info.isaksson.erland.codeatlas.parse;

import info.isaksson.erland.codeatlas.ir.ClassDef;
import info.isaksson.erland.codeatlas.ir.DegradationReason;
import info.isaksson.erland.codeatlas.ir.FunctionDef;
import info.isaksson.erland.codeatlas.ir.Language;
import info.isaksson.erland.codeatlas.ir.ParsedFile;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the immutable {@link ParsedFile} from an {@link Extraction}: clamps spans into the file,
 * orders declarations by start line, drops methods whose owner class is missing and derives each
 * class's method list.
 */
final class ParsedFileAssembler {

    private ParsedFileAssembler() {}

    static ParsedFile assemble(String path, Language language, List<String> lines, Extraction ex, DegradationReason reason) {
        int n = lines.size();
        if (n == 0) {
            return new ParsedFile(path, language, ex.imports(), null, null, lines, reason);
        }

        List<Extraction.ClassDraft> classDrafts = new ArrayList<>(ex.classes());
        classDrafts.sort(Comparator.comparingInt(c -> c.startLine));
        List<Extraction.FunctionDraft> functionDrafts = new ArrayList<>(ex.functions());
        functionDrafts.sort(Comparator.comparingInt(f -> f.startLine));

        Set<String> classNames = new HashSet<>();
        Set<String> repeated = new HashSet<>();
        for (Extraction.ClassDraft c : classDrafts) {
            if (!classNames.add(c.name)) repeated.add(c.name);
        }

        List<FunctionDef> functions = new ArrayList<>();
        for (Extraction.FunctionDraft f : functionDrafts) {
            String owner = f.ownerClass != null && classNames.contains(f.ownerClass) ? f.ownerClass : null;
            if (f.ownerClass != null && owner == null) continue;
            int start = SourceLines.clamp(f.startLine, n);
            int end = Math.max(start, SourceLines.clamp(f.endLine, n));
            functions.add(new FunctionDef(f.name, f.parameters, f.docComment, start, end, owner));
        }

        List<ClassDef> classes = new ArrayList<>();
        for (Extraction.ClassDraft c : classDrafts) {
            List<String> methods = new ArrayList<>();
            for (FunctionDef f : functions) {
                if (!c.name.equals(f.ownerClass)) continue;
                // a redefined class name keeps only the methods inside its own span
                if (repeated.contains(c.name) && (f.startLine < c.startLine || f.startLine > c.endLine)) continue;
                methods.add(f.name);
            }
            int start = SourceLines.clamp(c.startLine, n);
            int end = Math.max(start, SourceLines.clamp(c.endLine, n));
            classes.add(new ClassDef(c.name, c.baseNames, methods, c.docComment, start, end));
        }
        return new ParsedFile(path, language, ex.imports(), functions, classes, lines, reason);
    }
}
