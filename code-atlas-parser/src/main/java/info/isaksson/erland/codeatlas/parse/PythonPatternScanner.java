package info.isaksson.erland.codeatlas.parse;

import info.isaksson.erland.codeatlas.ir.Language;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Python fallback: module-level {@code def}/{@code class} headers, direct methods and import
 * statements, found on logical lines at the right indentation. Blocks end where indentation
 * returns to the header's level.
 */
final class PythonPatternScanner implements PatternScanner {

    private static final Pattern DEF = Pattern.compile("^\\s*(?:async\\s+)?def\\s+([A-Za-z_]\\w*)\\s*\\(");
    private static final Pattern CLASS = Pattern.compile("^\\s*class\\s+([A-Za-z_]\\w*)\\s*(\\()?");

    @Override
    public Extraction scan(List<String> lines) {
        PythonSource src = PythonSource.of(lines);
        List<PythonSource.LogicalLine> logical = src.logicalLines();
        Extraction out = new Extraction();
        if (logical.isEmpty()) return out;

        int top = logical.get(0).indent;
        for (int i = 0; i < logical.size(); i++) {
            PythonSource.LogicalLine line = logical.get(i);
            if (line.indent == top) {
                if (!function(src, i, null, out)) {
                    classDef(src, i, out);
                }
            }
            imports(line, out);
        }
        return out;
    }

    private static boolean function(PythonSource src, int index, String owner, Extraction out) {
        PythonSource.LogicalLine line = src.logicalLines().get(index);
        Matcher m = DEF.matcher(line.code);
        if (!m.find()) return false;
        int open = m.end() - 1;
        int close = PythonSource.matchClose(line.code, open);
        if (close < 0) return false;
        List<String> params = ParameterLists.split(line.raw.substring(open + 1, close - 1), Language.PYTHON);
        int end = src.logicalLines().get(src.blockEndIndex(index)).endLine;
        out.addFunction(new Extraction.FunctionDraft(
                m.group(1), params, docstring(src, index, close), lineOf(line, m.start(1)), end, owner));
        return true;
    }

    private static void classDef(PythonSource src, int index, Extraction out) {
        List<PythonSource.LogicalLine> logical = src.logicalLines();
        PythonSource.LogicalLine line = logical.get(index);
        Matcher m = CLASS.matcher(line.code);
        if (!m.find()) return;
        String name = m.group(1);
        List<String> bases = List.of();
        int headerEnd = m.end();
        if (m.group(2) != null) {
            int open = m.start(2);
            int close = PythonSource.matchClose(line.code, open);
            if (close < 0) return;
            bases = BaseNames.python(line.raw.substring(open + 1, close - 1));
            headerEnd = close;
        }
        int last = src.blockEndIndex(index);
        out.addClass(new Extraction.ClassDraft(
                name, bases, docstring(src, index, headerEnd), lineOf(line, m.start(1)), logical.get(last).endLine));

        if (last == index) return;
        int bodyIndent = logical.get(index + 1).indent;
        for (int k = index + 1; k <= last; k++) {
            if (logical.get(k).indent == bodyIndent) function(src, k, name, out);
        }
    }

    /**
     * Docstring of the suite following a header: the first body statement when the suite is
     * indented, otherwise the inline suite after the header colon.
     */
    private static String docstring(PythonSource src, int index, int afterHeader) {
        List<PythonSource.LogicalLine> logical = src.logicalLines();
        PythonSource.LogicalLine header = logical.get(index);
        int colon = PythonSource.indexAtDepthZero(header.code, ':', afterHeader);
        if (colon < 0) return null;
        String inlineCode = header.code.substring(colon + 1);
        if (!inlineCode.isBlank()) {
            List<int[]> parts = PythonSource.statementRanges(inlineCode);
            int[] first = parts.get(0);
            if (!PythonSource.isStringOnly(inlineCode.substring(first[0], first[1]))) return null;
            return DocComments.pythonDocstring(header.raw.substring(colon + 1 + first[0], colon + 1 + first[1]));
        }
        if (index + 1 >= logical.size()) return null;
        PythonSource.LogicalLine body = logical.get(index + 1);
        if (body.indent <= header.indent) return null;
        int[] first = PythonSource.statementRanges(body.code).get(0);
        if (!PythonSource.isStringOnly(body.code.substring(first[0], first[1]))) return null;
        return DocComments.pythonDocstring(body.raw.substring(first[0], first[1]));
    }

    private static void imports(PythonSource.LogicalLine line, Extraction out) {
        for (int[] r : PythonSource.statementRanges(line.code)) {
            String code = line.code.substring(r[0], r[1]);
            if (ImportStatements.isPythonImport(code)) {
                out.addImports(ImportStatements.python(line.raw.substring(r[0], r[1])));
            }
        }
    }

    /** Physical line number of an offset inside a logical line. */
    private static int lineOf(PythonSource.LogicalLine line, int offset) {
        int n = line.startLine;
        for (int i = 0; i < offset && i < line.code.length(); i++) {
            if (line.code.charAt(i) == '\n') n++;
        }
        return n;
    }
}
