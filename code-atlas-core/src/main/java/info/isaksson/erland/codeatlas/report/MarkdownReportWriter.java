package info.isaksson.erland.codeatlas.report;

import info.isaksson.erland.codeatlas.core.CodeAtlasResult;
import info.isaksson.erland.codeatlas.ir.AnalysisWarning;
import info.isaksson.erland.codeatlas.ir.ClassDef;
import info.isaksson.erland.codeatlas.ir.FileAnalysis;
import info.isaksson.erland.codeatlas.ir.FunctionDef;
import info.isaksson.erland.codeatlas.ir.ImportRef;
import info.isaksson.erland.codeatlas.ir.Language;
import info.isaksson.erland.codeatlas.ir.LineAnnotation;
import info.isaksson.erland.codeatlas.ir.ParsedFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Human-readable markdown document for one analysis run.
 *
 * NOTE: section order is fixed and every list is emitted in path or declaration order, so two runs
 * over the same input produce the same bytes.
 */
public final class MarkdownReportWriter {

    private MarkdownReportWriter() {}

    public static void write(CodeAtlasResult result, Path reportPath) throws IOException {
        Path parent = reportPath.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(reportPath, render(result), StandardCharsets.UTF_8);
    }

    public static String render(CodeAtlasResult result) {
        StringBuilder report = new StringBuilder();
        report.append("# ").append(result.projectName).append(" code atlas\n\n");

        report.append("## Overview\n\n");
        report.append("- Files analysed: **").append(result.files.size()).append("**\n");
        Map<Language, Integer> perLanguage = new EnumMap<>(Language.class);
        for (FileAnalysis f : result.files) perLanguage.merge(f.file.language, 1, Integer::sum);
        for (Map.Entry<Language, Integer> e : perLanguage.entrySet()) {
            report.append("  - ").append(e.getKey().id).append(": **").append(e.getValue()).append("**\n");
        }
        report.append("- Degraded (fallback) parses: **").append(result.degradedFileCount()).append("**\n");
        report.append("- Classes: **").append(result.stats.classes).append("**\n");
        report.append("- Functions and methods: **").append(result.stats.functions).append("**\n");
        report.append("- Imported modules: **").append(result.stats.modules).append("**\n");
        report.append("- Warnings: **").append(result.warnings.size()).append("**\n\n");

        report.append("## Architecture\n\n");
        fenced(report, "mermaid", result.architectureDiagram);

        report.append("\n## Graph statistics\n\n");
        report.append("| Element | Count |\n");
        report.append("|---|---:|\n");
        report.append("| Files | ").append(result.stats.files).append(" |\n");
        report.append("| Classes | ").append(result.stats.classes).append(" |\n");
        report.append("| Functions | ").append(result.stats.functions).append(" |\n");
        report.append("| Modules | ").append(result.stats.modules).append(" |\n");
        report.append("| Defines edges | ").append(result.stats.definesEdges).append(" |\n");
        report.append("| Imports edges | ").append(result.stats.importsEdges).append(" |\n");

        report.append("\n## Folder structure\n\n");
        Folder root = new Folder();
        for (FileAnalysis f : result.files) root.add(f.file.path.split("/"), 0);
        report.append("```\n");
        root.print(report, "");
        report.append("```\n");

        report.append("\n## Workflows\n\n");
        boolean anyWorkflow = false;
        for (Map.Entry<String, String> e : result.workflows.entrySet()) {
            if (e.getValue().isEmpty()) continue;
            anyWorkflow = true;
            report.append("### `").append(e.getKey()).append("`\n\n");
            fenced(report, "mermaid", e.getValue());
            report.append("\n");
        }
        if (!anyWorkflow) report.append("_(none)_\n\n");

        report.append("## Modules\n\n");
        for (FileAnalysis f : result.files) {
            writeModule(report, f);
        }

        report.append("## Warnings\n\n");
        if (result.warnings.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            for (AnalysisWarning w : result.warnings) {
                report.append("- `").append(w.code).append("` ").append(w.message);
                if (!w.context.isEmpty()) report.append(" (").append(w.contextString()).append(")");
                report.append("\n");
            }
        }
        return report.toString();
    }

    private static void writeModule(StringBuilder report, FileAnalysis analysis) {
        ParsedFile pf = analysis.file;
        report.append("### `").append(pf.path).append("`\n\n");
        report.append("- Language: ").append(pf.language.id).append("\n");
        report.append("- Parse mode: ")
                .append(pf.degraded ? "fallback (" + pf.degradationReason + ")" : "grammar")
                .append("\n");
        report.append("- Lines: **").append(pf.lineCount()).append("**\n");
        report.append("- Imports: ");
        if (pf.imports.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            report.append("\n");
            for (ImportRef i : pf.imports) {
                report.append("  - `").append(i.moduleOrPath).append("`");
                if (!i.importedSymbols.isEmpty()) {
                    report.append(" (").append(String.join(", ", i.importedSymbols)).append(")");
                }
                report.append("\n");
            }
        }

        report.append("\n#### Functions\n\n");
        if (pf.functions.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            for (FunctionDef f : pf.functions) {
                report.append("- `").append(f.qualifiedName()).append("(")
                        .append(String.join(", ", f.parameters)).append(")` lines ")
                        .append(f.startLine).append("-").append(f.endLine).append("\n");
                if (f.docComment != null && !f.docComment.isBlank()) {
                    report.append("  - ").append(oneLine(f.docComment)).append("\n");
                }
            }
        }

        report.append("\n#### Classes\n\n");
        if (pf.classes.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            for (ClassDef c : pf.classes) {
                report.append("- `").append(c.name).append("`");
                if (!c.baseNames.isEmpty()) report.append(" extends ").append(codeList(c.baseNames));
                report.append(" lines ").append(c.startLine).append("-").append(c.endLine).append("\n");
                report.append("  - Methods: ").append(c.methodNames.isEmpty() ? "_(none)_" : codeList(c.methodNames)).append("\n");
                if (c.docComment != null && !c.docComment.isBlank()) {
                    report.append("  - ").append(oneLine(c.docComment)).append("\n");
                }
            }
        }

        report.append("\n#### Line by line\n\n");
        if (analysis.annotations.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            report.append("| Line | Kind | Explanation |\n");
            report.append("|---:|---|---|\n");
            for (LineAnnotation a : analysis.annotations) {
                report.append("| ").append(a.lineNumber).append(" | ")
                        .append(a.category.label).append(" | ")
                        .append(tableCell(a.explanation)).append(" |\n");
            }
        }

        report.append("\n#### Dry runs\n\n");
        if (pf.functions.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            for (FunctionDef f : pf.functions) {
                report.append("`").append(f.qualifiedName()).append("`");
                analysis.traceFor(f.qualifiedName()).ifPresent(t -> {
                    if (t.inputInferred) report.append(" (input inferred from defaults)");
                });
                report.append("\n\n");
                fenced(report, "text", analysis.dryRunText(f.qualifiedName()));
                report.append("\n");
            }
        }
        report.append("\n");
    }

    private static void fenced(StringBuilder report, String info, String body) {
        report.append("```").append(info).append("\n").append(body);
        if (!body.endsWith("\n")) report.append("\n");
        report.append("```\n");
    }

    private static String codeList(List<String> names) {
        return "`" + String.join("`, `", names) + "`";
    }

    private static String oneLine(String text) {
        return text.replaceAll("\\s*\\R\\s*", " ").trim();
    }

    static String tableCell(String text) {
        return oneLine(text).replace("|", "\\|");
    }

    /** Path tree for the folder structure section; children kept sorted. */
    private static final class Folder {
        private final Map<String, Folder> folders = new TreeMap<>();
        private final Set<String> files = new TreeSet<>();

        void add(String[] parts, int index) {
            if (index == parts.length - 1) {
                files.add(parts[index]);
            } else {
                folders.computeIfAbsent(parts[index], k -> new Folder()).add(parts, index + 1);
            }
        }

        void print(StringBuilder out, String indent) {
            for (Map.Entry<String, Folder> e : folders.entrySet()) {
                out.append(indent).append(e.getKey()).append("/\n");
                e.getValue().print(out, indent + "  ");
            }
            for (String f : files) {
                out.append(indent).append(f).append("\n");
            }
        }
    }
}
