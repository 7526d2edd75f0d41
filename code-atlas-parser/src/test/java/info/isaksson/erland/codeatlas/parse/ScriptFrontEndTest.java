package info.isaksson.erland.codeatlas.parse;

import info.isaksson.erland.codeatlas.ir.ClassDef;
import info.isaksson.erland.codeatlas.ir.DegradationReason;
import info.isaksson.erland.codeatlas.ir.FunctionDef;
import info.isaksson.erland.codeatlas.ir.ImportRef;
import info.isaksson.erland.codeatlas.ir.Language;
import info.isaksson.erland.codeatlas.ir.ParsedFile;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ScriptFrontEndTest {

    @Test
    void runtimeRequireIsNotAnImport() {
        for (SourceParser parser : parsers(Language.JAVASCRIPT)) {
            ParsedFile pf = parser.parse("index.js", Fixtures.read("index.js"));
            assertTrue(pf.imports.isEmpty(), "require(...) is a runtime load, not a declarative import: " + parser);
            assertTrue(pf.functions.isEmpty(), parser.toString());
            assertTrue(pf.classes.isEmpty(), parser.toString());
            assertEquals(17, pf.lineCount());
        }
    }

    @Test
    void typescriptClassesFunctionsAndImports() {
        for (SourceParser parser : parsers(Language.TYPESCRIPT)) {
            ParsedFile pf = parser.parse("src/shapes.ts", Fixtures.read("shapes.ts"));
            String who = parser.toString();

            assertEquals(List.of(
                    new ImportRef("fs", List.of("readFileSync")),
                    new ImportRef("path", List.of("*")),
                    new ImportRef("./options", List.of("Options"))), pf.imports, who);

            ClassDef shape = pf.classNamed("Shape").orElseThrow();
            assertEquals(List.of("constructor", "describe"), shape.methodNames, who);
            assertEquals("Base shape.", shape.docComment, who);
            assertEquals(8, shape.startLine, who);
            assertEquals(16, shape.endLine, who);

            ClassDef circle = pf.classNamed("Circle").orElseThrow();
            assertTrue(circle.baseNames.contains("Shape"), who);
            assertEquals(List.of("constructor", "area"), circle.methodNames, who);

            FunctionDef load = pf.functionNamed("loadShapes").orElseThrow();
            assertEquals(List.of("file: string", "opts?: Options"), load.parameters, who);
            assertEquals(28, load.startLine, who);
            assertEquals(31, load.endLine, who);

            FunctionDef scale = pf.functionNamed("scale").orElseThrow();
            assertEquals(List.of("factor: number"), scale.parameters, who);
            assertEquals(33, scale.startLine, who);
            assertEquals(33, scale.endLine, who);

            assertEquals(2, pf.topLevelFunctions().size(), who);
        }
    }

    @Test
    void methodSpansSitInsideTheirClass() {
        for (SourceParser parser : parsers(Language.TYPESCRIPT)) {
            ParsedFile pf = parser.parse("shapes.ts", Fixtures.read("shapes.ts"));
            for (FunctionDef f : pf.functions) {
                if (!f.isMethod()) continue;
                ClassDef owner = pf.classNamed(f.ownerClass).orElseThrow();
                assertTrue(owner.startLine <= f.startLine && f.endLine <= owner.endLine,
                        f.qualifiedName() + " outside " + owner.name + " (" + parser + ")");
            }
        }
    }

    @Test
    void tsxIsAlwaysAnUnsupportedDialect() {
        String src = "export function App(props) {\n  return props.children;\n}\n";
        ParsedFile pf = LanguageFrontEnd.typescript().parse("ui/App.tsx", src);
        assertTrue(pf.degraded);
        assertEquals(DegradationReason.UNSUPPORTED_DIALECT, pf.degradationReason);
        assertEquals(List.of("props"), pf.functionNamed("App").orElseThrow().parameters);
    }

    @Test
    void brokenJavascriptDegrades() {
        String src = "function ok(a) {\n  return a;\n}\nfunction (\n";
        ParsedFile pf = LanguageFrontEnd.javascript().parse("broken.js", src);
        assertTrue(pf.degraded);
        assertEquals(4, pf.lineCount());
        if (TreeSitterGrammars.isAvailable(Language.JAVASCRIPT)) {
            assertEquals(DegradationReason.MALFORMED_SPAN, pf.degradationReason);
        }
    }

    @Test
    void exportFormsAndSideEffectImports() {
        String src = "import './polyfills';\n"
                + "import React, { useState } from 'react';\n"
                + "export { helper } from './helper';\n"
                + "\n"
                + "/** Adds. */\n"
                + "export default function add(a, b = 1) {\n"
                + "  return a + b;\n"
                + "}\n";
        for (SourceParser parser : parsers(Language.JAVASCRIPT)) {
            ParsedFile pf = parser.parse("mod.js", src);
            assertEquals(List.of(
                    new ImportRef("./polyfills"),
                    new ImportRef("react", List.of("React", "useState")),
                    new ImportRef("./helper", List.of("helper"))), pf.imports, parser.toString());
            FunctionDef add = pf.functionNamed("add").orElseThrow();
            assertEquals(List.of("a", "b = 1"), add.parameters);
            assertEquals("Adds.", add.docComment);
        }
    }

    static List<SourceParser> parsers(Language language) {
        List<SourceParser> out = new ArrayList<>();
        if (TreeSitterGrammars.isAvailable(language)) {
            out.add(language == Language.TYPESCRIPT ? LanguageFrontEnd.typescript() : LanguageFrontEnd.javascript());
        }
        out.add(LanguageFrontEnd.patternsOnly(language));
        return out;
    }
}
