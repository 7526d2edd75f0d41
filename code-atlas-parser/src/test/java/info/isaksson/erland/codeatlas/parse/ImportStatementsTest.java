package info.isaksson.erland.codeatlas.parse;

import info.isaksson.erland.codeatlas.ir.ImportRef;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ImportStatementsTest {

    @Test
    void pythonFromImportCollectsSymbolsOnce() {
        List<ImportRef> refs = ImportStatements.python("from os.path import (join,\n    exists as ex,  # keep\n)");
        assertEquals(List.of(new ImportRef("os.path", List.of("exists", "join"))), refs);
    }

    @Test
    void pythonPlainImportYieldsOneRefPerModule() {
        assertEquals(List.of(new ImportRef("os"), new ImportRef("sys")), ImportStatements.python("import os, sys as system"));
        assertEquals(List.of(new ImportRef(".", List.of("models"))), ImportStatements.python("from . import models"));
    }

    @Test
    void scriptClauses() {
        assertEquals(List.of(new ImportRef("react", List.of("FC", "React", "useState"))),
                ImportStatements.script("import React, { useState, type FC } from 'react';"));
        assertEquals(List.of(new ImportRef("./styles.css")), ImportStatements.script("import './styles.css';"));
        assertEquals(List.of(new ImportRef("./util", List.of("*"))), ImportStatements.script("export * from \"./util\";"));
        assertEquals(List.of(new ImportRef("lodash", List.of("debounce"))),
                ImportStatements.script("import {\n  debounce as db, // later\n} from 'lodash'"));
    }

    @Test
    void runtimeLoadsAreNotImportStatements() {
        assertFalse(ImportStatements.isScriptImport("const http = require('node:http');"));
        assertFalse(ImportStatements.isScriptImport("import('./lazy').then(m => m.run());"));
        assertFalse(ImportStatements.isScriptImport("export const x = 1;"));
        assertTrue(ImportStatements.isScriptImport("export type { Foo } from './foo';"));
        assertFalse(ImportStatements.isPythonImport("importlib.import_module('x')"));
        assertTrue(ImportStatements.isPythonImport("from x import y"));
    }
}
