package info.isaksson.erland.codeatlas.io;

import info.isaksson.erland.codeatlas.ir.Language;
import info.isaksson.erland.codeatlas.ir.SourceUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class SourceScannerTest {

    @TempDir
    Path root;

    @Test
    void findsSupportedFilesInStableOrder() throws IOException {
        write("b/z.ts", "export const z = 1;\n");
        write("a.py", "x = 1\n");
        write("b/a.js", "let a;\n");
        write("README.md", "# readme\n");
        write("node_modules/dep/index.js", "module.exports = {};\n");
        write("pkg/__pycache__/a.py", "x = 2\n");
        write(".git/hooks/pre-commit.py", "pass\n");

        List<Path> files = SourceScanner.scan(root, List.of());
        assertEquals(List.of("a.py", "b/a.js", "b/z.ts"), relative(files));
    }

    @Test
    void appliesExcludeGlobs() throws IOException {
        write("src/app.py", "pass\n");
        write("tests/test_app.py", "pass\n");
        write("src/gen/schema.ts", "export {};\n");
        write("src/types.d.ts", "declare const x: number;\n");

        List<Path> files = SourceScanner.scan(root, List.of("tests", "src/gen", "**/*.d.ts"));
        assertEquals(List.of("src/app.py"), relative(files));
    }

    @Test
    void readerKeepsRelativePathsAndReplacesBadBytes() throws IOException {
        write("m.py", "name = 'ok'\n");
        Path bad = root.resolve("bad.js");
        Files.write(bad, new byte[]{'l', 'e', 't', ' ', 'x', ' ', '=', ' ', '"', (byte) 0xC3, (byte) 0x28, '"', ';', '\n'});

        List<SourceUnit> units = SourceReader.readAll(root, SourceScanner.scan(root, null));
        assertEquals(List.of("bad.js", "m.py"), units.stream().map(u -> u.path).collect(Collectors.toList()));
        assertEquals(Language.JAVASCRIPT, units.get(0).language);
        assertTrue(units.get(0).text.contains("\uFFFD"));
        assertEquals("name = 'ok'\n", units.get(1).text);
    }

    private void write(String rel, String content) throws IOException {
        Path p = root.resolve(rel);
        Files.createDirectories(p.getParent());
        Files.writeString(p, content, StandardCharsets.UTF_8);
    }

    private List<String> relative(List<Path> files) {
        return files.stream().map(p -> SourceScanner.relativePath(root, p)).collect(Collectors.toList());
    }
}
