package info.isaksson.erland.codeatlas.io;

import info.isaksson.erland.codeatlas.ir.Language;
import info.isaksson.erland.codeatlas.ir.SourceUnit;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads scanned files into {@link SourceUnit}s. Text is decoded as UTF-8 with malformed input
 * replaced, so a stray byte never stops a run.
 */
public final class SourceReader {

    private SourceReader() {}

    public static List<SourceUnit> readAll(Path root, List<Path> files) throws IOException {
        List<SourceUnit> out = new ArrayList<>(files.size());
        for (Path f : files) {
            String rel = SourceScanner.relativePath(root, f);
            Language lang = Language.fromPath(rel)
                    .orElseThrow(() -> new IOException("Unsupported file type: " + rel));
            out.add(new SourceUnit(rel, lang, read(f)));
        }
        return out;
    }

    public static String read(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            throw new IOException("Cannot decode " + file + ": " + e.getMessage(), e);
        }
    }
}
