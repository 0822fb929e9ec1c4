package org.pragmatica.monostyle.shared;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/// Source text of a single file together with the path it was read from.
///
/// The core pipeline never touches the file system; the path is only used for reporting.
public record SourceFile(Path path, String content) {
    /// Factory method for in-memory sources.
    public static SourceFile sourceFile(Path path, String content) {
        return new SourceFile(path, content);
    }

    /// Decode raw file bytes as UTF-8.
    ///
    /// Malformed UTF-8 and binary content are rejected here, before tokenization.
    public static SourceFile decode(Path path, byte[] bytes) throws InvalidSourceException {
        for (byte b : bytes) {
            if (b == 0) {
                throw new InvalidSourceException(new InputError.BinaryContent(path));
            }
        }
        var decoder = StandardCharsets.UTF_8.newDecoder()
                                            .onMalformedInput(CodingErrorAction.REPORT)
                                            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            var text = decoder.decode(ByteBuffer.wrap(bytes))
                              .toString();
            return new SourceFile(path, text);
        } catch (CharacterCodingException e) {
            throw new InvalidSourceException(new InputError.MalformedEncoding(path, e.getMessage()));
        }
    }

    public String fileName() {
        return path.toString();
    }

    public SourceFile withContent(String newContent) {
        return new SourceFile(path, newContent);
    }
}
